package io.nosqlbench.colprofile.accumulate;


/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class DistinctCountEstimatorTest {

    @Test
    void lgKForPrecision_defaultIsTwelve() {
        assertEquals(12, DistinctCountEstimator.lgKForPrecision(DistinctCountEstimator.DEFAULT_PRECISION));
        assertEquals(12, new DistinctCountEstimator().lgK());
    }

    @Test
    void lgKForPrecision_clamped() {
        assertEquals(DistinctCountEstimator.MIN_LG_K, DistinctCountEstimator.lgKForPrecision(0.5));
        assertEquals(DistinctCountEstimator.MAX_LG_K, DistinctCountEstimator.lgKForPrecision(0.0001));
    }

    @Test
    void lgKForPrecision_outOfRange_throws() {
        assertThrows(IllegalArgumentException.class, () -> DistinctCountEstimator.lgKForPrecision(0.0));
        assertThrows(IllegalArgumentException.class, () -> DistinctCountEstimator.lgKForPrecision(0.6));
        assertThrows(IllegalArgumentException.class, () -> new DistinctCountEstimator(3));
    }

    @Test
    void smallCardinality_isExact() {
        DistinctCountEstimator estimator = new DistinctCountEstimator();
        for (String v : new String[]{"IN_TRANSIT", "DELAYED", "DELAYED", "UNKNOWN", null}) {
            estimator.update(v);
        }
        assertEquals(3, estimator.estimate());
    }

    @Test
    void empty_estimatesZero() {
        DistinctCountEstimator estimator = new DistinctCountEstimator();
        estimator.update(null);
        assertEquals(0, estimator.estimate());
    }

    @Test
    void emptyString_countsAsValue() {
        DistinctCountEstimator estimator = new DistinctCountEstimator();
        estimator.update("");
        estimator.update("");
        estimator.update("a");
        assertEquals(2, estimator.estimate());
    }

    @Test
    void merge_overlappingPartitions() {
        DistinctCountEstimator a = new DistinctCountEstimator();
        DistinctCountEstimator b = new DistinctCountEstimator();
        a.update("x");
        a.update("y");
        b.update("y");
        b.update("z");

        DistinctCountEstimator merged = a.merge(b);
        assertEquals(3, merged.estimate());
        assertEquals(2, a.estimate());
        assertEquals(2, b.estimate());
    }

    @Test
    @Tag("accuracy")
    void largeCardinality_withinErrorBoundAcrossPartitions() {
        int distinct = 200_000;
        int partitions = 7;
        DistinctCountEstimator[] parts = new DistinctCountEstimator[partitions];
        for (int p = 0; p < partitions; p++) {
            parts[p] = new DistinctCountEstimator();
        }
        for (int i = 0; i < distinct; i++) {
            // Every value lands in two partitions, so partitions overlap.
            parts[i % partitions].update("value-" + i);
            parts[(i + 3) % partitions].update("value-" + i);
        }
        DistinctCountEstimator merged = parts[0];
        for (int p = 1; p < partitions; p++) {
            merged = merged.merge(parts[p]);
        }
        double error = Math.abs(merged.estimate() - distinct) / (double) distinct;
        assertTrue(error < 3 * merged.relativeError(),
            "relative error " + error + " exceeds 3 sigma of " + merged.relativeError());
    }

    @Test
    void merge_differentSizes_usesSmaller() {
        DistinctCountEstimator small = new DistinctCountEstimator(8);
        DistinctCountEstimator large = new DistinctCountEstimator(12);
        small.update("a");
        large.update("b");
        DistinctCountEstimator merged = small.merge(large);
        assertEquals(8, merged.lgK());
        assertEquals(2, merged.estimate());
    }
}
