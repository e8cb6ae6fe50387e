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

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class QuantileAccumulatorTest {

    @Test
    void empty_noPercentiles() {
        assertTrue(new QuantileAccumulator().percentiles().isEmpty());
    }

    @Test
    void constructor_invalidK_throws() {
        assertThrows(IllegalArgumentException.class, () -> new QuantileAccumulator(7));
        assertThrows(IllegalArgumentException.class, () -> new QuantileAccumulator(65536));
    }

    @Test
    void percentiles_hundredAscendingValuesWithinRange() {
        QuantileAccumulator acc = new QuantileAccumulator();
        for (int i = 1; i <= 10_000; i++) {
            acc.add(i);
        }
        List<Double> percentiles = acc.percentiles();

        assertEquals(QuantileAccumulator.PERCENTILE_COUNT, percentiles.size());
        assertThat(percentiles).isSorted();
        assertEquals(10_000.0, percentiles.get(99), 1e-9);
        assertEquals(5_000.0, percentiles.get(49), 10_000 * 0.03);
        assertThat(percentiles).allSatisfy(p -> assertThat(p).isBetween(1.0, 10_000.0));
    }

    @Test
    void merge_combinesCounts() {
        QuantileAccumulator a = new QuantileAccumulator();
        QuantileAccumulator b = new QuantileAccumulator(100);
        a.add(1);
        a.add(2);
        b.add(3);

        QuantileAccumulator merged = a.merge(b);
        assertEquals(3, merged.getCount());
        assertEquals(100, merged.getK());
        assertEquals(2, a.getCount());
        assertEquals(3.0, merged.percentiles().get(99), 1e-12);
    }
}
