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

import org.apache.datasketches.hll.HllSketch;
import org.apache.datasketches.hll.TgtHllType;
import org.apache.datasketches.hll.Union;

/// Approximate distinct-value counter backed by a DataSketches HLL sketch.
///
/// ## Precision
///
/// The sketch size is chosen from a target relative standard error (RSE).
/// For HLL the RSE is about `1.04 / sqrt(2^lgK)`, so:
///
/// | RSE | lgK | registers |
/// |-----|-----|-----------|
/// | 0.05 | 9 | 512 |
/// | 0.02 | 12 | 4096 |
/// | 0.01 | 14 | 16384 |
///
/// Memory is bounded by the register count and does not grow with the number
/// of values. At low cardinalities the sketch runs in its exact list/set mode,
/// so small columns report exact counts.
///
/// ## Merging
///
/// [#merge] unions two sketches into a new estimator without touching either
/// input. Union is commutative, associative and idempotent, so any grouping of
/// partial estimators over disjoint inputs estimates the cardinality of their
/// union.
///
/// This class is **not thread-safe**.
public final class DistinctCountEstimator {

    /// Default target relative standard error.
    public static final double DEFAULT_PRECISION = 0.02;

    static final int MIN_LG_K = 4;
    static final int MAX_LG_K = 21;

    // DataSketches ignores empty strings, so "" is fed as this reserved long.
    private static final long EMPTY_VALUE_KEY = 0x5eed_e3a7_7e00_0001L;

    private static final TgtHllType TYPE = TgtHllType.HLL_8;

    private final HllSketch sketch;

    /// Creates an estimator for the default precision.
    public DistinctCountEstimator() {
        this(lgKForPrecision(DEFAULT_PRECISION));
    }

    /// Creates an estimator with an explicit sketch size.
    ///
    /// @param lgK log2 of the register count, in `[4, 21]`
    public DistinctCountEstimator(int lgK) {
        if (lgK < MIN_LG_K || lgK > MAX_LG_K) {
            throw new IllegalArgumentException(
                "lgK must be in [" + MIN_LG_K + ", " + MAX_LG_K + "], got: " + lgK);
        }
        this.sketch = new HllSketch(lgK, TYPE);
    }

    private DistinctCountEstimator(HllSketch sketch) {
        this.sketch = sketch;
    }

    /// Creates an estimator sized for a target relative standard error.
    ///
    /// @param precision target RSE, in `(0, 0.5]`
    /// @return a new, empty estimator
    public static DistinctCountEstimator forPrecision(double precision) {
        return new DistinctCountEstimator(lgKForPrecision(precision));
    }

    /// Computes the sketch size that meets a target relative standard error.
    ///
    /// @param precision target RSE, in `(0, 0.5]`
    /// @return lgK clamped to `[4, 21]`
    public static int lgKForPrecision(double precision) {
        if (!(precision > 0.0) || precision > 0.5) {
            throw new IllegalArgumentException("precision must be in (0, 0.5], got: " + precision);
        }
        double registers = Math.pow(1.04 / precision, 2);
        int lgK = (int) Math.ceil(Math.log(registers) / Math.log(2));
        return Math.max(MIN_LG_K, Math.min(MAX_LG_K, lgK));
    }

    /// Adds a value. Null is ignored.
    ///
    /// @param value the raw value
    public void update(String value) {
        if (value == null) {
            return;
        }
        if (value.isEmpty()) {
            sketch.update(EMPTY_VALUE_KEY);
        } else {
            sketch.update(value);
        }
    }

    /// Returns a new estimator representing the union of this and another.
    ///
    /// Estimators of different sizes may be merged; the result uses the
    /// smaller of the two sizes.
    ///
    /// @param other the estimator to combine with
    /// @return the union
    public DistinctCountEstimator merge(DistinctCountEstimator other) {
        int lgK = Math.min(sketch.getLgConfigK(), other.sketch.getLgConfigK());
        Union union = new Union(lgK);
        union.update(sketch);
        union.update(other.sketch);
        return new DistinctCountEstimator(union.getResult(TYPE));
    }

    /// @return the rounded cardinality estimate, never negative
    public long estimate() {
        if (sketch.isEmpty()) {
            return 0;
        }
        return Math.max(0L, Math.round(sketch.getEstimate()));
    }

    /// @return log2 of the register count
    public int lgK() {
        return sketch.getLgConfigK();
    }

    /// Returns the one-standard-deviation relative error bound of the estimate.
    ///
    /// @return the relative error, for example `0.0163` at lgK 12
    public double relativeError() {
        return HllSketch.getRelErr(true, true, sketch.getLgConfigK(), 1);
    }

    @Override
    public String toString() {
        return "DistinctCountEstimator[lgK=" + lgK() + ", estimate=" + estimate() + "]";
    }
}
