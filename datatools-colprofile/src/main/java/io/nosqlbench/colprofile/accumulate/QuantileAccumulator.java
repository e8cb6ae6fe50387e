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

import org.apache.datasketches.kll.KllDoublesSketch;

import java.util.ArrayList;
import java.util.List;

/// Approximate quantiles of a numeric column, backed by a KLL sketch.
///
/// Memory grows only logarithmically with the number of values. At the
/// default `k = 200` the normalized rank error is about 1.65%.
///
/// This class is **not thread-safe**. [#merge] builds a new sketch and leaves
/// both inputs unchanged.
public final class QuantileAccumulator {

    /// Default KLL accuracy parameter.
    public static final int DEFAULT_K = 200;

    static final int PERCENTILE_COUNT = 100;

    private final int k;
    private final KllDoublesSketch sketch;

    /// Creates an accumulator with the default sketch size.
    public QuantileAccumulator() {
        this(DEFAULT_K);
    }

    /// Creates an accumulator with an explicit sketch size.
    ///
    /// @param k KLL accuracy parameter, in `[8, 65535]`
    public QuantileAccumulator(int k) {
        if (k < 8 || k > 65535) {
            throw new IllegalArgumentException("k must be in [8, 65535], got: " + k);
        }
        this.k = k;
        this.sketch = KllDoublesSketch.newHeapInstance(k);
    }

    /// Adds a value. NaN is ignored by the sketch.
    ///
    /// @param value the value to add
    public void add(double value) {
        sketch.update(value);
    }

    /// Returns a new accumulator holding the values of both inputs.
    ///
    /// @param other the accumulator to combine with
    /// @return the combined accumulator
    public QuantileAccumulator merge(QuantileAccumulator other) {
        QuantileAccumulator merged = new QuantileAccumulator(Math.min(k, other.k));
        merged.sketch.merge(this.sketch);
        merged.sketch.merge(other.sketch);
        return merged;
    }

    /// Returns the 1st through 100th percentiles.
    ///
    /// @return 100 ascending values, or an empty list when no values were added
    public List<Double> percentiles() {
        if (sketch.isEmpty()) {
            return List.of();
        }
        double[] ranks = new double[PERCENTILE_COUNT];
        for (int i = 0; i < PERCENTILE_COUNT; i++) {
            ranks[i] = (i + 1) / (double) PERCENTILE_COUNT;
        }
        double[] quantiles = sketch.getQuantiles(ranks);
        List<Double> out = new ArrayList<>(quantiles.length);
        for (double q : quantiles) {
            out.add(q);
        }
        return List.copyOf(out);
    }

    /// @return number of values seen
    public long getCount() {
        return sketch.getN();
    }

    /// @return the KLL accuracy parameter
    public int getK() {
        return k;
    }

    @Override
    public String toString() {
        return "QuantileAccumulator[k=" + k + ", n=" + sketch.getN() + "]";
    }
}
