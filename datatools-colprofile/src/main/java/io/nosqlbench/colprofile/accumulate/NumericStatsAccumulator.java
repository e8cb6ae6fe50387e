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

/// Streaming descriptive statistics for the numeric values of one column.
///
/// ## Purpose
///
/// Accumulates count, sum, sum of squares, min and max in a single pass,
/// alongside Welford's running mean and second central moment (M2). The sums
/// are what a profile reports for auditability; M2 gives a numerically stable
/// variance for callers that need one.
///
/// ## Welford's Algorithm
///
/// ```
/// For each new value x:
///   n++
///   delta = x - mean
///   mean += delta / n
///   M2 += delta * (x - mean)
/// ```
///
/// ## Parallel Combination
///
/// Two accumulators over disjoint values combine with Chan's formulas:
///
/// ```
/// n    = nA + nB
/// d    = meanB - meanA
/// mean = meanA + d * nB / n
/// M2   = M2A + M2B + d^2 * nA * nB / n
/// ```
///
/// Counts, min and max combine exactly. Sums combine exactly up to
/// floating-point summation order, so different partitionings of the same
/// data can differ in the last bits of `sum`, `mean` and `stdDev`.
///
/// ## Thread Safety
///
/// This class is **not thread-safe**. Use one accumulator per partition and
/// combine with [#merge], which never mutates its inputs.
public final class NumericStatsAccumulator {

    /// Relative disagreement between the sum-based and Welford variances
    /// beyond which the sum-based one is treated as cancellation noise.
    static final double VARIANCE_TOLERANCE = 1e-6;

    private long count = 0;
    private double sum = 0.0;
    private double sumOfSquares = 0.0;
    private double mean = 0.0;
    private double m2 = 0.0;
    private double min = Double.POSITIVE_INFINITY;
    private double max = Double.NEGATIVE_INFINITY;

    /// Adds a single value.
    ///
    /// @param value the value to add
    public void add(double value) {
        if (value < min) min = value;
        if (value > max) max = value;

        count++;
        sum += value;
        sumOfSquares += value * value;

        double delta = value - mean;
        mean += delta / count;
        m2 += delta * (value - mean);
    }

    /// Returns a new accumulator equivalent to having seen the values of both.
    ///
    /// @param other the accumulator to combine with
    /// @return the combined accumulator
    public NumericStatsAccumulator merge(NumericStatsAccumulator other) {
        NumericStatsAccumulator merged = new NumericStatsAccumulator();
        if (other.count == 0) {
            merged.copyFrom(this);
            return merged;
        }
        if (this.count == 0) {
            merged.copyFrom(other);
            return merged;
        }

        double nA = this.count;
        double nB = other.count;
        double nAB = nA + nB;
        double delta = other.mean - this.mean;

        merged.count = this.count + other.count;
        merged.sum = this.sum + other.sum;
        merged.sumOfSquares = this.sumOfSquares + other.sumOfSquares;
        merged.mean = this.mean + delta * nB / nAB;
        merged.m2 = this.m2 + other.m2 + delta * delta * nA * nB / nAB;
        merged.min = Math.min(this.min, other.min);
        merged.max = Math.max(this.max, other.max);
        return merged;
    }

    private void copyFrom(NumericStatsAccumulator source) {
        this.count = source.count;
        this.sum = source.sum;
        this.sumOfSquares = source.sumOfSquares;
        this.mean = source.mean;
        this.m2 = source.m2;
        this.min = source.min;
        this.max = source.max;
    }

    /// @return number of values accumulated
    public long getCount() {
        return count;
    }

    /// @return running sum
    public double getSum() {
        return sum;
    }

    /// @return running sum of squares
    public double getSumOfSquares() {
        return sumOfSquares;
    }

    /// @return minimum value seen, or +Infinity if no data
    public double getMin() {
        return min;
    }

    /// @return maximum value seen, or -Infinity if no data
    public double getMax() {
        return max;
    }

    /// Returns the mean as `sum / count`, clamped into `[min, max]` where
    /// rounding in the sum pushes it past either bound.
    ///
    /// @return the mean
    /// @throws IllegalStateException if no values have been added
    public double getMean() {
        requireData();
        double mean = sum / count;
        return Math.max(min, Math.min(max, mean));
    }

    /// Returns the population standard deviation from the running sums,
    /// `sqrt(sumOfSquares / count - mean^2)`, clamped at zero when rounding
    /// makes the radicand negative.
    ///
    /// The sum-based variance loses precision to cancellation when values are
    /// large relative to their spread. When it disagrees with the Welford
    /// variance by more than [#VARIANCE_TOLERANCE] (relative), the Welford
    /// variance is used instead.
    ///
    /// @return the standard deviation
    /// @throws IllegalStateException if no values have been added
    public double getStdDev() {
        requireData();
        double mean = sum / count;
        double variance = sumOfSquares / count - mean * mean;
        double stable = getStableVariance();
        if (Math.abs(variance - stable) > VARIANCE_TOLERANCE * Math.max(Math.abs(variance), stable)) {
            variance = stable;
        }
        return variance > 0 ? Math.sqrt(variance) : 0.0;
    }

    /// Returns the population variance from Welford's M2.
    ///
    /// @return M2 / count, or 0 if no data
    public double getStableVariance() {
        return count > 0 ? m2 / count : 0.0;
    }

    /// @return true if no values have been added
    public boolean isEmpty() {
        return count == 0;
    }

    private void requireData() {
        if (count == 0) {
            throw new IllegalStateException("Cannot compute statistics: no data added");
        }
    }

    @Override
    public String toString() {
        return String.format(
            "NumericStatsAccumulator[n=%d, sum=%.4f, range=[%.4f, %.4f]]",
            count, sum, min, max);
    }
}
