package io.nosqlbench.colprofile.profile;

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

import com.google.gson.annotations.SerializedName;

import java.util.List;
import java.util.Objects;

/**
 * Descriptive statistics of a numeric column.
 *
 * <p>{@code mean} and {@code stdDev} are derived from {@code count}, {@code sum}
 * and {@code sumOfSquares}, which are retained so the derivation can be audited.
 * A numeric profile only exists for columns with at least one numeric value, so
 * none of its statistics is ever undefined.
 */
public final class NumericProfile {

    @SerializedName("count")
    private final long count;

    @SerializedName("sum")
    private final double sum;

    @SerializedName("sum_of_squares")
    private final double sumOfSquares;

    @SerializedName("minimum")
    private final double minimum;

    @SerializedName("maximum")
    private final double maximum;

    @SerializedName("mean")
    private final double mean;

    @SerializedName("std_dev")
    private final double stdDev;

    /** Non-null values that did not parse as numbers */
    @SerializedName("skipped")
    private final long skipped;

    @SerializedName("approx_percentiles")
    private final List<Double> approxPercentiles;

    public NumericProfile(long count, double sum, double sumOfSquares, double minimum, double maximum,
                          double mean, double stdDev, long skipped, List<Double> approxPercentiles) {
        if (count < 1) {
            throw new IllegalArgumentException("count must be positive, got: " + count);
        }
        this.count = count;
        this.sum = sum;
        this.sumOfSquares = sumOfSquares;
        this.minimum = minimum;
        this.maximum = maximum;
        this.mean = mean;
        this.stdDev = stdDev;
        this.skipped = skipped;
        this.approxPercentiles = List.copyOf(Objects.requireNonNull(approxPercentiles));
    }

    public long count() {
        return count;
    }

    public double sum() {
        return sum;
    }

    public double sumOfSquares() {
        return sumOfSquares;
    }

    public double minimum() {
        return minimum;
    }

    public double maximum() {
        return maximum;
    }

    public double mean() {
        return mean;
    }

    public double stdDev() {
        return stdDev;
    }

    /**
     * @return non-null values excluded from these statistics because they are not numeric
     */
    public long skipped() {
        return skipped;
    }

    /**
     * @return the 1st through 100th percentiles, or an empty list when not computed
     */
    public List<Double> approxPercentiles() {
        return approxPercentiles;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NumericProfile)) return false;
        NumericProfile that = (NumericProfile) o;
        return count == that.count
            && Double.compare(sum, that.sum) == 0
            && Double.compare(sumOfSquares, that.sumOfSquares) == 0
            && Double.compare(minimum, that.minimum) == 0
            && Double.compare(maximum, that.maximum) == 0
            && Double.compare(mean, that.mean) == 0
            && Double.compare(stdDev, that.stdDev) == 0
            && skipped == that.skipped
            && approxPercentiles.equals(that.approxPercentiles);
    }

    @Override
    public int hashCode() {
        return Objects.hash(count, sum, sumOfSquares, minimum, maximum, mean, stdDev, skipped, approxPercentiles);
    }

    @Override
    public String toString() {
        return String.format("NumericProfile[n=%d, min=%.4f, max=%.4f, mean=%.4f, stdDev=%.4f]",
            count, minimum, maximum, mean, stdDev);
    }
}
