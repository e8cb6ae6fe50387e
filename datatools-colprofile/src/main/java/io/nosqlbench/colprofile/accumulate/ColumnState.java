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

import io.nosqlbench.colprofile.parse.TypeTally;
import io.nosqlbench.colprofile.parse.ValueParser;
import io.nosqlbench.colprofile.parse.ValueType;
import io.nosqlbench.colprofile.schedule.ColumnPlan;

import java.util.Objects;
import java.util.Optional;
import java.util.function.BinaryOperator;

/// Aggregation state for one column over one partition of one pass.
///
/// ## Lifecycle
///
/// ```
/// 1. create(column, plan)  - empty state at the start of a partition scan
/// 2. update(raw)           - once per row, by the scan that owns the state
/// 3. merge(other)          - read-only fold into a new state
/// 4. ProfileFinalizer      - consumed once to build the column profile
/// ```
///
/// ## Accumulators
///
/// Which accumulators exist is decided by the [ColumnPlan]:
///
/// | Plan flag | Accumulators |
/// |-----------|--------------|
/// | trackCounts | totalCount, nonNullCount, [TypeTally], [DistinctCountEstimator] |
/// | trackHistogram | [HistogramAccumulator] |
/// | trackNumeric | [NumericStatsAccumulator] |
/// | trackQuantiles | [QuantileAccumulator] |
///
/// ## Merging
///
/// [#merge] is commutative and associative. An accumulator present on only one
/// side is carried into the result as is, which lets a pass-1 state (counts
/// only) combine with a pass-2 state (histogram and numeric only).
///
/// This class is **not thread-safe**.
public final class ColumnState {

    private final String column;
    private long totalCount;
    private long nonNullCount;
    private final TypeTally typeTally;
    private final DistinctCountEstimator distinct;
    private final HistogramAccumulator histogram;
    private final NumericStatsAccumulator numeric;
    private final QuantileAccumulator quantiles;

    private ColumnState(String column, long totalCount, long nonNullCount, TypeTally typeTally,
                        DistinctCountEstimator distinct, HistogramAccumulator histogram,
                        NumericStatsAccumulator numeric, QuantileAccumulator quantiles) {
        this.column = column;
        this.totalCount = totalCount;
        this.nonNullCount = nonNullCount;
        this.typeTally = typeTally;
        this.distinct = distinct;
        this.histogram = histogram;
        this.numeric = numeric;
        this.quantiles = quantiles;
    }

    /// Creates an empty state holding the accumulators the plan asks for.
    ///
    /// @param column the column name
    /// @param plan what to track
    /// @return a new, empty state
    public static ColumnState create(String column, ColumnPlan plan) {
        Objects.requireNonNull(column, "column cannot be null");
        Objects.requireNonNull(plan, "plan cannot be null");
        return new ColumnState(
            column,
            0,
            0,
            plan.trackCounts() ? new TypeTally() : null,
            plan.trackCounts() ? new DistinctCountEstimator(plan.distinctLgK()) : null,
            plan.trackHistogram() ? new HistogramAccumulator(plan.histogramBins()) : null,
            plan.trackNumeric() ? new NumericStatsAccumulator() : null,
            plan.trackQuantiles() ? new QuantileAccumulator(plan.kllK()) : null);
    }

    /// Folds one raw cell value into this state.
    ///
    /// @param raw the raw value, null when absent
    public void update(String raw) {
        ValueType type = ValueParser.parse(raw);
        if (typeTally != null) {
            totalCount++;
            if (type != ValueType.NULL) {
                nonNullCount++;
                typeTally.add(type);
                distinct.update(raw);
            }
        }
        if (type == ValueType.NULL) {
            return;
        }
        if (histogram != null) {
            histogram.add(raw);
        }
        if (type.isNumeric() && (numeric != null || quantiles != null)) {
            double value = Double.parseDouble(raw);
            // Numerals beyond double range parse to infinity; they count as skipped.
            if (!Double.isFinite(value)) {
                return;
            }
            if (numeric != null) {
                numeric.add(value);
            }
            if (quantiles != null) {
                quantiles.add(value);
            }
        }
    }

    /// Returns a new state combining this state with another for the same column.
    ///
    /// @param other the state to combine with
    /// @return the combined state
    /// @throws IllegalArgumentException if the states belong to different columns
    public ColumnState merge(ColumnState other) {
        if (!column.equals(other.column)) {
            throw new IllegalArgumentException(
                "Cannot merge states for different columns: " + column + " vs " + other.column);
        }
        return new ColumnState(
            column,
            totalCount + other.totalCount,
            nonNullCount + other.nonNullCount,
            combine(typeTally, other.typeTally, TypeTally::merge),
            combine(distinct, other.distinct, DistinctCountEstimator::merge),
            combine(histogram, other.histogram, HistogramAccumulator::merge),
            combine(numeric, other.numeric, NumericStatsAccumulator::merge),
            combine(quantiles, other.quantiles, QuantileAccumulator::merge));
    }

    private static <T> T combine(T left, T right, BinaryOperator<T> merger) {
        if (left == null) return right;
        if (right == null) return left;
        return merger.apply(left, right);
    }

    public String column() {
        return column;
    }

    public long totalCount() {
        return totalCount;
    }

    public long nonNullCount() {
        return nonNullCount;
    }

    /// @return the tally, or an empty tally when counts were not tracked
    public TypeTally typeTally() {
        return typeTally != null ? typeTally : new TypeTally();
    }

    public Optional<DistinctCountEstimator> distinct() {
        return Optional.ofNullable(distinct);
    }

    public Optional<HistogramAccumulator> histogram() {
        return Optional.ofNullable(histogram);
    }

    public Optional<NumericStatsAccumulator> numeric() {
        return Optional.ofNullable(numeric);
    }

    public Optional<QuantileAccumulator> quantiles() {
        return Optional.ofNullable(quantiles);
    }

    @Override
    public String toString() {
        return String.format("ColumnState[%s, total=%d, nonNull=%d, %s]",
            column, totalCount, nonNullCount, typeTally());
    }
}
