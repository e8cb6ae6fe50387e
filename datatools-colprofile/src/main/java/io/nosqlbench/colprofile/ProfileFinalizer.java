package io.nosqlbench.colprofile;

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

import io.nosqlbench.colprofile.accumulate.ColumnState;
import io.nosqlbench.colprofile.accumulate.DistinctCountEstimator;
import io.nosqlbench.colprofile.accumulate.HistogramAccumulator;
import io.nosqlbench.colprofile.accumulate.NumericStatsAccumulator;
import io.nosqlbench.colprofile.accumulate.QuantileAccumulator;
import io.nosqlbench.colprofile.parse.DataType;
import io.nosqlbench.colprofile.profile.ColumnProfile;
import io.nosqlbench.colprofile.profile.HistogramEntry;
import io.nosqlbench.colprofile.profile.NumericProfile;
import io.nosqlbench.colprofile.schedule.ProfileScheduler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns a fully merged {@link ColumnState} into an immutable {@link ColumnProfile}.
 *
 * <h2>Rules</h2>
 *
 * <ul>
 *   <li>completeness is {@code nonNull / total}, and 0 when the column has no rows</li>
 *   <li>the data type is the predefined one when configured, otherwise the tally's resolution</li>
 *   <li>the histogram is attached only if its accumulator never overflowed</li>
 *   <li>the numeric profile is attached only for numeric types with at least one numeric value</li>
 * </ul>
 */
public final class ProfileFinalizer {

    private static final Logger logger = LogManager.getLogger(ProfileFinalizer.class);

    private final ProfilerConfig config;
    private final ProfileScheduler scheduler;

    public ProfileFinalizer(ProfilerConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.scheduler = new ProfileScheduler(config);
    }

    /**
     * Builds the profile for one column.
     *
     * @param state the merged state over all partitions and passes
     * @return the column's profile
     */
    public ColumnProfile toProfile(ColumnState state) {
        String column = state.column();
        DataType type = scheduler.expectedType(column, state);
        boolean inferred = !config.predefinedTypes().containsKey(column);

        ColumnProfile.Builder builder = ColumnProfile.builder(column)
            .counts(state.totalCount(), state.nonNullCount())
            .approximateNumDistinctValues(state.distinct().map(DistinctCountEstimator::estimate).orElse(0L))
            .dataType(type, inferred)
            .typeCounts(state.typeTally().asMap());

        Optional<HistogramAccumulator> histogram = state.histogram();
        if (histogram.isPresent() && state.nonNullCount() > 0) {
            Optional<List<HistogramEntry>> entries = histogram.get().entries(state.nonNullCount());
            if (entries.isPresent()) {
                builder.histogram(entries.get());
            } else {
                logger.debug("Column '{}' histogram overflowed {} bins; omitted",
                    column, histogram.get().maxBins());
            }
        }

        if (type.isNumeric()) {
            state.numeric()
                .filter(stats -> !stats.isEmpty())
                .ifPresent(stats -> builder.numericProfile(numericProfile(state, stats)));
        }
        return builder.build();
    }

    private NumericProfile numericProfile(ColumnState state, NumericStatsAccumulator stats) {
        List<Double> percentiles = config.computePercentiles()
            ? state.quantiles().map(QuantileAccumulator::percentiles).orElse(List.of())
            : List.of();
        return new NumericProfile(
            stats.getCount(),
            stats.getSum(),
            stats.getSumOfSquares(),
            stats.getMin(),
            stats.getMax(),
            stats.getMean(),
            stats.getStdDev(),
            Math.max(0, state.nonNullCount() - stats.getCount()),
            percentiles);
    }
}
