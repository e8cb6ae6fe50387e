package io.nosqlbench.colprofile.schedule;

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

import io.nosqlbench.colprofile.ProfilerConfig;
import io.nosqlbench.colprofile.accumulate.ColumnState;
import io.nosqlbench.colprofile.accumulate.DistinctCountEstimator;
import io.nosqlbench.colprofile.parse.DataType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Decides which accumulators each column needs in which pass.
///
/// ## Pass Layout
///
/// ```text
/// SINGLE_PASS
///   pass 1: counts + tally + distinct + histogram(bounded) + numeric + quantiles
///
/// TWO_PASS
///   pass 1: counts + tally + distinct
///   pass 2: histogram      where distinct estimate <= threshold
///           numeric + kll  where the resolved or predefined type is numeric
///           (skipped entirely when no column qualifies)
/// ```
///
/// Neither layout sorts or repartitions data by value; every pass is a plain
/// scan of each partition.
public final class ProfileScheduler {

    private static final Logger logger = LogManager.getLogger(ProfileScheduler.class);

    private final ProfilerConfig config;

    public ProfileScheduler(ProfilerConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    /// Plans the first pass.
    ///
    /// @param columns the columns to profile, in output order
    /// @return the pass-1 plan
    public PassPlan firstPass(List<String> columns) {
        boolean single = config.passStrategy() == PassStrategy.SINGLE_PASS;
        boolean percentiles = single && config.computePercentiles();
        Map<String, ColumnPlan> plans = new LinkedHashMap<>();
        for (String column : columns) {
            plans.put(column, plan(true, single, single, percentiles));
        }
        return new PassPlan(1, plans);
    }

    /// Plans the second pass from the merged pass-1 states.
    ///
    /// @param firstPass merged pass-1 state per column
    /// @return the pass-2 plan, or empty when the strategy is single-pass or
    ///         no column needs a second look at the data
    public Optional<PassPlan> secondPass(Map<String, ColumnState> firstPass) {
        if (config.passStrategy() != PassStrategy.TWO_PASS) {
            return Optional.empty();
        }
        int threshold = config.lowCardinalityHistogramThreshold();
        Map<String, ColumnPlan> plans = new LinkedHashMap<>();
        for (Map.Entry<String, ColumnState> e : firstPass.entrySet()) {
            ColumnState state = e.getValue();
            boolean populated = state.nonNullCount() > 0;
            long estimate = state.distinct().map(DistinctCountEstimator::estimate).orElse(0L);
            boolean histogram = populated && estimate <= threshold;
            boolean numeric = populated && expectedType(e.getKey(), state).isNumeric();
            if (populated && !histogram) {
                logger.debug("Column '{}' skips histogram: distinct estimate {} exceeds {}",
                    e.getKey(), estimate, threshold);
            }
            plans.put(e.getKey(), plan(false, histogram, numeric, numeric && config.computePercentiles()));
        }
        PassPlan plan = new PassPlan(2, plans);
        return plan.isEmpty() ? Optional.empty() : Optional.of(plan);
    }

    /// Returns the type a column is profiled as: its predefined type if one is
    /// configured, otherwise the type resolved from the tally.
    ///
    /// @param column the column name
    /// @param state the merged state
    /// @return the data type
    public DataType expectedType(String column, ColumnState state) {
        DataType predefined = config.predefinedTypes().get(column);
        return predefined != null ? predefined : state.typeTally().resolve();
    }

    private ColumnPlan plan(boolean counts, boolean histogram, boolean numeric, boolean quantiles) {
        return new ColumnPlan(
            counts,
            histogram,
            numeric,
            quantiles,
            config.lowCardinalityHistogramThreshold(),
            config.distinctLgK(),
            config.kllSketchSize());
    }
}
