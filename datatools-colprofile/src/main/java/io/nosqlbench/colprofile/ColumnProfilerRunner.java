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
import io.nosqlbench.colprofile.profile.ColumnProfile;
import io.nosqlbench.colprofile.profile.ColumnProfiles;
import io.nosqlbench.colprofile.schedule.ColumnPlan;
import io.nosqlbench.colprofile.schedule.PassPlan;
import io.nosqlbench.colprofile.schedule.ProfileScheduler;
import io.nosqlbench.colprofile.source.ExecutionEngine;
import io.nosqlbench.colprofile.source.Row;
import io.nosqlbench.colprofile.source.RowSource;
import io.nosqlbench.colprofile.source.SequentialExecutionEngine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Profiles the columns of a {@link RowSource}.
 *
 * <h2>Purpose</h2>
 *
 * <p>Runs one or two passes over every partition of a source, folds the
 * per-partition column states in partition order, and finalizes one
 * {@link ColumnProfile} per profiled column.
 *
 * <h2>Run Flow</h2>
 *
 * <pre>{@code
 * validate inputs ──► plan pass 1 ──► scan partitions ──► fold
 *                                                          │
 *                  ┌───────────────────────────────────────┘
 *                  ▼
 *        plan pass 2 (TWO_PASS only) ──► scan partitions ──► fold ──► merge with pass 1
 *                                                                        │
 *                                                           finalize ◄───┘
 * }</pre>
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * ColumnProfilerRunner runner = new ColumnProfilerRunner(
 *     ProfilerConfig.builder().passStrategy(PassStrategy.TWO_PASS).build(),
 *     new ForkJoinExecutionEngine());
 *
 * ColumnProfiles all = runner.run(source);
 * ColumnProfiles some = runner.run(source, Set.of("status", "totalNumber"));
 * ColumnProfiles shipped = runner.run(source, Set.of("totalNumber"),
 *     Map.of("totalNumber", row -> "SHIPPED".equals(row.get("status"))));
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>A runner holds no per-run state and may be shared. Concurrency within a
 * run is entirely up to the {@link ExecutionEngine}.
 */
public final class ColumnProfilerRunner {

    private static final Logger logger = LogManager.getLogger(ColumnProfilerRunner.class);

    private final ProfilerConfig config;
    private final ExecutionEngine engine;
    private final ProfileScheduler scheduler;
    private final ProfileFinalizer finalizer;

    /**
     * Creates a runner with default configuration, scanning on the calling thread.
     */
    public ColumnProfilerRunner() {
        this(ProfilerConfig.defaults());
    }

    /**
     * Creates a runner scanning on the calling thread.
     *
     * @param config profiling configuration
     */
    public ColumnProfilerRunner(ProfilerConfig config) {
        this(config, new SequentialExecutionEngine());
    }

    /**
     * Creates a runner.
     *
     * @param config profiling configuration
     * @param engine how partitions are scanned
     */
    public ColumnProfilerRunner(ProfilerConfig config, ExecutionEngine engine) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.engine = Objects.requireNonNull(engine, "engine cannot be null");
        this.scheduler = new ProfileScheduler(config);
        this.finalizer = new ProfileFinalizer(config);
    }

    /**
     * Profiles every column of the source, or the configured allow-list if one is set.
     *
     * @param source the data to profile
     * @return a profile per column
     * @throws ProfilingInputException if the inputs are unusable
     * @throws ProfilingException if a pass fails
     */
    public ColumnProfiles run(RowSource source) {
        return run(source, Set.of(), Map.of());
    }

    /**
     * Profiles the given columns.
     *
     * @param source the data to profile
     * @param columns columns to profile; empty means the configured allow-list, or all
     * @return a profile per requested column, in source column order
     */
    public ColumnProfiles run(RowSource source, Set<String> columns) {
        return run(source, columns, Map.of());
    }

    /**
     * Profiles the given columns, counting a row toward a column only if it
     * satisfies that column's restriction.
     *
     * @param source the data to profile
     * @param columns columns to profile; empty means the configured allow-list, or all
     * @param restrictions row predicate per column; unrestricted columns see every row
     * @return a profile per requested column, in source column order
     */
    public ColumnProfiles run(RowSource source, Set<String> columns,
                              Map<String, Predicate<Row>> restrictions) {
        if (source == null) {
            throw new ProfilingInputException("source cannot be null");
        }
        List<String> targets = resolveColumns(source, columns == null ? Set.of() : columns);
        Map<String, Predicate<Row>> filters = restrictions == null ? Map.of() : restrictions;
        warnUnknownPredefined(targets);

        long startTime = System.currentTimeMillis();
        logger.info("Profiling {} columns of source '{}' over {} partitions ({}, engine={})",
            targets.size(), source.getId(), source.partitions().size(),
            config.passStrategy(), engine.name());

        PassPlan firstPlan = scheduler.firstPass(targets);
        PassResult first = scan(source, firstPlan, filters);
        Map<String, ColumnState> merged = first.states;
        int passCount = 1;

        Optional<PassPlan> secondPlan = scheduler.secondPass(merged);
        if (secondPlan.isPresent()) {
            PassResult second = scan(source, secondPlan.get(), filters);
            Map<String, ColumnState> combined = new LinkedHashMap<>();
            for (Map.Entry<String, ColumnState> e : merged.entrySet()) {
                ColumnState extra = second.states.get(e.getKey());
                combined.put(e.getKey(), extra != null ? e.getValue().merge(extra) : e.getValue());
            }
            merged = combined;
            passCount = 2;
        }

        Map<String, ColumnProfile> profiles = new LinkedHashMap<>();
        for (ColumnState state : merged.values()) {
            profiles.put(state.column(), finalizer.toProfile(state));
        }

        logger.info("Profiled {} columns over {} records in {} pass(es), {} ms",
            profiles.size(), first.rows, passCount, System.currentTimeMillis() - startTime);
        return new ColumnProfiles(first.rows, config.passStrategy(), passCount, profiles);
    }

    private List<String> resolveColumns(RowSource source, Set<String> requested) {
        List<String> available = source.columnNames();
        if (available == null || available.isEmpty()) {
            throw new ProfilingInputException("source '" + source.getId() + "' has no columns");
        }
        Set<String> allowList = !requested.isEmpty() ? requested : config.restrictToColumns();
        if (allowList.isEmpty()) {
            return List.copyOf(new LinkedHashSet<>(available));
        }
        Set<String> unknown = new LinkedHashSet<>(allowList);
        unknown.removeAll(available);
        if (!unknown.isEmpty()) {
            throw new ProfilingInputException(unknown);
        }
        List<String> targets = new ArrayList<>();
        for (String column : new LinkedHashSet<>(available)) {
            if (allowList.contains(column)) {
                targets.add(column);
            }
        }
        return targets;
    }

    private void warnUnknownPredefined(List<String> targets) {
        for (String column : config.predefinedTypes().keySet()) {
            if (!targets.contains(column)) {
                logger.warn("Predefined type for column '{}' ignored: column is not profiled", column);
            }
        }
    }

    private PassResult scan(RowSource source, PassPlan plan, Map<String, Predicate<Row>> filters) {
        long passStart = System.currentTimeMillis();
        List<PassResult> partials;
        try {
            partials = engine.mapPartitions(source.partitions(), partition -> scanPartition(partition, plan, filters));
        } catch (ProfilingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ProfilingException("Pass " + plan.passNumber() + " failed: " + e.getMessage(), e);
        }

        // Fold in partition order starting from empty states, so a source with no partitions still yields states.
        PassResult result = new PassResult(0, emptyStates(plan));
        for (PassResult partial : partials) {
            result = result.merge(partial);
        }
        logger.debug("Pass {} scanned {} rows in {} partitions, {} ms",
            plan.passNumber(), result.rows, partials.size(), System.currentTimeMillis() - passStart);
        return result;
    }

    private static PassResult scanPartition(Iterable<Row> partition, PassPlan plan,
                                            Map<String, Predicate<Row>> filters) {
        Map<String, ColumnState> states = emptyStates(plan);
        long rows = 0;
        for (Row row : partition) {
            rows++;
            for (ColumnState state : states.values()) {
                Predicate<Row> filter = filters.get(state.column());
                if (filter == null || filter.test(row)) {
                    state.update(row.get(state.column()));
                }
            }
        }
        return new PassResult(rows, states);
    }

    private static Map<String, ColumnState> emptyStates(PassPlan plan) {
        Map<String, ColumnState> states = new LinkedHashMap<>();
        for (Map.Entry<String, ColumnPlan> e : plan.columns().entrySet()) {
            if (e.getValue().isActive()) {
                states.put(e.getKey(), ColumnState.create(e.getKey(), e.getValue()));
            }
        }
        return states;
    }

    /** Row count and column states of one partition, or of a fold of partitions. */
    private static final class PassResult {
        private final long rows;
        private final Map<String, ColumnState> states;

        private PassResult(long rows, Map<String, ColumnState> states) {
            this.rows = rows;
            this.states = states;
        }

        private PassResult merge(PassResult other) {
            Map<String, ColumnState> combined = new LinkedHashMap<>();
            for (Map.Entry<String, ColumnState> e : states.entrySet()) {
                ColumnState right = other.states.get(e.getKey());
                combined.put(e.getKey(), right != null ? e.getValue().merge(right) : e.getValue());
            }
            return new PassResult(rows + other.rows, combined);
        }
    }
}
