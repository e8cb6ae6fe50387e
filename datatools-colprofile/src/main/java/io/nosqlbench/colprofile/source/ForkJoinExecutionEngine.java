package io.nosqlbench.colprofile.source;

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

import io.nosqlbench.colprofile.ProfilingException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinTask;
import java.util.function.Function;

/**
 * Scans partitions in parallel on a {@link ForkJoinPool}.
 *
 * <h2>Concurrency Model</h2>
 *
 * <pre>{@code
 * partition 0 ──► worker ──► state 0 ─┐
 * partition 1 ──► worker ──► state 1 ─┼──► results in partition order
 * partition N ──► worker ──► state N ─┘
 * }</pre>
 *
 * <p>Each task creates its own result, so workers share nothing while scanning.
 * Results are collected by joining tasks in submission order, which keeps the
 * downstream fold deterministic regardless of completion order.
 *
 * <h2>Failure</h2>
 *
 * <p>If any partition task fails, the remaining tasks are cancelled, their
 * partial results are dropped, and a {@link ProfilingException} carrying the
 * first failure is thrown.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * try (ForkJoinExecutionEngine engine = new ForkJoinExecutionEngine(8)) {
 *     ColumnProfiles profiles = new ColumnProfilerRunner(config, engine).run(source);
 * }
 * }</pre>
 */
public final class ForkJoinExecutionEngine implements ExecutionEngine, AutoCloseable {

    private static final Logger logger = LogManager.getLogger(ForkJoinExecutionEngine.class);

    private final ForkJoinPool pool;
    private final boolean ownsPool;

    /**
     * Creates an engine with one worker per available processor.
     */
    public ForkJoinExecutionEngine() {
        this(Runtime.getRuntime().availableProcessors());
    }

    /**
     * Creates an engine with its own pool of the given size.
     *
     * @param parallelism number of worker threads
     */
    public ForkJoinExecutionEngine(int parallelism) {
        this(new ForkJoinPool(parallelism), true);
    }

    /**
     * Creates an engine on an existing pool. The pool is not shut down by {@link #close()}.
     *
     * @param pool the pool to submit partition tasks to
     */
    public ForkJoinExecutionEngine(ForkJoinPool pool) {
        this(pool, false);
    }

    private ForkJoinExecutionEngine(ForkJoinPool pool, boolean ownsPool) {
        this.pool = pool;
        this.ownsPool = ownsPool;
    }

    @Override
    public <S> List<S> mapPartitions(List<Iterable<Row>> partitions, Function<Iterable<Row>, S> task) {
        List<ForkJoinTask<S>> tasks = new ArrayList<>(partitions.size());
        for (Iterable<Row> partition : partitions) {
            tasks.add(pool.submit(() -> task.apply(partition)));
        }

        List<S> results = new ArrayList<>(tasks.size());
        for (int i = 0; i < tasks.size(); i++) {
            try {
                results.add(tasks.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelAll(tasks);
                throw new ProfilingException("Interrupted while scanning partition " + i, e);
            } catch (ExecutionException e) {
                cancelAll(tasks);
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                throw new ProfilingException(
                    "Partition " + i + " failed: " + cause.getMessage(), cause);
            }
        }
        return results;
    }

    private static void cancelAll(List<? extends ForkJoinTask<?>> tasks) {
        int cancelled = 0;
        for (ForkJoinTask<?> task : tasks) {
            if (!task.isDone() && task.cancel(true)) {
                cancelled++;
            }
        }
        logger.debug("Cancelled {} outstanding partition tasks", cancelled);
    }

    /**
     * @return the pool's parallelism
     */
    public int parallelism() {
        return pool.getParallelism();
    }

    /**
     * Shuts down the pool if this engine owns it.
     */
    @Override
    public void close() {
        if (ownsPool && !pool.isShutdown()) {
            pool.shutdown();
        }
    }

    @Override
    public String name() {
        return "fork-join(" + pool.getParallelism() + ")";
    }
}
