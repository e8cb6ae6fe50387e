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

import java.util.List;
import java.util.function.Function;

/**
 * Fans a per-partition task out over the partitions of a source.
 *
 * <h2>Contract</h2>
 *
 * <ul>
 *   <li>{@code task} is applied exactly once to every partition</li>
 *   <li>results are returned in partition order, whatever order tasks finished in</li>
 *   <li>tasks share no mutable state; each creates and owns its own result</li>
 *   <li>if any task fails, the whole call fails and all partial results are discarded</li>
 * </ul>
 *
 * <p>The profiler folds the returned results in list order, which makes a run
 * deterministic for a fixed partitioning.
 *
 * @see SequentialExecutionEngine
 * @see ForkJoinExecutionEngine
 */
public interface ExecutionEngine {

    /**
     * Applies a task to each partition.
     *
     * @param partitions the partitions to scan
     * @param task the per-partition task
     * @param <S> the per-partition result type
     * @return one result per partition, in partition order
     */
    <S> List<S> mapPartitions(List<Iterable<Row>> partitions, Function<Iterable<Row>, S> task);

    /**
     * @return a short name for logging
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
