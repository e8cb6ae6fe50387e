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

/**
 * Abstraction for a partitioned source of tabular rows.
 *
 * <h2>Purpose</h2>
 *
 * <p>Provides a uniform interface to row data regardless of where it comes from
 * (file readers, table connectors, in-memory lists). The profiler never reads
 * files or the network itself; it only iterates what a source hands it.
 *
 * <h2>Partitions</h2>
 *
 * <p>Each partition is a lazy, re-iterable sequence of rows. A profiling run may
 * traverse every partition more than once (one traversal per pass), so
 * {@link Iterable#iterator()} must start a fresh traversal on every call.
 * Partitions may be iterated concurrently with each other, but a single
 * partition is only ever iterated by one thread at a time.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * RowSource source = InMemoryRowSource.builder()
 *     .columns("id", "status")
 *     .row("1", "DELAYED")
 *     .row("2", null)
 *     .build();
 *
 * ColumnProfiles profiles = new ColumnProfilerRunner().run(source);
 * }</pre>
 *
 * @see InMemoryRowSource
 * @see ExecutionEngine
 */
public interface RowSource {

    /**
     * Returns the stable column names of the source, in order.
     *
     * @return column names
     */
    List<String> columnNames();

    /**
     * Returns the partitions of the source.
     *
     * @return re-iterable row partitions
     */
    List<Iterable<Row>> partitions();

    /**
     * Returns an optional identifier for this source.
     *
     * <p>Used for logging.
     *
     * @return an identifier, or "anonymous" if not set
     */
    default String getId() {
        return "anonymous";
    }
}
