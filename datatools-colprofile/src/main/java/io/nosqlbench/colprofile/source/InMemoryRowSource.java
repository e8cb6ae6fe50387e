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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * RowSource implementation backed by in-memory row lists.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * RowSource source = InMemoryRowSource.builder()
 *     .columns("id", "status")
 *     .row("1", "DELAYED")
 *     .row("2", null)
 *     .partitions(4)
 *     .build();
 *
 * // Same rows, different partitioning
 * RowSource regrouped = ((InMemoryRowSource) source).repartition(2);
 * }</pre>
 *
 * @see RowSource
 */
public final class InMemoryRowSource implements RowSource {

    private final List<String> columnNames;
    private final List<List<Row>> partitions;
    private final String id;

    /**
     * Creates a source from explicit partitions.
     *
     * @param columnNames the column names
     * @param partitions the row partitions; empty partitions are allowed
     * @param id identifier for logging
     */
    public InMemoryRowSource(List<String> columnNames, List<List<Row>> partitions, String id) {
        Objects.requireNonNull(columnNames, "columnNames cannot be null");
        Objects.requireNonNull(partitions, "partitions cannot be null");
        this.columnNames = List.copyOf(columnNames);
        List<List<Row>> copy = new ArrayList<>(partitions.size());
        for (List<Row> partition : partitions) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(partition)));
        }
        this.partitions = Collections.unmodifiableList(copy);
        this.id = id != null ? id : "in-memory";
    }

    /**
     * Returns a builder for a new source.
     */
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public List<String> columnNames() {
        return columnNames;
    }

    @Override
    public List<Iterable<Row>> partitions() {
        List<Iterable<Row>> out = new ArrayList<>(partitions);
        return Collections.unmodifiableList(out);
    }

    @Override
    public String getId() {
        return id;
    }

    /**
     * @return all rows in partition order
     */
    public List<Row> rows() {
        List<Row> all = new ArrayList<>();
        partitions.forEach(all::addAll);
        return all;
    }

    /**
     * Returns a source with the same rows split into contiguous partitions.
     *
     * @param count number of partitions, at least 1
     * @return a new source
     */
    public InMemoryRowSource repartition(int count) {
        return new InMemoryRowSource(columnNames, split(rows(), count), id);
    }

    static List<List<Row>> split(List<Row> rows, int count) {
        if (count < 1) {
            throw new IllegalArgumentException("partition count must be at least 1, got: " + count);
        }
        List<List<Row>> out = new ArrayList<>(count);
        int size = rows.size();
        for (int p = 0; p < count; p++) {
            int from = (int) ((long) size * p / count);
            int to = (int) ((long) size * (p + 1) / count);
            out.add(new ArrayList<>(rows.subList(from, to)));
        }
        return out;
    }

    @Override
    public String toString() {
        return String.format("InMemoryRowSource[%s, columns=%s, partitions=%d]",
            id, columnNames, partitions.size());
    }

    /**
     * Builder for {@link InMemoryRowSource}.
     */
    public static final class Builder {
        private List<String> columns = List.of();
        private final List<Row> rows = new ArrayList<>();
        private int partitionCount = 1;
        private String id = "in-memory";

        private Builder() {
        }

        public Builder columns(String... names) {
            this.columns = Arrays.asList(names);
            return this;
        }

        public Builder columns(List<String> names) {
            this.columns = List.copyOf(names);
            return this;
        }

        /**
         * Adds a row of positional values matching {@link #columns}.
         */
        public Builder row(String... values) {
            rows.add(Row.of(columns, Arrays.asList(values)));
            return this;
        }

        public Builder row(Row row) {
            rows.add(Objects.requireNonNull(row, "row cannot be null"));
            return this;
        }

        public Builder rows(List<Row> more) {
            more.forEach(this::row);
            return this;
        }

        /**
         * Splits the rows into this many contiguous partitions.
         */
        public Builder partitions(int count) {
            this.partitionCount = count;
            return this;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public InMemoryRowSource build() {
            return new InMemoryRowSource(columns, split(rows, partitionCount), id);
        }
    }
}
