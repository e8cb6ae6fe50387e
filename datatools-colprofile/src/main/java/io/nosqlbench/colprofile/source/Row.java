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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An ordered set of named raw cell values.
 *
 * <p>Values are strings or null. A column the row does not carry reads as null,
 * so sources whose partitions disagree on the schema are profiled as if the
 * missing cells were null.
 */
public final class Row {

    private final Map<String, String> values;

    private Row(Map<String, String> values) {
        this.values = values;
    }

    /**
     * Creates a row from a name-to-value map, keeping the map's iteration order.
     *
     * @param values cell values by column name; null values are allowed
     * @return the row
     */
    public static Row of(Map<String, String> values) {
        Objects.requireNonNull(values, "values cannot be null");
        return new Row(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    /**
     * Creates a row from parallel lists of names and values.
     *
     * @param names column names
     * @param values cell values, same length as names; null entries are allowed
     * @return the row
     */
    public static Row of(List<String> names, List<String> values) {
        if (names.size() != values.size()) {
            throw new IllegalArgumentException(
                "names and values differ in length: " + names.size() + " vs " + values.size());
        }
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); i++) {
            map.put(names.get(i), values.get(i));
        }
        return new Row(Collections.unmodifiableMap(map));
    }

    /**
     * @param column a column name
     * @return the raw value, or null when the value is null or the column is absent
     */
    public String get(String column) {
        return values.get(column);
    }

    /**
     * @param column a column name
     * @return true if this row carries the column, even with a null value
     */
    public boolean has(String column) {
        return values.containsKey(column);
    }

    /**
     * @return the column names this row carries, in order
     */
    public Set<String> columnNames() {
        return values.keySet();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Row)) return false;
        return values.equals(((Row) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Row" + values;
    }
}
