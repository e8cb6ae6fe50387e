package io.nosqlbench.colprofile.parse;

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
import java.util.EnumMap;
import java.util.Map;

/// Per-type counts of the non-null values seen in one column.
///
/// The tally is the input to dominant-type resolution. Because [#resolve()]
/// only looks at counts, the resolved type is independent of row order and of
/// how rows were partitioned.
///
/// This class is **not thread-safe**. Each partition scan owns its own tally;
/// tallies are combined with [#merge], which never mutates its inputs.
public final class TypeTally {

    private final long[] counts = new long[DataType.values().length];

    /// Records one classified value. NULL values are ignored.
    ///
    /// @param type the value's type tag
    public void add(ValueType type) {
        DataType dataType = type.dataType();
        if (dataType != null) {
            counts[dataType.ordinal()]++;
        }
    }

    /// @param type a data type
    /// @return the number of values tallied under that type
    public long count(DataType type) {
        return counts[type.ordinal()];
    }

    /// @return the total number of tallied (non-null) values
    public long total() {
        long total = 0;
        for (long c : counts) {
            total += c;
        }
        return total;
    }

    /// Returns a new tally holding the sum of this tally and another.
    ///
    /// @param other the tally to combine with
    /// @return the combined tally
    public TypeTally merge(TypeTally other) {
        TypeTally merged = new TypeTally();
        for (int i = 0; i < counts.length; i++) {
            merged.counts[i] = counts[i] + other.counts[i];
        }
        return merged;
    }

    /// Resolves the dominant type: the most specific type that every tallied
    /// value satisfies.
    ///
    /// - no values: [DataType#STRING]
    /// - only booleans: [DataType#BOOLEAN]
    /// - only integers and fractionals: [DataType#FRACTIONAL] if any fractional,
    ///   otherwise [DataType#INTEGER]
    /// - anything else: [DataType#STRING]
    ///
    /// @return the dominant type
    public DataType resolve() {
        long total = total();
        if (total == 0) {
            return DataType.STRING;
        }
        if (count(DataType.BOOLEAN) == total) {
            return DataType.BOOLEAN;
        }
        long fractional = count(DataType.FRACTIONAL);
        if (count(DataType.INTEGER) + fractional == total) {
            return fractional > 0 ? DataType.FRACTIONAL : DataType.INTEGER;
        }
        return DataType.STRING;
    }

    /// @return an immutable snapshot of the non-zero counts, keyed by type
    public Map<DataType, Long> asMap() {
        Map<DataType, Long> map = new EnumMap<>(DataType.class);
        for (DataType type : DataType.values()) {
            if (counts[type.ordinal()] > 0) {
                map.put(type, counts[type.ordinal()]);
            }
        }
        return Collections.unmodifiableMap(map);
    }

    @Override
    public String toString() {
        return "TypeTally" + asMap();
    }
}
