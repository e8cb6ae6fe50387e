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

import io.nosqlbench.colprofile.profile.HistogramEntry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Exact value-to-count distribution with a bounded number of distinct keys.
///
/// ## Overflow
///
/// At most `maxBins` distinct values are tracked. The first value that would
/// become bin `maxBins + 1` moves the accumulator into the *overflowed* state:
///
/// - values already tracked keep being counted
/// - new values are dropped
/// - [#entries] returns empty, so callers report "no histogram" rather than a
///   truncated distribution
///
/// ## Merging
///
/// [#merge] returns a new accumulator. The result is overflowed when either
/// input is overflowed or the union of keys exceeds `maxBins`. An overflowed
/// merge result keeps no bins, which bounds memory in tree reductions.
///
/// This class is **not thread-safe**.
public final class HistogramAccumulator {

    /// Orders entries by descending count, ties by ascending value.
    static final Comparator<Map.Entry<String, Long>> ENTRY_ORDER =
        Map.Entry.<String, Long>comparingByValue().reversed()
            .thenComparing(Map.Entry.<String, Long>comparingByKey());

    private final int maxBins;
    private final Map<String, Long> counts;
    private boolean overflowed;

    /// Creates an empty accumulator.
    ///
    /// @param maxBins maximum number of distinct values tracked, at least 1
    public HistogramAccumulator(int maxBins) {
        if (maxBins < 1) {
            throw new IllegalArgumentException("maxBins must be at least 1, got: " + maxBins);
        }
        this.maxBins = maxBins;
        this.counts = new HashMap<>();
    }

    /// Counts one occurrence of a value. Null is ignored.
    ///
    /// @param value the raw value
    public void add(String value) {
        if (value == null) {
            return;
        }
        Long current = counts.get(value);
        if (current != null) {
            counts.put(value, current + 1);
        } else if (!overflowed) {
            if (counts.size() >= maxBins) {
                overflowed = true;
            } else {
                counts.put(value, 1L);
            }
        }
    }

    /// Returns a new accumulator holding the union of this and another.
    ///
    /// @param other the accumulator to combine with
    /// @return the combined accumulator
    /// @throws IllegalArgumentException if the bin bounds differ
    public HistogramAccumulator merge(HistogramAccumulator other) {
        if (this.maxBins != other.maxBins) {
            throw new IllegalArgumentException(
                "Cannot merge histograms with different bounds: " + maxBins + " vs " + other.maxBins);
        }
        HistogramAccumulator merged = new HistogramAccumulator(maxBins);
        if (this.overflowed || other.overflowed) {
            merged.overflowed = true;
            return merged;
        }
        merged.counts.putAll(this.counts);
        for (Map.Entry<String, Long> e : other.counts.entrySet()) {
            merged.counts.merge(e.getKey(), e.getValue(), Long::sum);
        }
        if (merged.counts.size() > maxBins) {
            merged.counts.clear();
            merged.overflowed = true;
        }
        return merged;
    }

    /// Builds the ordered histogram.
    ///
    /// @param nonNullCount denominator for each entry's ratio
    /// @return the entries, or empty when overflowed
    public Optional<List<HistogramEntry>> entries(long nonNullCount) {
        if (overflowed) {
            return Optional.empty();
        }
        List<Map.Entry<String, Long>> sorted = new ArrayList<>(counts.entrySet());
        sorted.sort(ENTRY_ORDER);
        List<HistogramEntry> entries = new ArrayList<>(sorted.size());
        for (Map.Entry<String, Long> e : sorted) {
            double ratio = nonNullCount > 0 ? (double) e.getValue() / nonNullCount : 0.0;
            entries.add(new HistogramEntry(e.getKey(), e.getValue(), ratio));
        }
        return Optional.of(List.copyOf(entries));
    }

    /// @return true once a value beyond the bound has been seen
    public boolean isOverflowed() {
        return overflowed;
    }

    /// @return the number of distinct values currently tracked
    public int binCount() {
        return counts.size();
    }

    /// @return the bin bound
    public int maxBins() {
        return maxBins;
    }

    /// @param value a raw value
    /// @return the tracked count for the value, 0 if untracked
    public long count(String value) {
        return counts.getOrDefault(value, 0L);
    }

    @Override
    public String toString() {
        return String.format("HistogramAccumulator[bins=%d/%d, overflowed=%s]",
            counts.size(), maxBins, overflowed);
    }
}
