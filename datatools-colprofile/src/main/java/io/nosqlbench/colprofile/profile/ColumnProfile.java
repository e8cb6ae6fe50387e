package io.nosqlbench.colprofile.profile;

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

import com.google.gson.annotations.SerializedName;
import io.nosqlbench.colprofile.parse.DataType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable profile of a single column.
 *
 * <h2>Fields</h2>
 *
 * <ul>
 *   <li><b>completeness</b> - non-null values over all values, in [0, 1]; 0 for a column with no rows</li>
 *   <li><b>approximateNumDistinctValues</b> - HLL estimate over non-null values</li>
 *   <li><b>dataType</b> - dominant or predefined type</li>
 *   <li><b>typeCounts</b> - non-null values per per-value type</li>
 *   <li><b>histogram</b> - present only for low-cardinality columns</li>
 *   <li><b>numericProfile</b> - present only for numeric columns with at least one numeric value</li>
 * </ul>
 *
 * <p>Optional parts are stored as nullable fields so Gson renders an absent
 * histogram as a missing key.
 */
public final class ColumnProfile {

    @SerializedName("column")
    private final String column;

    @SerializedName("completeness")
    private final double completeness;

    @SerializedName("approximate_num_distinct_values")
    private final long approximateNumDistinctValues;

    @SerializedName("data_type")
    private final DataType dataType;

    @SerializedName("is_data_type_inferred")
    private final boolean dataTypeInferred;

    @SerializedName("type_counts")
    private final Map<DataType, Long> typeCounts;

    @SerializedName("total_count")
    private final long totalCount;

    @SerializedName("non_null_count")
    private final long nonNullCount;

    @SerializedName("histogram")
    private final List<HistogramEntry> histogram;

    @SerializedName("numeric_profile")
    private final NumericProfile numericProfile;

    private ColumnProfile(Builder b) {
        this.column = Objects.requireNonNull(b.column, "column cannot be null");
        this.totalCount = b.totalCount;
        this.nonNullCount = b.nonNullCount;
        this.completeness = b.totalCount > 0 ? (double) b.nonNullCount / b.totalCount : 0.0;
        this.approximateNumDistinctValues = b.approximateNumDistinctValues;
        this.dataType = Objects.requireNonNull(b.dataType, "dataType cannot be null");
        this.dataTypeInferred = b.dataTypeInferred;
        Map<DataType, Long> counts = new EnumMap<>(DataType.class);
        counts.putAll(b.typeCounts);
        this.typeCounts = Collections.unmodifiableMap(counts);
        this.histogram = b.histogram != null ? List.copyOf(b.histogram) : null;
        this.numericProfile = b.numericProfile;
    }

    public static Builder builder(String column) {
        return new Builder(column);
    }

    public String column() {
        return column;
    }

    public double completeness() {
        return completeness;
    }

    public long approximateNumDistinctValues() {
        return approximateNumDistinctValues;
    }

    public DataType dataType() {
        return dataType;
    }

    /**
     * @return false when the type came from configuration rather than the data
     */
    public boolean isDataTypeInferred() {
        return dataTypeInferred;
    }

    public Map<DataType, Long> typeCounts() {
        return typeCounts;
    }

    public long totalCount() {
        return totalCount;
    }

    public long nonNullCount() {
        return nonNullCount;
    }

    /**
     * @return the ordered histogram, or empty when the column's cardinality exceeded the bound
     */
    public Optional<List<HistogramEntry>> histogram() {
        return Optional.ofNullable(histogram);
    }

    public Optional<NumericProfile> numericProfile() {
        return Optional.ofNullable(numericProfile);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ColumnProfile)) return false;
        ColumnProfile that = (ColumnProfile) o;
        return Double.compare(completeness, that.completeness) == 0
            && approximateNumDistinctValues == that.approximateNumDistinctValues
            && dataTypeInferred == that.dataTypeInferred
            && totalCount == that.totalCount
            && nonNullCount == that.nonNullCount
            && column.equals(that.column)
            && dataType == that.dataType
            && typeCounts.equals(that.typeCounts)
            && Objects.equals(histogram, that.histogram)
            && Objects.equals(numericProfile, that.numericProfile);
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, completeness, approximateNumDistinctValues, dataType,
            dataTypeInferred, typeCounts, totalCount, nonNullCount, histogram, numericProfile);
    }

    @Override
    public String toString() {
        return String.format("ColumnProfile[%s, completeness=%.4f, distinct=%d, type=%s, histogram=%s, numeric=%s]",
            column, completeness, approximateNumDistinctValues, dataType,
            histogram != null ? histogram.size() + " bins" : "none",
            numericProfile != null ? numericProfile : "none");
    }

    /**
     * Builder for {@link ColumnProfile}.
     */
    public static final class Builder {
        private final String column;
        private long totalCount;
        private long nonNullCount;
        private long approximateNumDistinctValues;
        private DataType dataType = DataType.STRING;
        private boolean dataTypeInferred = true;
        private Map<DataType, Long> typeCounts = Map.of();
        private List<HistogramEntry> histogram;
        private NumericProfile numericProfile;

        private Builder(String column) {
            this.column = column;
        }

        public Builder counts(long totalCount, long nonNullCount) {
            if (nonNullCount < 0 || nonNullCount > totalCount) {
                throw new IllegalArgumentException(
                    "nonNullCount must be in [0, totalCount], got: " + nonNullCount + " of " + totalCount);
            }
            this.totalCount = totalCount;
            this.nonNullCount = nonNullCount;
            return this;
        }

        public Builder approximateNumDistinctValues(long estimate) {
            this.approximateNumDistinctValues = estimate;
            return this;
        }

        public Builder dataType(DataType type, boolean inferred) {
            this.dataType = type;
            this.dataTypeInferred = inferred;
            return this;
        }

        public Builder typeCounts(Map<DataType, Long> counts) {
            this.typeCounts = Objects.requireNonNull(counts);
            return this;
        }

        public Builder histogram(List<HistogramEntry> entries) {
            this.histogram = entries;
            return this;
        }

        public Builder numericProfile(NumericProfile profile) {
            this.numericProfile = profile;
            return this;
        }

        public ColumnProfile build() {
            return new ColumnProfile(this);
        }
    }
}
