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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.nosqlbench.colprofile.accumulate.DistinctCountEstimator;
import io.nosqlbench.colprofile.accumulate.QuantileAccumulator;
import io.nosqlbench.colprofile.parse.DataType;
import io.nosqlbench.colprofile.schedule.PassStrategy;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Configuration for a {@link ColumnProfilerRunner}.
 *
 * <h2>JSON Schema</h2>
 *
 * <p>Every key is optional; missing keys take their defaults.
 * <pre>{@code
 * {
 *   "low_cardinality_histogram_threshold": 120,
 *   "distinct_estimator_precision": 0.02,
 *   "restrict_to_columns": ["status", "totalNumber"],
 *   "pass_strategy": "SINGLE_PASS",
 *   "predefined_types": {"totalNumber": "FRACTIONAL"},
 *   "compute_percentiles": true,
 *   "kll_sketch_size": 200
 * }
 * }</pre>
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * ProfilerConfig config = ProfilerConfig.builder()
 *     .lowCardinalityHistogramThreshold(50)
 *     .passStrategy(PassStrategy.TWO_PASS)
 *     .build();
 *
 * ProfilerConfig fromFile = ProfilerConfig.loadFromFile(Path.of("profiler.json"));
 * }</pre>
 */
public final class ProfilerConfig {

    /** Default maximum number of distinct values tracked by a histogram */
    public static final int DEFAULT_HISTOGRAM_THRESHOLD = 120;

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    @SerializedName("low_cardinality_histogram_threshold")
    private int lowCardinalityHistogramThreshold = DEFAULT_HISTOGRAM_THRESHOLD;

    @SerializedName("distinct_estimator_precision")
    private double distinctEstimatorPrecision = DistinctCountEstimator.DEFAULT_PRECISION;

    @SerializedName("restrict_to_columns")
    private Set<String> restrictToColumns = new LinkedHashSet<>();

    @SerializedName("pass_strategy")
    private PassStrategy passStrategy = PassStrategy.SINGLE_PASS;

    @SerializedName("predefined_types")
    private Map<String, DataType> predefinedTypes = new LinkedHashMap<>();

    @SerializedName("compute_percentiles")
    private boolean computePercentiles = true;

    @SerializedName("kll_sketch_size")
    private int kllSketchSize = QuantileAccumulator.DEFAULT_K;

    private ProfilerConfig() {
    }

    /**
     * Returns a configuration with every option at its default.
     */
    public static ProfilerConfig defaults() {
        return new ProfilerConfig();
    }

    /**
     * Returns a builder for custom configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public int lowCardinalityHistogramThreshold() {
        return lowCardinalityHistogramThreshold;
    }

    public double distinctEstimatorPrecision() {
        return distinctEstimatorPrecision;
    }

    /**
     * @return the HLL sketch size implied by {@link #distinctEstimatorPrecision()}
     */
    public int distinctLgK() {
        return DistinctCountEstimator.lgKForPrecision(distinctEstimatorPrecision);
    }

    /**
     * @return columns to profile; empty means all columns
     */
    public Set<String> restrictToColumns() {
        return Collections.unmodifiableSet(restrictToColumns);
    }

    public PassStrategy passStrategy() {
        return passStrategy;
    }

    public Map<String, DataType> predefinedTypes() {
        return Collections.unmodifiableMap(predefinedTypes);
    }

    public boolean computePercentiles() {
        return computePercentiles;
    }

    public int kllSketchSize() {
        return kllSketchSize;
    }

    /**
     * Parses a configuration from JSON and validates it.
     *
     * @throws IllegalArgumentException if the JSON is malformed or a value is out of range
     */
    public static ProfilerConfig fromJson(String json) {
        try {
            return normalize(GSON.fromJson(json, ProfilerConfig.class));
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid profiler config JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Parses a configuration from a JSON reader and validates it.
     *
     * @throws IllegalArgumentException if the JSON is malformed or a value is out of range
     */
    public static ProfilerConfig fromJson(Reader reader) {
        try {
            return normalize(GSON.fromJson(reader, ProfilerConfig.class));
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid profiler config JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Loads a configuration from a JSON file.
     */
    public static ProfilerConfig loadFromFile(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            return fromJson(reader);
        }
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    private static ProfilerConfig normalize(ProfilerConfig config) {
        if (config == null) {
            return defaults();
        }
        if (config.restrictToColumns == null) {
            config.restrictToColumns = new LinkedHashSet<>();
        }
        if (config.predefinedTypes == null) {
            config.predefinedTypes = new LinkedHashMap<>();
        }
        if (config.passStrategy == null) {
            config.passStrategy = PassStrategy.SINGLE_PASS;
        }
        config.validate();
        return config;
    }

    private void validate() {
        if (lowCardinalityHistogramThreshold < 1) {
            throw new IllegalArgumentException(
                "low_cardinality_histogram_threshold must be at least 1, got: "
                    + lowCardinalityHistogramThreshold);
        }
        if (!(distinctEstimatorPrecision > 0.0) || distinctEstimatorPrecision > 0.5) {
            throw new IllegalArgumentException(
                "distinct_estimator_precision must be in (0, 0.5], got: " + distinctEstimatorPrecision);
        }
        if (kllSketchSize < 8 || kllSketchSize > 65535) {
            throw new IllegalArgumentException(
                "kll_sketch_size must be in [8, 65535], got: " + kllSketchSize);
        }
        for (Map.Entry<String, DataType> e : predefinedTypes.entrySet()) {
            if (e.getValue() == null) {
                throw new IllegalArgumentException("predefined type for column '" + e.getKey() + "' is not a known type");
            }
        }
    }

    @Override
    public String toString() {
        return toJson();
    }

    /**
     * Builder for {@link ProfilerConfig}.
     */
    public static final class Builder {
        private final ProfilerConfig config = new ProfilerConfig();

        private Builder() {
        }

        /**
         * Sets the maximum number of distinct values a histogram tracks exactly.
         */
        public Builder lowCardinalityHistogramThreshold(int threshold) {
            config.lowCardinalityHistogramThreshold = threshold;
            return this;
        }

        /**
         * Sets the target relative standard error of distinct-count estimates.
         */
        public Builder distinctEstimatorPrecision(double precision) {
            config.distinctEstimatorPrecision = precision;
            return this;
        }

        /**
         * Limits profiling to the named columns.
         */
        public Builder restrictToColumns(Set<String> columns) {
            config.restrictToColumns = new LinkedHashSet<>(Objects.requireNonNull(columns));
            return this;
        }

        public Builder passStrategy(PassStrategy strategy) {
            config.passStrategy = Objects.requireNonNull(strategy);
            return this;
        }

        /**
         * Declares a column's type, skipping inference for it.
         */
        public Builder predefinedType(String column, DataType type) {
            config.predefinedTypes.put(Objects.requireNonNull(column), Objects.requireNonNull(type));
            return this;
        }

        public Builder computePercentiles(boolean enabled) {
            config.computePercentiles = enabled;
            return this;
        }

        public Builder kllSketchSize(int k) {
            config.kllSketchSize = k;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a value is out of range
         */
        public ProfilerConfig build() {
            ProfilerConfig built = new ProfilerConfig();
            built.lowCardinalityHistogramThreshold = config.lowCardinalityHistogramThreshold;
            built.distinctEstimatorPrecision = config.distinctEstimatorPrecision;
            built.restrictToColumns = new LinkedHashSet<>(config.restrictToColumns);
            built.passStrategy = config.passStrategy;
            built.predefinedTypes = new LinkedHashMap<>(config.predefinedTypes);
            built.computePercentiles = config.computePercentiles;
            built.kllSketchSize = config.kllSketchSize;
            built.validate();
            return built;
        }
    }
}
