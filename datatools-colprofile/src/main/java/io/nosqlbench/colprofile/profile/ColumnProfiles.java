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
import io.nosqlbench.colprofile.schedule.PassStrategy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Container for the column profiles of one profiling run.
 *
 * <h2>Purpose</h2>
 *
 * <p>Holds the immutable profile of every profiled column, in source column
 * order, along with run metadata: how many rows were seen, which pass strategy
 * was used and how many passes over the data were actually made.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * ColumnProfiles profiles = runner.run(source);
 *
 * ColumnProfile status = profiles.get("status").orElseThrow();
 * status.histogram().ifPresent(bins ->
 *     bins.forEach(b -> System.out.println(b.value() + " " + b.ratio())));
 *
 * // Render for a reporting layer
 * String json = profiles.toJson();
 * }</pre>
 */
public final class ColumnProfiles {

    @SerializedName("num_records")
    private final long numRecords;

    @SerializedName("pass_strategy")
    private final PassStrategy passStrategy;

    @SerializedName("pass_count")
    private final int passCount;

    @SerializedName("profiles")
    private final Map<String, ColumnProfile> profiles;

    /**
     * Creates a result container.
     *
     * @param numRecords rows in the source
     * @param passStrategy the strategy the run used
     * @param passCount passes actually made over the data
     * @param profiles profile per column, in output order
     */
    public ColumnProfiles(long numRecords, PassStrategy passStrategy, int passCount,
                          Map<String, ColumnProfile> profiles) {
        this.numRecords = numRecords;
        this.passStrategy = Objects.requireNonNull(passStrategy, "passStrategy cannot be null");
        this.passCount = passCount;
        this.profiles = Collections.unmodifiableMap(new LinkedHashMap<>(profiles));
    }

    /**
     * @return all profiles keyed by column name, in column order
     */
    public Map<String, ColumnProfile> profiles() {
        return profiles;
    }

    public Optional<ColumnProfile> get(String column) {
        return Optional.ofNullable(profiles.get(column));
    }

    public Set<String> columns() {
        return profiles.keySet();
    }

    public long numRecords() {
        return numRecords;
    }

    public PassStrategy passStrategy() {
        return passStrategy;
    }

    public int passCount() {
        return passCount;
    }

    /**
     * @return the profiles rendered as pretty-printed JSON
     */
    public String toJson() {
        return ProfileGsonConfig.gson().toJson(this);
    }

    /**
     * Returns a summary of the results.
     *
     * @return human-readable summary
     */
    public String getSummary() {
        StringBuilder sb = new StringBuilder();
        sb.append("ColumnProfiles:\n");
        sb.append(String.format("  Records: %d, Strategy: %s, Passes: %d\n", numRecords, passStrategy, passCount));
        for (ColumnProfile profile : profiles.values()) {
            sb.append("  ").append(profile).append('\n');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return getSummary();
    }
}
