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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Centralized Gson configuration for rendering profiles.
 *
 * <h2>Purpose</h2>
 *
 * <p>Provides the {@link Gson} instance reporting layers use to turn
 * {@link ColumnProfiles} and {@link ColumnProfile} into JSON.
 *
 * <h2>Configuration</h2>
 *
 * <ul>
 *   <li><b>Pretty printing</b> - enabled, for human-readable reports</li>
 *   <li><b>Serialize nulls</b> - disabled, so an absent histogram or numeric profile is a missing key</li>
 *   <li><b>HTML escaping</b> - disabled, raw values render as-is</li>
 *   <li><b>Special floats</b> - allowed, NaN and Infinity render instead of failing</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>The {@link Gson} instances are thread-safe and can be shared across threads.
 */
public final class ProfileGsonConfig {

    private static final Gson INSTANCE;

    static {
        INSTANCE = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues()  // Handle NaN, Infinity, -Infinity
            .create();
    }

    private ProfileGsonConfig() {
        // Utility class
    }

    /**
     * @return the shared pretty-printing Gson instance
     */
    public static Gson gson() {
        return INSTANCE;
    }

    /**
     * Creates a compact (non-pretty-printed) Gson instance.
     *
     * <p>Useful for NDJSON output where each profile should be on a single line.
     *
     * @return a compact Gson instance
     */
    public static Gson compactGson() {
        return new GsonBuilder()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues()  // Handle NaN, Infinity, -Infinity
            .create();
    }
}
