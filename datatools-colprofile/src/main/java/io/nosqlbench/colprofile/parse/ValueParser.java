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

import java.util.regex.Pattern;

/// Classifies raw string cell values into a [ValueType].
///
/// ## Rules
///
/// Rules are tried in a fixed order and the first match wins:
///
/// | Order | Input | Result |
/// |-------|-------|--------|
/// | 1 | `null` | [ValueType#NULL] |
/// | 2 | `[+-]?[0-9]+` | [ValueType#INTEGER] |
/// | 3 | `[+-]?([0-9]+.?[0-9]*` or `.[0-9]+)` with optional exponent | [ValueType#FRACTIONAL] |
/// | 4 | `true` / `false`, any case | [ValueType#BOOLEAN] |
/// | 5 | anything else | [ValueType#STRING] |
///
/// Matching is purely lexical. Leading zeros are accepted and integers are not
/// range checked. Values are not trimmed, so `" 5"` is a STRING, as are `NaN`,
/// `Infinity` and the empty string.
///
/// ## Thread Safety
///
/// Stateless. All methods may be called concurrently.
public final class ValueParser {

    private static final Pattern INTEGER = Pattern.compile("[+-]?[0-9]+");

    private static final Pattern FRACTIONAL =
        Pattern.compile("[+-]?([0-9]+\\.?[0-9]*|\\.[0-9]+)([eE][+-]?[0-9]+)?");

    private ValueParser() {
        // Utility class
    }

    /// Classifies a single raw value.
    ///
    /// @param raw the raw value, possibly null
    /// @return the value's type tag, never null
    public static ValueType parse(String raw) {
        if (raw == null) {
            return ValueType.NULL;
        }
        if (raw.isEmpty()) {
            return ValueType.STRING;
        }
        if (INTEGER.matcher(raw).matches()) {
            return ValueType.INTEGER;
        }
        if (FRACTIONAL.matcher(raw).matches()) {
            return ValueType.FRACTIONAL;
        }
        if ("true".equalsIgnoreCase(raw) || "false".equalsIgnoreCase(raw)) {
            return ValueType.BOOLEAN;
        }
        return ValueType.STRING;
    }
}
