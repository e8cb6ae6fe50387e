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

/// Logical data type reported for a profiled column.
///
/// ## Precedence
///
/// The types form a total order from least to most general:
///
/// ```
/// BOOLEAN < INTEGER < FRACTIONAL < STRING
/// ```
///
/// Every INTEGER value also satisfies FRACTIONAL, and every value satisfies
/// STRING. BOOLEAN values satisfy only BOOLEAN and STRING, so a column mixing
/// booleans with numbers resolves to STRING.
///
/// @see TypeTally#resolve()
public enum DataType {
    BOOLEAN,
    INTEGER,
    FRACTIONAL,
    STRING;

    /// @return true for [#INTEGER] and [#FRACTIONAL]
    public boolean isNumeric() {
        return this == INTEGER || this == FRACTIONAL;
    }
}
