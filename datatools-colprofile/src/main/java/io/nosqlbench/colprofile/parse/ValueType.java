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

/// Type tag assigned to a single raw cell value by [ValueParser].
///
/// Unlike [DataType], this includes [#NULL] for absent values. Null values
/// count toward a column's total but never toward its type tally.
public enum ValueType {

    NULL(null),
    INTEGER(DataType.INTEGER),
    FRACTIONAL(DataType.FRACTIONAL),
    BOOLEAN(DataType.BOOLEAN),
    STRING(DataType.STRING);

    private final DataType dataType;

    ValueType(DataType dataType) {
        this.dataType = dataType;
    }

    /// Returns the column-level data type this value tag contributes to.
    ///
    /// @return the data type, or null for [#NULL]
    public DataType dataType() {
        return dataType;
    }

    /// @return true for [#INTEGER] and [#FRACTIONAL]
    public boolean isNumeric() {
        return this == INTEGER || this == FRACTIONAL;
    }
}
