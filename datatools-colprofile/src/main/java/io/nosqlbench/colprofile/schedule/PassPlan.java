package io.nosqlbench.colprofile.schedule;

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
import java.util.Map;

/// The per-column plans for one pass, in column order.
///
/// @param passNumber 1-based pass ordinal
/// @param columns    plan for each column scanned in this pass
public record PassPlan(int passNumber, Map<String, ColumnPlan> columns) {

    public PassPlan {
        if (passNumber < 1) {
            throw new IllegalArgumentException("passNumber must be positive, got: " + passNumber);
        }
        columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    /// @return true when no column needs anything in this pass
    public boolean isEmpty() {
        return columns.values().stream().noneMatch(ColumnPlan::isActive);
    }
}
