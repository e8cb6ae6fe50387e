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

import java.util.Collections;
import java.util.Set;

/**
 * Thrown before any data is scanned when the run inputs are unusable: a
 * missing source, a source without columns, or an allow-list naming columns
 * the source does not have.
 */
public class ProfilingInputException extends ProfilingException {

    private final Set<String> unknownColumns;

    public ProfilingInputException(String message) {
        super(message);
        this.unknownColumns = Collections.emptySet();
    }

    public ProfilingInputException(Set<String> unknownColumns) {
        super("Unknown columns requested: " + unknownColumns);
        this.unknownColumns = Collections.unmodifiableSet(unknownColumns);
    }

    /**
     * @return the requested columns missing from the source, empty for other input errors
     */
    public Set<String> getUnknownColumns() {
        return unknownColumns;
    }
}
