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

/// How many traversals of the data a profiling run may make.
///
/// | Strategy | Passes | Histogram memory |
/// |----------|--------|------------------|
/// | [#SINGLE_PASS] | 1 | bounded speculatively for every column |
/// | [#TWO_PASS] | 1 or 2 | only for columns whose pass-1 distinct estimate is low |
public enum PassStrategy {

    /// One pass computes every accumulator. Histograms are tracked for all
    /// columns up to the bin bound and dropped on overflow; numeric statistics
    /// are tracked for every numerically-parsable value and reported only for
    /// columns that resolve to a numeric type.
    SINGLE_PASS,

    /// Pass 1 computes completeness, type tally and distinct estimates. Pass 2
    /// computes histograms for low-cardinality columns and numeric statistics
    /// for numeric columns, and is skipped when no column needs either.
    TWO_PASS
}
