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

/// What one column tracks during one pass.
///
/// @param trackCounts    totals, non-null count, type tally and distinct estimate
/// @param trackHistogram bounded exact histogram
/// @param trackNumeric   numeric statistics over numerically-parsable values
/// @param trackQuantiles KLL quantiles over numerically-parsable values
/// @param histogramBins  histogram bound
/// @param distinctLgK    HLL sketch size
/// @param kllK           KLL sketch size
public record ColumnPlan(
    boolean trackCounts,
    boolean trackHistogram,
    boolean trackNumeric,
    boolean trackQuantiles,
    int histogramBins,
    int distinctLgK,
    int kllK
) {

    /// @return true if the column needs any accumulator in this pass
    public boolean isActive() {
        return trackCounts || trackHistogram || trackNumeric || trackQuantiles;
    }
}
