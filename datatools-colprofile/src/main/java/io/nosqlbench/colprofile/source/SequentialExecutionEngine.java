package io.nosqlbench.colprofile.source;

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

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/** Scans partitions one after another on the calling thread. */
public final class SequentialExecutionEngine implements ExecutionEngine {

    @Override
    public <S> List<S> mapPartitions(List<Iterable<Row>> partitions, Function<Iterable<Row>, S> task) {
        List<S> results = new ArrayList<>(partitions.size());
        for (Iterable<Row> partition : partitions) {
            results.add(task.apply(partition));
        }
        return results;
    }
}
