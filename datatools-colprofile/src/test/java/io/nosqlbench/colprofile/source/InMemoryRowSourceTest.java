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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class InMemoryRowSourceTest {

    private static InMemoryRowSource fiveRows(int partitions) {
        return InMemoryRowSource.builder()
            .columns("id", "status")
            .row("1", "A")
            .row("2", null)
            .row("3", "B")
            .row("4", "A")
            .row("5", "C")
            .partitions(partitions)
            .id("five")
            .build();
    }

    private static List<Row> flatten(RowSource source) {
        List<Row> rows = new ArrayList<>();
        for (Iterable<Row> partition : source.partitions()) {
            partition.forEach(rows::add);
        }
        return rows;
    }

    @Test
    void builder_singlePartition() {
        InMemoryRowSource source = fiveRows(1);
        assertEquals(List.of("id", "status"), source.columnNames());
        assertEquals(1, source.partitions().size());
        assertEquals("five", source.getId());
        assertNull(source.rows().get(1).get("status"));
        assertTrue(source.rows().get(1).has("status"));
    }

    @Test
    void partitions_contiguousAndComplete() {
        InMemoryRowSource source = fiveRows(3);
        assertEquals(3, source.partitions().size());
        assertEquals(flatten(fiveRows(1)), flatten(source));
    }

    @Test
    void partitions_moreThanRows_allowsEmpty() {
        InMemoryRowSource source = fiveRows(8);
        assertEquals(8, source.partitions().size());
        assertEquals(5, flatten(source).size());
    }

    @Test
    void partitions_reiterable() {
        Iterable<Row> partition = fiveRows(1).partitions().get(0);
        int first = 0;
        for (Row ignored : partition) first++;
        int second = 0;
        for (Row ignored : partition) second++;
        assertEquals(first, second);
    }

    @Test
    void repartition_keepsRowOrder() {
        InMemoryRowSource source = fiveRows(1);
        assertEquals(source.rows(), source.repartition(4).rows());
        assertThrows(IllegalArgumentException.class, () -> source.repartition(0));
    }

    @Test
    void row_missingColumnReadsNull() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("id", "9");
        Row row = Row.of(values);
        assertNull(row.get("status"));
        assertFalse(row.has("status"));
        assertThat(row.columnNames()).containsExactly("id");
    }

    @Test
    void row_mismatchedLengths_throws() {
        assertThrows(IllegalArgumentException.class, () -> Row.of(List.of("a", "b"), List.of("1")));
    }
}
