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

import io.nosqlbench.colprofile.parse.DataType;
import io.nosqlbench.colprofile.profile.ColumnProfile;
import io.nosqlbench.colprofile.profile.ColumnProfiles;
import io.nosqlbench.colprofile.profile.HistogramEntry;
import io.nosqlbench.colprofile.profile.NumericProfile;
import io.nosqlbench.colprofile.schedule.PassStrategy;
import io.nosqlbench.colprofile.source.ForkJoinExecutionEngine;
import io.nosqlbench.colprofile.source.InMemoryRowSource;
import io.nosqlbench.colprofile.source.Row;
import io.nosqlbench.colprofile.source.RowSource;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class ColumnProfilerRunnerTest {

    private static InMemoryRowSource shipments(int partitions) {
        return InMemoryRowSource.builder()
            .columns("totalNumber", "status", "valuable")
            .row("13.0", "IN_TRANSIT", "true")
            .row("5", "DELAYED", null)
            .row(null, "DELAYED", "false")
            .row(null, "UNKNOWN", "true")
            .row("1.0", "DELAYED", null)
            .row("7.0", "IN_TRANSIT", "true")
            .row("20", "DELAYED", null)
            .row("20", "UNKNOWN", "false")
            .partitions(partitions)
            .id("shipments")
            .build();
    }

    private static ColumnProfilerRunner runner(PassStrategy strategy) {
        return new ColumnProfilerRunner(ProfilerConfig.builder().passStrategy(strategy).build());
    }

    @ParameterizedTest
    @EnumSource(PassStrategy.class)
    void referenceDataset_numericColumn(PassStrategy strategy) {
        ColumnProfile total = runner(strategy).run(shipments(1)).get("totalNumber").orElseThrow();

        assertEquals(8, total.totalCount());
        assertEquals(6, total.nonNullCount());
        assertEquals(0.75, total.completeness(), 1e-12);
        assertEquals(DataType.FRACTIONAL, total.dataType());
        assertTrue(total.isDataTypeInferred());
        assertEquals(5, total.approximateNumDistinctValues());
        assertEquals(Map.of(DataType.FRACTIONAL, 3L, DataType.INTEGER, 3L), total.typeCounts());

        NumericProfile numeric = total.numericProfile().orElseThrow();
        assertEquals(6, numeric.count());
        assertEquals(1.0, numeric.minimum());
        assertEquals(20.0, numeric.maximum());
        assertEquals(11.0, numeric.mean(), 1e-9);
        assertEquals(7.28, numeric.stdDev(), 0.005);
        assertEquals(0, numeric.skipped());
        assertEquals(100, numeric.approxPercentiles().size());
        assertEquals(20.0, numeric.approxPercentiles().get(99));
    }

    @ParameterizedTest
    @EnumSource(PassStrategy.class)
    void referenceDataset_categoricalColumn(PassStrategy strategy) {
        ColumnProfile status = runner(strategy).run(shipments(1)).get("status").orElseThrow();

        assertEquals(1.0, status.completeness());
        assertEquals(DataType.STRING, status.dataType());
        assertEquals(3, status.approximateNumDistinctValues());
        assertTrue(status.numericProfile().isEmpty());

        List<HistogramEntry> histogram = status.histogram().orElseThrow();
        assertThat(histogram).extracting(HistogramEntry::value)
            .containsExactly("DELAYED", "IN_TRANSIT", "UNKNOWN");
        assertThat(histogram).extracting(HistogramEntry::ratio)
            .containsExactly(0.5, 0.25, 0.25);
    }

    @ParameterizedTest
    @EnumSource(PassStrategy.class)
    void referenceDataset_booleanColumn(PassStrategy strategy) {
        ColumnProfile valuable = runner(strategy).run(shipments(1)).get("valuable").orElseThrow();

        assertEquals(0.625, valuable.completeness(), 1e-12);
        assertEquals(DataType.BOOLEAN, valuable.dataType());
        assertEquals(2, valuable.approximateNumDistinctValues());
        assertTrue(valuable.numericProfile().isEmpty());
        double ratioSum = valuable.histogram().orElseThrow().stream().mapToDouble(HistogramEntry::ratio).sum();
        assertEquals(1.0, ratioSum, 1e-12);
    }

    @Test
    void strategies_produceEqualProfiles() {
        ColumnProfiles single = runner(PassStrategy.SINGLE_PASS).run(shipments(3));
        ColumnProfiles two = runner(PassStrategy.TWO_PASS).run(shipments(3));

        assertEquals(single.profiles(), two.profiles());
        assertEquals(1, single.passCount());
        assertEquals(2, two.passCount());
        assertEquals(PassStrategy.TWO_PASS, two.passStrategy());
        assertEquals(8, single.numRecords());
        assertEquals(8, two.numRecords());
    }

    @Test
    void partitioning_doesNotChangeProfiles() {
        ColumnProfilerRunner runner = new ColumnProfilerRunner();
        ColumnProfiles expected = runner.run(shipments(1));
        for (int partitions : new int[]{2, 3, 5, 8, 11}) {
            assertEquals(expected.profiles(), runner.run(shipments(partitions)).profiles(),
                "partitions=" + partitions);
        }
    }

    @Test
    void forkJoinEngine_matchesSequential() {
        ColumnProfiles expected = new ColumnProfilerRunner().run(shipments(4));
        try (ForkJoinExecutionEngine engine = new ForkJoinExecutionEngine(3)) {
            ColumnProfiles parallel = new ColumnProfilerRunner(ProfilerConfig.defaults(), engine).run(shipments(4));
            assertEquals(expected.profiles(), parallel.profiles());
        }
    }

    @Test
    void profiles_inSourceColumnOrder() {
        ColumnProfiles profiles = new ColumnProfilerRunner().run(shipments(2), Set.of("valuable", "totalNumber"));
        assertThat(profiles.columns()).containsExactly("totalNumber", "valuable");
    }

    @Test
    void allowListFromConfig() {
        ColumnProfilerRunner runner = new ColumnProfilerRunner(
            ProfilerConfig.builder().restrictToColumns(Set.of("status")).build());
        assertThat(runner.run(shipments(1)).columns()).containsExactly("status");
    }

    @Test
    void restrictions_filterRowsPerColumn() {
        ColumnProfiles profiles = new ColumnProfilerRunner().run(shipments(2),
            Set.of("totalNumber", "status"),
            Map.of("totalNumber", row -> "DELAYED".equals(row.get("status"))));

        ColumnProfile total = profiles.get("totalNumber").orElseThrow();
        assertEquals(4, total.totalCount());
        assertEquals(0.75, total.completeness(), 1e-12);
        assertEquals(26.0 / 3, total.numericProfile().orElseThrow().mean(), 1e-9);

        assertEquals(8, profiles.get("status").orElseThrow().totalCount());
        assertEquals(8, profiles.numRecords());
    }

    @ParameterizedTest
    @EnumSource(PassStrategy.class)
    void predefinedTypes_overrideInference(PassStrategy strategy) {
        InMemoryRowSource source = InMemoryRowSource.builder()
            .columns("zip", "qty")
            .row("02134", "1")
            .row("10001", "x")
            .row("94105", "3")
            .build();
        ProfilerConfig config = ProfilerConfig.builder()
            .passStrategy(strategy)
            .predefinedType("zip", DataType.STRING)
            .predefinedType("qty", DataType.INTEGER)
            .predefinedType("ghost", DataType.BOOLEAN)
            .build();

        ColumnProfiles profiles = new ColumnProfilerRunner(config).run(source);
        ColumnProfile zip = profiles.get("zip").orElseThrow();
        assertEquals(DataType.STRING, zip.dataType());
        assertFalse(zip.isDataTypeInferred());
        assertTrue(zip.numericProfile().isEmpty());

        ColumnProfile qty = profiles.get("qty").orElseThrow();
        assertEquals(DataType.INTEGER, qty.dataType());
        NumericProfile numeric = qty.numericProfile().orElseThrow();
        assertEquals(2, numeric.count());
        assertEquals(1, numeric.skipped());
        assertEquals(2.0, numeric.mean(), 1e-12);
    }

    @ParameterizedTest
    @EnumSource(PassStrategy.class)
    void highCardinality_histogramOmitted(PassStrategy strategy) {
        InMemoryRowSource.Builder builder = InMemoryRowSource.builder().columns("id", "flag");
        for (int i = 0; i < 500; i++) {
            builder.row("id-" + i, i % 2 == 0 ? "true" : "false");
        }
        ColumnProfiles profiles = runner(strategy).run(builder.partitions(4).build());

        ColumnProfile id = profiles.get("id").orElseThrow();
        assertTrue(id.histogram().isEmpty());
        assertEquals(500, id.approximateNumDistinctValues(), 500 * 0.05);
        assertTrue(profiles.get("flag").orElseThrow().histogram().isPresent());
    }

    @ParameterizedTest
    @EnumSource(PassStrategy.class)
    void emptyDataset_degenerateProfiles(PassStrategy strategy) {
        InMemoryRowSource source = InMemoryRowSource.builder().columns("a", "b").partitions(3).build();
        ColumnProfiles profiles = runner(strategy).run(source);

        assertEquals(0, profiles.numRecords());
        assertEquals(1, profiles.passCount());
        for (ColumnProfile profile : profiles.profiles().values()) {
            assertEquals(0.0, profile.completeness());
            assertEquals(0, profile.approximateNumDistinctValues());
            assertEquals(DataType.STRING, profile.dataType());
            assertTrue(profile.histogram().isEmpty());
            assertTrue(profile.numericProfile().isEmpty());
        }
    }

    @Test
    void allNullColumn_completenessZero() {
        InMemoryRowSource source = InMemoryRowSource.builder()
            .columns("a", "b")
            .row("1", null)
            .row("2", null)
            .build();
        ColumnProfile b = new ColumnProfilerRunner().run(source).get("b").orElseThrow();
        assertEquals(2, b.totalCount());
        assertEquals(0.0, b.completeness());
        assertEquals(DataType.STRING, b.dataType());
        assertTrue(b.histogram().isEmpty());
    }

    @Test
    void missingCells_readAsNull() {
        Map<String, String> partial = new LinkedHashMap<>();
        partial.put("a", "1");
        InMemoryRowSource source = InMemoryRowSource.builder()
            .columns("a", "b")
            .row("2", "x")
            .row(Row.of(partial))
            .build();
        ColumnProfile b = new ColumnProfilerRunner().run(source).get("b").orElseThrow();
        assertEquals(2, b.totalCount());
        assertEquals(0.5, b.completeness());
    }

    @Test
    void inputErrors() {
        ColumnProfilerRunner runner = new ColumnProfilerRunner();
        assertThrows(ProfilingInputException.class, () -> runner.run(null));
        assertThrows(ProfilingInputException.class,
            () -> runner.run(InMemoryRowSource.builder().build()));

        ProfilingInputException unknown = assertThrows(ProfilingInputException.class,
            () -> runner.run(shipments(1), Set.of("status", "weight")));
        assertEquals(Set.of("weight"), unknown.getUnknownColumns());

        ColumnProfilerRunner configured = new ColumnProfilerRunner(
            ProfilerConfig.builder().restrictToColumns(Set.of("nope")).build());
        assertThrows(ProfilingInputException.class, () -> configured.run(shipments(1)));
    }

    @Test
    void sourceFailure_raisesProfilingException() {
        RowSource failing = new RowSource() {
            @Override
            public List<String> columnNames() {
                return List.of("a");
            }

            @Override
            public List<Iterable<Row>> partitions() {
                Iterable<Row> broken = () -> new Iterator<>() {
                    @Override
                    public boolean hasNext() {
                        return true;
                    }

                    @Override
                    public Row next() {
                        throw new IllegalStateException("connection lost");
                    }
                };
                return List.of(broken);
            }
        };
        ProfilingException e = assertThrows(ProfilingException.class, () -> new ColumnProfilerRunner().run(failing));
        assertFalse(e instanceof ProfilingInputException);
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    void toJson_omitsAbsentParts() {
        String json = new ColumnProfilerRunner().run(shipments(1), Set.of("status")).toJson();
        assertThat(json)
            .contains("\"num_records\": 8")
            .contains("\"pass_strategy\": \"SINGLE_PASS\"")
            .contains("\"value\": \"DELAYED\"")
            .doesNotContain("numeric_profile");
    }

    @ParameterizedTest
    @EnumSource(PassStrategy.class)
    void nonFiniteNumerals_skippedAndRenderable(PassStrategy strategy) {
        InMemoryRowSource source = InMemoryRowSource.builder()
            .columns("reading", "overflowOnly")
            .row("1e400", "1e400")
            .row("-1e400", "-1e400")
            .row("9".repeat(400), null)
            .row("2", null)
            .partitions(2)
            .build();
        ColumnProfiles profiles = runner(strategy).run(source);

        ColumnProfile reading = profiles.get("reading").orElseThrow();
        assertEquals(DataType.FRACTIONAL, reading.dataType());
        NumericProfile numeric = reading.numericProfile().orElseThrow();
        assertEquals(1, numeric.count());
        assertEquals(3, numeric.skipped());
        assertEquals(2.0, numeric.mean());
        assertEquals(0.0, numeric.stdDev());
        assertThat(numeric.approxPercentiles()).allSatisfy(p -> assertTrue(Double.isFinite(p)));

        ColumnProfile overflowOnly = profiles.get("overflowOnly").orElseThrow();
        assertEquals(DataType.FRACTIONAL, overflowOnly.dataType());
        assertTrue(overflowOnly.numericProfile().isEmpty());

        String json = assertDoesNotThrow(() -> profiles.toJson());
        assertThat(json).doesNotContain("NaN").doesNotContain("Infinity");
    }

    @Test
    void repeatedFractions_meanBetweenMinAndMax() {
        InMemoryRowSource.Builder builder = InMemoryRowSource.builder().columns("share");
        for (int i = 0; i < 10; i++) {
            builder.row("0.1");
        }
        for (int partitions : new int[]{1, 3, 7}) {
            NumericProfile numeric = new ColumnProfilerRunner().run(builder.partitions(partitions).build())
                .get("share").orElseThrow().numericProfile().orElseThrow();
            assertTrue(numeric.minimum() <= numeric.mean() && numeric.mean() <= numeric.maximum(),
                "partitions=" + partitions + ", mean=" + numeric.mean());
            assertTrue(numeric.stdDev() >= 0.0);
        }
    }
}
