package com.meridian.codehistory.core.extraction;

import com.meridian.codehistory.api.ExtractionListener;
import com.meridian.codehistory.api.exceptions.SchemaException;
import com.meridian.codehistory.api.model.Episode;
import com.meridian.codehistory.api.model.ExtractionResult;
import com.meridian.codehistory.api.model.FeatureMode;
import com.meridian.codehistory.api.model.MatchBackend;
import com.meridian.codehistory.api.model.ResultRecord;
import com.meridian.codehistory.api.model.SourceTable;
import com.meridian.codehistory.core.config.ExtractionConfig;
import com.meridian.codehistory.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class DiagnosisCodeExtractorTest {

    private static final String[] DAD_COLUMNS =
            {"episode_order", "PATID", "ADMITDATE_DT", "DISDATE_DT", "DXCODE1", "DXCODE2"};
    private static final String[] ED_COLUMNS = {"episode_order", "PATID", "VISIT_DATE_DT", "DXCODE1", "DXCODE2"};

    private InMemoryMetricsRegistry metrics;

    @BeforeEach
    void setUp() {
        metrics = new InMemoryMetricsRegistry();
    }

    private DiagnosisCodeExtractor extractor(ExtractionConfig config) {
        return new DiagnosisCodeExtractor(config, OpenTelemetry.noop().getTracer("test"), metrics);
    }

    private DiagnosisCodeExtractor extractor(int lookbackDays, FeatureMode mode) {
        return extractor(ExtractionConfig.builder().lookbackDays(lookbackDays).featureMode(mode).build());
    }

    private static SourceTable episodes(Object[]... rows) {
        SourceTable.Builder builder = SourceTable.builder("episodes").columns("episode_order", "PATID", "start_date", "type");
        for (Object[] row : rows) {
            builder.row(row);
        }
        return builder.build();
    }

    private static SourceTable dad(Object[]... rows) {
        SourceTable.Builder builder = SourceTable.builder("dad").columns(DAD_COLUMNS);
        for (Object[] row : rows) {
            builder.row(row);
        }
        return builder.build();
    }

    private static SourceTable ed(Object[]... rows) {
        SourceTable.Builder builder = SourceTable.builder("ed").columns(ED_COLUMNS);
        for (Object[] row : rows) {
            builder.row(row);
        }
        return builder.build();
    }

    private static Object[] row(Object... values) {
        return values;
    }

    @Nested
    @DisplayName("Window matching")
    class WindowMatching {

        @Test
        @DisplayName("Ten-day lookback from 2024-06-10 should collect codes from D1 and D2 only")
        void testScenarioA() {
            SourceTable inpatient = dad(
                    row("D1", "P001", "2024-06-01", "2024-06-03", "I10", null),
                    row("D2", "P001", "2024-06-05", "2024-06-07", "E11", "I10"),
                    row("D3", "P001", "2024-06-10", "2024-06-12", "ON_START", null),
                    row("D4", "P002", "2024-06-05", "2024-06-07", "OTHER_PAT", null));

            ExtractionResult result = extractor(10, FeatureMode.INP_ONLY)
                    .extract(episodes(row("E1", "P001", "2024-06-10", "inp")), inpatient, null);

            assertThat(result.codesFor("E1")).containsExactly("E11", "I10");
        }

        @Test
        @DisplayName("A code found in several matched records should be reported once")
        void testScenarioB() {
            SourceTable inpatient = dad(
                    row("D1", "P001", "2024-05-10", "2024-05-15", "ZZZ", "AAA"),
                    row("D2", "P001", "2024-05-15", "2024-05-20", "AAA", "BBB"));
            SourceTable emergency = ed(row("V1", "P001", "2024-05-25", "AAA", null));

            ExtractionResult result = extractor(30, FeatureMode.BOTH)
                    .extract(episodes(row("E1", "P001", "2024-06-01", "ed")), inpatient, emergency);

            assertThat(result.codesFor("E1")).containsExactly("AAA", "BBB", "ZZZ");
        }

        @Test
        @DisplayName("Episodes without matching records should get an empty code list")
        void testScenarioC() {
            SourceTable inpatient = dad(
                    row("D1", "P001", "2024-01-01", "2024-01-05", "OLD", null),
                    row("D2", "P002", "2024-05-20", "2024-05-25", "OTHER_PAT", null));

            ExtractionResult result = extractor(30, FeatureMode.INP_ONLY)
                    .extract(episodes(row("E1", "P001", "2024-06-01", "inp"), row("E2", "P003", "2024-06-01", "inp")),
                            inpatient, null);

            assertThat(result.get("E1")).isPresent();
            assertThat(result.codesFor("E1")).isEmpty();
            assertThat(result.codesFor("E2")).isNotNull().isEmpty();
            assertThat(result.stats().episodesWithCodes()).isZero();
        }

        @Test
        @DisplayName("The episode's own inpatient record should be excluded")
        void testSelfExclusion() {
            SourceTable inpatient = dad(
                    row("E1", "P001", "2024-05-25", "2024-05-30", "CURRENT", null),
                    row("E0", "P001", "2024-05-20", "2024-05-25", "PREVIOUS", null));

            ExtractionResult result = extractor(30, FeatureMode.INP_ONLY)
                    .extract(episodes(row("E1", "P001", "2024-06-01", "inp")), inpatient, null);

            assertThat(result.codesFor("E1")).containsExactly("PREVIOUS");
        }

        @Test
        @DisplayName("Emergency visits on either window boundary should be included")
        void testPointBoundaries() {
            SourceTable emergency = ed(
                    row("V0", "P001", "2024-05-30", "BEFORE", null),
                    row("V1", "P001", "2024-05-31", "ON_START", null),
                    row("V2", "P001", "2024-06-09", "ON_END", null),
                    row("V3", "P001", "2024-06-10", "ON_EPISODE", null));

            ExtractionResult result = extractor(10, FeatureMode.BOTH)
                    .extract(episodes(row("E1", "P001", "2024-06-10", "ed")), dad(), emergency);

            assertThat(result.codesFor("E1")).containsExactly("ON_END", "ON_START");
        }
    }

    @Nested
    @DisplayName("Feature modes")
    class FeatureModes {

        private final SourceTable inpatient = dad(row("D1", "P001", "2024-05-20", "2024-05-22", "INP_CODE", null));
        private final SourceTable emergency = ed(row("V1", "P001", "2024-05-25", "ED_CODE", null));
        private final SourceTable episodeTable = episodes(
                row("E1", "P001", "2024-06-01", "inp"),
                row("E2", "P001", "2024-06-02", "ed"));

        @Test
        @DisplayName("INP_IGNORE_ED should skip emergency visits for inpatient episodes only")
        void testScenarioD() {
            ExtractionResult ignoring = extractor(30, FeatureMode.INP_IGNORE_ED).extract(episodeTable, inpatient, emergency);
            ExtractionResult both = extractor(30, FeatureMode.BOTH).extract(episodeTable, inpatient, emergency);

            assertThat(ignoring.codesFor("E1")).containsExactly("INP_CODE");
            assertThat(ignoring.codesFor("E2")).containsExactly("ED_CODE", "INP_CODE");
            assertThat(both.codesFor("E1")).containsExactly("ED_CODE", "INP_CODE");
            assertThat(both.codesFor("E2")).containsExactly("ED_CODE", "INP_CODE");
        }

        @Test
        @DisplayName("INP_ONLY should accept a missing emergency table")
        void testInpOnlyWithoutEmergencyTable() {
            ExtractionResult result = extractor(30, FeatureMode.INP_ONLY).extract(episodeTable, inpatient, null);

            assertThat(result.codesFor("E1")).containsExactly("INP_CODE");
            assertThat(result.codesFor("E2")).containsExactly("INP_CODE");
            assertThat(result.stats().recordsDropped()).containsOnlyKeys("dad");
        }

        @Test
        @DisplayName("Modes that query emergency visits should require the emergency table")
        void testEmergencyTableRequired() {
            assertThatThrownBy(() -> extractor(30, FeatureMode.BOTH).extract(episodeTable, inpatient, null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("both");
        }
    }

    @Nested
    @DisplayName("Input validation")
    class InputValidation {

        @Test
        @DisplayName("Should name the missing inpatient start column")
        void testMissingAdmitDate() {
            SourceTable inpatient = SourceTable.builder("dad")
                    .columns("episode_order", "PATID", "DISDATE_DT", "DXCODE1")
                    .row("D1", "P001", "2024-05-20", "I10")
                    .build();

            assertThatThrownBy(() -> extractor(30, FeatureMode.INP_ONLY)
                    .extract(episodes(row("E1", "P001", "2024-06-01", "inp")), inpatient, null))
                    .isInstanceOf(SchemaException.class)
                    .hasMessageContaining("ADMITDATE_DT")
                    .satisfies(e -> assertThat(((SchemaException) e).table()).isEqualTo("dad"));
        }

        @Test
        @DisplayName("Should name the missing inpatient discharge column")
        void testMissingDischargeDate() {
            SourceTable inpatient = SourceTable.builder("dad")
                    .columns("episode_order", "PATID", "ADMITDATE_DT", "DXCODE1")
                    .row("D1", "P001", "2024-05-20", "I10")
                    .build();

            assertThatThrownBy(() -> extractor(30, FeatureMode.INP_ONLY)
                    .extract(episodes(row("E1", "P001", "2024-06-01", "inp")), inpatient, null))
                    .isInstanceOf(SchemaException.class)
                    .hasMessageContaining("DISDATE_DT")
                    .satisfies(e -> assertThat(((SchemaException) e).missingColumns()).containsExactly("DISDATE_DT"));
        }

        @Test
        @DisplayName("Should name the missing inpatient record id column")
        void testMissingRecordIdColumn() {
            SourceTable inpatient = SourceTable.builder("dad")
                    .columns("PATID", "ADMITDATE_DT", "DISDATE_DT", "DXCODE1")
                    .row("P001", "2024-06-01", "2024-06-12", "SELF")
                    .build();

            assertThatThrownBy(() -> extractor(30, FeatureMode.INP_ONLY)
                    .extract(episodes(row("E1", "P001", "2024-06-10", "inp")), inpatient, null))
                    .isInstanceOf(SchemaException.class)
                    .hasMessageContaining("episode_order");
        }

        @Test
        @DisplayName("Inpatient rows with a missing or unparseable discharge date should be dropped and counted")
        void testDroppedInvalidDischarge() {
            SourceTable inpatient = dad(
                    row("D1", "P001", "2024-06-01", "garbage", "BAD_END", null),
                    row("D2", "P001", "2024-06-02", null, "NULL_END", null),
                    row("D3", "P001", "2024-06-03", "2024-06-04", "KEEP", null));

            ExtractionResult result = extractor(30, FeatureMode.INP_ONLY)
                    .extract(episodes(row("E1", "P001", "2024-06-10", "inp")), inpatient, null);

            assertThat(result.codesFor("E1")).containsExactly("KEEP");
            assertThat(result.stats().recordsDropped()).containsEntry("dad", 2);
            assertThat(metrics.getCounterValue("codehistory_records_dropped_total", "source", "dad")).isEqualTo(2);
        }

        @Test
        @DisplayName("Should name the missing episode start column")
        void testMissingStartDate() {
            SourceTable episodeTable = SourceTable.builder("episodes")
                    .columns("episode_order", "PATID")
                    .row("E1", "P001")
                    .build();

            assertThatThrownBy(() -> extractor(30, FeatureMode.INP_ONLY).extract(episodeTable, dad(), null))
                    .isInstanceOf(SchemaException.class)
                    .hasMessageContaining("start_date");
        }

        @Test
        @DisplayName("Episodes with unparseable start dates should be dropped and counted")
        void testDroppedEpisodes() {
            SourceTable episodeTable = episodes(
                    row("E1", "P001", "2024-06-01", "inp"),
                    row("E2", "P001", "not a date", "inp"),
                    row("E3", "P001", null, "inp"));

            ExtractionResult result = extractor(30, FeatureMode.INP_ONLY).extract(episodeTable, dad(), null);

            assertThat(result.records()).extracting(ResultRecord::episodeId).containsExactly("E1");
            assertThat(result.stats().episodesDropped()).isEqualTo(2);
            assertThat(metrics.getCounterValue("codehistory_episodes_dropped_total")).isEqualTo(2);
        }

        @Test
        @DisplayName("Should reject a lookback below one day")
        void testInvalidLookback() {
            assertThatThrownBy(() -> ExtractionConfig.builder().lookbackDays(0).build())
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Determinism")
    class Determinism {

        private SourceTable randomEpisodes;
        private SourceTable randomDad;
        private SourceTable randomEd;

        @BeforeEach
        void generate() {
            Random random = new Random(42);
            LocalDate base = LocalDate.of(2023, 1, 1);
            SourceTable.Builder episodeBuilder = SourceTable.builder("episodes")
                    .columns("episode_order", "PATID", "start_date", "type");
            SourceTable.Builder dadBuilder = SourceTable.builder("dad").columns(DAD_COLUMNS);
            SourceTable.Builder edBuilder = SourceTable.builder("ed").columns(ED_COLUMNS);
            for (int p = 0; p < 60; p++) {
                String patient = "P" + p;
                for (int e = 0; e < 1 + random.nextInt(4); e++) {
                    episodeBuilder.row(patient + "_" + e, patient, base.plusDays(random.nextInt(700)).toString(),
                            random.nextBoolean() ? "inp" : "ed");
                }
                for (int d = 0; d < random.nextInt(8); d++) {
                    LocalDate admit = base.plusDays(random.nextInt(700));
                    dadBuilder.row(patient + "_" + d, patient, admit.toString(),
                            admit.plusDays(random.nextInt(20)).toString(), "DX" + random.nextInt(30),
                            random.nextBoolean() ? "DX" + random.nextInt(30) : null);
                }
                for (int v = 0; v < random.nextInt(6); v++) {
                    edBuilder.row("V" + p + "_" + v, patient, base.plusDays(random.nextInt(700)).toString(),
                            "ED" + random.nextInt(20), null);
                }
            }
            randomEpisodes = episodeBuilder.build();
            randomDad = dadBuilder.build();
            randomEd = edBuilder.build();
        }

        @Test
        @DisplayName("Repeated runs over the same input should produce identical results")
        void testIdempotence() {
            DiagnosisCodeExtractor extractor = extractor(90, FeatureMode.INP_IGNORE_ED);

            ExtractionResult first = extractor.extract(randomEpisodes, randomDad, randomEd);
            ExtractionResult second = extractor.extract(randomEpisodes, randomDad, randomEd);

            assertThat(second.records()).isEqualTo(first.records());
        }

        @ParameterizedTest
        @EnumSource(MatchBackend.class)
        @DisplayName("Parallel matching should keep input order and equal the sequential result")
        void testParallelMatchesSequential(MatchBackend backend) {
            ExtractionConfig sequential = ExtractionConfig.builder()
                    .lookbackDays(90)
                    .featureMode(FeatureMode.BOTH)
                    .matchBackend(backend)
                    .build();
            ExtractionConfig parallel = sequential.toBuilder().parallelism(4).progressInterval(7).build();

            ExtractionResult expected = extractor(sequential).extract(randomEpisodes, randomDad, randomEd);
            ExtractionResult actual = extractor(parallel).extract(randomEpisodes, randomDad, randomEd);

            assertThat(actual.records()).isEqualTo(expected.records());
            List<String> inputOrder = new ArrayList<>();
            randomEpisodes.rows().forEach(r -> inputOrder.add((String) r.get("episode_order")));
            assertThat(actual.records()).extracting(ResultRecord::episodeId).containsExactlyElementsOf(inputOrder);
        }

        @Test
        @DisplayName("Both match backends should produce the same codes")
        void testBackendsAgree() {
            ExtractionConfig indexed = ExtractionConfig.builder().lookbackDays(120).featureMode(FeatureMode.BOTH).build();
            ExtractionConfig linear = indexed.toBuilder().matchBackend(MatchBackend.LINEAR_SCAN).build();

            assertThat(extractor(linear).extract(randomEpisodes, randomDad, randomEd).records())
                    .isEqualTo(extractor(indexed).extract(randomEpisodes, randomDad, randomEd).records());
        }
    }

    @Nested
    @DisplayName("Listener and metrics")
    class ListenerAndMetrics {

        private final SourceTable inpatient = dad(
                row("D1", "P001", "2024-05-20", "2024-05-22", "I10", null),
                row("D2", "P002", "2024-05-20", "2024-05-22", "E11", null));
        private final SourceTable episodeTable = episodes(
                row("E1", "P001", "2024-06-01", "inp"),
                row("E2", "P002", "2024-06-01", "inp"),
                row("E3", "P003", "2024-06-01", "inp"));

        @Test
        @DisplayName("Should report every stage and the final progress to the listener")
        void testListenerNotified() {
            ExtractionListener listener = mock(ExtractionListener.class);
            DiagnosisCodeExtractor extractor = extractor(30, FeatureMode.INP_ONLY);
            extractor.setExtractionListener(listener);

            extractor.extract(episodeTable, inpatient, null);

            verify(listener).onStageStart("EPISODES", 1, 3);
            verify(listener).onStageStart("INDEXING", 2, 3);
            verify(listener).onStageStart("MATCHING", 3, 3);
            verify(listener, times(3)).onStageComplete(anyString(), any(ExtractionListener.StageResult.class));
            verify(listener).onProgress(3, 3);
            verify(listener, never()).onError(anyString(), any());
        }

        @Test
        @DisplayName("Should report a failing stage before rethrowing")
        void testListenerNotifiedOfError() {
            ExtractionListener listener = mock(ExtractionListener.class);
            DiagnosisCodeExtractor extractor = extractor(30, FeatureMode.INP_ONLY);
            extractor.setExtractionListener(listener);
            SourceTable broken = SourceTable.builder("dad").columns("PATID").row("P001").build();

            assertThatThrownBy(() -> extractor.extract(episodeTable, broken, null)).isInstanceOf(SchemaException.class);

            verify(listener).onError(eq("INDEXING"), any(SchemaException.class));
            verify(listener, never()).onStageStart(eq("MATCHING"), anyInt(), anyInt());
        }

        @Test
        @DisplayName("A failing listener should not stop the extraction")
        void testFailingListener() {
            ExtractionListener listener = mock(ExtractionListener.class);
            doThrow(new IllegalStateException("listener down")).when(listener).onStageStart(anyString(), anyInt(), anyInt());
            DiagnosisCodeExtractor extractor = extractor(30, FeatureMode.INP_ONLY);
            extractor.setExtractionListener(listener);

            ExtractionResult result = extractor.extract(episodeTable, inpatient, null);

            assertThat(result.codesFor("E1")).containsExactly("I10");
        }

        @Test
        @DisplayName("Should fill stats, extractor metrics and registry metrics")
        void testStatsAndMetrics() {
            DiagnosisCodeExtractor extractor = extractor(30, FeatureMode.INP_ONLY);

            ExtractionResult result = extractor.extract(episodeTable, inpatient, null);

            assertThat(result.stats().episodesProcessed()).isEqualTo(3);
            assertThat(result.stats().episodesWithCodes()).isEqualTo(2);
            assertThat(result.stats().totalCodes()).isEqualTo(2);
            assertThat(result.stats().patients()).isEqualTo(3);
            assertThat(result.stats().recordsDropped()).containsEntry("dad", 0);

            assertThat(extractor.getMetrics().episodes()).isEqualTo(3);
            assertThat(extractor.getMetrics().recordsMatched()).isEqualTo(2);
            assertThat(extractor.getMetrics().getSnapshot()).containsEntry("emptyEpisodes", 1L);

            assertThat(metrics.getCounterValue("codehistory_episodes_processed_total", "kind", "diagnosis")).isEqualTo(3);
            assertThat(metrics.getCounterValue("codehistory_records_indexed_total", "source", "dad")).isEqualTo(2);
            assertThat(metrics.getTimerRecordings("codehistory_patient_batch_duration", "kind", "diagnosis")).hasSize(1);
        }

        @Test
        @DisplayName("Should accept pre-built episodes")
        void testEpisodeList() {
            List<Episode> list = List.of(
                    new Episode("E1", "P001", LocalDate.of(2024, 6, 1), "inp"),
                    new Episode("E2", " P002 ", LocalDate.of(2024, 6, 1)));

            ExtractionResult result = extractor(30, FeatureMode.BOTH).extract(list, inpatient, ed());

            assertThat(result.codesFor("E1")).containsExactly("I10");
            assertThat(result.codesFor("E2")).containsExactly("E11");
        }

        @Test
        @DisplayName("Should reject duplicate episode ids")
        void testDuplicateEpisodeIds() {
            List<Episode> list = List.of(
                    new Episode("E1", "P001", LocalDate.of(2024, 6, 1)),
                    new Episode("E1", "P001", LocalDate.of(2024, 7, 1)));

            assertThatThrownBy(() -> extractor(30, FeatureMode.INP_ONLY).extract(list, inpatient, null))
                    .isInstanceOf(SchemaException.class)
                    .hasMessageContaining("E1");
        }
    }
}
