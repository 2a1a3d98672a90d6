/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.benchmark;

import com.meridian.codehistory.api.model.ExtractionResult;
import com.meridian.codehistory.api.model.FeatureMode;
import com.meridian.codehistory.api.model.MatchBackend;
import com.meridian.codehistory.api.model.SourceRecord;
import com.meridian.codehistory.api.model.SourceTable;
import com.meridian.codehistory.api.model.Window;
import com.meridian.codehistory.core.config.ExtractionConfig;
import com.meridian.codehistory.core.extraction.DiagnosisCodeExtractor;
import com.meridian.codehistory.core.index.CodeDictionary;
import com.meridian.codehistory.core.index.PartitionIndexBuilder;
import com.meridian.codehistory.core.index.PatientPartition;
import com.meridian.codehistory.core.index.PatientPartitionIndex;
import com.meridian.codehistory.core.matching.IntervalMatcher;
import com.meridian.codehistory.core.matching.IntervalMatchers;
import com.meridian.codehistory.core.matching.MatchPredicate;
import com.meridian.codehistory.core.window.WindowResolver;
import com.meridian.codehistory.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;
import org.openjdk.jmh.runner.options.TimeValue;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Compares the indexed and linear-scan match backends.
 * <p>
 * {@code matchWindow} measures a single window query against one patient's partition, so the
 * gap between backends grows with {@code recordsPerPatient}. {@code extractDiagnoses} runs a
 * whole diagnosis extraction over synthetic episode, inpatient and emergency tables.
 * <p>
 * USAGE:
 * <pre>
 * mvn clean package -pl codehistory-benchmarks -am -DskipTests
 * java -cp codehistory-benchmarks/target/classes:... com.meridian.codehistory.benchmark.WindowMatchBenchmark
 * </pre>
 * Pass {@code -Dbench.quick=true} for a short run.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms2g", "-Xmx2g", "-XX:+UseG1GC"})
@Warmup(iterations = 5, time = 2)
@Measurement(iterations = 10, time = 3)
public class WindowMatchBenchmark {

    private static final boolean QUICK_MODE = Boolean.getBoolean("bench.quick");
    private static final LocalDate BASE = LocalDate.of(2015, 1, 1);
    private static final int HISTORY_DAYS = 3650;
    private static final int QUERY_POOL = 4096;
    private static final Tracer NOOP_TRACER = OpenTelemetry.noop().getTracer("noop");

    @Param({"INDEXED", "LINEAR_SCAN"})
    private MatchBackend backend;

    @Param({"50", "500", "5000"})
    private int recordsPerPatient;

    @Param({"30", "365"})
    private int lookbackDays;

    private IntervalMatcher matcher;
    private PatientPartition partition;
    private Window[] windows;
    private int next;
    private final IntArrayList matches = new IntArrayList();

    private DiagnosisCodeExtractor extractor;
    private SourceTable episodes;
    private SourceTable inpatient;
    private SourceTable emergency;

    @Setup(Level.Trial)
    public void setupTrial() {
        java.util.logging.Logger.getLogger("com.meridian.codehistory")
                .setLevel(java.util.logging.Level.WARNING);
        Random random = new Random(42);

        List<SourceRecord> records = new ArrayList<>(recordsPerPatient);
        for (int i = 0; i < recordsPerPatient; i++) {
            LocalDate admit = BASE.plusDays(random.nextInt(HISTORY_DAYS));
            records.add(SourceRecord.ofCodes("R" + i, "P0", admit, admit.plusDays(random.nextInt(14)),
                    List.of("DX" + random.nextInt(500))));
        }
        PatientPartitionIndex index = new PartitionIndexBuilder(NOOP_TRACER, new InMemoryMetricsRegistry())
                .build("dad", records, CodeDictionary.fromRecords(List.of(records)), 0, false);
        partition = index.partitionFor("P0");
        matcher = IntervalMatchers.forBackend(backend);

        windows = new Window[QUERY_POOL];
        for (int i = 0; i < QUERY_POOL; i++) {
            windows[i] = WindowResolver.resolve(BASE.plusDays(random.nextInt(HISTORY_DAYS + 30)), lookbackDays);
        }

        buildTables(random);
        extractor = new DiagnosisCodeExtractor(ExtractionConfig.builder()
                .lookbackDays(lookbackDays)
                .featureMode(FeatureMode.BOTH)
                .matchBackend(backend)
                .build(), NOOP_TRACER, new InMemoryMetricsRegistry());
    }

    private void buildTables(Random random) {
        int patients = 200;
        int episodesPerPatient = 20;
        int visitsPerPatient = Math.max(1, recordsPerPatient / 5);

        SourceTable.Builder episodeTable = SourceTable.builder("episodes")
                .columns("episode_order", "PATID", "start_date", "type");
        SourceTable.Builder dadTable = SourceTable.builder("dad")
                .columns("episode_order", "PATID", "ADMITDATE_DT", "DISDATE_DT", "DXCODE1", "DXCODE2");
        SourceTable.Builder edTable = SourceTable.builder("ed")
                .columns("episode_order", "PATID", "VISIT_DATE_DT", "DXCODE1");
        for (int p = 0; p < patients; p++) {
            String patient = "P" + p;
            for (int e = 0; e < episodesPerPatient; e++) {
                episodeTable.row(patient + "_" + e, patient, BASE.plusDays(random.nextInt(HISTORY_DAYS)),
                        random.nextInt(3) == 0 ? "inp" : "ed");
            }
            for (int d = 0; d < recordsPerPatient / 10; d++) {
                LocalDate admit = BASE.plusDays(random.nextInt(HISTORY_DAYS));
                dadTable.row(patient + "_d" + d, patient, admit, admit.plusDays(random.nextInt(14)),
                        "DX" + random.nextInt(500), "DX" + random.nextInt(500));
            }
            for (int v = 0; v < visitsPerPatient; v++) {
                edTable.row(patient + "_v" + v, patient, BASE.plusDays(random.nextInt(HISTORY_DAYS)),
                        "DX" + random.nextInt(500));
            }
        }
        episodes = episodeTable.build();
        inpatient = dadTable.build();
        emergency = edTable.build();
    }

    @Benchmark
    public int matchWindow() {
        Window window = windows[next++ & (QUERY_POOL - 1)];
        matches.clear();
        matcher.match(partition, window, null, MatchPredicate.INTERVAL_OVERLAP, matches);
        return matches.size();
    }

    @Benchmark
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public void extractDiagnoses(Blackhole bh) {
        ExtractionResult result = extractor.extract(episodes, inpatient, emergency);
        bh.consume(result.stats().totalCodes());
    }

    public static void main(String[] args) throws RunnerException {
        Options options = new OptionsBuilder()
                .include(WindowMatchBenchmark.class.getSimpleName())
                .warmupIterations(QUICK_MODE ? 2 : 5)
                .warmupTime(TimeValue.seconds(QUICK_MODE ? 1 : 2))
                .measurementIterations(QUICK_MODE ? 3 : 10)
                .measurementTime(TimeValue.seconds(QUICK_MODE ? 1 : 3))
                .shouldFailOnError(true)
                .build();
        new Runner(options).run();
    }
}
