/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.core.extraction;

import com.meridian.codehistory.api.ExtractionListener;
import com.meridian.codehistory.api.exceptions.ExtractionException;
import com.meridian.codehistory.api.exceptions.SchemaException;
import com.meridian.codehistory.api.model.Episode;
import com.meridian.codehistory.api.model.ExtractionKind;
import com.meridian.codehistory.api.model.ExtractionResult;
import com.meridian.codehistory.api.model.ExtractionStats;
import com.meridian.codehistory.api.model.ResultRecord;
import com.meridian.codehistory.api.model.SourceRecord;
import com.meridian.codehistory.api.model.SourceTable;
import com.meridian.codehistory.api.model.Window;
import com.meridian.codehistory.core.aggregation.CodeAggregator;
import com.meridian.codehistory.core.config.ExtractionConfig;
import com.meridian.codehistory.core.index.CodeDictionary;
import com.meridian.codehistory.core.index.PartitionIndexBuilder;
import com.meridian.codehistory.core.index.PatientPartition;
import com.meridian.codehistory.core.index.PatientPartitionIndex;
import com.meridian.codehistory.core.matching.IntervalMatcher;
import com.meridian.codehistory.core.matching.IntervalMatchers;
import com.meridian.codehistory.core.matching.MatchPredicate;
import com.meridian.codehistory.core.preprocess.PatientIds;
import com.meridian.codehistory.core.preprocess.SourceRecordReader;
import com.meridian.codehistory.core.schema.SourceSchema;
import com.meridian.codehistory.core.window.WindowResolver;
import com.meridian.codehistory.infra.metrics.MetricsRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenHashMap;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Shared three-stage pipeline of the code extractors.
 *
 * <ol>
 *   <li>EPISODES: read and validate episodes</li>
 *   <li>INDEXING: build one {@link PatientPartitionIndex} per source (subclass)</li>
 *   <li>MATCHING: group episodes by patient, resolve each window, match it against the
 *       patient's partitions and aggregate codes</li>
 * </ol>
 *
 * <p>Results keep episode input order regardless of parallelism: every worker writes its
 * rows by episode position.
 */
public abstract class AbstractCodeExtractor {
    private static final Logger logger = Logger.getLogger(AbstractCodeExtractor.class.getName());

    static final String STAGE_EPISODES = "EPISODES";
    static final String STAGE_INDEXING = "INDEXING";
    static final String STAGE_MATCHING = "MATCHING";
    private static final int TOTAL_STAGES = 3;

    /**
     * An indexed source and the predicate its records are matched with.
     */
    protected record IndexedSource(PatientPartitionIndex index, MatchPredicate predicate, boolean point) {
        String name() {
            return index.source();
        }
    }

    /**
     * Sources built by the INDEXING stage, with the dictionary they share.
     */
    protected record IndexedSources(List<IndexedSource> sources, CodeDictionary dictionary) {
    }

    protected final ExtractionConfig config;
    protected final Tracer tracer;
    protected final MetricsRegistry metrics;
    protected final SourceRecordReader recordReader;
    protected final PartitionIndexBuilder indexBuilder;
    private final EpisodeTableReader episodeReader = new EpisodeTableReader();
    private final IntervalMatcher matcher;
    private final ExtractorMetrics extractorMetrics = new ExtractorMetrics();
    private volatile ExtractionListener listener = ExtractionListener.NO_OP;

    protected AbstractCodeExtractor(ExtractionConfig config, Tracer tracer, MetricsRegistry metrics) {
        this.config = Objects.requireNonNull(config, "config");
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.recordReader = new SourceRecordReader();
        this.indexBuilder = new PartitionIndexBuilder(tracer, metrics);
        this.matcher = IntervalMatchers.forBackend(config.matchBackend());
    }

    protected abstract ExtractionKind kind();

    /**
     * Whether {@code source} is queried for {@code episode}.
     */
    protected abstract boolean participates(Episode episode, IndexedSource source);

    protected abstract boolean tracksOccurrences();

    public void setExtractionListener(ExtractionListener listener) {
        this.listener = listener != null ? listener : ExtractionListener.NO_OP;
    }

    public ExtractorMetrics getMetrics() {
        return extractorMetrics;
    }

    public ExtractionConfig getConfig() {
        return config;
    }

    protected SourceRecordReader.ReadResult readSource(SourceTable table, SourceSchema schema) {
        return recordReader.read(table, schema);
    }

    protected IndexedSource index(String source, SourceRecordReader.ReadResult read, CodeDictionary dictionary,
                                  MatchPredicate predicate, boolean point) {
        PatientPartitionIndex index = indexBuilder.build(source, read.records(), dictionary, read.dropped(),
                tracksOccurrences());
        return new IndexedSource(index, predicate, point);
    }

    protected static CodeDictionary dictionaryFor(List<SourceRecordReader.ReadResult> reads) {
        List<List<SourceRecord>> all = new ArrayList<>(reads.size());
        for (SourceRecordReader.ReadResult read : reads) {
            all.add(read.records());
        }
        return CodeDictionary.fromRecords(all);
    }

    protected final ExtractionResult run(SourceTable episodeTable, Supplier<IndexedSources> indexing) {
        Objects.requireNonNull(episodeTable, "episodeTable");
        return execute(() -> episodeReader.read(episodeTable, config.episodeSchema(),
                config.deriveEpisodePatientId()), indexing);
    }

    protected final ExtractionResult run(List<Episode> episodes, Supplier<IndexedSources> indexing) {
        Objects.requireNonNull(episodes, "episodes");
        return execute(() -> {
            EpisodeTableReader.requireUniqueIds(episodes);
            return new EpisodeTableReader.EpisodeReadResult(List.copyOf(episodes), 0, 0);
        }, indexing);
    }

    private ExtractionResult execute(Supplier<EpisodeTableReader.EpisodeReadResult> episodeStage,
                                     Supplier<IndexedSources> indexing) {
        String kindTag = kind().tag();
        Span span = tracer.spanBuilder("extract-" + kindTag + "-codes").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long startTime = System.nanoTime();
            span.setAttribute("lookbackDays", config.lookbackDays());
            span.setAttribute("matchBackend", config.matchBackend().name());
            span.setAttribute("parallelism", config.parallelism());

            EpisodeTableReader.EpisodeReadResult episodeRead = stage(STAGE_EPISODES, 1, episodeStage,
                    r -> Map.of("episodes", r.episodes().size(), "dropped", r.dropped()));
            List<Episode> episodes = episodeRead.episodes();
            if (episodeRead.dropped() > 0) {
                metrics.counter("codehistory_episodes_dropped_total").increment(episodeRead.dropped());
            }

            IndexedSources sources = stage(STAGE_INDEXING, 2, indexing, this::indexingMetrics);

            MatchOutcome outcome = stage(STAGE_MATCHING, 3, () -> matchAll(episodes, sources),
                    o -> Map.of("patients", o.patients, "episodesWithCodes", o.episodesWithCodes,
                            "totalCodes", o.totalCodes));

            Map<String, Integer> recordsDropped = new LinkedHashMap<>();
            for (IndexedSource source : sources.sources()) {
                recordsDropped.put(source.name(), source.index().stats().recordsDropped());
            }
            ExtractionStats stats = new ExtractionStats(episodes.size(), outcome.episodesWithCodes,
                    outcome.totalCodes, outcome.patients, episodeRead.dropped(), recordsDropped,
                    System.nanoTime() - startTime);

            metrics.counter("codehistory_episodes_processed_total", "kind", kindTag).increment(episodes.size());
            span.setAttribute("episodeCount", episodes.size());
            span.setAttribute("episodesWithCodes", stats.episodesWithCodes());
            logSummary(stats);

            return new ExtractionResult(Arrays.asList(outcome.results), stats);
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private Map<String, Object> indexingMetrics(IndexedSources sources) {
        Map<String, Object> stageMetrics = new LinkedHashMap<>();
        stageMetrics.put("dictionarySize", sources.dictionary().size());
        for (IndexedSource source : sources.sources()) {
            stageMetrics.put(source.name() + "RecordsIndexed", source.index().stats().recordsIndexed());
            stageMetrics.put(source.name() + "Patients", source.index().stats().patients());
        }
        return stageMetrics;
    }

    private <T> T stage(String name, int number, Supplier<T> body,
                        Function<T, Map<String, Object>> stageMetrics) {
        notifyListener(() -> listener.onStageStart(name, number, TOTAL_STAGES));
        long start = System.nanoTime();
        T result;
        try {
            result = body.get();
        } catch (RuntimeException e) {
            notifyListener(() -> listener.onError(name, e));
            throw e;
        }
        ExtractionListener.StageResult stageResult =
                new ExtractionListener.StageResult(name, System.nanoTime() - start, stageMetrics.apply(result));
        notifyListener(() -> listener.onStageComplete(name, stageResult));
        return result;
    }

    private void notifyListener(Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Extraction listener failed", e);
        }
    }

    // ==================== Matching ====================

    private static final class MatchOutcome {
        final ResultRecord[] results;
        final int patients;
        final AtomicInteger episodesWithCodesCounter = new AtomicInteger();
        final AtomicLong totalCodesCounter = new AtomicLong();
        int episodesWithCodes;
        long totalCodes;

        MatchOutcome(int episodes, int patients) {
            this.results = new ResultRecord[episodes];
            this.patients = patients;
        }
    }

    /**
     * Episodes of one patient, as positions in the input list.
     */
    private record PatientGroup(String patientId, IntArrayList positions) {
    }

    private MatchOutcome matchAll(List<Episode> episodes, IndexedSources sources) {
        Object2ObjectLinkedOpenHashMap<String, IntArrayList> byPatient = new Object2ObjectLinkedOpenHashMap<>();
        for (int i = 0; i < episodes.size(); i++) {
            String patientId = PatientIds.normalize(episodes.get(i).patientId());
            IntArrayList positions = byPatient.get(patientId);
            if (positions == null) {
                positions = new IntArrayList(4);
                byPatient.put(patientId, positions);
            }
            positions.add(i);
        }
        List<PatientGroup> groups = new ArrayList<>(byPatient.size());
        byPatient.forEach((patientId, positions) -> groups.add(new PatientGroup(patientId, positions)));

        MatchOutcome outcome = new MatchOutcome(episodes.size(), groups.size());
        int batchSize = config.progressInterval();
        List<List<PatientGroup>> batches = new ArrayList<>();
        for (int from = 0; from < groups.size(); from += batchSize) {
            batches.add(groups.subList(from, Math.min(groups.size(), from + batchSize)));
        }

        AtomicInteger patientsDone = new AtomicInteger();
        if (config.parallelism() <= 1 || batches.size() <= 1) {
            for (List<PatientGroup> batch : batches) {
                matchBatch(batch, episodes, sources, outcome);
                reportProgress(patientsDone.addAndGet(batch.size()), groups.size());
            }
        } else {
            matchParallel(batches, episodes, sources, outcome, patientsDone, groups.size());
        }

        outcome.episodesWithCodes = outcome.episodesWithCodesCounter.get();
        outcome.totalCodes = outcome.totalCodesCounter.get();
        return outcome;
    }

    private void matchParallel(List<List<PatientGroup>> batches, List<Episode> episodes, IndexedSources sources,
                               MatchOutcome outcome, AtomicInteger patientsDone, int totalPatients) {
        ExecutorService executor = Executors.newFixedThreadPool(config.parallelism(), workerThreadFactory());
        try {
            List<Future<?>> futures = new ArrayList<>(batches.size());
            for (List<PatientGroup> batch : batches) {
                Callable<Void> task = () -> {
                    matchBatch(batch, episodes, sources, outcome);
                    reportProgress(patientsDone.addAndGet(batch.size()), totalPatients);
                    return null;
                };
                futures.add(executor.submit(Context.current().wrap(task)));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SchemaException || cause instanceof ExtractionException) {
                throw (RuntimeException) cause;
            }
            throw new ExtractionException("Matching worker failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExtractionException("Interrupted while matching episodes", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "codehistory-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private void matchBatch(List<PatientGroup> batch, List<Episode> episodes, IndexedSources sources,
                            MatchOutcome outcome) {
        Span span = tracer.spanBuilder("match-batch").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long batchStart = System.nanoTime();
            span.setAttribute("patientCount", batch.size());

            List<IndexedSource> sourceList = sources.sources();
            CodeAggregator aggregator = new CodeAggregator(sources.dictionary(), tracksOccurrences());
            IntArrayList matches = new IntArrayList();
            PatientPartition[] partitions = new PatientPartition[sourceList.size()];
            int withCodes = 0;
            long codes = 0;

            for (PatientGroup group : batch) {
                for (int s = 0; s < partitions.length; s++) {
                    partitions[s] = sourceList.get(s).index().partitionFor(group.patientId());
                }
                for (int k = 0; k < group.positions().size(); k++) {
                    int position = group.positions().getInt(k);
                    ResultRecord result = matchEpisode(episodes.get(position), sourceList, partitions, aggregator, matches);
                    outcome.results[position] = result;
                    if (result.hasCodes()) {
                        withCodes++;
                        codes += result.codes().size();
                    }
                }
            }

            outcome.episodesWithCodesCounter.addAndGet(withCodes);
            outcome.totalCodesCounter.addAndGet(codes);
            metrics.timer("codehistory_patient_batch_duration", "kind", kind().tag())
                    .recordNanos(System.nanoTime() - batchStart);
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private ResultRecord matchEpisode(Episode episode, List<IndexedSource> sources, PatientPartition[] partitions,
                                      CodeAggregator aggregator, IntArrayList matches) {
        long start = System.nanoTime();
        Window window = WindowResolver.resolve(episode.startDate(), config.lookbackDays());
        aggregator.reset();
        int examined = 0;

        for (int s = 0; s < partitions.length; s++) {
            IndexedSource source = sources.get(s);
            if (partitions[s].isEmpty() || !participates(episode, source)) {
                continue;
            }
            matches.clear();
            examined += matcher.match(partitions[s], window, episode.episodeId(), source.predicate(), matches);
            for (int m = 0; m < matches.size(); m++) {
                aggregator.add(partitions[s], matches.getInt(m));
            }
        }

        ResultRecord result = new ResultRecord(episode.episodeId(), episode.patientId(), episode.startDate(),
                aggregator.sortedCodes(), aggregator.latestOccurrences());
        extractorMetrics.recordEpisode(System.nanoTime() - start, examined, aggregator.matchedRecords(),
                result.codes().size());
        if (logger.isLoggable(Level.FINEST)) {
            logger.finest(String.format("Episode %s window %s: %d records, %d codes",
                    episode.episodeId(), window, aggregator.matchedRecords(), result.codes().size()));
        }
        return result;
    }

    private void reportProgress(int patientsDone, int totalPatients) {
        notifyListener(() -> listener.onProgress(patientsDone, totalPatients));
        logger.fine(() -> String.format("Matched %d/%d patients", patientsDone, totalPatients));
    }

    private void logSummary(ExtractionStats stats) {
        logger.info(String.format(
                "Extracted %s codes for %,d episodes of %,d patients in %d ms: %,d with codes (%.1f%%), %,d codes (avg %.2f per episode), %d episodes excluded, dropped records %s",
                kind().tag(), stats.episodesProcessed(), stats.patients(), stats.elapsedMillis(),
                stats.episodesWithCodes(), stats.episodesWithCodesPercent(), stats.totalCodes(),
                stats.averageCodesPerEpisode(), stats.episodesDropped(), stats.recordsDropped()));
    }
}
