/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.core.extraction;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Per-extractor counters for matching work.
 *
 * <p>Lock-free (LongAdder) so worker threads record without contention. Latency
 * percentiles are approximated with a fixed-bucket histogram.
 */
public final class ExtractorMetrics {

    private final LongAdder episodes = new LongAdder();
    private final LongAdder episodeTimeNanos = new LongAdder();
    private final LongAdder candidatesExamined = new LongAdder();
    private final LongAdder recordsMatched = new LongAdder();
    private final LongAdder codesEmitted = new LongAdder();
    private final LongAdder emptyEpisodes = new LongAdder();

    private final LatencyHistogram latencyHistogram = new LatencyHistogram();

    public void recordEpisode(long latencyNanos, int examined, int matched, int codes) {
        episodes.increment();
        episodeTimeNanos.add(latencyNanos);
        candidatesExamined.add(examined);
        recordsMatched.add(matched);
        codesEmitted.add(codes);
        if (codes == 0) {
            emptyEpisodes.increment();
        }
        latencyHistogram.record(latencyNanos);
    }

    public long episodes() {
        return episodes.sum();
    }

    public long candidatesExamined() {
        return candidatesExamined.sum();
    }

    public long recordsMatched() {
        return recordsMatched.sum();
    }

    /**
     * Creates a new map on every call.
     */
    public Map<String, Object> getSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        long count = episodes.sum();
        long examined = candidatesExamined.sum();
        long matched = recordsMatched.sum();

        snapshot.put("episodes", count);
        snapshot.put("emptyEpisodes", emptyEpisodes.sum());
        snapshot.put("avgEpisodeTimeNanos", count > 0 ? episodeTimeNanos.sum() / count : 0);
        snapshot.put("avgCandidatesPerEpisode", count > 0 ? (double) examined / count : 0.0);
        snapshot.put("avgMatchesPerEpisode", count > 0 ? (double) matched / count : 0.0);
        snapshot.put("avgCodesPerEpisode", count > 0 ? (double) codesEmitted.sum() / count : 0.0);
        snapshot.put("candidateHitRate", examined > 0 ? (double) matched / examined * 100.0 : 0.0);
        snapshot.put("p50LatencyNanos", latencyHistogram.getPercentile(0.50));
        snapshot.put("p95LatencyNanos", latencyHistogram.getPercentile(0.95));
        snapshot.put("p99LatencyNanos", latencyHistogram.getPercentile(0.99));
        return snapshot;
    }

    /**
     * Fixed buckets up to 1ms; per-episode matching is expected to stay well below.
     */
    private static class LatencyHistogram {
        private static final int NUM_BUCKETS = 100;
        private static final long MAX_LATENCY_NANOS = 1_000_000;
        private final LongAdder[] buckets = new LongAdder[NUM_BUCKETS];
        private final LongAdder overflow = new LongAdder();

        LatencyHistogram() {
            for (int i = 0; i < NUM_BUCKETS; i++) {
                buckets[i] = new LongAdder();
            }
        }

        void record(long latencyNanos) {
            if (latencyNanos >= MAX_LATENCY_NANOS) {
                overflow.increment();
                return;
            }
            int bucket = (int) (latencyNanos * NUM_BUCKETS / MAX_LATENCY_NANOS);
            buckets[Math.min(bucket, NUM_BUCKETS - 1)].increment();
        }

        long getPercentile(double percentile) {
            long total = overflow.sum();
            for (LongAdder bucket : buckets) {
                total += bucket.sum();
            }
            if (total == 0) {
                return 0;
            }

            long target = (long) Math.ceil(total * percentile);
            long cumulative = 0;
            for (int i = 0; i < NUM_BUCKETS; i++) {
                cumulative += buckets[i].sum();
                if (cumulative >= target) {
                    return (long) ((i + 0.5) * MAX_LATENCY_NANOS / NUM_BUCKETS);
                }
            }
            return MAX_LATENCY_NANOS;
        }
    }
}
