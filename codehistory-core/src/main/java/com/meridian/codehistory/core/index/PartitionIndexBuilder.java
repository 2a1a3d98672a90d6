/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.core.index;

import com.meridian.codehistory.api.model.CodeOccurrence;
import com.meridian.codehistory.api.model.SourceRecord;
import com.meridian.codehistory.infra.metrics.MetricsRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenHashMap;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Builds a {@link PatientPartitionIndex} from source records.
 *
 * <p>Records are sorted by {@code (intervalStart, intervalEnd)}, grouped by patient with
 * order preserved, and each group is then stably re-sorted by {@code intervalEnd}. Codes
 * are encoded through a {@link CodeDictionary} that may be shared between sources.
 */
public final class PartitionIndexBuilder {
    private static final Logger logger = Logger.getLogger(PartitionIndexBuilder.class.getName());

    private static final Comparator<SourceRecord> BY_START_THEN_END = Comparator
            .comparing(SourceRecord::intervalStart)
            .thenComparing(SourceRecord::intervalEnd);

    private final Tracer tracer;
    private final MetricsRegistry metrics;

    public PartitionIndexBuilder(Tracer tracer, MetricsRegistry metrics) {
        this.tracer = tracer;
        this.metrics = metrics;
    }

    /**
     * @param source            label used in logs and metric tags
     * @param records           valid records of the source
     * @param dictionary        dictionary containing every code of {@code records}
     * @param droppedRecords    rows rejected before indexing, reported in the stats
     * @param retainOccurrences keep per-code occurrence days (procedure extraction)
     */
    public PatientPartitionIndex build(String source, List<SourceRecord> records, CodeDictionary dictionary,
                                       int droppedRecords, boolean retainOccurrences) {
        Span span = tracer.spanBuilder("build-partition-index").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long startTime = System.nanoTime();
            span.setAttribute("source", source);
            span.setAttribute("recordCount", records.size());

            List<SourceRecord> sorted = new ArrayList<>(records);
            sorted.sort(BY_START_THEN_END);

            Object2ObjectLinkedOpenHashMap<String, IntArrayList> groups = new Object2ObjectLinkedOpenHashMap<>();
            for (int i = 0; i < sorted.size(); i++) {
                String patientId = sorted.get(i).patientId();
                IntArrayList group = groups.get(patientId);
                if (group == null) {
                    group = new IntArrayList();
                    groups.put(patientId, group);
                }
                group.add(i);
            }

            Map<String, PatientPartition> partitions = new HashMap<>(groups.size() * 2);
            int maxPartitionSize = 0;
            for (Map.Entry<String, IntArrayList> entry : groups.entrySet()) {
                PatientPartition partition = buildPartition(sorted, entry.getValue().toIntArray(),
                        dictionary, retainOccurrences);
                partitions.put(entry.getKey(), partition);
                maxPartitionSize = Math.max(maxPartitionSize, partition.size());
            }

            long buildTime = System.nanoTime() - startTime;
            IndexStats stats = new IndexStats(source, records.size(), droppedRecords, partitions.size(),
                    maxPartitionSize, buildTime);

            metrics.counter("codehistory_records_indexed_total", "source", source).increment(records.size());
            metrics.counter("codehistory_records_dropped_total", "source", source).increment(droppedRecords);
            metrics.gauge("codehistory_partition_count", "source", source).set(partitions.size());

            span.setAttribute("patientCount", partitions.size());
            span.setAttribute("maxPartitionSize", maxPartitionSize);
            logger.info(String.format("Indexed %d '%s' records for %d patients in %d ms (dropped %d, largest partition %d)",
                    records.size(), source, partitions.size(), stats.buildTimeMillis(), droppedRecords, maxPartitionSize));

            return new PatientPartitionIndex(source, partitions, dictionary, stats);
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private static PatientPartition buildPartition(List<SourceRecord> sorted, int[] positions,
                                                   CodeDictionary dictionary, boolean retainOccurrences) {
        // Stable: ties on end keep (start, end) order.
        IntArrays.mergeSort(positions, (a, b) -> sorted.get(a).intervalEnd().compareTo(sorted.get(b).intervalEnd()));

        int n = positions.length;
        long[] starts = new long[n];
        long[] ends = new long[n];
        String[] recordIds = new String[n];
        int[][] codeIds = new int[n][];
        long[][] occurrenceDays = retainOccurrences ? new long[n][] : null;
        boolean point = true;

        for (int i = 0; i < n; i++) {
            SourceRecord record = sorted.get(positions[i]);
            starts[i] = record.intervalStart().toEpochDay();
            ends[i] = record.intervalEnd().toEpochDay();
            point &= starts[i] == ends[i];
            recordIds[i] = record.recordId();

            List<CodeOccurrence> codes = record.codes();
            int[] ids = new int[codes.size()];
            long[] days = retainOccurrences ? new long[codes.size()] : null;
            for (int j = 0; j < ids.length; j++) {
                CodeOccurrence occurrence = codes.get(j);
                int id = dictionary.id(occurrence.code());
                if (id < 0) {
                    throw new IllegalArgumentException("Code '" + occurrence.code() + "' of record '"
                            + record.recordId() + "' is not in the dictionary");
                }
                ids[j] = id;
                if (days != null) {
                    days[j] = occurrence.occurredOn().toEpochDay();
                }
            }
            codeIds[i] = ids;
            if (occurrenceDays != null) {
                occurrenceDays[i] = days;
            }
        }
        return new PatientPartition(starts, ends, recordIds, codeIds, occurrenceDays, point);
    }
}
