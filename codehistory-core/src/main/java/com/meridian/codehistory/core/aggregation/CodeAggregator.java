/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.core.aggregation;

import com.meridian.codehistory.api.model.CodeOccurrence;
import com.meridian.codehistory.core.index.CodeDictionary;
import com.meridian.codehistory.core.index.PatientPartition;
import it.unimi.dsi.fastutil.ints.Int2LongOpenHashMap;
import org.roaringbitmap.IntIterator;
import org.roaringbitmap.RoaringBitmap;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Unions the codes of matched records for one episode at a time.
 *
 * <p>Codes are collected as dictionary ids in a {@link RoaringBitmap}; since ids follow
 * lexicographic code order, iterating the bitmap yields the sorted, de-duplicated code
 * list. Not thread-safe: use one instance per worker and {@link #reset()} between episodes.
 */
public final class CodeAggregator {

    private final CodeDictionary dictionary;
    private final boolean trackOccurrences;
    private final RoaringBitmap codeIds = new RoaringBitmap();
    private final Int2LongOpenHashMap latestOccurrence;
    private int matchedRecords;

    public CodeAggregator(CodeDictionary dictionary, boolean trackOccurrences) {
        this.dictionary = dictionary;
        this.trackOccurrences = trackOccurrences;
        this.latestOccurrence = trackOccurrences ? new Int2LongOpenHashMap() : null;
        if (latestOccurrence != null) {
            latestOccurrence.defaultReturnValue(Long.MIN_VALUE);
        }
    }

    public void reset() {
        codeIds.clear();
        if (latestOccurrence != null) {
            latestOccurrence.clear();
        }
        matchedRecords = 0;
    }

    /**
     * Adds every code of the record at {@code position}.
     */
    public void add(PatientPartition partition, int position) {
        matchedRecords++;
        int count = partition.codeCount(position);
        for (int j = 0; j < count; j++) {
            int id = partition.codeId(position, j);
            codeIds.add(id);
            if (trackOccurrences) {
                long day = partition.occurrenceDay(position, j);
                if (day > latestOccurrence.get(id)) {
                    latestOccurrence.put(id, day);
                }
            }
        }
    }

    public int matchedRecords() {
        return matchedRecords;
    }

    public int distinctCodes() {
        return codeIds.getCardinality();
    }

    public List<String> sortedCodes() {
        List<String> codes = new ArrayList<>(codeIds.getCardinality());
        IntIterator it = codeIds.getIntIterator();
        while (it.hasNext()) {
            codes.add(dictionary.code(it.next()));
        }
        return codes;
    }

    /**
     * Latest occurrence of every aggregated code, ordered by code. Empty unless occurrence
     * tracking is enabled.
     */
    public List<CodeOccurrence> latestOccurrences() {
        if (!trackOccurrences) {
            return List.of();
        }
        List<CodeOccurrence> occurrences = new ArrayList<>(codeIds.getCardinality());
        IntIterator it = codeIds.getIntIterator();
        while (it.hasNext()) {
            int id = it.next();
            occurrences.add(new CodeOccurrence(dictionary.code(id), LocalDate.ofEpochDay(latestOccurrence.get(id))));
        }
        return occurrences;
    }
}
