/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.core.matching;

import com.meridian.codehistory.api.model.Window;
import com.meridian.codehistory.core.index.PatientPartition;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Reference matcher that tests every record of the partition.
 */
public final class LinearScanIntervalMatcher implements IntervalMatcher {

    public static final LinearScanIntervalMatcher INSTANCE = new LinearScanIntervalMatcher();

    @Override
    public int match(PatientPartition partition, Window window, String episodeId,
                     MatchPredicate predicate, IntList out) {
        long windowStart = window.startEpochDay();
        long windowEnd = window.endEpochDay();
        int size = partition.size();
        for (int i = 0; i < size; i++) {
            if (predicate.test(partition.start(i), partition.end(i), windowStart, windowEnd)
                    && (episodeId == null || !episodeId.equals(partition.recordId(i)))) {
                out.add(i);
            }
        }
        return size;
    }
}
