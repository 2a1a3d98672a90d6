/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.core.matching;

import com.meridian.codehistory.api.model.Window;
import com.meridian.codehistory.core.index.PatientPartition;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Matcher that narrows the partition with a lower-bound search on interval end and
 * filters the remaining suffix with the exact predicate.
 *
 * <p>The search only guarantees {@code end >= windowStart}; records in the suffix may still
 * start after the window and are rejected by the predicate. For point partitions the
 * suffix is also ordered by start, so the scan stops at the first record past the window.
 */
public final class BinarySearchIntervalMatcher implements IntervalMatcher {

    public static final BinarySearchIntervalMatcher INSTANCE = new BinarySearchIntervalMatcher();

    @Override
    public int match(PatientPartition partition, Window window, String episodeId,
                     MatchPredicate predicate, IntList out) {
        if (partition.isEmpty()) {
            return 0;
        }
        long windowStart = window.startEpochDay();
        long windowEnd = window.endEpochDay();
        boolean ordered = partition.isPointPartition();

        int examined = 0;
        int size = partition.size();
        for (int i = partition.firstEndingOnOrAfter(windowStart); i < size; i++) {
            examined++;
            long start = partition.start(i);
            if (ordered && start > windowEnd) {
                break;
            }
            if (!predicate.test(start, partition.end(i), windowStart, windowEnd)) {
                continue;
            }
            if (episodeId != null && episodeId.equals(partition.recordId(i))) {
                continue;
            }
            out.add(i);
        }
        return examined;
    }
}
