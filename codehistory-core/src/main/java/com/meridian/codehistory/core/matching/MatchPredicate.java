/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.core.matching;

/**
 * Exact inclusion test of a record against a window, on epoch days.
 */
public enum MatchPredicate {

    /** {@code start <= windowEnd && end >= windowStart}. */
    INTERVAL_OVERLAP {
        @Override
        public boolean test(long start, long end, long windowStart, long windowEnd) {
            return start <= windowEnd && end >= windowStart;
        }
    },

    /** {@code windowStart <= timestamp <= windowEnd}; the record's start is its timestamp. */
    POINT_IN_WINDOW {
        @Override
        public boolean test(long start, long end, long windowStart, long windowEnd) {
            return start >= windowStart && start <= windowEnd;
        }
    };

    public abstract boolean test(long start, long end, long windowStart, long windowEnd);
}
