/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.core.index;

public record IndexStats(
        String source,
        int recordsIndexed,
        int recordsDropped,
        int patients,
        int maxPartitionSize,
        long buildTimeNanos
) {
    public long buildTimeMillis() {
        return buildTimeNanos / 1_000_000;
    }
}
