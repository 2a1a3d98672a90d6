/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.core.index;

/**
 * All records of one patient from one source, sorted ascending by interval end.
 *
 * <p>Structure-of-arrays layout: record {@code i} is {@code starts[i]}, {@code ends[i]}
 * (epoch days), {@code recordIds[i]} and {@code codeIds[i]}. Instances are immutable
 * once built and safe to share across threads.
 */
public final class PatientPartition {

    public static final PatientPartition EMPTY =
            new PatientPartition(new long[0], new long[0], new String[0], new int[0][], null, false);

    private final long[] starts;
    private final long[] ends;
    private final String[] recordIds;
    private final int[][] codeIds;
    private final long[][] occurrenceDays;
    private final boolean pointPartition;

    PatientPartition(long[] starts, long[] ends, String[] recordIds, int[][] codeIds,
                     long[][] occurrenceDays, boolean pointPartition) {
        this.starts = starts;
        this.ends = ends;
        this.recordIds = recordIds;
        this.codeIds = codeIds;
        this.occurrenceDays = occurrenceDays;
        this.pointPartition = pointPartition;
    }

    public int size() {
        return ends.length;
    }

    public boolean isEmpty() {
        return ends.length == 0;
    }

    public long start(int i) {
        return starts[i];
    }

    public long end(int i) {
        return ends[i];
    }

    /**
     * @return the record id, or {@code null} if the source had none
     */
    public String recordId(int i) {
        return recordIds[i];
    }

    public int codeCount(int i) {
        return codeIds[i].length;
    }

    public int codeId(int i, int j) {
        return codeIds[i][j];
    }

    public boolean hasOccurrences() {
        return occurrenceDays != null;
    }

    public long occurrenceDay(int i, int j) {
        return occurrenceDays != null ? occurrenceDays[i][j] : starts[i];
    }

    /**
     * True when every record is a single day, so ends are also sorted starts.
     */
    public boolean isPointPartition() {
        return pointPartition;
    }

    /**
     * Lower bound on interval end.
     *
     * @return the first index whose end is {@code >= day}, or {@link #size()} if none
     */
    public int firstEndingOnOrAfter(long day) {
        int low = 0;
        int high = ends.length;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (ends[mid] < day) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }
}
