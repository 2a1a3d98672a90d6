/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.api.model;

import java.util.Map;

/**
 * Aggregated statistics for one extraction run.
 *
 * @param episodesProcessed  episodes that produced a result row
 * @param episodesWithCodes  result rows with at least one code
 * @param totalCodes         sum of result code list sizes
 * @param patients           distinct patients among processed episodes
 * @param episodesDropped    episodes excluded before matching (unparseable start date)
 * @param recordsDropped     encounter rows dropped per source (unparseable dates, blank patient)
 * @param elapsedNanos       wall time of the whole run
 */
public record ExtractionStats(
        int episodesProcessed,
        int episodesWithCodes,
        long totalCodes,
        int patients,
        int episodesDropped,
        Map<String, Integer> recordsDropped,
        long elapsedNanos
) {
    public ExtractionStats {
        recordsDropped = recordsDropped == null ? Map.of() : Map.copyOf(recordsDropped);
    }

    public static ExtractionStats empty() {
        return new ExtractionStats(0, 0, 0, 0, 0, Map.of(), 0);
    }

    public double averageCodesPerEpisode() {
        return episodesProcessed > 0 ? (double) totalCodes / episodesProcessed : 0.0;
    }

    public double episodesWithCodesPercent() {
        return episodesProcessed > 0 ? episodesWithCodes * 100.0 / episodesProcessed : 0.0;
    }

    public long elapsedMillis() {
        return elapsedNanos / 1_000_000;
    }
}
