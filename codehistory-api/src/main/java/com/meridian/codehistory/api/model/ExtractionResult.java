/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.api.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Output table of an extraction run, keyed by episode ID.
 *
 * <p>Rows keep the order in which episodes were supplied.
 */
public final class ExtractionResult {

    private final List<ResultRecord> records;
    private final Map<String, ResultRecord> byEpisodeId;
    private final ExtractionStats stats;

    public ExtractionResult(List<ResultRecord> records, ExtractionStats stats) {
        this.records = List.copyOf(records);
        Map<String, ResultRecord> index = new LinkedHashMap<>(records.size() * 2);
        for (ResultRecord record : records) {
            index.put(record.episodeId(), record);
        }
        this.byEpisodeId = Collections.unmodifiableMap(index);
        this.stats = stats == null ? ExtractionStats.empty() : stats;
    }

    public List<ResultRecord> records() {
        return records;
    }

    public Optional<ResultRecord> get(String episodeId) {
        return Optional.ofNullable(byEpisodeId.get(episodeId));
    }

    /**
     * Returns the codes of an episode, or an empty list if the episode is unknown.
     */
    public List<String> codesFor(String episodeId) {
        ResultRecord record = byEpisodeId.get(episodeId);
        return record != null ? record.codes() : List.of();
    }

    public ExtractionStats stats() {
        return stats;
    }

    public int size() {
        return records.size();
    }

    @Override
    public String toString() {
        return "ExtractionResult[episodes=" + records.size() + ", stats=" + stats + ']';
    }
}
