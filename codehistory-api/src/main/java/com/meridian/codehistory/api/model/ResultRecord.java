/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.api.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Code history of one episode.
 *
 * @param episodeId   the episode this row belongs to
 * @param patientId   passthrough for joins with downstream feature tables
 * @param startDate   passthrough episode start date
 * @param codes       deduplicated, lexicographically sorted codes; never null, possibly empty
 * @param occurrences latest occurrence per code, sorted by code; empty unless occurrence
 *                    tracking is enabled (procedure extraction)
 */
public record ResultRecord(
        String episodeId,
        String patientId,
        LocalDate startDate,
        List<String> codes,
        List<CodeOccurrence> occurrences
) {
    public ResultRecord {
        Objects.requireNonNull(episodeId, "episodeId");
        codes = codes == null ? List.of() : List.copyOf(codes);
        occurrences = occurrences == null ? List.of() : List.copyOf(occurrences);
    }

    public ResultRecord(String episodeId, String patientId, LocalDate startDate, List<String> codes) {
        this(episodeId, patientId, startDate, codes, List.of());
    }

    public boolean hasCodes() {
        return !codes.isEmpty();
    }
}
