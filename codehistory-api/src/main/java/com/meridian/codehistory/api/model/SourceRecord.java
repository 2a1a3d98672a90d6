/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.api.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One encounter record contributing codes to a patient's history.
 *
 * <p>Interval records (inpatient stays) carry distinct start and end dates. Point records
 * (emergency visits) are modeled as degenerate intervals where start and end are the
 * visit date; use {@link #point(String, String, LocalDate, List)} to build them.
 *
 * <p>The record ID is the identifier of the episode the record belongs to. It may be
 * {@code null} when the source table has no such column, in which case the record never
 * self-excludes.
 *
 * @param recordId      episode identifier of the record, nullable
 * @param patientId     normalized (trimmed) patient identifier
 * @param intervalStart first day of the encounter (inclusive)
 * @param intervalEnd   last day of the encounter (inclusive), never before {@code intervalStart}
 * @param codes         ordered codes owned by this record
 */
public record SourceRecord(
        String recordId,
        String patientId,
        LocalDate intervalStart,
        LocalDate intervalEnd,
        List<CodeOccurrence> codes
) {
    public SourceRecord {
        if (patientId == null || patientId.isBlank()) {
            throw new IllegalArgumentException("Source record has a blank patient ID");
        }
        Objects.requireNonNull(intervalStart, "intervalStart");
        Objects.requireNonNull(intervalEnd, "intervalEnd");
        if (intervalEnd.isBefore(intervalStart)) {
            throw new IllegalArgumentException("Record '" + recordId + "' ends (" + intervalEnd
                    + ") before it starts (" + intervalStart + ")");
        }
        patientId = patientId.trim();
        codes = codes == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(codes));
    }

    /**
     * Builds a record whose codes all occurred on the interval start date.
     */
    public static SourceRecord ofCodes(String recordId, String patientId, LocalDate intervalStart,
                                       LocalDate intervalEnd, List<String> codes) {
        List<CodeOccurrence> occurrences = new ArrayList<>(codes.size());
        for (String code : codes) {
            occurrences.add(new CodeOccurrence(code, intervalStart));
        }
        return new SourceRecord(recordId, patientId, intervalStart, intervalEnd, occurrences);
    }

    public boolean isPoint() {
        return intervalStart.equals(intervalEnd);
    }
}
