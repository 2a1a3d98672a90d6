/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.infra.io;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.meridian.codehistory.api.model.CodeOccurrence;
import com.meridian.codehistory.api.model.ResultRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON shape of one output line. Dates are ISO-8601 strings.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResultRow(
        @JsonProperty("episode_id") String episodeId,
        @JsonProperty("patient_id") String patientId,
        @JsonProperty("start_date") String startDate,
        @JsonProperty("codes") List<String> codes,
        @JsonProperty("occurrences") List<OccurrenceRow> occurrences
) {
    public record OccurrenceRow(@JsonProperty("code") String code, @JsonProperty("date") String date) {
    }

    public static ResultRow from(ResultRecord record, boolean includeOccurrences) {
        List<OccurrenceRow> occurrences = null;
        if (includeOccurrences) {
            occurrences = new ArrayList<>(record.occurrences().size());
            for (CodeOccurrence occurrence : record.occurrences()) {
                occurrences.add(new OccurrenceRow(occurrence.code(), occurrence.occurredOn().toString()));
            }
        }
        return new ResultRow(record.episodeId(), record.patientId(),
                record.startDate() != null ? record.startDate().toString() : null,
                record.codes(), occurrences);
    }
}
