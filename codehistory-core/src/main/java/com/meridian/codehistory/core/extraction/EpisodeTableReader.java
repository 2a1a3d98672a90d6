/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.core.extraction;

import com.meridian.codehistory.api.exceptions.SchemaException;
import com.meridian.codehistory.api.model.Episode;
import com.meridian.codehistory.api.model.SourceTable;
import com.meridian.codehistory.core.preprocess.DateValues;
import com.meridian.codehistory.core.preprocess.PatientIds;
import com.meridian.codehistory.core.schema.EpisodeSchema;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Reads {@link Episode}s from an episode table.
 *
 * <p>The id and start date columns are required. The patient column is required unless
 * {@code derivePatientId} is set, in which case a missing patient column is replaced by the
 * episode id prefix before the first {@code '_'} ({@code "P001_3"} belongs to {@code "P001"}).
 * Rows with a blank id, a blank patient or an unparseable start date are dropped. Duplicate
 * episode ids fail the table.
 */
public final class EpisodeTableReader {
    private static final Logger logger = Logger.getLogger(EpisodeTableReader.class.getName());

    public record EpisodeReadResult(List<Episode> episodes, int droppedInvalidDate, int droppedMissingId) {
        public int dropped() {
            return droppedInvalidDate + droppedMissingId;
        }
    }

    public EpisodeReadResult read(SourceTable table, EpisodeSchema schema, boolean derivePatientId) {
        List<String> required = new ArrayList<>(List.of(schema.idColumn(), schema.startColumn()));
        boolean derive = false;
        if (!table.hasColumn(schema.patientColumn())) {
            if (derivePatientId) {
                logger.warning(String.format("Table '%s' has no '%s' column; deriving patient ids from '%s'",
                        table.name(), schema.patientColumn(), schema.idColumn()));
                derive = true;
            } else {
                required.add(schema.patientColumn());
            }
        }
        List<String> missing = table.missingColumns(required);
        if (!missing.isEmpty()) {
            throw new SchemaException(table.name(), missing);
        }
        boolean hasType = schema.typeColumn() != null && table.hasColumn(schema.typeColumn());

        List<Episode> episodes = new ArrayList<>(table.size());
        Set<String> seen = new HashSet<>(table.size() * 2);
        int invalidDate = 0;
        int missingId = 0;
        for (Map<String, Object> row : table.rows()) {
            Object rawId = row.get(schema.idColumn());
            String episodeId = rawId == null ? "" : rawId.toString().trim();
            String patientId = derive ? derivePatientId(episodeId) : PatientIds.normalize(row.get(schema.patientColumn()));
            if (episodeId.isEmpty() || patientId == null || patientId.isEmpty()) {
                missingId++;
                continue;
            }
            LocalDate start = DateValues.parse(row.get(schema.startColumn()));
            if (start == null) {
                invalidDate++;
                continue;
            }
            if (!seen.add(episodeId)) {
                throw new SchemaException("Table '" + table.name() + "' has duplicate episode id '" + episodeId + "'");
            }
            Object type = hasType ? row.get(schema.typeColumn()) : null;
            episodes.add(new Episode(episodeId, patientId, start, type == null ? null : type.toString()));
        }

        if (invalidDate + missingId > 0) {
            logger.warning(String.format("Excluded %d of %d episodes from '%s' (unparseable %s: %d, blank id or patient: %d)",
                    invalidDate + missingId, table.size(), table.name(), schema.startColumn(), invalidDate, missingId));
        }
        return new EpisodeReadResult(episodes, invalidDate, missingId);
    }

    static String derivePatientId(String episodeId) {
        int separator = episodeId.indexOf('_');
        return separator >= 0 ? episodeId.substring(0, separator) : episodeId;
    }

    /**
     * Rejects duplicate ids in an episode list that did not come from a table.
     */
    static void requireUniqueIds(List<Episode> episodes) {
        Set<String> seen = new HashSet<>(episodes.size() * 2);
        for (Episode episode : episodes) {
            if (!seen.add(episode.episodeId())) {
                throw new SchemaException("Duplicate episode id '" + episode.episodeId() + "'");
            }
        }
    }
}
