/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.core.preprocess;

import com.meridian.codehistory.api.exceptions.SchemaException;
import com.meridian.codehistory.api.model.CodeOccurrence;
import com.meridian.codehistory.api.model.SourceRecord;
import com.meridian.codehistory.api.model.SourceTable;
import com.meridian.codehistory.core.schema.SourceSchema;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Converts an encounter table into {@link SourceRecord}s according to a {@link SourceSchema}.
 *
 * <p>Missing required columns fail the whole table. Individual rows with a missing or
 * unparseable date, a blank patient id or an end before the start are dropped and counted.
 * Only a table that lacks an optional end column entirely falls back to the start date.
 */
public final class SourceRecordReader {
    private static final Logger logger = Logger.getLogger(SourceRecordReader.class.getName());

    private final CodeListPreprocessor preprocessor;

    public SourceRecordReader() {
        this(new CodeListPreprocessor());
    }

    public SourceRecordReader(CodeListPreprocessor preprocessor) {
        this.preprocessor = preprocessor;
    }

    public record ReadResult(
            List<SourceRecord> records,
            int droppedMissingPatient,
            int droppedInvalidDate,
            int droppedInvertedInterval,
            CodeListPreprocessor.PreprocessStats preprocessStats
    ) {
        public int dropped() {
            return droppedMissingPatient + droppedInvalidDate + droppedInvertedInterval;
        }
    }

    public ReadResult read(SourceTable table, SourceSchema schema) {
        List<String> missing = table.missingColumns(schema.requiredColumns());
        if (!missing.isEmpty()) {
            throw new SchemaException(table.name(), missing);
        }

        String recordIdColumn = schema.recordIdColumn();
        String endColumn = schema.endColumn();
        if (endColumn != null && !table.hasColumn(endColumn)) {
            logger.warning(String.format("Table '%s' has no '%s' column; using '%s' as the interval end",
                    table.name(), endColumn, schema.startColumn()));
            endColumn = null;
        }

        CodeListPreprocessor.CodeLists codeLists = preprocessor.preprocess(table, schema.codeSchema());

        List<SourceRecord> records = new ArrayList<>(table.size());
        int missingPatient = 0;
        int invalidDate = 0;
        int inverted = 0;
        List<Map<String, Object>> rows = table.rows();
        for (int i = 0; i < rows.size(); i++) {
            Map<String, Object> row = rows.get(i);

            String patientId = PatientIds.normalize(row.get(schema.patientColumn()));
            if (patientId == null) {
                missingPatient++;
                continue;
            }
            LocalDate start = DateValues.parse(row.get(schema.startColumn()));
            if (start == null) {
                invalidDate++;
                continue;
            }
            LocalDate end = start;
            if (endColumn != null) {
                end = DateValues.parse(row.get(endColumn));
                if (end == null) {
                    invalidDate++;
                    continue;
                }
            }
            if (end.isBefore(start)) {
                inverted++;
                continue;
            }

            String recordId = recordIdColumn != null ? recordId(row.get(recordIdColumn)) : null;
            List<CodeListPreprocessor.PendingCode> pending = codeLists.row(i);
            List<CodeOccurrence> codes = new ArrayList<>(pending.size());
            for (CodeListPreprocessor.PendingCode code : pending) {
                codes.add(new CodeOccurrence(code.code(), code.occurredOn() != null ? code.occurredOn() : start));
            }
            records.add(new SourceRecord(recordId, patientId, start, end, codes));
        }

        ReadResult result = new ReadResult(records, missingPatient, invalidDate, inverted, codeLists.stats());
        if (result.dropped() > 0) {
            logger.warning(String.format("Dropped %d of %d rows from '%s' (blank patient: %d, invalid date: %d, end before start: %d)",
                    result.dropped(), table.size(), table.name(), missingPatient, invalidDate, inverted));
        }
        return result;
    }

    private static String recordId(Object value) {
        if (value == null) {
            return null;
        }
        String id = value.toString().trim();
        return id.isEmpty() ? null : id;
    }
}
