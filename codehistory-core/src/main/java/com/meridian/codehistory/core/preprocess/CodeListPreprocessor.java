/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.core.preprocess;

import com.meridian.codehistory.api.model.SourceTable;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Collapses a table's wide optional code columns into one code list per row.
 *
 * <p>Only the schema columns present in the table are scanned, in schema order. Null and
 * blank cells are skipped, the remaining values are trimmed. Duplicates within a row are
 * kept; they are removed later by the aggregator.
 */
public final class CodeListPreprocessor {
    private static final Logger logger = Logger.getLogger(CodeListPreprocessor.class.getName());

    /**
     * A code read from a row, with the value of its companion date column if there is one.
     */
    public record PendingCode(String code, LocalDate occurredOn) {
    }

    public record PreprocessStats(
            String table,
            int records,
            int recordsWithCodes,
            long totalCodes,
            List<String> presentColumns
    ) {
        public double averageCodesPerRecord() {
            return recordsWithCodes > 0 ? (double) totalCodes / recordsWithCodes : 0.0;
        }
    }

    public record CodeLists(List<List<PendingCode>> perRow, PreprocessStats stats) {
        public List<PendingCode> row(int index) {
            return perRow.get(index);
        }
    }

    public CodeLists preprocess(SourceTable table, CodeColumnSchema schema) {
        List<String> codeColumns = new ArrayList<>();
        List<String> dateColumns = new ArrayList<>();
        for (int i = 0; i < schema.codeColumns().size(); i++) {
            String column = schema.codeColumns().get(i);
            if (table.hasColumn(column)) {
                codeColumns.add(column);
                String dateColumn = schema.dateColumns().get(i);
                dateColumns.add(dateColumn != null && table.hasColumn(dateColumn) ? dateColumn : null);
            }
        }

        if (codeColumns.isEmpty()) {
            logger.warning(String.format("Table '%s' has none of the %d %s code columns; every record gets an empty code list",
                    table.name(), schema.codeColumns().size(), schema.name()));
        }

        List<List<PendingCode>> perRow = new ArrayList<>(table.size());
        int recordsWithCodes = 0;
        long totalCodes = 0;
        for (Map<String, Object> row : table.rows()) {
            List<PendingCode> codes = extractRow(row, codeColumns, dateColumns);
            if (!codes.isEmpty()) {
                recordsWithCodes++;
                totalCodes += codes.size();
            }
            perRow.add(codes);
        }

        PreprocessStats stats = new PreprocessStats(table.name(), table.size(), recordsWithCodes,
                totalCodes, List.copyOf(codeColumns));
        logger.info(String.format("Preprocessed '%s': %d records, %d with codes, %d codes (avg %.2f) from %d columns",
                table.name(), stats.records(), stats.recordsWithCodes(), stats.totalCodes(),
                stats.averageCodesPerRecord(), codeColumns.size()));
        return new CodeLists(perRow, stats);
    }

    private static List<PendingCode> extractRow(Map<String, Object> row, List<String> codeColumns,
                                                List<String> dateColumns) {
        if (codeColumns.isEmpty()) {
            return List.of();
        }
        List<PendingCode> codes = new ArrayList<>(4);
        for (int i = 0; i < codeColumns.size(); i++) {
            String code = codeValue(row.get(codeColumns.get(i)));
            if (code == null) {
                continue;
            }
            String dateColumn = dateColumns.get(i);
            LocalDate occurredOn = dateColumn != null ? DateValues.parse(row.get(dateColumn)) : null;
            codes.add(new PendingCode(code, occurredOn));
        }
        return codes;
    }

    static String codeValue(Object cell) {
        if (cell == null) {
            return null;
        }
        if (cell instanceof Double d && d.isNaN()) {
            return null;
        }
        String code = cell.toString().trim();
        return code.isEmpty() ? null : code;
    }
}
