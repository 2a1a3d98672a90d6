/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.infra.io;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.meridian.codehistory.api.model.SourceTable;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.logging.Logger;

/**
 * Loads a CSV file with a header row into a {@link SourceTable}.
 *
 * <p>All values are kept as strings; empty cells become {@code null}. An optional column
 * filter keeps only the columns a run needs, which bounds memory on wide encounter
 * extracts.
 */
public final class CsvTableReader {
    private static final Logger logger = Logger.getLogger(CsvTableReader.class.getName());

    private final CsvMapper mapper = new CsvMapper();
    private final char separator;

    public CsvTableReader() {
        this(',');
    }

    public CsvTableReader(char separator) {
        this.separator = separator;
    }

    public SourceTable read(Path path) throws IOException {
        return read(path, column -> true);
    }

    public SourceTable read(Path path, Predicate<String> columnFilter) throws IOException {
        String name = path.getFileName().toString();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            SourceTable table = read(name, reader, columnFilter);
            logger.info(String.format("Loaded %s: %,d rows, %d columns", path, table.size(), table.columns().size()));
            return table;
        }
    }

    public SourceTable read(String name, Reader reader, Predicate<String> columnFilter) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader().withColumnSeparator(separator);
        try (MappingIterator<Map<String, String>> rows = mapper.readerFor(Map.class).with(schema).readValues(reader)) {
            boolean hasRows = rows.hasNextValue();

            List<String> columns = new ArrayList<>();
            if (rows.getParserSchema() instanceof CsvSchema header) {
                for (CsvSchema.Column column : header) {
                    if (columnFilter.test(column.getName())) {
                        columns.add(column.getName());
                    }
                }
            }

            SourceTable.Builder table = SourceTable.builder(name).columns(columns.toArray(new String[0]));
            while (hasRows) {
                Map<String, String> values = rows.nextValue();
                Map<String, Object> row = new HashMap<>(columns.size() * 2);
                for (String column : columns) {
                    String value = values.get(column);
                    row.put(column, value == null || value.isBlank() ? null : value);
                }
                table.row(row);
                hasRows = rows.hasNextValue();
            }
            return table.build();
        }
    }
}
