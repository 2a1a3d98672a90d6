/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.core.preprocess;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A fixed, ordered set of code columns where any column may be absent from a given table.
 *
 * @param name        schema name for logging
 * @param codeColumns code columns in scan order
 * @param dateColumns companion per-code date columns, parallel to {@code codeColumns};
 *                    entries (or the whole list) may be {@code null}
 */
public record CodeColumnSchema(String name, List<String> codeColumns, List<String> dateColumns) {

    public static final CodeColumnSchema DAD_DIAGNOSIS = numbered("dad-diagnosis", "DXCODE", 25);
    public static final CodeColumnSchema ED_DIAGNOSIS = numbered("ed-diagnosis", "DXCODE", 10);
    public static final CodeColumnSchema DAD_PROCEDURE =
            numberedWithDates("dad-procedure", "PROCCODE", "PROCSTDT", "_DT", 20);

    public CodeColumnSchema {
        if (codeColumns == null || codeColumns.isEmpty()) {
            throw new IllegalArgumentException("Code column schema '" + name + "' declares no columns");
        }
        codeColumns = List.copyOf(codeColumns);
        if (dateColumns == null) {
            dateColumns = Collections.nCopies(codeColumns.size(), null);
        } else if (dateColumns.size() != codeColumns.size()) {
            throw new IllegalArgumentException("Schema '" + name + "' has " + codeColumns.size()
                    + " code columns but " + dateColumns.size() + " date columns");
        } else {
            dateColumns = Collections.unmodifiableList(new ArrayList<>(dateColumns));
        }
    }

    public static CodeColumnSchema of(String name, String... codeColumns) {
        return new CodeColumnSchema(name, Arrays.asList(codeColumns), null);
    }

    /**
     * {@code prefix1..prefixN}, e.g. {@code DXCODE1..DXCODE25}.
     */
    public static CodeColumnSchema numbered(String name, String prefix, int count) {
        List<String> columns = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            columns.add(prefix + i);
        }
        return new CodeColumnSchema(name, columns, null);
    }

    public static CodeColumnSchema numberedWithDates(String name, String codePrefix, String datePrefix,
                                                     String dateSuffix, int count) {
        List<String> codes = new ArrayList<>(count);
        List<String> dates = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            codes.add(codePrefix + i);
            dates.add(datePrefix + i + dateSuffix);
        }
        return new CodeColumnSchema(name, codes, dates);
    }

    public boolean hasDateColumns() {
        for (String column : dateColumns) {
            if (column != null) {
                return true;
            }
        }
        return false;
    }
}
