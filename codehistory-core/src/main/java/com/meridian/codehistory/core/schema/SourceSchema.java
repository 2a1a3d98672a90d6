/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.core.schema;

import com.meridian.codehistory.core.preprocess.CodeColumnSchema;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Column layout of an encounter table.
 *
 * @param source         short label used in logs and metric tags ("dad", "ed")
 * @param patientColumn  patient id column (required)
 * @param recordIdColumn record id column used for self-exclusion (required when declared)
 * @param startColumn    interval start, or the timestamp of a point source (required)
 * @param endColumn      interval end
 * @param endRequired    whether a table without {@code endColumn} is rejected; otherwise the
 *                       start doubles as the end
 * @param kind           interval or point source
 * @param codeSchema     code columns of the table
 */
public record SourceSchema(
        String source,
        String patientColumn,
        String recordIdColumn,
        String startColumn,
        String endColumn,
        boolean endRequired,
        Kind kind,
        CodeColumnSchema codeSchema
) {
    public enum Kind {
        INTERVAL,
        POINT
    }

    public SourceSchema {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(patientColumn, "patientColumn");
        Objects.requireNonNull(startColumn, "startColumn");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(codeSchema, "codeSchema");
        if (kind == Kind.POINT) {
            endColumn = null;
        }
        if (endColumn == null) {
            endRequired = false;
        }
    }

    public static SourceSchema dadDiagnosis() {
        return new SourceSchema("dad", "PATID", "episode_order", "ADMITDATE_DT", "DISDATE_DT", true,
                Kind.INTERVAL, CodeColumnSchema.DAD_DIAGNOSIS);
    }

    public static SourceSchema edDiagnosis() {
        return new SourceSchema("ed", "PATID", "episode_order", "VISIT_DATE_DT", null, false,
                Kind.POINT, CodeColumnSchema.ED_DIAGNOSIS);
    }

    public static SourceSchema dadProcedure() {
        return new SourceSchema("dad", "PATID", "episode_order", "ADMITDATE_DT", "DISDATE_DT", false,
                Kind.INTERVAL, CodeColumnSchema.DAD_PROCEDURE);
    }

    public boolean isPoint() {
        return kind == Kind.POINT;
    }

    public List<String> requiredColumns() {
        List<String> required = new ArrayList<>(4);
        if (recordIdColumn != null) {
            required.add(recordIdColumn);
        }
        required.add(patientColumn);
        required.add(startColumn);
        if (endRequired) {
            required.add(endColumn);
        }
        return required;
    }

    /**
     * Every column this schema reads, for loading only what a run needs.
     */
    public Set<String> referencedColumns() {
        Set<String> columns = new LinkedHashSet<>();
        columns.add(patientColumn);
        if (recordIdColumn != null) {
            columns.add(recordIdColumn);
        }
        columns.add(startColumn);
        if (endColumn != null) {
            columns.add(endColumn);
        }
        columns.addAll(codeSchema.codeColumns());
        for (String dateColumn : codeSchema.dateColumns()) {
            if (dateColumn != null) {
                columns.add(dateColumn);
            }
        }
        return columns;
    }
}
