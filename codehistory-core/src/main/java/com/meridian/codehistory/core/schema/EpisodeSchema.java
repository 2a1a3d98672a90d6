/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.core.schema;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Column layout of the episode table. The type column is optional.
 */
public record EpisodeSchema(String idColumn, String patientColumn, String startColumn, String typeColumn) {

    public static final EpisodeSchema DEFAULT = new EpisodeSchema("episode_order", "PATID", "start_date", "type");

    public EpisodeSchema {
        Objects.requireNonNull(idColumn, "idColumn");
        Objects.requireNonNull(patientColumn, "patientColumn");
        Objects.requireNonNull(startColumn, "startColumn");
    }

    public Set<String> referencedColumns() {
        Set<String> columns = new LinkedHashSet<>(List.of(idColumn, patientColumn, startColumn));
        if (typeColumn != null) {
            columns.add(typeColumn);
        }
        return columns;
    }
}
