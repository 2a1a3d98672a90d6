/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.api.model;

import java.time.LocalDate;
import java.util.Locale;
import java.util.Objects;

/**
 * A clinical episode (admission, visit, ...) for which a code history window is computed.
 *
 * <p>Episodes are read-only inputs. The {@code type} is normalized to trimmed lower case
 * so that feature-mode checks such as {@code "inp"} are case-insensitive; an absent type
 * becomes the empty string.
 */
public record Episode(
        String episodeId,
        String patientId,
        LocalDate startDate,
        String type
) {
    public static final String INPATIENT_TYPE = "inp";

    public Episode {
        if (episodeId == null || episodeId.isBlank()) {
            throw new IllegalArgumentException("Episode ID cannot be null or blank");
        }
        if (patientId == null || patientId.isBlank()) {
            throw new IllegalArgumentException("Episode '" + episodeId + "' has a blank patient ID");
        }
        Objects.requireNonNull(startDate, "startDate");
        patientId = patientId.trim();
        type = type == null ? "" : type.trim().toLowerCase(Locale.ROOT);
    }

    public Episode(String episodeId, String patientId, LocalDate startDate) {
        this(episodeId, patientId, startDate, null);
    }

    public boolean isInpatient() {
        return INPATIENT_TYPE.equals(type);
    }
}
