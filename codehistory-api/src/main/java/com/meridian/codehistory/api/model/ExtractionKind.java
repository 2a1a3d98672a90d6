/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.api.model;

import java.util.Locale;

public enum ExtractionKind {
    DIAGNOSIS,
    PROCEDURE;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ExtractionKind fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Extraction kind cannot be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "diagnosis", "dx" -> DIAGNOSIS;
            case "procedure", "proc" -> PROCEDURE;
            default -> throw new IllegalArgumentException("Unknown extraction kind: '" + value + "'");
        };
    }
}
