/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.api.model;

import java.util.Locale;

/**
 * Selects which encounter sources take part in diagnosis extraction.
 *
 * <p>The mode is fixed for a whole run.
 */
public enum FeatureMode {
    /** Only interval (inpatient) records are queried. */
    INP_ONLY("inp only"),

    /** Interval and point records are queried for every episode. */
    BOTH("both"),

    /** Inpatient episodes behave as {@link #INP_ONLY}, all others as {@link #BOTH}. */
    INP_IGNORE_ED("inp ignore ed");

    private final String label;

    FeatureMode(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Parses either the enum name or the human label ("inp only", "both", "inp ignore ed").
     *
     * @throws IllegalArgumentException if the value matches no mode
     */
    public static FeatureMode fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Feature mode cannot be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (FeatureMode mode : values()) {
            if (mode.label.equals(normalized) || mode.name().equalsIgnoreCase(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown feature mode: '" + value
                + "' (expected one of 'inp only', 'both', 'inp ignore ed')");
    }
}
