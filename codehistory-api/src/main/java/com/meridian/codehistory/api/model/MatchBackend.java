/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.api.model;

import java.util.Locale;

/**
 * Matching strategy used against a patient partition.
 */
public enum MatchBackend {
    /** Binary search on interval end followed by an exact filter over the suffix. */
    INDEXED,

    /** Exact filter over the whole partition. Reference implementation. */
    LINEAR_SCAN;

    public static MatchBackend fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Match backend cannot be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown match backend: '" + value + "'", e);
        }
    }
}
