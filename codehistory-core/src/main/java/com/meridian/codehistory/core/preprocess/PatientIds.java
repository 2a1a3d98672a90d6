/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.core.preprocess;

/**
 * Normalizes patient identifiers so that the same patient read from different tables
 * compares equal: strings are trimmed, integral numbers lose any fractional suffix
 * ({@code 1001.0} and {@code 1001} are the same patient).
 */
public final class PatientIds {

    private PatientIds() {
    }

    /**
     * @return the normalized id, or {@code null} when the value is missing or blank
     */
    public static String normalize(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            return value.toString();
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            if (Double.isNaN(d)) {
                return null;
            }
            if (d == Math.rint(d) && !Double.isInfinite(d)) {
                return Long.toString((long) d);
            }
            return value.toString();
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        if (text.endsWith(".0") && text.length() > 2 && isDigits(text, text.length() - 2)) {
            return text.substring(0, text.length() - 2);
        }
        return text;
    }

    private static boolean isDigits(String text, int end) {
        for (int i = 0; i < end; i++) {
            if (!Character.isDigit(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
