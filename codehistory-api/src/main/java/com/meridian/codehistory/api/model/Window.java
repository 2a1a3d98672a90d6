/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.api.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Lookback window {@code [start, end]}, both bounds inclusive.
 */
public record Window(LocalDate start, LocalDate end) {

    public Window {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Window end " + end + " is before start " + start);
        }
    }

    public long startEpochDay() {
        return start.toEpochDay();
    }

    public long endEpochDay() {
        return end.toEpochDay();
    }

    public boolean contains(LocalDate day) {
        return !day.isBefore(start) && !day.isAfter(end);
    }

    public boolean overlaps(LocalDate intervalStart, LocalDate intervalEnd) {
        return !intervalStart.isAfter(end) && !intervalEnd.isBefore(start);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + "]";
    }
}
