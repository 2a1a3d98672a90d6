/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.core.window;

import com.meridian.codehistory.api.model.Window;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Resolves the lookback window of an episode: {@code [start - lookbackDays, start - 1 day]},
 * both ends inclusive. The episode's own start day is never part of its window.
 */
public final class WindowResolver {

    private WindowResolver() {
    }

    public static Window resolve(LocalDate startDate, int lookbackDays) {
        Objects.requireNonNull(startDate, "startDate");
        if (lookbackDays < 1) {
            throw new IllegalArgumentException("lookbackDays must be at least 1, was " + lookbackDays);
        }
        return new Window(startDate.minusDays(lookbackDays), startDate.minusDays(1));
    }
}
