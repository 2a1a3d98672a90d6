/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.core.matching;

import com.meridian.codehistory.api.model.MatchBackend;

public final class IntervalMatchers {

    private IntervalMatchers() {
    }

    public static IntervalMatcher forBackend(MatchBackend backend) {
        return switch (backend) {
            case INDEXED -> BinarySearchIntervalMatcher.INSTANCE;
            case LINEAR_SCAN -> LinearScanIntervalMatcher.INSTANCE;
        };
    }
}
