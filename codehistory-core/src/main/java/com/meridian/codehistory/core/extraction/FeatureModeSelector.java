/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.core.extraction;

import com.meridian.codehistory.api.model.Episode;
import com.meridian.codehistory.api.model.FeatureMode;

/**
 * Decides which encounter sources are queried for an episode.
 */
public final class FeatureModeSelector {

    public record SourceSelection(boolean interval, boolean point) {
        public static final SourceSelection INTERVAL_ONLY = new SourceSelection(true, false);
        public static final SourceSelection ALL = new SourceSelection(true, true);
    }

    private FeatureModeSelector() {
    }

    public static SourceSelection select(FeatureMode mode, Episode episode) {
        return switch (mode) {
            case INP_ONLY -> SourceSelection.INTERVAL_ONLY;
            case BOTH -> SourceSelection.ALL;
            case INP_IGNORE_ED -> episode.isInpatient() ? SourceSelection.INTERVAL_ONLY : SourceSelection.ALL;
        };
    }

    /**
     * True if any episode of the run can query the point source.
     */
    public static boolean usesPointSource(FeatureMode mode) {
        return mode != FeatureMode.INP_ONLY;
    }
}
