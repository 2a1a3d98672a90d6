/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.core.extraction;

import com.meridian.codehistory.api.ExtractionListener;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reports stages and progress through java.util.logging.
 */
public final class LoggingExtractionListener implements ExtractionListener {
    private static final Logger logger = Logger.getLogger(LoggingExtractionListener.class.getName());

    @Override
    public void onStageStart(String stageName, int stageNumber, int totalStages) {
        logger.info(String.format("Stage %d/%d: %s", stageNumber, totalStages, stageName));
    }

    @Override
    public void onStageComplete(String stageName, StageResult result) {
        logger.info(String.format("Stage %s completed in %d ms %s", stageName, result.durationMillis(), result.metrics()));
    }

    @Override
    public void onProgress(int patientsDone, int totalPatients) {
        logger.info(String.format("Processed %,d/%,d patients (%.1f%%)", patientsDone, totalPatients,
                totalPatients > 0 ? patientsDone * 100.0 / totalPatients : 100.0));
    }

    @Override
    public void onError(String stageName, Exception error) {
        logger.log(Level.SEVERE, "Stage " + stageName + " failed", error);
    }
}
