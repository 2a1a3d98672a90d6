/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.api;

import java.util.Map;

/**
 * Callback interface for extraction stage events and progress.
 *
 * <p>An extraction run consists of these stages:
 * <ol>
 *   <li>EPISODES - Read and validate the episode table</li>
 *   <li>INDEXING - Preprocess code columns and build one partition index per source</li>
 *   <li>MATCHING - Resolve windows and match every episode against its patient partitions</li>
 * </ol>
 *
 * <p>Listener exceptions are logged by the extractor and never abort a run.
 *
 * <h2>Usage</h2>
 * <pre>
 * ExtractionListener listener = new ExtractionListener() {
 *     {@literal @}Override
 *     public void onStageStart(String stageName, int stageNumber, int totalStages) {
 *         System.out.printf("Starting %s (%d/%d)%n", stageName, stageNumber, totalStages);
 *     }
 *
 *     {@literal @}Override
 *     public void onProgress(int patientsDone, int totalPatients) {
 *         System.out.printf("%d/%d patients%n", patientsDone, totalPatients);
 *     }
 * };
 * extractor.setExtractionListener(listener);
 * </pre>
 */
public interface ExtractionListener {

    ExtractionListener NO_OP = new ExtractionListener() {
    };

    /**
     * Called when a stage starts.
     *
     * @param stageName   name of the stage (e.g., "INDEXING")
     * @param stageNumber current stage number (1-based)
     * @param totalStages total number of stages
     */
    default void onStageStart(String stageName, int stageNumber, int totalStages) {
    }

    /**
     * Called when a stage completes successfully.
     */
    default void onStageComplete(String stageName, StageResult result) {
    }

    /**
     * Called periodically while episodes are matched.
     *
     * @param patientsDone  patients fully processed so far
     * @param totalPatients patients to process in this run
     */
    default void onProgress(int patientsDone, int totalPatients) {
    }

    /**
     * Called when a stage fails. The exception is rethrown to the caller afterwards.
     */
    default void onError(String stageName, Exception error) {
    }

    /**
     * Result of a single stage.
     *
     * @param stageName     name of the stage
     * @param durationNanos duration in nanoseconds
     * @param metrics       stage-specific metrics (e.g., "recordsIndexed", "episodes")
     */
    record StageResult(
            String stageName,
            long durationNanos,
            Map<String, Object> metrics
    ) {
        public StageResult {
            metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
        }

        public long durationMillis() {
            return durationNanos / 1_000_000;
        }
    }
}
