/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.api;

import com.meridian.codehistory.api.exceptions.SchemaException;
import com.meridian.codehistory.api.model.Episode;
import com.meridian.codehistory.api.model.ExtractionResult;
import com.meridian.codehistory.api.model.SourceTable;

import java.util.List;

/**
 * Builds the N-day diagnosis code history of each episode from an inpatient (interval)
 * source and an emergency (point) source.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * IDiagnosisCodeExtractor extractor = new DiagnosisCodeExtractor(
 *         ExtractionConfig.builder().lookbackDays(1825).featureMode(FeatureMode.INP_IGNORE_ED).build());
 *
 * ExtractionResult result = extractor.extract(episodeTable, dadTable, edTable);
 * List<String> codes = result.codesFor("P001_3");
 * }</pre>
 *
 * <p>Which sources participate for a given episode is decided by the configured
 * {@link com.meridian.codehistory.api.model.FeatureMode}.
 */
public interface IDiagnosisCodeExtractor {

    /**
     * Extracts diagnosis histories for the episodes of an episode table.
     *
     * @param episodes  episode table (episode id, patient id, start date, optional type)
     * @param inpatient interval encounter table with diagnosis code columns
     * @param emergency point encounter table with diagnosis code columns
     * @return one result row per valid episode, in episode order
     * @throws SchemaException if a required column is missing from any table
     */
    ExtractionResult extract(SourceTable episodes, SourceTable inpatient, SourceTable emergency);

    /**
     * Extracts diagnosis histories for already validated episodes.
     */
    ExtractionResult extract(List<Episode> episodes, SourceTable inpatient, SourceTable emergency);

    void setExtractionListener(ExtractionListener listener);
}
