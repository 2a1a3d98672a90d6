/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.api;

import com.meridian.codehistory.api.model.Episode;
import com.meridian.codehistory.api.model.ExtractionResult;
import com.meridian.codehistory.api.model.SourceTable;

import java.util.List;

/**
 * Builds the N-day procedure code history of each episode from a single inpatient
 * (interval) source.
 *
 * <p>Result rows additionally carry the latest occurrence date of every code. A code's
 * occurrence date is its own procedure date when the source has one, otherwise the
 * admission date of the containing record.
 */
public interface IProcedureCodeExtractor {

    ExtractionResult extract(SourceTable episodes, SourceTable inpatient);

    ExtractionResult extract(List<Episode> episodes, SourceTable inpatient);

    void setExtractionListener(ExtractionListener listener);
}
