/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.core.extraction;

import com.meridian.codehistory.api.IProcedureCodeExtractor;
import com.meridian.codehistory.api.model.Episode;
import com.meridian.codehistory.api.model.ExtractionKind;
import com.meridian.codehistory.api.model.ExtractionResult;
import com.meridian.codehistory.api.model.SourceTable;
import com.meridian.codehistory.core.config.ExtractionConfig;
import com.meridian.codehistory.core.index.CodeDictionary;
import com.meridian.codehistory.core.matching.MatchPredicate;
import com.meridian.codehistory.core.preprocess.SourceRecordReader;
import com.meridian.codehistory.infra.metrics.MetricsRegistry;
import com.meridian.codehistory.infra.telemetry.TracingService;
import io.opentelemetry.api.trace.Tracer;

import java.util.List;

/**
 * Procedure history from the inpatient (DAD) source. Feature mode does not apply.
 */
public class ProcedureCodeExtractor extends AbstractCodeExtractor implements IProcedureCodeExtractor {

    public ProcedureCodeExtractor(ExtractionConfig config) {
        this(config, TracingService.getInstance().getTracer(), MetricsRegistry.getInstance());
    }

    public ProcedureCodeExtractor(ExtractionConfig config, Tracer tracer, MetricsRegistry metrics) {
        super(config, tracer, metrics);
    }

    @Override
    public ExtractionResult extract(SourceTable episodes, SourceTable inpatient) {
        return run(episodes, () -> buildSources(inpatient));
    }

    @Override
    public ExtractionResult extract(List<Episode> episodes, SourceTable inpatient) {
        return run(episodes, () -> buildSources(inpatient));
    }

    @Override
    protected ExtractionKind kind() {
        return ExtractionKind.PROCEDURE;
    }

    @Override
    protected boolean tracksOccurrences() {
        return true;
    }

    @Override
    protected boolean participates(Episode episode, IndexedSource source) {
        return true;
    }

    private IndexedSources buildSources(SourceTable inpatient) {
        if (inpatient == null) {
            throw new IllegalArgumentException("Inpatient table is required");
        }
        SourceRecordReader.ReadResult dad = readSource(inpatient, config.dadProcedureSchema());
        CodeDictionary dictionary = dictionaryFor(List.of(dad));
        IndexedSource source = index(config.dadProcedureSchema().source(), dad, dictionary,
                MatchPredicate.INTERVAL_OVERLAP, false);
        return new IndexedSources(List.of(source), dictionary);
    }
}
