/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.core.extraction;

import com.meridian.codehistory.api.IDiagnosisCodeExtractor;
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

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Diagnosis history from the inpatient (DAD, interval) and emergency (ED, point) sources.
 *
 * <p>Under {@link com.meridian.codehistory.api.model.FeatureMode#INP_ONLY} the emergency
 * table is not read at all and may be {@code null}.
 */
public class DiagnosisCodeExtractor extends AbstractCodeExtractor implements IDiagnosisCodeExtractor {
    private static final Logger logger = Logger.getLogger(DiagnosisCodeExtractor.class.getName());

    public DiagnosisCodeExtractor(ExtractionConfig config) {
        this(config, TracingService.getInstance().getTracer(), MetricsRegistry.getInstance());
    }

    public DiagnosisCodeExtractor(ExtractionConfig config, Tracer tracer, MetricsRegistry metrics) {
        super(config, tracer, metrics);
    }

    @Override
    public ExtractionResult extract(SourceTable episodes, SourceTable inpatient, SourceTable emergency) {
        return run(episodes, () -> buildSources(inpatient, emergency));
    }

    @Override
    public ExtractionResult extract(List<Episode> episodes, SourceTable inpatient, SourceTable emergency) {
        return run(episodes, () -> buildSources(inpatient, emergency));
    }

    @Override
    protected ExtractionKind kind() {
        return ExtractionKind.DIAGNOSIS;
    }

    @Override
    protected boolean tracksOccurrences() {
        return false;
    }

    @Override
    protected boolean participates(Episode episode, IndexedSource source) {
        FeatureModeSelector.SourceSelection selection = FeatureModeSelector.select(config.featureMode(), episode);
        return source.point() ? selection.point() : selection.interval();
    }

    private IndexedSources buildSources(SourceTable inpatient, SourceTable emergency) {
        if (inpatient == null) {
            throw new IllegalArgumentException("Inpatient table is required");
        }
        boolean usePoint = FeatureModeSelector.usesPointSource(config.featureMode());
        if (usePoint && emergency == null) {
            throw new IllegalArgumentException("Emergency table is required for feature mode '"
                    + config.featureMode().label() + "'");
        }

        List<SourceRecordReader.ReadResult> reads = new ArrayList<>(2);
        SourceRecordReader.ReadResult dad = readSource(inpatient, config.dadDiagnosisSchema());
        reads.add(dad);
        SourceRecordReader.ReadResult ed = null;
        if (usePoint) {
            ed = readSource(emergency, config.edDiagnosisSchema());
            reads.add(ed);
        } else {
            logger.info("Feature mode '" + config.featureMode().label() + "': emergency records are not indexed");
        }

        CodeDictionary dictionary = dictionaryFor(reads);
        List<IndexedSource> sources = new ArrayList<>(2);
        sources.add(index(config.dadDiagnosisSchema().source(), dad, dictionary, MatchPredicate.INTERVAL_OVERLAP, false));
        if (ed != null) {
            sources.add(index(config.edDiagnosisSchema().source(), ed, dictionary, MatchPredicate.POINT_IN_WINDOW, true));
        }
        return new IndexedSources(sources, dictionary);
    }
}
