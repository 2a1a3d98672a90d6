/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory;

import com.meridian.codehistory.api.model.ExtractionKind;
import com.meridian.codehistory.api.model.ExtractionResult;
import com.meridian.codehistory.api.model.SourceTable;
import com.meridian.codehistory.core.config.ExtractionConfig;
import com.meridian.codehistory.core.extraction.DiagnosisCodeExtractor;
import com.meridian.codehistory.core.extraction.FeatureModeSelector;
import com.meridian.codehistory.core.extraction.LoggingExtractionListener;
import com.meridian.codehistory.core.extraction.ProcedureCodeExtractor;
import com.meridian.codehistory.infra.io.CsvTableReader;
import com.meridian.codehistory.infra.io.ResultWriter;
import com.meridian.codehistory.infra.telemetry.TracingService;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Command-line entry point.
 *
 * <pre>
 * java -Dcodehistory.kind=diagnosis \
 *      -Dcodehistory.episodes=episodes.csv \
 *      -Dcodehistory.dad=dad.csv \
 *      -Dcodehistory.ed=ed.csv \
 *      -Dcodehistory.output=dx_history.jsonl \
 *      -DCODEHISTORY_LOOKBACK_DAYS=1825 \
 *      -jar codehistory-core.jar
 * </pre>
 */
public class CodeHistoryApplication {
    private static final Logger logger = Logger.getLogger(CodeHistoryApplication.class.getName());

    static final String PROP_KIND = "codehistory.kind";
    static final String PROP_EPISODES = "codehistory.episodes";
    static final String PROP_DAD = "codehistory.dad";
    static final String PROP_ED = "codehistory.ed";
    static final String PROP_OUTPUT = "codehistory.output";

    private final CsvTableReader csvReader = new CsvTableReader();

    public static void main(String[] args) {
        configureLogging();
        try {
            ExtractionResult result = new CodeHistoryApplication().run(ExtractionConfig.loadDefault());
            logger.info(String.format("Done: %,d episodes, %,d with codes", result.size(),
                    result.stats().episodesWithCodes()));
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Extraction failed: " + e.getMessage(), e);
            System.exit(1);
        } finally {
            TracingService.getInstance().shutdown();
        }
    }

    ExtractionResult run(ExtractionConfig config) throws IOException {
        ExtractionKind kind = ExtractionKind.fromString(System.getProperty(PROP_KIND, "diagnosis"));
        Path episodesPath = requiredPath(PROP_EPISODES);
        Path dadPath = requiredPath(PROP_DAD);
        Path outputPath = requiredPath(PROP_OUTPUT);
        logger.info("Starting " + kind.tag() + " code extraction with " + config);

        SourceTable episodes = csvReader.read(episodesPath, config.episodeSchema().referencedColumns()::contains);
        ExtractionResult result;
        if (kind == ExtractionKind.PROCEDURE) {
            SourceTable dad = csvReader.read(dadPath, config.dadProcedureSchema().referencedColumns()::contains);
            ProcedureCodeExtractor extractor = new ProcedureCodeExtractor(config);
            extractor.setExtractionListener(new LoggingExtractionListener());
            result = extractor.extract(episodes, dad);
        } else {
            SourceTable dad = csvReader.read(dadPath, config.dadDiagnosisSchema().referencedColumns()::contains);
            SourceTable ed = null;
            if (FeatureModeSelector.usesPointSource(config.featureMode())) {
                ed = csvReader.read(requiredPath(PROP_ED), config.edDiagnosisSchema().referencedColumns()::contains);
            }
            DiagnosisCodeExtractor extractor = new DiagnosisCodeExtractor(config);
            extractor.setExtractionListener(new LoggingExtractionListener());
            result = extractor.extract(episodes, dad, ed);
        }

        new ResultWriter(kind == ExtractionKind.PROCEDURE).write(result, outputPath);
        return result;
    }

    private static Path requiredPath(String property) {
        String value = System.getProperty(property);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing required system property -D" + property);
        }
        return Paths.get(value.trim());
    }

    private static void configureLogging() {
        try (InputStream config = CodeHistoryApplication.class.getResourceAsStream("/logging.properties")) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
                return;
            }
        } catch (IOException e) {
            System.err.println("Could not read logging.properties, using console defaults: " + e.getMessage());
        }

        LogManager.getLogManager().reset();
        Logger rootLogger = Logger.getLogger("");
        ConsoleHandler consoleHandler = new ConsoleHandler();
        consoleHandler.setLevel(Level.INFO);
        consoleHandler.setFormatter(new SimpleFormatter() {
            @Override
            public String format(LogRecord record) {
                return String.format("[%1$tF %1$tT.%1$tL] [%2$-7s] %3$s - %4$s%n",
                        new java.util.Date(record.getMillis()), record.getLevel(),
                        record.getLoggerName(), record.getMessage());
            }
        });
        rootLogger.addHandler(consoleHandler);
        rootLogger.setLevel(Level.INFO);
    }
}
