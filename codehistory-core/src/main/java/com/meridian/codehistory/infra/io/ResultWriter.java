/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.infra.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.meridian.codehistory.api.model.ExtractionResult;
import com.meridian.codehistory.api.model.ResultRecord;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Writes extraction results as JSON Lines, one object per episode in result order.
 */
public final class ResultWriter {
    private static final Logger logger = Logger.getLogger(ResultWriter.class.getName());

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final boolean includeOccurrences;

    public ResultWriter(boolean includeOccurrences) {
        this.includeOccurrences = includeOccurrences;
    }

    public void write(ExtractionResult result, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(result, writer);
        }
        logger.info(String.format("Wrote %,d results to %s", result.size(), path));
    }

    public void write(ExtractionResult result, Writer writer) throws IOException {
        for (ResultRecord record : result.records()) {
            writer.write(objectMapper.writeValueAsString(ResultRow.from(record, includeOccurrences)));
            writer.write('\n');
        }
        writer.flush();
    }
}
