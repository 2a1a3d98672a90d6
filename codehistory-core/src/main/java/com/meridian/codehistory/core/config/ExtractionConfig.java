/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.core.config;

import com.meridian.codehistory.api.model.FeatureMode;
import com.meridian.codehistory.api.model.MatchBackend;
import com.meridian.codehistory.core.schema.EpisodeSchema;
import com.meridian.codehistory.core.schema.SourceSchema;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Configuration of an extraction run.
 *
 * <p><b>Environment Variable Override:</b>
 * {@link #loadDefault()} reads each property from an environment variable, falling back to
 * a system property of the same name:
 * <pre>
 * CODEHISTORY_LOOKBACK_DAYS=1825
 * CODEHISTORY_FEATURE_MODE="inp ignore ed"
 * CODEHISTORY_MATCH_BACKEND=indexed
 * CODEHISTORY_PARALLELISM=8
 * CODEHISTORY_PROGRESS_INTERVAL=10000
 * CODEHISTORY_DERIVE_EPISODE_PATIENT_ID=true
 * </pre>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * ExtractionConfig config = ExtractionConfig.builder()
 *     .lookbackDays(365)
 *     .featureMode(FeatureMode.BOTH)
 *     .parallelism(4)
 *     .build();
 * }</pre>
 */
public final class ExtractionConfig {

    private static final Logger logger = Logger.getLogger(ExtractionConfig.class.getName());

    static final String ENV_LOOKBACK_DAYS = "CODEHISTORY_LOOKBACK_DAYS";
    static final String ENV_FEATURE_MODE = "CODEHISTORY_FEATURE_MODE";
    static final String ENV_MATCH_BACKEND = "CODEHISTORY_MATCH_BACKEND";
    static final String ENV_PARALLELISM = "CODEHISTORY_PARALLELISM";
    static final String ENV_PROGRESS_INTERVAL = "CODEHISTORY_PROGRESS_INTERVAL";
    static final String ENV_DERIVE_EPISODE_PATIENT_ID = "CODEHISTORY_DERIVE_EPISODE_PATIENT_ID";

    public static final int DEFAULT_LOOKBACK_DAYS = 365;
    public static final int DEFAULT_PROGRESS_INTERVAL = 1000;

    private final int lookbackDays;
    private final FeatureMode featureMode;
    private final MatchBackend matchBackend;
    private final int parallelism;
    private final int progressInterval;
    private final boolean deriveEpisodePatientId;
    private final EpisodeSchema episodeSchema;
    private final SourceSchema dadDiagnosisSchema;
    private final SourceSchema edDiagnosisSchema;
    private final SourceSchema dadProcedureSchema;

    private ExtractionConfig(Builder builder) {
        this.lookbackDays = builder.lookbackDays;
        this.featureMode = Objects.requireNonNull(builder.featureMode, "featureMode");
        this.matchBackend = Objects.requireNonNull(builder.matchBackend, "matchBackend");
        this.parallelism = builder.parallelism;
        this.progressInterval = builder.progressInterval;
        this.deriveEpisodePatientId = builder.deriveEpisodePatientId;
        this.episodeSchema = Objects.requireNonNull(builder.episodeSchema, "episodeSchema");
        this.dadDiagnosisSchema = Objects.requireNonNull(builder.dadDiagnosisSchema, "dadDiagnosisSchema");
        this.edDiagnosisSchema = Objects.requireNonNull(builder.edDiagnosisSchema, "edDiagnosisSchema");
        this.dadProcedureSchema = Objects.requireNonNull(builder.dadProcedureSchema, "dadProcedureSchema");
        validate();
    }

    private void validate() {
        if (lookbackDays < 1) {
            throw new IllegalArgumentException("lookbackDays must be at least 1, was " + lookbackDays);
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, was " + parallelism);
        }
        if (progressInterval < 1) {
            throw new IllegalArgumentException("progressInterval must be at least 1, was " + progressInterval);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ExtractionConfig defaults() {
        return builder().build();
    }

    /**
     * Defaults overridden by environment variables and system properties.
     */
    public static ExtractionConfig loadDefault() {
        return fromLookup(key -> {
            String value = System.getenv(key);
            return value != null && !value.isBlank() ? value : System.getProperty(key);
        });
    }

    static ExtractionConfig fromLookup(Function<String, String> lookup) {
        Builder builder = builder();
        lookupValue(lookup, ENV_LOOKBACK_DAYS).flatMap(v -> parseInt(ENV_LOOKBACK_DAYS, v))
                .ifPresent(builder::lookbackDays);
        lookupValue(lookup, ENV_FEATURE_MODE).ifPresent(v -> builder.featureMode(FeatureMode.fromString(v)));
        lookupValue(lookup, ENV_MATCH_BACKEND).ifPresent(v -> builder.matchBackend(MatchBackend.fromString(v)));
        lookupValue(lookup, ENV_PARALLELISM).flatMap(v -> parseInt(ENV_PARALLELISM, v))
                .ifPresent(builder::parallelism);
        lookupValue(lookup, ENV_PROGRESS_INTERVAL).flatMap(v -> parseInt(ENV_PROGRESS_INTERVAL, v))
                .ifPresent(builder::progressInterval);
        lookupValue(lookup, ENV_DERIVE_EPISODE_PATIENT_ID)
                .ifPresent(v -> builder.deriveEpisodePatientId(Boolean.parseBoolean(v)));
        return builder.build();
    }

    private static Optional<String> lookupValue(Function<String, String> lookup, String key) {
        String value = lookup.apply(key);
        if (value != null && !value.trim().isEmpty()) {
            logger.fine("Loaded " + key + "=" + value.trim());
            return Optional.of(value.trim());
        }
        return Optional.empty();
    }

    private static Optional<Integer> parseInt(String key, String value) {
        try {
            return Optional.of(Integer.parseInt(value));
        } catch (NumberFormatException e) {
            logger.warning("Invalid int value for " + key + ": " + value + ", keeping default");
            return Optional.empty();
        }
    }

    public Builder toBuilder() {
        return builder()
                .lookbackDays(lookbackDays)
                .featureMode(featureMode)
                .matchBackend(matchBackend)
                .parallelism(parallelism)
                .progressInterval(progressInterval)
                .deriveEpisodePatientId(deriveEpisodePatientId)
                .episodeSchema(episodeSchema)
                .dadDiagnosisSchema(dadDiagnosisSchema)
                .edDiagnosisSchema(edDiagnosisSchema)
                .dadProcedureSchema(dadProcedureSchema);
    }

    public int lookbackDays() {
        return lookbackDays;
    }

    public FeatureMode featureMode() {
        return featureMode;
    }

    public MatchBackend matchBackend() {
        return matchBackend;
    }

    public int parallelism() {
        return parallelism;
    }

    public int progressInterval() {
        return progressInterval;
    }

    public boolean deriveEpisodePatientId() {
        return deriveEpisodePatientId;
    }

    public EpisodeSchema episodeSchema() {
        return episodeSchema;
    }

    public SourceSchema dadDiagnosisSchema() {
        return dadDiagnosisSchema;
    }

    public SourceSchema edDiagnosisSchema() {
        return edDiagnosisSchema;
    }

    public SourceSchema dadProcedureSchema() {
        return dadProcedureSchema;
    }

    @Override
    public String toString() {
        return "ExtractionConfig{lookbackDays=" + lookbackDays
                + ", featureMode=" + featureMode.label()
                + ", matchBackend=" + matchBackend
                + ", parallelism=" + parallelism
                + ", progressInterval=" + progressInterval
                + ", deriveEpisodePatientId=" + deriveEpisodePatientId + '}';
    }

    public static final class Builder {
        private int lookbackDays = DEFAULT_LOOKBACK_DAYS;
        private FeatureMode featureMode = FeatureMode.BOTH;
        private MatchBackend matchBackend = MatchBackend.INDEXED;
        private int parallelism = 1;
        private int progressInterval = DEFAULT_PROGRESS_INTERVAL;
        private boolean deriveEpisodePatientId;
        private EpisodeSchema episodeSchema = EpisodeSchema.DEFAULT;
        private SourceSchema dadDiagnosisSchema = SourceSchema.dadDiagnosis();
        private SourceSchema edDiagnosisSchema = SourceSchema.edDiagnosis();
        private SourceSchema dadProcedureSchema = SourceSchema.dadProcedure();

        private Builder() {
        }

        public Builder lookbackDays(int days) {
            this.lookbackDays = days;
            return this;
        }

        public Builder featureMode(FeatureMode mode) {
            this.featureMode = mode;
            return this;
        }

        public Builder matchBackend(MatchBackend backend) {
            this.matchBackend = backend;
            return this;
        }

        public Builder parallelism(int threads) {
            this.parallelism = threads;
            return this;
        }

        public Builder progressInterval(int patients) {
            this.progressInterval = patients;
            return this;
        }

        public Builder deriveEpisodePatientId(boolean derive) {
            this.deriveEpisodePatientId = derive;
            return this;
        }

        public Builder episodeSchema(EpisodeSchema schema) {
            this.episodeSchema = schema;
            return this;
        }

        public Builder dadDiagnosisSchema(SourceSchema schema) {
            this.dadDiagnosisSchema = schema;
            return this;
        }

        public Builder edDiagnosisSchema(SourceSchema schema) {
            this.edDiagnosisSchema = schema;
            return this;
        }

        public Builder dadProcedureSchema(SourceSchema schema) {
            this.dadProcedureSchema = schema;
            return this;
        }

        public ExtractionConfig build() {
            return new ExtractionConfig(this);
        }
    }
}
