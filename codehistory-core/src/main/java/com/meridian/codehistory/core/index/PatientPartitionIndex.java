/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.core.index;

import com.meridian.codehistory.core.preprocess.PatientIds;

import java.util.Collections;
import java.util.Map;

/**
 * Immutable per-patient index of one encounter source.
 *
 * <p>Built once by {@link PartitionIndexBuilder}; rebuilding is the only way to reflect new
 * data.
 */
public final class PatientPartitionIndex {

    private final String source;
    private final Map<String, PatientPartition> partitions;
    private final CodeDictionary dictionary;
    private final IndexStats stats;

    PatientPartitionIndex(String source, Map<String, PatientPartition> partitions,
                          CodeDictionary dictionary, IndexStats stats) {
        this.source = source;
        this.partitions = Collections.unmodifiableMap(partitions);
        this.dictionary = dictionary;
        this.stats = stats;
    }

    /**
     * @return the patient's partition, or {@link PatientPartition#EMPTY} if the patient has
     * no records in this source
     */
    public PatientPartition partitionFor(String patientId) {
        String key = PatientIds.normalize(patientId);
        if (key == null) {
            return PatientPartition.EMPTY;
        }
        return partitions.getOrDefault(key, PatientPartition.EMPTY);
    }

    public String source() {
        return source;
    }

    public CodeDictionary dictionary() {
        return dictionary;
    }

    public IndexStats stats() {
        return stats;
    }

    public int patientCount() {
        return partitions.size();
    }
}
