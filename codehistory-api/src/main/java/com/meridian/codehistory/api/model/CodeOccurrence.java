/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.api.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A single code attached to an encounter record, with the date the code occurred on.
 *
 * <p>For diagnosis sources the occurrence date is the record's primary date. Procedure
 * sources may carry a per-code date; when it is missing the record's primary date is
 * used instead. The occurrence date is reported only; window matching always uses the
 * containing record's interval.
 */
public record CodeOccurrence(String code, LocalDate occurredOn) implements Comparable<CodeOccurrence> {

    public CodeOccurrence {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Code cannot be null or blank");
        }
        Objects.requireNonNull(occurredOn, "occurredOn");
        code = code.trim();
    }

    @Override
    public int compareTo(CodeOccurrence other) {
        int byCode = code.compareTo(other.code);
        return byCode != 0 ? byCode : occurredOn.compareTo(other.occurredOn);
    }
}
