/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.api.exceptions;

import java.util.List;

/**
 * Thrown when an input table is structurally unusable, for example when a required
 * column is missing. This is a configuration error and is never downgraded to a warning.
 */
public class SchemaException extends RuntimeException {

    private final String table;
    private final List<String> missingColumns;

    public SchemaException(String message) {
        super(message);
        this.table = null;
        this.missingColumns = List.of();
    }

    public SchemaException(String table, List<String> missingColumns) {
        super("Table '" + table + "' is missing required columns: " + missingColumns);
        this.table = table;
        this.missingColumns = List.copyOf(missingColumns);
    }

    public String table() {
        return table;
    }

    public List<String> missingColumns() {
        return missingColumns;
    }
}
