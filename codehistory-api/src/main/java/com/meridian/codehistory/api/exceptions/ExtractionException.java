/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.api.exceptions;

/**
 * Thrown when an extraction run fails for a reason other than a schema violation,
 * such as a worker failure during parallel processing.
 */
public class ExtractionException extends RuntimeException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
