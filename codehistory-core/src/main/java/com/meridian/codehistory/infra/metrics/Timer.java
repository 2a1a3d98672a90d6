/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.infra.metrics;

import java.time.Duration;

/**
 * Latency histogram with percentile tracking.
 * Thread-safe.
 */
public interface Timer {

    /**
     * Records a pre-measured duration.
     */
    void record(Duration duration);

    default void recordNanos(long nanos) {
        record(Duration.ofNanos(nanos));
    }

    /**
     * Gets percentile value.
     *
     * @param percentile value between 0.0 and 1.0
     * @return duration at percentile
     */
    Duration percentile(double percentile);

    long count();
}
