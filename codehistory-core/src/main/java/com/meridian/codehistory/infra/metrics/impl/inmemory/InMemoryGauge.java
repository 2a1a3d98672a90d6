/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.infra.metrics.impl.inmemory;

import com.meridian.codehistory.infra.metrics.Gauge;

final class InMemoryGauge implements Gauge {
    private volatile double value;
    private final String key;

    InMemoryGauge(String key) {
        this.key = key;
    }

    @Override
    public void set(double value) {
        this.value = value;
    }

    @Override
    public double value() {
        return value;
    }

    @Override
    public String toString() {
        return "InMemoryGauge{" + key + "=" + value + "}";
    }
}
