/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.infra.metrics.impl.inmemory;

import com.meridian.codehistory.infra.metrics.MetricsRegistry;
import com.meridian.codehistory.infra.metrics.api.MetricsRegistryProvider;

/**
 * Default provider, registered in {@code META-INF/services}.
 */
public final class InMemoryMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new InMemoryMetricsRegistry();
    }

    @Override
    public int priority() {
        return 100;
    }

    @Override
    public String name() {
        return "InMemory";
    }
}
