/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.infra.metrics.impl.inmemory;

import com.meridian.codehistory.infra.metrics.Counter;

import java.util.concurrent.atomic.LongAdder;

final class InMemoryCounter implements Counter {
    private final LongAdder value = new LongAdder();
    private final String key;

    InMemoryCounter(String key) {
        this.key = key;
    }

    @Override
    public void increment() {
        value.increment();
    }

    @Override
    public void increment(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Counter '" + key + "' cannot decrease: " + amount);
        }
        value.add(amount);
    }

    @Override
    public long count() {
        return value.sum();
    }

    @Override
    public String toString() {
        return "InMemoryCounter{" + key + "=" + count() + "}";
    }
}
