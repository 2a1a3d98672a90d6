/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.infra.metrics.impl.inmemory;

import com.meridian.codehistory.infra.metrics.Counter;
import com.meridian.codehistory.infra.metrics.Gauge;
import com.meridian.codehistory.infra.metrics.MetricsRegistry;
import com.meridian.codehistory.infra.metrics.Timer;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory metrics registry.
 *
 * <p>Provides access to recorded values for assertions:
 * <pre>{@code
 * InMemoryMetricsRegistry metrics = new InMemoryMetricsRegistry();
 * metrics.counter("codehistory_records_dropped_total", "source", "ed").increment(3);
 *
 * assertThat(metrics.getCounterValue("codehistory_records_dropped_total", "source", "ed")).isEqualTo(3L);
 * }</pre>
 */
public final class InMemoryMetricsRegistry implements MetricsRegistry {

    private final Map<String, InMemoryCounter> counters = new ConcurrentHashMap<>();
    private final Map<String, InMemoryGauge> gauges = new ConcurrentHashMap<>();
    private final Map<String, InMemoryTimer> timers = new ConcurrentHashMap<>();

    @Override
    public Counter counter(String name, String... tags) {
        return counters.computeIfAbsent(MetricsRegistry.key(name, tags), InMemoryCounter::new);
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return gauges.computeIfAbsent(MetricsRegistry.key(name, tags), InMemoryGauge::new);
    }

    @Override
    public Timer timer(String name, String... tags) {
        return timers.computeIfAbsent(MetricsRegistry.key(name, tags), InMemoryTimer::new);
    }

    // Test helper methods

    public long getCounterValue(String name, String... tags) {
        Counter counter = counters.get(MetricsRegistry.key(name, tags));
        return counter != null ? counter.count() : 0L;
    }

    public double getGaugeValue(String name, String... tags) {
        Gauge gauge = gauges.get(MetricsRegistry.key(name, tags));
        return gauge != null ? gauge.value() : 0.0;
    }

    public List<Duration> getTimerRecordings(String name, String... tags) {
        InMemoryTimer timer = timers.get(MetricsRegistry.key(name, tags));
        return timer != null ? timer.getRecordings() : List.of();
    }

    /**
     * Point-in-time view of every counter and gauge, keyed by metric identity.
     */
    public Map<String, Object> snapshot() {
        Map<String, Object> out = new TreeMap<>();
        counters.forEach((k, c) -> out.put(k, c.count()));
        gauges.forEach((k, g) -> out.put(k, g.value()));
        timers.forEach((k, t) -> out.put(k, t.count()));
        return out;
    }

    public void reset() {
        counters.clear();
        gauges.clear();
        timers.clear();
    }
}
