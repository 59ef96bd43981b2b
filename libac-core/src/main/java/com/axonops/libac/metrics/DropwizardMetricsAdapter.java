/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.axonops.libac.metrics;

import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Forwards matcher export instrumentation to a Dropwizard {@link MetricRegistry}.
 *
 * <p>Every name from {@link MetricNames} is qualified with a prefix, so several exports instances
 * can share one registry as long as each has its own prefix. Counters map to Dropwizard counters,
 * timers to timers, distributions to histograms and gauges to gauges.
 *
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * AcConfig config = AcConfig.builder()
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "com.myapp.keywords"))
 *     .build();
 * // registry now receives com.myapp.keywords.scans.total.count, ...
 * }</pre>
 *
 * @since 1.0.0
 */
public final class DropwizardMetricsAdapter implements AcMetricsRegistry {

    /** Prefix used when none is given. */
    public static final String DEFAULT_PREFIX = "com.axonops.libac";

    private final MetricRegistry registry;
    private final String prefix;

    public DropwizardMetricsAdapter(MetricRegistry registry) {
        this(registry, DEFAULT_PREFIX);
    }

    /**
     * @param registry registry receiving the metrics
     * @param prefix namespace for every metric name, without a trailing dot
     */
    public DropwizardMetricsAdapter(MetricRegistry registry, String prefix) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.prefix = Objects.requireNonNull(prefix, "prefix cannot be null");
    }

    @Override
    public void incrementCounter(String name) {
        registry.counter(qualify(name)).inc();
    }

    @Override
    public void incrementCounter(String name, long delta) {
        registry.counter(qualify(name)).inc(delta);
    }

    @Override
    public void recordTimer(String name, long durationNanos) {
        registry.timer(qualify(name)).update(durationNanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void recordDistribution(String name, long value) {
        registry.histogram(qualify(name)).update(value);
    }

    @Override
    public void registerGauge(String name, Supplier<Number> valueSupplier) {
        Objects.requireNonNull(valueSupplier, "valueSupplier cannot be null");
        String qualified = qualify(name);
        // A second exports instance on the same prefix takes the name over.
        registry.remove(qualified);
        registry.register(qualified, (Gauge<Number>) valueSupplier::get);
    }

    @Override
    public void removeGauge(String name) {
        registry.remove(qualify(name));
    }

    /** The namespace prepended to every metric name. */
    public String prefix() {
        return prefix;
    }

    /** The fully qualified name {@code name} is recorded under. */
    public String qualify(String name) {
        return MetricRegistry.name(prefix, name);
    }
}
