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

import java.util.function.Supplier;

/**
 * Sink for the instrumentation of matcher exports.
 *
 * <p>The core module records through this interface only, so it carries no hard dependency on a
 * metrics library. Names are the constants in {@link MetricNames}; implementations decide how they
 * are namespaced.
 *
 * <p>Four kinds of measurement are recorded:
 * <ul>
 *   <li>counters for boundary calls, scanned bytes, reported matches and rejected calls</li>
 *   <li>timers for {@code construct} and {@code scan} latency, in nanoseconds</li>
 *   <li>distributions of per-call sizes: haystack bytes, automaton states</li>
 *   <li>gauges over linear memory and the matcher registry, read on demand</li>
 * </ul>
 *
 * <p>Implementations are called from whatever thread drives the exports and must be thread-safe.
 *
 * @since 1.0.0
 */
public interface AcMetricsRegistry {

    /**
     * Adds one to a counter.
     *
     * @param name counter name, e.g. {@link MetricNames#SCANS}
     */
    void incrementCounter(String name);

    /**
     * Adds {@code delta} to a counter.
     *
     * @param name counter name
     * @param delta non-negative amount, e.g. the number of bytes scanned
     */
    void incrementCounter(String name, long delta);

    /**
     * Records how long one boundary call took.
     *
     * @param name timer name, e.g. {@link MetricNames#SCANS_LATENCY}
     * @param durationNanos elapsed time in nanoseconds
     */
    void recordTimer(String name, long durationNanos);

    /**
     * Records one sample of a size distribution.
     *
     * @param name distribution name, e.g. {@link MetricNames#SCANS_HAYSTACK_BYTES}
     * @param value the sample
     */
    void recordDistribution(String name, long value);

    /**
     * Registers a gauge over live state, replacing any gauge of the same name.
     *
     * <p>The supplier is read by reporters on their own threads and must not block.
     *
     * @param name gauge name, e.g. {@link MetricNames#MEMORY_RESERVED}
     * @param valueSupplier reads the current value
     */
    void registerGauge(String name, Supplier<Number> valueSupplier);

    /**
     * Removes a gauge registered by {@link #registerGauge(String, Supplier)}. Unknown names are
     * ignored.
     *
     * @param name gauge name
     */
    void removeGauge(String name);
}
