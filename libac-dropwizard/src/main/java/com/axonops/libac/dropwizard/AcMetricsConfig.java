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

package com.axonops.libac.dropwizard;

import com.axonops.libac.config.AcConfig;
import com.axonops.libac.metrics.DropwizardMetricsAdapter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Convenience factory for AcConfig with Dropwizard Metrics integration.
 *
 * <p>Wires a {@link DropwizardMetricsAdapter} into the configuration and, unless told otherwise,
 * exposes the registry over JMX so scan, construction and memory metrics are visible to any JMX
 * console.
 *
 * <p><strong>Usage Examples:</strong>
 * <pre>{@code
 * // Existing application registry, JMX on:
 * AcConfig config = AcMetricsConfig.withMetrics(appRegistry, "com.myapp.keywords");
 *
 * // Start from a tuned builder:
 * AcConfig config = AcMetricsConfig.withMetrics(
 *     AcConfig.builder().failOnTruncation(true), registry, "com.myapp.keywords", false);
 *
 * try (MatcherExports exports = new MatcherExports(config)) {
 *     ...
 * }
 * }</pre>
 *
 * <p><strong>JMX Exposure:</strong> one JmxReporter is started for the first registry passed
 * with JMX enabled. Later calls reuse it.
 *
 * @since 1.0.0
 */
public final class AcMetricsConfig {
    private static final Logger logger = LoggerFactory.getLogger(AcMetricsConfig.class);
    private static volatile JmxReporter jmxReporter;

    private AcMetricsConfig() {
        // Utility class
    }

    /**
     * Creates AcConfig with Dropwizard Metrics integration and automatic JMX.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @return configured AcConfig with metrics enabled
     */
    public static AcConfig withMetrics(MetricRegistry registry, String metricPrefix) {
        return withMetrics(registry, metricPrefix, true);
    }

    /**
     * Creates AcConfig with Dropwizard Metrics integration.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to automatically set up JMX exposure
     * @return configured AcConfig with metrics enabled
     */
    public static AcConfig withMetrics(MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        return withMetrics(AcConfig.builder(), registry, metricPrefix, enableJmx);
    }

    /**
     * Creates AcConfig with Dropwizard Metrics using the default prefix
     * {@value DropwizardMetricsAdapter#DEFAULT_PREFIX}.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @return configured AcConfig with metrics enabled
     */
    public static AcConfig withMetrics(MetricRegistry registry) {
        return withMetrics(registry, DropwizardMetricsAdapter.DEFAULT_PREFIX, true);
    }

    /**
     * Adds Dropwizard Metrics to a partially configured builder.
     *
     * @param builder builder carrying the other settings
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to automatically set up JMX exposure
     * @return configured AcConfig with metrics enabled
     */
    public static AcConfig withMetrics(
            AcConfig.Builder builder, MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        Objects.requireNonNull(builder, "builder cannot be null");
        Objects.requireNonNull(registry, "registry cannot be null");
        Objects.requireNonNull(metricPrefix, "metricPrefix cannot be null");

        if (enableJmx) {
            ensureJmxReporter(registry);
        }

        return builder
            .metricsRegistry(new DropwizardMetricsAdapter(registry, metricPrefix))
            .build();
    }

    /**
     * Ensures a JmxReporter is registered.
     *
     * <p>Idempotent: only the first call creates a reporter.
     *
     * @param registry the MetricRegistry to expose via JMX
     */
    private static synchronized void ensureJmxReporter(MetricRegistry registry) {
        if (jmxReporter == null) {
            try {
                logger.info("libac: Registering JmxReporter for metrics");
                jmxReporter = JmxReporter.forRegistry(registry).build();
                jmxReporter.start();
                logger.info("libac: JmxReporter started - metrics available via JMX");
            } catch (RuntimeException e) {
                // Not fatal: the host may already expose the registry itself.
                logger.warn("libac: Failed to start JmxReporter (may already be configured)", e);
            }
        }
    }

    /** Whether a reporter started by this class is running. */
    public static synchronized boolean isJmxReporterRunning() {
        return jmxReporter != null;
    }

    /**
     * Stops the JmxReporter started by this class, if any.
     */
    public static synchronized void shutdown() {
        if (jmxReporter != null) {
            logger.info("libac: Stopping JmxReporter");
            jmxReporter.stop();
            jmxReporter = null;
        }
    }
}
