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

import com.axonops.libac.api.MatcherExports;
import com.axonops.libac.api.ScanResult;
import com.axonops.libac.config.AcConfig;
import com.axonops.libac.memory.Region;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.management.MBeanServer;
import javax.management.ObjectName;
import java.lang.management.ManagementFactory;
import java.nio.charset.StandardCharsets;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * JMX integration tests.
 *
 * Verifies that metrics are actually exposed via JMX and accessible
 * through the platform MBean server.
 */
class JmxIntegrationTest {

    private JmxReporter jmxReporter;
    private MetricRegistry registry;
    private MatcherExports exports;

    @BeforeEach
    void setup() {
        registry = new MetricRegistry();

        jmxReporter = JmxReporter.forRegistry(registry).build();
        jmxReporter.start();
    }

    @AfterEach
    void cleanup() {
        if (exports != null) {
            exports.close();
        }
        if (jmxReporter != null) {
            jmxReporter.stop();
        }
    }

    @Test
    void testMetricsExposedViaJmx() throws Exception {
        AcConfig config = AcMetricsConfig.withMetrics(registry, "com.test.jmx", false);
        exports = new MatcherExports(config);

        int handle = construct("he she hers");
        scan(handle, "ushers", 4);

        MBeanServer mBeanServer = ManagementFactory.getPlatformMBeanServer();
        Set<ObjectName> mbeans = mBeanServer.queryNames(
            new ObjectName("metrics:name=com.test.jmx.*,type=*"), null
        );

        assertThat(mbeans)
            .as("JMX MBeans should be registered for libac metrics")
            .hasSizeGreaterThan(5);

        assertThat(mbeans)
            .as("registry.matchers.current.count gauge should be in JMX")
            .anyMatch(name -> name.toString().contains("registry.matchers.current.count")
                && name.toString().contains("type=gauges"));
        assertThat(mbeans)
            .as("scans.total.count counter should be in JMX")
            .anyMatch(name -> name.toString().contains("scans.total.count")
                && name.toString().contains("type=counters"));
        assertThat(mbeans)
            .as("matchers.construct.latency timer should be in JMX")
            .anyMatch(name -> name.toString().contains("matchers.construct.latency")
                && name.toString().contains("type=timers"));
    }

    @Test
    void testJmxGaugeReadable() throws Exception {
        AcConfig config = AcMetricsConfig.withMetrics(registry, "jmx.readable.test", false);
        exports = new MatcherExports(config);

        construct("p1");
        construct("p2 p3");
        construct("p4");

        MBeanServer mBeanServer = ManagementFactory.getPlatformMBeanServer();
        ObjectName matchersName = new ObjectName("metrics:name=jmx.readable.test.registry.matchers.current.count,type=gauges");

        assertThat(mBeanServer.isRegistered(matchersName))
            .as("registry.matchers.current.count gauge should be registered in JMX")
            .isTrue();

        Object value = mBeanServer.getAttribute(matchersName, "Value");

        assertThat(value).isInstanceOf(Number.class);
        assertThat(((Number) value).intValue())
            .as("Matcher count via JMX should reflect the registry (3 automatons)")
            .isEqualTo(3);
    }

    @Test
    void testJmxTimerStatistics() throws Exception {
        AcConfig config = AcMetricsConfig.withMetrics(registry, "jmx.timer.test", false);
        exports = new MatcherExports(config);

        int handle = construct("needle");
        for (int i = 0; i < 50; i++) {
            scan(handle, "hay needle hay " + i, 2);
        }

        assertThat(registry.getTimers().keySet())
            .as("Timer should exist in MetricRegistry")
            .contains("jmx.timer.test.scans.latency");

        MBeanServer mBeanServer = ManagementFactory.getPlatformMBeanServer();
        ObjectName timerName = new ObjectName("metrics:name=jmx.timer.test.scans.latency,type=timers");

        assertThat(mBeanServer.isRegistered(timerName))
            .as("Scan latency timer should be in JMX")
            .isTrue();

        long countValue = ((Number) mBeanServer.getAttribute(timerName, "Count")).longValue();
        assertThat(countValue)
            .as("Timer count via JMX")
            .isEqualTo(50);

        assertThat(mBeanServer.getAttribute(timerName, "Min")).as("Timer min attribute exists").isNotNull();
        assertThat(mBeanServer.getAttribute(timerName, "Max")).as("Timer max attribute exists").isNotNull();
    }

    @Test
    void testGaugesUnregisteredOnClose() throws Exception {
        AcConfig config = AcMetricsConfig.withMetrics(registry, "jmx.close.test", false);
        exports = new MatcherExports(config);

        MBeanServer mBeanServer = ManagementFactory.getPlatformMBeanServer();
        ObjectName capacityName = new ObjectName("metrics:name=jmx.close.test.memory.capacity.current.bytes,type=gauges");
        assertThat(mBeanServer.isRegistered(capacityName)).isTrue();

        exports.close();

        assertThat(mBeanServer.isRegistered(capacityName))
            .as("Gauges should leave JMX when the exports close")
            .isFalse();
    }

    private int construct(String patterns) {
        Region region = exports.reserve(patterns.getBytes(StandardCharsets.UTF_8));
        try {
            return exports.construct(region.ptr(), region.length());
        } finally {
            exports.release(region);
        }
    }

    private ScanResult scan(int handle, String haystack, int capacity) {
        Region input = exports.reserve(haystack.getBytes(StandardCharsets.UTF_8));
        int out = exports.reserve(8 * capacity);
        try {
            return exports.scan(handle, input.ptr(), input.length(), capacity, out);
        } finally {
            exports.release(out, 8 * capacity);
            exports.release(input);
        }
    }
}
