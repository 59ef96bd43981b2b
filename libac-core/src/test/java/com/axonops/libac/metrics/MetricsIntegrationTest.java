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

import com.axonops.libac.api.InvalidEncodingException;
import com.axonops.libac.api.InvalidHandleException;
import com.axonops.libac.api.InvalidRegionException;
import com.axonops.libac.api.MatcherExports;
import com.axonops.libac.api.SizeMismatchException;
import com.axonops.libac.memory.Region;
import com.axonops.libac.test.TestUtils;
import com.codahale.metrics.Counter;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests verifying metrics are actually collected during boundary calls.
 *
 * Builds exports with a Dropwizard adapter under the "test.ac" prefix, performs real
 * operations and checks the registry.
 */
class MetricsIntegrationTest {

    private MetricRegistry registry;
    private MatcherExports exports;

    @BeforeEach
    void setup() {
        registry = new MetricRegistry();
        exports = new MatcherExports(TestUtils.testConfigWithMetrics(registry, "test.ac").build());
    }

    @AfterEach
    void cleanup() {
        exports.close();
    }

    @Test
    void testConstructMetrics() {
        TestUtils.construct(exports, "he she hers");

        Counter constructed = registry.counter("test.ac.matchers.constructed.total.count");
        Counter patterns = registry.counter("test.ac.matchers.patterns.total.count");
        Timer latency = registry.timer("test.ac.matchers.construct.latency");

        assertThat(constructed.getCount()).isEqualTo(1);
        assertThat(patterns.getCount()).isEqualTo(3);
        assertThat(latency.getCount()).isEqualTo(1);
        assertThat(registry.histogram("test.ac.matchers.states.distribution").getSnapshot().getMax())
            .isEqualTo(9);

        TestUtils.construct(exports, "a b");

        assertThat(constructed.getCount()).isEqualTo(2);
        assertThat(patterns.getCount()).isEqualTo(5);
    }

    @Test
    void testScanMetrics() {
        int handle = TestUtils.construct(exports, "a");

        TestUtils.scan(exports, handle, "banana", 2);

        assertThat(registry.counter("test.ac.scans.total.count").getCount()).isEqualTo(1);
        assertThat(registry.counter("test.ac.scans.bytes.total.count").getCount()).isEqualTo(6);
        assertThat(registry.counter("test.ac.scans.matches.total.count").getCount()).isEqualTo(2);
        assertThat(registry.counter("test.ac.scans.truncated.total.count").getCount()).isEqualTo(1);
        assertThat(registry.timer("test.ac.scans.latency").getCount()).isEqualTo(1);
        assertThat(registry.histogram("test.ac.scans.haystack.bytes.distribution").getCount()).isEqualTo(1);

        TestUtils.scan(exports, handle, "banana", 3);

        assertThat(registry.counter("test.ac.scans.matches.total.count").getCount()).isEqualTo(5);
        assertThat(registry.counter("test.ac.scans.truncated.total.count").getCount()).isEqualTo(1);
    }

    @Test
    void testMemoryCounters() {
        int ptr = exports.reserve(32);
        exports.release(ptr, 32);

        assertThat(registry.counter("test.ac.memory.reservations.total.count").getCount()).isEqualTo(1);
        assertThat(registry.counter("test.ac.memory.releases.total.count").getCount()).isEqualTo(1);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testGauges() {
        assertThat(registry.getGauges()).containsKeys(
            "test.ac.memory.reserved.current.bytes",
            "test.ac.memory.reserved.peak.bytes",
            "test.ac.memory.regions.current.count",
            "test.ac.memory.capacity.current.bytes",
            "test.ac.registry.matchers.current.count",
            "test.ac.registry.automaton_memory.current.bytes"
        );

        Gauge<Number> reserved = (Gauge<Number>) registry.getGauges().get("test.ac.memory.reserved.current.bytes");
        Gauge<Number> peak = (Gauge<Number>) registry.getGauges().get("test.ac.memory.reserved.peak.bytes");
        Gauge<Number> regions = (Gauge<Number>) registry.getGauges().get("test.ac.memory.regions.current.count");
        Gauge<Number> capacity = (Gauge<Number>) registry.getGauges().get("test.ac.memory.capacity.current.bytes");
        Gauge<Number> matchers = (Gauge<Number>) registry.getGauges().get("test.ac.registry.matchers.current.count");
        Gauge<Number> automatonMemory =
            (Gauge<Number>) registry.getGauges().get("test.ac.registry.automaton_memory.current.bytes");

        assertThat(reserved.getValue().longValue()).isZero();
        assertThat(capacity.getValue().longValue()).isEqualTo(65536L);
        assertThat(matchers.getValue().intValue()).isZero();

        Region region = exports.reserve(new byte[100]);
        assertThat(reserved.getValue().longValue()).isEqualTo(100L);
        assertThat(regions.getValue().intValue()).isEqualTo(1);
        exports.release(region);

        assertThat(reserved.getValue().longValue()).isZero();
        assertThat(peak.getValue().longValue()).isEqualTo(100L);
        assertThat(regions.getValue().intValue()).isZero();

        TestUtils.construct(exports, "needle haystack");
        assertThat(matchers.getValue().intValue()).isEqualTo(1);
        assertThat(automatonMemory.getValue().longValue()).isPositive();
    }

    @Test
    void testErrorCounters() {
        int ptr = exports.reserve(16);
        assertThatThrownBy(() -> exports.release(ptr, 15)).isInstanceOf(SizeMismatchException.class);
        exports.release(ptr, 16);
        assertThatThrownBy(() -> exports.release(ptr, 16)).isInstanceOf(InvalidRegionException.class);

        Region haystack = exports.reserve("x".getBytes(StandardCharsets.UTF_8));
        assertThatThrownBy(() -> exports.scan(7, haystack.ptr(), haystack.length(), 0, haystack.ptr()))
            .isInstanceOf(InvalidHandleException.class);
        exports.release(haystack);

        Region invalid = exports.reserve(new byte[] {(byte) 0xc3});
        assertThatThrownBy(() -> exports.construct(invalid.ptr(), invalid.length()))
            .isInstanceOf(InvalidEncodingException.class);
        exports.release(invalid);

        assertThat(registry.counter("test.ac.errors.size_mismatch.total.count").getCount()).isEqualTo(1);
        assertThat(registry.counter("test.ac.errors.invalid_region.total.count").getCount()).isEqualTo(1);
        assertThat(registry.counter("test.ac.errors.invalid_handle.total.count").getCount()).isEqualTo(1);
        assertThat(registry.counter("test.ac.errors.invalid_encoding.total.count").getCount()).isEqualTo(1);
    }

    @Test
    void testAdapterQualifiesNames() {
        DropwizardMetricsAdapter adapter = new DropwizardMetricsAdapter(registry, "test.ac");

        assertThat(adapter.prefix()).isEqualTo("test.ac");
        assertThat(adapter.qualify(MetricNames.SCANS)).isEqualTo("test.ac.scans.total.count");
        assertThat(new DropwizardMetricsAdapter(registry).qualify(MetricNames.SCANS))
            .isEqualTo("com.axonops.libac.scans.total.count");
    }

    @Test
    void testGaugesRemovedOnClose() {
        exports.close();

        assertThat(registry.getGauges()).isEmpty();
    }

    @Test
    void testNoOpRegistryIsInert() {
        NoOpMetricsRegistry noOp = NoOpMetricsRegistry.INSTANCE;

        noOp.incrementCounter(MetricNames.SCANS);
        noOp.incrementCounter(MetricNames.SCANS_BYTES, 10);
        noOp.recordTimer(MetricNames.SCANS_LATENCY, 1000);
        noOp.recordDistribution(MetricNames.SCANS_HAYSTACK_BYTES, 42);
        noOp.registerGauge(MetricNames.MEMORY_RESERVED, () -> 1L);
        noOp.removeGauge(MetricNames.MEMORY_RESERVED);
    }
}
