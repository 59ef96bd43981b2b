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

package com.axonops.libac.api;

import com.axonops.libac.automaton.Automaton;
import com.axonops.libac.automaton.AutomatonBuilder;
import com.axonops.libac.automaton.Match;
import com.axonops.libac.config.AcConfig;
import com.axonops.libac.memory.MemoryBridge;
import com.axonops.libac.memory.MemoryStatistics;
import com.axonops.libac.memory.Region;
import com.axonops.libac.metrics.AcMetricsRegistry;
import com.axonops.libac.metrics.MetricNames;
import com.axonops.libac.registry.MatcherRegistry;
import com.axonops.libac.registry.RegistryStatistics;
import com.axonops.libac.util.PatternHasher;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The operations a host calls across the memory boundary.
 *
 * <p>Only plain integers cross the boundary: offsets and lengths into linear memory, matcher
 * handles and counts. Strings travel as UTF-8 bytes in regions the host reserves with {@link
 * #reserve(int)} and later hands back with {@link #release(int, int)}.
 *
 * <h2>Protocol</h2>
 *
 * <ol>
 *   <li>Reserve a region, write the space-separated pattern list into it, call {@link
 *       #construct(int, int)} and keep the returned handle. Release the region.
 *   <li>Reserve a region for the haystack and one of {@code 8 * capacity} bytes for results.
 *   <li>Call {@link #scan(int, int, int, int, int)}; read {@code count} little-endian u32 pairs
 *       from the output region.
 *   <li>Release both regions with the sizes they were reserved with.
 * </ol>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * try (MatcherExports exports = new MatcherExports(AcConfig.DEFAULT)) {
 *     Region patterns = exports.reserve("he she hers".getBytes(StandardCharsets.UTF_8));
 *     int handle = exports.construct(patterns.ptr(), patterns.length());
 *     exports.release(patterns);
 *
 *     Region haystack = exports.reserve("shers".getBytes(StandardCharsets.UTF_8));
 *     int out = exports.reserve(8 * 16);
 *     ScanResult result = exports.scan(handle, haystack.ptr(), haystack.length(), 16, out);
 *     List<MatchSpan> spans = exports.readMatches(out, result.count()); // [(0, 3)]
 *     exports.release(haystack);
 *     exports.release(out, 8 * 16);
 * }
 * }</pre>
 *
 * <p>Every entry point validates its arguments before acting: unknown handles, out-of-range or
 * unowned memory, malformed UTF-8 and mismatched release sizes are reported as {@link AcException}
 * subclasses and leave no partial state behind.
 *
 * <p>Thread-safe. Each instance owns its linear memory and its registry; instances share nothing.
 *
 * @since 1.0.0
 */
public final class MatcherExports implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(MatcherExports.class);

    private final AcConfig config;
    private final AcMetricsRegistry metrics;
    private final MemoryBridge bridge;
    private final MatcherRegistry registry;
    private volatile boolean closed;

    public MatcherExports() {
        this(AcConfig.DEFAULT);
    }

    public MatcherExports(AcConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.metrics = config.metricsRegistry();
        this.bridge = new MemoryBridge(config);
        this.registry = new MatcherRegistry(config.maxRegisteredMatchers(), metrics);
        registerGauges();
        logger.debug("libac: Matcher exports initialized - memory: {} bytes, max: {} bytes, matchKind: {}",
            bridge.memory().size(), bridge.memory().maxSize(), config.matchKind());
    }

    /**
     * Builds an automaton from a space-separated pattern list held in host memory.
     *
     * <p>The text is split on single ASCII spaces; consecutive, leading or trailing spaces yield
     * empty patterns, which match the empty string. The host keeps ownership of the input region.
     *
     * @param patternsPtr offset of the UTF-8 pattern list
     * @param patternsLen its length in bytes
     * @return handle of the new automaton
     * @throws InvalidRegionException if the range may not be read
     * @throws InvalidEncodingException if the pattern list is not well-formed UTF-8
     * @throws ResourceException if the registry is full
     */
    public int construct(int patternsPtr, int patternsLen) {
        checkOpen();
        long startNanos = System.nanoTime();

        String text = bridge.decode(patternsPtr, patternsLen);
        List<String> patterns = Arrays.asList(text.split(" ", -1));

        Automaton automaton = new AutomatonBuilder()
            .matchKind(config.matchKind())
            .asciiCaseInsensitive(config.asciiCaseInsensitive())
            .build(patterns);
        int handle = registry.register(automaton);

        long durationNanos = System.nanoTime() - startNanos;
        metrics.incrementCounter(MetricNames.MATCHERS_CONSTRUCTED);
        metrics.incrementCounter(MetricNames.MATCHERS_PATTERNS, patterns.size());
        metrics.recordTimer(MetricNames.MATCHERS_CONSTRUCT_LATENCY, durationNanos);
        metrics.recordDistribution(MetricNames.MATCHERS_STATES, automaton.stateCount());

        logger.debug("libac: Matcher constructed - handle: {}, patterns: {}, states: {}, tableBytes: {}, timeNs: {}",
            handle, PatternHasher.hash(patterns), automaton.stateCount(), automaton.memoryBytes(), durationNanos);
        return handle;
    }

    /**
     * Scans a haystack held in host memory and writes match offsets back.
     *
     * <p>Matches are leftmost-longest (or leftmost-first, per configuration), non-overlapping and in
     * increasing start order. At most {@code capacity} pairs are written, as consecutive
     * little-endian u32 {@code (start, end)} values starting at {@code outPtr}. The whole output
     * range {@code [outPtr, outPtr + 8 * capacity)} is validated before anything is written and
     * nothing is written past it.
     *
     * @param handle automaton handle from {@link #construct(int, int)}
     * @param haystackPtr offset of the haystack
     * @param haystackLen haystack length in bytes
     * @param capacity maximum pairs to write
     * @param outPtr offset of the output region
     * @return pairs written and whether matches were dropped
     * @throws InvalidHandleException if the handle is unknown
     * @throws InvalidRegionException if the haystack or output range may not be accessed
     * @throws InvalidEncodingException if haystack validation is enabled and it is not UTF-8
     * @throws CapacityExceededException if matches were dropped and {@code failOnTruncation} is set
     */
    public ScanResult scan(int handle, int haystackPtr, int haystackLen, int capacity, int outPtr) {
        checkOpen();
        long startNanos = System.nanoTime();

        Automaton automaton = registry.lookup(handle);
        bridge.checkPairsWritable(outPtr, capacity);
        byte[] haystack = config.validateHaystackEncoding()
            ? bridge.readUtf8Bytes(haystackPtr, haystackLen)
            : bridge.readBytes(haystackPtr, haystackLen);

        int[] pairs = new int[2 * Math.min(capacity, 16)];
        int count = 0;
        Iterator<Match> matches = automaton.findIter(haystack).iterator();
        while (count < capacity && matches.hasNext()) {
            Match match = matches.next();
            if (2 * count == pairs.length) {
                pairs = Arrays.copyOf(pairs, pairs.length * 2);
            }
            pairs[2 * count] = match.start();
            pairs[2 * count + 1] = match.end();
            count++;
        }
        boolean truncated = matches.hasNext();
        bridge.writePairs(outPtr, pairs, count);

        long durationNanos = System.nanoTime() - startNanos;
        metrics.incrementCounter(MetricNames.SCANS);
        metrics.incrementCounter(MetricNames.SCANS_BYTES, haystackLen);
        metrics.incrementCounter(MetricNames.SCANS_MATCHES, count);
        metrics.recordTimer(MetricNames.SCANS_LATENCY, durationNanos);
        metrics.recordDistribution(MetricNames.SCANS_HAYSTACK_BYTES, haystackLen);

        if (truncated) {
            metrics.incrementCounter(MetricNames.SCANS_TRUNCATED);
            logger.debug("libac: Scan truncated - handle: {}, capacity: {}", handle, capacity);
            if (config.failOnTruncation()) {
                throw new CapacityExceededException(capacity);
            }
        }

        logger.trace("libac: Scan complete - handle: {}, haystackBytes: {}, matches: {}, timeNs: {}",
            handle, haystackLen, count, durationNanos);
        return new ScanResult(count, truncated);
    }

    /**
     * Reserves {@code size} zeroed bytes of linear memory and transfers them to the host.
     *
     * @param size bytes to reserve (≥ 0)
     * @return offset of the region; never 0
     * @throws InvalidRegionException if size is negative
     * @throws ResourceException if linear memory cannot grow further
     */
    public int reserve(int size) {
        checkOpen();
        return bridge.reserve(size).ptr();
    }

    /**
     * Takes back a region reserved with {@link #reserve(int)}.
     *
     * @param ptr offset returned by {@code reserve}
     * @param size the exact size passed to {@code reserve}
     * @throws InvalidRegionException if {@code ptr} is not a live region
     * @throws SizeMismatchException if {@code size} differs from the reserved size
     */
    public void release(int ptr, int size) {
        checkOpen();
        bridge.release(ptr, size);
    }

    /**
     * Reserves a region holding a copy of {@code data}.
     *
     * @param data bytes to copy into linear memory
     * @return the region, owned by the caller
     */
    public Region reserve(byte[] data) {
        checkOpen();
        return bridge.copyIn(data);
    }

    public void release(Region region) {
        checkOpen();
        bridge.release(region);
    }

    /** Copies a region's bytes out of linear memory. */
    public byte[] read(Region region) {
        checkOpen();
        Objects.requireNonNull(region, "region cannot be null");
        return bridge.readBytes(region.ptr(), region.length());
    }

    /**
     * Reads {@code count} pairs written by {@link #scan(int, int, int, int, int)}.
     *
     * @param outPtr offset of the output region
     * @param count {@link ScanResult#count()}
     * @return the pairs in order
     */
    public List<MatchSpan> readMatches(int outPtr, int count) {
        checkOpen();
        int[] pairs = bridge.readPairs(outPtr, count);
        List<MatchSpan> spans = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            spans.add(new MatchSpan(pairs[2 * i], pairs[2 * i + 1]));
        }
        return spans;
    }

    public AcConfig config() {
        return config;
    }

    public MemoryBridge memory() {
        return bridge;
    }

    public MatcherRegistry registry() {
        return registry;
    }

    public MemoryStatistics getMemoryStatistics() {
        return bridge.getStatistics();
    }

    public RegistryStatistics getRegistryStatistics() {
        return registry.getStatistics();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Releases linear memory and unregisters gauges. Registered automatons become unreachable.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        removeGauges();
        bridge.close();
        logger.debug("libac: Matcher exports closed - matchers: {}", registry.size());
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("libac: Matcher exports are closed");
        }
    }

    private void registerGauges() {
        metrics.registerGauge(MetricNames.MEMORY_RESERVED,
            () -> bridge.allocator().getResourceTracker().getReservedBytes());
        metrics.registerGauge(MetricNames.MEMORY_RESERVED_PEAK,
            () -> bridge.allocator().getResourceTracker().getPeakReservedBytes());
        metrics.registerGauge(MetricNames.MEMORY_REGIONS_COUNT,
            () -> bridge.allocator().getResourceTracker().getLiveRegionCount());
        metrics.registerGauge(MetricNames.MEMORY_CAPACITY, () -> bridge.memory().size());
        metrics.registerGauge(MetricNames.REGISTRY_MATCHERS_COUNT, registry::size);
        metrics.registerGauge(MetricNames.REGISTRY_AUTOMATON_MEMORY, registry::automatonMemoryBytes);
    }

    private void removeGauges() {
        metrics.removeGauge(MetricNames.MEMORY_RESERVED);
        metrics.removeGauge(MetricNames.MEMORY_RESERVED_PEAK);
        metrics.removeGauge(MetricNames.MEMORY_REGIONS_COUNT);
        metrics.removeGauge(MetricNames.MEMORY_CAPACITY);
        metrics.removeGauge(MetricNames.REGISTRY_MATCHERS_COUNT);
        metrics.removeGauge(MetricNames.REGISTRY_AUTOMATON_MEMORY);
    }
}
