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

/**
 * Metric name constants for libac instrumentation.
 *
 * <h2>Metric Categories</h2>
 *
 * <ul>
 *   <li><b>Matcher Construction</b> - automatons built from host-supplied pattern sets
 *   <li><b>Registry State</b> - number of registered automatons and their table footprint
 *   <li><b>Scanning</b> - scan operations, scanned bytes, reported matches, truncations
 *   <li><b>Linear Memory</b> - reservations, releases, growth and live bytes
 *   <li><b>Errors</b> - one counter per boundary error type
 * </ul>
 *
 * <h2>Metric Types</h2>
 *
 * <ul>
 *   <li><b>Counter</b> - Monotonically increasing count (suffix: {@code .total.count})
 *   <li><b>Timer</b> - Latency histogram with percentiles (suffix: {@code .latency})
 *   <li><b>Histogram</b> - Distribution of per-call sizes (suffix: {@code .distribution})
 *   <li><b>Gauge</b> - Current or peak value (suffix: {@code .current.*} or {@code .peak.*})
 * </ul>
 *
 * <h2>Monitoring Recommendations</h2>
 *
 * <ul>
 *   <li><b>Leaks:</b> {@link #MEMORY_REGIONS_COUNT} should return to a steady value between host
 *       calls. Steady growth means the host is not releasing the regions it reserved.
 *   <li><b>Truncation:</b> a non-zero {@link #SCANS_TRUNCATED} means the host passes an output
 *       capacity smaller than the number of matches and silently loses results.
 *   <li><b>Registry growth:</b> automatons are never removed, so {@link #REGISTRY_MATCHERS_COUNT}
 *       should plateau after warmup.
 * </ul>
 *
 * @since 1.0.0
 * @see com.axonops.libac.api.MatcherExports
 */
public final class MetricNames {
  private MetricNames() {}

  // ========================================
  // Matcher Construction
  // ========================================

  /**
   * Total automatons constructed via the {@code construct} export.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String MATCHERS_CONSTRUCTED = "matchers.constructed.total.count";

  /**
   * Total patterns folded into constructed automatons (including empty patterns).
   *
   * <p><b>Type:</b> Counter
   */
  public static final String MATCHERS_PATTERNS = "matchers.patterns.total.count";

  /**
   * Construction latency (decode + build + register).
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   */
  public static final String MATCHERS_CONSTRUCT_LATENCY = "matchers.construct.latency";

  /**
   * Distribution of automaton sizes in states, one sample per construction.
   *
   * <p><b>Type:</b> Histogram
   */
  public static final String MATCHERS_STATES = "matchers.states.distribution";

  // ========================================
  // Registry State
  // ========================================

  /**
   * Current number of registered automatons.
   *
   * <p><b>Type:</b> Gauge (count)
   */
  public static final String REGISTRY_MATCHERS_COUNT = "registry.matchers.current.count";

  /**
   * Heap bytes held by transition tables of all registered automatons.
   *
   * <p><b>Type:</b> Gauge (bytes)
   */
  public static final String REGISTRY_AUTOMATON_MEMORY = "registry.automaton_memory.current.bytes";

  // ========================================
  // Scanning
  // ========================================

  /**
   * Total scan operations.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String SCANS = "scans.total.count";

  /**
   * Scan latency (decode + scan + write back).
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   */
  public static final String SCANS_LATENCY = "scans.latency";

  /**
   * Total haystack bytes scanned.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String SCANS_BYTES = "scans.bytes.total.count";

  /**
   * Total matches written back to host memory.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String SCANS_MATCHES = "scans.matches.total.count";

  /**
   * Scans where more matches existed than the output capacity.
   *
   * <p><b>Type:</b> Counter
   *
   * <p><b>Interpretation:</b> Should be zero; non-zero means results were dropped
   */
  public static final String SCANS_TRUNCATED = "scans.truncated.total.count";

  /**
   * Distribution of haystack lengths in bytes, one sample per scan.
   *
   * <p><b>Type:</b> Histogram
   */
  public static final String SCANS_HAYSTACK_BYTES = "scans.haystack.bytes.distribution";

  // ========================================
  // Linear Memory
  // ========================================

  /** Total regions reserved. <b>Type:</b> Counter */
  public static final String MEMORY_RESERVATIONS = "memory.reservations.total.count";

  /** Total regions released. <b>Type:</b> Counter */
  public static final String MEMORY_RELEASES = "memory.releases.total.count";

  /** Times linear memory grew by one or more pages. <b>Type:</b> Counter */
  public static final String MEMORY_GROWTHS = "memory.grow.total.count";

  /** Bytes currently owned by the host (requested sizes). <b>Type:</b> Gauge (bytes) */
  public static final String MEMORY_RESERVED = "memory.reserved.current.bytes";

  /** High water mark of {@link #MEMORY_RESERVED}. <b>Type:</b> Gauge (bytes) */
  public static final String MEMORY_RESERVED_PEAK = "memory.reserved.peak.bytes";

  /** Regions currently owned by the host. <b>Type:</b> Gauge (count) */
  public static final String MEMORY_REGIONS_COUNT = "memory.regions.current.count";

  /** Current linear memory size. <b>Type:</b> Gauge (bytes) */
  public static final String MEMORY_CAPACITY = "memory.capacity.current.bytes";

  // ========================================
  // Errors
  // ========================================

  /** Scan called with an unknown handle. <b>Type:</b> Counter */
  public static final String ERRORS_INVALID_HANDLE = "errors.invalid_handle.total.count";

  /** Host bytes that were not well-formed UTF-8. <b>Type:</b> Counter */
  public static final String ERRORS_INVALID_ENCODING = "errors.invalid_encoding.total.count";

  /** Release with a size different from the reservation. <b>Type:</b> Counter */
  public static final String ERRORS_SIZE_MISMATCH = "errors.size_mismatch.total.count";

  /** Out-of-bounds or unowned access, unknown or repeated release. <b>Type:</b> Counter */
  public static final String ERRORS_INVALID_REGION = "errors.invalid_region.total.count";

  /** Linear memory or registry limits reached. <b>Type:</b> Counter */
  public static final String ERRORS_RESOURCE_EXHAUSTED = "errors.resource.exhausted.total.count";
}
