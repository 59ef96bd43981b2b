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

package com.axonops.libac.config;

import com.axonops.libac.automaton.MatchKind;
import com.axonops.libac.memory.LinearMemory;
import com.axonops.libac.metrics.AcMetricsRegistry;
import com.axonops.libac.metrics.NoOpMetricsRegistry;
import java.util.Objects;

/**
 * Configuration for the libac matcher exports: linear memory sizing, boundary validation, matcher
 * semantics and metrics.
 *
 * <p>Immutable configuration using Java 17 records.
 *
 * <h2>Architecture Overview</h2>
 *
 * <h3>Linear Memory</h3>
 *
 * <p>Host and library exchange data through one flat off-heap byte range. It starts at {@code
 * initialMemoryBytes} and grows in 64 KiB pages when a reservation does not fit, up to {@code
 * maxMemoryBytes}. Offsets handed to the host stay valid across growth.
 *
 * <h3>Boundary Validation</h3>
 *
 * <ul>
 *   <li><b>enforceRegionOwnership</b> - every read or write of host memory must lie inside a
 *       single live reservation. When disabled only the bounds of linear memory are checked.
 *   <li><b>validateHaystackEncoding</b> - haystacks must be well-formed UTF-8, like pattern sets.
 *       Disable to scan arbitrary binary input.
 *   <li><b>failOnTruncation</b> - raise {@link com.axonops.libac.api.CapacityExceededException}
 *       instead of only flagging truncated scan results.
 * </ul>
 *
 * <h3>Resource Limits</h3>
 *
 * <ul>
 *   <li><b>maxRegisteredMatchers</b> - automatons are never removed, so this bounds their total
 *   <li><b>maxLiveRegions</b> - regions reserved and not yet released
 * </ul>
 *
 * <h2>Configuration Examples</h2>
 *
 * <pre>{@code
 * // Defaults: 1 MiB initial memory, 256 MiB max, strict validation, metrics disabled
 * MatcherExports exports = new MatcherExports(AcConfig.DEFAULT);
 *
 * // Binary haystacks, truncation as an error, Dropwizard metrics
 * AcConfig config = AcConfig.builder()
 *     .validateHaystackEncoding(false)
 *     .failOnTruncation(true)
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myapp.ac"))
 *     .build();
 * }</pre>
 *
 * @param initialMemoryBytes initial linear memory size, rounded up to whole pages
 * @param maxMemoryBytes upper bound for linear memory growth
 * @param alignment alignment of reserved regions (power of two)
 * @param maxLiveRegions maximum regions reserved and not yet released
 * @param maxRegisteredMatchers maximum automatons in the registry
 * @param matchKind match semantics of constructed automatons
 * @param asciiCaseInsensitive fold ASCII letters when building automatons
 * @param validateHaystackEncoding reject haystacks that are not well-formed UTF-8
 * @param enforceRegionOwnership require host memory accesses to stay inside live reservations
 * @param failOnTruncation throw when a scan finds more matches than its output capacity
 * @param metricsRegistry metrics implementation (use {@link NoOpMetricsRegistry} for none)
 * @since 1.0.0
 * @see com.axonops.libac.api.MatcherExports
 */
public record AcConfig(
    int initialMemoryBytes,
    int maxMemoryBytes,
    int alignment,
    int maxLiveRegions,
    int maxRegisteredMatchers,
    MatchKind matchKind,
    boolean asciiCaseInsensitive,
    boolean validateHaystackEncoding,
    boolean enforceRegionOwnership,
    boolean failOnTruncation,
    AcMetricsRegistry metricsRegistry) {

  /**
   * Default configuration.
   *
   * <p>Leftmost-longest, ASCII case-insensitive matching; 1 MiB initial memory growing to at most
   * 256 MiB; 8-byte alignment; strict ownership and encoding checks; truncation flagged but not
   * thrown; metrics disabled.
   */
  public static final AcConfig DEFAULT = builder().build();

  /** Compact constructor with validation. */
  public AcConfig {
    if (initialMemoryBytes <= 0) {
      throw new IllegalArgumentException("initialMemoryBytes must be positive");
    }
    if (maxMemoryBytes < initialMemoryBytes) {
      throw new IllegalArgumentException(
          "maxMemoryBytes ("
              + maxMemoryBytes
              + ") cannot be smaller than initialMemoryBytes ("
              + initialMemoryBytes
              + ")");
    }
    if (alignment <= 0 || Integer.bitCount(alignment) != 1) {
      throw new IllegalArgumentException("alignment must be a positive power of two: " + alignment);
    }
    if (alignment > LinearMemory.PAGE_SIZE) {
      throw new IllegalArgumentException(
          "alignment cannot exceed the page size " + LinearMemory.PAGE_SIZE);
    }
    if (maxLiveRegions <= 0) {
      throw new IllegalArgumentException("maxLiveRegions must be positive");
    }
    if (maxRegisteredMatchers <= 0) {
      throw new IllegalArgumentException("maxRegisteredMatchers must be positive");
    }
    Objects.requireNonNull(matchKind, "matchKind cannot be null");
    Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
  }

  /**
   * Creates a builder for custom configuration, starting from the defaults.
   *
   * @return new builder with default values
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Builder for custom configuration. */
  public static class Builder {
    private int initialMemoryBytes = 16 * LinearMemory.PAGE_SIZE;
    private int maxMemoryBytes = 4096 * LinearMemory.PAGE_SIZE;
    private int alignment = 8;
    private int maxLiveRegions = 1_000_000;
    private int maxRegisteredMatchers = 100_000;
    private MatchKind matchKind = MatchKind.LEFTMOST_LONGEST;
    private boolean asciiCaseInsensitive = true;
    private boolean validateHaystackEncoding = true;
    private boolean enforceRegionOwnership = true;
    private boolean failOnTruncation = false;
    private AcMetricsRegistry metricsRegistry = NoOpMetricsRegistry.INSTANCE;

    /**
     * Set the initial linear memory size.
     *
     * <p><b>Default: 1 MiB (16 pages)</b>
     *
     * @param bytes initial size (must be > 0, rounded up to whole pages)
     * @return this builder
     */
    public Builder initialMemoryBytes(int bytes) {
      this.initialMemoryBytes = bytes;
      return this;
    }

    /**
     * Set the maximum linear memory size.
     *
     * <p><b>Default: 256 MiB (4096 pages)</b>
     *
     * <p>Reservations that would grow memory beyond this fail with {@link
     * com.axonops.libac.api.ResourceException}.
     *
     * @param bytes maximum size (must be ≥ initialMemoryBytes)
     * @return this builder
     */
    public Builder maxMemoryBytes(int bytes) {
      this.maxMemoryBytes = bytes;
      return this;
    }

    /**
     * Set the alignment of reserved regions.
     *
     * <p><b>Default: 8</b>
     *
     * @param alignment power of two, at most one page
     * @return this builder
     */
    public Builder alignment(int alignment) {
      this.alignment = alignment;
      return this;
    }

    /**
     * Set the maximum number of live regions.
     *
     * <p><b>Default: 1,000,000</b>
     *
     * @param max maximum live regions (must be > 0)
     * @return this builder
     */
    public Builder maxLiveRegions(int max) {
      this.maxLiveRegions = max;
      return this;
    }

    /**
     * Set the maximum number of registered automatons.
     *
     * <p><b>Default: 100,000</b>
     *
     * <p>The registry is append-only, so this is a lifetime bound per exports instance.
     *
     * @param max maximum registered automatons (must be > 0)
     * @return this builder
     */
    public Builder maxRegisteredMatchers(int max) {
      this.maxRegisteredMatchers = max;
      return this;
    }

    /**
     * Set the match semantics of constructed automatons.
     *
     * <p><b>Default: {@link MatchKind#LEFTMOST_LONGEST}</b>
     *
     * @param matchKind match kind (must not be null)
     * @return this builder
     */
    public Builder matchKind(MatchKind matchKind) {
      this.matchKind = Objects.requireNonNull(matchKind, "matchKind cannot be null");
      return this;
    }

    /**
     * Enable or disable ASCII case folding.
     *
     * <p><b>Default: enabled (true)</b>
     *
     * @param enabled true to fold ASCII letters
     * @return this builder
     */
    public Builder asciiCaseInsensitive(boolean enabled) {
      this.asciiCaseInsensitive = enabled;
      return this;
    }

    /**
     * Enable or disable UTF-8 validation of haystacks.
     *
     * <p><b>Default: enabled (true)</b>
     *
     * <p>Pattern sets are always validated.
     *
     * @param validate true to reject malformed haystacks
     * @return this builder
     */
    public Builder validateHaystackEncoding(boolean validate) {
      this.validateHaystackEncoding = validate;
      return this;
    }

    /**
     * Enable or disable region ownership checks on host memory accesses.
     *
     * <p><b>Default: enabled (true)</b>
     *
     * @param enforce true to require accesses inside live reservations
     * @return this builder
     */
    public Builder enforceRegionOwnership(boolean enforce) {
      this.enforceRegionOwnership = enforce;
      return this;
    }

    /**
     * Throw when a scan has more matches than its output capacity.
     *
     * <p><b>Default: disabled (false)</b> - truncation is reported through {@link
     * com.axonops.libac.api.ScanResult#truncated()} and the {@code scans.truncated} counter.
     *
     * @param fail true to throw {@link com.axonops.libac.api.CapacityExceededException}
     * @return this builder
     */
    public Builder failOnTruncation(boolean fail) {
      this.failOnTruncation = fail;
      return this;
    }

    /**
     * Set metrics registry for instrumentation.
     *
     * <p><b>Default: {@link NoOpMetricsRegistry}</b>
     *
     * @param metricsRegistry metrics implementation (must not be null)
     * @return this builder
     * @throws NullPointerException if metricsRegistry is null
     */
    public Builder metricsRegistry(AcMetricsRegistry metricsRegistry) {
      this.metricsRegistry =
          Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
      return this;
    }

    /**
     * Build immutable configuration.
     *
     * @return validated immutable configuration
     * @throws IllegalArgumentException if configuration is invalid
     */
    public AcConfig build() {
      return new AcConfig(
          initialMemoryBytes,
          maxMemoryBytes,
          alignment,
          maxLiveRegions,
          maxRegisteredMatchers,
          matchKind,
          asciiCaseInsensitive,
          validateHaystackEncoding,
          enforceRegionOwnership,
          failOnTruncation,
          metricsRegistry);
    }
  }
}
