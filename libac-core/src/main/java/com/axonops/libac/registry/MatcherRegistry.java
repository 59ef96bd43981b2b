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

package com.axonops.libac.registry;

import com.axonops.libac.api.InvalidHandleException;
import com.axonops.libac.api.ResourceException;
import com.axonops.libac.automaton.Automaton;
import com.axonops.libac.metrics.AcMetricsRegistry;
import com.axonops.libac.metrics.MetricNames;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only store of constructed automatons, addressed by integer handles.
 *
 * <p>A handle is the insertion index: the first automaton registered gets handle 0, the next 1,
 * and so on. Automatons are never removed, so a handle stays valid for the lifetime of the
 * registry and can never be reused for a different automaton.
 *
 * <p>Thread-safe. Registration is serialized on this instance; lookups are lock-free reads of a
 * {@link CopyOnWriteArrayList}. Automatons themselves are immutable and may be scanned from any
 * number of threads.
 *
 * @since 1.0.0
 */
public final class MatcherRegistry {
  private static final Logger logger = LoggerFactory.getLogger(MatcherRegistry.class);

  private final List<Automaton> automatons = new CopyOnWriteArrayList<>();
  private final int maxRegistered;
  private final AcMetricsRegistry metrics;

  private final LongAdder lookups = new LongAdder();
  private final LongAdder invalidHandleRejections = new LongAdder();
  private final LongAdder registrationRejections = new LongAdder();
  private final AtomicLong automatonMemoryBytes = new AtomicLong(0);

  /**
   * Creates an empty registry.
   *
   * @param maxRegistered maximum number of automatons ever registered
   * @param metrics metrics registry
   */
  public MatcherRegistry(int maxRegistered, AcMetricsRegistry metrics) {
    if (maxRegistered <= 0) {
      throw new IllegalArgumentException("maxRegistered must be positive: " + maxRegistered);
    }
    this.maxRegistered = maxRegistered;
    this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
  }

  /**
   * Appends an automaton and returns its handle.
   *
   * @param automaton automaton to register
   * @return the new handle, equal to the previous {@link #size()}
   * @throws ResourceException if the registry is full
   */
  public synchronized int register(Automaton automaton) {
    Objects.requireNonNull(automaton, "automaton cannot be null");
    int handle = automatons.size();
    if (handle >= maxRegistered) {
      registrationRejections.increment();
      metrics.incrementCounter(MetricNames.ERRORS_RESOURCE_EXHAUSTED);
      logger.warn("libac: Matcher registry full - max: {}", maxRegistered);
      throw new ResourceException(
          ResourceException.Resource.MATCHER_REGISTRY,
          "Matcher registry full: " + maxRegistered + " automatons already registered");
    }
    automatons.add(automaton);
    automatonMemoryBytes.addAndGet(automaton.memoryBytes());
    logger.trace("libac: Registered matcher - handle: {}, {}", handle, automaton);
    return handle;
  }

  /**
   * Returns the automaton registered under {@code handle}.
   *
   * @param handle handle returned by {@link #register(Automaton)}
   * @return the automaton
   * @throws InvalidHandleException if the handle is negative or not yet issued
   */
  public Automaton lookup(int handle) {
    List<Automaton> snapshot = automatons;
    int registered = snapshot.size();
    if (handle < 0 || handle >= registered) {
      invalidHandleRejections.increment();
      metrics.incrementCounter(MetricNames.ERRORS_INVALID_HANDLE);
      logger.debug("libac: Rejected invalid matcher handle {} ({} registered)", handle, registered);
      throw new InvalidHandleException(handle, registered);
    }
    lookups.increment();
    return snapshot.get(handle);
  }

  public int size() {
    return automatons.size();
  }

  public int maxSize() {
    return maxRegistered;
  }

  /** Total transition table footprint of all registered automatons. */
  public long automatonMemoryBytes() {
    return automatonMemoryBytes.get();
  }

  public RegistryStatistics getStatistics() {
    return new RegistryStatistics(
        automatons.size(),
        maxRegistered,
        lookups.sum(),
        invalidHandleRejections.sum(),
        registrationRejections.sum(),
        automatonMemoryBytes.get());
  }
}
