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

/**
 * Registry statistics for monitoring and metrics.
 *
 * <p>Immutable snapshot of registry state at a point in time.
 *
 * @since 1.0.0
 */
public record RegistryStatistics(
    int registered,
    int maxRegistered,
    long lookups,
    long invalidHandleRejections,
    long registrationRejections,
    long automatonMemoryBytes) {

  /**
   * Registry utilization.
   *
   * @return registered / maxRegistered, between 0.0 and 1.0
   */
  public double utilization() {
    return maxRegistered == 0 ? 0.0 : (double) registered / maxRegistered;
  }

  /** Fraction of lookups rejected for an invalid handle. */
  public double invalidHandleRate() {
    long total = lookups + invalidHandleRejections;
    return total == 0 ? 0.0 : (double) invalidHandleRejections / total;
  }
}
