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

package com.axonops.libac.memory;

/**
 * Snapshot of linear memory accounting.
 *
 * <p>A reserve followed by a release of the same region returns {@link #liveRegions()} and {@link
 * #reservedBytes()} to their previous values.
 *
 * @param liveRegions regions reserved and not yet released
 * @param reservedBytes sum of sizes requested for live regions
 * @param committedBytes bytes actually set aside for live regions, after alignment
 * @param freeBytes bytes available without growing memory
 * @param capacityBytes current linear memory size
 * @param peakReservedBytes high water mark of {@code reservedBytes}
 * @param totalReservations cumulative reservations
 * @param totalReleases cumulative releases
 * @param sizeMismatchRejections releases rejected for a wrong size
 * @param invalidReleaseRejections releases of pointers that were not reserved
 * @param growths times memory grew
 * @since 1.0.0
 */
public record MemoryStatistics(
    int liveRegions,
    long reservedBytes,
    long committedBytes,
    long freeBytes,
    long capacityBytes,
    long peakReservedBytes,
    long totalReservations,
    long totalReleases,
    long sizeMismatchRejections,
    long invalidReleaseRejections,
    long growths) {

  /** True when every reserved region has been released. */
  public boolean isBalanced() {
    return liveRegions == 0 && reservedBytes == 0 && totalReservations == totalReleases;
  }

  /** Fraction of linear memory committed to live regions, between 0.0 and 1.0. */
  public double utilization() {
    return capacityBytes == 0 ? 0.0 : (double) committedBytes / capacityBytes;
  }
}
