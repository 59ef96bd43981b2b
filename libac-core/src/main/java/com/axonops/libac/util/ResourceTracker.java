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

package com.axonops.libac.util;

import com.axonops.libac.api.ResourceException;
import com.axonops.libac.metrics.AcMetricsRegistry;
import com.axonops.libac.metrics.MetricNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Tracks host-owned region usage for enforcing limits and monitoring.
 *
 * CRITICAL: Tracks LIVE (currently reserved) regions, not the cumulative total.
 * Instance-level (per linear memory) so several export instances never share counts.
 *
 * @since 1.0.0
 */
public final class ResourceTracker {
    private final Logger logger = LoggerFactory.getLogger(ResourceTracker.class);

    // LIVE counts - checked on every reserve
    private final AtomicInteger liveRegions = new AtomicInteger(0);
    private final AtomicLong reservedBytes = new AtomicLong(0);
    private final AtomicLong peakReservedBytes = new AtomicLong(0);

    // Cumulative counters (lifetime, for statistics only)
    private final LongAdder totalReservations = new LongAdder();
    private final LongAdder totalReleases = new LongAdder();

    // Rejections
    private final LongAdder regionLimitRejections = new LongAdder();
    private final LongAdder sizeMismatchRejections = new LongAdder();
    private final LongAdder invalidReleaseRejections = new LongAdder();

    public ResourceTracker() {
        // Instance per linear memory
    }

    /**
     * Tracks a new region handed to the host.
     *
     * @param size requested size in bytes
     * @param maxLiveRegions maximum allowed live regions
     * @param metricsRegistry metrics registry to record errors and reservations
     * @throws ResourceException if the live region limit is exceeded
     */
    public void trackRegionReserved(int size, int maxLiveRegions, AcMetricsRegistry metricsRegistry) {
        int current = liveRegions.incrementAndGet();
        if (current > maxLiveRegions) {
            liveRegions.decrementAndGet(); // Roll back
            regionLimitRejections.increment();
            metricsRegistry.incrementCounter(MetricNames.ERRORS_RESOURCE_EXHAUSTED);
            throw new ResourceException(
                ResourceException.Resource.LIVE_REGIONS,
                "Maximum live regions exceeded: " + maxLiveRegions
                + " (this is the LIVE count - release regions to reserve new ones)");
        }

        totalReservations.increment();
        long bytes = reservedBytes.addAndGet(size);
        peakReservedBytes.accumulateAndGet(bytes, Math::max);
        metricsRegistry.incrementCounter(MetricNames.MEMORY_RESERVATIONS);

        logger.trace("libac: Region reserved - size: {}, live: {}, reservedBytes: {}", size, current, bytes);
    }

    /**
     * Tracks a region returned by the host.
     *
     * @param size the size the region was reserved with
     * @param metricsRegistry metrics registry to record releases
     */
    public void trackRegionReleased(int size, AcMetricsRegistry metricsRegistry) {
        int current = liveRegions.decrementAndGet();
        long bytes = reservedBytes.addAndGet(-size);
        totalReleases.increment();
        metricsRegistry.incrementCounter(MetricNames.MEMORY_RELEASES);

        if (current < 0 || bytes < 0) {
            logger.error("libac: Region accounting went negative! live={}, reservedBytes={}", current, bytes);
            liveRegions.set(Math.max(0, current));
            reservedBytes.set(Math.max(0, bytes));
        }

        logger.trace("libac: Region released - size: {}, live: {}, reservedBytes: {}", size, current, bytes);
    }

    /** Records a release rejected because the size did not match the reservation. */
    public void trackSizeMismatch(AcMetricsRegistry metricsRegistry) {
        sizeMismatchRejections.increment();
        metricsRegistry.incrementCounter(MetricNames.ERRORS_SIZE_MISMATCH);
    }

    /** Records a release of a pointer that is not reserved (never reserved, or released twice). */
    public void trackInvalidRelease(AcMetricsRegistry metricsRegistry) {
        invalidReleaseRejections.increment();
        metricsRegistry.incrementCounter(MetricNames.ERRORS_INVALID_REGION);
    }

    /**
     * Gets current LIVE region count.
     */
    public int getLiveRegionCount() {
        return liveRegions.get();
    }

    /**
     * Gets bytes currently reserved by the host (sum of requested sizes).
     */
    public long getReservedBytes() {
        return reservedBytes.get();
    }

    /**
     * Gets the highest value {@link #getReservedBytes()} has reached.
     */
    public long getPeakReservedBytes() {
        return peakReservedBytes.get();
    }

    public long getTotalReservations() {
        return totalReservations.sum();
    }

    public long getTotalReleases() {
        return totalReleases.sum();
    }

    public long getRegionLimitRejections() {
        return regionLimitRejections.sum();
    }

    public long getSizeMismatchRejections() {
        return sizeMismatchRejections.sum();
    }

    public long getInvalidReleaseRejections() {
        return invalidReleaseRejections.sum();
    }

    /**
     * Resets all counters (for testing only).
     */
    public void reset() {
        liveRegions.set(0);
        reservedBytes.set(0);
        peakReservedBytes.set(0);
        totalReservations.reset();
        totalReleases.reset();
        regionLimitRejections.reset();
        sizeMismatchRejections.reset();
        invalidReleaseRejections.reset();
        logger.trace("libac: ResourceTracker reset");
    }
}
