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

import com.axonops.libac.api.InvalidRegionException;
import com.axonops.libac.api.ResourceException;
import com.axonops.libac.api.SizeMismatchException;
import com.axonops.libac.metrics.AcMetricsRegistry;
import com.axonops.libac.metrics.MetricNames;
import com.axonops.libac.util.ResourceTracker;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands out and takes back regions of {@link LinearMemory}.
 *
 * <p>Ownership protocol: {@link #reserve(int)} transfers a fresh region to the caller, who must
 * hand it back exactly once through {@link #release(int, int)} with the same size it asked for.
 * There is no reference counting; exactly one party owns a region at a time.
 *
 * <p>Allocation is first-fit over a free list ordered by offset, with neighbouring free blocks
 * coalesced on release. Blocks are rounded up to the configured alignment. Offset 0 is never
 * handed out, so a zero pointer always means "no region". A zero-byte reservation still gets a
 * unique offset and must be released with size 0.
 *
 * <p>When no free block fits, memory grows by the number of pages needed. Growth beyond the
 * memory's maximum fails with {@link ResourceException}.
 *
 * <p>Thread-safe: reserve, release and access checks synchronize on this instance.
 *
 * @since 1.0.0
 */
public final class RegionAllocator {
  private static final Logger logger = LoggerFactory.getLogger(RegionAllocator.class);

  private final LinearMemory memory;
  private final int alignment;
  private final int maxLiveRegions;
  private final AcMetricsRegistry metrics;
  private final ResourceTracker tracker = new ResourceTracker();

  // offset -> block length
  private final TreeMap<Integer, Integer> free = new TreeMap<>();
  // offset -> reservation
  private final TreeMap<Integer, Reservation> live = new TreeMap<>();

  private long committedBytes;
  private final AtomicLong growths = new AtomicLong(0);

  private record Reservation(int size, int blockSize) {}

  /**
   * Creates an allocator managing all of {@code memory} except the first aligned block.
   *
   * @param memory linear memory to carve regions from
   * @param alignment region alignment (power of two)
   * @param maxLiveRegions maximum regions reserved at once
   * @param metrics metrics registry
   */
  public RegionAllocator(
      LinearMemory memory, int alignment, int maxLiveRegions, AcMetricsRegistry metrics) {
    this.memory = Objects.requireNonNull(memory, "memory cannot be null");
    this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
    if (alignment <= 0 || Integer.bitCount(alignment) != 1) {
      throw new IllegalArgumentException("alignment must be a positive power of two: " + alignment);
    }
    this.alignment = alignment;
    this.maxLiveRegions = maxLiveRegions;

    // The first aligned block is never handed out: offset 0 stays the null pointer.
    int heapBase = alignment;
    if (memory.size() > heapBase) {
      free.put(heapBase, memory.size() - heapBase);
    }
  }

  /**
   * Reserves a region of {@code size} bytes. The bytes are zeroed.
   *
   * @param size bytes requested (≥ 0)
   * @return the region, now owned by the caller
   * @throws InvalidRegionException if size is negative
   * @throws ResourceException if memory cannot grow or the live region limit is reached
   */
  public synchronized Region reserve(int size) {
    if (size < 0) {
      metrics.incrementCounter(MetricNames.ERRORS_INVALID_REGION);
      throw new InvalidRegionException("negative reservation size " + size);
    }
    long rounded = roundUp(Math.max(size, 1));
    if (rounded > Integer.MAX_VALUE) {
      metrics.incrementCounter(MetricNames.ERRORS_RESOURCE_EXHAUSTED);
      throw new ResourceException(
          ResourceException.Resource.LINEAR_MEMORY,
          "Reservation of " + size + " bytes cannot be addressed");
    }
    int blockSize = (int) rounded;

    int ptr;
    try {
      ptr = takeFreeBlock(blockSize);
    } catch (ResourceException e) {
      metrics.incrementCounter(MetricNames.ERRORS_RESOURCE_EXHAUSTED);
      logger.warn("libac: Reservation of {} bytes failed - {}", size, e.getMessage());
      throw e;
    }
    try {
      tracker.trackRegionReserved(size, maxLiveRegions, metrics);
    } catch (ResourceException e) {
      addFreeBlock(ptr, blockSize);
      logger.warn("libac: Reservation of {} bytes rejected - {}", size, e.getMessage());
      throw e;
    }

    memory.zero(ptr, blockSize);
    live.put(ptr, new Reservation(size, blockSize));
    committedBytes += blockSize;

    logger.trace("libac: Reserved region - ptr: {}, size: {}, block: {}", ptr, size, blockSize);
    return new Region(ptr, size);
  }

  /**
   * Releases a region previously returned by {@link #reserve(int)}.
   *
   * @param ptr region offset
   * @param size the exact size passed to {@code reserve}
   * @throws InvalidRegionException if {@code ptr} is not a live region (never reserved, or
   *     already released)
   * @throws SizeMismatchException if {@code size} differs from the reserved size; the region
   *     stays reserved
   */
  public synchronized void release(int ptr, int size) {
    Reservation reservation = live.get(ptr);
    if (reservation == null) {
      tracker.trackInvalidRelease(metrics);
      logger.debug("libac: Rejected release of unknown region - ptr: {}, size: {}", ptr, size);
      throw new InvalidRegionException(
          "no live region at " + ptr + " (never reserved or already released)");
    }
    if (reservation.size() != size) {
      tracker.trackSizeMismatch(metrics);
      logger.debug(
          "libac: Rejected release with wrong size - ptr: {}, reserved: {}, given: {}",
          ptr,
          reservation.size(),
          size);
      throw new SizeMismatchException(ptr, reservation.size(), size);
    }

    live.remove(ptr);
    committedBytes -= reservation.blockSize();
    addFreeBlock(ptr, reservation.blockSize());
    tracker.trackRegionReleased(size, metrics);

    logger.trace("libac: Released region - ptr: {}, size: {}", ptr, size);
  }

  /**
   * Releases a region; its own length is used as the size.
   */
  public void release(Region region) {
    Objects.requireNonNull(region, "region cannot be null");
    release(region.ptr(), region.length());
  }

  /**
   * Validates that {@code [ptr, ptr + length)} may be accessed.
   *
   * @param ptr start offset
   * @param length number of bytes
   * @param requireOwnership when true the range must lie inside one live region; otherwise only
   *     the bounds of linear memory are checked. Empty ranges only need to be inside memory.
   * @throws InvalidRegionException if the range may not be accessed
   */
  public synchronized void checkAccess(int ptr, int length, boolean requireOwnership) {
    if (ptr < 0 || length < 0) {
      metrics.incrementCounter(MetricNames.ERRORS_INVALID_REGION);
      throw new InvalidRegionException("negative pointer or length: ptr=" + ptr + ", length=" + length);
    }
    if (!memory.contains(ptr, length)) {
      metrics.incrementCounter(MetricNames.ERRORS_INVALID_REGION);
      throw new InvalidRegionException(
          "[" + ptr + ", " + ((long) ptr + length) + ") is outside linear memory of "
              + memory.size() + " bytes");
    }
    if (!requireOwnership || length == 0) {
      return;
    }
    Map.Entry<Integer, Reservation> owner = live.floorEntry(ptr);
    if (owner == null || (long) ptr + length > (long) owner.getKey() + owner.getValue().size()) {
      metrics.incrementCounter(MetricNames.ERRORS_INVALID_REGION);
      throw new InvalidRegionException(
          "[" + ptr + ", " + ((long) ptr + length) + ") is not inside a reserved region");
    }
  }

  /** Returns the reserved size of the live region at {@code ptr}, or -1 if there is none. */
  public synchronized int sizeOf(int ptr) {
    Reservation reservation = live.get(ptr);
    return reservation == null ? -1 : reservation.size();
  }

  public synchronized boolean isLive(int ptr) {
    return live.containsKey(ptr);
  }

  public LinearMemory memory() {
    return memory;
  }

  public ResourceTracker getResourceTracker() {
    return tracker;
  }

  /** Returns a consistent snapshot of the accounting. */
  public synchronized MemoryStatistics getStatistics() {
    long freeBytes = 0;
    for (int length : free.values()) {
      freeBytes += length;
    }
    return new MemoryStatistics(
        tracker.getLiveRegionCount(),
        tracker.getReservedBytes(),
        committedBytes,
        freeBytes,
        memory.size(),
        tracker.getPeakReservedBytes(),
        tracker.getTotalReservations(),
        tracker.getTotalReleases(),
        tracker.getSizeMismatchRejections(),
        tracker.getInvalidReleaseRejections(),
        growths.get());
  }

  private int takeFreeBlock(int blockSize) {
    Iterator<Map.Entry<Integer, Integer>> it = free.entrySet().iterator();
    while (it.hasNext()) {
      Map.Entry<Integer, Integer> block = it.next();
      int length = block.getValue();
      if (length >= blockSize) {
        int ptr = block.getKey();
        it.remove();
        if (length > blockSize) {
          free.put(ptr + blockSize, length - blockSize);
        }
        return ptr;
      }
    }

    growFor(blockSize);
    return takeFreeBlock(blockSize);
  }

  private void growFor(int blockSize) {
    int oldSize = memory.size();
    // A free block touching the end of memory is extended by the growth.
    Map.Entry<Integer, Integer> last = free.lastEntry();
    long tail = last != null && (long) last.getKey() + last.getValue() == oldSize ? last.getValue() : 0;
    long needed = blockSize - tail;
    long deltaPages = (needed + LinearMemory.PAGE_SIZE - 1) / LinearMemory.PAGE_SIZE;
    if (deltaPages > LinearMemory.MAX_PAGES) {
      throw new ResourceException(
          ResourceException.Resource.LINEAR_MEMORY,
          "Reservation of " + blockSize + " bytes exceeds linear memory");
    }

    memory.grow((int) deltaPages);
    growths.incrementAndGet();
    metrics.incrementCounter(MetricNames.MEMORY_GROWTHS);
    addFreeBlock(oldSize, memory.size() - oldSize);
  }

  private void addFreeBlock(int ptr, int length) {
    int start = ptr;
    int end = ptr + length;

    Map.Entry<Integer, Integer> before = free.floorEntry(start);
    if (before != null && before.getKey() + before.getValue() == start) {
      start = before.getKey();
      free.remove(before.getKey());
    }
    Map.Entry<Integer, Integer> after = free.ceilingEntry(end);
    if (after != null && after.getKey() == end) {
      end = end + after.getValue();
      free.remove(after.getKey());
    }
    free.put(start, end - start);
  }

  private long roundUp(long size) {
    return (size + alignment - 1) & -(long) alignment;
  }
}
