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

import com.axonops.libac.api.InvalidEncodingException;
import com.axonops.libac.api.InvalidRegionException;
import com.axonops.libac.config.AcConfig;
import com.axonops.libac.metrics.AcMetricsRegistry;
import com.axonops.libac.metrics.MetricNames;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves bytes and strings across the boundary.
 *
 * <p>Reads are pure borrows: bytes are copied out of linear memory during the call and no
 * reference into host memory is kept afterwards. The host keeps ownership of every region it
 * passes in and must release it itself.
 *
 * <p>Every access is validated before any byte is touched: ranges must lie inside linear memory
 * and, when ownership is enforced, inside a single live region. Text is decoded with a reporting
 * UTF-8 decoder, so malformed input becomes an {@link InvalidEncodingException} rather than
 * garbage.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * try (MemoryBridge bridge = new MemoryBridge(AcConfig.DEFAULT)) {
 *     Region region = bridge.copyIn("he she hers".getBytes(StandardCharsets.UTF_8));
 *     try {
 *         String text = bridge.decode(region.ptr(), region.length());
 *     } finally {
 *         bridge.release(region);
 *     }
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public final class MemoryBridge implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(MemoryBridge.class);

  /** Bytes per (start, end) pair written back to the host. */
  public static final int PAIR_BYTES = 8;

  private final LinearMemory memory;
  private final RegionAllocator allocator;
  private final boolean enforceOwnership;
  private final AcMetricsRegistry metrics;

  public MemoryBridge(AcConfig config) {
    Objects.requireNonNull(config, "config cannot be null");
    this.metrics = config.metricsRegistry();
    this.memory = new LinearMemory(config.initialMemoryBytes(), config.maxMemoryBytes());
    this.allocator =
        new RegionAllocator(memory, config.alignment(), config.maxLiveRegions(), metrics);
    this.enforceOwnership = config.enforceRegionOwnership();
  }

  /** Transfers ownership of a fresh zeroed region to the caller. */
  public Region reserve(int size) {
    return allocator.reserve(size);
  }

  /** Takes back a region; {@code size} must equal the reserved size. */
  public void release(int ptr, int size) {
    allocator.release(ptr, size);
  }

  public void release(Region region) {
    allocator.release(region);
  }

  /**
   * Reserves a region and copies {@code data} into it.
   *
   * @param data bytes to copy
   * @return the region, owned by the caller
   */
  public Region copyIn(byte[] data) {
    Objects.requireNonNull(data, "data cannot be null");
    Region region = allocator.reserve(data.length);
    memory.write(region.ptr(), data);
    return region;
  }

  /**
   * Copies {@code [ptr, ptr + length)} out of linear memory.
   *
   * @throws InvalidRegionException if the range may not be read
   */
  public byte[] readBytes(int ptr, int length) {
    allocator.checkAccess(ptr, length, enforceOwnership);
    return memory.read(ptr, length);
  }

  /**
   * Decodes {@code [ptr, ptr + length)} as UTF-8 text.
   *
   * @throws InvalidRegionException if the range may not be read
   * @throws InvalidEncodingException if the bytes are not well-formed UTF-8
   */
  public String decode(int ptr, int length) {
    return decodeUtf8(ptr, readBytes(ptr, length));
  }

  /**
   * Copies {@code [ptr, ptr + length)} out of linear memory after checking it is well-formed
   * UTF-8. The bytes are returned undecoded so that offsets into them stay byte offsets.
   */
  public byte[] readUtf8Bytes(int ptr, int length) {
    byte[] bytes = readBytes(ptr, length);
    decodeUtf8(ptr, bytes);
    return bytes;
  }

  /** Copies {@code data} into host memory at {@code ptr}. */
  public void write(int ptr, byte[] data) {
    Objects.requireNonNull(data, "data cannot be null");
    allocator.checkAccess(ptr, data.length, enforceOwnership);
    memory.write(ptr, data);
  }

  /**
   * Validates that {@code count} (start, end) pairs fit at {@code outPtr}.
   *
   * @throws InvalidRegionException if the output range may not be written
   */
  public void checkPairsWritable(int outPtr, int count) {
    if (count < 0) {
      metrics.incrementCounter(MetricNames.ERRORS_INVALID_REGION);
      throw new InvalidRegionException("negative output capacity " + count);
    }
    long bytes = (long) count * PAIR_BYTES;
    if (bytes > Integer.MAX_VALUE) {
      metrics.incrementCounter(MetricNames.ERRORS_INVALID_REGION);
      throw new InvalidRegionException("output capacity " + count + " exceeds addressable memory");
    }
    allocator.checkAccess(outPtr, (int) bytes, enforceOwnership);
  }

  /**
   * Writes {@code count} pairs as consecutive little-endian u32 values at {@code outPtr}.
   *
   * @param outPtr start of the output range
   * @param pairs flattened pairs: {@code start0, end0, start1, end1, ...}
   * @param count number of pairs to write
   */
  public void writePairs(int outPtr, int[] pairs, int count) {
    checkPairsWritable(outPtr, count);
    for (int i = 0; i < count; i++) {
      int at = outPtr + i * PAIR_BYTES;
      memory.writeIntLE(at, pairs[2 * i]);
      memory.writeIntLE(at + 4, pairs[2 * i + 1]);
    }
  }

  /**
   * Reads back {@code count} pairs written by {@link #writePairs(int, int[], int)}.
   *
   * @return flattened pairs
   */
  public int[] readPairs(int outPtr, int count) {
    checkPairsWritable(outPtr, count);
    int[] pairs = new int[2 * count];
    for (int i = 0; i < count; i++) {
      int at = outPtr + i * PAIR_BYTES;
      pairs[2 * i] = memory.readIntLE(at);
      pairs[2 * i + 1] = memory.readIntLE(at + 4);
    }
    return pairs;
  }

  public LinearMemory memory() {
    return memory;
  }

  public RegionAllocator allocator() {
    return allocator;
  }

  public MemoryStatistics getStatistics() {
    return allocator.getStatistics();
  }

  @Override
  public void close() {
    MemoryStatistics stats = allocator.getStatistics();
    if (stats.liveRegions() > 0) {
      logger.warn(
          "libac: Closing linear memory with {} live regions ({} bytes) never released",
          stats.liveRegions(),
          stats.reservedBytes());
    }
    memory.close();
  }

  private String decodeUtf8(int ptr, byte[] bytes) {
    CharsetDecoder decoder =
        StandardCharsets.UTF_8
            .newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
    ByteBuffer in = ByteBuffer.wrap(bytes);
    CharBuffer out = CharBuffer.allocate(bytes.length);

    CoderResult result = decoder.decode(in, out, true);
    if (!result.isError()) {
      result = decoder.flush(out);
    }
    if (result.isError()) {
      metrics.incrementCounter(MetricNames.ERRORS_INVALID_ENCODING);
      int errorOffset = in.position();
      logger.debug("libac: Malformed UTF-8 - ptr: {}, offset: {}", ptr, errorOffset);
      try {
        result.throwException();
      } catch (CharacterCodingException e) {
        throw new InvalidEncodingException(ptr, errorOffset, e);
      }
    }
    out.flip();
    return out.toString();
  }
}
