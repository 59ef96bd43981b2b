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
import net.openhft.chronicle.bytes.BytesStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The flat address space shared by host and library.
 *
 * <p>Backed by an off-heap Chronicle {@link BytesStore}. Addresses are non-negative 32-bit offsets
 * from the start of the store; the host never sees a native address. Memory grows in {@link
 * #PAGE_SIZE} pages by copying into a larger store, so offsets survive growth unchanged.
 *
 * <p>Multi-byte values are little-endian regardless of platform byte order.
 *
 * <p>Every access is bounds-checked against the current size and throws {@link
 * InvalidRegionException} when it falls outside. Ownership of sub-ranges is the business of {@link
 * RegionAllocator}, not of this class.
 *
 * <p>Thread-safe: all accessors synchronize on this instance.
 *
 * @since 1.0.0
 */
public final class LinearMemory implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(LinearMemory.class);

  /** Growth granularity in bytes (64 KiB). */
  public static final int PAGE_SIZE = 65536;

  /** Largest page count whose byte size still fits a non-negative int. */
  public static final int MAX_PAGES = Integer.MAX_VALUE / PAGE_SIZE;

  private BytesStore<?, ?> store;
  private int pages;
  private final int maxPages;
  private boolean closed;

  /**
   * Creates linear memory.
   *
   * @param initialBytes initial size, rounded up to whole pages
   * @param maxBytes maximum size, rounded down to whole pages
   */
  public LinearMemory(int initialBytes, int maxBytes) {
    if (initialBytes <= 0 || maxBytes < initialBytes) {
      throw new IllegalArgumentException(
          "invalid memory bounds: initial=" + initialBytes + ", max=" + maxBytes);
    }
    this.pages = Math.min(MAX_PAGES, (int) (((long) initialBytes + PAGE_SIZE - 1) / PAGE_SIZE));
    this.maxPages = Math.max(pages, Math.min(MAX_PAGES, maxBytes / PAGE_SIZE));
    this.store = allocate(pages);
    logger.debug("libac: Linear memory initialized - pages: {}, maxPages: {}", pages, maxPages);
  }

  private static BytesStore<?, ?> allocate(int pages) {
    long bytes = (long) pages * PAGE_SIZE;
    BytesStore<?, ?> store = BytesStore.nativeStoreWithFixedCapacity(bytes);
    store.zeroOut(0, bytes);
    return store;
  }

  /** Current size in bytes. */
  public synchronized int size() {
    return pages * PAGE_SIZE;
  }

  /** Current size in pages. */
  public synchronized int pages() {
    return pages;
  }

  /** Maximum size in bytes. */
  public int maxSize() {
    return maxPages * PAGE_SIZE;
  }

  /**
   * Grows memory by {@code deltaPages} pages. New bytes are zero.
   *
   * @param deltaPages pages to add (must be ≥ 0)
   * @return the previous size in pages
   * @throws ResourceException if the maximum size would be exceeded
   */
  public synchronized int grow(int deltaPages) {
    checkOpen();
    if (deltaPages < 0) {
      throw new IllegalArgumentException("deltaPages must be non-negative: " + deltaPages);
    }
    int previous = pages;
    if (deltaPages == 0) {
      return previous;
    }
    if ((long) previous + deltaPages > maxPages) {
      throw new ResourceException(
          ResourceException.Resource.LINEAR_MEMORY,
          "Linear memory exhausted: growing by " + deltaPages + " pages would exceed the maximum of "
              + maxPages + " pages (" + maxSize() + " bytes)");
    }

    BytesStore<?, ?> grown = allocate(previous + deltaPages);
    long used = (long) previous * PAGE_SIZE;
    for (long offset = 0; offset < used; offset += 8) {
      grown.writeLong(offset, store.readLong(offset));
    }
    store.releaseLast();
    store = grown;
    pages = previous + deltaPages;

    logger.debug("libac: Linear memory grown - pages: {} -> {}", previous, pages);
    return previous;
  }

  public synchronized byte readByte(int ptr) {
    checkRange(ptr, 1);
    return store.readByte(ptr);
  }

  public synchronized void writeByte(int ptr, byte value) {
    checkRange(ptr, 1);
    store.writeByte(ptr, value);
  }

  /**
   * Copies {@code length} bytes starting at {@code ptr} into a new array.
   *
   * <p>The returned array is independent of linear memory: no reference into the store escapes.
   */
  public synchronized byte[] read(int ptr, int length) {
    checkRange(ptr, length);
    byte[] bytes = new byte[length];
    for (int i = 0; i < length; i++) {
      bytes[i] = store.readByte(ptr + (long) i);
    }
    return bytes;
  }

  /** Copies {@code data} into memory starting at {@code ptr}. */
  public synchronized void write(int ptr, byte[] data) {
    checkRange(ptr, data.length);
    for (int i = 0; i < data.length; i++) {
      store.writeByte(ptr + (long) i, data[i]);
    }
  }

  /** Reads an unsigned 32-bit little-endian value, returned in an int's bit pattern. */
  public synchronized int readIntLE(int ptr) {
    checkRange(ptr, 4);
    return (store.readByte(ptr) & 0xff)
        | (store.readByte(ptr + 1L) & 0xff) << 8
        | (store.readByte(ptr + 2L) & 0xff) << 16
        | (store.readByte(ptr + 3L) & 0xff) << 24;
  }

  /** Writes a 32-bit value in little-endian byte order. */
  public synchronized void writeIntLE(int ptr, int value) {
    checkRange(ptr, 4);
    store.writeByte(ptr, (byte) value);
    store.writeByte(ptr + 1L, (byte) (value >>> 8));
    store.writeByte(ptr + 2L, (byte) (value >>> 16));
    store.writeByte(ptr + 3L, (byte) (value >>> 24));
  }

  /** Zeroes {@code length} bytes starting at {@code ptr}. */
  public synchronized void zero(int ptr, int length) {
    checkRange(ptr, length);
    if (length > 0) {
      store.zeroOut(ptr, (long) ptr + length);
    }
  }

  /**
   * Tests whether {@code [ptr, ptr + length)} lies inside memory.
   */
  public synchronized boolean contains(int ptr, int length) {
    return ptr >= 0 && length >= 0 && (long) ptr + length <= (long) pages * PAGE_SIZE;
  }

  /** Releases the off-heap store. Further access throws {@link IllegalStateException}. */
  @Override
  public synchronized void close() {
    if (!closed) {
      closed = true;
      store.releaseLast();
      logger.debug("libac: Linear memory released - pages: {}", pages);
    }
  }

  public synchronized boolean isClosed() {
    return closed;
  }

  private void checkRange(int ptr, int length) {
    checkOpen();
    if (!contains(ptr, length)) {
      throw new InvalidRegionException(
          "[" + ptr + ", " + ((long) ptr + length) + ") is outside linear memory of "
              + size() + " bytes");
    }
  }

  private void checkOpen() {
    if (closed) {
      throw new IllegalStateException("libac: Linear memory is closed");
    }
  }
}
