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
 * A byte range of linear memory owned by the host.
 *
 * <p>Carries its own length, so releasing a {@code Region} through {@link
 * RegionAllocator#release(Region)} cannot get the size wrong. The raw {@code (ptr, size)} form of
 * the boundary protocol remains available and is validated.
 *
 * @param ptr offset of the first byte
 * @param length number of bytes the host asked for
 * @since 1.0.0
 */
public record Region(int ptr, int length) {

  public Region {
    if (ptr < 0 || length < 0) {
      throw new IllegalArgumentException("invalid region: ptr=" + ptr + ", length=" + length);
    }
  }

  /** Offset one past the last byte. */
  public long end() {
    return (long) ptr + length;
  }
}
