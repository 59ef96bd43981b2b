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

package com.axonops.libac.automaton;

/**
 * A single match reported by an {@link Automaton}.
 *
 * <p>Offsets are byte offsets into the scanned haystack, half-open: the matched bytes are {@code
 * haystack[start, end)}.
 *
 * @param start offset of the first matched byte
 * @param end offset one past the last matched byte
 * @param pattern index of the matching pattern in the order patterns were supplied
 * @since 1.0.0
 */
public record Match(int start, int end, int pattern) {

  public Match {
    if (start < 0 || end < start) {
      throw new IllegalArgumentException("invalid match bounds [" + start + ", " + end + ")");
    }
  }

  /** Number of matched bytes. */
  public int length() {
    return end - start;
  }

  /** True for a match of the empty pattern. */
  public boolean isEmpty() {
    return start == end;
  }
}
