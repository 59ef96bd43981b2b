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

package com.axonops.libac.api;

/**
 * Outcome of a {@link MatcherExports#scan} call.
 *
 * @param count number of (start, end) pairs written to the output region, at most the capacity
 * @param truncated true if the haystack held more matches than the capacity allowed
 * @since 1.0.0
 */
public record ScanResult(int count, boolean truncated) {

  public ScanResult {
    if (count < 0) {
      throw new IllegalArgumentException("count must be non-negative: " + count);
    }
  }

  /** Bytes of output written: 8 per pair. */
  public int bytesWritten() {
    return count * 8;
  }
}
