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
 * A (start, end) pair as written to host memory by {@link MatcherExports#scan}.
 *
 * @param start byte offset of the first matched byte
 * @param end byte offset one past the last matched byte
 * @since 1.0.0
 */
public record MatchSpan(int start, int end) {

  public int length() {
    return end - start;
  }
}
