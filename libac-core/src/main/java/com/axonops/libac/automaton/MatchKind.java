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
 * Match selection policy of an {@link Automaton}.
 *
 * <p>Both kinds report non-overlapping matches, scanning left to right, and always prefer the
 * match that starts earliest. They differ when several patterns match at that same start.
 *
 * @since 1.0.0
 */
public enum MatchKind {

  /** Among matches starting at the leftmost position, report the longest. */
  LEFTMOST_LONGEST,

  /**
   * Among matches starting at the leftmost position, report the one whose pattern was supplied
   * first.
   */
  LEFTMOST_FIRST
}
