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

import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * An immutable multi-pattern matcher: a deterministic automaton over byte classes.
 *
 * <p>Thread-safe: an automaton holds no scan state. Every call to {@link #findIter(byte[])} or
 * {@link #find(byte[])} walks the haystack with its own cursor, so independent scans over the same
 * automaton never interfere.
 *
 * <p>Scanning is linear in the haystack: one table lookup per byte. After a match the scan resumes
 * at its end, so bytes already inspected past the end of a match may be inspected again by the
 * next search.
 *
 * <pre>{@code
 * Automaton automaton = new AutomatonBuilder()
 *     .asciiCaseInsensitive(true)
 *     .build(List.of("he", "she", "hers"));
 *
 * for (Match m : automaton.findIter("shers")) {
 *     // (0, 3) only: "hers" at 1 overlaps the earlier match
 * }
 * }</pre>
 *
 * @since 1.0.0
 * @see AutomatonBuilder
 */
public final class Automaton {

  private final int[] transitions;
  private final int[] classes;
  private final int strideBits;
  private final int[] matchLength;
  private final int[] matchPattern;
  private final MatchKind matchKind;
  private final boolean asciiCaseInsensitive;
  private final int patternCount;
  private final int maxPatternLength;
  private final int alphabetLen;
  private final int startId;

  Automaton(
      int[] transitions,
      int[] classes,
      int strideBits,
      int[] matchLength,
      int[] matchPattern,
      MatchKind matchKind,
      boolean asciiCaseInsensitive,
      int patternCount,
      int maxPatternLength,
      int alphabetLen) {
    this.transitions = transitions;
    this.classes = classes;
    this.strideBits = strideBits;
    this.matchLength = matchLength;
    this.matchPattern = matchPattern;
    this.matchKind = matchKind;
    this.asciiCaseInsensitive = asciiCaseInsensitive;
    this.patternCount = patternCount;
    this.maxPatternLength = maxPatternLength;
    this.alphabetLen = alphabetLen;
    this.startId = AutomatonBuilder.START << strideBits;
  }

  /**
   * Returns the leftmost match in the haystack.
   *
   * @param haystack bytes to search
   * @return the first match, or empty if no pattern occurs
   */
  public Optional<Match> find(byte[] haystack) {
    Objects.requireNonNull(haystack, "haystack cannot be null");
    return Optional.ofNullable(findAt(haystack, 0));
  }

  /**
   * Returns the leftmost match in the UTF-8 encoding of the haystack. Offsets are byte offsets.
   */
  public Optional<Match> find(String haystack) {
    Objects.requireNonNull(haystack, "haystack cannot be null");
    return find(haystack.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Tests whether any pattern occurs in the haystack.
   *
   * @param haystack bytes to search
   * @return true if at least one match exists
   */
  public boolean isMatch(byte[] haystack) {
    return find(haystack).isPresent();
  }

  /** Tests whether any pattern occurs in the UTF-8 encoding of the haystack. */
  public boolean isMatch(String haystack) {
    return find(haystack).isPresent();
  }

  /**
   * Returns all non-overlapping matches, lazily, in increasing start order.
   *
   * <p>The returned iterable is restartable: each {@link Iterable#iterator()} call starts a fresh
   * scan. The haystack is not copied and must not be modified while iterating.
   *
   * @param haystack bytes to search
   * @return lazy sequence of matches
   */
  public Iterable<Match> findIter(byte[] haystack) {
    Objects.requireNonNull(haystack, "haystack cannot be null");
    return () -> new MatchIterator(haystack);
  }

  /** Returns all non-overlapping matches in the UTF-8 encoding of the haystack. */
  public Iterable<Match> findIter(String haystack) {
    Objects.requireNonNull(haystack, "haystack cannot be null");
    return findIter(haystack.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Same sequence as {@link #findIter(byte[])} as a sequential stream.
   *
   * @param haystack bytes to search
   * @return stream of matches
   */
  public Stream<Match> stream(byte[] haystack) {
    Objects.requireNonNull(haystack, "haystack cannot be null");
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(
            new MatchIterator(haystack), Spliterator.ORDERED | Spliterator.NONNULL),
        false);
  }

  /**
   * Searches for the leftmost match starting at or after {@code from}.
   *
   * @return the match, or null if none
   */
  Match findAt(byte[] haystack, int from) {
    int state = startId;
    int lastStart = -1;
    int lastEnd = -1;
    int lastPattern = -1;

    int startLength = matchLength[AutomatonBuilder.START];
    if (startLength == 0) {
      lastStart = from;
      lastEnd = from;
      lastPattern = matchPattern[AutomatonBuilder.START];
    }

    for (int i = from; i < haystack.length; i++) {
      state = transitions[state + classes[haystack[i] & 0xff]];
      if (state == AutomatonBuilder.DEAD) {
        break;
      }
      int length = matchLength[state >>> strideBits];
      if (length >= 0) {
        lastEnd = i + 1;
        lastStart = lastEnd - length;
        lastPattern = matchPattern[state >>> strideBits];
      }
    }

    return lastEnd < 0 ? null : new Match(lastStart, lastEnd, lastPattern);
  }

  /** Number of patterns the automaton was built from, including duplicates and empty ones. */
  public int patternCount() {
    return patternCount;
  }

  /** Length in bytes of the longest pattern. */
  public int maxPatternLength() {
    return maxPatternLength;
  }

  /** Number of automaton states, including the dead and start states. */
  public int stateCount() {
    return matchLength.length;
  }

  /** Number of byte equivalence classes (columns of the transition table). */
  public int alphabetLength() {
    return alphabetLen;
  }

  public MatchKind matchKind() {
    return matchKind;
  }

  public boolean isAsciiCaseInsensitive() {
    return asciiCaseInsensitive;
  }

  /**
   * Approximate heap footprint of the automaton tables.
   *
   * @return bytes held by transition, class and match tables
   */
  public long memoryBytes() {
    return 4L * transitions.length
        + 4L * classes.length
        + 4L * matchLength.length
        + 4L * matchPattern.length;
  }

  @Override
  public String toString() {
    return "Automaton{patterns=" + patternCount
        + ", states=" + stateCount()
        + ", classes=" + alphabetLen
        + ", kind=" + matchKind
        + ", asciiCaseInsensitive=" + asciiCaseInsensitive + "}";
  }

  private final class MatchIterator implements Iterator<Match> {
    private final byte[] haystack;
    private int position;
    private Match next;
    private boolean done;

    MatchIterator(byte[] haystack) {
      this.haystack = haystack;
    }

    @Override
    public boolean hasNext() {
      if (next != null) {
        return true;
      }
      if (done || position > haystack.length) {
        done = true;
        return false;
      }
      Match found = findAt(haystack, position);
      if (found == null) {
        done = true;
        return false;
      }
      // An empty match must move the cursor forward or the scan would never end.
      position = found.end() == position ? position + 1 : found.end();
      next = found;
      return true;
    }

    @Override
    public Match next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      Match result = next;
      next = null;
      return result;
    }
  }
}
