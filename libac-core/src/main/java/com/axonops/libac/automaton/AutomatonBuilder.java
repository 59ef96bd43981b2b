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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds immutable {@link Automaton}s from a set of byte patterns.
 *
 * <p>Construction runs in three phases:
 *
 * <ol>
 *   <li><b>Trie</b> - patterns (case folded if requested) are inserted into a trie whose edges are
 *       labelled with {@link ByteClasses byte classes}
 *   <li><b>Failure links</b> - breadth-first, classic Aho-Corasick. Under leftmost semantics a
 *       state that completes a pattern gets the dead state as failure link: once a match has been
 *       seen, no match starting further right may replace it.
 *   <li><b>DFA</b> - every missing edge is resolved through the failure chain, giving one table
 *       lookup per haystack byte and no backtracking
 * </ol>
 *
 * <pre>{@code
 * Automaton automaton = new AutomatonBuilder()
 *     .asciiCaseInsensitive(true)
 *     .matchKind(MatchKind.LEFTMOST_LONGEST)
 *     .build(List.of("he", "she", "hers"));
 * }</pre>
 *
 * <p>Builders are not thread-safe; the automatons they produce are.
 *
 * @since 1.0.0
 */
public final class AutomatonBuilder {
  private static final Logger logger = LoggerFactory.getLogger(AutomatonBuilder.class);

  static final int DEAD = 0;
  static final int START = 1;
  private static final int FAIL = -1;

  private MatchKind matchKind = MatchKind.LEFTMOST_LONGEST;
  private boolean asciiCaseInsensitive = false;

  /**
   * Sets the match selection policy.
   *
   * @param matchKind policy (default {@link MatchKind#LEFTMOST_LONGEST})
   * @return this builder
   */
  public AutomatonBuilder matchKind(MatchKind matchKind) {
    this.matchKind = Objects.requireNonNull(matchKind, "matchKind cannot be null");
    return this;
  }

  /**
   * Enables ASCII case-insensitive matching. Only {@code A-Z} and {@code a-z} are folded.
   *
   * @param enabled true to fold ASCII letters (default false)
   * @return this builder
   */
  public AutomatonBuilder asciiCaseInsensitive(boolean enabled) {
    this.asciiCaseInsensitive = enabled;
    return this;
  }

  /**
   * Builds an automaton from UTF-8 encoded string patterns.
   *
   * @param patterns patterns, in priority order
   * @return the compiled automaton
   */
  public Automaton build(Collection<String> patterns) {
    Objects.requireNonNull(patterns, "patterns cannot be null");
    List<byte[]> encoded = new ArrayList<>(patterns.size());
    for (String pattern : patterns) {
      encoded.add(Objects.requireNonNull(pattern, "pattern cannot be null")
          .getBytes(StandardCharsets.UTF_8));
    }
    return buildBytes(encoded);
  }

  /**
   * Builds an automaton from byte patterns.
   *
   * @param patterns patterns, in priority order
   * @return the compiled automaton
   */
  public Automaton build(byte[]... patterns) {
    Objects.requireNonNull(patterns, "patterns cannot be null");
    return buildBytes(Arrays.asList(patterns));
  }

  /**
   * Builds an automaton from byte patterns.
   *
   * @param patterns patterns, in priority order
   * @return the compiled automaton
   */
  public Automaton buildBytes(List<byte[]> patterns) {
    Objects.requireNonNull(patterns, "patterns cannot be null");
    long start = System.nanoTime();

    byte[][] folded = new byte[patterns.size()][];
    int maxPatternLength = 0;
    for (int i = 0; i < folded.length; i++) {
      byte[] pattern = Objects.requireNonNull(patterns.get(i), "pattern cannot be null");
      folded[i] = asciiCaseInsensitive ? fold(pattern) : pattern.clone();
      maxPatternLength = Math.max(maxPatternLength, pattern.length);
    }

    ByteClasses classes = ByteClasses.of(folded, asciiCaseInsensitive);
    Trie trie = new Trie(classes.alphabetLen());
    for (int id = 0; id < folded.length; id++) {
      trie.insert(id, folded[id], classes, matchKind);
    }
    int[] order = trie.fillFailureLinks();
    Automaton automaton = compile(trie, order, classes, folded.length, maxPatternLength);

    logger.trace(
        "libac: Automaton built - patterns: {}, states: {}, classes: {}, bytes: {}, took {}us",
        folded.length,
        automaton.stateCount(),
        classes.alphabetLen(),
        automaton.memoryBytes(),
        (System.nanoTime() - start) / 1000);
    return automaton;
  }

  private Automaton compile(
      Trie trie, int[] order, ByteClasses classes, int patternCount, int maxPatternLength) {
    int alphabetLen = classes.alphabetLen();
    int strideBits = 32 - Integer.numberOfLeadingZeros(Math.max(1, alphabetLen - 1));
    int stride = 1 << strideBits;
    int states = trie.size();
    int[] transitions = new int[states * stride];

    // Dead row stays all zero. Rows are filled in BFS order so the failure row is always complete.
    for (int s : order) {
      int row = s << strideBits;
      int failRow = trie.fail[s] << strideBits;
      for (int c = 0; c < alphabetLen; c++) {
        int child = trie.child(s, c);
        int target;
        if (child != FAIL) {
          target = child;
        } else if (s == START) {
          target = trie.startIsMatch() ? DEAD : START;
        } else if (trie.fail[s] == DEAD) {
          target = DEAD;
        } else {
          target = transitions[failRow + c] >>> strideBits;
        }
        transitions[row + c] = target << strideBits;
      }
    }

    return new Automaton(
        transitions,
        classes.table(),
        strideBits,
        Arrays.copyOf(trie.matchLength, states),
        Arrays.copyOf(trie.matchPattern, states),
        matchKind,
        asciiCaseInsensitive,
        patternCount,
        maxPatternLength,
        alphabetLen);
  }

  private static byte[] fold(byte[] pattern) {
    byte[] folded = new byte[pattern.length];
    for (int i = 0; i < pattern.length; i++) {
      folded[i] = ByteClasses.foldAscii(pattern[i]);
    }
    return folded;
  }

  /** Mutable trie used only during construction. State 0 is dead, state 1 is the start state. */
  private static final class Trie {
    private final int alphabetLen;
    private int[] edges;
    private int[] depth;
    private int[] fail;
    private int[] ownPattern;
    private int[] matchLength;
    private int[] matchPattern;
    private int size;

    Trie(int alphabetLen) {
      this.alphabetLen = alphabetLen;
      int capacity = 16;
      this.edges = new int[capacity * alphabetLen];
      this.depth = new int[capacity];
      this.fail = new int[capacity];
      this.ownPattern = new int[capacity];
      this.matchLength = new int[capacity];
      this.matchPattern = new int[capacity];
      addState(0); // dead
      addState(0); // start
    }

    int size() {
      return size;
    }

    int child(int state, int cls) {
      return edges[state * alphabetLen + cls];
    }

    boolean startIsMatch() {
      return ownPattern[START] >= 0;
    }

    void insert(int id, byte[] pattern, ByteClasses classes, MatchKind kind) {
      int state = START;
      for (byte b : pattern) {
        if (kind == MatchKind.LEFTMOST_FIRST && ownPattern[state] >= 0) {
          // An earlier pattern is a prefix of this one and always wins.
          return;
        }
        int cls = classes.get(b);
        int next = child(state, cls);
        if (next == FAIL) {
          next = addState(depth[state] + 1);
          edges[state * alphabetLen + cls] = next;
        }
        state = next;
      }
      if (ownPattern[state] < 0) {
        ownPattern[state] = id;
        matchLength[state] = depth[state];
        matchPattern[state] = id;
      }
    }

    /**
     * Computes failure links and inherited matches.
     *
     * @return start state followed by all reachable states in breadth-first order
     */
    int[] fillFailureLinks() {
      int[] queue = new int[size];
      int tail = 0;
      queue[tail++] = START;
      fail[START] = START;
      fail[DEAD] = DEAD;

      // Depth one: failure is the start state, or dead for a state completing a pattern. When the
      // empty pattern matches at the start state every failure link is dead: the empty match at
      // the scan position is already leftmost.
      boolean startIsMatch = startIsMatch();
      int startRow = START * alphabetLen;
      for (int c = 0; c < alphabetLen; c++) {
        int next = edges[startRow + c];
        if (next == FAIL) {
          continue;
        }
        fail[next] = startIsMatch || ownPattern[next] >= 0 ? DEAD : START;
        queue[tail++] = next;
      }
      // The start state itself is already expanded.
      int head = 1;

      while (head < tail) {
        int id = queue[head++];
        int row = id * alphabetLen;
        for (int c = 0; c < alphabetLen; c++) {
          int next = edges[row + c];
          if (next == FAIL) {
            continue;
          }
          queue[tail++] = next;
          if (ownPattern[next] >= 0) {
            fail[next] = DEAD;
            continue;
          }
          int f = fail[id];
          while (follow(f, c) == FAIL) {
            f = fail[f];
          }
          f = follow(f, c);
          fail[next] = f;
          if (f != START && f != DEAD && matchLength[f] >= 0) {
            matchLength[next] = matchLength[f];
            matchPattern[next] = matchPattern[f];
          }
        }
      }
      return Arrays.copyOf(queue, tail);
    }

    private int follow(int state, int cls) {
      if (state == DEAD) {
        return DEAD;
      }
      int next = child(state, cls);
      if (next != FAIL) {
        return next;
      }
      if (state == START) {
        return startIsMatch() ? DEAD : START;
      }
      return FAIL;
    }

    private int addState(int stateDepth) {
      if (size == depth.length) {
        int capacity = depth.length * 2;
        edges = Arrays.copyOf(edges, capacity * alphabetLen);
        depth = Arrays.copyOf(depth, capacity);
        fail = Arrays.copyOf(fail, capacity);
        ownPattern = Arrays.copyOf(ownPattern, capacity);
        matchLength = Arrays.copyOf(matchLength, capacity);
        matchPattern = Arrays.copyOf(matchPattern, capacity);
      }
      int id = size++;
      Arrays.fill(edges, id * alphabetLen, (id + 1) * alphabetLen, FAIL);
      depth[id] = stateDepth;
      fail[id] = START;
      ownPattern[id] = -1;
      matchLength[id] = -1;
      matchPattern[id] = -1;
      return id;
    }
  }
}
