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
 * Partition of the 256 byte values into equivalence classes.
 *
 * <p>Bytes that never occur in any pattern behave identically in every state, so they share class
 * 0. Every byte that does occur gets its own class. With ASCII case folding both cases of a letter
 * map to the same class, which makes case-insensitive scanning free at search time.
 *
 * <p>The transition table of an {@link Automaton} has one column per class instead of one per byte
 * value.
 */
final class ByteClasses {

  private final int[] classes;
  private final int alphabetLen;

  private ByteClasses(int[] classes, int alphabetLen) {
    this.classes = classes;
    this.alphabetLen = alphabetLen;
  }

  /**
   * Computes classes for already case-folded patterns.
   *
   * @param patterns patterns as they will be inserted into the trie
   * @param asciiCaseInsensitive map upper case letters onto the class of their lower case form
   */
  static ByteClasses of(byte[][] patterns, boolean asciiCaseInsensitive) {
    int[] classes = new int[256];
    int next = 1;
    for (byte[] pattern : patterns) {
      for (byte b : pattern) {
        int value = b & 0xff;
        if (classes[value] == 0) {
          classes[value] = next++;
        }
      }
    }
    if (asciiCaseInsensitive) {
      for (int lower = 'a'; lower <= 'z'; lower++) {
        classes[lower - 32] = classes[lower];
      }
    }
    return new ByteClasses(classes, next);
  }

  int get(byte b) {
    return classes[b & 0xff];
  }

  int alphabetLen() {
    return alphabetLen;
  }

  int[] table() {
    return classes;
  }

  static byte foldAscii(byte b) {
    return b >= 'A' && b <= 'Z' ? (byte) (b + 32) : b;
  }
}
