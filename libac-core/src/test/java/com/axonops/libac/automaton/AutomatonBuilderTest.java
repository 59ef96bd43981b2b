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

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Structure of the automatons produced by {@link AutomatonBuilder}.
 */
class AutomatonBuilderTest {

    @Test
    void testStateAndClassCounts() {
        Automaton automaton = new AutomatonBuilder().build(List.of("he", "she", "hers"));

        // dead, start, h, he, her, hers, s, sh, she
        assertThat(automaton.stateCount()).isEqualTo(9);
        // h, e, r, s and the shared class of every other byte
        assertThat(automaton.alphabetLength()).isEqualTo(5);
        assertThat(automaton.patternCount()).isEqualTo(3);
        assertThat(automaton.maxPatternLength()).isEqualTo(4);
    }

    @Test
    void testCaseFoldingSharesClasses() {
        Automaton folded = new AutomatonBuilder()
            .asciiCaseInsensitive(true)
            .build(List.of("Hello", "HELLO", "hello"));
        Automaton exact = new AutomatonBuilder()
            .build(List.of("Hello", "HELLO", "hello"));

        // h, e, l, o + shared class
        assertThat(folded.alphabetLength()).isEqualTo(5);
        assertThat(folded.stateCount()).isEqualTo(2 + 5);
        assertThat(exact.alphabetLength()).isGreaterThan(folded.alphabetLength());
        assertThat(exact.stateCount()).isGreaterThan(folded.stateCount());
    }

    @Test
    void testLeftmostFirstSkipsPatternsBehindEarlierMatch() {
        Automaton first = new AutomatonBuilder()
            .matchKind(MatchKind.LEFTMOST_FIRST)
            .build(List.of("ab", "abcd"));
        Automaton longest = new AutomatonBuilder()
            .matchKind(MatchKind.LEFTMOST_LONGEST)
            .build(List.of("ab", "abcd"));

        // "abcd" can never win under leftmost-first, so its suffix states are never added.
        assertThat(first.stateCount()).isEqualTo(4);
        assertThat(longest.stateCount()).isEqualTo(6);
        assertThat(first.find("abcd")).contains(new Match(0, 2, 0));
        assertThat(longest.find("abcd")).contains(new Match(0, 4, 1));
    }

    @Test
    void testByteAndStringBuildsAgree() {
        List<String> patterns = List.of("alpha", "beta", "gamma");
        byte[][] bytes = patterns.stream()
            .map(p -> p.getBytes(StandardCharsets.UTF_8))
            .toArray(byte[][]::new);

        Automaton fromStrings = new AutomatonBuilder().build(patterns);
        Automaton fromBytes = new AutomatonBuilder().build(bytes);
        Automaton fromList = new AutomatonBuilder().buildBytes(Arrays.asList(bytes));

        String haystack = "alphabet gamma ray, beta";
        assertThat(fromBytes.findIter(haystack)).containsExactlyElementsOf(fromStrings.findIter(haystack));
        assertThat(fromList.findIter(haystack)).containsExactlyElementsOf(fromStrings.findIter(haystack));
        assertThat(fromStrings.stateCount()).isEqualTo(fromBytes.stateCount());
    }

    @Test
    void testBuilderDoesNotRetainCallerArrays() {
        byte[] pattern = "abc".getBytes(StandardCharsets.UTF_8);
        Automaton automaton = new AutomatonBuilder().build(pattern);

        pattern[0] = 'x';

        assertThat(automaton.isMatch("abc")).isTrue();
        assertThat(automaton.isMatch("xbc")).isFalse();
    }

    @Test
    void testEmptyPatternSet() {
        Automaton automaton = new AutomatonBuilder().build(List.of());

        assertThat(automaton.patternCount()).isZero();
        assertThat(automaton.stateCount()).isEqualTo(2);
        assertThat(automaton.isMatch("anything")).isFalse();
    }

    @Test
    void testMemoryFootprintGrowsWithPatterns() {
        Automaton small = new AutomatonBuilder().build(List.of("a"));
        Automaton large = new AutomatonBuilder().build(List.of("alpha", "bravo", "charlie", "delta", "echo"));

        assertThat(small.memoryBytes()).isPositive();
        assertThat(large.memoryBytes()).isGreaterThan(small.memoryBytes());
        assertThat(large.toString()).contains("patterns=5", "LEFTMOST_LONGEST");
    }

    @Test
    void testNullPatternsRejected() {
        AutomatonBuilder builder = new AutomatonBuilder();

        assertThatThrownBy(() -> builder.build((List<String>) null))
            .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> builder.build(Arrays.asList("a", null)))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("pattern cannot be null");
        assertThatThrownBy(() -> builder.matchKind(null))
            .isInstanceOf(NullPointerException.class);
    }
}
