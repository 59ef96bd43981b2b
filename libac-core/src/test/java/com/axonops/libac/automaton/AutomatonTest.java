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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Random;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

/**
 * Scanning semantics of built automatons.
 */
class AutomatonTest {

    private static Automaton leftmostLongest(String... patterns) {
        return new AutomatonBuilder()
            .matchKind(MatchKind.LEFTMOST_LONGEST)
            .asciiCaseInsensitive(true)
            .build(List.of(patterns));
    }

    private static List<Match> all(Automaton automaton, String haystack) {
        List<Match> matches = new ArrayList<>();
        automaton.findIter(haystack).forEach(matches::add);
        return matches;
    }

    @Test
    @DisplayName("Leftmost-longest prefers the earliest start over a longer later match")
    void testShers() {
        Automaton automaton = leftmostLongest("he", "she", "hers");

        assertThat(all(automaton, "shers")).containsExactly(new Match(0, 3, 1));
    }

    @Test
    void testLongestAtSameStart() {
        Automaton automaton = leftmostLongest("a", "ab", "abc");

        assertThat(all(automaton, "abcd")).containsExactly(new Match(0, 3, 2));
        assertThat(all(automaton, "abxa")).containsExactly(new Match(0, 2, 1), new Match(3, 4, 0));
    }

    @Test
    void testCaseInsensitive() {
        Automaton automaton = leftmostLongest("ABC");

        assertThat(all(automaton, "xxabcxx")).containsExactly(new Match(2, 5, 0));
        assertThat(all(automaton, "xxAbCxx")).containsExactly(new Match(2, 5, 0));
    }

    @Test
    void testCaseSensitiveWhenFoldingDisabled() {
        Automaton automaton = new AutomatonBuilder().build(List.of("ABC"));

        assertThat(automaton.isAsciiCaseInsensitive()).isFalse();
        assertThat(automaton.isMatch("xxabcxx")).isFalse();
        assertThat(automaton.find("xxABCxx")).contains(new Match(2, 5, 0));
    }

    @Test
    void testNonAsciiLettersAreNotFolded() {
        Automaton automaton = leftmostLongest("é");

        assertThat(automaton.isMatch("CAFÉ")).isFalse();
        // Offsets are byte offsets: 'é' is two bytes in UTF-8.
        assertThat(all(automaton, "café!")).containsExactly(new Match(3, 5, 0));
    }

    @Test
    void testMatchesNeverOverlap() {
        Automaton automaton = leftmostLongest("aa");

        assertThat(all(automaton, "aaaaa")).containsExactly(new Match(0, 2, 0), new Match(2, 4, 0));
    }

    @Test
    void testPatternInsideLongerPrefix() {
        assertThat(all(leftmostLongest("abcd", "bc"), "abcx")).containsExactly(new Match(1, 3, 1));
        assertThat(all(leftmostLongest("abcde", "bc", "bcd"), "abcdx")).containsExactly(new Match(1, 4, 2));
        assertThat(all(leftmostLongest("abcdef", "bc", "de"), "abcdeg"))
            .containsExactly(new Match(1, 3, 1), new Match(3, 5, 2));
    }

    @Test
    void testLongerMatchFromEarlierStartReplacesSuffixMatch() {
        Automaton automaton = leftmostLongest("abcd", "bc");

        assertThat(all(automaton, "abcd")).containsExactly(new Match(0, 4, 0));
    }

    @Test
    void testLeftmostFirst() {
        Automaton automaton = new AutomatonBuilder()
            .matchKind(MatchKind.LEFTMOST_FIRST)
            .build(List.of("a", "ab", "abc"));

        assertThat(automaton.matchKind()).isEqualTo(MatchKind.LEFTMOST_FIRST);
        assertThat(all(automaton, "abcd")).containsExactly(new Match(0, 1, 0));

        Automaton longerFirst = new AutomatonBuilder()
            .matchKind(MatchKind.LEFTMOST_FIRST)
            .build(List.of("abcd", "ab"));
        assertThat(all(longerFirst, "abcd")).containsExactly(new Match(0, 4, 0));
        assertThat(all(longerFirst, "abcx")).containsExactly(new Match(0, 2, 1));
    }

    @Test
    void testDuplicatePatternsReportLowestId() {
        Automaton automaton = leftmostLongest("abc", "abc", "ABC");

        assertThat(automaton.patternCount()).isEqualTo(3);
        assertThat(automaton.find("abc")).contains(new Match(0, 3, 0));
    }

    @Test
    @DisplayName("The empty pattern matches at every position not covered by a longer match")
    void testEmptyPattern() {
        assertThat(all(leftmostLongest(""), "ab"))
            .containsExactly(new Match(0, 0, 0), new Match(1, 1, 0), new Match(2, 2, 0));

        assertThat(all(leftmostLongest("", "a"), "ba"))
            .containsExactly(new Match(0, 0, 0), new Match(1, 2, 1), new Match(2, 2, 0));

        assertThat(all(leftmostLongest(""), "")).containsExactly(new Match(0, 0, 0));
    }

    @Test
    void testEmptyPatternIsNotDisplacedByLaterMatch() {
        Automaton automaton = leftmostLongest("", "abc", "bz");

        assertThat(all(automaton, "abz"))
            .containsExactly(new Match(0, 0, 0), new Match(1, 3, 2), new Match(3, 3, 0));
    }

    @Test
    void testNoMatches() {
        Automaton automaton = leftmostLongest("needle");

        assertThat(automaton.find("haystack")).isEmpty();
        assertThat(automaton.isMatch("")).isFalse();
        assertThat(automaton.findIter("haystack")).isEmpty();
    }

    @Test
    void testBinaryHaystack() {
        Automaton automaton = new AutomatonBuilder().build(new byte[] {(byte) 0xff, 0x00});

        byte[] haystack = {0x01, (byte) 0xff, 0x00, 0x02, (byte) 0xff, 0x00};
        assertThat(automaton.stream(haystack).collect(Collectors.toList()))
            .containsExactly(new Match(1, 3, 0), new Match(4, 6, 0));
    }

    @Test
    void testIterableIsRestartable() {
        Automaton automaton = leftmostLongest("he", "she", "hers");
        Iterable<Match> matches = automaton.findIter("she said hers, he said");

        List<Match> first = new ArrayList<>();
        matches.forEach(first::add);
        List<Match> second = new ArrayList<>();
        matches.forEach(second::add);

        assertThat(first).hasSize(3).isEqualTo(second);
        assertThat(automaton.stream("she said hers, he said".getBytes(StandardCharsets.UTF_8)))
            .containsExactlyElementsOf(first);
    }

    @Test
    void testIteratorExhaustion() {
        Iterator<Match> it = leftmostLongest("x").findIter("x").iterator();

        assertThat(it.hasNext()).isTrue();
        assertThat(it.next()).isEqualTo(new Match(0, 1, 0));
        assertThat(it.hasNext()).isFalse();
        assertThatThrownBy(it::next).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void testMatchesAreContainedAndOrdered() {
        Automaton automaton = leftmostLongest("fox", "quick", "the", "lazy dog", "o");
        String haystack = "The quick brown fox jumps over the lazy dog";
        byte[] bytes = haystack.getBytes(StandardCharsets.UTF_8);

        int previousEnd = 0;
        for (Match match : automaton.findIter(bytes)) {
            assertThat(match.start()).isGreaterThanOrEqualTo(previousEnd);
            assertThat(match.end()).isLessThanOrEqualTo(bytes.length);
            String text = haystack.substring(match.start(), match.end()).toLowerCase();
            assertThat(text).isIn("fox", "quick", "the", "lazy dog", "o");
            previousEnd = match.end();
        }
        assertThat(automaton.findIter(bytes)).hasSize(7);
    }

    @ParameterizedTest
    @EnumSource(MatchKind.class)
    @DisplayName("Scanning agrees with a brute force leftmost search")
    void testAgreesWithBruteForce(MatchKind kind) {
        Random random = new Random(0x5eedL + kind.ordinal());
        for (int round = 0; round < 500; round++) {
            List<String> patterns = new ArrayList<>();
            int patternCount = 1 + random.nextInt(5);
            for (int i = 0; i < patternCount; i++) {
                patterns.add(randomText(random, 1 + random.nextInt(4)));
            }
            if (random.nextInt(10) == 0) {
                patterns.add("");
            }
            String haystack = randomText(random, random.nextInt(24));

            Automaton automaton = new AutomatonBuilder().matchKind(kind).build(patterns);

            assertThat(all(automaton, haystack))
                .as("patterns %s over '%s'", patterns, haystack)
                .isEqualTo(bruteForce(patterns, haystack, kind));
        }
    }

    private static String randomText(Random random, int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append((char) ('a' + random.nextInt(3)));
        }
        return sb.toString();
    }

    private static List<Match> bruteForce(List<String> patterns, String haystack, MatchKind kind) {
        List<Match> matches = new ArrayList<>();
        int position = 0;
        while (position <= haystack.length()) {
            Match found = null;
            for (int start = position; start <= haystack.length() && found == null; start++) {
                for (int id = 0; id < patterns.size(); id++) {
                    String pattern = patterns.get(id);
                    if (!haystack.startsWith(pattern, start)) {
                        continue;
                    }
                    if (found == null
                        || (kind == MatchKind.LEFTMOST_LONGEST && pattern.length() > found.length())) {
                        found = new Match(start, start + pattern.length(), id);
                    }
                }
            }
            if (found == null) {
                break;
            }
            matches.add(found);
            position = found.end() == position ? position + 1 : found.end();
        }
        return matches;
    }
}
