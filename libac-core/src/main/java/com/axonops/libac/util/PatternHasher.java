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

package com.axonops.libac.util;

import java.util.List;

/**
 * Utility for hashing pattern sets for logging purposes.
 *
 * <p>Patterns supplied by a host may be sensitive (keywords, tokens, identifiers), so they are
 * never logged verbatim. The same pattern set always produces the same hash, which keeps log lines
 * greppable.
 *
 * @since 1.0.0
 */
public final class PatternHasher {

    private PatternHasher() {
        // Utility class
    }

    /**
     * Creates a compact hex hash of a string for logging.
     *
     * @param text the text to hash
     * @return hex string (e.g., "7a3f2b1c")
     */
    public static String hash(String text) {
        if (text == null) {
            return "null";
        }
        return Integer.toHexString(text.hashCode());
    }

    /**
     * Creates a hash of a pattern set with its size (e.g., "7a3f2b1c[3]").
     *
     * @param patterns the patterns in supplied order
     * @return hash with pattern count suffix
     */
    public static String hash(List<String> patterns) {
        if (patterns == null) {
            return "null";
        }
        return Integer.toHexString(patterns.hashCode()) + "[" + patterns.size() + "]";
    }
}
