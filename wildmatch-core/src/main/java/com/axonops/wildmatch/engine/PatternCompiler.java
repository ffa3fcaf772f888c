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

package com.axonops.wildmatch.engine;

import com.axonops.wildmatch.exception.InvalidPatternException;
import com.axonops.wildmatch.util.PatternHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parses pattern strings into {@link AtomSequence}s.
 *
 * <p>Redundant adjacent repeat atoms ({@code a*a*}, {@code .*a*}) are collapsed by default. This
 * bounds backtrack stack growth on chains such as {@code a*a*a*a*b} and never changes whether a
 * string matches.
 *
 * @since 1.0.0
 */
public final class PatternCompiler {
    private static final Logger logger = LoggerFactory.getLogger(PatternCompiler.class);

    static final char WILDCARD = '.';
    static final char REPEAT = '*';

    private PatternCompiler() {
        // Utility class
    }

    public static AtomSequence compile(String pattern) {
        return compile(pattern, true);
    }

    /**
     * Compiles a pattern.
     *
     * @param pattern pattern string; empty compiles to an empty sequence
     * @param collapseRedundant drop repeat atoms made redundant by the atom before them
     * @return compiled atoms
     * @throws InvalidPatternException if a {@code '*'} has no atom to bind to
     */
    public static AtomSequence compile(String pattern, boolean collapseRedundant) {
        Objects.requireNonNull(pattern, "pattern cannot be null");

        List<MatchAtom> atoms = new ArrayList<>();
        MatchAtom last = null;
        int collapsed = 0;
        int i = 0;

        while (i < pattern.length()) {
            char base = pattern.charAt(i);
            if (base == REPEAT) {
                throw new InvalidPatternException(pattern, i, i == 0
                    ? "'*' at start of pattern has no preceding atom"
                    : "'*' must directly follow a literal or '.'");
            }
            i++;

            boolean repeatable = i < pattern.length() && pattern.charAt(i) == REPEAT;
            if (repeatable) {
                i++;
            }

            MatchAtom atom = base == WILDCARD
                ? MatchAtom.wildcard(repeatable)
                : MatchAtom.literal(base, repeatable);

            if (collapseRedundant && last != null && last.makesRedundant(atom)) {
                collapsed++;
                continue;
            }

            atoms.add(atom);
            last = atom;
        }

        if (collapsed > 0) {
            logger.trace("Wildmatch: Collapsed redundant atoms - hash: {}, collapsed: {}, remaining: {}",
                PatternHasher.hash(pattern), collapsed, atoms.size());
        }
        return new AtomSequence(pattern, atoms, collapsed);
    }
}
