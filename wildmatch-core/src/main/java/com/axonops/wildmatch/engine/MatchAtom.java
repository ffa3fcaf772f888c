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

import java.util.Objects;

/**
 * The smallest matchable unit of a pattern: a literal character or a wildcard, optionally
 * repeatable (zero or more).
 *
 * <p>Valid atom sources: {@code "a"}, {@code "a*"}, {@code "."}, {@code ".*"}. A lone {@code "*"}
 * is not an atom (repetition of what?), and {@code "aa"} is two atoms.
 *
 * @param kind literal or wildcard
 * @param literal the character matched by a {@link Kind#LITERAL} atom; {@code '\0'} for wildcards
 * @param repeatable whether the atom matches zero or more consecutive characters
 * @since 1.0.0
 */
public record MatchAtom(Kind kind, char literal, boolean repeatable) {

    /** Marker passed to {@link #accepts(int)} when the input is exhausted. */
    public static final int END_OF_INPUT = -1;

    /** Closed set of atom kinds. */
    public enum Kind {
        LITERAL,
        WILDCARD
    }

    public MatchAtom {
        Objects.requireNonNull(kind, "kind cannot be null");
        if (kind == Kind.WILDCARD && literal != '\0') {
            throw new IllegalArgumentException("wildcard atoms carry no literal character");
        }
    }

    public static MatchAtom literal(char c, boolean repeatable) {
        return new MatchAtom(Kind.LITERAL, c, repeatable);
    }

    public static MatchAtom wildcard(boolean repeatable) {
        return new MatchAtom(Kind.WILDCARD, '\0', repeatable);
    }

    /**
     * Tests whether this atom accepts the given input character.
     *
     * <p>End of input is accepted only by repeatable atoms: a repetition may always stop with zero
     * further matches.
     *
     * @param ch the input character, or {@link #END_OF_INPUT}
     * @return true if the atom accepts {@code ch}
     */
    public boolean accepts(int ch) {
        if (ch == END_OF_INPUT) {
            return repeatable;
        }
        return switch (kind) {
            case LITERAL -> literal == ch;
            case WILDCARD -> true;
        };
    }

    /**
     * Whether {@code next}, appended directly after this atom, adds nothing to the language.
     *
     * <p>True only when both atoms are repeatable and every character {@code next} matches is also
     * matched by this atom: {@code a*a*}, {@code .*.*} and {@code .*a*}. Never true for {@code a*b*}
     * or {@code a*.*}.
     *
     * @param next the atom that would follow this one
     * @return true if {@code next} can be dropped without changing any match result
     */
    public boolean makesRedundant(MatchAtom next) {
        if (!repeatable || !next.repeatable) {
            return false;
        }
        return switch (kind) {
            case WILDCARD -> true;
            case LITERAL -> next.kind == Kind.LITERAL && next.literal == literal;
        };
    }

    @Override
    public String toString() {
        String base = kind == Kind.WILDCARD ? "." : String.valueOf(literal);
        return repeatable ? base + "*" : base;
    }
}
