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

import java.util.List;
import java.util.Objects;

/**
 * Compiled form of a pattern: an ordered, immutable list of {@link MatchAtom}s.
 *
 * <p>Thread-safe: instances are immutable and can be shared between concurrent matching calls.
 *
 * @since 1.0.0
 */
public final class AtomSequence {

    private final String source;
    private final List<MatchAtom> atoms;
    private final int collapsedCount;

    AtomSequence(String source, List<MatchAtom> atoms, int collapsedCount) {
        this.source = Objects.requireNonNull(source);
        this.atoms = List.copyOf(atoms);
        this.collapsedCount = collapsedCount;
    }

    /**
     * Builds a sequence directly from atoms, bypassing the compiler.
     *
     * @param atoms atoms in match order
     * @return sequence whose source is the rendered atoms
     */
    public static AtomSequence of(MatchAtom... atoms) {
        List<MatchAtom> list = List.of(atoms);
        StringBuilder sb = new StringBuilder();
        for (MatchAtom atom : list) {
            sb.append(atom);
        }
        return new AtomSequence(sb.toString(), list, 0);
    }

    public MatchAtom get(int index) {
        return atoms.get(index);
    }

    public int size() {
        return atoms.size();
    }

    public boolean isEmpty() {
        return atoms.isEmpty();
    }

    public List<MatchAtom> atoms() {
        return atoms;
    }

    /** The pattern string this sequence was compiled from. */
    public String source() {
        return source;
    }

    /** Number of redundant repeat atoms dropped during compilation. */
    public int collapsedCount() {
        return collapsedCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AtomSequence)) {
            return false;
        }
        return atoms.equals(((AtomSequence) o).atoms);
    }

    @Override
    public int hashCode() {
        return atoms.hashCode();
    }

    /** Renders the atoms back to pattern syntax, e.g. {@code "a*b."}. */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (MatchAtom atom : atoms) {
            sb.append(atom);
        }
        return sb.toString();
    }
}
