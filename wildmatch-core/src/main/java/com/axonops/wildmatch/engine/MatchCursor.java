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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Working state of one {@link BacktrackingMatcher} run.
 *
 * NOT Thread-Safe: a cursor belongs to exactly one matching call and is discarded when it returns.
 *
 * @since 1.0.0
 */
public final class MatchCursor {

    private final String text;
    private final AtomSequence atoms;
    private final Deque<BacktrackEntry> backtrackStack = new ArrayDeque<>();

    private ControlState state;
    private int stringIndex;
    private int atomIndex;

    private long transitions;
    private long backtracks;
    private int peakBacktrackDepth;

    public MatchCursor(String text, AtomSequence atoms) {
        this.text = Objects.requireNonNull(text, "text cannot be null");
        this.atoms = Objects.requireNonNull(atoms, "atoms cannot be null");
        this.state = atoms.isEmpty() ? ControlState.COMPUTE_NEXT_ATOM : ControlState.TRY_MATCH_ATOM;
    }

    public ControlState state() {
        return state;
    }

    public int stringIndex() {
        return stringIndex;
    }

    public int atomIndex() {
        return atomIndex;
    }

    public int backtrackDepth() {
        return backtrackStack.size();
    }

    public long transitions() {
        return transitions;
    }

    public long backtracks() {
        return backtracks;
    }

    public int peakBacktrackDepth() {
        return peakBacktrackDepth;
    }

    public CursorSnapshot snapshot() {
        return new CursorSnapshot(state, stringIndex, atomIndex, backtrackStack.size());
    }

    int textLength() {
        return text.length();
    }

    int atomCount() {
        return atoms.size();
    }

    MatchAtom currentAtom() {
        return atoms.get(atomIndex);
    }

    boolean atLastAtom() {
        return atomIndex == atoms.size() - 1;
    }

    /** Current input character, or {@link MatchAtom#END_OF_INPUT}. */
    int currentChar() {
        return stringIndex < text.length() ? text.charAt(stringIndex) : MatchAtom.END_OF_INPUT;
    }

    void advanceString() {
        stringIndex++;
    }

    void advanceAtom() {
        atomIndex++;
    }

    void transitionTo(ControlState next) {
        state = next;
        transitions++;
    }

    void pushBacktrack(int resumeStringIndex, int resumeAtomIndex) {
        if (resumeStringIndex < 0 || resumeStringIndex > text.length()
            || resumeAtomIndex < 0 || resumeAtomIndex > atoms.size()) {
            throw new IllegalStateException("Backtrack entry out of bounds: (" + resumeStringIndex
                + ", " + resumeAtomIndex + ") for text length " + text.length()
                + " and " + atoms.size() + " atoms");
        }
        backtrackStack.push(new BacktrackEntry(resumeStringIndex, resumeAtomIndex));
        peakBacktrackDepth = Math.max(peakBacktrackDepth, backtrackStack.size());
    }

    /** Pops and restores the latest entry; returns false if the stack was empty. */
    boolean restoreLatestBacktrack() {
        BacktrackEntry entry = backtrackStack.poll();
        if (entry == null) {
            return false;
        }
        stringIndex = entry.stringIndex();
        atomIndex = entry.atomIndex();
        backtracks++;
        return true;
    }

    @Override
    public String toString() {
        return "MatchCursor{state=" + state + ", stringIndex=" + stringIndex + ", atomIndex=" + atomIndex
            + ", backtrackDepth=" + backtrackStack.size() + "}";
    }
}
