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
 * Full-match engine running compiled atoms through an explicit state machine.
 *
 * <p>Repeatable atoms consume greedily. Each character a repeatable atom takes records a
 * {@link BacktrackEntry} where the repetition could have stopped instead; when a later atom fails,
 * the most recent entry is resumed. No recursion is used, and the backtrack stack never holds more
 * entries than the input has characters.
 *
 * <p>Worst-case time is exponential for long chains of distinct repeat atoms (e.g. {@code a*b*a*b*}
 * against adversarial input). {@link PatternCompiler} collapses the common redundant chains; use
 * {@link MemoizedMatcher} when O(n&middot;m) is required.
 *
 * <p>Thread-safe: the matcher holds no per-call state; each call owns a fresh {@link MatchCursor}.
 *
 * @since 1.0.0
 */
public final class BacktrackingMatcher implements FullMatcher {

    private final MatchTraceListener traceListener;
    private final boolean tracing;

    public BacktrackingMatcher() {
        this(MatchTraceListener.NO_OP);
    }

    /**
     * @param traceListener observer called after every transition (use {@link MatchTraceListener#NO_OP} to disable)
     */
    public BacktrackingMatcher(MatchTraceListener traceListener) {
        this.traceListener = Objects.requireNonNull(traceListener, "traceListener cannot be null");
        this.tracing = traceListener != MatchTraceListener.NO_OP;
    }

    /**
     * Compiles {@code pattern} and matches it against {@code text}.
     *
     * @throws com.axonops.wildmatch.exception.InvalidPatternException if the pattern is malformed
     */
    @Override
    public boolean isMatch(String text, String pattern) {
        return isMatch(text, PatternCompiler.compile(pattern));
    }

    public boolean isMatch(String text, AtomSequence atoms) {
        return run(text, atoms).matched();
    }

    /**
     * Runs the state machine to a terminal state.
     *
     * @param text input string
     * @param atoms compiled pattern
     * @return match result with transition and backtrack counts
     */
    public MatchOutcome run(String text, AtomSequence atoms) {
        MatchCursor cursor = new MatchCursor(text, atoms);
        if (tracing) {
            traceListener.onTransition(cursor.snapshot());
        }

        while (!cursor.state().isTerminal()) {
            step(cursor);
            if (tracing) {
                traceListener.onTransition(cursor.snapshot());
            }
        }

        return new MatchOutcome(
            cursor.state() == ControlState.SUCCESS,
            cursor.transitions(),
            cursor.backtracks(),
            cursor.peakBacktrackDepth());
    }

    /** Executes exactly one transition from the cursor's current state. */
    static void step(MatchCursor cursor) {
        switch (cursor.state()) {
            case TRY_MATCH_ATOM -> tryMatchAtom(cursor);
            case COMPUTE_NEXT_ATOM -> computeNextAtom(cursor);
            case ATTEMPT_BACKTRACK -> attemptBacktrack(cursor);
            case SUCCESS, FAILURE -> throw new IllegalStateException(
                "Wildmatch: No transition out of terminal state " + cursor.state());
        }
    }

    static void tryMatchAtom(MatchCursor cursor) {
        MatchAtom atom = cursor.currentAtom();
        int ch = cursor.currentChar();
        boolean accepted = atom.accepts(ch);

        if (!atom.repeatable()) {
            if (accepted) {
                cursor.advanceString();
                cursor.advanceAtom();
                cursor.transitionTo(ControlState.COMPUTE_NEXT_ATOM);
            } else {
                cursor.transitionTo(ControlState.ATTEMPT_BACKTRACK);
            }
            return;
        }

        if (accepted && ch != MatchAtom.END_OF_INPUT) {
            // Resume point: stop the repetition before this character. Pointless after the last
            // atom, where stopping early always leaves input unconsumed.
            if (!cursor.atLastAtom()) {
                cursor.pushBacktrack(cursor.stringIndex(), cursor.atomIndex() + 1);
            }
            cursor.advanceString();
            cursor.transitionTo(ControlState.TRY_MATCH_ATOM);
        } else {
            // Input exhausted or mismatch: the repetition ends here.
            cursor.advanceAtom();
            cursor.transitionTo(ControlState.COMPUTE_NEXT_ATOM);
        }
    }

    static void computeNextAtom(MatchCursor cursor) {
        if (cursor.atomIndex() >= cursor.atomCount()) {
            cursor.transitionTo(cursor.stringIndex() >= cursor.textLength()
                ? ControlState.SUCCESS
                : ControlState.ATTEMPT_BACKTRACK);
        } else {
            cursor.transitionTo(ControlState.TRY_MATCH_ATOM);
        }
    }

    static void attemptBacktrack(MatchCursor cursor) {
        if (cursor.restoreLatestBacktrack()) {
            cursor.transitionTo(ControlState.TRY_MATCH_ATOM);
        } else {
            cursor.transitionTo(ControlState.FAILURE);
        }
    }
}
