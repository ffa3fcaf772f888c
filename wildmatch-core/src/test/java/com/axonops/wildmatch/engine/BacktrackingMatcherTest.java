package com.axonops.wildmatch.engine;

import com.axonops.wildmatch.exception.InvalidPatternException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class BacktrackingMatcherTest {

    private final BacktrackingMatcher matcher = new BacktrackingMatcher();

    @ParameterizedTest
    @CsvSource({
        "aa, a, false",
        "aa, a*, true",
        "mississippi, mis*is*p*., false",
        "mississippi, mis*is*ip*., true",
        "aab, c*a*b*, true",
        "a, ab*, true",
        "aaaaaaaaaaaaab, a*a*a*a*a*a*a*a*a*a*a*a*b, true",
        "aaaaaaaaaaaaac, a*a*a*a*a*a*a*a*a*a*a*a*b, false",
        "ab, .*, true",
        "ab, .*c, false",
        "abc, a.c, true",
        "ab, a*ab, true",
        "aaa, a*a, true",
        "aaa, aaaa, false",
        "abcd, d*, false",
        "xyz, x.*z, true",
        "., ., true",
        "*, ., true",
        "é, ., true",
        "a.*b, .*, true",
        "é*., .*, true",
        "., a, false"
    })
    void testFullMatch(String text, String pattern, boolean expected) {
        assertThat(matcher.isMatch(text, pattern)).isEqualTo(expected);
    }

    @Test
    void testEmptyTextAndPattern() {
        assertThat(matcher.isMatch("", "")).isTrue();
        assertThat(matcher.isMatch("a", "")).isFalse();
        assertThat(matcher.isMatch("", "a")).isFalse();
        assertThat(matcher.isMatch("", ".")).isFalse();
        assertThat(matcher.isMatch("", "a*")).isTrue();
        assertThat(matcher.isMatch("", "a*b*.*")).isTrue();
    }

    @Test
    void testNulCharacterIsOrdinaryInput() {
        assertThat(matcher.isMatch("\0", ".")).isTrue();
        assertThat(matcher.isMatch("a\0b", ".*")).isTrue();
        assertThat(matcher.isMatch("\0", "a")).isFalse();
    }

    @Test
    void testVeryLongInput() {
        String text = "a".repeat(50_000);

        assertThat(matcher.isMatch(text, ".*")).isTrue();
        assertThat(matcher.isMatch(text, "a*")).isTrue();
    }

    @Test
    @DisplayName("Matching is anchored at both ends")
    void testAnchored() {
        assertThat(matcher.isMatch("xab", "ab")).isFalse();
        assertThat(matcher.isMatch("abx", "ab")).isFalse();
        assertThat(matcher.isMatch("ab", "ab")).isTrue();
    }

    @Test
    void testInvalidPatternRejected() {
        assertThatThrownBy(() -> matcher.isMatch("abc", "*abc"))
            .isInstanceOf(InvalidPatternException.class);
    }

    @Test
    @DisplayName("A repetition can resume with zero further characters")
    void testZeroRepetitionResume() {
        MatchOutcome outcome = matcher.run("ab", PatternCompiler.compile("a*ab"));

        assertThat(outcome.matched()).isTrue();
        assertThat(outcome.backtracks()).isEqualTo(1);
    }

    @Test
    void testCollapsedAndUncollapsedAgree() {
        String text = "aaaaaaaaaaaaac";
        String pattern = "a*a*a*a*a*a*b";

        MatchOutcome collapsed = matcher.run(text, PatternCompiler.compile(pattern, true));
        MatchOutcome expanded = matcher.run(text, PatternCompiler.compile(pattern, false));

        assertThat(collapsed.matched()).isFalse();
        assertThat(expanded.matched()).isFalse();
        assertThat(collapsed.backtracks()).isLessThan(expanded.backtracks());
    }

    @Test
    void testBacktrackDepthBoundedByTextLength() {
        String text = "aaaaaaac";
        AtomSequence atoms = PatternCompiler.compile("a*a*a*a*b", false);

        int[] maxSeen = new int[1];
        MatchOutcome outcome = new BacktrackingMatcher(
            s -> maxSeen[0] = Math.max(maxSeen[0], s.backtrackDepth())).run(text, atoms);

        assertThat(outcome.matched()).isFalse();
        assertThat(outcome.backtracks()).isGreaterThan(0);
        assertThat(outcome.peakBacktrackDepth()).isLessThanOrEqualTo(text.length());
        assertThat(maxSeen[0]).isEqualTo(outcome.peakBacktrackDepth());
    }

    @Test
    @DisplayName("Trace listener sees the initial state, every transition and the terminal state")
    void testTraceListener() {
        List<CursorSnapshot> trace = new ArrayList<>();
        MatchOutcome outcome = new BacktrackingMatcher(trace::add).run("aa", PatternCompiler.compile("a*"));

        assertThat(outcome.matched()).isTrue();
        assertThat(trace).hasSize((int) outcome.transitions() + 1);
        assertThat(trace.get(0)).isEqualTo(new CursorSnapshot(ControlState.TRY_MATCH_ATOM, 0, 0, 0));
        assertThat(trace.get(trace.size() - 1).state()).isEqualTo(ControlState.SUCCESS);
        assertThat(trace.subList(0, trace.size() - 1))
            .noneMatch(s -> s.state().isTerminal());
    }

    @Test
    void testTraceOfExactMatch() {
        List<CursorSnapshot> trace = new ArrayList<>();
        new BacktrackingMatcher(trace::add).run("a", PatternCompiler.compile("a"));

        assertThat(trace).containsExactly(
            new CursorSnapshot(ControlState.TRY_MATCH_ATOM, 0, 0, 0),
            new CursorSnapshot(ControlState.COMPUTE_NEXT_ATOM, 1, 1, 0),
            new CursorSnapshot(ControlState.SUCCESS, 1, 1, 0));
    }

    @Test
    void testEmptyPatternStartsAtComputeNextAtom() {
        List<CursorSnapshot> trace = new ArrayList<>();
        MatchOutcome outcome = new BacktrackingMatcher(trace::add).run("", PatternCompiler.compile(""));

        assertThat(outcome.matched()).isTrue();
        assertThat(trace.get(0).state()).isEqualTo(ControlState.COMPUTE_NEXT_ATOM);
    }

    // ========== Single transitions ==========

    @Test
    void testLiteralMismatchGoesToBacktrack() {
        MatchCursor cursor = new MatchCursor("b", PatternCompiler.compile("a"));

        BacktrackingMatcher.step(cursor);

        assertThat(cursor.state()).isEqualTo(ControlState.ATTEMPT_BACKTRACK);
        assertThat(cursor.stringIndex()).isZero();
        assertThat(cursor.atomIndex()).isZero();
    }

    @Test
    void testRepeatableAtomPushesResumePoint() {
        MatchCursor cursor = new MatchCursor("ab", PatternCompiler.compile("a*b"));

        BacktrackingMatcher.step(cursor);

        assertThat(cursor.state()).isEqualTo(ControlState.TRY_MATCH_ATOM);
        assertThat(cursor.stringIndex()).isEqualTo(1);
        assertThat(cursor.atomIndex()).isZero();
        assertThat(cursor.backtrackDepth()).isEqualTo(1);
    }

    @Test
    void testRepeatableLastAtomPushesNothing() {
        MatchCursor cursor = new MatchCursor("aa", PatternCompiler.compile("a*"));

        BacktrackingMatcher.step(cursor);

        assertThat(cursor.stringIndex()).isEqualTo(1);
        assertThat(cursor.backtrackDepth()).isZero();
    }

    @Test
    void testRepeatableAtomEndsOnMismatch() {
        MatchCursor cursor = new MatchCursor("b", PatternCompiler.compile("a*b"));

        BacktrackingMatcher.step(cursor);

        assertThat(cursor.state()).isEqualTo(ControlState.COMPUTE_NEXT_ATOM);
        assertThat(cursor.stringIndex()).isZero();
        assertThat(cursor.atomIndex()).isEqualTo(1);
    }

    @Test
    void testComputeNextAtomAtEndOfPattern() {
        MatchCursor done = new MatchCursor("", PatternCompiler.compile(""));
        BacktrackingMatcher.computeNextAtom(done);
        assertThat(done.state()).isEqualTo(ControlState.SUCCESS);

        MatchCursor leftover = new MatchCursor("x", PatternCompiler.compile(""));
        BacktrackingMatcher.computeNextAtom(leftover);
        assertThat(leftover.state()).isEqualTo(ControlState.ATTEMPT_BACKTRACK);
    }

    @Test
    void testBacktrackRestoresLatestEntry() {
        MatchCursor cursor = new MatchCursor("aab", PatternCompiler.compile("a*ab"));
        cursor.pushBacktrack(0, 1);
        cursor.pushBacktrack(1, 1);

        BacktrackingMatcher.attemptBacktrack(cursor);

        assertThat(cursor.state()).isEqualTo(ControlState.TRY_MATCH_ATOM);
        assertThat(cursor.stringIndex()).isEqualTo(1);
        assertThat(cursor.atomIndex()).isEqualTo(1);
        assertThat(cursor.backtrackDepth()).isEqualTo(1);
        assertThat(cursor.backtracks()).isEqualTo(1);
    }

    @Test
    void testBacktrackWithEmptyStackFails() {
        MatchCursor cursor = new MatchCursor("b", PatternCompiler.compile("a"));

        BacktrackingMatcher.attemptBacktrack(cursor);

        assertThat(cursor.state()).isEqualTo(ControlState.FAILURE);
    }

    @Test
    void testNoTransitionOutOfTerminalState() {
        MatchCursor cursor = new MatchCursor("b", PatternCompiler.compile("a"));
        BacktrackingMatcher.attemptBacktrack(cursor);

        assertThatThrownBy(() -> BacktrackingMatcher.step(cursor))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("FAILURE");
    }

    @Test
    void testOutOfBoundsBacktrackEntryRejected() {
        MatchCursor cursor = new MatchCursor("ab", PatternCompiler.compile("a*b"));

        assertThatThrownBy(() -> cursor.pushBacktrack(3, 1)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> cursor.pushBacktrack(0, 3)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> cursor.pushBacktrack(-1, 0)).isInstanceOf(IllegalStateException.class);
    }
}
