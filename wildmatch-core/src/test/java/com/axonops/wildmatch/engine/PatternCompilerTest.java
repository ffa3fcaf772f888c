package com.axonops.wildmatch.engine;

import com.axonops.wildmatch.exception.InvalidPatternException;
import com.axonops.wildmatch.exception.WildmatchException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

class PatternCompilerTest {

    @Test
    void testEmptyPatternCompilesToEmptySequence() {
        AtomSequence atoms = PatternCompiler.compile("");

        assertThat(atoms.isEmpty()).isTrue();
        assertThat(atoms.size()).isZero();
        assertThat(atoms.source()).isEmpty();
    }

    @Test
    void testAtomsInOrder() {
        AtomSequence atoms = PatternCompiler.compile("ab*.c.*");

        assertThat(atoms.atoms()).containsExactly(
            MatchAtom.literal('a', false),
            MatchAtom.literal('b', true),
            MatchAtom.wildcard(false),
            MatchAtom.literal('c', false),
            MatchAtom.wildcard(true));
        assertThat(atoms.source()).isEqualTo("ab*.c.*");
        assertThat(atoms.collapsedCount()).isZero();
    }

    @ParameterizedTest
    @CsvSource({
        "a*a*a*b, a*b, 2",
        ".*a*, .*, 1",
        ".*.*.*, .*, 2",
        ".*b*.*c, .*c, 2",
        "a*ab*b*, a*ab*, 1",
        "c*a*b*, c*a*b*, 0",
        "a*.*, a*.*, 0",
        "a*b*a*, a*b*a*, 0",
        "a*a, a*a, 0"
    })
    void testRedundantAtomsCollapsed(String pattern, String compiled, int collapsed) {
        AtomSequence atoms = PatternCompiler.compile(pattern);

        assertThat(atoms).hasToString(compiled);
        assertThat(atoms.collapsedCount()).isEqualTo(collapsed);
    }

    @Test
    void testCollapseCanBeDisabled() {
        AtomSequence atoms = PatternCompiler.compile("a*a*a*b", false);

        assertThat(atoms).hasToString("a*a*a*b");
        assertThat(atoms.size()).isEqualTo(4);
        assertThat(atoms.collapsedCount()).isZero();
    }

    @Test
    void testLeadingStarRejected() {
        assertThatThrownBy(() -> PatternCompiler.compile("*abc"))
            .isInstanceOf(InvalidPatternException.class)
            .isInstanceOf(WildmatchException.class)
            .hasMessageContaining("at index 0")
            .hasMessageContaining("no preceding atom");
    }

    @ParameterizedTest
    @CsvSource({
        "a**, 2",
        "ab***, 3",
        ".**, 2",
        "*, 0"
    })
    void testUnboundStarRejectedAtIndex(String pattern, int index) {
        assertThatThrownBy(() -> PatternCompiler.compile(pattern))
            .isInstanceOfSatisfying(InvalidPatternException.class, e -> {
                assertThat(e.getIndex()).isEqualTo(index);
                assertThat(e.getPattern()).isEqualTo(pattern);
            });
    }

    @Test
    void testStarAsRepeatOfDotStar() {
        assertThat(PatternCompiler.compile(".*").atoms())
            .containsExactly(MatchAtom.wildcard(true));
    }

    @Test
    void testEqualityIgnoresSource() {
        assertThat(PatternCompiler.compile("a*a*b")).isEqualTo(PatternCompiler.compile("a*b"));
        assertThat(PatternCompiler.compile("a*b")).isEqualTo(AtomSequence.of(
            MatchAtom.literal('a', true), MatchAtom.literal('b', false)));
    }

    @Test
    void testNullPatternRejected() {
        assertThatThrownBy(() -> PatternCompiler.compile(null))
            .isInstanceOf(NullPointerException.class);
    }
}
