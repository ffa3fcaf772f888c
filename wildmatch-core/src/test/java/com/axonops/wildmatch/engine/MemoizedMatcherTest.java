package com.axonops.wildmatch.engine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class MemoizedMatcherTest {

    private final MemoizedMatcher matcher = new MemoizedMatcher();

    @ParameterizedTest
    @CsvSource({
        "aa, a, false",
        "aa, a*, true",
        "mississippi, mis*is*p*., false",
        "aab, c*a*b*, true",
        "a, ab*, true",
        "aaaaaaaaaaaaab, a*a*a*a*a*a*a*a*a*a*a*a*b, true",
        "aaaaaaaaaaaaac, a*a*a*a*a*a*a*a*a*a*a*a*b, false",
        "ab, a*ab, true",
        "ab, .*, true",
        "abc, a.c, true",
        "., ., true",
        "*, ., true",
        "é, ., true",
        "a.*b, .*, true",
        "é*., .*, true"
    })
    void testFullMatch(String text, String pattern, boolean expected) {
        assertThat(matcher.isMatch(text, pattern)).isEqualTo(expected);
    }

    @Test
    void testEmptyInputs() {
        assertThat(matcher.isMatch("", "")).isTrue();
        assertThat(matcher.isMatch("", "x*")).isTrue();
        assertThat(matcher.isMatch("x", "")).isFalse();
    }

    @Test
    void testMalformedPatternIsNotAnError() {
        // No compile step: an unbound '*' is an ordinary character here
        assertThat(matcher.isMatch("*abc", "*abc")).isTrue();
        assertThat(matcher.isMatch("abc", "*abc")).isFalse();
    }

    @Test
    void testLongAdversarialInputTerminatesQuickly() {
        String text = "a".repeat(200) + "c";
        String pattern = "a*b*".repeat(50) + "b";

        assertThat(matcher.isMatch(text, pattern)).isFalse();
        assertThat(matcher.isMatch("a".repeat(200) + "b", pattern)).isTrue();
    }

    @Test
    void testNulCharacterIsOrdinaryInput() {
        assertThat(matcher.isMatch("\0", ".")).isTrue();
        assertThat(matcher.isMatch("a\0b", ".*")).isTrue();
        assertThat(matcher.isMatch("\0", "a")).isFalse();
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void testVeryLongInputDoesNotExhaustStack() {
        String text = "a".repeat(50_000);

        assertThat(matcher.isMatch(text, ".*")).isTrue();
        assertThat(matcher.isMatch(text, "a*")).isTrue();
        assertThat(matcher.isMatch(text + "b", "a*")).isFalse();
        assertThat(matcher.isMatch(text + "b", "a*.")).isTrue();
    }

    @Test
    void testNullRejected() {
        assertThatThrownBy(() -> matcher.isMatch(null, "a")).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> matcher.isMatch("a", null)).isInstanceOf(NullPointerException.class);
    }
}
