package com.unitbench.util;

import org.testng.annotations.Test;

import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SlashPatternValidatorTest {

    private final PatternValidator validator = new SlashPatternValidator();

    @Test
    public void isPattern_acceptsDelimitedRegex() {
        assertThat(validator.isPattern("/abc/")).isTrue();
        assertThat(validator.isPattern("/abc/im")).isTrue();
        assertThat(validator.isPattern("#a/b#")).isTrue();
    }

    @Test
    public void isPattern_rejectsPlainTextAndBrokenRegex() {
        assertThat(validator.isPattern("abc")).isFalse();
        assertThat(validator.isPattern("/abc")).isFalse();
        assertThat(validator.isPattern("/abc/q")).isFalse();
        assertThat(validator.isPattern("/(unclosed/")).isFalse();
        assertThat(validator.isPattern(null)).isFalse();
    }

    @Test
    public void compile_translatesFlags() {
        Pattern p = validator.compile("/^total: \\d+$/im");

        assertThat(p.flags() & Pattern.CASE_INSENSITIVE).isNotZero();
        assertThat(p.flags() & Pattern.MULTILINE).isNotZero();
        assertThat(p.matcher("header\nTOTAL: 12").find()).isTrue();
    }

    @Test
    public void compile_rejectsNonPattern() {
        assertThatThrownBy(() -> validator.compile("plain"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("plain");
    }
}
