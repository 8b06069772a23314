package com.unitbench.interceptor;

import com.unitbench.util.SlashPatternValidator;
import org.testng.annotations.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class ExpectedExceptionTest {

    private final SlashPatternValidator validator = new SlashPatternValidator();

    @Test
    public void any_acceptsEveryMessage() {
        assertThat(ExpectedException.any().matches("whatever")).isTrue();
        assertThat(ExpectedException.any().matches(null)).isTrue();
    }

    @Test
    public void exact_requiresWholeMessage() {
        ExpectedException e = ExpectedException.exact("Order not found");

        assertThat(e.matches("Order not found")).isTrue();
        assertThat(e.matches("Order not found: 42")).isFalse();
        assertThat(e.matches(null)).isFalse();
    }

    @Test
    public void of_delimitedStringBecomesPattern() {
        ExpectedException e = ExpectedException.of("/not\\s+found/i", validator);

        assertThat(e.getKind()).isEqualTo(ExpectedException.Kind.PATTERN);
        assertThat(e.matches("Order NOT FOUND: 42")).isTrue();
        assertThat(e.matches("Order missing")).isFalse();
    }

    @Test
    public void of_plainStringStaysExact() {
        ExpectedException e = ExpectedException.of("Order not found", validator);

        assertThat(e.getKind()).isEqualTo(ExpectedException.Kind.EXACT);
    }

    @Test
    public void skipSignal_prefixIsRecognised() {
        assertThat(SkipSignal.isSkip(new SkipSignal("anything"))).isTrue();
        assertThat(SkipSignal.isSkip(new IllegalStateException("Skipped test A::b()"))).isTrue();
        assertThat(SkipSignal.isSkip(new IllegalStateException("Failed"))).isFalse();
        assertThat(SkipSignal.isSkipMessage(null)).isFalse();
    }
}
