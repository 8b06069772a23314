package com.unitbench.core;

import com.unitbench.interceptor.SkipSignal;
import com.unitbench.markup.TagSpec;
import com.unitbench.model.Outcome;
import com.unitbench.model.Result;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the UnitTestCase assertion surface, called directly outside a run.
 */
public class UnitTestCaseTest {

    public static class PlainCase extends UnitTestCase {
        PlainCase() {
            super(UnitBenchConfig.defaults());
        }
    }

    public static class OrderTest extends UnitTestCase {
        OrderTest() {
            super(UnitBenchConfig.defaults());
        }
    }

    private PlainCase subject;

    @BeforeMethod
    public void setUp() {
        subject = new PlainCase();
    }

    private Result last() {
        List<Result> results = subject.results();
        return results.get(results.size() - 1);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Equality
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void assertEqual_isLoose() {
        assertThat(subject.assertEqual(1, "1")).isTrue();
        assertThat(subject.assertEqual(List.of(1, 2), List.of(1.0, 2L))).isTrue();
        assertThat(last().getOutcome()).isEqualTo(Outcome.PASS);
        assertThat(last().getData()).isNull();
    }

    @Test
    public void assertEqual_failureMessageCarriesDiff() {
        boolean outcome = subject.assertEqual(Map.of("name", "Alice"), Map.of("name", "Bob"));

        assertThat(outcome).isFalse();
        assertThat(last().getOutcome()).isEqualTo(Outcome.FAIL);
        assertThat(last().getMessage())
            .contains("trace: [name]")
            .contains("expected: \"Alice\"")
            .contains("result: \"Bob\"");
    }

    @Test
    public void assertEqual_messageTemplateWrapsDiff() {
        subject.assertEqual(1, 2, "Totals differ: {:message}");

        assertThat(last().getMessage()).startsWith("Totals differ: trace: ").contains("expected: 1");
    }

    @Test
    public void assertEqual_messageWithoutPlaceholderIsVerbatim() {
        subject.assertEqual(1, 2, "Totals differ");

        assertThat(last().getMessage()).isEqualTo("Totals differ");
        assertThat(last().getData()).isNotNull();
    }

    @Test
    public void assertIdentical_isStrict() {
        assertThat(subject.assertIdentical(1, 1)).isTrue();
        assertThat(subject.assertIdentical(1, "1")).isFalse();

        assertThat(last().getMessage()).contains("expected: \"integer\"").contains("result: \"string\"");
    }

    @Test
    public void assertNotEqual_usesLooseEquality() {
        assertThat(subject.assertNotEqual(1, 2)).isTrue();
        assertThat(subject.assertNotEqual(1, "1")).isFalse();
    }

    // ════════════════════════════════════════════════════════════════════════
    // Truthiness and patterns
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void truthiness() {
        assertThat(subject.assertTrue(1)).isTrue();
        assertThat(subject.assertTrue("0")).isFalse();
        assertThat(subject.assertFalse(List.of())).isTrue();
        assertThat(subject.assertFalse("no")).isFalse();
        assertThat(subject.assertNull(null)).isTrue();
        assertThat(subject.assertNull("x")).isFalse();
    }

    @Test
    public void assertPattern_delimitedAndPlain() {
        assertThat(subject.assertPattern("/^ab+c$/i", "ABBC")).isTrue();
        assertThat(subject.assertPattern("b+", "abbc")).isTrue();
        assertThat(subject.assertPattern("/x/", null)).isFalse();
        assertThat(subject.assertNoPattern("/z/", "abc")).isTrue();
        assertThat(subject.assertNoPattern("b", "abc")).isFalse();
    }

    // ════════════════════════════════════════════════════════════════════════
    // Markup
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void assertTags_successHasEmptyMessage() {
        boolean outcome = subject.assertTags("<p class=\"note\">hello</p>",
            List.of(TagSpec.tag("p").equalTo("class", "note"), "hello", "/p"));

        assertThat(outcome).isTrue();
        assertThat(last().getMessage()).isEmpty();
    }

    @Test
    public void assertTags_failureNamesItemAndRule() {
        boolean outcome = subject.assertTags("<p>goodbye</p>", List.of(Map.of("p", true), "hello", "/p"));

        assertThat(outcome).isFalse();
        assertThat(last().getMessage()).isEqualTo("Item #2 / rule #2 failed: Text equals \"hello\"");
    }

    @Test
    public void assertTags_tooManyAttributesIsRejected() {
        UnitTestCase narrow = new UnitTestCase(UnitBenchConfig.builder().maxMarkupAttributes(1).build()) { };
        List<Object> spec = List.of(TagSpec.tag("a").present("href").present("title"));

        assertThatThrownBy(() -> narrow.assertTags("<a href=\"x\" title=\"y\">", spec))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Skipping, naming, recording
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void skipIf_falseDoesNothing() {
        assertThatCode(() -> subject.skipIf(false)).doesNotThrowAnyException();
    }

    @Test
    public void skipIf_defaultMessageNamesCaller() {
        assertThatThrownBy(() -> subject.skipIf(true))
            .isInstanceOf(SkipSignal.class)
            .hasMessageStartingWith("Skipped test " + UnitTestCaseTest.class.getName() + "::");
    }

    @Test
    public void subject_stripsTrailingTest() {
        assertThat(new OrderTest().subject()).isEqualTo("Order");
        assertThat(subject.subject()).isEqualTo("PlainCase");
    }

    @Test
    public void directAssertionsHaveNoLocation() {
        subject.check(false, "plain failure");

        assertThat(last().getOutcome()).isEqualTo(Outcome.FAIL);
        assertThat(last().getMessage()).isEqualTo("plain failure");
        assertThat(last().getMethod()).isNull();
        assertThat(last().getClassName()).isEqualTo(PlainCase.class.getName());
    }

    @Test
    public void reporterSetOnCaseAppliesToDirectAssertions() {
        subject.setReporter(r -> r.toBuilder().message("seen").build());

        subject.check(true);

        assertThat(last().getMessage()).isEqualTo("seen");
    }
}
