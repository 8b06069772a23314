package com.unitbench.core;

import com.unitbench.diff.ComparisonMode;
import com.unitbench.diff.DiffNode;
import com.unitbench.diff.StructuralDiffer;
import com.unitbench.diff.Values;
import com.unitbench.interceptor.ExpectedException;
import com.unitbench.interceptor.SkipSignal;
import com.unitbench.markup.MarkupMatcher;
import com.unitbench.markup.MatchOutcome;
import com.unitbench.model.Result;
import com.unitbench.trace.StackCapture;
import com.unitbench.trace.StackFrame;
import com.unitbench.trace.StackWalkerCapture;
import com.unitbench.util.MessageTemplates;
import com.unitbench.util.PatternValidator;
import com.unitbench.util.SlashPatternValidator;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Base class for test cases.
 *
 * <pre>
 *   public class OrderTest extends UnitTestCase {
 *
 *       private Order order;
 *
 *       {@literal @}Override
 *       public void setUp() {
 *           order = new Order(42);
 *       }
 *
 *       public void testTotal() {
 *           assertEqual(42, order.total());
 *       }
 *
 *       public void testRefundOfEmptyOrder() {
 *           expectException("/nothing to refund/");
 *           order.refund();
 *       }
 *   }
 *
 *   List&lt;Result&gt; results = new OrderTest().run();
 * </pre>
 *
 * Test methods are the public, no-argument instance methods whose name starts with
 * the configured prefix ({@code test} by default). Every assertion returns its
 * boolean outcome and appends a Pass or Fail record to the Result Log; none of
 * them throws on failure.
 */
public abstract class UnitTestCase implements TestSubject {

    private static final String SKIP_MESSAGE = SkipSignal.PREFIX + " {:class}::{:function}()";

    private final UnitBenchConfig  config;
    private final StackCapture     capture;
    private final TestRunner       runner;
    private final StructuralDiffer differ    = new StructuralDiffer();
    private final PatternValidator validator = new SlashPatternValidator();
    private final MarkupMatcher    markup;

    private List<String> methods;

    protected UnitTestCase() {
        this(UnitBenchConfig.fromEnvironment());
    }

    protected UnitTestCase(UnitBenchConfig config) {
        this.config  = config;
        this.capture = new StackWalkerCapture();
        this.runner  = new TestRunner(this, config, capture);
        this.markup  = new MarkupMatcher(config.getMaxMarkupAttributes());
    }

    // ── Lifecycle hooks ───────────────────────────────────────────────────────

    @Override
    public void setUp() throws Exception {
    }

    @Override
    public void tearDown() throws Exception {
    }

    /** Override and call {@link #skipIf} to skip the whole case. */
    @Override
    public void skip() throws Exception {
    }

    // ── Running ───────────────────────────────────────────────────────────────

    public List<Result> run() {
        return runner.run();
    }

    public List<Result> run(RunOptions options) {
        return runner.run(options);
    }

    public List<Result> results() {
        return runner.getResults();
    }

    public void setReporter(Reporter reporter) {
        runner.setReporter(reporter);
    }

    protected TestRunner runner() {
        return runner;
    }

    @Override
    public List<String> testMethods() {
        if (methods == null) {
            methods = TestMethodDiscovery.discover(getClass(), config.getMethodPrefix());
        }
        return methods;
    }

    @Override
    public void invoke(String method) throws Throwable {
        Method target;
        try {
            target = getClass().getMethod(method);
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException(
                "No public no-argument method '" + method + "' on " + getClass().getName(), e);
        }
        try {
            target.setAccessible(true);
            target.invoke(this);
        } catch (InvocationTargetException e) {
            throw e.getCause();
        }
    }

    /** The simple class name without a trailing {@code Test}: {@code OrderTest} gives {@code Order}. */
    public String subject() {
        String name = getClass().getSimpleName();
        return name.endsWith("Test") ? name.substring(0, name.length() - 4) : name;
    }

    // ── Primitive ─────────────────────────────────────────────────────────────

    public boolean check(boolean expression) {
        return check(expression, null, null);
    }

    public boolean check(boolean expression, String message) {
        return check(expression, message, null);
    }

    /**
     * Records one assertion. {@code {:message}} in {@code message} is replaced by the
     * formatted diff of {@code data}; a null message means {@code "{:message}"}.
     */
    public boolean check(boolean expression, String message, DiffNode data) {
        return runner.assertion(expression, message, data);
    }

    // ── Equality ──────────────────────────────────────────────────────────────

    public boolean assertEqual(Object expected, Object result) {
        return assertEqual(expected, result, null);
    }

    /** Representational equality: {@code 1} equals {@code "1"} and {@code 1.0}. */
    public boolean assertEqual(Object expected, Object result, String message) {
        boolean equal = Values.looseEquals(expected, result);
        DiffNode data = equal ? null : differ.compare(ComparisonMode.LOOSE, expected, result);
        return check(equal, message, data);
    }

    public boolean assertNotEqual(Object expected, Object result) {
        return assertNotEqual(expected, result, null);
    }

    public boolean assertNotEqual(Object expected, Object result, String message) {
        boolean equal = Values.looseEquals(expected, result);
        return check(!equal, message, equal ? DiffNode.leaf("", expected, result) : null);
    }

    public boolean assertIdentical(Object expected, Object result) {
        return assertIdentical(expected, result, null);
    }

    /** Same runtime type and same value, with no coercion. */
    public boolean assertIdentical(Object expected, Object result, String message) {
        boolean identical = Values.strictEquals(expected, result);
        DiffNode data = identical ? null : differ.compare(ComparisonMode.STRICT, expected, result);
        return check(identical, message, data);
    }

    // ── Truthiness ────────────────────────────────────────────────────────────

    public boolean assertTrue(Object value) {
        return assertTrue(value, null);
    }

    /** Passes when {@code value} is truthy: not null, false, zero, "", "0" or an empty container. */
    public boolean assertTrue(Object value, String message) {
        boolean truthy = !Values.isEmpty(value);
        return check(truthy, message, truthy ? null : DiffNode.leaf("", true, value));
    }

    public boolean assertFalse(Object value) {
        return assertFalse(value, null);
    }

    public boolean assertFalse(Object value, String message) {
        boolean falsy = Values.isEmpty(value);
        return check(falsy, message, falsy ? null : DiffNode.leaf("", false, value));
    }

    public boolean assertNull(Object value) {
        return assertNull(value, null);
    }

    public boolean assertNull(Object value, String message) {
        return check(value == null, message, value == null ? null : DiffNode.leaf("", null, value));
    }

    // ── Patterns ──────────────────────────────────────────────────────────────

    public boolean assertPattern(String pattern, String subject) {
        return assertPattern(pattern, subject, null);
    }

    /**
     * Passes when {@code pattern} is found in {@code subject}. Delimited patterns
     * ({@code "/ab+c/i"}) carry their own flags; anything else is a plain regex.
     */
    public boolean assertPattern(String pattern, String subject, String message) {
        boolean found = subject != null && toPattern(pattern).matcher(subject).find();
        return check(found, message, found ? null : DiffNode.leaf("", pattern, subject));
    }

    public boolean assertNoPattern(String pattern, String subject) {
        return assertNoPattern(pattern, subject, null);
    }

    public boolean assertNoPattern(String pattern, String subject, String message) {
        boolean found = subject != null && toPattern(pattern).matcher(subject).find();
        return check(!found, message, found ? DiffNode.leaf("", pattern, subject) : null);
    }

    private Pattern toPattern(String pattern) {
        return validator.isPattern(pattern) ? validator.compile(pattern) : Pattern.compile(pattern);
    }

    // ── Markup ────────────────────────────────────────────────────────────────

    public boolean assertTags(String input, List<?> spec) {
        return assertTags(input, spec, null);
    }

    /**
     * Matches {@code input} against a declarative markup spec (see {@link MarkupMatcher}).
     * On failure the message names the item and rule that failed unless an explicit
     * message is given.
     */
    public boolean assertTags(String input, List<?> spec, String message) {
        MatchOutcome outcome = markup.match(spec, input);
        if (outcome.isMatched()) {
            return check(true, message != null ? message : "");
        }
        return check(false, message != null ? message : outcome.describeFailure());
    }

    // ── Expectations and skipping ─────────────────────────────────────────────

    /** The next exception raised in this test method, with any message, is expected. */
    public void expectException() {
        runner.expect(ExpectedException.any());
    }

    /**
     * The next exception raised in this test method is expected to carry
     * {@code message}: an exact string, or a delimited pattern such as {@code "/timed? out/"}.
     */
    public void expectException(String message) {
        runner.expect(message == null ? ExpectedException.any() : ExpectedException.of(message, validator));
    }

    public void skipIf(boolean condition) {
        skipIf(condition, SKIP_MESSAGE);
    }

    /**
     * Aborts the current test method (or, from {@link #skip()}, the whole run) with a
     * Skip result when {@code condition} holds. {@code {:class}} and {@code {:function}}
     * in the message name the calling method.
     *
     * @throws SkipSignal when {@code condition} is true
     */
    public void skipIf(boolean condition, String message) {
        if (!condition) {
            return;
        }
        StackFrame caller = capture.capture().stream()
            .filter(f -> !UnitTestCase.class.getName().equals(f.getClassName()))
            .findFirst()
            .orElse(null);
        throw new SkipSignal(MessageTemplates.insert(message != null ? message : SKIP_MESSAGE, Map.of(
            "class",    caller != null ? caller.getClassName() : getClass().getName(),
            "function", caller != null ? caller.getFunction() : "")));
    }
}
