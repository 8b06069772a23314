package com.unitbench.core;

import com.unitbench.diff.DiffFormatter;
import com.unitbench.diff.DiffNode;
import com.unitbench.interceptor.ExceptionTranslator;
import com.unitbench.interceptor.ExpectedException;
import com.unitbench.interceptor.NormalizedException;
import com.unitbench.interceptor.Reconciliation;
import com.unitbench.interceptor.RuntimeErrorHandler;
import com.unitbench.interceptor.RuntimeErrors;
import com.unitbench.model.ErrorLevel;
import com.unitbench.model.Outcome;
import com.unitbench.model.Result;
import com.unitbench.trace.CallSite;
import com.unitbench.trace.CallSiteResolver;
import com.unitbench.trace.InheritanceChain;
import com.unitbench.trace.StackCapture;
import com.unitbench.trace.StackWalkerCapture;
import com.unitbench.util.MessageTemplates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Drives the test lifecycle for one {@link TestSubject} and keeps its Result Log.
 *
 * <h3>Run sequence</h3>
 * <ol>
 *   <li>The Result Log is cleared and the method list resolved: the names in
 *       {@link RunOptions#getMethods()}, or {@link TestSubject#testMethods()}.</li>
 *   <li>{@code skip()} runs before any interception is installed. A skip signal
 *       records one Skip result and ends the run; any other exception is reconciled
 *       like a test-body exception and also ends the run.</li>
 *   <li>The runtime-error handler is installed for the rest of the run and
 *       restored on every exit path.</li>
 *   <li>Each method runs {@code setUp}, the body, then {@code tearDown}. Every phase
 *       is guarded on its own and {@code tearDown} always runs.</li>
 * </ol>
 *
 * <h3>Thread safety</h3>
 * Not thread-safe. A run is bound to one thread; starting a second run on the same
 * runner while one is in progress throws {@link IllegalStateException}.
 */
public class TestRunner {

    private static final Logger log = LoggerFactory.getLogger(TestRunner.class);

    private static final String DEFAULT_MESSAGE = "{:message}";

    private final TestSubject         subject;
    private final UnitBenchConfig     config;
    private final StackCapture        capture;
    private final CallSiteResolver    resolver   = new CallSiteResolver();
    private final DiffFormatter       formatter  = new DiffFormatter();
    private final ExceptionTranslator translator;
    private final InheritanceChain    scope;

    private final List<Result>            results      = new ArrayList<>();
    private final Deque<ExpectedException> expectations = new ArrayDeque<>();

    private Reporter    reporter;
    private Set<String> activeMethods = Set.of();
    private String      currentMethod;
    private boolean     running;

    public TestRunner(TestSubject subject) {
        this(subject, UnitBenchConfig.fromEnvironment(), new StackWalkerCapture());
    }

    public TestRunner(TestSubject subject, UnitBenchConfig config, StackCapture capture) {
        this.subject    = subject;
        this.config     = config;
        this.capture    = capture;
        this.translator = new ExceptionTranslator(capture);
        this.scope      = InheritanceChain.of(subject.getClass())
            .without(UnitTestCase.class, Object.class);
    }

    // ── Run ───────────────────────────────────────────────────────────────────

    public List<Result> run() {
        return run(RunOptions.defaults());
    }

    /**
     * Runs the resolved test methods and returns a snapshot of the Result Log.
     * Test-code failures never escape; they are recorded instead.
     *
     * @throws IllegalStateException if this runner is already running
     */
    public List<Result> run(RunOptions options) {
        if (running) {
            throw new IllegalStateException("A run is already in progress for "
                + subject.getClass().getName());
        }
        running = true;
        try {
            results.clear();
            expectations.clear();
            if (options.getReporter() != null) {
                reporter = options.getReporter();
            }
            List<String> methods = options.hasMethods() ? options.getMethods() : subject.testMethods();
            activeMethods = new LinkedHashSet<>(methods);
            log.info("TestRunner: running {} method(s) of {}", methods.size(), subject.getClass().getName());

            if (runPhase(subject::skip) != PhaseOutcome.COMPLETED) {
                log.info("TestRunner: {} aborted by skip()", subject.getClass().getName());
                return snapshot();
            }

            RuntimeErrorHandler handler = options.getHandler() != null
                ? options.getHandler()
                : this::handleRuntimeError;

            try (RuntimeErrors.Scope ignored = RuntimeErrors.install(handler)) {
                for (String method : methods) {
                    runMethod(method);
                }
            }

            logSummary();
            return snapshot();
        } finally {
            running       = false;
            currentMethod = null;
            activeMethods = Set.of();
        }
    }

    private void runMethod(String method) {
        currentMethod = method;
        log.debug("TestRunner: {}::{}", subject.getClass().getSimpleName(), method);

        runPhase(subject::setUp);
        runPhase(() -> subject.invoke(method));
        runPhase(subject::tearDown);

        settleExpectations(method);
        currentMethod = null;
    }

    private void settleExpectations(String method) {
        if (expectations.isEmpty()) {
            return;
        }
        String pending = expectations.stream()
            .map(ExpectedException::toString)
            .collect(Collectors.joining(", "));
        if (config.isFailOnUnmetExpectations()) {
            record(Result.builder()
                .outcome(Outcome.FAIL)
                .method(method)
                .className(subject.getClass().getName())
                .message("Expected exception(s) not raised: " + pending)
                .build());
        } else {
            log.debug("TestRunner: {} left unmet expectation(s): {}", method, pending);
        }
        expectations.clear();
    }

    // ── Phases ────────────────────────────────────────────────────────────────

    @FunctionalInterface
    private interface Phase {
        void run() throws Throwable;
    }

    private PhaseOutcome runPhase(Phase phase) {
        try {
            phase.run();
            return PhaseOutcome.COMPLETED;
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable t) {
            return handle(translator.translate(t));
        }
    }

    private void handleRuntimeError(ErrorLevel code, String message, String file, int line,
                                    Map<String, Object> context) {
        handle(translator.translate(code, message, file, line, context));
    }

    private PhaseOutcome handle(NormalizedException exception) {
        Reconciliation reconciliation = translator.reconcile(exception, expectations);
        switch (reconciliation) {
            case SKIPPED:
                record(Result.skip(exception.getMessage()).toBuilder()
                    .method(currentMethod)
                    .className(subject.getClass().getName())
                    .build());
                return PhaseOutcome.SKIPPED;
            case CONSUMED:
                return PhaseOutcome.RAISED;
            default:
                record(translator.toResult(exception, scope));
                return PhaseOutcome.RAISED;
        }
    }

    // ── Assertion support ─────────────────────────────────────────────────────

    /** Pushes an expectation; the most recent one is matched first. */
    public void expect(ExpectedException expectation) {
        expectations.push(expectation);
    }

    /**
     * Records a Pass or Fail for an assertion made by the subject.
     *
     * The location comes from the innermost frame of a test method invoked on the
     * subject; assertions made outside a test method (in {@code setUp}, say) carry
     * no location. {@code {:message}} in the message is replaced by the formatted
     * diff of {@code data}.
     *
     * @return {@code expression}
     */
    public boolean assertion(boolean expression, String message, DiffNode data) {
        Set<String> methods = running ? activeMethods : new LinkedHashSet<>(subject.testMethods());
        Optional<CallSite> site = resolver.locate(capture.capture(), methods, subject);

        String template = message != null ? message : DEFAULT_MESSAGE;
        String rendered = MessageTemplates.insert(template, Map.of("message", formatter.format(data)));

        Result.Builder result = Result.builder()
            .outcome(expression ? Outcome.PASS : Outcome.FAIL)
            .className(subject.getClass().getName())
            .message(rendered)
            .data(data);
        site.ifPresent(s -> result
            .file(s.getFile())
            .line(s.getLine())
            .method(s.getMethod())
            .assertion(s.getAssertion()));

        record(result.build());
        return expression;
    }

    // ── Result Log ────────────────────────────────────────────────────────────

    /** Appends to the Result Log after passing the record through the reporter. */
    void record(Result result) {
        Result recorded = result;
        if (reporter != null) {
            try {
                Result replacement = reporter.report(result);
                if (replacement != null) {
                    recorded = replacement;
                }
            } catch (RuntimeException e) {
                log.warn("TestRunner: reporter failed on {} result, keeping it as is: {}",
                    result.getOutcome(), e.getMessage());
            }
        }
        if (config.isLogResults()) {
            log.debug("TestRunner: {}", recorded);
        }
        results.add(recorded);
    }

    public List<Result> getResults() {
        return snapshot();
    }

    public void setReporter(Reporter reporter) {
        this.reporter = reporter;
    }

    public Reporter getReporter() {
        return reporter;
    }

    public UnitBenchConfig getConfig() {
        return config;
    }

    boolean isRunning() {
        return running;
    }

    private List<Result> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(results));
    }

    private void logSummary() {
        long pass = results.stream().filter(Result::isPass).count();
        long fail = results.stream().filter(Result::isFail).count();
        long skip = results.stream().filter(Result::isSkip).count();
        long exc  = results.stream().filter(Result::isException).count();
        if (fail > 0 || exc > 0) {
            log.warn("TestRunner: {} finished: {} pass, {} fail, {} skip, {} exception",
                subject.getClass().getName(), pass, fail, skip, exc);
        } else {
            log.info("TestRunner: {} finished: {} pass, {} fail, {} skip, {} exception",
                subject.getClass().getName(), pass, fail, skip, exc);
        }
    }
}
