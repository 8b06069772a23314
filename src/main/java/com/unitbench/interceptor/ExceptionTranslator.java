package com.unitbench.interceptor;

import com.unitbench.model.ErrorLevel;
import com.unitbench.model.Outcome;
import com.unitbench.model.Result;
import com.unitbench.trace.InheritanceChain;
import com.unitbench.trace.StackCapture;
import com.unitbench.trace.StackFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Normalizes raised exceptions and intercepted runtime errors, and reconciles them
 * against the expectation stack.
 *
 * <h3>Reconciliation</h3>
 * Only the top of the stack (the most recent {@code expectException}) is
 * consulted. A match pops it and the fault is dropped; otherwise the stack is
 * left as it is and the caller records an Exception result built by
 * {@link #toResult}. Skip signals bypass the stack entirely.
 *
 * <h3>Attribution</h3>
 * Exception results name the nearest frame whose declaring class belongs to the
 * given scope (the subject's own hierarchy, engine classes excluded), so a fault
 * raised deep inside a library is reported against the test code that caused it.
 */
public class ExceptionTranslator {

    private static final Logger log = LoggerFactory.getLogger(ExceptionTranslator.class);

    private final StackCapture capture;

    public ExceptionTranslator(StackCapture capture) {
        this.capture = capture;
    }

    // ── Normalization ─────────────────────────────────────────────────────────

    public NormalizedException translate(Throwable t) {
        List<StackFrame> trace = Arrays.stream(t.getStackTrace())
            .map(StackFrame::of)
            .collect(Collectors.toList());
        if (trace.isEmpty()) {
            trace = capture.capture();
        }
        StackFrame origin = trace.isEmpty() ? null : trace.get(0);
        String message = t.getMessage() != null ? t.getMessage() : t.getClass().getName();

        return new NormalizedException(
            message,
            origin != null ? origin.getFile() : null,
            origin != null ? origin.getLine() : -1,
            trace,
            null,
            t.getClass().getName(),
            t instanceof SkipSignal,
            Map.of());
    }

    /**
     * Normalizes a runtime-error callback. The trace is synthesized from the current
     * stack, starting at the code that called {@link RuntimeErrors#trigger}.
     */
    public NormalizedException translate(ErrorLevel code, String message, String file, int line,
                                         Map<String, Object> context) {
        return new NormalizedException(message, file, line, currentTrace(), code, null, false, context);
    }

    private List<StackFrame> currentTrace() {
        List<StackFrame> frames = capture.capture();
        int cut = -1;
        for (int i = 0; i < frames.size(); i++) {
            if (RuntimeErrors.class.getName().equals(frames.get(i).getClassName())) {
                cut = i;
            }
        }
        if (cut >= 0) {
            return new ArrayList<>(frames.subList(cut + 1, frames.size()));
        }
        List<StackFrame> out = new ArrayList<>(frames);
        while (!out.isEmpty() && ExceptionTranslator.class.getName().equals(out.get(0).getClassName())) {
            out.remove(0);
        }
        return out;
    }

    // ── Reconciliation ────────────────────────────────────────────────────────

    public Reconciliation reconcile(NormalizedException exception, Deque<ExpectedException> expectations) {
        if (exception.isSkip()) {
            return Reconciliation.SKIPPED;
        }
        ExpectedException top = expectations.peek();
        if (top != null && top.matches(exception.getMessage())) {
            expectations.pop();
            log.debug("ExceptionTranslator: '{}' consumed by {}", exception.getMessage(), top);
            return Reconciliation.CONSUMED;
        }
        return Reconciliation.UNMATCHED;
    }

    // ── Reporting ─────────────────────────────────────────────────────────────

    /**
     * Builds the Exception result for an unmatched fault.
     *
     * @param scope classes the fault may be attributed to
     */
    public Result toResult(NormalizedException exception, InheritanceChain scope) {
        List<StackFrame> trace = exception.getTrace();
        int scoped = -1;
        for (int i = 0; i < trace.size(); i++) {
            if (scope.contains(trace.get(i).getClassName())) {
                scoped = i;
                break;
            }
        }
        StackFrame attributed = scoped >= 0 ? trace.get(scoped) : (trace.isEmpty() ? null : trace.get(0));
        List<String> formatted = trace.subList(0, scoped >= 0 ? scoped + 1 : trace.size()).stream()
            .map(StackFrame::format)
            .collect(Collectors.toList());

        String message = exception.getType() != null
            ? simpleName(exception.getType()) + ": " + exception.getMessage()
            : exception.getMessage();

        return Result.builder()
            .outcome(Outcome.EXCEPTION)
            .file(exception.getFile())
            .line(exception.getLine() >= 0 ? exception.getLine() : null)
            .className(attributed != null ? attributed.getClassName() : null)
            .method(attributed != null ? attributed.getFunction() : null)
            .message(message)
            .trace(formatted)
            .code(exception.getCode())
            .build();
    }

    private static String simpleName(String className) {
        int dot = className.lastIndexOf('.');
        return dot >= 0 ? className.substring(dot + 1) : className;
    }
}
