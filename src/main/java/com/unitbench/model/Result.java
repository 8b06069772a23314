package com.unitbench.model;

import com.unitbench.diff.DiffNode;

import java.util.List;
import java.util.Objects;

/**
 * One entry of the Result Log produced by a test run.
 *
 * <p>Immutable; use {@link #builder()} or the static factories. A reporter that
 * wants to rewrite a record derives a new one with {@link #toBuilder()}:
 *
 * <pre>
 *   Reporter reporter = r -&gt; r.toBuilder().message("overridden").build();
 * </pre>
 *
 * <p>Location fields ({@code file}, {@code line}, {@code method}, {@code assertion},
 * {@code className}) are {@code null} when the call site could not be resolved,
 * e.g. for an assertion made from {@code setUp()}.
 */
public class Result {

    private final Outcome      outcome;
    private final String       file;
    private final Integer      line;
    private final String       method;
    private final String       assertion;   // the asserting function called from the test method
    private final String       className;
    private final String       message;
    private final DiffNode     data;        // diff output for comparison assertions
    private final List<String> trace;       // formatted frames, exception results only
    private final ErrorLevel   code;        // non-null only for intercepted runtime errors

    private Result(Builder b) {
        this.outcome   = Objects.requireNonNull(b.outcome, "outcome is required");
        this.file      = b.file;
        this.line      = b.line;
        this.method    = b.method;
        this.assertion = b.assertion;
        this.className = b.className;
        this.message   = b.message != null ? b.message : "";
        this.data      = b.data;
        this.trace     = b.trace != null ? List.copyOf(b.trace) : List.of();
        this.code      = b.code;
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static Result skip(String message) {
        return builder().outcome(Outcome.SKIP).message(message).build();
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public Outcome      getOutcome()   { return outcome; }
    public String       getFile()      { return file; }
    public Integer      getLine()      { return line; }
    public String       getMethod()    { return method; }
    public String       getAssertion() { return assertion; }
    public String       getClassName() { return className; }
    public String       getMessage()   { return message; }
    public DiffNode     getData()      { return data; }
    public List<String> getTrace()     { return trace; }
    public ErrorLevel   getCode()      { return code; }

    public boolean isPass()      { return outcome == Outcome.PASS; }
    public boolean isFail()      { return outcome == Outcome.FAIL; }
    public boolean isSkip()      { return outcome == Outcome.SKIP; }
    public boolean isException() { return outcome == Outcome.EXCEPTION; }

    @Override
    public String toString() {
        return String.format("Result{%s, %s::%s() line %s, assertion=%s, message='%s'}",
            outcome, className, method, line, assertion, message);
    }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static Builder builder() { return new Builder(); }

    /** Returns a builder pre-populated with every field of this record. */
    public Builder toBuilder() {
        return new Builder()
            .outcome(outcome)
            .file(file)
            .line(line)
            .method(method)
            .assertion(assertion)
            .className(className)
            .message(message)
            .data(data)
            .trace(trace)
            .code(code);
    }

    public static class Builder {
        private Outcome      outcome;
        private String       file;
        private Integer      line;
        private String       method;
        private String       assertion;
        private String       className;
        private String       message;
        private DiffNode     data;
        private List<String> trace;
        private ErrorLevel   code;

        public Builder outcome(Outcome o)         { this.outcome = o; return this; }
        public Builder file(String f)             { this.file = f; return this; }
        public Builder line(Integer l)            { this.line = l; return this; }
        public Builder method(String m)           { this.method = m; return this; }
        public Builder assertion(String a)        { this.assertion = a; return this; }
        public Builder className(String c)        { this.className = c; return this; }
        public Builder message(String m)          { this.message = m; return this; }
        public Builder data(DiffNode d)           { this.data = d; return this; }
        public Builder trace(List<String> t)      { this.trace = t; return this; }
        public Builder code(ErrorLevel c)         { this.code = c; return this; }
        public Result build()                     { return new Result(this); }
    }
}
