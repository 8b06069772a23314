package com.unitbench.core;

import com.unitbench.interceptor.RuntimeErrorHandler;

import java.util.List;

/**
 * Options for one {@link TestRunner#run} call.
 *
 * <pre>
 *   RunOptions.builder()
 *       .methods(List.of("testRefund"))
 *       .reporter(r -&gt; r.isFail() ? r.toBuilder().message("[!] " + r.getMessage()).build() : null)
 *       .build();
 * </pre>
 */
public class RunOptions {

    private final List<String>        methods;   // empty = discover by naming convention
    private final Reporter            reporter;  // null = keep the runner's current reporter
    private final RuntimeErrorHandler handler;   // null = the runner's own interception handler

    private RunOptions(Builder b) {
        this.methods  = b.methods != null ? List.copyOf(b.methods) : List.of();
        this.reporter = b.reporter;
        this.handler  = b.handler;
    }

    public static RunOptions defaults() {
        return builder().build();
    }

    public List<String>        getMethods()  { return methods; }
    public Reporter            getReporter() { return reporter; }
    public RuntimeErrorHandler getHandler()  { return handler; }

    public boolean hasMethods() { return !methods.isEmpty(); }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private List<String>        methods;
        private Reporter            reporter;
        private RuntimeErrorHandler handler;

        public Builder methods(List<String> m)          { this.methods = m; return this; }
        public Builder methods(String... m)             { this.methods = List.of(m); return this; }
        public Builder reporter(Reporter r)             { this.reporter = r; return this; }
        public Builder handler(RuntimeErrorHandler h)   { this.handler = h; return this; }
        public RunOptions build()                       { return new RunOptions(this); }
    }
}
