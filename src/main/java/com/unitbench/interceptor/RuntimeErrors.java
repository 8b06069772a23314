package com.unitbench.interceptor;

import com.unitbench.model.ErrorLevel;
import com.unitbench.trace.StackFrame;
import com.unitbench.trace.StackWalkerCapture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * The process-wide runtime-error interception hook.
 *
 * Code under test reports faults that should not unwind the caller with
 * {@link #trigger}. The currently installed {@link RuntimeErrorHandler} receives
 * them; with none installed they are logged.
 *
 * A handler is installed for a bounded scope:
 *
 * <pre>
 *   try (RuntimeErrors.Scope scope = RuntimeErrors.install(handler)) {
 *       ... // every trigger() lands in handler
 *   }   // the previous handler, or none, is back in place
 * </pre>
 *
 * Installing replaces the current handler; closing the scope restores the one it
 * replaced, including when the body throws.
 */
public final class RuntimeErrors {

    private static final Logger log = LoggerFactory.getLogger(RuntimeErrors.class);

    private static final StackWalkerCapture CAPTURE = new StackWalkerCapture();

    private static volatile RuntimeErrorHandler current;

    private RuntimeErrors() {}

    // ── Installation ──────────────────────────────────────────────────────────

    public static synchronized Scope install(RuntimeErrorHandler handler) {
        if (handler == null) {
            throw new IllegalArgumentException("handler is required");
        }
        Scope scope = new Scope(current, handler);
        current = handler;
        return scope;
    }

    /** The installed handler, or null. */
    public static RuntimeErrorHandler current() {
        return current;
    }

    private static synchronized void restore(RuntimeErrorHandler previous) {
        current = previous;
    }

    // ── Reporting ─────────────────────────────────────────────────────────────

    public static void trigger(ErrorLevel code, String message) {
        trigger(code, message, Map.of());
    }

    public static void trigger(ErrorLevel code, String message, Map<String, Object> context) {
        StackFrame origin = CAPTURE.capture().stream()
            .filter(f -> !RuntimeErrors.class.getName().equals(f.getClassName()))
            .findFirst()
            .orElse(null);
        String file = origin != null ? origin.getFile() : null;
        int    line = origin != null ? origin.getLine() : -1;

        RuntimeErrorHandler handler = current;
        if (handler == null) {
            if (code == ErrorLevel.ERROR) {
                log.error("Runtime error at {}:{}: {}", file, line, message);
            } else {
                log.warn("Runtime {} at {}:{}: {}", code, file, line, message);
            }
            return;
        }
        handler.handle(code, message, file, line, context != null ? context : Map.of());
    }

    // ── Scope ─────────────────────────────────────────────────────────────────

    /** Restores the handler that was current before {@link #install}; idempotent. */
    public static final class Scope implements AutoCloseable {

        private final RuntimeErrorHandler previous;
        private final RuntimeErrorHandler installed;
        private boolean closed;

        private Scope(RuntimeErrorHandler previous, RuntimeErrorHandler installed) {
            this.previous  = previous;
            this.installed = installed;
        }

        public RuntimeErrorHandler getInstalled() { return installed; }

        @Override
        public void close() {
            if (closed) return;
            closed = true;
            restore(previous);
        }
    }
}
