package com.unitbench.interceptor;

/**
 * Raised by {@code skipIf} to abandon the rest of the current phase.
 *
 * <h3>How skip propagation works</h3>
 *
 * <p>The signal never leaves the runner. Whatever phase raised it is converted
 * into a {@code PhaseOutcome.SKIPPED} value at the invocation boundary:
 *
 * <ol>
 *   <li>Raised from {@code skip()}: one Skip result is recorded and the whole run
 *       ends before any test method executes.</li>
 *   <li>Raised from a test method: the remaining statements of that method are
 *       skipped, a Skip result is recorded, and {@code tearDown()} still runs.</li>
 * </ol>
 *
 * <p>Any throwable whose message starts with {@link #PREFIX} is treated the same
 * way, so a skip raised by a helper as a plain exception is still a skip.
 */
public class SkipSignal extends RuntimeException {

    public static final String PREFIX = "Skipped test";

    public SkipSignal(String message) {
        super(message);
    }

    /** {@code true} for a SkipSignal or any message carrying the skip prefix. */
    public static boolean isSkip(Throwable t) {
        return t instanceof SkipSignal || isSkipMessage(t.getMessage());
    }

    public static boolean isSkipMessage(String message) {
        return message != null && message.startsWith(PREFIX);
    }
}
