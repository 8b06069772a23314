package com.unitbench.core;

/**
 * How one lifecycle phase ({@code skip}, {@code setUp}, test body, {@code tearDown}) ended.
 *
 *   COMPLETED: returned normally
 *   SKIPPED: raised a skip signal; a Skip result was recorded
 *   RAISED: raised anything else; it was either consumed by an expectation or
 *   recorded as an Exception result
 */
public enum PhaseOutcome {
    COMPLETED,
    SKIPPED,
    RAISED
}
