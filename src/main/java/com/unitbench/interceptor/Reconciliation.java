package com.unitbench.interceptor;

/**
 * What {@link ExceptionTranslator#reconcile} decided for one normalized exception.
 *
 *   SKIPPED     a skip signal; the expectation stack was not consulted
 *   CONSUMED    the top expectation matched and was popped; nothing is reported
 *   UNMATCHED   no match; the caller records an Exception result
 */
public enum Reconciliation {
    SKIPPED,
    CONSUMED,
    UNMATCHED
}
