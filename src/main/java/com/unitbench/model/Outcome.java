package com.unitbench.model;

/**
 * The outcome recorded on every {@link Result}.
 *
 *   PASS        an assertion expression evaluated to true
 *   FAIL        an assertion expression evaluated to false
 *   SKIP        a skip signal aborted the run or the current test method
 *   EXCEPTION   an exception or runtime error was raised and no expectation consumed it
 */
public enum Outcome {
    PASS,
    FAIL,
    SKIP,
    EXCEPTION
}
