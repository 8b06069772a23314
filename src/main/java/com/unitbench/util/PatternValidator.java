package com.unitbench.util;

import java.util.regex.Pattern;

/**
 * Distinguishes a delimited regular expression from literal text.
 *
 * Used by {@code expectException(String)} to decide whether the expected message
 * is compared exactly or matched as a pattern, and by {@code assertPattern}.
 */
public interface PatternValidator {

    /** {@code true} if the value is a delimited pattern that compiles. */
    boolean isPattern(String value);

    /**
     * Compiles a delimited pattern.
     *
     * @throws IllegalArgumentException if {@link #isPattern} is false for the value
     */
    Pattern compile(String value);
}
