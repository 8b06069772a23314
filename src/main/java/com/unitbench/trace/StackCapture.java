package com.unitbench.trace;

import java.util.List;

/**
 * Captures the current call stack as a value.
 *
 * Implementations return frames innermost first, beginning with the method that
 * called {@link #capture()}. Tests can substitute a fixed stack.
 */
public interface StackCapture {

    List<StackFrame> capture();
}
