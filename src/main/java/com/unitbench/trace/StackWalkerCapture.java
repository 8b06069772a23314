package com.unitbench.trace;

import java.util.List;
import java.util.stream.Collectors;

/**
 * {@link StackCapture} backed by {@link StackWalker}. Reflection frames are hidden,
 * so a test method invoked reflectively sits directly above the runner frame
 * that invoked it.
 */
public class StackWalkerCapture implements StackCapture {

    private static final StackWalker WALKER = StackWalker.getInstance();

    @Override
    public List<StackFrame> capture() {
        return WALKER.walk(frames -> frames
            .filter(f -> !f.getClassName().equals(StackWalkerCapture.class.getName()))
            .map(StackFrame::of)
            .collect(Collectors.toList()));
    }
}
