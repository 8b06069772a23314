package com.unitbench.trace;

/**
 * The location an assertion is attributed to.
 *
 * A JVM frame records the line currently executing in its own method, so the
 * line of the assertion call lives in the test-method frame. The frame just
 * below it names the asserting function.
 */
public class CallSite {

    private final StackFrame callerFrame;   // the asserting function called from the test method
    private final StackFrame testFrame;     // the test method entry

    public CallSite(StackFrame callerFrame, StackFrame testFrame) {
        this.callerFrame = callerFrame;
        this.testFrame   = testFrame;
    }

    public StackFrame getCallerFrame() { return callerFrame; }
    public StackFrame getTestFrame()   { return testFrame; }

    public String getFile()      { return testFrame.getFile(); }
    public int    getLine()      { return testFrame.getLine(); }
    public String getMethod()    { return testFrame.getFunction(); }
    public String getAssertion() { return callerFrame.getFunction(); }

    @Override
    public String toString() {
        return String.format("CallSite{%s() -> %s() at %s:%d}",
            getMethod(), getAssertion(), getFile(), getLine());
    }
}
