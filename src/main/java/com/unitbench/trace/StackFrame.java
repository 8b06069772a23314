package com.unitbench.trace;

import java.util.Objects;

/**
 * One entry of a captured call stack.
 *
 * JVM stack frames do not expose the receiver, so {@code receiver} is only set
 * for frames built by hand. When it is null, resolvers fall back to the
 * declaring class.
 */
public class StackFrame {

    private final String function;
    private final String file;
    private final int    line;
    private final String className;
    private final Object receiver;

    public StackFrame(String function, String file, int line, String className, Object receiver) {
        this.function  = Objects.requireNonNull(function, "function is required");
        this.file      = file;
        this.line      = line;
        this.className = className;
        this.receiver  = receiver;
    }

    public StackFrame(String function, String file, int line, String className) {
        this(function, file, line, className, null);
    }

    public static StackFrame of(StackTraceElement element) {
        return new StackFrame(element.getMethodName(), element.getFileName(),
            element.getLineNumber(), element.getClassName());
    }

    public static StackFrame of(StackWalker.StackFrame frame) {
        return new StackFrame(frame.getMethodName(), frame.getFileName(),
            frame.getLineNumber(), frame.getClassName());
    }

    public String getFunction()  { return function; }
    public String getFile()      { return file; }
    public int    getLine()      { return line; }
    public String getClassName() { return className; }
    public Object getReceiver()  { return receiver; }

    public boolean hasReceiver() { return receiver != null; }

    /** {@code Class.method, line N}; the format used in exception result traces. */
    public String format() {
        String owner = className != null ? className + "." : "";
        return owner + function + ", line " + line;
    }

    @Override
    public String toString() {
        return String.format("StackFrame{%s.%s(%s:%d)}", className, function, file, line);
    }
}
