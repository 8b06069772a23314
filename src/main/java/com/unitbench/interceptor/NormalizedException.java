package com.unitbench.interceptor;

import com.unitbench.model.ErrorLevel;
import com.unitbench.trace.StackFrame;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A raised exception or an intercepted runtime error in one shape.
 *
 * Built by {@link ExceptionTranslator#translate}. {@code code} is set only for
 * runtime errors and {@code type} only for exceptions.
 */
public class NormalizedException {

    private final String              message;
    private final String              file;
    private final int                 line;
    private final List<StackFrame>    trace;
    private final ErrorLevel          code;
    private final String              type;         // exception class name
    private final boolean             skipSignal;
    private final Map<String, Object> context;

    NormalizedException(String message, String file, int line, List<StackFrame> trace,
                        ErrorLevel code, String type, boolean skipSignal,
                        Map<String, Object> context) {
        this.message    = message != null ? message : "";
        this.file       = file;
        this.line       = line;
        this.trace      = List.copyOf(trace);
        this.code       = code;
        this.type       = type;
        this.skipSignal = skipSignal;
        this.context    = context != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(context))
            : Map.of();
    }

    public String              getMessage() { return message; }
    public String              getFile()    { return file; }
    public int                 getLine()    { return line; }
    public List<StackFrame>    getTrace()   { return trace; }
    public ErrorLevel          getCode()    { return code; }
    public String              getType()    { return type; }
    public Map<String, Object> getContext() { return context; }

    public boolean isRuntimeError() { return code != null; }

    /** {@code true} for a {@link SkipSignal} or a message with the skip prefix. */
    public boolean isSkip() {
        return skipSignal || SkipSignal.isSkipMessage(message);
    }

    @Override
    public String toString() {
        return String.format("NormalizedException{%s, '%s' at %s:%d, %d frame(s)}",
            code != null ? code : type, message, file, line, trace.size());
    }
}
