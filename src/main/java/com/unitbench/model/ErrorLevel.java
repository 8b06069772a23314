package com.unitbench.model;

/**
 * Severity of a runtime error reported through
 * {@link com.unitbench.interceptor.RuntimeErrors#trigger}.
 *
 * Runtime errors do not unwind the caller. The installed handler decides what
 * happens to them; while a test run is active they are reconciled against the
 * expectation stack exactly like raised exceptions.
 */
public enum ErrorLevel {

    /** Something the caller should fix but that does not invalidate the result. */
    NOTICE(8),

    /** A recoverable problem, e.g. a fallback path was taken. */
    WARNING(2),

    /** Use of an API scheduled for removal. */
    DEPRECATED(8192),

    /** A fault the caller considers fatal for the current operation. */
    ERROR(256);

    private final int code;

    ErrorLevel(int code) {
        this.code = code;
    }

    /** Numeric code carried on exception results. */
    public int getCode() {
        return code;
    }
}
