package com.unitbench.core;

import com.unitbench.model.Result;

/**
 * Sees every result immediately before it is appended to the Result Log.
 *
 * Return a replacement record to rewrite it, or {@code null} to keep it as is.
 * Implementations should not throw; if one does, the failure is logged and the
 * original record is kept.
 */
@FunctionalInterface
public interface Reporter {
    Result report(Result result);
}
