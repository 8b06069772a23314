package com.unitbench.interceptor;

import com.unitbench.model.ErrorLevel;

import java.util.Map;

/**
 * Receives runtime errors reported through {@link RuntimeErrors#trigger}.
 *
 * At most one handler is installed process-wide at a time.
 */
@FunctionalInterface
public interface RuntimeErrorHandler {

    /**
     * @param code    severity of the error
     * @param message error text
     * @param file    source file of the code that reported it, may be null
     * @param line    line in that file, or a negative value when unknown
     * @param context variables relevant to the error; never null
     */
    void handle(ErrorLevel code, String message, String file, int line, Map<String, Object> context);
}
