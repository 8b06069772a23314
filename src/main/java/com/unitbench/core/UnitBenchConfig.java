package com.unitbench.core;

import com.unitbench.markup.MarkupMatcher;

/**
 * Configuration for test runs.
 *
 * Load from environment variables or construct programmatically.
 *
 * Recognised environment variables:
 *   UNITBENCH_METHOD_PREFIX              - Name prefix of discovered test methods (default: test)
 *   UNITBENCH_FAIL_ON_UNMET_EXPECTATIONS - Record a Fail when expectException declarations are
 *                                          still pending at the end of a method (default: false)
 *   UNITBENCH_MAX_MARKUP_ATTRIBUTES      - Max attribute constraints per tag in assertTags;
 *                                          each tag costs N! orderings (default: 8)
 *   UNITBENCH_LOG_RESULTS                - Log every recorded result at DEBUG (default: false)
 */
public class UnitBenchConfig {

    public static final String DEFAULT_METHOD_PREFIX = "test";

    private final String  methodPrefix;
    private final boolean failOnUnmetExpectations;
    private final int     maxMarkupAttributes;
    private final boolean logResults;

    private UnitBenchConfig(Builder b) {
        this.methodPrefix            = b.methodPrefix;
        this.failOnUnmetExpectations = b.failOnUnmetExpectations;
        this.maxMarkupAttributes     = b.maxMarkupAttributes;
        this.logResults              = b.logResults;
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static UnitBenchConfig defaults() {
        return builder().build();
    }

    public static UnitBenchConfig fromEnvironment() {
        return builder()
            .methodPrefix(envOrDefault("UNITBENCH_METHOD_PREFIX", DEFAULT_METHOD_PREFIX))
            .failOnUnmetExpectations(boolEnvOrDefault("UNITBENCH_FAIL_ON_UNMET_EXPECTATIONS", false))
            .maxMarkupAttributes(intEnvOrDefault("UNITBENCH_MAX_MARKUP_ATTRIBUTES",
                MarkupMatcher.DEFAULT_MAX_ATTRIBUTES))
            .logResults(boolEnvOrDefault("UNITBENCH_LOG_RESULTS", false))
            .build();
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public String  getMethodPrefix()            { return methodPrefix; }
    public boolean isFailOnUnmetExpectations()  { return failOnUnmetExpectations; }
    public int     getMaxMarkupAttributes()     { return maxMarkupAttributes; }
    public boolean isLogResults()               { return logResults; }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private String  methodPrefix            = DEFAULT_METHOD_PREFIX;
        private boolean failOnUnmetExpectations = false;
        private int     maxMarkupAttributes     = MarkupMatcher.DEFAULT_MAX_ATTRIBUTES;
        private boolean logResults              = false;

        public Builder methodPrefix(String p)                { this.methodPrefix = p; return this; }
        public Builder failOnUnmetExpectations(boolean b)    { this.failOnUnmetExpectations = b; return this; }
        public Builder maxMarkupAttributes(int n)            { this.maxMarkupAttributes = n; return this; }
        public Builder logResults(boolean b)                 { this.logResults = b; return this; }

        public UnitBenchConfig build() {
            if (methodPrefix == null || methodPrefix.isBlank()) {
                throw new IllegalStateException("methodPrefix must not be blank");
            }
            if (maxMarkupAttributes < 1) {
                throw new IllegalStateException("maxMarkupAttributes must be at least 1");
            }
            return new UnitBenchConfig(this);
        }
    }

    // ── Env helpers ───────────────────────────────────────────────────────────

    private static String envOrDefault(String key, String defaultValue) {
        String val = System.getenv(key);
        return (val != null && !val.isBlank()) ? val.trim() : defaultValue;
    }

    private static int intEnvOrDefault(String key, int defaultValue) {
        try {
            String val = System.getenv(key);
            return (val != null && !val.isBlank()) ? Integer.parseInt(val.trim()) : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static boolean boolEnvOrDefault(String key, boolean defaultValue) {
        String val = System.getenv(key);
        if (val == null || val.isBlank()) return defaultValue;
        return "true".equalsIgnoreCase(val.trim()) || "1".equals(val.trim());
    }
}
