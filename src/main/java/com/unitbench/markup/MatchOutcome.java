package com.unitbench.markup;

/**
 * The result of running compiled rules against an input string.
 *
 * Immutable; use the static factories.
 */
public class MatchOutcome {

    private final boolean   matched;
    private final MatchRule failedRule;   // null when matched
    private final int       ruleIndex;    // 0-based index of the failed rule, -1 when matched
    private final String    remainder;    // input left unconsumed

    private MatchOutcome(boolean matched, MatchRule failedRule, int ruleIndex, String remainder) {
        this.matched    = matched;
        this.failedRule = failedRule;
        this.ruleIndex  = ruleIndex;
        this.remainder  = remainder;
    }

    public static MatchOutcome success(String remainder) {
        return new MatchOutcome(true, null, -1, remainder);
    }

    public static MatchOutcome failure(MatchRule rule, int ruleIndex, String remainder) {
        return new MatchOutcome(false, rule, ruleIndex, remainder);
    }

    public boolean   isMatched()     { return matched; }
    public MatchRule getFailedRule() { return failedRule; }
    public int       getRuleIndex()  { return ruleIndex; }
    public String    getRemainder()  { return remainder; }

    /** {@code Item #<origin> / rule #<index> failed: <description>}, or "" when matched. */
    public String describeFailure() {
        if (matched) return "";
        return String.format("Item #%d / rule #%d failed: %s",
            failedRule.getOriginIndex(), ruleIndex, failedRule.getDescription());
    }

    @Override
    public String toString() {
        return matched
            ? "MatchOutcome{MATCHED}"
            : "MatchOutcome{FAILED, " + describeFailure() + "}";
    }
}
