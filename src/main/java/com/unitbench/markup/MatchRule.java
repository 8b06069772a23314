package com.unitbench.markup;

import java.util.List;
import java.util.regex.Pattern;

/**
 * One compiled unit of a markup spec.
 *
 * Matching a rule means one of its alternatives matches a prefix of the remaining
 * input. Attribute blocks carry one alternative per attribute ordering; every
 * other rule carries exactly one.
 */
public class MatchRule {

    private final String        description;
    private final List<Pattern> alternatives;
    private final int           originIndex;   // 1-based position of the spec item

    MatchRule(String description, List<Pattern> alternatives, int originIndex) {
        this.description  = description;
        this.alternatives = List.copyOf(alternatives);
        this.originIndex  = originIndex;
    }

    public String        getDescription()  { return description; }
    public List<Pattern> getAlternatives() { return alternatives; }
    public int           getOriginIndex()  { return originIndex; }

    @Override
    public String toString() {
        return String.format("MatchRule{item #%d, '%s', %d alternative(s)}",
            originIndex, description, alternatives.size());
    }
}
