package com.unitbench.diff;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a {@link DiffNode} as the human-readable block inserted into assertion
 * messages:
 *
 * <pre>
 *   trace: [user].name
 *   expected: "Alice"
 *   result: "Bob"
 * </pre>
 *
 * Branches render each child in order. Informational leaves are rendered too, so a
 * failing comparison whose only node is a placeholder still explains itself.
 * Values are written as JSON through Jackson; a value Jackson cannot write falls
 * back to {@code String.valueOf}.
 */
public class DiffFormatter {

    private static final Logger log = LoggerFactory.getLogger(DiffFormatter.class);

    public String format(DiffNode node) {
        if (node == null || node.isMatch()) {
            return "";
        }
        if (node instanceof DiffNode.Branch branch) {
            StringBuilder sb = new StringBuilder();
            for (DiffNode child : branch.getChildren()) {
                sb.append(format(child));
            }
            return sb.toString();
        }
        DiffNode.Leaf leaf = (DiffNode.Leaf) node;
        return String.format("trace: %s%nexpected: %s%nresult: %s%n",
            leaf.getTrace(), render(leaf.getExpected()), render(leaf.getResult()));
    }

    /** Renders a single value the way it appears in a diff block. */
    public String render(Object value) {
        if (value == Values.ABSENT) {
            return "absent";
        }
        try {
            return Values.mapper().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.debug("DiffFormatter: could not render {} as JSON: {}",
                value.getClass().getName(), e.getOriginalMessage());
            return String.valueOf(value);
        }
    }
}
