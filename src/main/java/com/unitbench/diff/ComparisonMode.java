package com.unitbench.diff;

/**
 * Equality semantics used by {@link StructuralDiffer}.
 *
 *   LOOSE    representational equality; numbers and numeric strings compare by value
 *             ({@code assertEqual})
 *   STRICT   same runtime type and same value, no coercion ({@code assertIdentical})
 */
public enum ComparisonMode {
    LOOSE,
    STRICT;

    /** Applies this mode's equality rule to a pair of values. */
    public boolean equal(Object expected, Object actual) {
        return this == STRICT
            ? Values.strictEquals(expected, actual)
            : Values.looseEquals(expected, actual);
    }
}
