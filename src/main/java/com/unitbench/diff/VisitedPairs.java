package com.unitbench.diff;

import java.util.HashSet;
import java.util.Set;

/**
 * Identity-keyed record of the composite pairs a comparison has already entered.
 * A pair seen again is on a cycle and compares as equal, since every difference
 * along the cycle is reported where it first appears.
 */
final class VisitedPairs {

    private final Set<Pair> pairs = new HashSet<>();

    /** @return {@code false} if the pair was already entered */
    boolean enter(Object a, Object b) {
        return pairs.add(new Pair(a, b));
    }

    private static final class Pair {
        private final Object a;
        private final Object b;

        Pair(Object a, Object b) {
            this.a = a;
            this.b = b;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Pair)) return false;
            Pair other = (Pair) o;
            return a == other.a && b == other.b;
        }

        @Override
        public int hashCode() {
            return 31 * System.identityHashCode(a) + System.identityHashCode(b);
        }
    }
}
