package com.unitbench.diff;

import java.util.ArrayList;
import java.util.List;

/**
 * The output of {@link StructuralDiffer#compare}.
 *
 * A node is one of:
 *   - {@link Match}    the values are equal under the chosen mode
 *   - {@link Leaf}     a {@code {trace, expected, result}} triple
 *   - {@link Branch}   the per-key diffs of a composite that partially mismatched
 *
 * A leaf is either actionable (a real divergence) or informational: the
 * placeholder returned for a composite whose keys all matched, or a type
 * mismatch between loosely-equal scalars. Callers recognise "no mismatches"
 * with {@link #hasMismatches()}, not by testing for {@link Match}.
 */
public abstract class DiffNode {

    private static final Match MATCH = new Match();

    DiffNode() {}

    // ── Static factories ──────────────────────────────────────────────────────

    public static DiffNode match() {
        return MATCH;
    }

    public static Leaf leaf(String trace, Object expected, Object result) {
        return new Leaf(trace, expected, result, false);
    }

    public static Leaf informational(String trace, Object expected, Object result) {
        return new Leaf(trace, expected, result, true);
    }

    public static Branch branch(List<DiffNode> children) {
        return new Branch(children);
    }

    // ── Queries ───────────────────────────────────────────────────────────────

    /** {@code true} only for the literal match node. */
    public boolean isMatch() {
        return false;
    }

    /** {@code true} when at least one actionable leaf is reachable from this node. */
    public boolean hasMismatches() {
        return !leaves().isEmpty();
    }

    /** Every actionable leaf under this node, depth-first. */
    public abstract List<Leaf> leaves();

    // ── Variants ──────────────────────────────────────────────────────────────

    public static final class Match extends DiffNode {
        private Match() {}

        @Override public boolean isMatch()     { return true; }
        @Override public List<Leaf> leaves()   { return List.of(); }
        @Override public String toString()     { return "Match"; }
    }

    public static final class Leaf extends DiffNode {
        private final String  trace;
        private final Object  expected;
        private final Object  result;
        private final boolean informational;

        private Leaf(String trace, Object expected, Object result, boolean informational) {
            this.trace         = trace != null ? trace : "";
            this.expected      = expected;
            this.result        = result;
            this.informational = informational;
        }

        public String  getTrace()        { return trace; }
        public Object  getExpected()     { return expected; }
        public Object  getResult()       { return result; }
        public boolean isInformational() { return informational; }

        @Override
        public List<Leaf> leaves() {
            return informational ? List.of() : List.of(this);
        }

        @Override
        public String toString() {
            return String.format("Leaf{trace='%s', expected=%s, result=%s%s}",
                trace, expected, result, informational ? ", informational" : "");
        }
    }

    public static final class Branch extends DiffNode {
        private final List<DiffNode> children;

        private Branch(List<DiffNode> children) {
            this.children = List.copyOf(children);
        }

        public List<DiffNode> getChildren() { return children; }

        @Override
        public List<Leaf> leaves() {
            List<Leaf> out = new ArrayList<>();
            for (DiffNode child : children) {
                out.addAll(child.leaves());
            }
            return out;
        }

        @Override
        public String toString() {
            return "Branch" + children;
        }
    }
}
