package com.unitbench.diff;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Recursively compares an expected value with an actual one and returns a
 * {@link DiffNode} describing where they diverge.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Different type names short-circuit: the result is a
 *       {@code {trace, typeName(expected), typeName(actual)}} leaf. In LOOSE mode the
 *       leaf is informational when the two values are still loosely equal
 *       ({@code 1} vs {@code "1"}).</li>
 *   <li>Composites are walked over every key of the expected value. A key missing
 *       from the actual value reads as {@link Values#ABSENT}.
 *       <ul>
 *         <li>STRICT: an absent counterpart ends that branch at once with a leaf.</li>
 *         <li>LOOSE: only a non-composite expected entry ends the branch; a composite
 *             entry is recursed into first.</li>
 *       </ul>
 *       Paths grow by {@code .key} for records and {@code [key]} for maps, lists and arrays.
 *       When every key matched, the composite's own triple comes back as an
 *       informational placeholder.</li>
 *   <li>Scalars return {@link DiffNode#match()} or an actionable leaf.</li>
 * </ol>
 *
 * A composite pair already entered higher up the walk is a cycle and returns
 * {@link DiffNode#match()}.
 *
 * Stateless and thread-safe.
 */
public class StructuralDiffer {

    public DiffNode compare(ComparisonMode mode, Object expected, Object actual) {
        return compare(mode, expected, actual, "");
    }

    public DiffNode compare(ComparisonMode mode, Object expected, Object actual, String trace) {
        return compare(mode, expected, actual, trace, new VisitedPairs());
    }

    private DiffNode compare(ComparisonMode mode, Object expected, Object actual, String trace,
                             VisitedPairs visited) {
        String expectedType = Values.typeName(expected);
        String actualType   = Values.typeName(actual);

        if (!expectedType.equals(actualType)) {
            boolean tolerated = mode == ComparisonMode.LOOSE && Values.looseEquals(expected, actual);
            return tolerated
                ? DiffNode.informational(trace, expectedType, actualType)
                : DiffNode.leaf(trace, expectedType, actualType);
        }

        if (Values.isComposite(expected) && Values.isComposite(actual)) {
            if (!visited.enter(expected, actual)) {
                return DiffNode.match();
            }
            return compareComposite(mode, expected, actual, trace, visited);
        }

        return mode.equal(expected, actual)
            ? DiffNode.match()
            : DiffNode.leaf(trace, expected, actual);
    }

    private DiffNode compareComposite(ComparisonMode mode, Object expected, Object actual, String trace,
                                      VisitedPairs visited) {
        boolean isRecord = Values.isRecord(expected);
        Map<Object, Object> expectedEntries = Values.entries(expected);
        Map<Object, Object> actualEntries   = Values.entries(actual);
        List<DiffNode> data = new ArrayList<>();

        for (Map.Entry<Object, Object> entry : expectedEntries.entrySet()) {
            Object key   = entry.getKey();
            Object value = entry.getValue();
            Object check = actualEntries.containsKey(key) ? actualEntries.get(key) : Values.ABSENT;
            String path  = isRecord ? trace + "." + key : trace + "[" + key + "]";

            if (mode.equal(value, check)) {
                continue;
            }
            if (mode == ComparisonMode.STRICT && check == Values.ABSENT) {
                return DiffNode.leaf(path, value, check);
            }
            if (mode == ComparisonMode.LOOSE && !Values.isComposite(value)) {
                return DiffNode.leaf(path, value, check);
            }

            DiffNode sub = compare(mode, value, check, path, visited);
            if (!sub.isMatch()) {
                data.add(sub);
            }
        }

        if (data.isEmpty()) {
            return DiffNode.informational(trace, expected, actual);
        }
        return DiffNode.branch(data);
    }
}
