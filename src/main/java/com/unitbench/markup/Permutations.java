package com.unitbench.markup;

import java.util.ArrayList;
import java.util.List;

/**
 * Generates every ordering of a list.
 *
 * The output has N! entries, so callers bound N. Attribute constraints in
 * hand-written markup specs rarely exceed four or five.
 */
final class Permutations {

    private Permutations() {}

    /** All orderings of {@code items}; the first one is the input order. */
    static <T> List<List<T>> of(List<T> items) {
        List<List<T>> out = new ArrayList<>();
        permute(new ArrayList<>(items), new ArrayList<>(), out);
        return out;
    }

    private static <T> void permute(List<T> remaining, List<T> prefix, List<List<T>> out) {
        if (remaining.isEmpty()) {
            out.add(List.copyOf(prefix));
            return;
        }
        for (int i = 0; i < remaining.size(); i++) {
            List<T> rest = new ArrayList<>(remaining);
            prefix.add(rest.remove(i));
            permute(rest, prefix, out);
            prefix.remove(prefix.size() - 1);
        }
    }

    static long factorial(int n) {
        long f = 1;
        for (int i = 2; i <= n; i++) f *= i;
        return f;
    }
}
