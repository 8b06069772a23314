package com.unitbench.diff;

import org.testng.annotations.Test;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

import static org.assertj.core.api.Assertions.assertThat;

public class ValuesTest {

    static class Point {
        int x;
        int y;

        Point(int x, int y) {
            this.x = x;
            this.y = y;
        }
    }

    enum Color { RED }

    static class Node {
        String name;
        Node   parent;
        Node   child;

        Node(String name) {
            this.name = name;
        }
    }

    static class Fraction extends Number {
        final long numerator;
        final long denominator;

        Fraction(long numerator, long denominator) {
            this.numerator   = numerator;
            this.denominator = denominator;
        }

        @Override public int intValue()       { return (int) longValue(); }
        @Override public long longValue()     { return numerator / denominator; }
        @Override public float floatValue()   { return (float) doubleValue(); }
        @Override public double doubleValue() { return (double) numerator / denominator; }
    }

    private static Node family(String childName) {
        Node root  = new Node("root");
        Node child = new Node(childName);
        root.child   = child;
        child.parent = root;
        return root;
    }

    @Test
    public void typeName_classifiesValues() {
        assertThat(Values.typeName(null)).isEqualTo("null");
        assertThat(Values.typeName(true)).isEqualTo("boolean");
        assertThat(Values.typeName(7L)).isEqualTo("integer");
        assertThat(Values.typeName(1.5)).isEqualTo("double");
        assertThat(Values.typeName("s")).isEqualTo("string");
        assertThat(Values.typeName(List.of())).isEqualTo("array");
        assertThat(Values.typeName(new int[0])).isEqualTo("array");
        assertThat(Values.typeName(Map.of())).isEqualTo("array");
        assertThat(Values.typeName(new Point(1, 2))).isEqualTo("object");
        assertThat(Values.typeName(Values.ABSENT)).isEqualTo("absent");
    }

    @Test
    public void isRecord_excludesJdkTypesAndEnums() {
        assertThat(Values.isRecord(new Point(1, 2))).isTrue();
        assertThat(Values.isRecord(Color.RED)).isFalse();
        assertThat(Values.isRecord(new StringBuilder())).isFalse();
        assertThat(Values.isRecord(List.of())).isFalse();
    }

    @Test
    public void entries_readsFieldsInDeclarationOrder() {
        assertThat(Values.entries(new Point(3, 4)))
            .containsExactly(Map.entry("x", 3), Map.entry("y", 4));
    }

    @Test
    public void entries_indexesListsAndArrays() {
        assertThat(Values.entries(List.of("a", "b"))).containsEntry(0, "a").containsEntry(1, "b");
        assertThat(Values.entries(new int[] {9})).containsEntry(0, 9);
    }

    @Test
    public void looseEquals_coercesNumbersAndNumericStrings() {
        assertThat(Values.looseEquals(1, 1L)).isTrue();
        assertThat(Values.looseEquals(1, 1.0)).isTrue();
        assertThat(Values.looseEquals(new BigDecimal("2.50"), 2.5)).isTrue();
        assertThat(Values.looseEquals(1, "1")).isTrue();
        assertThat(Values.looseEquals("1.0", 1)).isTrue();
        assertThat(Values.looseEquals(1, "one")).isFalse();
        assertThat(Values.looseEquals('c', "c")).isTrue();
    }

    @Test
    public void looseEquals_comparesCompositesDeeply() {
        assertThat(Values.looseEquals(Map.of("a", List.of(1, 2)), Map.of("a", List.of(1L, 2.0)))).isTrue();
        assertThat(Values.looseEquals(List.of(1, 2), new int[] {1, 2})).isTrue();
        assertThat(Values.looseEquals(new Point(1, 2), new Point(1, 2))).isTrue();
        assertThat(Values.looseEquals(new Point(1, 2), new Point(2, 1))).isFalse();
    }

    @Test
    public void strictEquals_requiresSameType() {
        assertThat(Values.strictEquals(1, 1L)).isFalse();
        assertThat(Values.strictEquals(1, "1")).isFalse();
        assertThat(Values.strictEquals(1, 1)).isTrue();
        assertThat(Values.strictEquals(List.of(1, 2), List.of(1, 2))).isTrue();
        assertThat(Values.strictEquals(List.of(1, 2), List.of(1L, 2L))).isFalse();
        assertThat(Values.strictEquals(new Point(1, 2), new Point(1, 2))).isTrue();
    }

    @Test
    public void absentNeverEqualsAnything() {
        assertThat(Values.looseEquals(Values.ABSENT, null)).isFalse();
        assertThat(Values.strictEquals(null, Values.ABSENT)).isFalse();
    }

    @Test
    public void isEmpty_followsTruthiness() {
        assertThat(Values.isEmpty(null)).isTrue();
        assertThat(Values.isEmpty(false)).isTrue();
        assertThat(Values.isEmpty(0)).isTrue();
        assertThat(Values.isEmpty(0.0)).isTrue();
        assertThat(Values.isEmpty("")).isTrue();
        assertThat(Values.isEmpty("0")).isTrue();
        assertThat(Values.isEmpty(List.of())).isTrue();
        assertThat(Values.isEmpty(Map.of())).isTrue();

        assertThat(Values.isEmpty(true)).isFalse();
        assertThat(Values.isEmpty(-1)).isFalse();
        assertThat(Values.isEmpty("0.0")).isFalse();
        assertThat(Values.isEmpty(List.of(0))).isFalse();
        assertThat(Values.isEmpty(new Point(0, 0))).isFalse();
    }

    @Test
    public void isRecord_treatsClosedJdkInternalsAsScalars() {
        Path path = Path.of("a");

        assertThat(Values.isRecord(path)).isFalse();
        assertThat(Values.looseEquals(path, Path.of("a"))).isTrue();
        assertThat(Values.strictEquals(path, Path.of("a"))).isTrue();
        assertThat(Values.looseEquals(path, Path.of("b"))).isFalse();
    }

    @Test
    public void equality_terminatesOnBackReferences() {
        assertThat(Values.looseEquals(family("leaf"), family("leaf"))).isTrue();
        assertThat(Values.strictEquals(family("leaf"), family("leaf"))).isTrue();
        assertThat(Values.looseEquals(family("leaf"), family("other"))).isFalse();
        assertThat(Values.strictEquals(family("leaf"), family("other"))).isFalse();
    }

    @Test
    public void equality_terminatesOnSelfContainingLists() {
        List<Object> a = new ArrayList<>();
        a.add(1);
        a.add(a);
        List<Object> b = new ArrayList<>();
        b.add(1);
        b.add(b);

        assertThat(Values.looseEquals(a, b)).isTrue();
    }

    @Test
    public void numbers_atomicCountersAreIntegers() {
        LongAdder adder = new LongAdder();
        adder.add(4);

        assertThat(Values.typeName(new AtomicInteger(1))).isEqualTo("integer");
        assertThat(Values.typeName(new AtomicLong(1))).isEqualTo("integer");
        assertThat(Values.typeName(adder)).isEqualTo("integer");
        assertThat(Values.looseEquals(new AtomicInteger(3), 3L)).isTrue();
        assertThat(Values.looseEquals(adder, "4")).isTrue();
        assertThat(Values.strictEquals(new AtomicLong(5), new AtomicLong(5))).isTrue();
        assertThat(Values.isEmpty(new AtomicInteger(0))).isTrue();
    }

    @Test
    public void numbers_customNumbersKeepTheirFraction() {
        Fraction half = new Fraction(1, 2);

        assertThat(Values.typeName(half)).isEqualTo("double");
        assertThat(Values.looseEquals(half, 0)).isFalse();
        assertThat(Values.looseEquals(half, 0.5)).isTrue();
        assertThat(Values.looseEquals(half, "0.5")).isTrue();
        assertThat(Values.isEmpty(half)).isFalse();
    }
}
