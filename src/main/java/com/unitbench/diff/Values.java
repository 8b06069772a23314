package com.unitbench.diff;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.introspect.AnnotatedMember;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAccumulator;
import java.util.concurrent.atomic.LongAdder;

/**
 * Value classification and the two equality rules shared by the differ and the
 * assertions.
 *
 * <h3>Type names</h3>
 * <pre>
 *   null     null
 *   boolean  Boolean
 *   integer  Byte, Short, Integer, Long, BigInteger, AtomicInteger, AtomicLong,
 *            LongAdder, LongAccumulator
 *   double   Float, Double, BigDecimal and any other Number
 *   string   CharSequence, Character
 *   array    Map, Collection, Java arrays
 *   object   any other value (records/POJOs, enums, JDK value types)
 *   absent   the {@link #ABSENT} sentinel
 * </pre>
 *
 * <h3>Records</h3>
 * An {@code object} whose class lives outside the JDK and is not an enum is a
 * named-field record, provided its package is open to this library: classes in the
 * unnamed module, or in a named module that opens the package. Its fields are read
 * one level deep, in declaration order, through Jackson's bean introspection.
 * Anything else, such as the {@code sun.nio.fs} class behind a {@code Path}, is
 * compared with {@code equals}.
 *
 * <h3>Cycles</h3>
 * Composite comparisons track the pairs they have entered by identity; a pair met
 * again compares as equal, so back-referencing object graphs terminate.
 */
public final class Values {

    /** Stands in for a key or index that the actual value does not have. */
    public static final Object ABSENT = new Object() {
        @Override
        public String toString() { return "absent"; }
    };

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
        .setVisibility(PropertyAccessor.ALL, JsonAutoDetect.Visibility.NONE)
        .setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);

    private Values() {}

    /** The mapper used to read record fields and render values; fields only, any visibility. */
    static ObjectMapper mapper() {
        return MAPPER;
    }

    // ── Classification ────────────────────────────────────────────────────────

    public static String typeName(Object value) {
        if (value == ABSENT) return "absent";
        if (value == null) return "null";
        if (value instanceof Boolean) return "boolean";
        if (isIntegral(value)) return "integer";
        if (value instanceof Number) return "double";
        if (value instanceof CharSequence || value instanceof Character) return "string";
        if (isContainer(value)) return "array";
        return "object";
    }

    /** Map, Collection or Java array. */
    public static boolean isContainer(Object value) {
        return value instanceof Map
            || value instanceof Collection
            || (value != null && value.getClass().isArray());
    }

    /** A named-field record: a non-JDK, non-enum object whose fields we are allowed to read. */
    public static boolean isRecord(Object value) {
        if (value == null || value == ABSENT || !"object".equals(typeName(value))) return false;
        if (value instanceof Enum) return false;
        Class<?> type = value.getClass();
        String pkg = type.getPackageName();
        if (pkg.startsWith("java.") || pkg.startsWith("javax.") || pkg.startsWith("jdk.")) return false;
        Module module = type.getModule();
        return !module.isNamed() || module.isOpen(pkg, Values.class.getModule());
    }

    public static boolean isComposite(Object value) {
        return isContainer(value) || isRecord(value);
    }

    /**
     * Returns the entries of a composite value keyed by map key, list index or
     * record field name. Insertion order follows the source.
     */
    public static Map<Object, Object> entries(Object composite) {
        Map<Object, Object> out = new LinkedHashMap<>();
        if (composite instanceof Map<?, ?> map) {
            out.putAll(map);
        } else if (isContainer(composite)) {
            List<Object> items = asList(composite);
            for (int i = 0; i < items.size(); i++) {
                out.put(i, items.get(i));
            }
        } else if (isRecord(composite)) {
            out.putAll(fields(composite));
        } else {
            throw new IllegalArgumentException("Not a composite value: " + typeName(composite));
        }
        return out;
    }

    private static Map<String, Object> fields(Object record) {
        BeanDescription description = MAPPER.getSerializationConfig()
            .introspect(MAPPER.constructType(record.getClass()));
        Map<String, Object> out = new LinkedHashMap<>();
        for (BeanPropertyDefinition property : description.findProperties()) {
            AnnotatedMember accessor = property.getAccessor();
            if (accessor == null) continue;
            accessor.fixAccess(true);
            out.put(property.getName(), accessor.getValue(record));
        }
        return out;
    }

    private static List<Object> asList(Object container) {
        if (container instanceof Collection<?> c) return new ArrayList<>(c);
        int length = Array.getLength(container);
        List<Object> items = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            items.add(Array.get(container, i));
        }
        return items;
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Byte || value instanceof Short || value instanceof Integer
            || value instanceof Long || value instanceof BigInteger
            || value instanceof AtomicInteger || value instanceof AtomicLong
            || value instanceof LongAdder || value instanceof LongAccumulator;
    }

    // ── Equality ──────────────────────────────────────────────────────────────

    /**
     * Representational equality. Numbers compare by value regardless of boxed type,
     * numeric strings compare with numbers, a Character equals its one-char String,
     * and composites compare deeply under the same rule (map key order ignored).
     */
    public static boolean looseEquals(Object a, Object b) {
        return looseEquals(a, b, new VisitedPairs());
    }

    static boolean looseEquals(Object a, Object b, VisitedPairs visited) {
        if (a == b) return true;
        if (a == null || b == null || a == ABSENT || b == ABSENT) return false;

        if (a instanceof Number na && b instanceof Number nb) return numericEquals(na, nb);
        if (a instanceof Number na && b instanceof CharSequence sb) return numericEquals(na, sb.toString());
        if (a instanceof CharSequence sa && b instanceof Number nb) return numericEquals(nb, sa.toString());
        if (isStringLike(a) && isStringLike(b)) return a.toString().equals(b.toString());

        if (isContainer(a) && isContainer(b)) {
            if ((a instanceof Map) != (b instanceof Map)) return false;
            return !visited.enter(a, b) || entriesEqual(entries(a), entries(b), false, visited);
        }
        if (isRecord(a) && isRecord(b)) {
            if (a.getClass() != b.getClass()) return false;
            return !visited.enter(a, b) || entriesEqual(entries(a), entries(b), false, visited);
        }
        return a.equals(b);
    }

    /** Same runtime type and same value; composites are compared element-wise under the same rule. */
    public static boolean strictEquals(Object a, Object b) {
        return strictEquals(a, b, new VisitedPairs());
    }

    static boolean strictEquals(Object a, Object b, VisitedPairs visited) {
        if (a == b) return true;
        if (a == null || b == null || a == ABSENT || b == ABSENT) return false;

        if (a instanceof Map && b instanceof Map) {
            return !visited.enter(a, b) || entriesEqual(entries(a), entries(b), true, visited);
        }
        if (isContainer(a) && isContainer(b)) {
            if (a instanceof Map || b instanceof Map) return false;
            return !visited.enter(a, b) || entriesEqual(entries(a), entries(b), true, visited);
        }
        if (a.getClass() != b.getClass()) return false;
        if (isIntegral(a)) return numericEquals((Number) a, (Number) b);
        if (!isRecord(a)) return a.equals(b);
        return !visited.enter(a, b) || entriesEqual(entries(a), entries(b), true, visited);
    }

    private static boolean entriesEqual(Map<Object, Object> a, Map<Object, Object> b, boolean strict,
                                        VisitedPairs visited) {
        if (a.size() != b.size()) return false;
        for (Map.Entry<Object, Object> e : a.entrySet()) {
            if (!b.containsKey(e.getKey())) return false;
            Object other = b.get(e.getKey());
            boolean same = strict
                ? strictEquals(e.getValue(), other, visited)
                : looseEquals(e.getValue(), other, visited);
            if (!same) return false;
        }
        return true;
    }

    private static boolean isStringLike(Object value) {
        return value instanceof CharSequence || value instanceof Character;
    }

    private static boolean numericEquals(Number a, Number b) {
        if (isNonFinite(a) || isNonFinite(b)) {
            return a.doubleValue() == b.doubleValue();
        }
        return toDecimal(a).compareTo(toDecimal(b)) == 0;
    }

    private static boolean numericEquals(Number a, String b) {
        try {
            return numericEquals(a, new BigDecimal(b.trim()));
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static boolean isNonFinite(Number n) {
        if (isIntegral(n) || n instanceof BigDecimal) return false;
        double d = n.doubleValue();
        return Double.isNaN(d) || Double.isInfinite(d);
    }

    private static BigDecimal toDecimal(Number n) {
        if (n instanceof BigDecimal bd) return bd;
        if (n instanceof BigInteger bi) return new BigDecimal(bi);
        if (isIntegral(n)) return BigDecimal.valueOf(n.longValue());
        if (n instanceof Double || n instanceof Float) return new BigDecimal(n.toString());
        return BigDecimal.valueOf(n.doubleValue());
    }

    // ── Truthiness ────────────────────────────────────────────────────────────

    /**
     * {@code true} for null, false, numeric zero, "", "0" and empty
     * containers. Used by {@code assertTrue} / {@code assertFalse}.
     */
    public static boolean isEmpty(Object value) {
        if (value == null || value == ABSENT) return true;
        if (value instanceof Boolean b) return !b;
        if (value instanceof Number n) return signum(n) == 0;
        if (value instanceof CharSequence s) return s.length() == 0 || "0".contentEquals(s);
        if (value instanceof Map<?, ?> m) return m.isEmpty();
        if (value instanceof Collection<?> c) return c.isEmpty();
        if (value.getClass().isArray()) return Array.getLength(value) == 0;
        return false;
    }

    private static int signum(Number n) {
        if (isNonFinite(n)) return 1;
        return toDecimal(n).signum();
    }
}
