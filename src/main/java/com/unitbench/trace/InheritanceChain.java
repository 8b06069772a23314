package com.unitbench.trace;

import org.reflections.ReflectionUtils;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The names of a class, its superclasses and every interface it implements.
 *
 * Stack frames identify their owner by class name only, so membership is
 * tested by name. Chains are computed once per class with the Reflections
 * library and cached.
 */
public final class InheritanceChain {

    private static final Map<Class<?>, InheritanceChain> CACHE = new ConcurrentHashMap<>();

    private final Set<String> names;

    private InheritanceChain(Set<String> names) {
        this.names = Collections.unmodifiableSet(names);
    }

    public static InheritanceChain of(Class<?> type) {
        return CACHE.computeIfAbsent(type, InheritanceChain::compute);
    }

    private static InheritanceChain compute(Class<?> type) {
        Set<String> names = new LinkedHashSet<>();
        names.add(type.getName());
        for (Class<?> superType : ReflectionUtils.getAllSuperTypes(type)) {
            names.add(superType.getName());
        }
        return new InheritanceChain(names);
    }

    public boolean contains(String className) {
        return className != null && names.contains(className);
    }

    public Set<String> names() {
        return names;
    }

    /** A copy of this chain without the given types. */
    public InheritanceChain without(Class<?>... types) {
        Set<String> remaining = new LinkedHashSet<>(names);
        Arrays.stream(types).map(Class::getName).forEach(remaining::remove);
        return new InheritanceChain(remaining);
    }

    @Override
    public String toString() {
        return "InheritanceChain" + names;
    }
}
