package com.unitbench.core;

import org.reflections.ReflectionUtils;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.List;
import java.util.Set;

import static org.reflections.ReflectionUtils.withModifier;
import static org.reflections.ReflectionUtils.withParametersCount;
import static org.reflections.ReflectionUtils.withPrefix;

/**
 * Finds test methods by naming convention.
 *
 * A test method is public, non-static, non-abstract, takes no arguments and its
 * name starts with the configured prefix. Methods inherited from superclasses
 * and default interface methods count; methods of the engine types themselves
 * ({@link UnitTestCase}, {@link TestSubject}) do not.
 *
 * The JVM does not report declaration order, so names are returned sorted.
 */
final class TestMethodDiscovery {

    private TestMethodDiscovery() {}

    static List<String> discover(Class<?> type, String prefix) {
        Set<Method> candidates = ReflectionUtils.getAllMethods(type,
            withModifier(Modifier.PUBLIC), withPrefix(prefix), withParametersCount(0));

        return candidates.stream()
            .filter(m -> !Modifier.isStatic(m.getModifiers()))
            .filter(m -> !Modifier.isAbstract(m.getModifiers()))
            .filter(m -> !m.isBridge() && !m.isSynthetic())
            .filter(m -> m.getDeclaringClass() != UnitTestCase.class
                      && m.getDeclaringClass() != TestSubject.class)
            .map(Method::getName)
            .distinct()
            .sorted()
            .toList();
    }
}
