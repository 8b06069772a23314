package com.unitbench.trace;

import org.testng.annotations.Test;

import java.io.Serializable;

import static org.assertj.core.api.Assertions.assertThat;

public class InheritanceChainTest {

    interface Marker {
    }

    static class Parent implements Serializable {
    }

    static class Child extends Parent implements Marker {
    }

    @Test
    public void of_includesClassSuperclassesAndInterfaces() {
        InheritanceChain chain = InheritanceChain.of(Child.class);

        assertThat(chain.contains(Child.class.getName())).isTrue();
        assertThat(chain.contains(Parent.class.getName())).isTrue();
        assertThat(chain.contains(Marker.class.getName())).isTrue();
        assertThat(chain.contains(Serializable.class.getName())).isTrue();
        assertThat(chain.contains(String.class.getName())).isFalse();
        assertThat(chain.contains(null)).isFalse();
    }

    @Test
    public void of_isCachedPerClass() {
        assertThat(InheritanceChain.of(Child.class)).isSameAs(InheritanceChain.of(Child.class));
    }

    @Test
    public void without_removesGivenTypesOnly() {
        InheritanceChain chain = InheritanceChain.of(Child.class).without(Parent.class, Marker.class);

        assertThat(chain.contains(Parent.class.getName())).isFalse();
        assertThat(chain.contains(Marker.class.getName())).isFalse();
        assertThat(chain.contains(Child.class.getName())).isTrue();
        assertThat(InheritanceChain.of(Child.class).contains(Parent.class.getName())).isTrue();
    }
}
