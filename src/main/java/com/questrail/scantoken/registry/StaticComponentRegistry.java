package com.questrail.scantoken.registry;

import com.questrail.scantoken.api.ComponentRegistry;
import com.questrail.scantoken.api.TokenFormat;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable {@link ComponentRegistry} backed by a fixed allocation list.
 *
 * <p>Component names are checked for syntax at build time, so a registry can
 * never claim to allocate a name that the grammar would reject. Lookups never
 * fail.</p>
 */
public final class StaticComponentRegistry implements ComponentRegistry {
    private final Set<String> components;

    private StaticComponentRegistry(Set<String> components) {
        this.components = Collections.unmodifiableSet(new TreeSet<>(components));
    }

    /**
     * Shorthand for a registry allocating exactly {@code components}.
     */
    public static StaticComponentRegistry of(String... components) {
        Builder builder = builder();
        for (String component : components) {
            builder.allocate(component);
        }
        return builder.build();
    }

    @Override
    public boolean isAllocated(String component) {
        return component != null && components.contains(component);
    }

    /**
     * Returns the allocated components in lexical order.
     */
    public Set<String> allocatedComponents() {
        return components;
    }

    @Override
    public String toString() {
        return "StaticComponentRegistry" + components;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Set<String> components = new TreeSet<>();

        /**
         * @throws IllegalArgumentException if {@code component} is not 3-6
         *         lowercase ASCII letters
         */
        public Builder allocate(String component) {
            Objects.requireNonNull(component, "component");
            if (!TokenFormat.isValidComponent(component)) {
                throw new IllegalArgumentException(
                        "Component must be 3-6 lowercase ASCII letters: \"" + component + "\"");
            }
            components.add(component);
            return this;
        }

        public StaticComponentRegistry build() {
            if (components.isEmpty()) {
                throw new IllegalStateException("At least one component required");
            }
            return new StaticComponentRegistry(components);
        }
    }
}
