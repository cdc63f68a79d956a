package de.mirkosertic.querywarmup.util;

import org.jspecify.annotations.Nullable;

import java.util.Objects;
import java.util.function.Function;

/**
 * One end of an interval: open ended, inclusive or exclusive.
 *
 * @param <T> the type of the bound value
 */
public sealed interface Bound<T> permits Bound.Unbounded, Bound.Included, Bound.Excluded {

    record Unbounded<T>() implements Bound<T> {
        @Override
        public String toString() {
            return "Unbounded";
        }
    }

    record Included<T>(T value) implements Bound<T> {
        public Included {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String toString() {
            return "Included(" + value + ")";
        }
    }

    record Excluded<T>(T value) implements Bound<T> {
        public Excluded {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String toString() {
            return "Excluded(" + value + ")";
        }
    }

    static <T> Bound<T> unbounded() {
        return new Unbounded<>();
    }

    static <T> Bound<T> included(final T value) {
        return new Included<>(value);
    }

    static <T> Bound<T> excluded(final T value) {
        return new Excluded<>(value);
    }

    default boolean isUnbounded() {
        return this instanceof Unbounded;
    }

    /**
     * Transforms the bound value, keeping the bound kind.
     */
    default <R, E extends Exception> Bound<R> map(final ThrowingFunction<T, R, E> mapper) throws E {
        if (this instanceof Included<T> included) {
            return new Included<>(mapper.apply(included.value()));
        }
        if (this instanceof Excluded<T> excluded) {
            return new Excluded<>(mapper.apply(excluded.value()));
        }
        return new Unbounded<>();
    }

    /**
     * Returns the bound value, or null if this bound is open.
     */
    default @Nullable T valueOrNull() {
        if (this instanceof Included<T> included) {
            return included.value();
        }
        if (this instanceof Excluded<T> excluded) {
            return excluded.value();
        }
        return null;
    }

    /**
     * A {@link Function} that may throw a checked exception.
     */
    @FunctionalInterface
    interface ThrowingFunction<T, R, E extends Exception> {
        R apply(T value) throws E;
    }
}
