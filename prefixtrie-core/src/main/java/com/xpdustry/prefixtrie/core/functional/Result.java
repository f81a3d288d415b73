package com.xpdustry.prefixtrie.core.functional;

public sealed interface Result<V, E> {

    static <V, E> Result<V, E> success(final V value) {
        return new Success<>(value);
    }

    static <V, E> Result<V, E> failure(final E error) {
        return new Failure<>(error);
    }

    V value();

    E error();

    default boolean isSuccess() {
        return this instanceof Success<V, E>;
    }

    record Success<V, E>(V value) implements Result<V, E> {
        @Override
        public E error() {
            throw new IllegalStateException("This success has no error");
        }
    }

    record Failure<V, E>(E error) implements Result<V, E> {
        @Override
        public V value() {
            throw new IllegalStateException("This failure has no value: " + this.error);
        }
    }
}
