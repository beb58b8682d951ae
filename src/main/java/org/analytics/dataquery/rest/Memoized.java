package org.analytics.dataquery.rest;

import java.util.NoSuchElementException;

/**
 * Slot for a value computed at most once: either {@link Pending} or {@link Computed}.
 *
 * @param <T> value type
 */
public sealed interface Memoized<T> permits Memoized.Pending, Memoized.Computed {

    @SuppressWarnings("unchecked")
    static <T> Memoized<T> pending() {
        return (Memoized<T>) Pending.INSTANCE;
    }

    static <T> Memoized<T> computed(T value) {
        return new Computed<>(value);
    }

    boolean isComputed();

    /**
     * @return the computed value
     * @throws NoSuchElementException if nothing was computed yet
     */
    T get();

    final class Pending<T> implements Memoized<T> {

        private static final Pending<?> INSTANCE = new Pending<>();

        private Pending() {
        }

        @Override
        public boolean isComputed() {
            return false;
        }

        @Override
        public T get() {
            throw new NoSuchElementException("Value not computed yet");
        }
    }

    final class Computed<T> implements Memoized<T> {

        private final T value;

        private Computed(T value) {
            this.value = value;
        }

        @Override
        public boolean isComputed() {
            return true;
        }

        @Override
        public T get() {
            return value;
        }
    }
}
