package com.al.clinicalconverter.model.value;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One or many occurrences of a keyed entry, in source order.
 *
 * <p>
 * A key seen once holds {@link One}; the second occurrence promotes it to
 * {@link Many}. {@link #asList()} always returns the occurrences as a list so
 * callers never branch on the variant.
 */
public abstract class Repeated<T> {

    private Repeated() {
    }

    public static <T> Repeated<T> one(T item) {
        return new One<>(item);
    }

    public abstract List<T> asList();

    public abstract boolean isRepeated();

    /**
     * Returns a new instance with {@code item} appended after the existing
     * occurrences.
     */
    public Repeated<T> append(T item) {
        List<T> items = new ArrayList<>(asList());
        items.add(item);
        return new Many<>(items);
    }

    public T first() {
        return asList().get(0);
    }

    public int size() {
        return asList().size();
    }

    public static final class One<T> extends Repeated<T> {

        private final T item;

        private One(T item) {
            this.item = Objects.requireNonNull(item);
        }

        public T get() {
            return item;
        }

        @Override
        public List<T> asList() {
            return List.of(item);
        }

        @Override
        public boolean isRepeated() {
            return false;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof One && item.equals(((One<?>) o).item);
        }

        @Override
        public int hashCode() {
            return item.hashCode();
        }

        @Override
        public String toString() {
            return String.valueOf(item);
        }
    }

    public static final class Many<T> extends Repeated<T> {

        private final List<T> items;

        private Many(List<T> items) {
            this.items = List.copyOf(items);
        }

        @Override
        public List<T> asList() {
            return items;
        }

        @Override
        public boolean isRepeated() {
            return true;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Many && items.equals(((Many<?>) o).items);
        }

        @Override
        public int hashCode() {
            return items.hashCode();
        }

        @Override
        public String toString() {
            return String.valueOf(items);
        }
    }
}
