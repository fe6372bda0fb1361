package org.rungforge.logic.model;

import java.util.function.Supplier;

/**
 * A memoized value derived from the state of its owner.
 * <p>
 * The value is computed on first access and kept until {@link #invalidate()} discards it. A
 * computed value is never updated in place.
 *
 * @param <T> The type of the value.
 */
public final class Derived<T> {

    /**
     * The lifecycle of a derived value.
     */
    public enum State {
        /** Never computed. */
        NOT_COMPUTED,
        /** Computed and current. */
        COMPUTED,
        /** Computed once, then discarded; recomputed on the next access. */
        INVALID
    }

    private State state = State.NOT_COMPUTED;
    private T value;

    /**
     * Returns the value, computing it with the given supplier if it is not current.
     *
     * @param supplier Computes the value.
     * @return The current value.
     */
    public T get(Supplier<T> supplier) {
        if (state != State.COMPUTED) {
            value = supplier.get();
            state = State.COMPUTED;
        }
        return value;
    }

    /**
     * Discards the value.
     */
    public void invalidate() {
        if (state == State.COMPUTED) {
            value = null;
            state = State.INVALID;
        }
    }

    public State getState() {
        return state;
    }

    public boolean isComputed() {
        return state == State.COMPUTED;
    }
}
