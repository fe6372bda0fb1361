package org.rungforge.logic.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class DerivedTest {

    @Test
    void get_computesOnceUntilInvalidated() {
        // Arrange
        AtomicInteger calls = new AtomicInteger();
        Derived<Integer> derived = new Derived<>();

        // Act & Assert
        assertThat(derived.getState()).isEqualTo(Derived.State.NOT_COMPUTED);
        assertThat(derived.get(calls::incrementAndGet)).isEqualTo(1);
        assertThat(derived.get(calls::incrementAndGet)).isEqualTo(1);
        assertThat(derived.isComputed()).isTrue();

        derived.invalidate();
        assertThat(derived.getState()).isEqualTo(Derived.State.INVALID);
        assertThat(derived.get(calls::incrementAndGet)).isEqualTo(2);
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    void invalidate_keepsNeverComputedState() {
        Derived<String> derived = new Derived<>();

        derived.invalidate();

        assertThat(derived.getState()).isEqualTo(Derived.State.NOT_COMPUTED);
    }

    @Test
    void get_memoizesNullValues() {
        AtomicInteger calls = new AtomicInteger();
        Derived<String> derived = new Derived<>();

        derived.get(() -> {
            calls.incrementAndGet();
            return null;
        });
        derived.get(() -> {
            calls.incrementAndGet();
            return null;
        });

        assertThat(calls.get()).isEqualTo(1);
    }
}
