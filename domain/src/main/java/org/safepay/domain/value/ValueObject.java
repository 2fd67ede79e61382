package org.safepay.domain.value;

import java.util.Objects;

/// Base class for validated wrappers around a single primitive value.
///
/// Subclasses keep their constructors private and expose a static factory which validates the input, so an
/// instance always holds a value satisfying the subclass invariant. [#value()] projects the wrapper back to
/// the primitive. Two wrappers are equal when they are of the same class and hold equal values.
///
/// @param <T> Type of the wrapped value
public abstract class ValueObject<T> {
    private final T value;

    protected ValueObject(T value) {
        this.value = Objects.requireNonNull(value);
    }

    public T value() {
        return value;
    }

    @Override
    public final boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        return value.equals(((ValueObject<?>) other).value);
    }

    @Override
    public final int hashCode() {
        return Objects.hash(getClass(), value);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + value + "]";
    }
}
