package dk.cloudcreate.bookstore.common.types;

import java.io.Serializable;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Base class for semantic types that wrap a single non-null value, such as {@link TenantId} or {@link EventId}.<br>
 * Two instances are equal when they are of the same concrete type and wrap equal values.
 *
 * @param <VALUE_TYPE>    the type of the wrapped value
 * @param <CONCRETE_TYPE> the concrete sub type
 */
public abstract class SingleValueType<VALUE_TYPE extends Comparable<VALUE_TYPE>, CONCRETE_TYPE extends SingleValueType<VALUE_TYPE, CONCRETE_TYPE>>
        implements Serializable, Comparable<CONCRETE_TYPE> {
    protected final VALUE_TYPE value;

    protected SingleValueType(VALUE_TYPE value) {
        this.value = checkNotNull(value, "%s value cannot be null", getClass().getSimpleName());
    }

    public VALUE_TYPE value() {
        return value;
    }

    @Override
    public int compareTo(CONCRETE_TYPE o) {
        return value.compareTo(o.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return value.equals(((SingleValueType<?, ?>) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), value);
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
