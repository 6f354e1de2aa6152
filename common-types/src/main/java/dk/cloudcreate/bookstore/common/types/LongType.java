package dk.cloudcreate.bookstore.common.types;

/**
 * {@link SingleValueType} wrapping a <code>long</code>, used for versions and positions
 *
 * @param <CONCRETE_TYPE> the concrete sub type
 */
public abstract class LongType<CONCRETE_TYPE extends LongType<CONCRETE_TYPE>> extends SingleValueType<Long, CONCRETE_TYPE> {
    protected LongType(Long value) {
        super(value);
    }

    public long longValue() {
        return value;
    }

    public boolean isGreaterThan(CONCRETE_TYPE other) {
        return value > other.value;
    }

    public boolean isLessThan(CONCRETE_TYPE other) {
        return value < other.value;
    }
}
