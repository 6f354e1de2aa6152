package dk.cloudcreate.bookstore.common.types;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * {@link SingleValueType} for identifiers and names. Blank values are rejected
 *
 * @param <CONCRETE_TYPE> the concrete sub type
 */
public abstract class CharSequenceType<CONCRETE_TYPE extends CharSequenceType<CONCRETE_TYPE>> extends SingleValueType<String, CONCRETE_TYPE> implements CharSequence {
    protected CharSequenceType(CharSequence value) {
        super(value == null ? null : value.toString());
        checkArgument(!this.value.isBlank(), "%s value cannot be blank", getClass().getSimpleName());
    }

    @Override
    public int length() {
        return value.length();
    }

    @Override
    public char charAt(int index) {
        return value.charAt(index);
    }

    @Override
    public CharSequence subSequence(int start, int end) {
        return value.subSequence(start, end);
    }
}
