package com.turbonbt.nbt;

/**
 * Signed long value.
 */
public final class LongTag extends NumericTag {

    private final long value;

    public LongTag(long value) {
        this.value = value;
    }

    public long getValue() {
        return value;
    }

    @Override
    public Number getAsNumber() {
        return value;
    }

    @Override
    public TagType getType() {
        return TagType.LONG;
    }

    @Override
    public LongTag copy() {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LongTag)) return false;
        return value == ((LongTag) o).value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }
}
