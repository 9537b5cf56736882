package com.turbonbt.nbt;

/**
 * Signed short value.
 */
public final class ShortTag extends NumericTag {

    private final short value;

    public ShortTag(short value) {
        this.value = value;
    }

    public short getValue() {
        return value;
    }

    @Override
    public Number getAsNumber() {
        return value;
    }

    @Override
    public TagType getType() {
        return TagType.SHORT;
    }

    @Override
    public ShortTag copy() {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ShortTag)) return false;
        return value == ((ShortTag) o).value;
    }

    @Override
    public int hashCode() {
        return Short.hashCode(value);
    }
}
