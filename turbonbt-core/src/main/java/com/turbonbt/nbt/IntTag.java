package com.turbonbt.nbt;

/**
 * Signed int value.
 */
public final class IntTag extends NumericTag {

    private final int value;

    public IntTag(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    @Override
    public Number getAsNumber() {
        return value;
    }

    @Override
    public TagType getType() {
        return TagType.INT;
    }

    @Override
    public IntTag copy() {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IntTag)) return false;
        return value == ((IntTag) o).value;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(value);
    }
}
