package com.turbonbt.nbt;

/**
 * 32-bit IEEE-754 value. Equality compares bit patterns, so NaN equals NaN.
 */
public final class FloatTag extends NumericTag {

    private final float value;

    public FloatTag(float value) {
        this.value = value;
    }

    public float getValue() {
        return value;
    }

    @Override
    public Number getAsNumber() {
        return value;
    }

    @Override
    public TagType getType() {
        return TagType.FLOAT;
    }

    @Override
    public FloatTag copy() {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FloatTag)) return false;
        return Float.floatToIntBits(value) == Float.floatToIntBits(((FloatTag) o).value);
    }

    @Override
    public int hashCode() {
        return Float.hashCode(value);
    }
}
