package com.turbonbt.nbt;

/**
 * 64-bit IEEE-754 value. Equality compares bit patterns, so NaN equals NaN.
 */
public final class DoubleTag extends NumericTag {

    private final double value;

    public DoubleTag(double value) {
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    @Override
    public Number getAsNumber() {
        return value;
    }

    @Override
    public TagType getType() {
        return TagType.DOUBLE;
    }

    @Override
    public DoubleTag copy() {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DoubleTag)) return false;
        return Double.doubleToLongBits(value) == Double.doubleToLongBits(((DoubleTag) o).value);
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }
}
