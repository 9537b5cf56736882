package com.turbonbt.nbt;

import java.util.Arrays;
import java.util.Objects;

/**
 * Length-prefixed array of signed int values.
 * The backing array is exposed as-is; callers may modify it in place.
 */
public final class IntArrayTag extends Tag {

    private final int[] value;

    public IntArrayTag(int[] value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public int[] getValue() {
        return value;
    }

    public int size() {
        return value.length;
    }

    @Override
    public TagType getType() {
        return TagType.INT_ARRAY;
    }

    @Override
    public IntArrayTag copy() {
        return new IntArrayTag(value.clone());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IntArrayTag)) return false;
        return Arrays.equals(value, ((IntArrayTag) o).value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }
}
