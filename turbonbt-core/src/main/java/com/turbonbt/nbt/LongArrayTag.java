package com.turbonbt.nbt;

import java.util.Arrays;
import java.util.Objects;

/**
 * Length-prefixed array of signed long values.
 * The backing array is exposed as-is; callers may modify it in place.
 */
public final class LongArrayTag extends Tag {

    private final long[] value;

    public LongArrayTag(long[] value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public long[] getValue() {
        return value;
    }

    public int size() {
        return value.length;
    }

    @Override
    public TagType getType() {
        return TagType.LONG_ARRAY;
    }

    @Override
    public LongArrayTag copy() {
        return new LongArrayTag(value.clone());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LongArrayTag)) return false;
        return Arrays.equals(value, ((LongArrayTag) o).value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }
}
