package com.turbonbt.nbt;

import java.util.Arrays;
import java.util.Objects;

/**
 * Length-prefixed array of signed byte values.
 * The backing array is exposed as-is; callers may modify it in place.
 */
public final class ByteArrayTag extends Tag {

    private final byte[] value;

    public ByteArrayTag(byte[] value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public byte[] getValue() {
        return value;
    }

    public int size() {
        return value.length;
    }

    @Override
    public TagType getType() {
        return TagType.BYTE_ARRAY;
    }

    @Override
    public ByteArrayTag copy() {
        return new ByteArrayTag(value.clone());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ByteArrayTag)) return false;
        return Arrays.equals(value, ((ByteArrayTag) o).value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }
}
