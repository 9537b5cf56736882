package com.turbonbt.nbt;

/**
 * Signed byte value. Also used for booleans (0 or 1), the format has no boolean kind.
 */
public final class ByteTag extends NumericTag {

    private final byte value;

    public ByteTag(byte value) {
        this.value = value;
    }

    public static ByteTag of(boolean value) {
        return new ByteTag((byte) (value ? 1 : 0));
    }

    public byte getValue() {
        return value;
    }

    public boolean getAsBoolean() {
        return value != 0;
    }

    @Override
    public Number getAsNumber() {
        return value;
    }

    @Override
    public TagType getType() {
        return TagType.BYTE;
    }

    @Override
    public ByteTag copy() {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ByteTag)) return false;
        return value == ((ByteTag) o).value;
    }

    @Override
    public int hashCode() {
        return Byte.hashCode(value);
    }
}
