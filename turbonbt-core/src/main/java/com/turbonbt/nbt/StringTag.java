package com.turbonbt.nbt;

import java.util.Objects;

/**
 * Text value. Encoded as UTF-8 with an unsigned 16-bit byte length; modified UTF-8
 * (the encoding the game itself writes) is not reproduced, so supplementary characters
 * and embedded NUL are stored in their standard UTF-8 form.
 */
public final class StringTag extends Tag {

    private final String value;

    public StringTag(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public String getValue() {
        return value;
    }

    @Override
    public TagType getType() {
        return TagType.STRING;
    }

    @Override
    public StringTag copy() {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StringTag)) return false;
        return value.equals(((StringTag) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }
}
