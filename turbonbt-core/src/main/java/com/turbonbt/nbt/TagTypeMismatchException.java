package com.turbonbt.nbt;

/**
 * Thrown when a tag of the wrong kind is put into a {@link ListTag}.
 */
public class TagTypeMismatchException extends IllegalArgumentException {

    private final TagType expected;
    private final TagType actual;

    public TagTypeMismatchException(TagType expected, TagType actual) {
        super("List holds " + expected.getDisplayName() + ", got " + actual.getDisplayName());
        this.expected = expected;
        this.actual = actual;
    }

    public TagType getExpected() {
        return expected;
    }

    public TagType getActual() {
        return actual;
    }
}
