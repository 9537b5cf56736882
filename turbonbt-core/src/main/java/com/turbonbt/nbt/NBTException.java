package com.turbonbt.nbt;

import java.io.IOException;

/**
 * Exception thrown when an NBT stream cannot be decoded or a tag cannot be encoded.
 * The {@link Kind} tells malformed input apart from truncated input.
 *
 * @author TurboNBT
 */
public class NBTException extends IOException {

    public enum Kind {
        /** Stream ended in the middle of a value. */
        UNEXPECTED_EOF,
        /** Type id outside 0-12, or TAG_End where a value is required. */
        UNKNOWN_TAG_KIND,
        /** Array or list count below zero. */
        NEGATIVE_LENGTH,
        /** Lists and compounds nested deeper than the reader allows. */
        DEPTH_EXCEEDED,
        /** Name or string longer than 65535 bytes once encoded. */
        STRING_TOO_LONG
    }

    private final Kind kind;

    public NBTException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public NBTException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public String toString() {
        return "NBTException{kind=" + kind + ", message='" + getMessage() + "'}";
    }
}
