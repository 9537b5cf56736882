package com.turbonbt.nbt.snbt;

/**
 * Thrown when SNBT text cannot be parsed into a tag.
 *
 * @author TurboNBT
 * @version 1.0.0
 */
public class SnbtParseException extends Exception {

    private final int position;

    public SnbtParseException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    public SnbtParseException(String message, int position, Throwable cause) {
        super(message + " at position " + position, cause);
        this.position = position;
    }

    /**
     * Offset into the input where parsing failed.
     */
    public int getPosition() {
        return position;
    }
}
