package com.turbonbt.compression;

/**
 * Thrown when a chunk declares a compression scheme id this library cannot handle.
 */
public class UnsupportedCompressionException extends CompressionException {

    private final int compressionId;

    public UnsupportedCompressionException(int compressionId) {
        super("Unsupported chunk compression type: " + compressionId);
        this.compressionId = compressionId;
    }

    public int getCompressionId() {
        return compressionId;
    }
}
