package com.turbonbt.compression;

import java.io.IOException;

/**
 * Exception thrown when compression or decompression operations fail.
 */
public class CompressionException extends IOException {
    public CompressionException(String message) {
        super(message);
    }

    public CompressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
