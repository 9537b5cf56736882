package com.turbonbt.compression;

/**
 * Statistics for compression operations.
 * Byte counters cover both directions: {@code rawBytes} is uncompressed data fed to
 * or produced by a compressor, {@code compressedBytes} the matching compressed side.
 */
public record CompressionStats(
    long compressionCount,
    long decompressionCount,
    long rawBytes,
    long compressedBytes,
    String primaryAlgorithm
) {
    
    public double getCompressionRatio() {
        if (rawBytes == 0) return 0.0;
        return (double) compressedBytes / rawBytes;
    }
    
    @Override
    public String toString() {
        return String.format("""
            Compression Statistics:
              Algorithm: %s
              Compressions: %,d
              Decompressions: %,d
              Compression Ratio: %.2f%%
            """,
            primaryAlgorithm,
            compressionCount,
            decompressionCount,
            getCompressionRatio() * 100
        );
    }
}
