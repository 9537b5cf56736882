package com.turbonbt.compression;

/**
 * Interface for the chunk compression schemes of the region format.
 * Each implementation produces exactly the bytes the game stores for its scheme id,
 * with no extra framing.
 */
public interface Compressor {
    
    /**
     * Compress raw data.
     *
     * @param data Raw bytes to compress
     * @return Compressed bytes
     * @throws CompressionException if compression fails
     */
    byte[] compress(byte[] data) throws CompressionException;
    
    /**
     * Decompress compressed data.
     *
     * @param compressed Compressed bytes
     * @return Decompressed raw bytes
     * @throws CompressionException if the data is corrupt or truncated
     */
    byte[] decompress(byte[] compressed) throws CompressionException;
    
    /**
     * Get the name of this compression algorithm.
     *
     * @return Algorithm name (e.g., "Zlib", "GZip")
     */
    String getName();
    
    /**
     * Get the compression level used by this compressor.
     *
     * @return Compression level (1-9 for deflate based schemes)
     */
    int getCompressionLevel();
    
    /**
     * Get the scheme this compressor implements.
     * Its id is the byte written in front of each chunk payload.
     */
    CompressionType getType();
}
