package com.turbonbt.compression;

import java.io.ByteArrayOutputStream;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * Zlib (RFC 1950) implementation, scheme 2.
 * This is what the game writes for chunks by default.
 */
public class ZlibCompressor implements Compressor {
    
    private static final int BUFFER_SIZE = 8192;
    
    private final int level;
    
    public ZlibCompressor(int level) {
        this.level = Math.max(1, Math.min(9, level));
    }
    
    @Override
    public byte[] compress(byte[] data) throws CompressionException {
        Deflater deflater = new Deflater(level);
        try {
            deflater.setInput(data);
            deflater.finish();
            
            ByteArrayOutputStream outputStream = new ByteArrayOutputStream(Math.max(64, data.length / 2)); // Initial estimate
            byte[] buffer = new byte[BUFFER_SIZE];
            
            while (!deflater.finished()) {
                int count = deflater.deflate(buffer);
                outputStream.write(buffer, 0, count);
            }
            
            return outputStream.toByteArray();
        } catch (RuntimeException e) {
            throw new CompressionException("Zlib compression failed", e);
        } finally {
            deflater.end();
        }
    }
    
    @Override
    public byte[] decompress(byte[] compressed) throws CompressionException {
        Inflater inflater = new Inflater();
        try {
            inflater.setInput(compressed);
            
            ByteArrayOutputStream outputStream = new ByteArrayOutputStream(compressed.length * 4);
            byte[] buffer = new byte[BUFFER_SIZE];
            
            while (!inflater.finished()) {
                int count = inflater.inflate(buffer);
                if (count == 0) {
                    if (inflater.needsInput()) {
                        throw new CompressionException("Zlib stream truncated after " + outputStream.size() + " bytes");
                    }
                    if (inflater.needsDictionary()) {
                        throw new CompressionException("Zlib stream requires a preset dictionary");
                    }
                }
                outputStream.write(buffer, 0, count);
            }
            
            return outputStream.toByteArray();
        } catch (DataFormatException e) {
            throw new CompressionException("Zlib decompression failed", e);
        } finally {
            inflater.end();
        }
    }
    
    @Override
    public String getName() {
        return "Zlib";
    }
    
    @Override
    public int getCompressionLevel() {
        return level;
    }
    
    @Override
    public CompressionType getType() {
        return CompressionType.ZLIB;
    }
}
