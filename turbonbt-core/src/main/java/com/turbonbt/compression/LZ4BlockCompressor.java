package com.turbonbt.compression;

import net.jpountz.lz4.LZ4BlockInputStream;
import net.jpountz.lz4.LZ4BlockOutputStream;
import net.jpountz.lz4.LZ4Compressor;
import net.jpountz.lz4.LZ4Factory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * LZ4 implementation, scheme 4.
 * Uses the lz4-java block stream framing, which is what newer game versions write.
 */
public class LZ4BlockCompressor implements Compressor {
    
    private static final int BLOCK_SIZE = 1 << 16;
    
    private final LZ4Compressor compressor;
    private final int level;
    
    public LZ4BlockCompressor(int level) {
        this.level = Math.max(1, Math.min(17, level));
        LZ4Factory factory = LZ4Factory.fastestInstance();
        
        // Use fast compressor for levels 1-6, high compressor for 7+
        if (this.level <= 6) {
            this.compressor = factory.fastCompressor();
        } else {
            this.compressor = factory.highCompressor(this.level);
        }
    }
    
    @Override
    public byte[] compress(byte[] data) throws CompressionException {
        ByteArrayOutputStream outputStream = new ByteArrayOutputStream(Math.max(64, data.length / 2));
        try (OutputStream lz4 = new LZ4BlockOutputStream(outputStream, BLOCK_SIZE, compressor)) {
            lz4.write(data);
        } catch (IOException e) {
            throw new CompressionException("LZ4 compression failed", e);
        }
        return outputStream.toByteArray();
    }
    
    @Override
    public byte[] decompress(byte[] compressed) throws CompressionException {
        try (InputStream lz4 = new LZ4BlockInputStream(new ByteArrayInputStream(compressed))) {
            return lz4.readAllBytes();
        } catch (IOException | RuntimeException e) {
            throw new CompressionException("LZ4 decompression failed", e);
        }
    }
    
    @Override
    public String getName() {
        return "LZ4";
    }
    
    @Override
    public int getCompressionLevel() {
        return level;
    }
    
    @Override
    public CompressionType getType() {
        return CompressionType.LZ4;
    }
}
