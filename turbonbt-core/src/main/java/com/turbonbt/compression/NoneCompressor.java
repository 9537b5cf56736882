package com.turbonbt.compression;

/**
 * Scheme 3: payload stored as plain NBT. Never touches an inflater.
 */
public class NoneCompressor implements Compressor {

    @Override
    public byte[] compress(byte[] data) {
        return data;
    }

    @Override
    public byte[] decompress(byte[] compressed) {
        return compressed;
    }

    @Override
    public String getName() {
        return "None";
    }

    @Override
    public int getCompressionLevel() {
        return 0;
    }

    @Override
    public CompressionType getType() {
        return CompressionType.NONE;
    }
}
