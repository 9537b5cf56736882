package com.turbonbt.compression;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * GZip (RFC 1952) implementation, scheme 1.
 * The game never writes it for chunks any more but still reads it.
 */
public class GzipCompressor implements Compressor {

    private final int level;

    public GzipCompressor(int level) {
        this.level = Math.max(1, Math.min(9, level));
    }

    @Override
    public byte[] compress(byte[] data) throws CompressionException {
        ByteArrayOutputStream outputStream = new ByteArrayOutputStream(Math.max(64, data.length / 2));
        try (OutputStream gzip = new LeveledGZIPOutputStream(outputStream, level)) {
            gzip.write(data);
        } catch (IOException e) {
            throw new CompressionException("GZip compression failed", e);
        }
        return outputStream.toByteArray();
    }

    @Override
    public byte[] decompress(byte[] compressed) throws CompressionException {
        try (InputStream gzip = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return gzip.readAllBytes();
        } catch (IOException e) {
            throw new CompressionException("GZip decompression failed", e);
        }
    }

    @Override
    public String getName() {
        return "GZip";
    }

    @Override
    public int getCompressionLevel() {
        return level;
    }

    @Override
    public CompressionType getType() {
        return CompressionType.GZIP;
    }

    private static final class LeveledGZIPOutputStream extends GZIPOutputStream {
        LeveledGZIPOutputStream(OutputStream out, int level) throws IOException {
            super(out);
            def.setLevel(level);
        }
    }
}
