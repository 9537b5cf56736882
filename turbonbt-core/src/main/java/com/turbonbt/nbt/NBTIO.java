package com.turbonbt.nbt;

import com.turbonbt.config.TurboNBTConfig;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Reads and writes standalone NBT files such as {@code level.dat}.
 * <p>
 * Reading detects gzip framing from the two magic bytes and inflates transparently;
 * anything else is read as raw NBT. Writing to files and streams always applies gzip.
 * The byte-array helpers produce raw NBT for the region layer, which compresses
 * each chunk itself.
 *
 * @author TurboNBT
 * @version 1.0.0
 */
public final class NBTIO {

    private static final int GZIP_MAGIC_0 = 0x1F;
    private static final int GZIP_MAGIC_1 = 0x8B;
    private static final int BUFFER_SIZE = 8192;

    private NBTIO() {
        throw new AssertionError("NBTIO should not be instantiated");
    }

    /**
     * Read a root tag from a file, gzip-compressed or not.
     */
    public static NamedTag read(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        }
    }

    /**
     * Read a root tag from a stream, gzip-compressed or not.
     * The stream is not closed.
     */
    public static NamedTag read(InputStream in) throws IOException {
        BufferedInputStream buffered = new BufferedInputStream(in, BUFFER_SIZE);
        InputStream source = isGzipped(buffered) ? new GZIPInputStream(buffered, BUFFER_SIZE) : buffered;
        try {
            return new NBTReader(source, TurboNBTConfig.current().getMaxDepth()).readNamedTag();
        } catch (EOFException e) {
            // Truncated gzip framing
            throw new NBTException(NBTException.Kind.UNEXPECTED_EOF, "Unexpected end of compressed NBT data", e);
        }
    }

    public static CompoundTag readCompound(Path path) throws IOException {
        return asCompound(read(path));
    }

    private static CompoundTag asCompound(NamedTag root) throws NBTException {
        if (!(root.tag() instanceof CompoundTag compound)) {
            throw new NBTException(NBTException.Kind.UNKNOWN_TAG_KIND,
                    "Expected TAG_Compound root, found " + root.tag().getType().getDisplayName());
        }
        return compound;
    }

    private static boolean isGzipped(BufferedInputStream in) throws IOException {
        in.mark(2);
        int first = in.read();
        int second = in.read();
        in.reset();
        return first == GZIP_MAGIC_0 && second == GZIP_MAGIC_1;
    }

    /**
     * Check whether data starts with the gzip magic bytes.
     */
    public static boolean isGzipped(byte[] data) {
        return data.length >= 2 && (data[0] & 0xFF) == GZIP_MAGIC_0 && (data[1] & 0xFF) == GZIP_MAGIC_1;
    }

    /**
     * Write a root tag to a file with gzip framing, replacing any existing file.
     * The whole file is encoded in memory first, so an encoding failure leaves
     * the existing file untouched.
     */
    public static void write(NamedTag root, Path path) throws IOException {
        ByteArrayOutputStream encoded = new ByteArrayOutputStream();
        write(root, encoded);
        Files.write(path, encoded.toByteArray());
    }

    /**
     * Write a root tag to a stream with gzip framing.
     * The gzip trailer is written but the stream itself is left open.
     */
    public static void write(NamedTag root, OutputStream out) throws IOException {
        GZIPOutputStream gzip = new GZIPOutputStream(new NonClosingOutputStream(out), BUFFER_SIZE);
        try (BufferedOutputStream buffered = new BufferedOutputStream(gzip, BUFFER_SIZE)) {
            new NBTWriter(buffered).writeNamedTag(root);
        }
    }

    /**
     * Encode a root tag to raw, uncompressed NBT bytes.
     */
    public static byte[] toBytes(NamedTag root) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        new NBTWriter(out).writeNamedTag(root);
        return out.toByteArray();
    }

    /**
     * Decode raw, uncompressed NBT bytes.
     */
    public static NamedTag fromBytes(byte[] data) throws IOException {
        return fromBytes(data, TurboNBTConfig.current().getMaxDepth());
    }

    public static NamedTag fromBytes(byte[] data, int maxDepth) throws IOException {
        return new NBTReader(new ByteArrayInputStream(data), maxDepth).readNamedTag();
    }

    private static final class NonClosingOutputStream extends java.io.FilterOutputStream {

        NonClosingOutputStream(OutputStream out) {
            super(out);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            out.write(b, off, len);
        }

        @Override
        public void close() throws IOException {
            flush();
        }
    }
}
