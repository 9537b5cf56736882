package com.turbonbt.nbt;

import java.io.DataInput;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;

/**
 * Decodes big-endian NBT from a byte stream into a {@link Tag} tree.
 * <p>
 * Lists and compounds are read by recursive descent. Each nested container counts
 * against {@code maxDepth} so corrupt or hostile input fails with
 * {@link NBTException.Kind#DEPTH_EXCEEDED} instead of overflowing the stack.
 * A stream that ends mid-value fails with {@link NBTException.Kind#UNEXPECTED_EOF}.
 *
 * @author TurboNBT
 * @version 1.0.0
 */
public final class NBTReader {

    public static final int DEFAULT_MAX_DEPTH = 512;

    // Initial capacity cap, a corrupt count must not allocate up front
    private static final int MAX_INITIAL_LIST_CAPACITY = 1024;

    // Arrays grow as their elements arrive, so a corrupt count fails at end of input
    private static final int MAX_INITIAL_ARRAY_BYTES = 64 * 1024;
    private static final int MAX_INITIAL_ARRAY_ELEMENTS = 8 * 1024;

    private final DataInput in;
    private final int maxDepth;

    public NBTReader(InputStream in) {
        this(in, DEFAULT_MAX_DEPTH);
    }

    public NBTReader(InputStream in, int maxDepth) {
        this(in instanceof DataInput ? (DataInput) in : new DataInputStream(in), maxDepth);
    }

    public NBTReader(DataInput in, int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.in = in;
        this.maxDepth = maxDepth;
    }

    /**
     * Read a named root tag: type id, name, payload.
     *
     * @return Root tag with its name
     * @throws NBTException if the data is malformed or truncated
     * @throws IOException  if the underlying stream fails
     */
    public NamedTag readNamedTag() throws IOException {
        try {
            TagType type = readType();
            if (type == TagType.END) {
                throw new NBTException(NBTException.Kind.UNKNOWN_TAG_KIND, "Root tag cannot be TAG_End");
            }
            String name = readString();
            return new NamedTag(name, readPayload(type, 0));
        } catch (EOFException e) {
            throw truncated(e);
        }
    }

    /**
     * Read an unnamed payload of a known type, as stored inside a list.
     */
    public Tag readTag(TagType type) throws IOException {
        if (type == TagType.END) {
            throw new NBTException(NBTException.Kind.UNKNOWN_TAG_KIND, "TAG_End has no payload");
        }
        try {
            return readPayload(type, 0);
        } catch (EOFException e) {
            throw truncated(e);
        }
    }

    private static NBTException truncated(EOFException cause) {
        return new NBTException(NBTException.Kind.UNEXPECTED_EOF, "Unexpected end of NBT data", cause);
    }

    private TagType readType() throws IOException {
        int id = in.readUnsignedByte();
        TagType type = TagType.byId(id);
        if (type == null) {
            throw new NBTException(NBTException.Kind.UNKNOWN_TAG_KIND, "Unknown NBT tag type: " + id);
        }
        return type;
    }

    private String readString() throws IOException {
        int length = in.readUnsignedShort();
        byte[] bytes = new byte[length];
        in.readFully(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private int readLength(TagType owner) throws IOException {
        int length = in.readInt();
        if (length < 0) {
            throw new NBTException(NBTException.Kind.NEGATIVE_LENGTH,
                    "Negative length " + length + " for " + owner.getDisplayName());
        }
        return length;
    }

    private Tag readPayload(TagType type, int depth) throws IOException {
        switch (type) {
            case BYTE:
                return new ByteTag(in.readByte());
            case SHORT:
                return new ShortTag(in.readShort());
            case INT:
                return new IntTag(in.readInt());
            case LONG:
                return new LongTag(in.readLong());
            case FLOAT:
                return new FloatTag(in.readFloat());
            case DOUBLE:
                return new DoubleTag(in.readDouble());
            case BYTE_ARRAY: {
                return new ByteArrayTag(readByteArray(readLength(type)));
            }
            case STRING:
                return new StringTag(readString());
            case LIST:
                return readList(depth + 1);
            case COMPOUND:
                return readCompound(depth + 1);
            case INT_ARRAY: {
                return new IntArrayTag(readIntArray(readLength(type)));
            }
            case LONG_ARRAY: {
                return new LongArrayTag(readLongArray(readLength(type)));
            }
            case END:
            default:
                throw new NBTException(NBTException.Kind.UNKNOWN_TAG_KIND,
                        "TAG_End is only valid as a compound terminator");
        }
    }

    private void checkDepth(int depth) throws NBTException {
        if (depth > maxDepth) {
            throw new NBTException(NBTException.Kind.DEPTH_EXCEEDED,
                    "NBT nesting exceeds maximum depth of " + maxDepth);
        }
    }

    private ListTag readList(int depth) throws IOException {
        checkDepth(depth);
        TagType elementType = readType();
        int count = readLength(TagType.LIST);
        if (elementType == TagType.END) {
            if (count > 0) {
                throw new NBTException(NBTException.Kind.UNKNOWN_TAG_KIND,
                        "List of TAG_End declares " + count + " elements");
            }
            return ListTag.empty();
        }

        ArrayList<Tag> elements = new ArrayList<>(Math.min(count, MAX_INITIAL_LIST_CAPACITY));
        for (int i = 0; i < count; i++) {
            elements.add(readPayload(elementType, depth));
        }
        return new ListTag(elementType, elements);
    }

    private byte[] readByteArray(int length) throws IOException {
        byte[] data = new byte[Math.min(length, MAX_INITIAL_ARRAY_BYTES)];
        int read = 0;
        while (read < length) {
            if (read == data.length) {
                data = Arrays.copyOf(data, grow(data.length, length));
            }
            in.readFully(data, read, data.length - read);
            read = data.length;
        }
        return data;
    }

    private int[] readIntArray(int length) throws IOException {
        int[] data = new int[Math.min(length, MAX_INITIAL_ARRAY_ELEMENTS)];
        for (int i = 0; i < length; i++) {
            if (i == data.length) {
                data = Arrays.copyOf(data, grow(data.length, length));
            }
            data[i] = in.readInt();
        }
        return data;
    }

    private long[] readLongArray(int length) throws IOException {
        long[] data = new long[Math.min(length, MAX_INITIAL_ARRAY_ELEMENTS)];
        for (int i = 0; i < length; i++) {
            if (i == data.length) {
                data = Arrays.copyOf(data, grow(data.length, length));
            }
            data[i] = in.readLong();
        }
        return data;
    }

    private static int grow(int current, int target) {
        return (int) Math.min(target, (long) current * 2);
    }

    private CompoundTag readCompound(int depth) throws IOException {
        checkDepth(depth);
        CompoundTag compound = new CompoundTag();
        while (true) {
            TagType type = readType();
            if (type == TagType.END) {
                return compound;
            }
            String name = readString();
            compound.put(name, readPayload(type, depth));
        }
    }
}
