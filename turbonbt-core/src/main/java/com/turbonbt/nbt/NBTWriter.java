package com.turbonbt.nbt;

import java.io.DataOutput;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Encodes a {@link Tag} tree as big-endian NBT, byte for byte the inverse of {@link NBTReader}.
 * <p>
 * Trees are assumed valid: {@link ListTag} already rejects foreign elements on insertion.
 * The only encoding failure is a name or string too long for its 16-bit length prefix.
 *
 * @author TurboNBT
 * @version 1.0.0
 */
public final class NBTWriter {

    public static final int MAX_STRING_BYTES = 0xFFFF;

    private final DataOutput out;

    public NBTWriter(OutputStream out) {
        this(out instanceof DataOutput ? (DataOutput) out : new DataOutputStream(out));
    }

    public NBTWriter(DataOutput out) {
        this.out = out;
    }

    public void writeNamedTag(NamedTag root) throws IOException {
        writeNamedTag(root.name(), root.tag());
    }

    /**
     * Write a named tag: type id, name, payload.
     */
    public void writeNamedTag(String name, Tag tag) throws IOException {
        out.writeByte(tag.getType().getId());
        writeString(name);
        writeTag(tag);
    }

    /**
     * Write only the payload of a tag, as stored inside a list.
     */
    public void writeTag(Tag tag) throws IOException {
        switch (tag.getType()) {
            case BYTE -> out.writeByte(((ByteTag) tag).getValue());
            case SHORT -> out.writeShort(((ShortTag) tag).getValue());
            case INT -> out.writeInt(((IntTag) tag).getValue());
            case LONG -> out.writeLong(((LongTag) tag).getValue());
            case FLOAT -> out.writeFloat(((FloatTag) tag).getValue());
            case DOUBLE -> out.writeDouble(((DoubleTag) tag).getValue());
            case BYTE_ARRAY -> {
                byte[] data = ((ByteArrayTag) tag).getValue();
                out.writeInt(data.length);
                out.write(data);
            }
            case STRING -> writeString(((StringTag) tag).getValue());
            case LIST -> writeList((ListTag) tag);
            case COMPOUND -> writeCompound((CompoundTag) tag);
            case INT_ARRAY -> {
                int[] data = ((IntArrayTag) tag).getValue();
                out.writeInt(data.length);
                for (int value : data) {
                    out.writeInt(value);
                }
            }
            case LONG_ARRAY -> {
                long[] data = ((LongArrayTag) tag).getValue();
                out.writeInt(data.length);
                for (long value : data) {
                    out.writeLong(value);
                }
            }
            case END -> throw new IllegalStateException("TAG_End has no payload");
        }
    }

    private void writeString(String value) throws IOException {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > MAX_STRING_BYTES) {
            throw new NBTException(NBTException.Kind.STRING_TOO_LONG,
                    "String of " + bytes.length + " bytes exceeds " + MAX_STRING_BYTES);
        }
        out.writeShort(bytes.length);
        out.write(bytes);
    }

    private void writeList(ListTag list) throws IOException {
        out.writeByte(list.getElementType().getId());
        out.writeInt(list.size());
        for (Tag element : list) {
            writeTag(element);
        }
    }

    private void writeCompound(CompoundTag compound) throws IOException {
        for (Map.Entry<String, Tag> entry : compound.getValue().entrySet()) {
            writeNamedTag(entry.getKey(), entry.getValue());
        }
        out.writeByte(TagType.END.getId());
    }
}
