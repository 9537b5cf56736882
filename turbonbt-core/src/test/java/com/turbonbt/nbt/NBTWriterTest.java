package com.turbonbt.nbt;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for binary NBT encoding.
 */
public class NBTWriterTest {

    /** The classic hello_world.nbt: {"hello world": {name: "Bananrama"}} */
    private static final byte[] HELLO_WORLD = {
            0x0A, 0x00, 0x0B, 'h', 'e', 'l', 'l', 'o', ' ', 'w', 'o', 'r', 'l', 'd',
            0x08, 0x00, 0x04, 'n', 'a', 'm', 'e',
            0x00, 0x09, 'B', 'a', 'n', 'a', 'n', 'r', 'a', 'm', 'a',
            0x00
    };

    private static NamedTag read(byte[] data) throws IOException {
        return new NBTReader(new ByteArrayInputStream(data)).readNamedTag();
    }

    @Test
    void testWriteProducesIdenticalBytes() throws IOException {
        NamedTag root = read(HELLO_WORLD);
        assertArrayEquals(HELLO_WORLD, NBTIO.toBytes(root));
    }

    @Test
    void testStringTooLongIsRejectedOnWrite() {
        String longString = "x".repeat(NBTWriter.MAX_STRING_BYTES + 1);
        CompoundTag compound = new CompoundTag();
        compound.putString("text", longString);

        NBTException e = assertThrows(NBTException.class, () -> NBTIO.toBytes(NamedTag.unnamed(compound)));
        assertEquals(NBTException.Kind.STRING_TOO_LONG, e.getKind());
    }

    @Test
    void testMaximumLengthNameAndString() throws IOException {
        String longest = "n".repeat(NBTWriter.MAX_STRING_BYTES);
        CompoundTag compound = new CompoundTag();
        compound.putString(longest, longest);

        NamedTag root = new NamedTag(longest, compound);
        assertEquals(root, read(NBTIO.toBytes(root)));
    }

    @Test
    void testUtf8Strings() throws IOException {
        CompoundTag compound = new CompoundTag();
        compound.putString("größe", "日本語");

        byte[] data = NBTIO.toBytes(new NamedTag("wörld", compound));
        NamedTag root = read(data);

        assertEquals("wörld", root.name());
        assertEquals("日本語", root.compound().getString("größe"));
        // u16 length counts encoded bytes, not characters
        assertEquals("wörld".getBytes(StandardCharsets.UTF_8).length, ((data[1] & 0xFF) << 8) | (data[2] & 0xFF));
    }

    @Test
    void testEveryKindRoundTrips() throws IOException {
        CompoundTag compound = new CompoundTag();
        compound.putByte("byte", Byte.MIN_VALUE);
        compound.putShort("short", Short.MAX_VALUE);
        compound.putInt("int", -123456789);
        compound.putLong("long", Long.MIN_VALUE);
        compound.putFloat("float", Float.NaN);
        compound.putDouble("double", -0.0);
        compound.putByteArray("bytes", new byte[]{-1, 0, 1});
        compound.putString("string", "");
        compound.put("list", ListTag.of(TagType.LONG, new LongTag(1L), new LongTag(2L)));
        compound.put("empty", ListTag.empty());
        compound.put("nested", ListTag.of(TagType.LIST, ListTag.of(TagType.BYTE, new ByteTag((byte) 1)), ListTag.empty()));
        compound.put("compound", new CompoundTag());
        compound.putIntArray("ints", new int[0]);
        compound.putLongArray("longs", new long[]{Long.MAX_VALUE});

        NamedTag decoded = read(NBTIO.toBytes(new NamedTag("root", compound)));

        assertEquals("root", decoded.name());
        assertEquals(compound, decoded.tag());
        assertEquals(TagType.END, decoded.compound().getList("empty", TagType.END).orElseThrow().getElementType());
    }

    @Test
    void testNonCompoundRoot() throws IOException {
        NamedTag root = new NamedTag("n", new IntTag(7));
        assertEquals(root, read(NBTIO.toBytes(root)));
    }
}
