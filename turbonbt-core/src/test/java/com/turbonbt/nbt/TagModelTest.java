package com.turbonbt.nbt;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the in-memory tag model: list kind checks, compound ordering and equality.
 */
public class TagModelTest {

    @Test
    void testListRejectsForeignKind() {
        ListTag list = new ListTag(TagType.INT);
        list.add(new IntTag(1));

        TagTypeMismatchException e = assertThrows(TagTypeMismatchException.class,
                () -> list.add(new ShortTag((short) 2)));
        assertEquals(TagType.INT, e.getExpected());
        assertEquals(TagType.SHORT, e.getActual());

        assertThrows(TagTypeMismatchException.class, () -> list.set(0, new StringTag("x")));
        assertThrows(TagTypeMismatchException.class, () -> list.add(0, new LongTag(3L)));
        assertEquals(1, list.size());
        assertEquals(new IntTag(1), list.get(0));
    }

    @Test
    void testEndListStaysEmpty() {
        ListTag list = ListTag.empty();
        assertEquals(TagType.END, list.getElementType());
        assertTrue(list.isEmpty());
        assertThrows(TagTypeMismatchException.class, () -> list.add(new IntTag(1)));
    }

    @Test
    void testListConstructorChecksEveryElement() {
        assertThrows(TagTypeMismatchException.class,
                () -> new ListTag(TagType.STRING, List.of(new StringTag("a"), new IntTag(1))));
    }

    @Test
    void testListViewIsReadOnly() {
        ListTag list = ListTag.of(TagType.INT, new IntTag(1), new IntTag(2));
        assertThrows(UnsupportedOperationException.class, () -> list.getValue().add(new IntTag(3)));
        assertThrows(UnsupportedOperationException.class, () -> list.getValue().add(new StringTag("bypass")));
    }

    @Test
    void testCompoundKeepsInsertionOrderAndReplacesInPlace() {
        CompoundTag compound = new CompoundTag();
        compound.putInt("zeta", 1);
        compound.putString("alpha", "a");
        compound.putByte("mid", (byte) 3);

        Tag previous = compound.put("zeta", new LongTag(9L));

        assertEquals(new IntTag(1), previous);
        assertEquals(List.of("zeta", "alpha", "mid"), List.copyOf(compound.keySet()));
        assertEquals(3, compound.size());
        assertEquals(9L, compound.getLong("zeta"));
    }

    @Test
    void testTypedGettersFallBackToDefaults() {
        CompoundTag compound = new CompoundTag();
        compound.putShort("short", (short) 7);

        assertEquals(0, compound.getInt("short"), "kind-sensitive getter");
        assertEquals(7, compound.getShort("short"));
        assertEquals("", compound.getString("missing"));
        assertEquals(0, compound.getByteArray("missing").length);
        assertFalse(compound.getCompound("short").isPresent());
        assertTrue(compound.contains("short", TagType.SHORT));
        assertFalse(compound.contains("short", TagType.INT));
    }

    @Test
    void testGetListMatchesElementType() {
        CompoundTag compound = new CompoundTag();
        compound.put("ints", ListTag.of(TagType.INT, new IntTag(1)));
        compound.put("empty", ListTag.empty());

        assertTrue(compound.getList("ints", TagType.INT).isPresent());
        assertFalse(compound.getList("ints", TagType.STRING).isPresent());
        assertTrue(compound.getList("empty", TagType.COMPOUND).isPresent(), "empty list fits any element type");
    }

    @Test
    void testEqualityIsKindSensitive() {
        assertNotEquals(new ByteTag((byte) 5), new ShortTag((short) 5));
        assertNotEquals(new IntTag(5), new LongTag(5L));
        assertEquals(new DoubleTag(Double.NaN), new DoubleTag(Double.NaN));
        assertNotEquals(new FloatTag(0.0f), new FloatTag(-0.0f));
        assertEquals(new IntArrayTag(new int[]{1, 2}), new IntArrayTag(new int[]{1, 2}));
        assertNotEquals(new ListTag(TagType.INT), new ListTag(TagType.STRING));
    }

    @Test
    void testCopyIsDeep() {
        CompoundTag inner = new CompoundTag();
        inner.putIntArray("data", new int[]{1, 2, 3});
        CompoundTag root = new CompoundTag();
        root.put("inner", inner);
        root.put("list", ListTag.of(TagType.COMPOUND, inner.copy()));

        CompoundTag copy = root.copy();
        assertEquals(root, copy);

        copy.getCompound("inner").orElseThrow().getIntArray("data")[0] = 42;
        copy.getList("list", TagType.COMPOUND).orElseThrow().getCompound(0).putBoolean("dirty", true);

        assertEquals(1, inner.getIntArray("data")[0]);
        assertFalse(root.getList("list", TagType.COMPOUND).orElseThrow().getCompound(0).contains("dirty"));
    }

    @Test
    void testNumericAccessors() {
        assertEquals(-1L, new ByteTag((byte) -1).getAsLong());
        assertEquals(300, new ShortTag((short) 300).getAsInt());
        assertEquals(1.5, new FloatTag(1.5f).getAsDouble(), 0.0);
        assertTrue(ByteTag.of(true).getAsBoolean());
        assertEquals(0, ByteTag.of(false).getValue());
    }

    @Test
    void testTagTypeLookup() {
        assertEquals(TagType.LONG_ARRAY, TagType.byId(12));
        assertNull(TagType.byId(13));
        assertNull(TagType.byId(-1));
        assertEquals("TAG_Compound", TagType.COMPOUND.getDisplayName());
    }

    @Test
    void testToStringUsesSnbt() {
        CompoundTag compound = new CompoundTag();
        compound.putString("name", "Bananrama");
        assertEquals("{name:\"Bananrama\"}", compound.toString());
    }
}
