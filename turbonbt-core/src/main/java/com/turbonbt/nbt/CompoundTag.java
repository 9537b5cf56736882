package com.turbonbt.nbt;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Insertion-ordered mapping from names to tags.
 * <p>
 * Putting an existing key replaces its value without moving the key, so entries are
 * written back in the order they were first read. Typed getters return a zero/empty
 * default when the key is missing or holds another kind.
 *
 * @author TurboNBT
 * @version 1.0.0
 */
public final class CompoundTag extends Tag {

    private final Map<String, Tag> entries = new LinkedHashMap<>();

    public CompoundTag() {
    }

    /**
     * Put a tag under a name.
     *
     * @return Previous value, or null
     */
    public Tag put(String name, Tag tag) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(tag, "tag");
        return entries.put(name, tag);
    }

    public void putByte(String name, byte value) {
        put(name, new ByteTag(value));
    }

    public void putBoolean(String name, boolean value) {
        put(name, ByteTag.of(value));
    }

    public void putShort(String name, short value) {
        put(name, new ShortTag(value));
    }

    public void putInt(String name, int value) {
        put(name, new IntTag(value));
    }

    public void putLong(String name, long value) {
        put(name, new LongTag(value));
    }

    public void putFloat(String name, float value) {
        put(name, new FloatTag(value));
    }

    public void putDouble(String name, double value) {
        put(name, new DoubleTag(value));
    }

    public void putString(String name, String value) {
        put(name, new StringTag(value));
    }

    public void putByteArray(String name, byte[] value) {
        put(name, new ByteArrayTag(value));
    }

    public void putIntArray(String name, int[] value) {
        put(name, new IntArrayTag(value));
    }

    public void putLongArray(String name, long[] value) {
        put(name, new LongArrayTag(value));
    }

    public Tag get(String name) {
        return entries.get(name);
    }

    public boolean contains(String name) {
        return entries.containsKey(name);
    }

    public boolean contains(String name, TagType type) {
        Tag tag = entries.get(name);
        return tag != null && tag.getType() == type;
    }

    public Tag remove(String name) {
        return entries.remove(name);
    }

    public Set<String> keySet() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    /**
     * Read-only view of the entries in insertion order.
     */
    public Map<String, Tag> getValue() {
        return Collections.unmodifiableMap(entries);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    // Typed getters

    public byte getByte(String name) {
        return get(name) instanceof ByteTag tag ? tag.getValue() : 0;
    }

    public boolean getBoolean(String name) {
        return getByte(name) != 0;
    }

    public short getShort(String name) {
        return get(name) instanceof ShortTag tag ? tag.getValue() : 0;
    }

    public int getInt(String name) {
        return get(name) instanceof IntTag tag ? tag.getValue() : 0;
    }

    public long getLong(String name) {
        return get(name) instanceof LongTag tag ? tag.getValue() : 0L;
    }

    public float getFloat(String name) {
        return get(name) instanceof FloatTag tag ? tag.getValue() : 0.0f;
    }

    public double getDouble(String name) {
        return get(name) instanceof DoubleTag tag ? tag.getValue() : 0.0;
    }

    public String getString(String name) {
        return get(name) instanceof StringTag tag ? tag.getValue() : "";
    }

    public byte[] getByteArray(String name) {
        return get(name) instanceof ByteArrayTag tag ? tag.getValue() : new byte[0];
    }

    public int[] getIntArray(String name) {
        return get(name) instanceof IntArrayTag tag ? tag.getValue() : new int[0];
    }

    public long[] getLongArray(String name) {
        return get(name) instanceof LongArrayTag tag ? tag.getValue() : new long[0];
    }

    public Optional<CompoundTag> getCompound(String name) {
        return get(name) instanceof CompoundTag tag ? Optional.of(tag) : Optional.empty();
    }

    /**
     * Get a list whose elements are of the given type.
     * An empty list of any element type matches.
     */
    public Optional<ListTag> getList(String name, TagType elementType) {
        if (get(name) instanceof ListTag list
                && (list.getElementType() == elementType || list.isEmpty())) {
            return Optional.of(list);
        }
        return Optional.empty();
    }

    @Override
    public TagType getType() {
        return TagType.COMPOUND;
    }

    @Override
    public CompoundTag copy() {
        CompoundTag copy = new CompoundTag();
        entries.forEach((name, tag) -> copy.entries.put(name, tag.copy()));
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CompoundTag)) return false;
        return entries.equals(((CompoundTag) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }
}
