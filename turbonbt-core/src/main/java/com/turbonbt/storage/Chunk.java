package com.turbonbt.storage;

import com.turbonbt.nbt.CompoundTag;

import java.util.Objects;

/**
 * One decoded chunk: its root compound and its slot inside the region.
 * <p>
 * Immutable: the constructor copies the given compound and {@link #getNbt()}
 * hands out a copy, so neither the caller nor a reader can change the chunk.
 *
 * @author TurboNBT
 * @version 1.0.0
 */
public final class Chunk {
    
    private final int x;
    private final int z;
    private final CompoundTag nbt;
    private final long timestamp;
    
    /**
     * Create a chunk.
     * 
     * @param x Chunk X coordinate (global coordinates are reduced to 0-31)
     * @param z Chunk Z coordinate (global coordinates are reduced to 0-31)
     * @param nbt Root compound of the chunk, copied
     * @param timestamp Last modification time (Unix timestamp in seconds)
     */
    public Chunk(int x, int z, CompoundTag nbt, long timestamp) {
        this(Objects.requireNonNull(nbt, "nbt").copy(), x, z, timestamp);
    }

    private Chunk(CompoundTag owned, int x, int z, long timestamp) {
        this.x = x & RegionConstants.CHUNK_X_MASK;
        this.z = z & RegionConstants.CHUNK_Z_MASK;
        this.nbt = owned;
        this.timestamp = timestamp;
    }
    
    /**
     * Create a chunk with current timestamp.
     */
    public Chunk(int x, int z, CompoundTag nbt) {
        this(x, z, nbt, System.currentTimeMillis() / 1000L);
    }
    
    /**
     * Wrap a tree that was just decoded and is referenced nowhere else.
     */
    static Chunk ofDecoded(int x, int z, CompoundTag decoded, long timestamp) {
        return new Chunk(decoded, x, z, timestamp);
    }

    /**
     * Local chunk X coordinate within region (0-31).
     */
    public int getX() {
        return x;
    }
    
    /**
     * Local chunk Z coordinate within region (0-31).
     */
    public int getZ() {
        return z;
    }
    
    /**
     * Slot index in region (0-1023).
     */
    public int getIndex() {
        return RegionConstants.getChunkIndex(x, z);
    }
    
    /**
     * A copy of the root compound; changes to it do not affect this chunk.
     */
    public CompoundTag getNbt() {
        return nbt.copy();
    }

    /**
     * The chunk's own tree, for encoding without a copy. Callers must not modify it.
     */
    CompoundTag nbtView() {
        return nbt;
    }
    
    public long getTimestamp() {
        return timestamp;
    }
    
    @Override
    public String toString() {
        return "Chunk{x=" + x + ", z=" + z + ", entries=" + nbt.size() + ", timestamp=" + timestamp + '}';
    }
}
