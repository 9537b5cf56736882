package com.turbonbt.storage;

import com.turbonbt.nbt.CompoundTag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for chunk construction and immutability.
 */
public class ChunkTest {

    @Test
    void testCoordinatesAreReducedToSlot() {
        Chunk chunk = new Chunk(35, -1, new CompoundTag(), 10L);
        assertEquals(3, chunk.getX());
        assertEquals(31, chunk.getZ());
        assertEquals(RegionConstants.getChunkIndex(3, 31), chunk.getIndex());
        assertEquals(10L, chunk.getTimestamp());
    }

    @Test
    void testChunkIsNotChangedThroughItsTrees() {
        CompoundTag nbt = new CompoundTag();
        nbt.putInt("a", 1);
        Chunk chunk = new Chunk(0, 0, nbt, 0L);

        chunk.getNbt().putInt("a", 2);
        nbt.putInt("b", 3);

        CompoundTag expected = new CompoundTag();
        expected.putInt("a", 1);
        assertEquals(expected, chunk.getNbt());
        assertNotSame(chunk.getNbt(), chunk.getNbt());
    }

    @Test
    void testNullTreeIsRejected() {
        assertThrows(NullPointerException.class, () -> new Chunk(0, 0, null, 0L));
    }
}
