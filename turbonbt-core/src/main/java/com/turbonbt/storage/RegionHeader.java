package com.turbonbt.storage;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;

/**
 * The two 4KB header blocks of a region file.
 * <p>
 * Location entry (big-endian int): {@code (sectorOffset << 8) | sectorCount}.
 * Timestamp entry: last modification in epoch seconds.
 * Both tables are indexed by {@code localZ * 32 + localX}.
 *
 * @author TurboNBT
 * @version 1.0.0
 */
public class RegionHeader {
    
    private final int[] locations = new int[RegionConstants.CHUNKS_PER_REGION];
    private final int[] timestamps = new int[RegionConstants.CHUNKS_PER_REGION];
    
    /**
     * Create an empty header (all slots empty).
     */
    public RegionHeader() {
    }
    
    /**
     * Read both header blocks from the start of a region file.
     */
    public static RegionHeader read(RandomAccessFile file) throws IOException {
        byte[] headerData = new byte[RegionConstants.HEADER_SIZE];
        file.seek(0);
        file.readFully(headerData);
        return read(ByteBuffer.wrap(headerData));
    }
    
    public static RegionHeader read(ByteBuffer buffer) {
        RegionHeader header = new RegionHeader();
        
        // Read locations (first 4KB)
        for (int i = 0; i < RegionConstants.CHUNKS_PER_REGION; i++) {
            header.locations[i] = buffer.getInt();
        }
        
        // Read timestamps (second 4KB)
        for (int i = 0; i < RegionConstants.CHUNKS_PER_REGION; i++) {
            header.timestamps[i] = buffer.getInt();
        }
        return header;
    }
    
    /**
     * Write both header blocks at the start of a region file.
     */
    public void write(RandomAccessFile file) throws IOException {
        ByteBuffer header = ByteBuffer.allocate(RegionConstants.HEADER_SIZE);
        write(header);
        file.seek(0);
        file.write(header.array());
    }
    
    public void write(ByteBuffer buffer) {
        for (int location : locations) {
            buffer.putInt(location);
        }
        for (int timestamp : timestamps) {
            buffer.putInt(timestamp);
        }
    }
    
    /**
     * Set the location and timestamp of a slot.
     */
    public void setChunk(int index, int sectorOffset, int sectorCount, int timestamp) {
        if (sectorOffset < 0 || sectorOffset > RegionConstants.MAX_SECTOR_OFFSET) {
            throw new IllegalArgumentException("Sector offset out of range: " + sectorOffset);
        }
        if (sectorCount < 0 || sectorCount > RegionConstants.MAX_SECTOR_COUNT) {
            throw new IllegalArgumentException("Sector count out of range: " + sectorCount);
        }
        locations[index] = (sectorOffset << 8) | sectorCount;
        timestamps[index] = timestamp;
    }
    
    public void clearChunk(int index) {
        locations[index] = 0;
        timestamps[index] = 0;
    }
    
    public int getSectorOffset(int index) {
        return locations[index] >>> 8;
    }
    
    public int getSectorCount(int index) {
        return locations[index] & 0xFF;
    }
    
    /**
     * Timestamp as unsigned epoch seconds.
     */
    public long getTimestamp(int index) {
        return timestamps[index] & 0xFFFFFFFFL;
    }
    
    /**
     * A slot is empty when both offset and sector count are zero.
     */
    public boolean isEmpty(int index) {
        return locations[index] == 0;
    }
    
    /**
     * Count non-empty slots.
     */
    public int countChunks() {
        int count = 0;
        for (int location : locations) {
            if (location != 0) {
                count++;
            }
        }
        return count;
    }
    
    @Override
    public String toString() {
        return "RegionHeader{chunks=" + countChunks() + "}";
    }
}
