package com.turbonbt.storage;

/**
 * Constants of the sector-addressed region format (.mca / .mcr).
 * <p>
 * Layout:
 * - Header: 8KB (4KB locations + 4KB timestamps), 1024 entries each
 * - Chunks: length-prefixed payloads starting on 4KB sector boundaries
 *
 * @author TurboNBT
 * @version 1.0.0
 */
public final class RegionConstants {
    
    // Sectors
    public static final int SECTOR_SIZE = 4096;
    public static final int HEADER_SECTORS = 2;
    public static final int HEADER_SIZE = SECTOR_SIZE * HEADER_SECTORS; // 8KB
    public static final int MAX_SECTOR_COUNT = 0xFF;   // 1 byte in the location entry
    public static final int MAX_SECTOR_OFFSET = 0xFFFFFF; // 3 bytes in the location entry
    
    // Region dimensions (32x32 chunks)
    public static final int REGION_SIZE = 32;
    public static final int CHUNKS_PER_REGION = REGION_SIZE * REGION_SIZE; // 1024
    
    // Chunk payload header: 4 byte length + 1 byte compression type
    public static final int CHUNK_HEADER_SIZE = 5;
    public static final int EXTERNAL_FLAG = 0x80;
    
    // File extensions
    public static final String MCA_EXTENSION = ".mca";
    public static final String MCR_EXTENSION = ".mcr";
    public static final String EXTERNAL_CHUNK_EXTENSION = ".mcc";
    
    // Chunk coordinates
    public static final int CHUNK_X_MASK = 0x1F; // 31 in binary = 0001 1111
    public static final int CHUNK_Z_MASK = 0x1F;
    
    private RegionConstants() {
        // Prevent instantiation
        throw new AssertionError("RegionConstants should not be instantiated");
    }
    
    /**
     * Get chunk index in region from chunk coordinates.
     * Works for global coordinates too: masking is a floor modulo 32, so -1 maps to 31.
     * 
     * @param chunkX Chunk X coordinate
     * @param chunkZ Chunk Z coordinate
     * @return Index in region (0-1023), z-major
     */
    public static int getChunkIndex(int chunkX, int chunkZ) {
        return (chunkX & CHUNK_X_MASK) | ((chunkZ & CHUNK_Z_MASK) << 5);
    }
    
    /**
     * Get local chunk coordinates from index - inverse operation.
     */
    public static int[] getChunkCoords(int index) {
        return new int[]{index & CHUNK_X_MASK, (index >>> 5) & CHUNK_Z_MASK};
    }
    
    /**
     * Get region coordinates from chunk coordinates.
     * 
     * @param chunkCoord Chunk coordinate (X or Z)
     * @return Region coordinate
     */
    public static int getRegionCoord(int chunkCoord) {
        return chunkCoord >> 5; // Divide by 32
    }
    
    /**
     * Number of whole sectors needed to hold a byte count.
     */
    public static int sectorsFor(long bytes) {
        return (int) ((bytes + SECTOR_SIZE - 1) / SECTOR_SIZE);
    }
}
