package com.turbonbt.storage;

import java.io.IOException;

/**
 * Exception thrown when a single chunk entry of a region file is corrupted and cannot be read.
 * Other chunks of the same region are unaffected.
 * 
 * @author TurboNBT
 */
public class CorruptionException extends IOException {
    
    public enum Type {
        /** Location entry points into the header, past the end of file, or has no sectors. */
        BAD_SECTOR_RANGE,
        /** Length prefix does not fit the allocated sectors. */
        BAD_LENGTH,
        /** Payload decoded to something other than a compound. */
        NOT_A_COMPOUND,
        /** External .mcc payload is missing or cannot be located. */
        MISSING_EXTERNAL,
        /** Payload too large to be stored in the region. */
        OVERSIZED
    }
    
    private final int chunkX;
    private final int chunkZ;
    private final Type corruptionType;
    
    public CorruptionException(String message, int chunkX, int chunkZ, Type corruptionType) {
        super(message);
        this.chunkX = chunkX;
        this.chunkZ = chunkZ;
        this.corruptionType = corruptionType;
    }
    
    public CorruptionException(String message, int chunkX, int chunkZ, Type corruptionType, Throwable cause) {
        super(message, cause);
        this.chunkX = chunkX;
        this.chunkZ = chunkZ;
        this.corruptionType = corruptionType;
    }
    
    public int getChunkX() {
        return chunkX;
    }
    
    public int getChunkZ() {
        return chunkZ;
    }
    
    public Type getCorruptionType() {
        return corruptionType;
    }
    
    @Override
    public String toString() {
        return String.format("CorruptionException{chunk=[%d,%d], type=%s, message='%s'}",
                chunkX, chunkZ, corruptionType, getMessage());
    }
}
