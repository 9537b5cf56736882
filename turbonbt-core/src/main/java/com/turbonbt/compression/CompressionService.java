package com.turbonbt.compression;

import com.turbonbt.config.TurboNBTConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Central compression service for chunk payloads.
 * Maps each region compression id to its {@link Compressor} and compresses new
 * chunks with the configured primary scheme.
 * <p>
 * A shared instance is available through {@link #getInstance()}; region readers and
 * writers also accept an explicit instance.
 */
public class CompressionService {
    private static final Logger LOGGER = LoggerFactory.getLogger("TurboNBT.Compression");
    
    private static volatile CompressionService instance;
    private static final Object INSTANCE_LOCK = new Object();
    
    private final Map<CompressionType, Compressor> compressors = new EnumMap<>(CompressionType.class);
    private final CompressionType primaryType;
    
    // Statistics
    private final AtomicLong rawBytes = new AtomicLong(0);
    private final AtomicLong compressedBytes = new AtomicLong(0);
    private final AtomicLong compressionCount = new AtomicLong(0);
    private final AtomicLong decompressionCount = new AtomicLong(0);
    
    public CompressionService(CompressionType primaryType, int level) {
        this.primaryType = primaryType;
        register(new GzipCompressor(level));
        register(new ZlibCompressor(level));
        register(new NoneCompressor());
        register(new LZ4BlockCompressor(level));
        
        LOGGER.debug("[TurboNBT][Compression] Initialized: primary {} (level {})",
                getPrimaryCompressor().getName(), level);
    }
    
    public CompressionService(TurboNBTConfig config) {
        this(config.getCompressionType(), config.getCompressionLevel());
    }
    
    public static void initialize(TurboNBTConfig config) {
        synchronized (INSTANCE_LOCK) {
            if (instance == null) {
                instance = new CompressionService(config);
            }
        }
    }
    
    /**
     * Get the shared service, creating it from {@link TurboNBTConfig#current()} on first use.
     */
    public static CompressionService getInstance() {
        if (instance == null) {
            initialize(TurboNBTConfig.current());
        }
        return instance;
    }
    
    /**
     * Resets the singleton instance for testing purposes.
     */
    public static void resetInstance() {
        synchronized (INSTANCE_LOCK) {
            instance = null;
        }
    }
    
    /**
     * Replace the compressor used for a scheme.
     */
    public void register(Compressor compressor) {
        compressors.put(compressor.getType(), compressor);
    }
    
    public Compressor getCompressor(CompressionType type) {
        return compressors.get(type);
    }
    
    /**
     * Compress data using the configured primary scheme.
     */
    public byte[] compress(byte[] data) throws CompressionException {
        return compress(data, primaryType);
    }
    
    public byte[] compress(byte[] data, CompressionType type) throws CompressionException {
        byte[] compressed = compressors.get(type).compress(data);
        compressionCount.incrementAndGet();
        rawBytes.addAndGet(data.length);
        compressedBytes.addAndGet(compressed.length);
        return compressed;
    }
    
    /**
     * Decompress a payload stored with the given scheme.
     */
    public byte[] decompress(byte[] compressed, CompressionType type) throws CompressionException {
        byte[] decompressed = compressors.get(type).decompress(compressed);
        decompressionCount.incrementAndGet();
        compressedBytes.addAndGet(compressed.length);
        rawBytes.addAndGet(decompressed.length);
        return decompressed;
    }
    
    /**
     * Decompress a payload given its raw compression id.
     *
     * @throws UnsupportedCompressionException if the id is unknown
     */
    public byte[] decompress(byte[] compressed, int compressionId) throws CompressionException {
        return decompress(compressed, CompressionType.fromId(compressionId));
    }
    
    public CompressionType getPrimaryType() {
        return primaryType;
    }
    
    public Compressor getPrimaryCompressor() {
        return compressors.get(primaryType);
    }
    
    public CompressionStats getStats() {
        return new CompressionStats(
            compressionCount.get(),
            decompressionCount.get(),
            rawBytes.get(),
            compressedBytes.get(),
            getPrimaryCompressor().getName()
        );
    }
    
    public void resetStats() {
        compressionCount.set(0);
        decompressionCount.set(0);
        rawBytes.set(0);
        compressedBytes.set(0);
    }
}
