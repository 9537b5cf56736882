package com.turbonbt.compression;

import java.util.Locale;
import java.util.Optional;

/**
 * Per-chunk compression schemes of the region format, keyed by the byte stored
 * in front of each chunk payload.
 *
 * @author TurboNBT
 * @version 1.0.0
 */
public enum CompressionType {
    GZIP(1, "gzip"),
    ZLIB(2, "zlib"),
    NONE(3, "none"),
    LZ4(4, "lz4");

    private final int id;
    private final String configName;

    CompressionType(int id, String configName) {
        this.id = id;
        this.configName = configName;
    }

    /**
     * Resolve a scheme from its on-disk id.
     *
     * @param id Compression byte with the external-payload flag already masked off
     * @throws UnsupportedCompressionException if the id is not a known scheme
     */
    public static CompressionType fromId(int id) throws UnsupportedCompressionException {
        for (CompressionType type : values()) {
            if (type.id == id) {
                return type;
            }
        }
        throw new UnsupportedCompressionException(id);
    }

    /**
     * Resolve a scheme from its configuration name ("gzip", "zlib", "none", "lz4").
     */
    public static Optional<CompressionType> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (CompressionType type : values()) {
            if (type.configName.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public int getId() {
        return id;
    }

    public String getConfigName() {
        return configName;
    }
}
