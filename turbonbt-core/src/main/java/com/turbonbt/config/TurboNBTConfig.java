package com.turbonbt.config;

import com.moandjiezana.toml.Toml;
import com.turbonbt.compression.CompressionType;
import com.turbonbt.nbt.NBTReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.util.List;
import java.util.Map;

/**
 * TurboNBT configuration loader and manager.
 * Loads settings from turbonbt.toml, falling back to turbonbt.yml, then to the bundled defaults.
 */
public class TurboNBTConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger("TurboNBT.Config");
    
    public static final String CONFIG_FILE_NAME = "turbonbt.toml";
    public static final String YAML_FILE_NAME = "turbonbt.yml";
    private static final String DEFAULTS_RESOURCE = "/turbonbt-defaults.toml";
    
    private static volatile TurboNBTConfig instance;
    private static volatile TurboNBTConfig defaults;
    private static final Object INSTANCE_LOCK = new Object();
    
    private final Toml toml;
    
    private TurboNBTConfig(Toml toml) {
        this.toml = toml;
    }
    
    /**
     * Load configuration from a directory without touching the shared instance.
     */
    public static TurboNBTConfig load(File directory) {
        Toml base = loadDefaults();
        File configFile = new File(directory, CONFIG_FILE_NAME);
        File yamlFile = new File(directory, YAML_FILE_NAME);
        
        if (configFile.exists()) {
            LOGGER.info("[TurboNBT][CFG] Loaded configuration from {}", configFile);
            return new TurboNBTConfig(new Toml(base).read(configFile));
        }
        if (yamlFile.exists()) {
            LOGGER.info("[TurboNBT][CFG] Loaded configuration from {} ({} not found)", yamlFile, CONFIG_FILE_NAME);
            return new TurboNBTConfig(new Toml(base).read(loadFromYaml(yamlFile)));
        }
        LOGGER.debug("[TurboNBT][CFG] No configuration in {}, using defaults", directory);
        return new TurboNBTConfig(base);
    }
    
    public static TurboNBTConfig getInstance(File directory) {
        if (instance == null) {
            synchronized (INSTANCE_LOCK) {
                if (instance == null) {
                    instance = load(directory);
                }
            }
        }
        return instance;
    }
    
    public static TurboNBTConfig getInstance() {
        if (instance == null) {
            throw new IllegalStateException("TurboNBTConfig not initialized! Call getInstance(File) first.");
        }
        return instance;
    }
    
    /**
     * Get the initialized instance, or the bundled defaults when none was loaded.
     */
    public static TurboNBTConfig current() {
        TurboNBTConfig config = instance;
        return config != null ? config : defaults();
    }
    
    public static TurboNBTConfig defaults() {
        if (defaults == null) {
            synchronized (INSTANCE_LOCK) {
                if (defaults == null) {
                    defaults = new TurboNBTConfig(loadDefaults());
                }
            }
        }
        return defaults;
    }
    
    /**
     * Resets the singleton instance for testing purposes.
     */
    public static void resetInstance() {
        synchronized (INSTANCE_LOCK) {
            instance = null;
        }
    }
    
    public static boolean isInitialized() {
        return instance != null;
    }
    
    private static Toml loadDefaults() {
        try (InputStream in = TurboNBTConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing bundled resource " + DEFAULTS_RESOURCE);
            }
            return new Toml().read(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULTS_RESOURCE, e);
        }
    }
    
    /**
     * Translate a YAML file with the same sections into TOML text.
     */
    @SuppressWarnings("unchecked")
    private static String loadFromYaml(File yamlFile) {
        Map<String, Object> data;
        try {
            data = new Yaml().load(Files.readString(yamlFile.toPath()));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + yamlFile, e);
        }
        
        StringBuilder tomlBuilder = new StringBuilder();
        if (data != null) {
            for (Map.Entry<String, Object> entry : data.entrySet()) {
                if (entry.getValue() instanceof Map) {
                    writeSection(tomlBuilder, entry.getKey(), (Map<String, Object>) entry.getValue());
                }
            }
        }
        return tomlBuilder.toString();
    }
    
    @SuppressWarnings("unchecked")
    private static void writeSection(StringBuilder sb, String name, Map<String, Object> map) {
        sb.append("[").append(name).append("]\n");
        for (Map.Entry<String, Object> entry : map.entrySet()) {
            if (!(entry.getValue() instanceof Map)) {
                sb.append(entry.getKey()).append(" = ").append(formatValue(entry.getValue())).append("\n");
            }
        }
        sb.append("\n");
        for (Map.Entry<String, Object> entry : map.entrySet()) {
            if (entry.getValue() instanceof Map) {
                writeSection(sb, name + "." + entry.getKey(), (Map<String, Object>) entry.getValue());
            }
        }
    }
    
    private static String formatValue(Object value) {
        if (value instanceof String s) {
            return "\"" + s.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
        }
        if (value instanceof List<?> list) {
            StringBuilder sb = new StringBuilder("[");
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(formatValue(list.get(i)));
            }
            return sb.append("]").toString();
        }
        return String.valueOf(value);
    }
    
    // NBT
    
    public int getMaxDepth() {
        int depth = getInt("nbt.max-depth", NBTReader.DEFAULT_MAX_DEPTH);
        return depth > 0 ? depth : NBTReader.DEFAULT_MAX_DEPTH;
    }
    
    // Compression
    
    public String getCompressionAlgorithm() {
        return toml.getString("compression.algorithm", "zlib");
    }
    
    public CompressionType getCompressionType() {
        String algorithm = getCompressionAlgorithm();
        return CompressionType.fromName(algorithm).orElseGet(() -> {
            LOGGER.warn("[TurboNBT][CFG] Unknown compression algorithm '{}', using zlib", algorithm);
            return CompressionType.ZLIB;
        });
    }
    
    public int getCompressionLevel() {
        return getInt("compression.level", 6);
    }
    
    // Region
    
    public boolean isExternalChunksEnabled() {
        return getBoolean("region.external-chunks", true);
    }
    
    // Generic access
    
    public String getString(String key, String defaultValue) {
        return toml.getString(key, defaultValue);
    }
    
    public int getInt(String key, int defaultValue) {
        return toml.getLong(key, (long) defaultValue).intValue();
    }
    
    public boolean getBoolean(String key, boolean defaultValue) {
        return toml.getBoolean(key, defaultValue);
    }
}
