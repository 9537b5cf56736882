package com.turbonbt.config;

import com.turbonbt.compression.CompressionType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TurboNBTConfig loading and the shared instance.
 */
public class TurboNBTConfigTest {

    private Path testDir;

    @BeforeEach
    void setUp() throws IOException {
        testDir = Files.createTempDirectory("turbonbt_config_test");
        TurboNBTConfig.resetInstance();
    }

    @AfterEach
    void tearDown() throws IOException {
        TurboNBTConfig.resetInstance();
        if (Files.exists(testDir)) {
            try (var paths = Files.walk(testDir)) {
                for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                    Files.deleteIfExists(path);
                }
            }
        }
    }

    @Test
    void testDefaultsWithoutConfigFile() {
        TurboNBTConfig config = TurboNBTConfig.load(testDir.toFile());

        assertEquals(512, config.getMaxDepth());
        assertEquals("zlib", config.getCompressionAlgorithm());
        assertEquals(CompressionType.ZLIB, config.getCompressionType());
        assertEquals(6, config.getCompressionLevel());
        assertTrue(config.isExternalChunksEnabled());
    }

    @Test
    void testSingleton() {
        assertFalse(TurboNBTConfig.isInitialized());
        assertThrows(IllegalStateException.class, TurboNBTConfig::getInstance);

        TurboNBTConfig config1 = TurboNBTConfig.getInstance(testDir.toFile());
        TurboNBTConfig config2 = TurboNBTConfig.getInstance(testDir.toFile());

        assertTrue(TurboNBTConfig.isInitialized());
        assertSame(config1, config2);
        assertSame(config1, TurboNBTConfig.getInstance());
        assertSame(config1, TurboNBTConfig.current());
    }

    @Test
    void testCurrentFallsBackToDefaults() {
        assertSame(TurboNBTConfig.defaults(), TurboNBTConfig.current());
        assertEquals(512, TurboNBTConfig.current().getMaxDepth());
    }

    @Test
    void testTomlOverridesDefaults() throws IOException {
        Files.writeString(testDir.resolve(TurboNBTConfig.CONFIG_FILE_NAME),
                "[compression]\nalgorithm = \"lz4\"\nlevel = 9\n\n[region]\nexternal-chunks = false\n");

        TurboNBTConfig config = TurboNBTConfig.load(testDir.toFile());

        assertEquals(CompressionType.LZ4, config.getCompressionType());
        assertEquals(9, config.getCompressionLevel());
        assertFalse(config.isExternalChunksEnabled());
        assertEquals(512, config.getMaxDepth(), "untouched keys keep their defaults");
    }

    @Test
    void testYamlFallback() throws IOException {
        Files.writeString(testDir.resolve(TurboNBTConfig.YAML_FILE_NAME),
                "nbt:\n  max-depth: 64\ncompression:\n  algorithm: gzip\n");

        TurboNBTConfig config = TurboNBTConfig.load(testDir.toFile());

        assertEquals(64, config.getMaxDepth());
        assertEquals(CompressionType.GZIP, config.getCompressionType());
        assertEquals(6, config.getCompressionLevel());
    }

    @Test
    void testTomlWinsOverYaml() throws IOException {
        Files.writeString(testDir.resolve(TurboNBTConfig.CONFIG_FILE_NAME), "[compression]\nalgorithm = \"none\"\n");
        Files.writeString(testDir.resolve(TurboNBTConfig.YAML_FILE_NAME), "compression:\n  algorithm: gzip\n");

        assertEquals(CompressionType.NONE, TurboNBTConfig.load(testDir.toFile()).getCompressionType());
    }

    @Test
    void testUnknownAlgorithmFallsBackToZlib() throws IOException {
        Files.writeString(testDir.resolve(TurboNBTConfig.CONFIG_FILE_NAME), "[compression]\nalgorithm = \"zstd\"\n");

        assertEquals(CompressionType.ZLIB, TurboNBTConfig.load(testDir.toFile()).getCompressionType());
    }

    @Test
    void testNonPositiveDepthUsesDefault() throws IOException {
        Files.writeString(testDir.resolve(TurboNBTConfig.CONFIG_FILE_NAME), "[nbt]\nmax-depth = 0\n");

        assertEquals(512, TurboNBTConfig.load(testDir.toFile()).getMaxDepth());
    }
}
