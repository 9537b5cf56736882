package com.turbonbt.compression;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Random;
import java.util.zip.Deflater;
import java.util.zip.InflaterInputStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the compression service and its per-scheme compressors.
 */
public class CompressionServiceTest {

    private CompressionService service;
    private byte[] sample;

    @BeforeEach
    void setUp() {
        CompressionService.resetInstance();
        service = new CompressionService(CompressionType.ZLIB, 6);

        // Half repetitive, half random so every scheme has something to do
        Random random = new Random(1337);
        sample = new byte[32 * 1024];
        byte[] pattern = "sections:[{Y:0b,block_states:{palette:[stone]}}]".getBytes(StandardCharsets.UTF_8);
        for (int i = 0; i < sample.length / 2; i++) {
            sample[i] = pattern[i % pattern.length];
        }
        byte[] noise = new byte[sample.length / 2];
        random.nextBytes(noise);
        System.arraycopy(noise, 0, sample, sample.length / 2, noise.length);
    }

    @AfterEach
    void tearDown() {
        CompressionService.resetInstance();
    }

    @Test
    void testEverySchemeRestoresInput() throws CompressionException {
        for (CompressionType type : CompressionType.values()) {
            byte[] compressed = service.compress(sample, type);
            assertArrayEquals(sample, service.decompress(compressed, type), type.getConfigName());
        }
    }

    @Test
    void testZlibOutputIsStandard() throws Exception {
        byte[] compressed = service.compress(sample, CompressionType.ZLIB);

        // A plain inflater must read what the service writes
        try (InflaterInputStream in = new InflaterInputStream(new ByteArrayInputStream(compressed))) {
            assertArrayEquals(sample, in.readAllBytes());
        }
    }

    @Test
    void testReadsZlibFromOtherWriters() throws CompressionException {
        Deflater deflater = new Deflater(Deflater.BEST_SPEED);
        deflater.setInput(sample);
        deflater.finish();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[4096];
        while (!deflater.finished()) {
            out.write(buffer, 0, deflater.deflate(buffer));
        }
        deflater.end();

        assertArrayEquals(sample, service.decompress(out.toByteArray(), CompressionType.ZLIB));
    }

    @Test
    void testGzipHasMagic() throws CompressionException {
        byte[] compressed = service.compress(sample, CompressionType.GZIP);
        assertEquals(0x1F, compressed[0] & 0xFF);
        assertEquals(0x8B, compressed[1] & 0xFF);
    }

    @Test
    void testNoneIsIdentity() throws CompressionException {
        assertArrayEquals(sample, service.compress(sample, CompressionType.NONE));
        assertArrayEquals(sample, service.decompress(sample, CompressionType.NONE));
    }

    @Test
    void testTruncatedStreamsFail() throws CompressionException {
        for (CompressionType type : new CompressionType[]{CompressionType.GZIP, CompressionType.ZLIB, CompressionType.LZ4}) {
            byte[] compressed = service.compress(sample, type);
            byte[] truncated = Arrays.copyOf(compressed, compressed.length / 2);
            assertThrows(CompressionException.class, () -> service.decompress(truncated, type), type.getConfigName());
        }
    }

    @Test
    void testGarbageFails() {
        byte[] garbage = {1, 2, 3, 4, 5, 6, 7, 8};
        assertThrows(CompressionException.class, () -> service.decompress(garbage, CompressionType.ZLIB));
        assertThrows(CompressionException.class, () -> service.decompress(garbage, CompressionType.GZIP));
    }

    @Test
    void testUnknownIdIsUnsupported() {
        UnsupportedCompressionException e = assertThrows(UnsupportedCompressionException.class,
                () -> service.decompress(sample, 99));
        assertEquals(99, e.getCompressionId());
        assertThrows(UnsupportedCompressionException.class, () -> CompressionType.fromId(0));
    }

    @Test
    void testTypeLookup() throws UnsupportedCompressionException {
        assertEquals(CompressionType.GZIP, CompressionType.fromId(1));
        assertEquals(CompressionType.ZLIB, CompressionType.fromId(2));
        assertEquals(CompressionType.NONE, CompressionType.fromId(3));
        assertEquals(CompressionType.LZ4, CompressionType.fromId(4));
        assertEquals(CompressionType.LZ4, CompressionType.fromName(" LZ4 ").orElseThrow());
        assertTrue(CompressionType.fromName("zstd").isEmpty());
    }

    @Test
    void testLevelsAreClamped() {
        assertEquals(9, new ZlibCompressor(42).getCompressionLevel());
        assertEquals(1, new GzipCompressor(0).getCompressionLevel());
        assertEquals(17, new LZ4BlockCompressor(99).getCompressionLevel());
    }

    @Test
    void testRegisteredCompressorReplacesDefault() throws CompressionException {
        service.register(new NoneCompressor() {
            @Override
            public CompressionType getType() {
                return CompressionType.GZIP;
            }
        });
        assertArrayEquals(sample, service.compress(sample, CompressionType.GZIP));
    }

    @Test
    void testStatistics() throws CompressionException {
        service.resetStats();
        byte[] compressed = service.compress(sample);
        service.decompress(compressed, CompressionType.ZLIB);

        CompressionStats stats = service.getStats();
        assertEquals(1, stats.compressionCount());
        assertEquals(1, stats.decompressionCount());
        assertEquals(2L * sample.length, stats.rawBytes());
        assertEquals(2L * compressed.length, stats.compressedBytes());
        assertEquals("Zlib", stats.primaryAlgorithm());
        assertTrue(stats.getCompressionRatio() > 0 && stats.getCompressionRatio() < 1);

        System.out.println(stats);
    }
}
