package com.turbonbt.nbt;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for file-level NBT helpers and gzip detection.
 */
public class NBTIOTest {

    @TempDir
    Path tempDir;

    private static NamedTag sampleLevel() {
        CompoundTag data = new CompoundTag();
        data.putString("LevelName", "New World");
        data.putLong("RandomSeed", 4242424242L);
        data.putBoolean("hardcore", false);
        CompoundTag root = new CompoundTag();
        root.put("Data", data);
        return NamedTag.unnamed(root);
    }

    @Test
    void testWriteIsGzippedAndReadsBack() throws IOException {
        Path file = tempDir.resolve("level.dat");
        NamedTag level = sampleLevel();

        NBTIO.write(level, file);

        byte[] onDisk = Files.readAllBytes(file);
        assertTrue(NBTIO.isGzipped(onDisk));
        assertEquals(level, NBTIO.read(file));
        assertEquals("New World", NBTIO.readCompound(file).getCompound("Data").orElseThrow().getString("LevelName"));
    }

    @Test
    void testFailedWriteKeepsExistingFile() throws IOException {
        Path file = tempDir.resolve("level.dat");
        NamedTag level = sampleLevel();
        NBTIO.write(level, file);
        byte[] before = Files.readAllBytes(file);

        CompoundTag broken = new CompoundTag();
        broken.putString("text", "x".repeat(70_000));
        NBTException e = assertThrows(NBTException.class, () -> NBTIO.write(NamedTag.unnamed(broken), file));
        assertEquals(NBTException.Kind.STRING_TOO_LONG, e.getKind());

        assertArrayEquals(before, Files.readAllBytes(file));
        assertEquals(level, NBTIO.read(file));
    }

    @Test
    void testRawFileIsReadWithoutDecompression() throws IOException {
        Path file = tempDir.resolve("raw.nbt");
        NamedTag level = sampleLevel();
        Files.write(file, NBTIO.toBytes(level));

        assertFalse(NBTIO.isGzipped(Files.readAllBytes(file)));
        assertEquals(level, NBTIO.read(file));
    }

    @Test
    void testStreamWriteLeavesStreamOpen() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        NBTIO.write(sampleLevel(), out);
        int firstLength = out.size();
        NBTIO.write(sampleLevel(), out);

        assertEquals(firstLength * 2, out.size());
        assertEquals(sampleLevel(), NBTIO.read(new ByteArrayInputStream(Arrays.copyOf(out.toByteArray(), firstLength))));
    }

    @Test
    void testTruncatedGzipIsUnexpectedEof() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        NBTIO.write(sampleLevel(), out);
        byte[] truncated = Arrays.copyOf(out.toByteArray(), out.size() / 2);

        NBTException e = assertThrows(NBTException.class, () -> NBTIO.read(new ByteArrayInputStream(truncated)));
        assertEquals(NBTException.Kind.UNEXPECTED_EOF, e.getKind());
    }

    @Test
    void testReadCompoundRejectsOtherRoots() throws IOException {
        Path file = tempDir.resolve("list.nbt");
        NBTIO.write(NamedTag.unnamed(ListTag.of(TagType.INT, new IntTag(1))), file);

        assertThrows(NBTException.class, () -> NBTIO.readCompound(file));
    }

    @Test
    void testGzipMagicDetection() {
        assertTrue(NBTIO.isGzipped(new byte[]{0x1F, (byte) 0x8B, 8}));
        assertFalse(NBTIO.isGzipped(new byte[]{0x1F}));
        assertFalse(NBTIO.isGzipped(new byte[]{0x0A, 0x00}));
    }
}
