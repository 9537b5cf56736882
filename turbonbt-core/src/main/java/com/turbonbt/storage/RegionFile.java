package com.turbonbt.storage;

import com.turbonbt.compression.CompressionService;
import com.turbonbt.compression.CompressionType;
import com.turbonbt.config.TurboNBTConfig;
import com.turbonbt.nbt.CompoundTag;
import com.turbonbt.nbt.NBTIO;
import com.turbonbt.nbt.NamedTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Reads region files (.mca / .mcr).
 * <p>
 * Opening a region reads and keeps only the 8KB header. Chunk payloads are read,
 * decompressed and decoded when a chunk is requested, so a corrupt chunk only fails
 * the request for that chunk. Decoded chunks are not cached.
 * <p>
 * Not thread-safe: the region owns one file handle and seeks it for each request.
 *
 * @author TurboNBT
 * @version 1.0.0
 */
public class RegionFile implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger("TurboNBT.Region");

    private final Path filePath;
    private final RandomAccessFile file;
    private final long fileLength;
    private final RegionHeader header;
    private final RegionFileName regionName;
    private final CompressionService compression;
    private final int maxDepth;
    private final boolean externalChunks;

    private RegionFile(Path filePath, RandomAccessFile file, long fileLength, RegionHeader header,
                       CompressionService compression, TurboNBTConfig config) {
        this.filePath = filePath;
        this.file = file;
        this.fileLength = fileLength;
        this.header = header;
        this.regionName = RegionFileName.parse(filePath).orElse(null);
        this.compression = compression;
        this.maxDepth = config.getMaxDepth();
        this.externalChunks = config.isExternalChunksEnabled();
    }

    /**
     * Open a region file and read its header.
     *
     * @param filePath Path to .mca or .mcr file
     * @return Open region, to be closed by the caller
     * @throws CorruptRegionFileException if the file is shorter than the 8KB header
     * @throws IOException if file cannot be opened
     */
    public static RegionFile fromFile(Path filePath) throws IOException {
        return fromFile(filePath, CompressionService.getInstance(), TurboNBTConfig.current());
    }

    public static RegionFile fromFile(Path filePath, CompressionService compression, TurboNBTConfig config) throws IOException {
        long size = Files.size(filePath);
        if (size < RegionConstants.HEADER_SIZE) {
            throw new CorruptRegionFileException(filePath,
                    "file is " + size + " bytes, shorter than the " + RegionConstants.HEADER_SIZE + " byte header");
        }

        RandomAccessFile file = new RandomAccessFile(filePath.toFile(), "r");
        try {
            RegionHeader header = RegionHeader.read(file);
            RegionFile region = new RegionFile(filePath, file, size, header, compression, config);
            LOGGER.debug("[TurboNBT][Region] Opened region: {} ({} chunks)", filePath.getFileName(), header.countChunks());
            return region;
        } catch (IOException | RuntimeException e) {
            file.close();
            throw e;
        }
    }

    /**
     * Read a chunk.
     * Global chunk coordinates are accepted and reduced to the local slot, so
     * {@code getChunk(35, -1)} reads the same slot as {@code getChunk(3, 31)}.
     *
     * @param chunkX Chunk X coordinate
     * @param chunkZ Chunk Z coordinate
     * @return Chunk, or empty if the slot holds no chunk
     * @throws CorruptionException if the slot's entry or payload is inconsistent
     * @throws com.turbonbt.compression.UnsupportedCompressionException if the payload uses an unknown scheme
     * @throws com.turbonbt.nbt.NBTException if the payload is not valid NBT
     * @throws IOException if read fails
     */
    public Optional<Chunk> getChunk(int chunkX, int chunkZ) throws IOException {
        int index = RegionConstants.getChunkIndex(chunkX, chunkZ);
        if (header.isEmpty(index)) {
            return Optional.empty();
        }

        int localX = chunkX & RegionConstants.CHUNK_X_MASK;
        int localZ = chunkZ & RegionConstants.CHUNK_Z_MASK;

        try {
            byte[] raw = readPayload(index, localX, localZ);
            NamedTag root = NBTIO.fromBytes(raw, maxDepth);
            if (!(root.tag() instanceof CompoundTag compound)) {
                throw new CorruptionException("Chunk root is " + root.tag().getType().getDisplayName() + ", not a compound",
                        localX, localZ, CorruptionException.Type.NOT_A_COMPOUND);
            }
            return Optional.of(Chunk.ofDecoded(localX, localZ, compound, header.getTimestamp(index)));
        } catch (CorruptionException e) {
            LOGGER.warn("[TurboNBT][Region] Corrupt chunk [{},{}] in {}: {}",
                    localX, localZ, filePath.getFileName(), e.getMessage());
            throw e;
        }
    }

    /**
     * Read and decompress the payload of a non-empty slot.
     */
    private byte[] readPayload(int index, int localX, int localZ) throws IOException {
        int sectorOffset = header.getSectorOffset(index);
        int sectorCount = header.getSectorCount(index);
        long offset = (long) sectorOffset * RegionConstants.SECTOR_SIZE;

        if (sectorOffset < RegionConstants.HEADER_SECTORS || sectorCount == 0
                || offset + RegionConstants.CHUNK_HEADER_SIZE > fileLength) {
            throw new CorruptionException("Invalid sector range: offset " + sectorOffset + ", count " + sectorCount,
                    localX, localZ, CorruptionException.Type.BAD_SECTOR_RANGE);
        }

        // Read chunk header (5 bytes: 4 byte length + 1 byte compression type)
        file.seek(offset);
        int length = file.readInt();
        int compressionByte = file.readUnsignedByte();

        long available = (long) sectorCount * RegionConstants.SECTOR_SIZE - 4;
        if (length <= 0 || length > available) {
            throw new CorruptionException("Invalid chunk length " + length + " for " + sectorCount + " sectors",
                    localX, localZ, CorruptionException.Type.BAD_LENGTH);
        }
        if (offset + 4 + length > fileLength) {
            throw new CorruptionException("Chunk length " + length + " runs past end of file",
                    localX, localZ, CorruptionException.Type.BAD_LENGTH);
        }

        boolean external = (compressionByte & RegionConstants.EXTERNAL_FLAG) != 0;
        CompressionType type = CompressionType.fromId(compressionByte & ~RegionConstants.EXTERNAL_FLAG);

        byte[] compressed;
        if (external) {
            compressed = readExternal(localX, localZ);
        } else {
            compressed = new byte[length - 1]; // -1 for compression type byte
            file.readFully(compressed);
        }

        return compression.decompress(compressed, type);
    }

    private byte[] readExternal(int localX, int localZ) throws IOException {
        if (!externalChunks) {
            throw new CorruptionException("Chunk is stored externally but external chunks are disabled",
                    localX, localZ, CorruptionException.Type.MISSING_EXTERNAL);
        }
        if (regionName == null) {
            throw new CorruptionException("External chunk needs region coordinates, but "
                    + filePath.getFileName() + " is not named r.<x>.<z>.mca",
                    localX, localZ, CorruptionException.Type.MISSING_EXTERNAL);
        }
        Path externalPath = filePath.resolveSibling(regionName.externalChunkFileName(localX, localZ));
        if (!Files.isRegularFile(externalPath)) {
            throw new CorruptionException("External chunk file missing: " + externalPath.getFileName(),
                    localX, localZ, CorruptionException.Type.MISSING_EXTERNAL);
        }
        return Files.readAllBytes(externalPath);
    }

    /**
     * Iterate over all chunks present in the region, in slot order (z-major, then x).
     * <p>
     * Each call to {@code iterator()} starts a fresh cursor, so the result can be
     * iterated again. Chunks are decoded one per {@code next()}; read failures are
     * thrown from {@code next()} as {@link UncheckedIOException}.
     */
    public Iterable<Chunk> iterNonEmpty() {
        return ChunkCursor::new;
    }

    /**
     * Check if chunk exists.
     *
     * @param chunkX Chunk X coordinate
     * @param chunkZ Chunk Z coordinate
     * @return True if the slot is not empty
     */
    public boolean hasChunk(int chunkX, int chunkZ) {
        return !header.isEmpty(RegionConstants.getChunkIndex(chunkX, chunkZ));
    }

    /**
     * Last modification time of a slot, in epoch seconds (0 when never written).
     */
    public long getTimestamp(int chunkX, int chunkZ) {
        return header.getTimestamp(RegionConstants.getChunkIndex(chunkX, chunkZ));
    }

    public int countChunks() {
        return header.countChunks();
    }

    /**
     * Region coordinates from the file name, if it follows {@code r.<x>.<z>.<ext>}.
     */
    public Optional<RegionFileName> getRegionName() {
        return Optional.ofNullable(regionName);
    }

    public Path getFilePath() {
        return filePath;
    }

    public long getFileSize() {
        return fileLength;
    }

    @Override
    public void close() throws IOException {
        file.close();
    }

    @Override
    public String toString() {
        return "RegionFile{" +
               "file=" + filePath.getFileName() +
               ", chunks=" + countChunks() +
               '}';
    }

    /**
     * Cursor over slot indices; holds no decoded state besides the next index.
     */
    private final class ChunkCursor implements Iterator<Chunk> {

        private int nextIndex = findNonEmpty(0);

        private int findNonEmpty(int from) {
            int index = from;
            while (index < RegionConstants.CHUNKS_PER_REGION && header.isEmpty(index)) {
                index++;
            }
            return index;
        }

        @Override
        public boolean hasNext() {
            return nextIndex < RegionConstants.CHUNKS_PER_REGION;
        }

        @Override
        public Chunk next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            int index = nextIndex;
            nextIndex = findNonEmpty(index + 1);

            int[] coords = RegionConstants.getChunkCoords(index);
            try {
                return getChunk(coords[0], coords[1]).orElseThrow();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }
}
