package com.turbonbt.storage;

import com.turbonbt.compression.CompressionService;
import com.turbonbt.compression.CompressionType;
import com.turbonbt.config.TurboNBTConfig;
import com.turbonbt.nbt.NBTIO;
import com.turbonbt.nbt.NamedTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes region files (.mca / .mcr) from scratch.
 * <p>
 * Chunks are buffered by slot (a later chunk for the same slot replaces the earlier one)
 * and laid out on {@link #flush()} in slot order, each starting on a sector boundary
 * right after the header. A payload needing more than 255 sectors goes to a
 * {@code c.<x>.<z>.mcc} file next to the region, leaving a one-sector stub in the region.
 * <p>
 * Nothing touches the disk before {@link #flush()}. Every chunk is encoded and checked
 * first; the region is then written to a sibling {@code .tmp} file and moved over the
 * target, so a failed flush leaves an existing region as it was.
 *
 * @author TurboNBT
 * @version 1.0.0
 */
public class RegionFileWriter implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger("TurboNBT.Region");

    private final Path filePath;
    private final Chunk[] chunks;
    private final CompressionType compressionType;
    private final CompressionService compression;
    private final boolean externalChunks;
    private final RegionFileName regionName;
    private boolean flushed;

    /**
     * Create a writer using the configured compression scheme.
     *
     * @param filePath Path to .mca file, replaced on flush if it exists
     */
    public RegionFileWriter(Path filePath) {
        this(filePath, CompressionService.getInstance().getPrimaryType(),
                CompressionService.getInstance(), TurboNBTConfig.current().isExternalChunksEnabled());
    }

    public RegionFileWriter(Path filePath, CompressionType compressionType) {
        this(filePath, compressionType, CompressionService.getInstance(),
                TurboNBTConfig.current().isExternalChunksEnabled());
    }

    public RegionFileWriter(Path filePath, CompressionType compressionType,
                            CompressionService compression, boolean externalChunks) {
        this.filePath = filePath;
        this.compressionType = compressionType;
        this.compression = compression;
        this.externalChunks = externalChunks;
        this.regionName = RegionFileName.parse(filePath).orElse(null);
        this.chunks = new Chunk[RegionConstants.CHUNKS_PER_REGION];
        this.flushed = false;
    }

    /**
     * Add a chunk to be written.
     *
     * @param chunk Chunk to store in its slot
     */
    public void addChunk(Chunk chunk) {
        if (flushed) {
            throw new IllegalStateException("Cannot add chunks after the region is written");
        }
        chunks[chunk.getIndex()] = chunk;
    }

    /**
     * Write all buffered chunks and the header.
     *
     * @throws CorruptionException if a chunk is too large and external chunks are unavailable
     * @throws IOException if write fails
     */
    public void flush() throws IOException {
        if (flushed) {
            return;
        }

        List<EncodedChunk> encoded = encodeAll();

        Path tempPath = filePath.resolveSibling(filePath.getFileName() + ".tmp");
        long size;
        try {
            size = writeRegion(tempPath, encoded);
            for (EncodedChunk entry : encoded) {
                if (entry.external()) {
                    writeExternal(entry);
                }
            }
            Files.move(tempPath, filePath, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException | RuntimeException e) {
            try {
                Files.deleteIfExists(tempPath);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }

        // Only once the new region is in place
        for (EncodedChunk entry : encoded) {
            if (!entry.external()) {
                deleteExternal(entry.chunk());
            }
        }

        flushed = true;

        LOGGER.info("[TurboNBT][Region] Wrote {} chunks to {} ({} bytes, {})",
                encoded.size(), filePath.getFileName(), size, compressionType.getConfigName());
    }

    /**
     * Encode and compress every buffered chunk, rejecting oversized ones that cannot go external.
     */
    private List<EncodedChunk> encodeAll() throws IOException {
        List<EncodedChunk> encoded = new ArrayList<>();
        for (int index = 0; index < RegionConstants.CHUNKS_PER_REGION; index++) {
            Chunk chunk = chunks[index];
            if (chunk == null) {
                continue;
            }

            byte[] raw = NBTIO.toBytes(NamedTag.unnamed(chunk.nbtView()));
            byte[] compressedData = compression.compress(raw, compressionType);

            // 4 byte length + 1 byte compression + data
            int sectorsNeeded = RegionConstants.sectorsFor(RegionConstants.CHUNK_HEADER_SIZE + compressedData.length);
            boolean external = sectorsNeeded > RegionConstants.MAX_SECTOR_COUNT;
            if (external && (!externalChunks || regionName == null)) {
                throw new CorruptionException("Chunk payload of " + compressedData.length
                        + " bytes exceeds " + RegionConstants.MAX_SECTOR_COUNT + " sectors"
                        + (externalChunks ? " and " + filePath.getFileName() + " has no region coordinates" : ""),
                        chunk.getX(), chunk.getZ(), CorruptionException.Type.OVERSIZED);
            }
            encoded.add(new EncodedChunk(index, chunk, compressedData, external));
        }
        return encoded;
    }

    /**
     * Lay out header and payloads in {@code target}.
     *
     * @return Size of the written file in bytes
     */
    private long writeRegion(Path target, List<EncodedChunk> encoded) throws IOException {
        RegionHeader header = new RegionHeader();
        int currentSector = RegionConstants.HEADER_SECTORS; // Start after header

        try (RandomAccessFile file = new RandomAccessFile(target.toFile(), "rw")) {
            file.setLength(0);
            for (EncodedChunk entry : encoded) {
                int chunkSize;
                int sectorsNeeded;

                file.seek((long) currentSector * RegionConstants.SECTOR_SIZE);
                if (entry.external()) {
                    file.writeInt(1);
                    file.writeByte(compressionType.getId() | RegionConstants.EXTERNAL_FLAG);
                    chunkSize = RegionConstants.CHUNK_HEADER_SIZE;
                    sectorsNeeded = 1;
                } else {
                    file.writeInt(entry.data().length + 1); // +1 for compression type
                    file.writeByte(compressionType.getId());
                    file.write(entry.data());
                    chunkSize = RegionConstants.CHUNK_HEADER_SIZE + entry.data().length;
                    sectorsNeeded = RegionConstants.sectorsFor(chunkSize);
                }

                // Pad to sector boundary
                int padding = (sectorsNeeded * RegionConstants.SECTOR_SIZE) - chunkSize;
                if (padding > 0) {
                    file.write(new byte[padding]);
                }

                header.setChunk(entry.index(), currentSector, sectorsNeeded, (int) entry.chunk().getTimestamp());
                currentSector += sectorsNeeded;
            }

            header.write(file);

            long size = (long) currentSector * RegionConstants.SECTOR_SIZE;
            file.setLength(size);
            return size;
        }
    }

    private void writeExternal(EncodedChunk entry) throws IOException {
        Chunk chunk = entry.chunk();
        Path externalPath = filePath.resolveSibling(regionName.externalChunkFileName(chunk.getX(), chunk.getZ()));
        Files.write(externalPath, entry.data());
        LOGGER.debug("[TurboNBT][Region] Chunk [{},{}] stored externally in {}",
                chunk.getX(), chunk.getZ(), externalPath.getFileName());
    }

    private void deleteExternal(Chunk chunk) throws IOException {
        if (regionName != null) {
            Files.deleteIfExists(filePath.resolveSibling(regionName.externalChunkFileName(chunk.getX(), chunk.getZ())));
        }
    }

    /**
     * Get number of chunks buffered.
     *
     * @return Chunk count
     */
    public int getChunkCount() {
        int count = 0;
        for (Chunk chunk : chunks) {
            if (chunk != null) {
                count++;
            }
        }
        return count;
    }

    public Path getFilePath() {
        return filePath;
    }

    @Override
    public void close() throws IOException {
        flush();
    }

    @Override
    public String toString() {
        return "RegionFileWriter{" +
               "file=" + filePath.getFileName() +
               ", chunks=" + getChunkCount() +
               ", written=" + flushed +
               '}';
    }

    private record EncodedChunk(int index, Chunk chunk, byte[] data, boolean external) {
    }
}
