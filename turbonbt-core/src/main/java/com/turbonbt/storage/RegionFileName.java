package com.turbonbt.storage;

import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Region coordinates encoded in a region file name, {@code r.<x>.<z>.<mca|mcr>}.
 *
 * @param x      Region X coordinate
 * @param z      Region Z coordinate
 * @param format Anvil (.mca) or legacy (.mcr)
 */
public record RegionFileName(int x, int z, Format format) {

    private static final Pattern PATTERN = Pattern.compile("^r\\.(-?\\d+)\\.(-?\\d+)\\.(mca|mcr)$");

    public enum Format {
        ANVIL("mca"),
        LEGACY("mcr");

        private final String extension;

        Format(String extension) {
            this.extension = extension;
        }

        public String getExtension() {
            return extension;
        }
    }

    /**
     * Parse a bare file name.
     *
     * @return Coordinates, or empty when the name does not follow the pattern
     */
    public static Optional<RegionFileName> parse(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        Matcher matcher = PATTERN.matcher(fileName);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        try {
            int x = Integer.parseInt(matcher.group(1));
            int z = Integer.parseInt(matcher.group(2));
            Format format = "mca".equals(matcher.group(3)) ? Format.ANVIL : Format.LEGACY;
            return Optional.of(new RegionFileName(x, z, format));
        } catch (NumberFormatException e) {
            // Digits overflow an int
            return Optional.empty();
        }
    }

    public static Optional<RegionFileName> parse(Path path) {
        Path fileName = path.getFileName();
        return fileName == null ? Optional.empty() : parse(fileName.toString());
    }

    /**
     * Region holding a global chunk position.
     */
    public static RegionFileName ofChunk(int chunkX, int chunkZ) {
        return new RegionFileName(RegionConstants.getRegionCoord(chunkX), RegionConstants.getRegionCoord(chunkZ), Format.ANVIL);
    }

    public String toFileName() {
        return "r." + x + "." + z + "." + format.getExtension();
    }

    /**
     * Name of the file holding an oversized chunk of this region, {@code c.<globalX>.<globalZ>.mcc}.
     */
    public String externalChunkFileName(int localX, int localZ) {
        int globalX = x * RegionConstants.REGION_SIZE + (localX & RegionConstants.CHUNK_X_MASK);
        int globalZ = z * RegionConstants.REGION_SIZE + (localZ & RegionConstants.CHUNK_Z_MASK);
        return "c." + globalX + "." + globalZ + RegionConstants.EXTERNAL_CHUNK_EXTENSION;
    }
}
