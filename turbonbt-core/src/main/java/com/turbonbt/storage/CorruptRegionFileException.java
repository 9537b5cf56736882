package com.turbonbt.storage;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Thrown when a file cannot be a region file at all, e.g. it is shorter than its header.
 */
public class CorruptRegionFileException extends IOException {

    private final Path path;

    public CorruptRegionFileException(Path path, String message) {
        super(path.getFileName() + ": " + message);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
