package com.peerkeys.storage;

import java.nio.file.Path;

/**
 * Thrown when a storage tier fails for a reason other than a missing key.
 */
public class StorageException extends RuntimeException {

    private final Path location;

    public StorageException(String message) {
        super(message);
        this.location = null;
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
        this.location = null;
    }

    public StorageException(String message, Path location, Throwable cause) {
        super(String.format("%s (location=%s)", message, location), cause);
        this.location = location;
    }

    /**
     * @return the file or directory involved, or null when not file-backed
     */
    public Path getLocation() {
        return location;
    }
}
