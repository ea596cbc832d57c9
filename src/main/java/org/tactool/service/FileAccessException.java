package org.tactool.service;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Exception thrown when a file cannot be read or written.
 * Carries the path so the message shown to the user can name it.
 *
 * @since 1.0
 */
public class FileAccessException extends IOException {

    private final transient Path path;

    /**
     * @param path    the file that could not be accessed
     * @param message the detail message
     * @param cause   the underlying I/O failure, may be null
     */
    public FileAccessException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public FileAccessException(Path path, String message) {
        this(path, message, null);
    }

    public Path getPath() {
        return path;
    }
}
