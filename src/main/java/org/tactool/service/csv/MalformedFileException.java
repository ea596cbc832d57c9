package org.tactool.service.csv;

import org.tactool.model.TactoolException;

import java.nio.file.Path;
import java.util.List;

/**
 * Thrown when a CSV file as a whole cannot be used: required columns are missing, or not a single row
 * could be read. The operation is abandoned before anything is changed.
 *
 * @since 1.0
 */
public class MalformedFileException extends TactoolException {

    private final transient Path path;

    public MalformedFileException(Path path, String message) {
        super(message + " (" + fileName(path) + ")");
        this.path = path;
    }

    /**
     * Builds the "missing headers" message listing each required header on its own line.
     */
    public static MalformedFileException missingHeaders(Path path, List<String> required) {
        StringBuilder sb = new StringBuilder("The given file does not contain the required headers:");
        for (String header : required) {
            sb.append("\n    ").append(header);
        }
        return new MalformedFileException(path, sb.toString());
    }

    public Path getPath() {
        return path;
    }

    private static String fileName(Path path) {
        return path == null || path.getFileName() == null ? String.valueOf(path) : path.getFileName().toString();
    }
}
