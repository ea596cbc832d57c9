package org.tactool.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tactool.model.PointSettings;
import org.tactool.service.csv.NativeDialect;

import java.util.regex.Pattern;

/**
 * Checks sample names before they are written into the {@code Name} column of a point file.
 *
 * <p>The name is written as {@code <sample>_#<id>} and split again on the last {@code _#} when read, so
 * a sample name that itself ends in {@code _#} followed by digits would read back with the wrong id.
 * Names containing {@code _#} are therefore rejected outright. Sample names are also used to suggest
 * export file names, so the usual filename-unsafe characters are rejected too:
 * <ul>
 *   <li>{@code / \ : * ? " < > |}
 *   <li>line breaks
 * </ul>
 *
 * @since 1.0
 */
public class SampleNameValidator {
    private static final Logger logger = LoggerFactory.getLogger(SampleNameValidator.class);

    private static final Pattern UNSAFE_CHARS = Pattern.compile("[/\\\\:*?\"<>|\\n\\r]");

    private static final String REPLACEMENT = "_";

    private SampleNameValidator() {
    }

    /**
     * @param sampleName name to check, may be null
     * @return true if the name survives the point-file round trip and is safe in file names
     */
    public static boolean isValid(String sampleName) {
        return getValidationError(sampleName) == null;
    }

    /**
     * @param sampleName name to check
     * @return why the name is unusable, or null if it is fine
     */
    public static String getValidationError(String sampleName) {
        if (sampleName == null || sampleName.isBlank()) {
            return "Sample name cannot be empty";
        }
        if (sampleName.contains(NativeDialect.ID_SEPARATOR)) {
            return "Sample name cannot contain '" + NativeDialect.ID_SEPARATOR
                    + "', it separates the sample name from the point id";
        }
        if (UNSAFE_CHARS.matcher(sampleName).find()) {
            return "Sample name contains illegal characters: / \\ : * ? \" < > |";
        }
        if (!sampleName.strip().equals(sampleName)) {
            return "Sample name cannot start or end with spaces";
        }
        return null;
    }

    /**
     * Replaces the separator and unsafe characters with underscores.
     *
     * @param sampleName name to clean
     * @return a valid name, {@code None} if nothing usable is left
     */
    public static String sanitize(String sampleName) {
        if (sampleName == null || sampleName.isBlank()) {
            return PointSettings.NONE;
        }
        String sanitized = UNSAFE_CHARS.matcher(sampleName.strip()).replaceAll(REPLACEMENT);
        while (sanitized.contains(NativeDialect.ID_SEPARATOR)) {
            sanitized = sanitized.replace(NativeDialect.ID_SEPARATOR, REPLACEMENT);
        }
        logger.debug("Sanitized sample name '{}' to '{}'", sampleName, sanitized);
        return sanitized;
    }
}
