package org.tactool.model;

/**
 * The two kinds of analysis point.
 *
 * <p>{@link #REF_MARK} points are the shared reference marks used to fit a recoordination transform;
 * {@link #SPOT} points are ordinary ablation targets. The text form ({@code "RefMark"} / {@code "Spot"})
 * is what appears in CSV files.
 *
 * @since 1.0
 */
public enum PointLabel {
    REF_MARK("RefMark"),
    SPOT("Spot");

    private final String text;

    PointLabel(String text) {
        this.text = text;
    }

    /**
     * @return the file representation, {@code "RefMark"} or {@code "Spot"}
     */
    public String getText() {
        return text;
    }

    /**
     * Parses a label, ignoring case and surrounding whitespace, so that {@code "SPOT"} or
     * {@code "refmark"} typed by a user are accepted.
     *
     * @param value label text
     * @return the matching label
     * @throws InvalidLabelException if the value is null or not a known label
     */
    public static PointLabel parse(String value) {
        if (value != null) {
            String trimmed = value.trim();
            for (PointLabel label : values()) {
                if (label.text.equalsIgnoreCase(trimmed)) {
                    return label;
                }
            }
        }
        throw new InvalidLabelException(value);
    }

    @Override
    public String toString() {
        return text;
    }
}
