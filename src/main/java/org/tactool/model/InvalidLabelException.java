package org.tactool.model;

/**
 * Thrown when a label value is neither {@code RefMark} nor {@code Spot}.
 *
 * @since 1.0
 */
public class InvalidLabelException extends IllegalArgumentException {

    private final String value;

    public InvalidLabelException(String value) {
        super(String.format("'%s' is not a valid label. Please use either 'Spot' or 'RefMark'.", value));
        this.value = value;
    }

    /**
     * @return the rejected label text, as given
     */
    public String getValue() {
        return value;
    }
}
