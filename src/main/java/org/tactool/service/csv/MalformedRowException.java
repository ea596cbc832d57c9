package org.tactool.service.csv;

import org.tactool.model.TactoolException;

/**
 * Thrown when a single CSV row cannot be turned into a point, typically because a required numeric
 * field is missing or not a number. Batch readers catch it, record the row and carry on.
 *
 * @since 1.0
 */
public class MalformedRowException extends TactoolException {

    private final int rowNumber;
    private final String detail;
    private final boolean referenceRow;

    /**
     * @param rowNumber 1-based data row number (the header is not counted)
     * @param message   what is wrong with the row
     */
    public MalformedRowException(int rowNumber, String message) {
        this(rowNumber, message, false);
    }

    /**
     * @param referenceRow true if the row's label marks it as a reference mark
     */
    public MalformedRowException(int rowNumber, String message, boolean referenceRow) {
        super("Row " + rowNumber + ": " + message);
        this.rowNumber = rowNumber;
        this.detail = message;
        this.referenceRow = referenceRow;
    }

    public int getRowNumber() {
        return rowNumber;
    }

    /**
     * @return the message without the row prefix
     */
    public String getDetail() {
        return detail;
    }

    public boolean isReferenceRow() {
        return referenceRow;
    }
}
