package org.tactool.service.csv;

/**
 * A row that was skipped during a batch read.
 *
 * @param rowNumber    1-based data row number
 * @param message      why the row was skipped
 * @param referenceRow true if the row was labelled as a reference mark
 */
public record RowError(int rowNumber, String message, boolean referenceRow) {

    public RowError(int rowNumber, String message) {
        this(rowNumber, message, false);
    }

    @Override
    public String toString() {
        return "Row " + rowNumber + ": " + message;
    }
}
