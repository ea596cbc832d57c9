package org.tactool.service.csv;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One row of an instrument file.
 *
 * <p>{@code x} and {@code y} are already in the annotation image's top-left frame (x inverted when the
 * dialect requires it); {@code rawX} and {@code rawY} are the values as written in the file. The full
 * set of original cells is kept so that the file can be written back with new coordinates.
 *
 * @param rowNumber 1-based data row number
 * @param id        point id from the identifier column, null for reference rows that have none
 * @param reference true if the label column marks this row as a reference mark
 * @param x         x in the image frame
 * @param y         y in the image frame
 * @param rawX      x as read from the file
 * @param rawY      y as read from the file
 * @param cells     all cells of the row keyed by header, in file order
 */
public record InstrumentRow(int rowNumber, Integer id, boolean reference,
                            double x, double y, double rawX, double rawY,
                            Map<String, String> cells) {

    public InstrumentRow {
        cells = Collections.unmodifiableMap(new LinkedHashMap<>(cells));
    }

    public double[] coordinates() {
        return new double[]{x, y};
    }
}
