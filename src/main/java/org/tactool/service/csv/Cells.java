package org.tactool.service.csv;

import org.tactool.utilities.AffineSolver;

import java.util.Map;

/**
 * Cell lookups and numeric conversions shared by the dialects.
 */
final class Cells {

    private Cells() {
    }

    /**
     * @return the first non-blank value among the given columns, or null if every one is blank or absent
     */
    static String value(Map<String, String> row, String... columns) {
        for (String column : columns) {
            String value = row.get(column);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    static double parseDouble(String value, String field, int rowNumber) throws MalformedRowException {
        if (value == null) {
            throw new MalformedRowException(rowNumber, "missing value for '" + field + "'");
        }
        try {
            double parsed = Double.parseDouble(value.trim());
            if (Double.isNaN(parsed) || Double.isInfinite(parsed)) {
                throw new MalformedRowException(rowNumber, "'" + field + "' is not a finite number: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new MalformedRowException(rowNumber, "'" + field + "' is not a number: " + value);
        }
    }

    /**
     * Parses a pixel coordinate, rounded half away from zero.
     */
    static int parsePixel(String value, String field, int rowNumber) throws MalformedRowException {
        double parsed = parseDouble(value, field, rowNumber);
        if (!AffineSolver.isPixelCoordinate(parsed)) {
            throw new MalformedRowException(rowNumber, "'" + field + "' is outside the pixel range: " + value);
        }
        return AffineSolver.roundHalfAwayFromZero(parsed);
    }

    static double parsePositiveDouble(String value, String field, int rowNumber) throws MalformedRowException {
        double parsed = parseDouble(value, field, rowNumber);
        if (parsed <= 0) {
            throw new MalformedRowException(rowNumber, "'" + field + "' must be positive, got " + value);
        }
        return parsed;
    }

    /**
     * Parses a whole number, accepting a decimal form with no fraction ("509.0") as written by spreadsheet
     * exports, and leading zeros ("007").
     */
    static int parseInteger(String value, String field, int rowNumber) throws MalformedRowException {
        if (value == null) {
            throw new MalformedRowException(rowNumber, "missing value for '" + field + "'");
        }
        String trimmed = value.trim();
        try {
            return Integer.parseInt(trimmed);
        } catch (NumberFormatException e) {
            double parsed = parseDouble(trimmed, field, rowNumber);
            if (parsed != Math.rint(parsed) || Math.abs(parsed) > Integer.MAX_VALUE) {
                throw new MalformedRowException(rowNumber, "'" + field + "' is not a whole number: " + value);
            }
            return (int) parsed;
        }
    }

    static int parsePositiveInteger(String value, String field, int rowNumber) throws MalformedRowException {
        int parsed = parseInteger(value, field, rowNumber);
        if (parsed <= 0) {
            throw new MalformedRowException(rowNumber, "'" + field + "' must be positive, got " + value);
        }
        return parsed;
    }
}
