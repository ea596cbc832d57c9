package org.tactool.service.csv;

import java.util.List;

/**
 * Outcome of reading a CSV file: the rows that were accepted, and every row that was skipped.
 *
 * @param items   accepted rows, in file order
 * @param rows    1-based data row number of each accepted row
 * @param errors  skipped rows, in file order
 * @param headers header row of the file, in file order
 * @param <T>     type a row is parsed into
 */
public record RowImportResult<T>(List<T> items, List<Integer> rows, List<RowError> errors,
                                 List<String> headers) {

    public RowImportResult {
        if (items.size() != rows.size()) {
            throw new IllegalArgumentException("Every accepted row needs a row number");
        }
        items = List.copyOf(items);
        rows = List.copyOf(rows);
        errors = List.copyOf(errors);
        headers = List.copyOf(headers);
    }

    public int skippedCount() {
        return errors.size();
    }

    /**
     * @return true if the file had rows but none of them could be used
     */
    public boolean isTotalFailure() {
        return items.isEmpty() && !errors.isEmpty();
    }
}
