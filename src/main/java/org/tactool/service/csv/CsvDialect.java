package org.tactool.service.csv;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * A CSV layout understood by {@link PointCsvCodec}.
 *
 * <p>There are two dialects, and they must not be mixed up:
 * <ul>
 *   <li>{@link NativeDialect}: this tool's own full-fidelity point file</li>
 *   <li>{@link InstrumentDialect}: the partial file exported by the instrument software, read only for
 *       recoordination</li>
 * </ul>
 *
 * <p>The codec owns file handling and row iteration; a dialect only checks the header row and turns one
 * row, keyed by header name, into a value.
 *
 * @param <T> type a row is parsed into
 * @since 1.0
 */
public interface CsvDialect<T> {

    /**
     * @return short name used in log messages
     */
    String getName();

    /**
     * Rejects a file whose header row lacks a column this dialect needs.
     *
     * @param path    file being read, for the error message
     * @param headers header row, trimmed
     * @throws MalformedFileException if a required column is missing
     */
    void checkHeaders(Path path, List<String> headers) throws MalformedFileException;

    /**
     * Parses one data row.
     *
     * @param row       cell values keyed by header; absent cells are missing from the map
     * @param rowNumber 1-based data row number
     * @return the parsed value
     * @throws MalformedRowException if the row cannot be used
     */
    T parseRow(Map<String, String> row, int rowNumber) throws MalformedRowException;
}
