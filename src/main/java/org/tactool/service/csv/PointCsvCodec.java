package org.tactool.service.csv;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.CSVWriter;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.exceptions.CsvValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tactool.model.AnalysisPoint;
import org.tactool.service.FileAccessException;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Reads and writes point CSV files in either {@link CsvDialect}.
 *
 * <p>Reading is one pass over the file with the dialect checking the header and parsing each row. A row
 * the dialect rejects is logged, recorded in the {@link RowImportResult} and skipped; the rest of the
 * file is still read. Header problems abort the read.
 *
 * <p>Quoting follows RFC 4180 (via OpenCSV), so notes containing commas or quotes survive a round trip.
 * File handles are closed on every path out of these methods.
 *
 * @since 1.0
 */
public class PointCsvCodec {
    private static final Logger logger = LoggerFactory.getLogger(PointCsvCodec.class);

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    /**
     * Reads every data row of a file with the given dialect.
     *
     * @param path    file to read
     * @param dialect layout of the file
     * @return accepted rows and skipped-row errors
     * @throws FileAccessException    if the file cannot be opened or read
     * @throws MalformedFileException if the file is empty or lacks required columns
     */
    public <T> RowImportResult<T> read(Path path, CsvDialect<T> dialect)
            throws FileAccessException, MalformedFileException {
        logger.info("Loading {} CSV: {}", dialect.getName(), path);

        List<T> items = new ArrayList<>();
        List<Integer> rows = new ArrayList<>();
        List<RowError> errors = new ArrayList<>();
        List<String> headers;

        try (BufferedReader in = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVReader reader = new CSVReaderBuilder(in)
                     .withCSVParser(new RFC4180ParserBuilder().build())
                     .build()) {

            String[] headerRow = reader.readNext();
            if (headerRow == null) {
                throw new MalformedFileException(path, "The file is empty");
            }
            headers = cleanHeaders(headerRow);
            dialect.checkHeaders(path, headers);

            int rowNumber = 0;
            String[] cells;
            while ((cells = reader.readNext()) != null) {
                rowNumber++;
                if (isBlank(cells)) {
                    logger.debug("Skipping blank line at row {}", rowNumber);
                    continue;
                }
                try {
                    items.add(dialect.parseRow(toMap(headers, cells), rowNumber));
                    rows.add(rowNumber);
                } catch (MalformedRowException e) {
                    logger.warn("Skipping row of {}: {}", path.getFileName(), e.getMessage());
                    errors.add(new RowError(rowNumber, e.getMessage(), e.isReferenceRow()));
                }
            }
        } catch (NoSuchFileException e) {
            logger.error("CSV file not found: {}", path);
            throw new FileAccessException(path, "File not found", e);
        } catch (IOException e) {
            logger.error("Error reading CSV: {}", path, e);
            throw new FileAccessException(path, "Could not read file", e);
        } catch (CsvValidationException e) {
            logger.error("Invalid CSV structure in {}", path, e);
            throw new MalformedFileException(path, "Invalid CSV structure at line " + e.getLineNumber());
        }

        logger.info("Read {} rows from {} ({} skipped)", items.size(), path.getFileName(), errors.size());
        return new RowImportResult<>(items, rows, errors, headers);
    }

    /**
     * Writes points in the native layout, in list order.
     *
     * @throws FileAccessException if the file cannot be written
     */
    public void writeNative(Path path, List<AnalysisPoint> points) throws FileAccessException {
        write(path, NativeDialect.HEADERS, points, NativeDialect::toRow);
        logger.info("Exported {} analysis points to {}", points.size(), path);
    }

    /**
     * Writes instrument rows back in their original column layout.
     *
     * @param headers   header row as read
     * @param rows      rows to write, with the cells to output
     * @throws FileAccessException if the file cannot be written
     */
    public void writeInstrument(Path path, List<String> headers, List<InstrumentRow> rows)
            throws FileAccessException {
        write(path, headers, rows, row -> headers.stream()
                .map(h -> row.cells().getOrDefault(h, ""))
                .toArray(String[]::new));
        logger.info("Saved {} instrument rows to {}", rows.size(), path);
    }

    private <T> void write(Path path, List<String> headers, List<T> items, Function<T, String[]> toRow)
            throws FileAccessException {
        try (BufferedWriter out = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out, CSVWriter.DEFAULT_SEPARATOR, CSVWriter.DEFAULT_QUOTE_CHARACTER,
                     CSVWriter.DEFAULT_ESCAPE_CHARACTER, CSVWriter.DEFAULT_LINE_END)) {
            writer.writeNext(headers.toArray(new String[0]), false);
            for (T item : items) {
                writer.writeNext(toRow.apply(item), false);
            }
        } catch (IOException e) {
            logger.error("Failed to write CSV to {}", path, e);
            throw new FileAccessException(path, "Could not write file", e);
        }
    }

    private static List<String> cleanHeaders(String[] headerRow) {
        List<String> headers = new ArrayList<>(headerRow.length);
        for (int i = 0; i < headerRow.length; i++) {
            String header = headerRow[i] == null ? "" : headerRow[i];
            if (i == 0 && !header.isEmpty() && header.charAt(0) == BYTE_ORDER_MARK) {
                header = header.substring(1);
            }
            headers.add(header.trim());
        }
        return headers;
    }

    private static Map<String, String> toMap(List<String> headers, String[] cells) {
        Map<String, String> row = new LinkedHashMap<>();
        for (int i = 0; i < headers.size() && i < cells.length; i++) {
            row.put(headers.get(i), cells[i]);
        }
        return row;
    }

    private static boolean isBlank(String[] cells) {
        return Arrays.stream(cells).allMatch(c -> c == null || c.isBlank());
    }
}
