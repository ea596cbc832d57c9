package org.tactool.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tactool.model.AnalysisPoint;
import org.tactool.model.PointRegistry;
import org.tactool.model.PointSettings;
import org.tactool.service.FileAccessException;
import org.tactool.service.csv.MalformedFileException;
import org.tactool.service.csv.NativeDialect;
import org.tactool.service.csv.PointCsvCodec;
import org.tactool.service.csv.RowError;
import org.tactool.service.csv.RowImportResult;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Saves the registry to a point file and loads it back.
 *
 * <p>Importing replaces the current session: the file is parsed completely first, and only if it is
 * usable is the registry cleared and refilled with the file's points, keeping their ids. A file that
 * cannot be used leaves the registry as it was.
 *
 * @since 1.0
 */
public class PointFileWorkflow {
    private static final Logger logger = LoggerFactory.getLogger(PointFileWorkflow.class);

    private final PointCsvCodec codec;

    public PointFileWorkflow() {
        this(new PointCsvCodec());
    }

    public PointFileWorkflow(PointCsvCodec codec) {
        this.codec = codec;
    }

    /**
     * Counts from an import.
     *
     * @param imported points now in the registry
     * @param errors   rows that were skipped, with the reason
     */
    public record ImportSummary(int imported, List<RowError> errors) {

        public ImportSummary {
            errors = List.copyOf(errors);
        }

        public int skipped() {
            return errors.size();
        }
    }

    /**
     * Replaces the registry contents with the points of a native file.
     *
     * @param settings fills optional columns that are missing or empty
     * @throws FileAccessException    if the file cannot be read
     * @throws MalformedFileException if the file lacks required columns or no row could be read
     */
    public ImportSummary importPoints(PointRegistry registry, Path path, PointSettings settings)
            throws FileAccessException, MalformedFileException {
        RowImportResult<AnalysisPoint> result = codec.read(path, new NativeDialect(settings));

        List<RowError> errors = new ArrayList<>(result.errors());
        List<AnalysisPoint> points = new ArrayList<>();
        Set<Integer> ids = new HashSet<>();
        for (int i = 0; i < result.items().size(); i++) {
            AnalysisPoint point = result.items().get(i);
            if (!ids.add(point.getId())) {
                logger.warn("Skipping point with duplicate id {} in {}", point.getId(), path.getFileName());
                errors.add(new RowError(result.rows().get(i), "Duplicate point id " + point.getId()));
                continue;
            }
            points.add(point);
        }

        if (points.isEmpty() && !errors.isEmpty()) {
            logger.error("No analysis points could be read from {}", path);
            throw new MalformedFileException(path, "None of the " + errors.size() + " rows could be read");
        }

        registry.clear();
        points.forEach(registry::add);
        logger.info("Imported {} analysis points from {} ({} skipped)", points.size(), path, errors.size());
        return new ImportSummary(points.size(), errors);
    }

    /**
     * Writes every point of the registry, in insertion order.
     *
     * @throws FileAccessException if the file cannot be written
     */
    public void exportPoints(PointRegistry registry, Path path) throws FileAccessException {
        codec.writeNative(path, registry.points());
    }
}
