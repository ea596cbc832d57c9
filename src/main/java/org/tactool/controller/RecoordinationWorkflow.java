package org.tactool.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tactool.model.AnalysisPoint;
import org.tactool.model.InsufficientReferencePointsException;
import org.tactool.model.PointLabel;
import org.tactool.model.PointRegistry;
import org.tactool.model.PointSettings;
import org.tactool.model.ReferenceTriplet;
import org.tactool.model.TactoolException;
import org.tactool.service.FileAccessException;
import org.tactool.service.csv.InstrumentDialect;
import org.tactool.service.csv.InstrumentRow;
import org.tactool.service.csv.MalformedFileException;
import org.tactool.service.csv.PointCsvCodec;
import org.tactool.service.csv.RowError;
import org.tactool.service.csv.RowImportResult;
import org.tactool.utilities.AffineSolver;
import org.tactool.utilities.TransformationFunctions;

import java.awt.geom.AffineTransform;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Moves the points of an instrument coordinate file into the annotation image's frame and adds them
 * to the point registry.
 *
 * <p>The workflow:
 * <ol>
 *   <li>Takes the first three reference marks of the registry as destination marks</li>
 *   <li>Reads the instrument file, inverting x with the destination image width</li>
 *   <li>Takes the first three reference rows of the file as source marks</li>
 *   <li>Fits the affine transform pairing the marks by position</li>
 *   <li>Transforms every target row into a {@code Spot} point built from the current settings</li>
 *   <li>Inserts the points, all at once, once every row has been processed</li>
 *   <li>Optionally writes the instrument file back with the new coordinates</li>
 * </ol>
 *
 * <p>Problems with the file as a whole (missing columns, too few or unreadable reference rows,
 * collinear marks) abort before the registry is touched. Problems with single rows skip the row and are
 * counted in the result.
 *
 * @since 1.0
 */
public class RecoordinationWorkflow {
    private static final Logger logger = LoggerFactory.getLogger(RecoordinationWorkflow.class);

    /** Distance in pixels within which a fitted transform must reproduce its reference marks. */
    private static final double REFERENCE_TOLERANCE = 0.5;

    private static final String REGISTRY_SIDE = "registry";
    private static final String INSTRUMENT_SIDE = "instrument file";

    private final PointCsvCodec codec;

    public RecoordinationWorkflow() {
        this(new PointCsvCodec());
    }

    public RecoordinationWorkflow(PointCsvCodec codec) {
        this.codec = codec;
    }

    /**
     * Recoordinates an instrument file using the registry's reference marks.
     *
     * @param registry registry supplying the destination marks and receiving the new points
     * @param request  file, dialect, settings and image size
     * @return inserted points, skipped row count and the fitted transform
     * @throws InsufficientReferencePointsException if either side has fewer than three reference marks
     * @throws MalformedFileException               if the file lacks required columns, or every target row failed
     * @throws FileAccessException                  if the file cannot be read, or the output cannot be written
     * @throws TactoolException                     if the source marks are collinear
     */
    public RecoordinationResult recoordinate(PointRegistry registry, RecoordinationRequest request)
            throws TactoolException, FileAccessException {
        ReferenceTriplet destination = registry.referenceTriplet();

        RowImportResult<InstrumentRow> rows = codec.read(request.getInstrumentFile(), request.boundDialect());
        List<InstrumentRow> referenceRows = rows.items().stream()
                .filter(InstrumentRow::reference)
                .toList();
        checkLeadingReferenceRows(request.getInstrumentFile(), referenceRows, rows.errors());
        List<double[]> sourceMarks = referenceRows.stream()
                .map(InstrumentRow::coordinates)
                .toList();
        if (sourceMarks.size() < ReferenceTriplet.SIZE) {
            logger.error("Instrument file {} has {} reference rows, at least 3 are required",
                    request.getInstrumentFile(), sourceMarks.size());
        }
        ReferenceTriplet source = ReferenceTriplet.of(sourceMarks, INSTRUMENT_SIDE);

        logger.debug("Calculating recoordination matrix");
        AffineTransform transform = AffineSolver.fit(source, destination);
        if (!TransformationFunctions.validateTransformWithReferences(transform, source, destination,
                REFERENCE_TOLERANCE)) {
            logger.warn("Fitted transform does not reproduce the reference marks within {} px",
                    REFERENCE_TOLERANCE);
        }
        TransformationFunctions.logTransformDetails("Recoordination", transform);

        return applyTransform(registry, request, rows, transform);
    }

    /**
     * Recoordinates an instrument file with a previously saved transform. No fit takes place, so neither
     * the registry nor the file needs reference marks; reference rows of the file are not inserted.
     *
     * @param transform transform from the instrument frame (after x inversion) to the image frame
     */
    public RecoordinationResult recoordinate(PointRegistry registry, RecoordinationRequest request,
                                             AffineTransform transform)
            throws TactoolException, FileAccessException {
        logger.info("Recoordinating {} with saved transform {}",
                request.getInstrumentFile(), TransformationFunctions.formatTransformMatrix(transform));
        RowImportResult<InstrumentRow> rows = codec.read(request.getInstrumentFile(), request.boundDialect());
        return applyTransform(registry, request, rows, new AffineTransform(transform));
    }

    private RecoordinationResult applyTransform(PointRegistry registry, RecoordinationRequest request,
                                                RowImportResult<InstrumentRow> rows, AffineTransform transform)
            throws TactoolException, FileAccessException {
        PointSettings settings = request.getSettings();
        InstrumentDialect dialect = request.boundDialect();
        double width = request.getImageWidth();
        double height = request.getImageHeight();

        List<AnalysisPoint> accepted = new ArrayList<>();
        List<InstrumentRow> rewritten = new ArrayList<>();
        Set<Integer> batchIds = new HashSet<>();
        int skipped = rows.skippedCount();
        int outOfBounds = 0;

        for (InstrumentRow row : rows.items()) {
            double[] exact = AffineSolver.applyExact(transform, row.x(), row.y());
            rewritten.add(withCoordinates(row, dialect, exact));
            if (row.reference()) {
                continue;
            }

            Integer id = row.id();
            if (registry.contains(id) || !batchIds.add(id)) {
                logger.warn("Skipping instrument row {}: id {} is already in use", row.rowNumber(), id);
                skipped++;
                continue;
            }

            if (!AffineSolver.isPixelCoordinate(exact[0]) || !AffineSolver.isPixelCoordinate(exact[1])) {
                logger.warn("Skipping instrument row {}: ({}, {}) lands outside the pixel range",
                        row.rowNumber(), exact[0], exact[1]);
                skipped++;
                continue;
            }
            int[] position = {AffineSolver.roundHalfAwayFromZero(exact[0]),
                    AffineSolver.roundHalfAwayFromZero(exact[1])};
            AnalysisPoint point = settings.newPoint(position[0], position[1])
                    .id(id)
                    .label(PointLabel.SPOT)
                    .build();
            accepted.add(point);
            logger.debug("Transformed point ({}, {}) to ({}, {})", row.x(), row.y(), position[0], position[1]);

            if (!TransformationFunctions.isWithinImage(position[0], position[1], width, height)) {
                outOfBounds++;
            }
        }

        if (accepted.isEmpty() && skipped > 0) {
            logger.error("None of the {} target rows of {} could be recoordinated",
                    skipped, request.getInstrumentFile());
            throw new MalformedFileException(request.getInstrumentFile(),
                    "None of the " + skipped + " target rows could be recoordinated");
        }

        if (request.getOutputFile().isPresent()) {
            Path output = request.getOutputFile().get();
            logger.info("Saving recoordination results to: {}", output);
            codec.writeInstrument(output, rows.headers(), rewritten);
        }

        accepted.forEach(registry::add);
        logger.info("Transformed {} points ({} skipped)", accepted.size(), skipped);
        if (outOfBounds > 0) {
            logger.warn("{} of the recoordinated points go beyond the current image boundary", outOfBounds);
        }
        return new RecoordinationResult(accepted, skipped, outOfBounds, transform);
    }

    /**
     * Fails if any of the file's first three reference rows could not be read. Dropping one would pull a
     * later reference row into its place and pair it with the wrong registry mark.
     */
    private static void checkLeadingReferenceRows(Path file, List<InstrumentRow> referenceRows,
                                                  List<RowError> errors) throws MalformedFileException {
        int lastUsedRow = referenceRows.size() >= ReferenceTriplet.SIZE
                ? referenceRows.get(ReferenceTriplet.SIZE - 1).rowNumber()
                : Integer.MAX_VALUE;
        for (RowError error : errors) {
            if (error.referenceRow() && error.rowNumber() < lastUsedRow) {
                logger.error("Reference row {} of {} could not be read: {}", error.rowNumber(), file, error.message());
                throw new MalformedFileException(file,
                        "Reference row " + error.rowNumber() + " could not be read, so the reference marks cannot be paired");
            }
        }
    }

    /**
     * Copies a row with its coordinate cells replaced, x converted back to the instrument's origin.
     */
    private static InstrumentRow withCoordinates(InstrumentRow row, InstrumentDialect dialect, double[] exact) {
        double fileX = dialect.toInstrumentX(exact[0]);
        Map<String, String> cells = new LinkedHashMap<>(row.cells());
        cells.put(dialect.getXHeader(), formatCoordinate(fileX));
        cells.put(dialect.getYHeader(), formatCoordinate(exact[1]));
        return new InstrumentRow(row.rowNumber(), row.id(), row.reference(),
                exact[0], exact[1], fileX, exact[1], cells);
    }

    static String formatCoordinate(double value) {
        // Collapse negative zero and drop trailing zeros: 50.0 -> "50", 12.50 -> "12.5"
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        double cleaned = value == 0 ? 0 : value;
        return BigDecimal.valueOf(cleaned).stripTrailingZeros().toPlainString();
    }
}
