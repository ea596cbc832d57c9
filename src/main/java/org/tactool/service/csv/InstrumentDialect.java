package org.tactool.service.csv;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tactool.utilities.TransformationFunctions;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The coordinate file exported by the instrument software, read for recoordination.
 *
 * <p>Only four columns matter and their names are configurable: an identifier, x, y, and a
 * classification column whose value marks reference rows. Every other native field is absent and is
 * filled from the current point settings when points are created.
 *
 * <p>The instrument measures x from the top-right corner, the annotation image from the top-left, so
 * rows are read with {@code x = imageWidth - x_instrument}. Call {@link #withImageWidth(double)} before
 * reading. Set {@code invertX} to false to read a file whose x already has a top-left origin.
 *
 * <pre>{@code
 * InstrumentDialect dialect = InstrumentDialect.defaults().withImageWidth(image.getWidth());
 * RowImportResult<InstrumentRow> rows = codec.read(path, dialect);
 * }</pre>
 *
 * @since 1.0
 */
public class InstrumentDialect implements CsvDialect<InstrumentRow> {
    private static final Logger logger = LoggerFactory.getLogger(InstrumentDialect.class);

    public static final String DEFAULT_ID_HEADER = "Particle ID";
    public static final String DEFAULT_X_HEADER = "Laser Ablation Centre X";
    public static final String DEFAULT_Y_HEADER = "Laser Ablation Centre Y";
    public static final String DEFAULT_LABEL_HEADER = "Mineral Classification";
    public static final String DEFAULT_REFERENCE_LABEL = "Fiducial";

    private final String idHeader;
    private final String xHeader;
    private final String yHeader;
    private final String labelHeader;
    private final String referenceLabel;
    private final boolean invertX;
    private final double imageWidth;

    public InstrumentDialect(String idHeader, String xHeader, String yHeader,
                             String labelHeader, String referenceLabel, boolean invertX) {
        this(idHeader, xHeader, yHeader, labelHeader, referenceLabel, invertX, Double.NaN);
    }

    private InstrumentDialect(String idHeader, String xHeader, String yHeader,
                              String labelHeader, String referenceLabel, boolean invertX, double imageWidth) {
        this.idHeader = requireName(idHeader, "id");
        this.xHeader = requireName(xHeader, "x");
        this.yHeader = requireName(yHeader, "y");
        this.labelHeader = requireName(labelHeader, "label");
        this.referenceLabel = requireName(referenceLabel, "reference label");
        this.invertX = invertX;
        this.imageWidth = imageWidth;
    }

    /**
     * @return the layout of the instrument's standard export, with x inversion
     */
    public static InstrumentDialect defaults() {
        return new InstrumentDialect(DEFAULT_ID_HEADER, DEFAULT_X_HEADER, DEFAULT_Y_HEADER,
                DEFAULT_LABEL_HEADER, DEFAULT_REFERENCE_LABEL, true);
    }

    /**
     * @param width pixel width of the destination image, used for x inversion
     * @return a copy bound to that width
     */
    public InstrumentDialect withImageWidth(double width) {
        if (!(width > 0)) {
            throw new IllegalArgumentException("Image width must be positive, got " + width);
        }
        return new InstrumentDialect(idHeader, xHeader, yHeader, labelHeader, referenceLabel, invertX, width);
    }

    public String getIdHeader() { return idHeader; }
    public String getXHeader() { return xHeader; }
    public String getYHeader() { return yHeader; }
    public String getLabelHeader() { return labelHeader; }
    public String getReferenceLabel() { return referenceLabel; }
    public boolean isInvertX() { return invertX; }
    public double getImageWidth() { return imageWidth; }

    @Override
    public String getName() {
        return "instrument";
    }

    /**
     * @return the columns a file must have, in the order they are reported when missing
     */
    public List<String> requiredHeaders() {
        return List.of(idHeader, xHeader, yHeader, labelHeader);
    }

    @Override
    public void checkHeaders(Path path, List<String> headers) throws MalformedFileException {
        List<String> missing = new ArrayList<>();
        for (String required : requiredHeaders()) {
            if (!headers.contains(required)) {
                missing.add(required);
            }
        }
        if (!missing.isEmpty()) {
            logger.error("Instrument file {} is missing headers {}", path, missing);
            throw MalformedFileException.missingHeaders(path, requiredHeaders());
        }
    }

    @Override
    public InstrumentRow parseRow(Map<String, String> row, int rowNumber) throws MalformedRowException {
        if (invertX && Double.isNaN(imageWidth)) {
            throw new IllegalStateException("Instrument dialect needs the image width to invert x");
        }
        String labelValue = row.get(labelHeader);
        boolean reference = labelValue != null && labelValue.trim().equalsIgnoreCase(referenceLabel);

        double rawX;
        double rawY;
        try {
            rawX = Cells.parseDouble(Cells.value(row, xHeader), xHeader, rowNumber);
            rawY = Cells.parseDouble(Cells.value(row, yHeader), yHeader, rowNumber);
        } catch (MalformedRowException e) {
            if (!reference) {
                throw e;
            }
            throw new MalformedRowException(rowNumber, "reference mark " + e.getDetail(), true);
        }
        double x = invertX ? TransformationFunctions.invertX(rawX, imageWidth) : rawX;

        Integer id = null;
        String idText = Cells.value(row, idHeader);
        if (reference) {
            // Reference rows usually have no particle id
            if (idText != null) {
                try {
                    id = Cells.parsePositiveInteger(idText, idHeader, rowNumber);
                } catch (MalformedRowException e) {
                    logger.debug("Ignoring unusable id on reference row {}: {}", rowNumber, idText);
                }
            }
        } else {
            id = Cells.parsePositiveInteger(idText, idHeader, rowNumber);
        }
        return new InstrumentRow(rowNumber, id, reference, x, rawY, rawX, rawY, row);
    }

    /**
     * Converts an image-frame x back to the instrument's convention, for writing a file back out.
     */
    public double toInstrumentX(double x) {
        return invertX ? TransformationFunctions.invertX(x, imageWidth) : x;
    }

    private static String requireName(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Instrument " + what + " header must not be blank");
        }
        return value;
    }
}
