package org.tactool.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tactool.model.ReferenceTriplet;

import java.awt.geom.AffineTransform;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Coordinate helpers shared by the recoordination workflow.
 *
 * <p>Coordinate frames:
 * <ul>
 *   <li><b>Image:</b> pixels of the annotation image, origin top-left</li>
 *   <li><b>Instrument:</b> coordinates exported by the instrument software, x measured from the
 *       top-right corner</li>
 * </ul>
 *
 * <p>Inverting x with the image width moves instrument coordinates to a top-left origin before a
 * transform is fitted.
 *
 * @since 1.0
 */
public class TransformationFunctions {
    private static final Logger logger = LoggerFactory.getLogger(TransformationFunctions.class);

    private TransformationFunctions() {
    }

    // ==================== AXIS INVERSION ====================

    /**
     * Moves an x coordinate between a top-right and a top-left origin. Applying it twice with the same
     * width returns the original value.
     *
     * @param x          x coordinate
     * @param imageWidth width of the image in pixels
     * @return {@code imageWidth - x}
     */
    public static double invertX(double x, double imageWidth) {
        return imageWidth - x;
    }

    /**
     * Inverts the selected axes of a coordinate pair.
     *
     * @param coords      coordinates [x, y]
     * @param imageWidth  image width
     * @param imageHeight image height
     * @param invertX     invert horizontally
     * @param invertY     invert vertically
     * @return new coordinates [x, y]
     */
    public static double[] invertAxes(double[] coords, double imageWidth, double imageHeight,
                                      boolean invertX, boolean invertY) {
        if (coords == null || coords.length != 2) {
            throw new IllegalArgumentException("Coordinates must be [x, y]");
        }
        double x = invertX ? imageWidth - coords[0] : coords[0];
        double y = invertY ? imageHeight - coords[1] : coords[1];
        return new double[]{x, y};
    }

    // ==================== VALIDATION ====================

    /**
     * @return true if the coordinate lies inside {@code [0, width] x [0, height]}
     */
    public static boolean isWithinImage(double x, double y, double imageWidth, double imageHeight) {
        return x >= 0 && x <= imageWidth && y >= 0 && y <= imageHeight;
    }

    /**
     * Checks that a fitted transform reproduces its own reference marks.
     *
     * @param transform transform to check
     * @param source    source marks
     * @param dest      expected destination marks
     * @param tolerance maximum acceptable distance in pixels
     * @return true if all three marks map within tolerance
     */
    public static boolean validateTransformWithReferences(AffineTransform transform,
                                                          ReferenceTriplet source,
                                                          ReferenceTriplet dest,
                                                          double tolerance) {
        boolean allValid = true;
        for (int i = 0; i < ReferenceTriplet.SIZE; i++) {
            double[] input = source.get(i);
            double[] expected = dest.get(i);
            double[] actual = AffineSolver.applyExact(transform, input[0], input[1]);

            double error = Math.hypot(actual[0] - expected[0], actual[1] - expected[1]);
            if (error > tolerance) {
                logger.warn("Reference {} maps to ({}, {}) instead of ({}, {}), error {} px",
                        i + 1, actual[0], actual[1], expected[0], expected[1], error);
                allValid = false;
            } else {
                logger.debug("Reference {} validated with error {} px", i + 1, error);
            }
        }
        return allValid;
    }

    // ==================== LOGGING ====================

    /**
     * Formats transform matrix for readable logging.
     */
    public static String formatTransformMatrix(AffineTransform transform) {
        return String.format(Locale.ROOT, "[%.4f, %.4f, %.4f, %.4f, %.4f, %.4f]",
                transform.getScaleX(), transform.getShearX(), transform.getShearY(),
                transform.getScaleY(), transform.getTranslateX(), transform.getTranslateY());
    }

    /**
     * Logs detailed transform information for debugging.
     *
     * @param name      transform description
     * @param transform the transform to log
     */
    public static void logTransformDetails(String name, AffineTransform transform) {
        double[] matrix = new double[6];
        transform.getMatrix(matrix);

        logger.debug("{} transform details:", name);
        logger.debug("  Matrix: [m00={}, m10={}, m01={}, m11={}, m02={}, m12={}]",
                matrix[0], matrix[1], matrix[2], matrix[3], matrix[4], matrix[5]);
        logger.debug("  Determinant: {}", transform.getDeterminant());
        logger.debug("  Type: {}", describeTransformType(transform.getType()));
    }

    /**
     * Describes the type of affine transform in human-readable form.
     */
    static String describeTransformType(int type) {
        if (type == AffineTransform.TYPE_IDENTITY) {
            return "IDENTITY";
        }
        List<String> types = new ArrayList<>();
        if ((type & AffineTransform.TYPE_TRANSLATION) != 0) types.add("TRANSLATION");
        if ((type & AffineTransform.TYPE_UNIFORM_SCALE) != 0) types.add("UNIFORM_SCALE");
        if ((type & AffineTransform.TYPE_GENERAL_SCALE) != 0) types.add("GENERAL_SCALE");
        if ((type & AffineTransform.TYPE_FLIP) != 0) types.add("FLIP");
        if ((type & AffineTransform.TYPE_QUADRANT_ROTATION) != 0) types.add("QUADRANT_ROTATION");
        if ((type & AffineTransform.TYPE_GENERAL_ROTATION) != 0) types.add("GENERAL_ROTATION");
        if ((type & AffineTransform.TYPE_GENERAL_TRANSFORM) != 0) types.add("GENERAL_TRANSFORM");
        return String.join(" | ", types);
    }
}
