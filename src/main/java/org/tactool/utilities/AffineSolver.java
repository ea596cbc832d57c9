package org.tactool.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tactool.model.ReferenceTriplet;

import java.awt.geom.AffineTransform;
import java.awt.geom.Point2D;

/**
 * Fits and applies the 2D affine transform defined by three point correspondences.
 *
 * <p>Given source marks {@code s1, s2, s3} and destination marks {@code d1, d2, d3}, the solver finds
 * the unique {@code T(p) = A·p + b} with {@code T(si) = di}. The six unknowns split into two 3x3
 * systems, one per output axis, sharing the matrix
 * <pre>
 * | s1.x  s1.y  1 |
 * | s2.x  s2.y  1 |
 * | s3.x  s3.y  1 |
 * </pre>
 * which is singular exactly when the source marks are collinear.
 *
 * <p>Everything happens in pixel space: no scale or unit conversion is applied. Results that become
 * point coordinates are rounded half away from zero.
 *
 * @since 1.0
 */
public class AffineSolver {
    private static final Logger logger = LoggerFactory.getLogger(AffineSolver.class);

    /** Relative tolerance below which the source determinant counts as zero. */
    private static final double DEGENERACY_TOLERANCE = 1e-9;

    private AffineSolver() {
    }

    /**
     * Fits the transform mapping each source mark onto the destination mark at the same position.
     *
     * @param source source reference marks, in pairing order
     * @param dest   destination reference marks, in pairing order
     * @return transform with {@code T(source_i) = dest_i}
     * @throws DegenerateReferenceSetException if the source marks are collinear or coincident
     */
    public static AffineTransform fit(ReferenceTriplet source, ReferenceTriplet dest)
            throws DegenerateReferenceSetException {
        double[][] s = source.toArray();
        double[][] d = dest.toArray();

        double[][] m = {
                {s[0][0], s[0][1], 1.0},
                {s[1][0], s[1][1], 1.0},
                {s[2][0], s[2][1], 1.0}
        };
        double det = determinant(m);

        // Scale the tolerance with the size of the triangle so that it works for any pixel range
        double extent = 0;
        for (int i = 0; i < 3; i++) {
            for (int j = i + 1; j < 3; j++) {
                extent = Math.max(extent, Math.abs(s[i][0] - s[j][0]));
                extent = Math.max(extent, Math.abs(s[i][1] - s[j][1]));
            }
        }
        if (extent == 0 || Math.abs(det) <= DEGENERACY_TOLERANCE * extent * extent) {
            logger.error("Cannot fit affine transform: source reference points are degenerate (det={})", det);
            throw new DegenerateReferenceSetException(det);
        }

        double[] xRow = solve(m, det, new double[]{d[0][0], d[1][0], d[2][0]});
        double[] yRow = solve(m, det, new double[]{d[0][1], d[1][1], d[2][1]});

        // AffineTransform takes (m00, m10, m01, m11, m02, m12)
        AffineTransform transform = new AffineTransform(
                xRow[0], yRow[0],
                xRow[1], yRow[1],
                xRow[2], yRow[2]);

        logger.info("Fitted recoordination transform: {}", TransformationFunctions.formatTransformMatrix(transform));
        return transform;
    }

    /**
     * Applies a transform and rounds the result to integer pixel coordinates.
     *
     * @return {x, y} rounded half away from zero
     */
    public static int[] apply(AffineTransform transform, double x, double y) {
        double[] exact = applyExact(transform, x, y);
        return new int[]{roundHalfAwayFromZero(exact[0]), roundHalfAwayFromZero(exact[1])};
    }

    /**
     * Applies a transform without rounding.
     *
     * @return {x, y}
     */
    public static double[] applyExact(AffineTransform transform, double x, double y) {
        Point2D.Double src = new Point2D.Double(x, y);
        Point2D.Double dst = new Point2D.Double();
        transform.transform(src, dst);
        logger.debug("({}, {}) -> ({}, {})", x, y, dst.x, dst.y);
        return new double[]{dst.x, dst.y};
    }

    /**
     * @return true if the value is finite and rounds to a coordinate that fits in an {@code int}
     */
    public static boolean isPixelCoordinate(double value) {
        return !Double.isNaN(value) && Math.abs(value) < Integer.MAX_VALUE;
    }

    /**
     * Rounds to the nearest integer, with halves going away from zero (2.5 to 3, -2.5 to -3).
     *
     * @throws ArithmeticException if the rounded value does not fit in an {@code int}
     */
    public static int roundHalfAwayFromZero(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Cannot round non-finite coordinate " + value);
        }
        long rounded = Math.round(Math.abs(value));
        return Math.toIntExact(value < 0 ? -rounded : rounded);
    }

    // Cramer's rule, reusing the determinant of m
    private static double[] solve(double[][] m, double det, double[] rhs) {
        double[] result = new double[3];
        for (int col = 0; col < 3; col++) {
            double[][] replaced = new double[3][];
            for (int row = 0; row < 3; row++) {
                replaced[row] = m[row].clone();
                replaced[row][col] = rhs[row];
            }
            result[col] = determinant(replaced) / det;
        }
        return result;
    }

    private static double determinant(double[][] m) {
        return m[0][0] * (m[1][1] * m[2][2] - m[1][2] * m[2][1])
                - m[0][1] * (m[1][0] * m[2][2] - m[1][2] * m[2][0])
                + m[0][2] * (m[1][0] * m[2][1] - m[1][1] * m[2][0]);
    }
}
