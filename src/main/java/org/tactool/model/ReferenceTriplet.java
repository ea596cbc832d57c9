package org.tactool.model;

import java.util.Arrays;
import java.util.List;

/**
 * The three reference marks of one side of a recoordination, in the order they pair with the other
 * side: the i-th mark here corresponds to the i-th mark there.
 *
 * <p>Pairing is purely positional. Nothing checks that two marks at the same index are the same
 * physical feature, so the caller must place (or list) reference marks in the same order on both sides.
 *
 * @param first  first reference coordinate {x, y}
 * @param second second reference coordinate {x, y}
 * @param third  third reference coordinate {x, y}
 * @since 1.0
 */
public record ReferenceTriplet(double[] first, double[] second, double[] third) {

    /** Number of correspondences an affine fit uses. */
    public static final int SIZE = 3;

    public ReferenceTriplet {
        checkCoordinate(first);
        checkCoordinate(second);
        checkCoordinate(third);
        first = first.clone();
        second = second.clone();
        third = third.clone();
    }

    /**
     * Builds a triplet from the first three entries of an ordered list; later entries are ignored.
     *
     * @param coordinates ordered {x, y} pairs
     * @param side        name of the side, used in the error message
     * @throws InsufficientReferencePointsException if fewer than three coordinates are given
     */
    public static ReferenceTriplet of(List<double[]> coordinates, String side)
            throws InsufficientReferencePointsException {
        if (coordinates.size() < SIZE) {
            throw new InsufficientReferencePointsException(side, coordinates.size());
        }
        return new ReferenceTriplet(coordinates.get(0), coordinates.get(1), coordinates.get(2));
    }

    /**
     * Builds a triplet from the first three reference points, in the given order.
     */
    public static ReferenceTriplet ofPoints(List<AnalysisPoint> points, String side)
            throws InsufficientReferencePointsException {
        return of(points.stream().map(p -> new double[]{p.getX(), p.getY()}).toList(), side);
    }

    @Override
    public double[] first() {
        return first.clone();
    }

    @Override
    public double[] second() {
        return second.clone();
    }

    @Override
    public double[] third() {
        return third.clone();
    }

    /**
     * @param index 0, 1 or 2
     * @return a copy of the coordinate at that position
     */
    public double[] get(int index) {
        return switch (index) {
            case 0 -> first.clone();
            case 1 -> second.clone();
            case 2 -> third.clone();
            default -> throw new IndexOutOfBoundsException("Reference index " + index + " out of range 0-2");
        };
    }

    /**
     * @return the three coordinates as a 3x2 array
     */
    public double[][] toArray() {
        return new double[][]{first.clone(), second.clone(), third.clone()};
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReferenceTriplet other)) return false;
        return Arrays.equals(first, other.first)
                && Arrays.equals(second, other.second)
                && Arrays.equals(third, other.third);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(new double[][]{first, second, third});
    }

    @Override
    public String toString() {
        return "ReferenceTriplet" + Arrays.deepToString(new double[][]{first, second, third});
    }

    private static void checkCoordinate(double[] coordinate) {
        if (coordinate == null || coordinate.length != 2) {
            throw new IllegalArgumentException("Coordinates must be [x, y]");
        }
    }
}
