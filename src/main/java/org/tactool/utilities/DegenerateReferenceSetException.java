package org.tactool.utilities;

import org.tactool.model.TactoolException;

/**
 * Thrown when the three source reference marks are collinear or coincident, so no unique affine
 * transform maps them onto the destination marks.
 *
 * @since 1.0
 */
public class DegenerateReferenceSetException extends TactoolException {

    private final double determinant;

    public DegenerateReferenceSetException(double determinant) {
        super(String.format("The reference points are collinear or coincident (determinant %.3g); "
                + "place three reference marks that form a triangle", determinant));
        this.determinant = determinant;
    }

    public double getDeterminant() {
        return determinant;
    }
}
