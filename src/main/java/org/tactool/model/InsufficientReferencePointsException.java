package org.tactool.model;

/**
 * Thrown when a recoordination is requested with fewer than three reference marks on either side.
 *
 * @since 1.0
 */
public class InsufficientReferencePointsException extends TactoolException {

    private final int found;

    /**
     * @param side  which side is short, used in the message (e.g. "registry", "instrument file")
     * @param found number of reference marks that were available
     */
    public InsufficientReferencePointsException(String side, int found) {
        super(String.format("Missing reference points: the %s has %d reference mark(s), at least %d are required",
                side, found, ReferenceTriplet.SIZE));
        this.found = found;
    }

    public int getFound() {
        return found;
    }
}
