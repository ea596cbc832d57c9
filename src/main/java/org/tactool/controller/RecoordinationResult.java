package org.tactool.controller;

import org.tactool.model.AnalysisPoint;

import java.awt.geom.AffineTransform;
import java.util.List;

/**
 * Outcome of a recoordination run.
 *
 * @param points           points inserted into the registry, in file order
 * @param skippedRows      target rows that were not inserted (parse errors, missing or colliding ids)
 * @param outOfBoundsCount inserted points that fall outside the destination image
 * @param transform        transform applied to the instrument coordinates
 * @since 1.0
 */
public record RecoordinationResult(List<AnalysisPoint> points, int skippedRows, int outOfBoundsCount,
                                   AffineTransform transform) {

    public RecoordinationResult {
        points = List.copyOf(points);
        transform = new AffineTransform(transform);
    }

    @Override
    public AffineTransform transform() {
        return new AffineTransform(transform);
    }

    public boolean hasOutOfBoundsPoints() {
        return outOfBoundsCount > 0;
    }
}
