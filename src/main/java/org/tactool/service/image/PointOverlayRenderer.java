package org.tactool.service.image;

import org.tactool.model.AnalysisPoint;

import java.awt.Graphics2D;

/**
 * Draws one analysis point onto an image. Implementations work only from the point's state, so the
 * overlay can be rebuilt at any time from the registry.
 */
public interface PointOverlayRenderer {

    /**
     * @param graphics target, in image pixel coordinates
     * @param point    point to draw
     */
    void draw(Graphics2D graphics, AnalysisPoint point);
}
