package org.tactool.service.image;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tactool.model.AnalysisPoint;
import org.tactool.model.PointSettings;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.Ellipse2D;

/**
 * Draws a point as the annotation canvas shows it: a ring whose diameter is the point's diameter in
 * microns times the scale, a filled dot at the centre, and a {@code <id>_<label>} caption to the lower
 * right, all in the point's colour.
 */
public class Java2DPointOverlayRenderer implements PointOverlayRenderer {
    private static final Logger logger = LoggerFactory.getLogger(Java2DPointOverlayRenderer.class);

    private static final float RING_WIDTH = 4f;
    private static final double DOT_SIZE = 3.0;
    private static final Font LABEL_FONT = new Font(Font.SANS_SERIF, Font.PLAIN, 14);

    @Override
    public void draw(Graphics2D graphics, AnalysisPoint point) {
        Color colour = parseColour(point.getColour());
        graphics.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        graphics.setColor(colour);

        double radius = point.getDisplayRadius();
        graphics.setStroke(new BasicStroke(RING_WIDTH));
        graphics.draw(new Ellipse2D.Double(point.getX() - radius, point.getY() - radius, radius * 2, radius * 2));

        graphics.fill(new Ellipse2D.Double(point.getX() - DOT_SIZE / 2, point.getY() - DOT_SIZE / 2,
                DOT_SIZE, DOT_SIZE));

        graphics.setFont(LABEL_FONT);
        int baseline = point.getY() + graphics.getFontMetrics().getAscent();
        graphics.drawString(caption(point), point.getX(), baseline);
    }

    static String caption(AnalysisPoint point) {
        return point.getId() + "_" + point.getLabel().getText();
    }

    static Color parseColour(String colour) {
        try {
            return Color.decode(colour);
        } catch (NumberFormatException | NullPointerException e) {
            logger.warn("Unrecognised colour '{}', drawing with {}", colour, PointSettings.DEFAULT_COLOUR);
            return Color.decode(PointSettings.DEFAULT_COLOUR);
        }
    }
}
