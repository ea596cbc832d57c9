package org.tactool.service.image;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tactool.model.AnalysisPoint;
import org.tactool.service.FileAccessException;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Saves the annotation image with its analysis points drawn on top.
 *
 * <p>The format follows the file extension. A path without an extension gets the default format's
 * extension appended. Any extension is passed to {@link ImageIO} as-is; if no writer handles it the
 * export fails with a {@link FileAccessException}.
 *
 * @since 1.0
 */
public class ImageExportService {
    private static final Logger logger = LoggerFactory.getLogger(ImageExportService.class);

    public static final String DEFAULT_FORMAT = "png";

    private final PointOverlayRenderer renderer;
    private final String defaultFormat;

    public ImageExportService() {
        this(new Java2DPointOverlayRenderer(), DEFAULT_FORMAT);
    }

    public ImageExportService(PointOverlayRenderer renderer, String defaultFormat) {
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        if (defaultFormat == null || defaultFormat.isBlank()) {
            throw new IllegalArgumentException("Default image format must not be blank");
        }
        this.defaultFormat = defaultFormat.toLowerCase(Locale.ROOT);
    }

    public String getDefaultFormat() {
        return defaultFormat;
    }

    /**
     * Draws the points onto a copy of the image. The source image is not modified.
     *
     * @param image  annotation image
     * @param points points in drawing order; later points are drawn over earlier ones
     * @return an RGB copy with the overlay
     */
    public BufferedImage render(BufferedImage image, List<AnalysisPoint> points) {
        Objects.requireNonNull(image, "No image loaded");
        BufferedImage output = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = output.createGraphics();
        try {
            g.drawImage(image, 0, 0, null);
            for (AnalysisPoint point : points) {
                renderer.draw(g, point);
            }
        } finally {
            g.dispose();
        }
        return output;
    }

    /**
     * Renders and writes the image.
     *
     * @param target destination; the default extension is appended if it has none
     * @return the path actually written
     * @throws FileAccessException if no writer exists for the format or writing fails
     */
    public Path export(BufferedImage image, List<AnalysisPoint> points, Path target) throws FileAccessException {
        Path output = withExtension(target);
        String format = extensionOf(output);
        logger.info("Saving current image with {} points to: {}", points.size(), output);

        BufferedImage rendered = render(image, points);
        boolean written;
        try {
            written = ImageIO.write(rendered, format, output.toFile());
        } catch (IOException e) {
            logger.error("Failed to save image to {}", output, e);
            throw new FileAccessException(output, "Could not write image", e);
        }
        if (!written) {
            logger.error("No image writer available for format '{}'", format);
            throw new FileAccessException(output, "No image writer available for format '" + format + "'");
        }
        return output;
    }

    Path withExtension(Path target) {
        if (extensionOf(target).isEmpty()) {
            return target.resolveSibling(target.getFileName() + "." + defaultFormat);
        }
        return target;
    }

    static String extensionOf(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 || dot == name.length() - 1 ? "" : name.substring(dot + 1);
    }
}
