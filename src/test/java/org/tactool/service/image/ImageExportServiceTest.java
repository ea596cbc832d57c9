package org.tactool.service.image;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.tactool.model.AnalysisPoint;
import org.tactool.model.PointLabel;
import org.tactool.service.FileAccessException;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Tests for rendering points onto an image and saving it.
 */
class ImageExportServiceTest {

    @TempDir
    Path tempDir;

    private final ImageExportService service = new ImageExportService();

    private static BufferedImage blankImage() {
        return new BufferedImage(200, 100, BufferedImage.TYPE_INT_RGB);
    }

    private static AnalysisPoint point(int id, int x, int y) {
        return AnalysisPoint.builder().id(id).label(PointLabel.SPOT).position(x, y).diameter(20).build();
    }

    // ==================== Rendering Tests ====================

    @Test
    @DisplayName("The ring and centre dot are drawn in the point's colour")
    void testRenderDrawsPoint() {
        BufferedImage rendered = service.render(blankImage(), List.of(point(1, 50, 50)));

        int yellow = Color.decode("#ffff00").getRGB() & 0xffffff;
        assertEquals(yellow, rendered.getRGB(60, 50) & 0xffffff, "ring at radius 10");
        assertEquals(yellow, rendered.getRGB(50, 50) & 0xffffff, "centre dot");
        assertEquals(0, rendered.getRGB(150, 20) & 0xffffff, "background untouched");
    }

    @Test
    @DisplayName("The source image is not modified")
    void testSourceUntouched() {
        BufferedImage source = blankImage();
        service.render(source, List.of(point(1, 50, 50)));

        assertEquals(0, source.getRGB(60, 50) & 0xffffff);
    }

    @Test
    @DisplayName("Points are handed to the renderer in drawing order")
    void testRendererOrder() {
        PointOverlayRenderer renderer = mock(PointOverlayRenderer.class);
        ImageExportService custom = new ImageExportService(renderer, "png");
        AnalysisPoint first = point(1, 10, 10);
        AnalysisPoint second = point(2, 20, 20);

        custom.render(blankImage(), List.of(first, second));

        InOrder order = inOrder(renderer);
        order.verify(renderer).draw(any(Graphics2D.class), eq(first));
        order.verify(renderer).draw(any(Graphics2D.class), eq(second));
    }

    @Test
    void testRenderNeedsImage() {
        assertThrows(NullPointerException.class, () -> service.render(null, List.of()));
    }

    @Test
    void testCaptionAndColour() {
        assertEquals("3_Spot", Java2DPointOverlayRenderer.caption(point(3, 0, 0)));
        assertEquals(Color.RED, Java2DPointOverlayRenderer.parseColour("#ff0000"));
        assertEquals(Color.YELLOW, Java2DPointOverlayRenderer.parseColour("not a colour"));
    }

    // ==================== Export Tests ====================

    @Test
    @DisplayName("A path without extension is saved as png")
    void testDefaultExtension() throws Exception {
        Path written = service.export(blankImage(), List.of(point(1, 50, 50)), tempDir.resolve("overlay"));

        assertEquals("overlay.png", written.getFileName().toString());
        BufferedImage read = ImageIO.read(written.toFile());
        assertEquals(200, read.getWidth());
        assertEquals(100, read.getHeight());
    }

    @Test
    @DisplayName("An explicit extension selects the format")
    void testExplicitFormat() throws Exception {
        Path written = service.export(blankImage(), List.of(), tempDir.resolve("overlay.jpg"));

        assertEquals("overlay.jpg", written.getFileName().toString());
        assertTrue(Files.size(written) > 0);
    }

    @Test
    @DisplayName("An extension with no image writer is a file access error")
    void testUnknownFormat() {
        Path target = tempDir.resolve("overlay.xyz");

        FileAccessException e = assertThrows(FileAccessException.class,
                () -> service.export(blankImage(), List.of(), target));
        assertEquals(target, e.getPath());
    }

    @Test
    void testExtensionOf() {
        assertEquals("png", ImageExportService.extensionOf(Path.of("a.b.png")));
        assertEquals("", ImageExportService.extensionOf(Path.of("noext")));
    }
}
