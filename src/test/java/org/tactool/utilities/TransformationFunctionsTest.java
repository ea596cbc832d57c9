package org.tactool.utilities;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.awt.geom.AffineTransform;

class TransformationFunctionsTest {

    @ParameterizedTest
    @CsvSource({
            "0, 1024",
            "100, 1024",
            "1024, 1024",
            "37.25, 800",
            "-5, 640"
    })
    @DisplayName("Inverting x twice returns the original value")
    void testInvertXInvolution(double x, double width) {
        assertEquals(x, TransformationFunctions.invertX(TransformationFunctions.invertX(x, width), width), 1e-12);
    }

    @Test
    void testInvertX() {
        assertEquals(924.0, TransformationFunctions.invertX(100, 1024));
    }

    @Test
    @DisplayName("Only the selected axes are inverted")
    void testInvertAxes() {
        assertArrayEquals(new double[]{90, 20},
                TransformationFunctions.invertAxes(new double[]{10, 20}, 100, 50, true, false));
        assertArrayEquals(new double[]{10, 30},
                TransformationFunctions.invertAxes(new double[]{10, 20}, 100, 50, false, true));
        assertThrows(IllegalArgumentException.class,
                () -> TransformationFunctions.invertAxes(new double[]{1}, 100, 50, true, true));
    }

    @Test
    @DisplayName("Image bounds include the edges")
    void testIsWithinImage() {
        assertTrue(TransformationFunctions.isWithinImage(0, 0, 100, 50));
        assertTrue(TransformationFunctions.isWithinImage(100, 50, 100, 50));
        assertFalse(TransformationFunctions.isWithinImage(-1, 10, 100, 50));
        assertFalse(TransformationFunctions.isWithinImage(10, 50.5, 100, 50));
    }

    @Test
    void testFormatTransformMatrix() {
        AffineTransform t = new AffineTransform(1, 0, 0, 2, -10, 5);
        assertEquals("[1.0000, 0.0000, 0.0000, 2.0000, -10.0000, 5.0000]",
                TransformationFunctions.formatTransformMatrix(t));
    }

    @Test
    void testDescribeTransformType() {
        assertEquals("IDENTITY", TransformationFunctions.describeTransformType(new AffineTransform().getType()));
        assertEquals("TRANSLATION",
                TransformationFunctions.describeTransformType(
                        AffineTransform.getTranslateInstance(3, 4).getType()));
    }
}
