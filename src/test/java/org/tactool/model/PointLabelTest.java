package org.tactool.model;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class PointLabelTest {

    @ParameterizedTest
    @CsvSource({
            "Spot, SPOT",
            "spot, SPOT",
            "SPOT, SPOT",
            "' Spot ', SPOT",
            "RefMark, REF_MARK",
            "refmark, REF_MARK",
            "REFMARK, REF_MARK"
    })
    @DisplayName("Labels parse regardless of case")
    void testParse(String text, PointLabel expected) {
        assertEquals(expected, PointLabel.parse(text));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "Ref Mark", "Fiducial", "spots"})
    @DisplayName("Unknown labels are rejected with the offending value")
    void testParseInvalid(String text) {
        InvalidLabelException e = assertThrows(InvalidLabelException.class, () -> PointLabel.parse(text));
        assertEquals(text, e.getValue());
        assertTrue(e.getMessage().contains("'Spot' or 'RefMark'"));
    }

    @Test
    void testNullRejected() {
        assertThrows(InvalidLabelException.class, () -> PointLabel.parse(null));
    }

    @Test
    void testTextForm() {
        assertEquals("RefMark", PointLabel.REF_MARK.toString());
        assertEquals("Spot", PointLabel.SPOT.getText());
    }
}
