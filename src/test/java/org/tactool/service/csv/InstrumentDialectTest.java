package org.tactool.service.csv;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

class InstrumentDialectTest {

    private final InstrumentDialect dialect = InstrumentDialect.defaults().withImageWidth(1000);

    private static Map<String, String> row(String id, String x, String y, String classification) {
        Map<String, String> row = new LinkedHashMap<>();
        row.put("Particle ID", id);
        row.put("Laser Ablation Centre X", x);
        row.put("Laser Ablation Centre Y", y);
        row.put("Mineral Classification", classification);
        return row;
    }

    @Test
    @DisplayName("x is measured from the right edge and inverted with the image width")
    void testXInversion() throws Exception {
        InstrumentRow parsed = dialect.parseRow(row("4", "100", "250", "Zircon"), 1);

        assertEquals(900.0, parsed.x());
        assertEquals(250.0, parsed.y());
        assertEquals(100.0, parsed.rawX());
        assertEquals(4, parsed.id());
        assertFalse(parsed.reference());
    }

    @Test
    @DisplayName("Rows with the reference label are reference rows and need no id")
    void testReferenceRow() throws Exception {
        InstrumentRow parsed = dialect.parseRow(row("", "10", "20", "fiducial"), 2);

        assertTrue(parsed.reference());
        assertNull(parsed.id());
    }

    @Test
    @DisplayName("Target rows need a positive id")
    void testTargetRowNeedsId() {
        assertThrows(MalformedRowException.class, () -> dialect.parseRow(row("", "10", "20", "Zircon"), 3));
        assertThrows(MalformedRowException.class, () -> dialect.parseRow(row("0", "10", "20", "Zircon"), 3));
    }

    @Test
    @DisplayName("An unreadable reference row is still recognised as a reference row")
    void testBadReferenceCoordinate() {
        MalformedRowException e = assertThrows(MalformedRowException.class,
                () -> dialect.parseRow(row("", "8x90", "10", "Fiducial"), 2));
        assertTrue(e.isReferenceRow());
        assertEquals(2, e.getRowNumber());
        assertTrue(e.getDetail().startsWith("reference mark"), e.getDetail());

        MalformedRowException target = assertThrows(MalformedRowException.class,
                () -> dialect.parseRow(row("1", "n/a", "20", "Zircon"), 3));
        assertFalse(target.isReferenceRow());
    }

    @Test
    @DisplayName("Non-numeric coordinates reject the row")
    void testBadCoordinate() {
        MalformedRowException e = assertThrows(MalformedRowException.class,
                () -> dialect.parseRow(row("1", "n/a", "20", "Zircon"), 6));
        assertEquals(6, e.getRowNumber());
    }

    @Test
    @DisplayName("Inversion can be switched off for files with a top-left origin")
    void testNoInversion() throws Exception {
        InstrumentDialect topLeft = new InstrumentDialect("Name", "x", "y", "label", "RefMark", false);
        Map<String, String> row = Map.of("Name", "7", "x", "12.5", "y", "3", "label", "Spot");

        InstrumentRow parsed = topLeft.parseRow(row, 1);
        assertEquals(12.5, parsed.x());
        assertEquals(12.5, topLeft.toInstrumentX(12.5));
    }

    @Test
    @DisplayName("Reading with inversion but no image width is a programming error")
    void testInversionNeedsWidth() {
        assertThrows(IllegalStateException.class,
                () -> InstrumentDialect.defaults().parseRow(row("1", "1", "1", "Zircon"), 1));
        assertThrows(IllegalArgumentException.class, () -> InstrumentDialect.defaults().withImageWidth(0));
    }

    @Test
    @DisplayName("Missing columns are reported with every required header")
    void testMissingHeaders() {
        MalformedFileException e = assertThrows(MalformedFileException.class,
                () -> dialect.checkHeaders(Path.of("sem.csv"),
                        List.of("Particle ID", "Laser Ablation Centre X", "Mineral Classification")));
        assertTrue(e.getMessage().contains("Laser Ablation Centre Y"));
    }

    @Test
    void testToInstrumentXRoundTrip() {
        assertEquals(100.0, dialect.toInstrumentX(900.0));
    }

    @Test
    void testBlankHeaderRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new InstrumentDialect("id", " ", "y", "label", "Fiducial", true));
    }
}
