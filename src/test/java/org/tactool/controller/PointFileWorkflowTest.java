package org.tactool.controller;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.tactool.model.AnalysisPoint;
import org.tactool.model.PointLabel;
import org.tactool.model.PointRegistry;
import org.tactool.model.PointSettings;
import org.tactool.service.FileAccessException;
import org.tactool.service.csv.MalformedFileException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

class PointFileWorkflowTest {

    @TempDir
    Path tempDir;

    private PointRegistry registry;
    private PointSettings settings;
    private PointFileWorkflow workflow;

    @BeforeEach
    void setUp() {
        registry = new PointRegistry();
        settings = PointSettings.defaults().withSampleName("x83");
        workflow = new PointFileWorkflow();
    }

    @Test
    @DisplayName("Export then import restores the same points")
    void testExportImportRoundTrip() throws Exception {
        registry.place(10, 10, settings);
        registry.place(110, 10, settings);
        registry.place(500, 400, settings.withLabel(PointLabel.SPOT).withScale(3.2));
        registry.update(3, b -> b.notes("core, bright"));
        registry.remove(2);
        List<AnalysisPoint> exported = registry.points();
        Path file = tempDir.resolve("points.csv");

        workflow.exportPoints(registry, file);
        PointRegistry restored = new PointRegistry();
        PointFileWorkflow.ImportSummary summary = workflow.importPoints(restored, file, PointSettings.defaults());

        assertEquals(exported, restored.points());
        assertEquals(2, summary.imported());
        assertEquals(0, summary.skipped());
        assertEquals(4, restored.nextId());
    }

    @Test
    @DisplayName("Import replaces the current points")
    void testImportReplaces() throws Exception {
        registry.place(1, 1, settings);
        registry.place(2, 2, settings);
        Path file = tempDir.resolve("other.csv");
        Files.writeString(file, "Name,label,x,y\nother_#7,Spot,70,70\n");

        workflow.importPoints(registry, file, settings);

        assertEquals(1, registry.size());
        assertEquals("other", registry.lookup(7).getSampleName());
        assertEquals(8, registry.nextId());
    }

    @Test
    @DisplayName("Duplicate ids in a file keep the first row and report the rest")
    void testDuplicateIds() throws Exception {
        Path file = tempDir.resolve("dupes.csv");
        Files.writeString(file, "Name,label,x,y\ns_#1,Spot,1,1\ns_#1,Spot,2,2\ns_#2,Spot,3,3\n");

        PointFileWorkflow.ImportSummary summary = workflow.importPoints(registry, file, settings);

        assertEquals(2, summary.imported());
        assertEquals(1, summary.skipped());
        assertEquals(2, summary.errors().get(0).rowNumber());
        assertEquals(1, registry.lookup(1).getX());
    }

    @Test
    @DisplayName("A file with no usable rows leaves the registry untouched")
    void testTotalFailureLeavesRegistry() throws Exception {
        registry.place(1, 1, settings);
        Path file = tempDir.resolve("bad.csv");
        Files.writeString(file, "Name,label,x,y\ns_#1,Crater,1,1\ns_#2,Spot,,2\n");

        assertThrows(MalformedFileException.class, () -> workflow.importPoints(registry, file, settings));
        assertEquals(1, registry.size());
    }

    @Test
    @DisplayName("A missing file leaves the registry untouched")
    void testMissingFile() {
        registry.place(1, 1, settings);

        assertThrows(FileAccessException.class,
                () -> workflow.importPoints(registry, tempDir.resolve("missing.csv"), settings));
        assertEquals(1, registry.size());
    }

    @Test
    @DisplayName("A header-only file empties the registry")
    void testHeaderOnlyFile() throws Exception {
        registry.place(1, 1, settings);
        Path file = tempDir.resolve("empty.csv");
        Files.writeString(file, "Name,label,x,y,diameter,scale,colour,mount_name,material,notes\n");

        PointFileWorkflow.ImportSummary summary = workflow.importPoints(registry, file, settings);

        assertEquals(0, summary.imported());
        assertTrue(registry.isEmpty());
    }
}
