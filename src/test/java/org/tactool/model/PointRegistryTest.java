package org.tactool.model;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

/**
 * Unit tests for PointRegistry id assignment, ordering and lookups.
 */
@ExtendWith(MockitoExtension.class)
class PointRegistryTest {

    @Mock
    private RegistryListener listener;

    private PointRegistry registry;
    private PointSettings settings;

    @BeforeEach
    void setUp() {
        registry = new PointRegistry();
        settings = PointSettings.defaults();
    }

    private AnalysisPoint point(int x, int y, PointLabel label) {
        return settings.newPoint(x, y).label(label).build();
    }

    // ==================== Id Assignment Tests ====================

    @Test
    @DisplayName("Points without an id get consecutive ids starting at 1")
    void testAutomaticIds() {
        AnalysisPoint first = registry.add(point(10, 10, PointLabel.SPOT));
        AnalysisPoint second = registry.add(point(20, 20, PointLabel.SPOT));

        assertEquals(1, first.getId());
        assertEquals(2, second.getId());
        assertEquals(3, registry.nextId());
    }

    @Test
    @DisplayName("Removing a point does not free its id")
    void testIdsNotReusedAfterRemove() {
        registry.add(point(10, 10, PointLabel.SPOT));
        registry.add(point(20, 20, PointLabel.SPOT));
        registry.remove(2);

        AnalysisPoint third = registry.add(point(30, 30, PointLabel.SPOT));
        assertEquals(3, third.getId());
    }

    @Test
    @DisplayName("An explicit id is kept and the counter moves past it")
    void testExplicitIdAdvancesCounter() {
        AnalysisPoint imported = registry.add(settings.newPoint(5, 5).id(40).build());
        AnalysisPoint next = registry.add(point(6, 6, PointLabel.SPOT));

        assertEquals(40, imported.getId());
        assertEquals(41, next.getId());
    }

    @Test
    @DisplayName("An explicit id below the counter does not move it back")
    void testExplicitLowIdKeepsCounter() {
        registry.add(point(1, 1, PointLabel.SPOT));
        registry.add(point(2, 2, PointLabel.SPOT));
        registry.remove(1);
        registry.add(settings.newPoint(3, 3).id(1).build());

        assertEquals(3, registry.nextId());
    }

    @Test
    @DisplayName("Adding a duplicate id is rejected and leaves the registry unchanged")
    void testDuplicateIdRejected() {
        registry.add(settings.newPoint(5, 5).id(7).build());

        assertThrows(IllegalArgumentException.class,
                () -> registry.add(settings.newPoint(9, 9).id(7).build()));
        assertEquals(1, registry.size());
        assertEquals(5, registry.lookup(7).getX());
    }

    @Test
    @DisplayName("Clear empties the registry but keeps the id counter")
    void testClearKeepsCounter() {
        registry.add(point(1, 1, PointLabel.SPOT));
        registry.add(point(2, 2, PointLabel.SPOT));
        registry.clear();

        assertTrue(registry.isEmpty());
        assertEquals(3, registry.add(point(3, 3, PointLabel.SPOT)).getId());
    }

    @Test
    @DisplayName("Adding with a label outside Spot and RefMark is rejected")
    void testAddWithTextLabel() {
        assertEquals(PointLabel.SPOT, registry.add(5, 5, "SPOT", settings).getLabel());

        assertThrows(InvalidLabelException.class, () -> registry.add(6, 6, "Crater", settings));
        assertEquals(1, registry.size());
        assertEquals(2, registry.nextId());
    }

    // ==================== Reset Ids Tests ====================

    @Test
    @DisplayName("Reset ids renumbers 1..N by ascending old id and keeps list order")
    void testResetIds() {
        registry.add(settings.newPoint(0, 0).id(9).build());
        registry.add(settings.newPoint(1, 1).id(3).build());
        registry.add(settings.newPoint(2, 2).id(5).build());

        registry.resetIds();

        List<AnalysisPoint> points = registry.points();
        assertEquals(3, points.get(0).getId());
        assertEquals(1, points.get(1).getId());
        assertEquals(2, points.get(2).getId());
        assertEquals(0, points.get(0).getX(), "List order must not change");
        assertEquals(4, registry.nextId());
        assertEquals(4, registry.add(point(3, 3, PointLabel.SPOT)).getId());
    }

    @Test
    @DisplayName("Reset ids on an empty registry sets the next id to 1")
    void testResetIdsEmpty() {
        registry.add(point(1, 1, PointLabel.SPOT));
        registry.remove(1);
        registry.resetIds();

        assertEquals(1, registry.nextId());
    }

    // ==================== Lookup Tests ====================

    @Test
    @DisplayName("Lookup and remove of a missing id throw PointNotFoundException")
    void testMissingId() {
        PointNotFoundException lookup = assertThrows(PointNotFoundException.class, () -> registry.lookup(12));
        assertEquals(12, lookup.getId());
        assertThrows(PointNotFoundException.class, () -> registry.remove(12));
    }

    @Test
    @DisplayName("Reference points are the RefMarks in insertion order")
    void testReferencePoints() {
        registry.add(point(1, 1, PointLabel.REF_MARK));
        registry.add(point(2, 2, PointLabel.SPOT));
        registry.add(point(3, 3, PointLabel.REF_MARK));

        List<AnalysisPoint> refs = registry.referencePoints();
        assertEquals(List.of(1, 3), refs.stream().map(AnalysisPoint::getId).toList());
    }

    @Test
    @DisplayName("Reference triplet uses only the first three marks")
    void testReferenceTriplet() throws Exception {
        registry.add(point(0, 0, PointLabel.REF_MARK));
        registry.add(point(100, 0, PointLabel.REF_MARK));
        registry.add(point(0, 100, PointLabel.REF_MARK));
        registry.add(point(100, 100, PointLabel.REF_MARK));

        ReferenceTriplet triplet = registry.referenceTriplet();
        assertArrayEquals(new double[]{0, 100}, triplet.third());
    }

    @Test
    @DisplayName("Reference triplet with two marks reports the count")
    void testReferenceTripletTooFew() {
        registry.add(point(0, 0, PointLabel.REF_MARK));
        registry.add(point(100, 0, PointLabel.REF_MARK));

        InsufficientReferencePointsException e =
                assertThrows(InsufficientReferencePointsException.class, registry::referenceTriplet);
        assertEquals(2, e.getFound());
    }

    @Test
    @DisplayName("Point at a position returns the most recently added overlapping point")
    void testPointAtPrefersLatest() {
        registry.add(point(50, 50, PointLabel.SPOT));
        registry.add(point(52, 50, PointLabel.SPOT));

        assertEquals(2, registry.pointAt(51, 50).orElseThrow().getId());
        assertTrue(registry.pointAt(200, 200).isEmpty());
    }

    @Test
    @DisplayName("Point at honours the scaled radius")
    void testPointAtUsesScale() {
        registry.add(settings.withScale(4.0).newPoint(100, 100).build());

        // diameter 10 at scale 4 draws a radius of 20 px
        assertTrue(registry.pointAt(119, 100).isPresent());
        assertTrue(registry.pointAt(121, 100).isEmpty());
    }

    // ==================== Update Tests ====================

    @Test
    @DisplayName("Update keeps id and position while changing metadata")
    void testUpdate() {
        registry.add(point(10, 20, PointLabel.SPOT));

        AnalysisPoint updated = registry.update(1, b -> b.notes("rim").material("zircon").id(99));

        assertEquals(1, updated.getId());
        assertEquals(10, updated.getX());
        assertEquals("rim", registry.lookup(1).getNotes());
        assertEquals("zircon", registry.lookup(1).getMaterial());
    }

    @Test
    @DisplayName("Relabel accepts any case and rejects unknown labels")
    void testRelabel() {
        registry.add(point(10, 20, PointLabel.SPOT));

        assertEquals(PointLabel.REF_MARK, registry.relabel(1, "refmark").getLabel());
        assertThrows(InvalidLabelException.class, () -> registry.relabel(1, "Crater"));
        assertEquals(PointLabel.REF_MARK, registry.lookup(1).getLabel());
    }

    // ==================== Listener Tests ====================

    @Test
    @DisplayName("Listeners are told about additions, removals and resets")
    void testListenerNotifications() {
        registry.addListener(listener);

        AnalysisPoint added = registry.add(point(1, 1, PointLabel.SPOT));
        registry.remove(added.getId());
        registry.clear();

        verify(listener).pointAdded(added);
        verify(listener).pointRemoved(added);
        verify(listener).registryReset(registry);
    }

    @Test
    @DisplayName("A rejected add does not notify listeners")
    void testNoNotificationOnRejectedAdd() {
        registry.add(settings.newPoint(5, 5).id(7).build());
        registry.addListener(listener);

        assertThrows(IllegalArgumentException.class,
                () -> registry.add(settings.newPoint(9, 9).id(7).build()));
        verify(listener, never()).pointAdded(any());
    }

    @Test
    @DisplayName("Removed listeners receive nothing")
    void testRemoveListener() {
        registry.addListener(listener);
        registry.removeListener(listener);

        registry.add(point(1, 1, PointLabel.SPOT));
        verify(listener, never()).pointAdded(any());
    }
}
