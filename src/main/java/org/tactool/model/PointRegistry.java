package org.tactool.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;

/**
 * Ordered collection of the analysis points of one editing session.
 *
 * <p>The registry owns point identity:
 * <ul>
 *   <li>Insertion order is kept, for stable export and for "most recent wins" hit testing.</li>
 *   <li>A next-id counter only ever grows. Removing a point does not free its id; only
 *       {@link #resetIds()} renumbers.</li>
 *   <li>Ids are unique at any instant.</li>
 * </ul>
 *
 * <p>The registry is not thread-safe; it belongs to a single interactive session.
 *
 * @since 1.0
 */
public class PointRegistry {
    private static final Logger logger = LoggerFactory.getLogger(PointRegistry.class);

    private final List<AnalysisPoint> points = new ArrayList<>();
    private final List<RegistryListener> listeners = new CopyOnWriteArrayList<>();
    private int nextId = 1;

    // ==================== MUTATION ====================

    /**
     * Appends a point. A point without an id receives the next free id; a point with an id keeps it and
     * the counter moves past it.
     *
     * @param point the point to add
     * @return the stored point, carrying its final id
     * @throws IllegalArgumentException if the point's id is already in use
     */
    public AnalysisPoint add(AnalysisPoint point) {
        AnalysisPoint stored;
        if (point.hasId()) {
            if (indexOf(point.getId()) >= 0) {
                throw new IllegalArgumentException("An analysis point with id " + point.getId() + " already exists");
            }
            stored = point;
            nextId = Math.max(nextId, point.getId() + 1);
        } else {
            stored = point.withId(nextId++);
        }
        points.add(stored);
        logger.debug("Added analysis point: {}", stored);
        for (RegistryListener listener : listeners) {
            listener.pointAdded(stored);
        }
        return stored;
    }

    /**
     * Adds a point at the given position with a label typed or read as text; everything else comes from
     * the settings.
     *
     * @throws InvalidLabelException if the label is not {@code Spot} or {@code RefMark}, in any case
     */
    public AnalysisPoint add(int x, int y, String label, PointSettings settings) {
        return add(settings.newPoint(x, y).label(label).build());
    }

    /**
     * Places a new point at the given position using the current settings, as a click on the image does.
     *
     * @return the stored point
     */
    public AnalysisPoint place(int x, int y, PointSettings settings) {
        return add(settings.newPoint(x, y).build());
    }

    /**
     * Removes the point with the given id.
     *
     * @return the removed point
     * @throws PointNotFoundException if no point has that id
     */
    public AnalysisPoint remove(int id) {
        int index = indexOf(id);
        if (index < 0) {
            throw new PointNotFoundException(id);
        }
        AnalysisPoint removed = points.remove(index);
        logger.debug("Deleted analysis point: {}", removed.getId());
        for (RegistryListener listener : listeners) {
            listener.pointRemoved(removed);
        }
        return removed;
    }

    /**
     * Replaces the metadata of a point. The edit may change anything except id; a changed id is
     * ignored.
     *
     * @param id     point to edit
     * @param editor receives a builder pre-filled with the current values
     * @return the stored replacement
     * @throws PointNotFoundException if no point has that id
     */
    public AnalysisPoint update(int id, UnaryOperator<AnalysisPoint.Builder> editor) {
        int index = indexOf(id);
        if (index < 0) {
            throw new PointNotFoundException(id);
        }
        AnalysisPoint previous = points.get(index);
        AnalysisPoint current = editor.apply(previous.toBuilder()).id(id).build();
        points.set(index, current);
        logger.debug("Updated analysis point {}: {}", id, current);
        for (RegistryListener listener : listeners) {
            listener.pointUpdated(previous, current);
        }
        return current;
    }

    /**
     * Sets the label of a point from user-typed text, e.g. an edited table cell.
     *
     * @throws InvalidLabelException if the text is not a known label
     * @throws PointNotFoundException if no point has that id
     */
    public AnalysisPoint relabel(int id, String label) {
        PointLabel parsed = PointLabel.parse(label);
        return update(id, b -> b.label(parsed));
    }

    /**
     * Removes every point. The id counter keeps its value.
     */
    public void clear() {
        int removed = points.size();
        points.clear();
        logger.info("Cleared {} analysis points", removed);
        fireReset();
    }

    /**
     * Renumbers every point 1..N in ascending order of its current id and sets the next id to N+1.
     * The list order itself is unchanged. This cannot be undone.
     */
    public void resetIds() {
        List<AnalysisPoint> byId = new ArrayList<>(points);
        byId.sort(Comparator.comparingInt(AnalysisPoint::getId));

        // old id -> new id, both sorted by old id
        int[] oldIds = new int[byId.size()];
        for (int i = 0; i < byId.size(); i++) {
            oldIds[i] = byId.get(i).getId();
        }
        for (int i = 0; i < points.size(); i++) {
            AnalysisPoint point = points.get(i);
            int newId = Arrays.binarySearch(oldIds, point.getId()) + 1;
            points.set(i, point.withId(newId));
        }
        nextId = points.size() + 1;
        logger.info("Reset ids of {} analysis points, next id is {}", points.size(), nextId);
        fireReset();
    }

    // ==================== QUERIES ====================

    /**
     * @throws PointNotFoundException if no point has that id
     */
    public AnalysisPoint lookup(int id) {
        int index = indexOf(id);
        if (index < 0) {
            throw new PointNotFoundException(id);
        }
        return points.get(index);
    }

    public boolean contains(int id) {
        return indexOf(id) >= 0;
    }

    /**
     * Finds the most recently added point whose drawn circle contains the given pixel.
     * Points added later are drawn on top, so the scan runs in reverse insertion order.
     *
     * @return the topmost point at (x, y), if any
     */
    public Optional<AnalysisPoint> pointAt(double x, double y) {
        for (int i = points.size() - 1; i >= 0; i--) {
            AnalysisPoint point = points.get(i);
            double dx = x - point.getX();
            double dy = y - point.getY();
            double r = point.getDisplayRadius();
            if (dx * dx + dy * dy <= r * r) {
                return Optional.of(point);
            }
        }
        return Optional.empty();
    }

    /**
     * @return all reference marks, in insertion order
     */
    public List<AnalysisPoint> referencePoints() {
        return points.stream().filter(AnalysisPoint::isReferenceMark).toList();
    }

    /**
     * @return the first three reference marks, in insertion order
     * @throws InsufficientReferencePointsException if the registry holds fewer than three
     */
    public ReferenceTriplet referenceTriplet() throws InsufficientReferencePointsException {
        return ReferenceTriplet.ofPoints(referencePoints(), "registry");
    }

    /**
     * @return an unmodifiable snapshot of all points, in insertion order
     */
    public List<AnalysisPoint> points() {
        return Collections.unmodifiableList(new ArrayList<>(points));
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    /**
     * @return the id the next point added without an id will receive
     */
    public int nextId() {
        return nextId;
    }

    // ==================== LISTENERS ====================

    public void addListener(RegistryListener listener) {
        listeners.add(listener);
    }

    public void removeListener(RegistryListener listener) {
        listeners.remove(listener);
    }

    private void fireReset() {
        for (RegistryListener listener : listeners) {
            listener.registryReset(this);
        }
    }

    private int indexOf(int id) {
        for (int i = 0; i < points.size(); i++) {
            if (points.get(i).getId() == id) {
                return i;
            }
        }
        return -1;
    }
}
