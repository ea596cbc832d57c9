package org.tactool.model;

/**
 * Receives changes made to a {@link PointRegistry}. A view layer implements this to keep its drawn
 * items in step with the registry; it never writes back into the points it receives.
 *
 * <p>All methods have empty defaults so listeners only override what they draw.
 */
public interface RegistryListener {

    default void pointAdded(AnalysisPoint point) {
    }

    default void pointRemoved(AnalysisPoint point) {
    }

    default void pointUpdated(AnalysisPoint previous, AnalysisPoint current) {
    }

    /**
     * Called after {@link PointRegistry#clear()} and {@link PointRegistry#resetIds()}, when every
     * drawn item should be rebuilt from {@link PointRegistry#points()}.
     */
    default void registryReset(PointRegistry registry) {
    }
}
