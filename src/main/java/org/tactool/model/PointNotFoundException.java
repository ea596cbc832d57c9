package org.tactool.model;

import java.util.NoSuchElementException;

/**
 * Thrown when a registry lookup or removal names an id that is not present.
 *
 * @since 1.0
 */
public class PointNotFoundException extends NoSuchElementException {

    private final int id;

    public PointNotFoundException(int id) {
        super("No analysis point with id " + id);
        this.id = id;
    }

    public int getId() {
        return id;
    }
}
