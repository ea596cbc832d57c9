package org.tactool.model;

/**
 * Base class for checked failures of the point engine that are reported back to the user.
 *
 * <p>A {@code TactoolException} aborts the operation that raised it. Operations that mutate a
 * {@link PointRegistry} only throw before their first mutation, so the registry is left as it was.
 *
 * @since 1.0
 */
public class TactoolException extends Exception {

    public TactoolException(String message) {
        super(message);
    }

    public TactoolException(String message, Throwable cause) {
        super(message, cause);
    }
}
