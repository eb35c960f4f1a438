package org.geofacet.grid;

/**
 * Thrown when a grid definition cannot be read: missing file or resource, unreadable
 * content, missing required columns or malformed values.
 */
public class GridLoadException extends Exception {

    public GridLoadException(String message) {
        super(message);
    }

    public GridLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
