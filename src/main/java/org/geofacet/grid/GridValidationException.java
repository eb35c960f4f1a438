package org.geofacet.grid;

/**
 * Thrown when a grid entry or a whole grid violates a structural invariant.
 * A grid whose construction throws this exception is never partially built.
 */
public class GridValidationException extends IllegalArgumentException {

    /**
     * The invariant that was violated.
     */
    public enum Reason {
        /** Region identifier is null, empty or whitespace-only. */
        INVALID_ENTITY,
        /** Row or column below 1. */
        INVALID_POSITION,
        /** Two regions share the same (row, col). */
        POSITION_CONFLICT,
        /** One region code appears at more than one position. */
        DUPLICATE_REGION,
        /** Parallel input arrays of different lengths. */
        SHAPE_MISMATCH
    }

    private final Reason reason;

    public GridValidationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    static GridValidationException invalidEntity(String region) {
        return new GridValidationException(Reason.INVALID_ENTITY,
                "Region names cannot be empty or whitespace-only, got '" + region + "'");
    }

    static GridValidationException invalidPosition(String region, int row, int col) {
        return new GridValidationException(Reason.INVALID_POSITION, String.format(
                "Grid positions must be positive integers (>= 1), got (%d, %d) for region '%s'", row, col, region));
    }

    static GridValidationException positionConflict(String existing, String region, GridPosition position) {
        return new GridValidationException(Reason.POSITION_CONFLICT, String.format(
                "Position conflict: regions '%s' and '%s' both at position %s", existing, region, position));
    }

    static GridValidationException duplicateRegion(String region, GridPosition first, GridPosition second) {
        return new GridValidationException(Reason.DUPLICATE_REGION, String.format(
                "Duplicate region '%s' at positions %s and %s", region, first, second));
    }

    static GridValidationException shapeMismatch(String detail) {
        return new GridValidationException(Reason.SHAPE_MISMATCH,
                "All input vectors must have the same length: " + detail);
    }
}
