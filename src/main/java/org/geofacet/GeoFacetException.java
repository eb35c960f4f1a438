package org.geofacet;

import java.util.List;

/**
 * Fatal error of a facet plot call. Raised before any cell is rendered, so a caller
 * never receives a partially populated figure together with this exception.
 */
public class GeoFacetException extends RuntimeException {

    /**
     * Classification of the failure.
     */
    public enum Kind {
        /** The input table has no rows or no columns. */
        EMPTY_INPUT,
        /** The region column does not exist in the input table. */
        COLUMN_NOT_FOUND,
        /** An enumerated option has a value outside its allowed set. */
        INVALID_OPTION,
        /** Grid regions without data under the {@code error} missing-region policy. */
        MISSING_REGIONS,
        /** Data regions absent from the grid under the {@code error} extra-region policy. */
        EXTRA_REGIONS
    }

    private final Kind kind;
    private final List<String> regions;

    public GeoFacetException(Kind kind, String message) {
        this(kind, message, List.of());
    }

    public GeoFacetException(Kind kind, String message, List<String> regions) {
        super(message);
        this.kind = kind;
        this.regions = List.copyOf(regions);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * The offending regions for {@link Kind#MISSING_REGIONS} and {@link Kind#EXTRA_REGIONS},
     * empty for the other kinds.
     */
    public List<String> getRegions() {
        return regions;
    }

    public static GeoFacetException invalidOption(String option, Object value, String allowed) {
        return new GeoFacetException(Kind.INVALID_OPTION,
                String.format("%s must be one of %s, got '%s'", option, allowed, value));
    }
}
