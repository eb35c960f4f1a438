package org.geofacet.facet;

import org.geofacet.GeoFacetException;

import java.util.Locale;

/**
 * What to do with grid regions that have no rows in the input table.
 */
public enum MissingRegionPolicy {
    /** Create no cell. */
    SKIP,
    /** Create a cell with empty axes titled with the region code. */
    PLACEHOLDER,
    /** Fail the whole call before anything is rendered. */
    ERROR;

    /**
     * Parses {@code skip}, {@code placeholder} (alias {@code empty}) or {@code error}.
     *
     * @throws GeoFacetException of kind {@code INVALID_OPTION} for any other value
     */
    public static MissingRegionPolicy parse(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "skip" -> SKIP;
            case "placeholder", "empty" -> PLACEHOLDER;
            case "error" -> ERROR;
            default -> throw GeoFacetException.invalidOption("missing-regions", value, "skip, placeholder, error");
        };
    }
}
