package org.geofacet.facet;

import org.geofacet.GeoFacetException;

import java.util.Locale;

/**
 * What to do with data regions that the grid does not contain.
 */
public enum ExtraRegionPolicy {
    WARN,
    ERROR;

    public static ExtraRegionPolicy parse(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "warn" -> WARN;
            case "error" -> ERROR;
            default -> throw GeoFacetException.invalidOption("extra-regions", value, "warn, error");
        };
    }
}
