package org.geofacet.axis;

import org.geofacet.GeoFacetException;

import java.util.Locale;

/**
 * Which axes share their range across facets.
 */
public enum LinkMode {
    NONE,
    /** Horizontal (primary) axes are linked. */
    X,
    /** Vertical (secondary) axes are linked. */
    Y,
    BOTH;

    public boolean linksX() {
        return this == X || this == BOTH;
    }

    public boolean linksY() {
        return this == Y || this == BOTH;
    }

    /**
     * Parses {@code none}, {@code x}, {@code y} or {@code both}, case-insensitively.
     * {@code primary} and {@code secondary} are accepted for {@code x} and {@code y}.
     *
     * @throws GeoFacetException of kind {@code INVALID_OPTION} for any other value
     */
    public static LinkMode parse(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "none" -> NONE;
            case "x", "primary" -> X;
            case "y", "secondary" -> Y;
            case "both" -> BOTH;
            default -> throw GeoFacetException.invalidOption("link-axes", value, "none, x, y, both");
        };
    }
}
