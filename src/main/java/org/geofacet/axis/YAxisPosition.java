package org.geofacet.axis;

import org.geofacet.GeoFacetException;

import java.util.Locale;

/**
 * Side of the facet on which a vertical axis draws its decorations.
 */
public enum YAxisPosition {
    LEFT,
    RIGHT;

    /**
     * Reads the {@value AxisOptions#Y_AXIS_POSITION} option. Absent means {@link #LEFT}.
     */
    public static YAxisPosition of(AxisOptions options) {
        Object value = options.get(AxisOptions.Y_AXIS_POSITION);
        if (value == null) {
            return LEFT;
        }
        if (value instanceof YAxisPosition position) {
            return position;
        }
        return switch (value.toString().trim().toLowerCase(Locale.ROOT)) {
            case "left" -> LEFT;
            case "right" -> RIGHT;
            default -> throw GeoFacetException.invalidOption(AxisOptions.Y_AXIS_POSITION, value, "left, right");
        };
    }
}
