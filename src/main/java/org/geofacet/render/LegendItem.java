package org.geofacet.render;

/**
 * One legend row: the label and the way its plot is drawn.
 *
 * @param label       non-blank plot label
 * @param kind        visual kind of the first plot carrying this label
 * @param seriesIndex position of the plot inside its axis, used to pick its colour
 */
public record LegendItem(String label, PlotKind kind, int seriesIndex) {
}
