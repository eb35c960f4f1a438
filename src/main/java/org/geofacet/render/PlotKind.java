package org.geofacet.render;

/**
 * Kind of visual drawn into an axis.
 */
public enum PlotKind {
    LINES,
    SCATTER,
    BARS
}
