package org.geofacet.render;

import java.util.List;

/**
 * A unified legend and its placement in grid coordinates.
 *
 * @param title    legend title, may be empty
 * @param items    legend rows in display order
 * @param firstRow first grid row spanned by the legend (1-based)
 * @param lastRow  last grid row spanned by the legend (inclusive)
 * @param col      grid column holding the legend; may lie right of the grid
 */
public record LegendSpec(String title, List<LegendItem> items, int firstRow, int lastRow, int col) {

    public LegendSpec {
        title = title == null ? "" : title;
        items = List.copyOf(items);
        if (firstRow < 1 || lastRow < firstRow || col < 1) {
            throw new IllegalArgumentException(String.format(
                    "Invalid legend placement rows %d..%d, col %d", firstRow, lastRow, col));
        }
    }
}
