package org.geofacet.grid;

/**
 * Extent of a grid: the largest occupied row and column. Both are 0 for an empty grid.
 */
public record GridDimensions(int maxRow, int maxCol) {

    public static final GridDimensions EMPTY = new GridDimensions(0, 0);

    public int cellCount() {
        return maxRow * maxCol;
    }
}
