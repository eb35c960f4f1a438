package org.geofacet.grid;

/**
 * A 1-based (row, column) cell position inside a {@link GeoGrid}.
 *
 * @param row the row, counted from the top starting at 1
 * @param col the column, counted from the left starting at 1
 */
public record GridPosition(int row, int col) {

    public static GridPosition of(int row, int col) {
        return new GridPosition(row, col);
    }

    @Override
    public String toString() {
        return "(" + row + ", " + col + ")";
    }
}
