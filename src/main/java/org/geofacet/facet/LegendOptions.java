package org.geofacet.facet;

/**
 * Explicit legend request. Unset placement fields fall back to a column right of the grid
 * spanning all of its rows.
 *
 * @param title    legend title, may be null
 * @param firstRow first grid row spanned, or null for row 1
 * @param lastRow  last grid row spanned, or null for the grid's last row
 * @param col      grid column, or null for the column right of the grid
 */
public record LegendOptions(String title, Integer firstRow, Integer lastRow, Integer col) {

    public LegendOptions {
        if ((firstRow == null) != (lastRow == null)) {
            throw new IllegalArgumentException("Legend rows must be given as a pair");
        }
        if (firstRow != null && (firstRow < 1 || lastRow < firstRow)) {
            throw new IllegalArgumentException("Invalid legend rows " + firstRow + ".." + lastRow);
        }
        if (col != null && col < 1) {
            throw new IllegalArgumentException("Invalid legend column " + col);
        }
    }

    public static LegendOptions defaults() {
        return new LegendOptions(null, null, null, null);
    }

    public static LegendOptions titled(String title) {
        return new LegendOptions(title, null, null, null);
    }

    public LegendOptions inRows(int first, int last) {
        return new LegendOptions(title, first, last, col);
    }

    public LegendOptions inColumn(int column) {
        return new LegendOptions(title, firstRow, lastRow, column);
    }
}
