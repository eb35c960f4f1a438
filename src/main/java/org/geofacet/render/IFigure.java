package org.geofacet.render;

import org.geofacet.grid.GridEntry;

import java.util.List;
import java.util.Optional;

/**
 * The top-level render container of a facet plot.
 * <p>
 * A figure is populated by exactly one writer and is not thread-safe.
 */
public interface IFigure {

    FigureSpec spec();

    /**
     * Creates the cell of {@code entry} at its grid position.
     *
     * @throws IllegalStateException if a cell for the same region already exists
     */
    IFacetCell createCell(GridEntry entry);

    /**
     * Cells in creation order.
     */
    List<IFacetCell> cells();

    Optional<IFacetCell> cell(String region);

    /**
     * Makes all given axes share one horizontal range.
     */
    void linkXAxes(List<IAxis> axes);

    /**
     * Makes all given axes share one vertical range.
     */
    void linkYAxes(List<IAxis> axes);

    void addTitle(String title);

    Optional<String> title();

    void addLegend(LegendSpec legend);

    Optional<LegendSpec> legend();

    /**
     * Returns true when any axis of any cell holds a plot with a non-blank label.
     */
    default boolean hasLabeledPlots() {
        for (IFacetCell cell : cells()) {
            for (IAxis axis : cell.axes()) {
                for (PlotElement plot : axis.plots()) {
                    if (plot.hasLabel()) {
                        return true;
                    }
                }
            }
        }
        return false;
    }
}
