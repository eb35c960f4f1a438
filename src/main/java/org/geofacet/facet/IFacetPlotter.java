package org.geofacet.facet;

import org.geofacet.axis.AxisOptions;
import org.geofacet.data.DataTable;
import org.geofacet.render.IFacetCell;

import java.util.List;
import java.util.Map;

/**
 * User callback that draws one region's data into its facet cell.
 * <p>
 * The callback creates its axes through {@link IFacetCell#addAxis(AxisOptions)}, normally one axis
 * per entry of {@code axisOptions} and in the same order, so that axes at the same index are
 * linked across cells. Any exception thrown is recorded as a {@link RenderFailure} for the region
 * and does not stop the other regions from rendering.
 */
@FunctionalInterface
public interface IFacetPlotter {

    /**
     * @param cell        empty cell created for the region
     * @param regionData  rows of the input table belonging to the region
     * @param axisOptions fully merged options, one entry per axis and never empty
     * @param extraArgs   caller-supplied arguments passed through unchanged
     * @throws Exception any failure while plotting
     */
    void plot(IFacetCell cell, DataTable regionData, List<AxisOptions> axisOptions,
              Map<String, Object> extraArgs) throws Exception;

    /**
     * Adapts a single-axis callback. Cells configured with more than one axis fail with an
     * {@link IllegalArgumentException}.
     */
    static IFacetPlotter singleAxis(ISingleAxisPlotter plotter) {
        return (cell, regionData, axisOptions, extraArgs) -> {
            if (axisOptions.size() != 1) {
                throw new IllegalArgumentException(String.format(
                        "Single-axis plotter cannot handle %d axis configurations in region %s",
                        axisOptions.size(), cell.region()));
            }
            plotter.plot(cell, regionData, axisOptions.get(0), extraArgs);
        };
    }
}
