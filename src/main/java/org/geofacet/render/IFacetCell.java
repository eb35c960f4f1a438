package org.geofacet.render;

import org.geofacet.axis.AxisOptions;
import org.geofacet.grid.GridEntry;

import java.util.List;

/**
 * The container of one facet, placed at its region's grid position. A cell holds
 * zero or more axes, kept in creation order.
 */
public interface IFacetCell {

    GridEntry entry();

    default String region() {
        return entry().region();
    }

    /**
     * Creates a new axis in this cell.
     *
     * @param options the fully merged options of the axis
     * @return the new axis handle
     */
    IAxis addAxis(AxisOptions options);

    /**
     * Axes of this cell in creation order.
     */
    List<IAxis> axes();
}
