package org.geofacet.facet;

import org.geofacet.axis.AxisOptions;
import org.geofacet.data.DataTable;
import org.geofacet.render.IFacetCell;

import java.util.Map;

/**
 * Plot callback for cells with exactly one axis. Wrap it with {@link IFacetPlotter#singleAxis}.
 */
@FunctionalInterface
public interface ISingleAxisPlotter {

    void plot(IFacetCell cell, DataTable regionData, AxisOptions axisOptions,
              Map<String, Object> extraArgs) throws Exception;
}
