package org.geofacet.facet;

import org.geofacet.axis.LinkMode;
import org.geofacet.render.IAxis;
import org.geofacet.render.IFacetCell;
import org.geofacet.render.IFigure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Links axis ranges across facets after all cells are populated.
 * <p>
 * Axes are grouped by their creation index inside each cell, so the first axis of every
 * cell is linked with the first axis of every other cell and never with a second axis.
 */
public final class AxisLinker {

    private static final Logger LOG = LoggerFactory.getLogger(AxisLinker.class);

    private AxisLinker() {
        // Private constructor to prevent instantiation
    }

    /**
     * Groups axes by creation index. Group {@code i} holds the {@code i}-th axis of every cell
     * that has at least {@code i + 1} axes, in cell order.
     */
    public static List<List<IAxis>> groupByPosition(List<? extends IFacetCell> cells) {
        List<List<IAxis>> groups = new ArrayList<>();
        for (IFacetCell cell : cells) {
            List<IAxis> axes = cell.axes();
            for (int i = 0; i < axes.size(); i++) {
                if (groups.size() <= i) {
                    groups.add(new ArrayList<>());
                }
                groups.get(i).add(axes.get(i));
            }
        }
        return groups;
    }

    /**
     * Links every non-empty group along the directions {@code linkMode} requests.
     */
    public static void link(IFigure figure, List<List<IAxis>> groups, LinkMode linkMode) {
        if (linkMode == LinkMode.NONE) {
            return;
        }
        for (List<IAxis> group : groups) {
            if (group.isEmpty()) {
                continue;
            }
            if (linkMode.linksX()) {
                figure.linkXAxes(group);
            }
            if (linkMode.linksY()) {
                figure.linkYAxes(group);
            }
        }
        LOG.debug("Linked {} axis group(s) with mode {}", groups.size(), linkMode);
    }
}
