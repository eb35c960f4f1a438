package org.geofacet.render;

import org.geofacet.axis.AxisOptions;

import java.util.List;

/**
 * A plotting area inside a facet cell. Handles are created by {@link IFacetCell#addAxis(AxisOptions)}
 * and linked across cells by {@link IFigure}.
 */
public interface IAxis {

    /**
     * The options this axis was created with.
     */
    AxisOptions options();

    IAxis lines(double[] x, double[] y, String label);

    IAxis scatter(double[] x, double[] y, String label);

    IAxis bars(double[] x, double[] y, String label);

    default IAxis lines(double[] x, double[] y) {
        return lines(x, y, null);
    }

    default IAxis scatter(double[] x, double[] y) {
        return scatter(x, y, null);
    }

    default IAxis bars(double[] x, double[] y) {
        return bars(x, y, null);
    }

    /**
     * Visuals drawn into this axis, in drawing order.
     */
    List<PlotElement> plots();

    /**
     * Effective horizontal limits: the union of all x-linked axes' data, or this axis' own data.
     */
    DataRange xLimits();

    /**
     * Effective vertical limits: the union of all y-linked axes' data, or this axis' own data.
     */
    DataRange yLimits();
}
