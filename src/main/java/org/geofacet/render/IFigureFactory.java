package org.geofacet.render;

/**
 * Creates empty figures for a facet plot.
 */
@FunctionalInterface
public interface IFigureFactory {

    IFigure create(FigureSpec spec);
}
