package org.geofacet.render.image;

import org.geofacet.render.FigureSpec;
import org.geofacet.render.IFigureFactory;

/**
 * Creates headless {@link ImageFigure}s drawn with Java2D.
 */
public class ImageFigureFactory implements IFigureFactory {

    @Override
    public ImageFigure create(FigureSpec spec) {
        return new ImageFigure(spec);
    }
}
