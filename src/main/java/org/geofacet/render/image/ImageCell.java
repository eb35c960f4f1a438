package org.geofacet.render.image;

import org.geofacet.axis.AxisOptions;
import org.geofacet.grid.GridEntry;
import org.geofacet.render.IAxis;
import org.geofacet.render.IFacetCell;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A facet cell of an {@link ImageFigure}. All axes of a cell share the cell's plot area
 * and are drawn on top of each other in creation order.
 */
public class ImageCell implements IFacetCell {

    private final GridEntry entry;
    private final List<ImageAxis> axes = new ArrayList<>();

    ImageCell(GridEntry entry) {
        this.entry = Objects.requireNonNull(entry, "entry");
    }

    @Override
    public GridEntry entry() {
        return entry;
    }

    @Override
    public ImageAxis addAxis(AxisOptions options) {
        ImageAxis axis = new ImageAxis(this, options == null ? AxisOptions.empty() : options);
        axes.add(axis);
        return axis;
    }

    @Override
    public List<IAxis> axes() {
        return Collections.unmodifiableList(axes);
    }

    List<ImageAxis> imageAxes() {
        return axes;
    }

    @Override
    public String toString() {
        return "ImageCell{" + entry.region() + ", axes=" + axes.size() + "}";
    }
}
