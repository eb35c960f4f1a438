package org.geofacet.render.image;

import org.geofacet.axis.AxisOptions;
import org.geofacet.render.DataRange;
import org.geofacet.render.IAxis;
import org.geofacet.render.PlotElement;
import org.geofacet.render.PlotKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * An axis of an {@link ImageFigure}. Limits are derived from the plotted data when the
 * figure is drawn; linked axes share the union of their members' data ranges.
 */
public class ImageAxis implements IAxis {

    private final ImageCell cell;
    private final AxisOptions options;
    private final List<PlotElement> plots = new ArrayList<>();
    private LinkGroup xLink;
    private LinkGroup yLink;

    ImageAxis(ImageCell cell, AxisOptions options) {
        this.cell = cell;
        this.options = options;
    }

    public ImageCell cell() {
        return cell;
    }

    @Override
    public AxisOptions options() {
        return options;
    }

    @Override
    public IAxis lines(double[] x, double[] y, String label) {
        plots.add(new PlotElement(PlotKind.LINES, x, y, label));
        return this;
    }

    @Override
    public IAxis scatter(double[] x, double[] y, String label) {
        plots.add(new PlotElement(PlotKind.SCATTER, x, y, label));
        return this;
    }

    @Override
    public IAxis bars(double[] x, double[] y, String label) {
        plots.add(new PlotElement(PlotKind.BARS, x, y, label));
        return this;
    }

    @Override
    public List<PlotElement> plots() {
        return Collections.unmodifiableList(plots);
    }

    @Override
    public DataRange xLimits() {
        return xLink == null ? dataXRange() : xLink.range(ImageAxis::dataXRange);
    }

    @Override
    public DataRange yLimits() {
        return yLink == null ? dataYRange() : yLink.range(ImageAxis::dataYRange);
    }

    public boolean isXLinked() {
        return xLink != null;
    }

    public boolean isYLinked() {
        return yLink != null;
    }

    DataRange dataXRange() {
        DataRange range = DataRange.EMPTY;
        for (PlotElement plot : plots) {
            range = range.union(plot.xRange());
        }
        return range;
    }

    DataRange dataYRange() {
        DataRange range = DataRange.EMPTY;
        for (PlotElement plot : plots) {
            range = range.union(plot.yRange());
        }
        return range;
    }

    void linkX(LinkGroup group) {
        this.xLink = group;
    }

    void linkY(LinkGroup group) {
        this.yLink = group;
    }

    /**
     * Axes sharing one range along a direction.
     */
    static final class LinkGroup {
        private final List<ImageAxis> members;

        LinkGroup(List<ImageAxis> members) {
            this.members = List.copyOf(members);
        }

        DataRange range(Function<ImageAxis, DataRange> extent) {
            DataRange range = DataRange.EMPTY;
            for (ImageAxis member : members) {
                range = range.union(extent.apply(member));
            }
            return range;
        }

        int size() {
            return members.size();
        }
    }
}
