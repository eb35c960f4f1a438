package org.geofacet.render;

import java.util.Arrays;
import java.util.Objects;

/**
 * One visual inside an axis: a series of points drawn as lines, markers or bars,
 * optionally labelled for the legend.
 */
public final class PlotElement {

    private final PlotKind kind;
    private final double[] x;
    private final double[] y;
    private final String label;

    public PlotElement(PlotKind kind, double[] x, double[] y, String label) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(x, "x");
        Objects.requireNonNull(y, "y");
        if (x.length != y.length) {
            throw new IllegalArgumentException("x and y must have the same length, got " + x.length + " and " + y.length);
        }
        this.kind = kind;
        this.x = x.clone();
        this.y = y.clone();
        this.label = label;
    }

    public PlotKind kind() {
        return kind;
    }

    public double[] x() {
        return x.clone();
    }

    public double[] y() {
        return y.clone();
    }

    public int size() {
        return x.length;
    }

    public String label() {
        return label;
    }

    public boolean hasLabel() {
        return label != null && !label.isBlank();
    }

    public DataRange xRange() {
        return DataRange.of(x);
    }

    /**
     * Bars always include the zero baseline.
     */
    public DataRange yRange() {
        DataRange range = DataRange.of(y);
        return kind == PlotKind.BARS ? range.union(new DataRange(0, 0)) : range;
    }

    @Override
    public String toString() {
        return "PlotElement{" + kind + ", points=" + x.length + (hasLabel() ? ", label='" + label + "'" : "")
                + ", x=" + Arrays.toString(x) + "}";
    }
}
