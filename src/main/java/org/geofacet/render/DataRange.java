package org.geofacet.render;

/**
 * A closed numeric interval. {@link #EMPTY} is the neutral element of {@link #union(DataRange)}.
 */
public record DataRange(double min, double max) {

    public static final DataRange EMPTY = new DataRange(Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY);

    public static DataRange of(double[] values) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            if (Double.isFinite(v)) {
                min = Math.min(min, v);
                max = Math.max(max, v);
            }
        }
        return new DataRange(min, max);
    }

    public boolean isEmpty() {
        return min > max;
    }

    public double span() {
        return isEmpty() ? 0 : max - min;
    }

    public DataRange union(DataRange other) {
        if (other.isEmpty()) return this;
        if (isEmpty()) return other;
        return new DataRange(Math.min(min, other.min), Math.max(max, other.max));
    }

    /**
     * Returns a drawable range: empty becomes [0, 1], a single value is widened by 0.5 on each side.
     */
    public DataRange padded() {
        if (isEmpty()) {
            return new DataRange(0, 1);
        }
        if (max == min) {
            return new DataRange(min - 0.5, max + 0.5);
        }
        return this;
    }
}
