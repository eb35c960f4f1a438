package org.geofacet.axis;

import org.geofacet.grid.GeoGrid;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes the final options of every axis in a facet cell.
 * <p>
 * Three layers are merged per axis, lowest precedence first:
 * <ol>
 *   <li>the common options shared by every axis of every cell,</li>
 *   <li>the axis' own entry of the per-axis option list, when present,</li>
 *   <li>the decoration-hiding options computed from the cell's neighbours.</li>
 * </ol>
 * The number of axes in a cell is the length of the per-axis list, or 1 when the list is empty.
 * <p>
 * Decorations are hidden only on linked axes: an x axis loses its ticks and labels when a
 * facet is rendered somewhere below it in the same column, a y axis when a facet is rendered
 * on the side its decorations face. The neighbour grid must contain exactly the regions that
 * get a rendered cell, otherwise hidden decorations would point at empty space.
 */
public final class AxisOptionsMerger {

    private static final AxisOptions HIDE_X_DECORATIONS = AxisOptions.of(
            AxisOptions.X_TICKS_VISIBLE, false,
            AxisOptions.X_TICK_LABELS_VISIBLE, false,
            AxisOptions.X_LABEL_VISIBLE, false);

    private static final AxisOptions HIDE_Y_DECORATIONS = AxisOptions.of(
            AxisOptions.Y_TICKS_VISIBLE, false,
            AxisOptions.Y_TICK_LABELS_VISIBLE, false,
            AxisOptions.Y_LABEL_VISIBLE, false);

    private AxisOptionsMerger() {
        // Private constructor to prevent instantiation
    }

    public static int axisCount(List<AxisOptions> perAxisOptions) {
        return perAxisOptions.isEmpty() ? 1 : perAxisOptions.size();
    }

    /**
     * Computes the decoration-hiding options of each axis of {@code region}'s cell.
     *
     * @param neighborGrid   grid whose entries all get a rendered cell
     * @param region         region of the cell
     * @param linkMode       axis link mode
     * @param hideInner      when false, every returned entry is empty
     * @param common         options shared by all axes, consulted for {@code yaxisposition}
     * @param perAxisOptions per-axis options, consulted for {@code yaxisposition}
     * @return one entry per axis
     */
    public static List<AxisOptions> decorationOptions(GeoGrid neighborGrid, String region, LinkMode linkMode,
                                                      boolean hideInner, AxisOptions common,
                                                      List<AxisOptions> perAxisOptions) {
        int numAxes = axisCount(perAxisOptions);
        List<AxisOptions> decorations = new ArrayList<>(numAxes);
        boolean hideX = hideInner && linkMode.linksX() && neighborGrid.hasNeighborBelow(region);

        for (int i = 0; i < numAxes; i++) {
            AxisOptions axisDecorations = AxisOptions.empty();
            if (!hideInner) {
                decorations.add(axisDecorations);
                continue;
            }
            if (hideX) {
                axisDecorations = axisDecorations.merge(HIDE_X_DECORATIONS);
            }
            if (linkMode.linksY()) {
                AxisOptions userOptions = i < perAxisOptions.size() ? common.merge(perAxisOptions.get(i)) : common;
                boolean neighborOnSide = switch (YAxisPosition.of(userOptions)) {
                    case LEFT -> neighborGrid.hasNeighborLeft(region);
                    case RIGHT -> neighborGrid.hasNeighborRight(region);
                };
                if (neighborOnSide) {
                    axisDecorations = axisDecorations.merge(HIDE_Y_DECORATIONS);
                }
            }
            decorations.add(axisDecorations);
        }
        return decorations;
    }

    /**
     * Layers common, per-axis and decoration options for {@code numAxes} axes.
     * Missing per-axis or decoration entries are skipped for that axis.
     */
    public static List<AxisOptions> merge(AxisOptions common, List<AxisOptions> perAxisOptions,
                                          List<AxisOptions> decorationOptions, int numAxes) {
        List<AxisOptions> merged = new ArrayList<>(numAxes);
        for (int i = 0; i < numAxes; i++) {
            AxisOptions options = common;
            if (i < perAxisOptions.size()) {
                options = options.merge(perAxisOptions.get(i));
            }
            if (i < decorationOptions.size()) {
                options = options.merge(decorationOptions.get(i));
            }
            merged.add(options);
        }
        return List.copyOf(merged);
    }

    /**
     * Computes the final options of every axis of {@code region}'s cell.
     */
    public static List<AxisOptions> axisOptionsFor(GeoGrid neighborGrid, String region, LinkMode linkMode,
                                                   boolean hideInner, AxisOptions common,
                                                   List<AxisOptions> perAxisOptions) {
        List<AxisOptions> decorations =
                decorationOptions(neighborGrid, region, linkMode, hideInner, common, perAxisOptions);
        return merge(common, perAxisOptions, decorations, axisCount(perAxisOptions));
    }
}
