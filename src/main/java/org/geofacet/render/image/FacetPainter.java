package org.geofacet.render.image;

import org.geofacet.axis.AxisOptions;
import org.geofacet.axis.YAxisPosition;
import org.geofacet.render.DataRange;
import org.geofacet.render.FigureSpec;
import org.geofacet.render.LegendItem;
import org.geofacet.render.LegendSpec;
import org.geofacet.render.PlotElement;
import org.geofacet.render.PlotKind;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.Rectangle;
import java.awt.geom.AffineTransform;
import java.awt.geom.Path2D;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Draws cells, legend and title of an {@link ImageFigure} onto a {@link Graphics2D}.
 * <p>
 * Every cell uses the same margins so that plot areas line up across the grid,
 * which matters when axes are linked and inner decorations are hidden.
 */
final class FacetPainter {

    private static final Color COLOR_BACKGROUND = Color.decode("#ffffff");
    private static final Color COLOR_SPINE = Color.decode("#9a9a9a");
    private static final Color COLOR_TEXT = Color.decode("#202020");
    private static final Color COLOR_GRID = Color.decode("#ececec");

    static final Color[] SERIES_PALETTE = {
            Color.decode("#1e90ff"), Color.decode("#dc143c"), Color.decode("#32cd32"),
            Color.decode("#ffa500"), Color.decode("#9370db"), Color.decode("#00ced1"),
            Color.decode("#ffd700")
    };

    private static final int MARGIN_LEFT = 40;
    private static final int MARGIN_RIGHT = 12;
    private static final int MARGIN_RIGHT_AXIS = 40;
    private static final int MARGIN_TOP = 20;
    private static final int MARGIN_BOTTOM = 30;
    private static final int TICK_LENGTH = 4;
    private static final int TARGET_TICKS = 4;

    private final Graphics2D g;
    private final FigureSpec spec;
    private final int top;
    private final int cellWidth;
    private final int cellHeight;
    private final Font tickFont = new Font(Font.SANS_SERIF, Font.PLAIN, 9);
    private final Font labelFont = new Font(Font.SANS_SERIF, Font.PLAIN, 10);
    private final Font titleFont = new Font(Font.SANS_SERIF, Font.BOLD, 11);
    private final Font figureTitleFont = new Font(Font.SANS_SERIF, Font.BOLD, 16);

    FacetPainter(Graphics2D g, FigureSpec spec, int top) {
        this.g = g;
        this.spec = spec;
        this.top = top;
        this.cellWidth = spec.width() / Math.max(1, spec.cols());
        this.cellHeight = spec.height() / Math.max(1, spec.rows());
    }

    void clear(int width, int height) {
        g.setColor(COLOR_BACKGROUND);
        g.fillRect(0, 0, width, height);
    }

    void drawFigureTitle(String title, int width) {
        g.setFont(figureTitleFont);
        g.setColor(COLOR_TEXT);
        FontMetrics fm = g.getFontMetrics();
        g.drawString(title, (width - fm.stringWidth(title)) / 2, (top + fm.getAscent()) / 2);
    }

    void drawCell(ImageCell cell) {
        int x0 = (cell.entry().col() - 1) * cellWidth;
        int y0 = top + (cell.entry().row() - 1) * cellHeight;
        boolean anyRightAxis = cell.imageAxes().stream()
                .anyMatch(a -> YAxisPosition.of(a.options()) == YAxisPosition.RIGHT);
        Rectangle plot = new Rectangle(
                x0 + MARGIN_LEFT,
                y0 + MARGIN_TOP,
                cellWidth - MARGIN_LEFT - (anyRightAxis ? MARGIN_RIGHT_AXIS : MARGIN_RIGHT),
                cellHeight - MARGIN_TOP - MARGIN_BOTTOM);
        if (plot.width <= 0 || plot.height <= 0) {
            return;
        }
        boolean titleDrawn = false;
        for (ImageAxis axis : cell.imageAxes()) {
            drawAxis(axis, plot);
            String title = axis.options().getString(AxisOptions.TITLE, null);
            if (!titleDrawn && title != null && !title.isBlank()) {
                g.setFont(titleFont);
                g.setColor(COLOR_TEXT);
                FontMetrics fm = g.getFontMetrics();
                g.drawString(title, plot.x + (plot.width - fm.stringWidth(title)) / 2, plot.y - 6);
                titleDrawn = true;
            }
        }
    }

    private void drawAxis(ImageAxis axis, Rectangle plot) {
        AxisOptions options = axis.options();
        DataRange xr = axis.xLimits().padded();
        DataRange yr = axis.yLimits().padded();
        boolean right = YAxisPosition.of(options) == YAxisPosition.RIGHT;

        g.setStroke(new BasicStroke(1f));
        g.setColor(COLOR_SPINE);
        g.drawRect(plot.x, plot.y, plot.width, plot.height);

        g.setFont(tickFont);
        FontMetrics fm = g.getFontMetrics();
        if (options.getBoolean(AxisOptions.X_TICKS_VISIBLE, true)) {
            for (double tick : ticks(xr)) {
                int px = mapX(tick, xr, plot);
                g.setColor(COLOR_SPINE);
                g.drawLine(px, plot.y + plot.height, px, plot.y + plot.height + TICK_LENGTH);
                if (options.getBoolean(AxisOptions.X_TICK_LABELS_VISIBLE, true)) {
                    String text = formatTick(tick, xr);
                    g.setColor(COLOR_TEXT);
                    g.drawString(text, px - fm.stringWidth(text) / 2,
                            plot.y + plot.height + TICK_LENGTH + fm.getAscent());
                }
            }
        }
        String xLabel = options.getString(AxisOptions.X_LABEL, null);
        if (xLabel != null && options.getBoolean(AxisOptions.X_LABEL_VISIBLE, true)) {
            g.setFont(labelFont);
            g.setColor(COLOR_TEXT);
            FontMetrics lfm = g.getFontMetrics();
            g.drawString(xLabel, plot.x + (plot.width - lfm.stringWidth(xLabel)) / 2,
                    plot.y + plot.height + MARGIN_BOTTOM - 2);
            g.setFont(tickFont);
        }

        int spineX = right ? plot.x + plot.width : plot.x;
        int direction = right ? 1 : -1;
        if (options.getBoolean(AxisOptions.Y_TICKS_VISIBLE, true)) {
            for (double tick : ticks(yr)) {
                int py = mapY(tick, yr, plot);
                g.setColor(COLOR_GRID);
                g.drawLine(plot.x + 1, py, plot.x + plot.width - 1, py);
                g.setColor(COLOR_SPINE);
                g.drawLine(spineX, py, spineX + direction * TICK_LENGTH, py);
                if (options.getBoolean(AxisOptions.Y_TICK_LABELS_VISIBLE, true)) {
                    String text = formatTick(tick, yr);
                    int tx = right ? spineX + TICK_LENGTH + 2 : spineX - TICK_LENGTH - 2 - fm.stringWidth(text);
                    g.setColor(COLOR_TEXT);
                    g.drawString(text, tx, py + fm.getAscent() / 2);
                }
            }
        }
        String yLabel = options.getString(AxisOptions.Y_LABEL, null);
        if (yLabel != null && options.getBoolean(AxisOptions.Y_LABEL_VISIBLE, true)) {
            drawVerticalLabel(yLabel, right ? plot.x + plot.width + MARGIN_RIGHT_AXIS - 4 : plot.x - MARGIN_LEFT + 10,
                    plot.y + plot.height / 2);
        }

        List<PlotElement> plots = axis.plots();
        for (int i = 0; i < plots.size(); i++) {
            drawPlot(plots.get(i), SERIES_PALETTE[i % SERIES_PALETTE.length], xr, yr, plot);
        }
    }

    private void drawVerticalLabel(String text, int x, int centerY) {
        g.setFont(labelFont);
        g.setColor(COLOR_TEXT);
        FontMetrics fm = g.getFontMetrics();
        AffineTransform saved = g.getTransform();
        g.rotate(-Math.PI / 2, x, centerY);
        g.drawString(text, x - fm.stringWidth(text) / 2, centerY);
        g.setTransform(saved);
    }

    private void drawPlot(PlotElement element, Color color, DataRange xr, DataRange yr, Rectangle plot) {
        double[] xs = element.x();
        double[] ys = element.y();
        g.setColor(color);
        java.awt.Shape savedClip = g.getClip();
        g.clipRect(plot.x, plot.y, plot.width + 1, plot.height + 1);
        try {
            switch (element.kind()) {
                case LINES -> {
                    g.setStroke(new BasicStroke(1.5f));
                    Path2D.Double path = new Path2D.Double();
                    boolean penDown = false;
                    for (int i = 0; i < xs.length; i++) {
                        if (!Double.isFinite(xs[i]) || !Double.isFinite(ys[i])) {
                            penDown = false;
                            continue;
                        }
                        double px = mapXExact(xs[i], xr, plot);
                        double py = mapYExact(ys[i], yr, plot);
                        if (penDown) {
                            path.lineTo(px, py);
                        } else {
                            path.moveTo(px, py);
                            penDown = true;
                        }
                    }
                    g.draw(path);
                }
                case SCATTER -> {
                    for (int i = 0; i < xs.length; i++) {
                        if (Double.isFinite(xs[i]) && Double.isFinite(ys[i])) {
                            g.fillOval(mapX(xs[i], xr, plot) - 2, mapY(ys[i], yr, plot) - 2, 5, 5);
                        }
                    }
                }
                case BARS -> {
                    int barWidth = Math.max(1, (int) (plot.width / Math.max(1.0, xs.length) * 0.8));
                    int baseline = mapY(Math.max(yr.min(), Math.min(0, yr.max())), yr, plot);
                    for (int i = 0; i < xs.length; i++) {
                        if (Double.isFinite(xs[i]) && Double.isFinite(ys[i])) {
                            int px = mapX(xs[i], xr, plot);
                            int py = mapY(ys[i], yr, plot);
                            g.fillRect(px - barWidth / 2, Math.min(py, baseline), barWidth, Math.abs(baseline - py));
                        }
                    }
                }
            }
        } finally {
            g.setClip(savedClip);
        }
    }

    void drawLegend(LegendSpec legend) {
        Rectangle area;
        int rowsSpanned = legend.lastRow() - legend.firstRow() + 1;
        int y = top + (legend.firstRow() - 1) * cellHeight;
        if (legend.col() > spec.cols()) {
            area = new Rectangle(spec.width() + 8, y, spec.legendWidth() - 16, rowsSpanned * cellHeight);
        } else {
            area = new Rectangle((legend.col() - 1) * cellWidth + 8, y, cellWidth - 16, rowsSpanned * cellHeight);
        }
        if (area.width <= 0) {
            return;
        }

        g.setFont(titleFont);
        FontMetrics fm = g.getFontMetrics();
        int lineHeight = fm.getHeight() + 4;
        int contentHeight = legend.items().size() * lineHeight + (legend.title().isEmpty() ? 0 : lineHeight) + 8;
        int boxY = area.y + Math.max(0, (area.height - contentHeight) / 2);

        g.setColor(COLOR_SPINE);
        g.drawRect(area.x, boxY, area.width, Math.min(contentHeight, area.height));

        int cursor = boxY + 4 + fm.getAscent();
        g.setColor(COLOR_TEXT);
        if (!legend.title().isEmpty()) {
            g.drawString(legend.title(), area.x + 6, cursor);
            cursor += lineHeight;
        }
        g.setFont(labelFont);
        for (LegendItem item : legend.items()) {
            Color color = SERIES_PALETTE[item.seriesIndex() % SERIES_PALETTE.length];
            int sx = area.x + 6;
            int sy = cursor - fm.getAscent() / 2;
            g.setColor(color);
            if (item.kind() == PlotKind.LINES) {
                g.setStroke(new BasicStroke(2f));
                g.drawLine(sx, sy, sx + 16, sy);
                g.setStroke(new BasicStroke(1f));
            } else if (item.kind() == PlotKind.SCATTER) {
                g.fillOval(sx + 5, sy - 3, 6, 6);
            } else {
                g.fillRect(sx + 2, sy - 5, 12, 10);
            }
            g.setColor(COLOR_TEXT);
            g.drawString(item.label(), sx + 22, cursor);
            cursor += lineHeight;
        }
    }

    static List<Double> ticks(DataRange range) {
        double step = niceStep(range.span() / TARGET_TICKS);
        List<Double> ticks = new ArrayList<>();
        double start = Math.ceil(range.min() / step) * step;
        for (double v = start; v <= range.max() + step * 1e-9; v += step) {
            ticks.add(Math.abs(v) < step * 1e-9 ? 0.0 : v);
        }
        return ticks;
    }

    static double niceStep(double raw) {
        double exponent = Math.floor(Math.log10(raw));
        double magnitude = Math.pow(10, exponent);
        double fraction = raw / magnitude;
        double nice;
        if (fraction < 1.5) {
            nice = 1;
        } else if (fraction < 3) {
            nice = 2;
        } else if (fraction < 7) {
            nice = 5;
        } else {
            nice = 10;
        }
        return nice * magnitude;
    }

    private static String formatTick(double value, DataRange range) {
        double step = niceStep(range.span() / TARGET_TICKS);
        int decimals = (int) Math.max(0, -Math.floor(Math.log10(step)));
        return String.format(Locale.ROOT, "%." + decimals + "f", value);
    }

    private static int mapX(double value, DataRange range, Rectangle plot) {
        return (int) Math.round(mapXExact(value, range, plot));
    }

    private static int mapY(double value, DataRange range, Rectangle plot) {
        return (int) Math.round(mapYExact(value, range, plot));
    }

    private static double mapXExact(double value, DataRange range, Rectangle plot) {
        return plot.x + (value - range.min()) / range.span() * plot.width;
    }

    private static double mapYExact(double value, DataRange range, Rectangle plot) {
        return plot.y + plot.height - (value - range.min()) / range.span() * plot.height;
    }
}
