package org.geofacet.render.image;

import org.geofacet.grid.GridEntry;
import org.geofacet.render.FigureSpec;
import org.geofacet.render.IAxis;
import org.geofacet.render.IFacetCell;
import org.geofacet.render.IFigure;
import org.geofacet.render.LegendSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A facet figure drawn headlessly into a {@link BufferedImage}.
 * <p>
 * The grid area of {@link FigureSpec#width()} x {@link FigureSpec#height()} pixels is split
 * evenly into the grid's rows and columns. A title adds a band on top and a legend placed
 * right of the grid adds {@link FigureSpec#legendWidth()} pixels on the right.
 */
public class ImageFigure implements IFigure {

    private static final Logger LOG = LoggerFactory.getLogger(ImageFigure.class);

    private final FigureSpec spec;
    private final Map<String, ImageCell> cells = new LinkedHashMap<>();
    private String title;
    private LegendSpec legend;

    public ImageFigure(FigureSpec spec) {
        this.spec = spec;
    }

    @Override
    public FigureSpec spec() {
        return spec;
    }

    @Override
    public ImageCell createCell(GridEntry entry) {
        if (cells.containsKey(entry.region())) {
            throw new IllegalStateException("Cell for region '" + entry.region() + "' already exists");
        }
        ImageCell cell = new ImageCell(entry);
        cells.put(entry.region(), cell);
        return cell;
    }

    @Override
    public List<IFacetCell> cells() {
        return Collections.unmodifiableList(new ArrayList<>(cells.values()));
    }

    @Override
    public Optional<IFacetCell> cell(String region) {
        return Optional.ofNullable(cells.get(region));
    }

    @Override
    public void linkXAxes(List<IAxis> axes) {
        ImageAxis.LinkGroup group = new ImageAxis.LinkGroup(toImageAxes(axes));
        for (IAxis axis : axes) {
            ((ImageAxis) axis).linkX(group);
        }
    }

    @Override
    public void linkYAxes(List<IAxis> axes) {
        ImageAxis.LinkGroup group = new ImageAxis.LinkGroup(toImageAxes(axes));
        for (IAxis axis : axes) {
            ((ImageAxis) axis).linkY(group);
        }
    }

    private static List<ImageAxis> toImageAxes(List<IAxis> axes) {
        List<ImageAxis> result = new ArrayList<>(axes.size());
        for (IAxis axis : axes) {
            if (!(axis instanceof ImageAxis imageAxis)) {
                throw new IllegalArgumentException("Cannot link foreign axis " + axis);
            }
            result.add(imageAxis);
        }
        return result;
    }

    @Override
    public void addTitle(String title) {
        this.title = title;
    }

    @Override
    public Optional<String> title() {
        return Optional.ofNullable(title);
    }

    @Override
    public void addLegend(LegendSpec legend) {
        this.legend = legend;
    }

    @Override
    public Optional<LegendSpec> legend() {
        return Optional.ofNullable(legend);
    }

    /**
     * Pixel width of the rendered image, including a legend column right of the grid.
     */
    public int imageWidth() {
        boolean legendOutside = legend != null && legend.col() > spec.cols();
        return spec.width() + (legendOutside ? spec.legendWidth() : 0);
    }

    public int imageHeight() {
        return spec.height() + (title != null ? spec.titleHeight() : 0);
    }

    /**
     * Draws the figure in its current state.
     */
    public BufferedImage render() {
        BufferedImage image = new BufferedImage(imageWidth(), imageHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            FacetPainter painter = new FacetPainter(g, spec, title != null ? spec.titleHeight() : 0);
            painter.clear(image.getWidth(), image.getHeight());
            if (title != null) {
                painter.drawFigureTitle(title, image.getWidth());
            }
            for (ImageCell cell : cells.values()) {
                painter.drawCell(cell);
            }
            if (legend != null) {
                painter.drawLegend(legend);
            }
        } finally {
            g.dispose();
        }
        return image;
    }

    /**
     * Renders the figure and writes it as a PNG file, creating parent directories as needed.
     *
     * @param file target file
     * @throws IOException if the image cannot be written
     */
    public void writePng(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        BufferedImage image = render();
        if (!ImageIO.write(image, "png", file.toFile())) {
            throw new IOException("No PNG writer available for " + file);
        }
        LOG.debug("Wrote {}x{} facet figure to {}", image.getWidth(), image.getHeight(), file);
    }
}
