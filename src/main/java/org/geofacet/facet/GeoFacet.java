package org.geofacet.facet;

import org.geofacet.GeoFacetException;
import org.geofacet.axis.AxisOptions;
import org.geofacet.axis.AxisOptionsMerger;
import org.geofacet.data.DataTable;
import org.geofacet.data.GroupedTable;
import org.geofacet.data.RegionMatcher;
import org.geofacet.grid.GeoGrid;
import org.geofacet.grid.GridDimensions;
import org.geofacet.grid.GridEntry;
import org.geofacet.grid.GridLoadException;
import org.geofacet.grid.PredefinedGrids;
import org.geofacet.render.FigureSpec;
import org.geofacet.render.IAxis;
import org.geofacet.render.IFacetCell;
import org.geofacet.render.IFigure;
import org.geofacet.render.LegendItem;
import org.geofacet.render.LegendSpec;
import org.geofacet.render.PlotElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Lays out one small plot per region at the region's position in a {@link GeoGrid}.
 * <p>
 * A call runs in fixed phases: validation, partitioning of the table by region, the
 * missing/extra cross-check, the per-cell render loop, axis linking, title and legend.
 * All fatal errors are raised before the first cell is created. A failing plot callback only
 * affects its own region; it is logged and reported in {@link FacetResult#failures()}.
 * <p>
 * Instances are stateless apart from the grid registry and may be shared. A single call is
 * synchronous and populates its figure from one thread.
 */
public class GeoFacet {

    private static final Logger LOG = LoggerFactory.getLogger(GeoFacet.class);

    private final PredefinedGrids grids;

    /**
     * Creates an instance resolving default grids from the shared registry.
     */
    public GeoFacet() {
        this(null);
    }

    /**
     * @param grids registry used to resolve {@link FacetOptions#defaultGridName()};
     *              {@code null} means {@link PredefinedGrids#shared()}, looked up lazily
     */
    public GeoFacet(PredefinedGrids grids) {
        this.grids = grids;
    }

    /**
     * Plots {@code data} with the default options.
     *
     * @see #plot(DataTable, String, IFacetPlotter, FacetOptions)
     */
    public FacetResult plot(DataTable data, String regionColumn, IFacetPlotter plotter) {
        return plot(data, regionColumn, plotter, FacetOptions.defaults());
    }

    /**
     * Creates a figure with one cell per grid region and lets {@code plotter} draw each region's rows.
     *
     * @param data         input table, must have rows and columns
     * @param regionColumn column holding region codes, matched case-insensitively against the grid
     * @param plotter      callback drawing one region
     * @param options      call options
     * @return the populated figure and bookkeeping
     * @throws GeoFacetException on empty input, an unknown column, or missing/extra regions under
     *                           the {@code error} policies
     */
    public FacetResult plot(DataTable data, String regionColumn, IFacetPlotter plotter, FacetOptions options) {
        Objects.requireNonNull(plotter, "plotter");
        Objects.requireNonNull(options, "options");

        // Phase 1: validate
        if (data == null || data.isEmpty()) {
            throw new GeoFacetException(GeoFacetException.Kind.EMPTY_INPUT, "Data cannot be empty");
        }
        if (regionColumn == null || !data.hasColumn(regionColumn)) {
            throw new GeoFacetException(GeoFacetException.Kind.COLUMN_NOT_FOUND,
                    "Column " + regionColumn + " not found in data");
        }
        GeoGrid grid = resolveGrid(options);

        // Phase 2: partition
        GroupedTable grouped = data.groupBy(regionColumn);
        Set<String> available = RegionMatcher.availableRegions(grouped);

        // Phase 3: cross-check
        List<String> missing = grid.regions().stream()
                .filter(region -> !RegionMatcher.hasData(available, region))
                .toList();
        if (options.missingRegions() == MissingRegionPolicy.ERROR && !missing.isEmpty()) {
            throw new GeoFacetException(GeoFacetException.Kind.MISSING_REGIONS,
                    "Missing regions in data: " + String.join(", ", missing), missing);
        }
        Set<String> gridRegions = grid.regions().stream()
                .map(RegionMatcher::normalize)
                .collect(Collectors.toSet());
        List<String> extra = grouped.keys().stream()
                .filter(key -> !gridRegions.contains(RegionMatcher.normalize(key)))
                .sorted()
                .toList();
        if (!extra.isEmpty()) {
            String message = "Additional regions in data not present in the grid provided: " + String.join(", ", extra);
            if (options.extraRegions() == ExtraRegionPolicy.ERROR) {
                throw new GeoFacetException(GeoFacetException.Kind.EXTRA_REGIONS, message, extra);
            }
            LOG.warn(message);
        }

        // Phase 4: cells that will not be rendered must not hide their neighbours' decorations
        GeoGrid neighborGrid = options.missingRegions() == MissingRegionPolicy.PLACEHOLDER
                ? grid
                : grid.filter(entry -> RegionMatcher.hasData(available, entry.region()));

        GridDimensions dims = grid.dimensions();
        FigureSpec spec = new FigureSpec(dims.maxRow(), dims.maxCol(),
                options.figureWidth(dims.maxCol()), options.figureHeight(dims.maxRow()),
                options.legendWidth(), options.titleHeight());
        IFigure figure = options.figureFactory().create(spec);

        // Phase 5: per-cell loop
        List<String> rendered = new ArrayList<>();
        List<String> placeholders = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        List<RenderFailure> failures = new ArrayList<>();
        List<IFacetCell> createdCells = new ArrayList<>();

        for (GridEntry entry : grid) {
            String region = entry.region();
            List<AxisOptions> axisOptions = AxisOptionsMerger.axisOptionsFor(neighborGrid, region,
                    options.linkMode(), options.hideInnerDecorations(),
                    options.commonAxisOptions(), options.axisOptionsList());

            if (RegionMatcher.hasData(available, region)) {
                DataTable regionData = RegionMatcher.dataFor(grouped, region).orElseThrow();
                IFacetCell cell = figure.createCell(entry);
                createdCells.add(cell);
                try {
                    plotter.plot(cell, regionData, axisOptions, options.extraArgs());
                    rendered.add(region);
                } catch (Exception e) {
                    RenderFailure failure = new RenderFailure(region, e);
                    LOG.warn(failure.message());
                    failures.add(failure);
                }
            } else if (options.missingRegions() == MissingRegionPolicy.PLACEHOLDER) {
                IFacetCell cell = figure.createCell(entry);
                createdCells.add(cell);
                for (AxisOptions axisOption : axisOptions) {
                    cell.addAxis(AxisOptions.of(AxisOptions.TITLE, region).merge(axisOption));
                }
                placeholders.add(region);
            } else {
                skipped.add(region);
            }
        }

        // Phase 6: link
        if (!createdCells.isEmpty()) {
            AxisLinker.link(figure, AxisLinker.groupByPosition(createdCells), options.linkMode());
        }

        // Phase 7: title
        options.title().ifPresent(figure::addTitle);

        // Phase 8: legend
        boolean legendCreated = addLegend(figure, dims, options);

        LOG.debug("Faceted {} region(s) on grid '{}': {} rendered, {} placeholder(s), {} skipped, {} failed",
                grid.size(), grid.name(), rendered.size(), placeholders.size(), skipped.size(), failures.size());

        return new FacetResult(figure, rendered, placeholders, skipped, failures, extra, legendCreated);
    }

    private GeoGrid resolveGrid(FacetOptions options) {
        Optional<GeoGrid> explicit = options.grid();
        if (explicit.isPresent()) {
            return explicit.get();
        }
        PredefinedGrids registry = grids != null ? grids : PredefinedGrids.shared();
        try {
            return registry.get(options.defaultGridName());
        } catch (GridLoadException e) {
            throw new IllegalStateException("Default grid '" + options.defaultGridName() + "' could not be loaded", e);
        }
    }

    private static boolean addLegend(IFigure figure, GridDimensions dims, FacetOptions options) {
        List<LegendItem> items = legendItems(figure);
        Optional<LegendOptions> requested = options.legend();
        if (items.isEmpty()) {
            if (requested.isPresent()) {
                LOG.warn("Legend requested but no labeled plots found");
            }
            return false;
        }
        LegendOptions legend = requested.orElse(LegendOptions.defaults());
        int firstRow = legend.firstRow() != null ? legend.firstRow() : 1;
        int lastRow = legend.lastRow() != null ? legend.lastRow() : Math.max(1, dims.maxRow());
        int col = legend.col() != null ? legend.col() : dims.maxCol() + 1;
        figure.addLegend(new LegendSpec(legend.title(), items, firstRow, lastRow, col));
        return true;
    }

    /**
     * One item per distinct non-blank label, the first plot carrying a label decides its look.
     */
    static List<LegendItem> legendItems(IFigure figure) {
        Map<String, LegendItem> items = new LinkedHashMap<>();
        for (IFacetCell cell : figure.cells()) {
            for (IAxis axis : cell.axes()) {
                List<PlotElement> plots = axis.plots();
                for (int i = 0; i < plots.size(); i++) {
                    PlotElement plot = plots.get(i);
                    if (plot.hasLabel()) {
                        items.putIfAbsent(plot.label(), new LegendItem(plot.label(), plot.kind(), i));
                    }
                }
            }
        }
        return new ArrayList<>(items.values());
    }
}
