package org.geofacet.facet;

import com.typesafe.config.Config;
import org.geofacet.axis.AxisOptions;
import org.geofacet.axis.LinkMode;
import org.geofacet.config.GeoFacetConfig;
import org.geofacet.grid.GeoGrid;
import org.geofacet.render.IFigureFactory;
import org.geofacet.render.image.ImageFigureFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable options of one {@link GeoFacet#plot} call.
 * <p>
 * Defaults come from the {@code geofacet} section of the configuration; see {@code reference.conf}.
 * Enumerated options are parsed when they are set, so an invalid value fails before any
 * rendering starts.
 */
public final class FacetOptions {

    private static final String DEFAULT_GRID_KEY = "default-grid";
    private static final String LINK_AXES_KEY = "link-axes";
    private static final String MISSING_REGIONS_KEY = "missing-regions";
    private static final String EXTRA_REGIONS_KEY = "extra-regions";
    private static final String HIDE_INNER_KEY = "hide-inner-decorations";
    private static final String CELL_WIDTH_KEY = "figure.cell-width";
    private static final String CELL_HEIGHT_KEY = "figure.cell-height";
    private static final String LEGEND_WIDTH_KEY = "figure.legend-width";
    private static final String TITLE_HEIGHT_KEY = "figure.title-height";

    private final GeoGrid grid;
    private final String defaultGridName;
    private final LinkMode linkMode;
    private final MissingRegionPolicy missingRegions;
    private final ExtraRegionPolicy extraRegions;
    private final boolean hideInnerDecorations;
    private final AxisOptions commonAxisOptions;
    private final List<AxisOptions> axisOptionsList;
    private final LegendOptions legend;
    private final String title;
    private final Integer figureWidth;
    private final Integer figureHeight;
    private final int cellWidth;
    private final int cellHeight;
    private final int legendWidth;
    private final int titleHeight;
    private final Map<String, Object> extraArgs;
    private final IFigureFactory figureFactory;

    private FacetOptions(Builder b) {
        this.grid = b.grid;
        this.defaultGridName = b.defaultGridName;
        this.linkMode = b.linkMode;
        this.missingRegions = b.missingRegions;
        this.extraRegions = b.extraRegions;
        this.hideInnerDecorations = b.hideInnerDecorations;
        this.commonAxisOptions = b.commonAxisOptions;
        this.axisOptionsList = List.copyOf(b.axisOptionsList);
        this.legend = b.legend;
        this.title = b.title;
        this.figureWidth = b.figureWidth;
        this.figureHeight = b.figureHeight;
        this.cellWidth = b.cellWidth;
        this.cellHeight = b.cellHeight;
        this.legendWidth = b.legendWidth;
        this.titleHeight = b.titleHeight;
        this.extraArgs = Collections.unmodifiableMap(new LinkedHashMap<>(b.extraArgs));
        this.figureFactory = b.figureFactory;
    }

    /**
     * Options built from the layered default configuration.
     */
    public static FacetOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder(GeoFacetConfig.load());
    }

    /**
     * Starts a builder whose defaults are read from {@code config}, which must contain a complete
     * {@code geofacet} section.
     */
    public static Builder builder(Config config) {
        return new Builder(config);
    }

    /**
     * The grid given explicitly, or empty when {@link #defaultGridName()} should be used.
     */
    public Optional<GeoGrid> grid() {
        return Optional.ofNullable(grid);
    }

    public String defaultGridName() {
        return defaultGridName;
    }

    public LinkMode linkMode() {
        return linkMode;
    }

    public MissingRegionPolicy missingRegions() {
        return missingRegions;
    }

    public ExtraRegionPolicy extraRegions() {
        return extraRegions;
    }

    public boolean hideInnerDecorations() {
        return hideInnerDecorations;
    }

    public AxisOptions commonAxisOptions() {
        return commonAxisOptions;
    }

    public List<AxisOptions> axisOptionsList() {
        return axisOptionsList;
    }

    /**
     * The explicitly requested legend, or empty when none was requested.
     */
    public Optional<LegendOptions> legend() {
        return Optional.ofNullable(legend);
    }

    public Optional<String> title() {
        return Optional.ofNullable(title).filter(t -> !t.isBlank());
    }

    /**
     * Pixel width of the grid area, derived from the grid when not set.
     */
    public int figureWidth(int gridCols) {
        return figureWidth != null ? figureWidth : Math.max(1, gridCols * cellWidth);
    }

    public int figureHeight(int gridRows) {
        return figureHeight != null ? figureHeight : Math.max(1, gridRows * cellHeight);
    }

    public int legendWidth() {
        return legendWidth;
    }

    public int titleHeight() {
        return titleHeight;
    }

    public Map<String, Object> extraArgs() {
        return extraArgs;
    }

    public IFigureFactory figureFactory() {
        return figureFactory;
    }

    /**
     * A builder pre-populated from this instance.
     */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.grid = grid;
        b.defaultGridName = defaultGridName;
        b.linkMode = linkMode;
        b.missingRegions = missingRegions;
        b.extraRegions = extraRegions;
        b.hideInnerDecorations = hideInnerDecorations;
        b.commonAxisOptions = commonAxisOptions;
        b.axisOptionsList = axisOptionsList;
        b.legend = legend;
        b.title = title;
        b.figureWidth = figureWidth;
        b.figureHeight = figureHeight;
        b.cellWidth = cellWidth;
        b.cellHeight = cellHeight;
        b.legendWidth = legendWidth;
        b.titleHeight = titleHeight;
        b.extraArgs = new LinkedHashMap<>(extraArgs);
        b.figureFactory = figureFactory;
        return b;
    }

    @Override
    public String toString() {
        return "FacetOptions{grid=" + (grid != null ? grid.name() : defaultGridName)
                + ", linkMode=" + linkMode
                + ", missingRegions=" + missingRegions
                + ", extraRegions=" + extraRegions
                + ", hideInnerDecorations=" + hideInnerDecorations
                + ", axes=" + Math.max(1, axisOptionsList.size()) + "}";
    }

    /**
     * Fluent builder for {@link FacetOptions}.
     */
    public static final class Builder {
        private GeoGrid grid;
        private String defaultGridName;
        private LinkMode linkMode = LinkMode.NONE;
        private MissingRegionPolicy missingRegions = MissingRegionPolicy.SKIP;
        private ExtraRegionPolicy extraRegions = ExtraRegionPolicy.ERROR;
        private boolean hideInnerDecorations = true;
        private AxisOptions commonAxisOptions = AxisOptions.empty();
        private List<AxisOptions> axisOptionsList = List.of();
        private LegendOptions legend;
        private String title;
        private Integer figureWidth;
        private Integer figureHeight;
        private int cellWidth;
        private int cellHeight;
        private int legendWidth;
        private int titleHeight;
        private Map<String, Object> extraArgs = new LinkedHashMap<>();
        private IFigureFactory figureFactory = new ImageFigureFactory();

        private Builder() {
        }

        private Builder(Config config) {
            Config section = config.getConfig(GeoFacetConfig.ROOT_PATH);
            this.defaultGridName = section.getString(DEFAULT_GRID_KEY);
            this.linkMode = LinkMode.parse(section.getString(LINK_AXES_KEY));
            this.missingRegions = MissingRegionPolicy.parse(section.getString(MISSING_REGIONS_KEY));
            this.extraRegions = ExtraRegionPolicy.parse(section.getString(EXTRA_REGIONS_KEY));
            this.hideInnerDecorations = section.getBoolean(HIDE_INNER_KEY);
            this.cellWidth = section.getInt(CELL_WIDTH_KEY);
            this.cellHeight = section.getInt(CELL_HEIGHT_KEY);
            this.legendWidth = section.getInt(LEGEND_WIDTH_KEY);
            this.titleHeight = section.getInt(TITLE_HEIGHT_KEY);
        }

        public Builder withGrid(GeoGrid grid) {
            this.grid = grid;
            return this;
        }

        /**
         * Uses a bundled grid by name instead of an explicit one.
         */
        public Builder withGrid(String predefinedGridName) {
            this.grid = null;
            this.defaultGridName = Objects.requireNonNull(predefinedGridName, "predefinedGridName");
            return this;
        }

        public Builder withLinkAxes(LinkMode linkMode) {
            this.linkMode = Objects.requireNonNull(linkMode, "linkMode");
            return this;
        }

        public Builder withLinkAxes(String linkMode) {
            this.linkMode = LinkMode.parse(linkMode);
            return this;
        }

        public Builder withMissingRegions(MissingRegionPolicy policy) {
            this.missingRegions = Objects.requireNonNull(policy, "policy");
            return this;
        }

        public Builder withMissingRegions(String policy) {
            this.missingRegions = MissingRegionPolicy.parse(policy);
            return this;
        }

        public Builder withExtraRegions(ExtraRegionPolicy policy) {
            this.extraRegions = Objects.requireNonNull(policy, "policy");
            return this;
        }

        public Builder withExtraRegions(String policy) {
            this.extraRegions = ExtraRegionPolicy.parse(policy);
            return this;
        }

        public Builder withHideInnerDecorations(boolean hide) {
            this.hideInnerDecorations = hide;
            return this;
        }

        /**
         * Options applied to every axis of every cell, overridden by the per-axis list.
         */
        public Builder withCommonAxisOptions(AxisOptions options) {
            this.commonAxisOptions = options == null ? AxisOptions.empty() : options;
            return this;
        }

        /**
         * One entry per axis of each cell. Its length fixes the number of axes per cell.
         */
        public Builder withAxisOptionsList(List<AxisOptions> options) {
            this.axisOptionsList = options == null ? List.of() : List.copyOf(options);
            return this;
        }

        public Builder withLegend(LegendOptions legend) {
            this.legend = legend;
            return this;
        }

        public Builder withTitle(String title) {
            this.title = title;
            return this;
        }

        /**
         * Fixes the pixel size of the grid area instead of deriving it from the grid.
         */
        public Builder withFigureSize(int width, int height) {
            if (width < 1 || height < 1) {
                throw new IllegalArgumentException("Figure size must be positive, got " + width + "x" + height);
            }
            this.figureWidth = width;
            this.figureHeight = height;
            return this;
        }

        public Builder withExtraArg(String key, Object value) {
            this.extraArgs.put(key, value);
            return this;
        }

        public Builder withExtraArgs(Map<String, ?> args) {
            this.extraArgs = new LinkedHashMap<>(args);
            return this;
        }

        public Builder withFigureFactory(IFigureFactory factory) {
            this.figureFactory = Objects.requireNonNull(factory, "factory");
            return this;
        }

        public FacetOptions build() {
            return new FacetOptions(this);
        }
    }
}
