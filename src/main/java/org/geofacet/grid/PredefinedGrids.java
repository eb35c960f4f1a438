package org.geofacet.grid;

import com.typesafe.config.Config;
import org.geofacet.config.GeoFacetConfig;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry of the grid layouts bundled on the classpath under {@code grids/<name>.csv}.
 * <p>
 * Grids are loaded on first use and cached. A grid that fails to load is reported to
 * the caller through {@link GridLoadException}; nothing is substituted in its place.
 * The list of bundled names comes from {@code geofacet.grids.available}.
 */
public final class PredefinedGrids {

    private static final String RESOURCE_DIRECTORY = "grids/";

    private static volatile PredefinedGrids shared;

    private final List<String> available;
    private final Map<String, GeoGrid> cache = new HashMap<>();

    public PredefinedGrids(Config config) {
        this.available = List.copyOf(config.getStringList(GeoFacetConfig.ROOT_PATH + ".grids.available"));
    }

    /**
     * Returns the process-wide registry, configured from {@link GeoFacetConfig#load()} on first access.
     */
    public static PredefinedGrids shared() {
        PredefinedGrids instance = shared;
        if (instance == null) {
            synchronized (PredefinedGrids.class) {
                instance = shared;
                if (instance == null) {
                    instance = new PredefinedGrids(GeoFacetConfig.load());
                    shared = instance;
                }
            }
        }
        return instance;
    }

    public List<String> available() {
        return available;
    }

    public int count() {
        return available.size();
    }

    /**
     * Returns a bundled grid by name.
     *
     * @param name grid name without the {@code .csv} extension, e.g. {@code us_state_grid1}
     * @return the cached grid
     * @throws GridLoadException if the name is unknown or the resource cannot be loaded
     */
    public synchronized GeoGrid get(String name) throws GridLoadException {
        GeoGrid grid = cache.get(name);
        if (grid != null) {
            return grid;
        }
        if (!available.contains(name)) {
            throw new GridLoadException("Unknown predefined grid '" + name + "'. Available grids: "
                    + String.join(", ", available));
        }
        grid = GridLoader.loadResource(RESOURCE_DIRECTORY + name + ".csv");
        cache.put(name, grid);
        return grid;
    }

    /**
     * US states plus DC.
     *
     * @param version layout variant, 1 or 2
     */
    public GeoGrid usStateGrid(int version) throws GridLoadException {
        if (version != 1 && version != 2) {
            throw new IllegalArgumentException("US state grid version must be 1 or 2, got " + version);
        }
        return get("us_state_grid" + version);
    }

    public GeoGrid usStateGridWithoutDc() throws GridLoadException {
        return get("us_state_without_DC_grid1");
    }

    /** The 48 contiguous states plus DC. */
    public GeoGrid usContiguousGrid() throws GridLoadException {
        return get("us_state_contiguous_grid1");
    }
}
