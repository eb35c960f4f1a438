package org.geofacet.facet;

import org.geofacet.render.IFigure;

import java.util.List;

/**
 * Outcome of a {@link GeoFacet#plot} call: the populated figure and per-region bookkeeping.
 */
public final class FacetResult {

    private final IFigure figure;
    private final List<String> renderedRegions;
    private final List<String> placeholderRegions;
    private final List<String> skippedRegions;
    private final List<RenderFailure> failures;
    private final List<String> extraRegions;
    private final boolean legendCreated;

    FacetResult(IFigure figure, List<String> renderedRegions, List<String> placeholderRegions,
                List<String> skippedRegions, List<RenderFailure> failures, List<String> extraRegions,
                boolean legendCreated) {
        this.figure = figure;
        this.renderedRegions = List.copyOf(renderedRegions);
        this.placeholderRegions = List.copyOf(placeholderRegions);
        this.skippedRegions = List.copyOf(skippedRegions);
        this.failures = List.copyOf(failures);
        this.extraRegions = List.copyOf(extraRegions);
        this.legendCreated = legendCreated;
    }

    public IFigure figure() {
        return figure;
    }

    /**
     * Regions whose plot callback completed, in grid order.
     */
    public List<String> renderedRegions() {
        return renderedRegions;
    }

    public List<String> placeholderRegions() {
        return placeholderRegions;
    }

    public List<String> skippedRegions() {
        return skippedRegions;
    }

    public List<RenderFailure> failures() {
        return failures;
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /**
     * Data regions not present in the grid, in the data's spelling. Only non-empty under the
     * {@link ExtraRegionPolicy#WARN} policy.
     */
    public List<String> extraRegions() {
        return extraRegions;
    }

    public boolean legendCreated() {
        return legendCreated;
    }

    @Override
    public String toString() {
        return String.format("FacetResult{rendered=%d, placeholders=%d, skipped=%d, failures=%d, extra=%d, legend=%s}",
                renderedRegions.size(), placeholderRegions.size(), skippedRegions.size(), failures.size(),
                extraRegions.size(), legendCreated);
    }
}
