package org.geofacet.grid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * An immutable geographic grid layout: an ordered list of {@link GridEntry} values
 * addressable by region code and by cell position.
 * <p>
 * Every factory funnels through the same validation routine, so a constructed grid
 * always satisfies these invariants:
 * <ul>
 *   <li>every region code is non-blank,</li>
 *   <li>every row and column is at least 1,</li>
 *   <li>no region code appears twice,</li>
 *   <li>no two entries share a (row, col) position.</li>
 * </ul>
 * Derived grids, such as the data-only subset used for neighbour detection, are
 * fresh instances created by {@link #filter(Predicate)}; entries are never removed
 * in place.
 * <p>
 * Neighbour queries use existential semantics: {@link #hasNeighborBelow(String)} is
 * true when <em>any</em> entry in the same column has a larger row, not only the
 * cell directly underneath. On sparse grids this keeps a gap from re-exposing axis
 * decorations that a facet further down would otherwise duplicate.
 * <p>
 * <strong>Thread Safety:</strong> instances are immutable and safe to share.
 */
public final class GeoGrid implements Iterable<GridEntry> {

    private static final GeoGrid EMPTY = new GeoGrid("", List.of());

    private final String name;
    private final List<GridEntry> entries;
    private final Map<String, GridEntry> byRegion;
    private final Map<GridPosition, GridEntry> byPosition;
    private final GridDimensions dimensions;

    private GeoGrid(String name, List<GridEntry> entries) {
        this.name = name == null ? "" : name;
        this.entries = List.copyOf(entries);
        this.byRegion = indexRegions(this.entries);
        this.byPosition = indexPositions(this.entries);

        int maxRow = 0;
        int maxCol = 0;
        for (GridEntry entry : this.entries) {
            maxRow = Math.max(maxRow, entry.row());
            maxCol = Math.max(maxCol, entry.col());
        }
        this.dimensions = this.entries.isEmpty() ? GridDimensions.EMPTY : new GridDimensions(maxRow, maxCol);
    }

    // ---------- Factories ----------

    public static GeoGrid empty() {
        return EMPTY;
    }

    /**
     * Builds a grid from a region to position mapping. The iteration order of the map
     * becomes the grid order, so pass a {@link LinkedHashMap} when order matters.
     *
     * @param name      grid name, may be empty
     * @param positions region code to position
     * @return the validated grid
     * @throws GridValidationException on an invalid region, position or a position conflict
     */
    public static GeoGrid fromPositions(String name, Map<String, GridPosition> positions) {
        List<GridEntry> entries = new ArrayList<>(positions.size());
        for (Map.Entry<String, GridPosition> e : positions.entrySet()) {
            GridPosition pos = e.getValue();
            entries.add(new GridEntry(e.getKey(), pos.row(), pos.col()));
        }
        return fromEntries(name, entries);
    }

    public static GeoGrid fromColumns(List<String> regions, List<Integer> rows, List<Integer> cols) {
        return fromColumns(regions, rows, cols, null, null);
    }

    public static GeoGrid fromColumns(List<String> regions, List<Integer> rows, List<Integer> cols,
                                      List<String> names) {
        return fromColumns(regions, rows, cols, names, null);
    }

    /**
     * Builds a grid from parallel columns. {@code names} and {@code metadata} are optional,
     * but when given they must have the same length as the other columns.
     *
     * @throws GridValidationException with reason {@code SHAPE_MISMATCH} on unequal lengths,
     *                                 or any other reason raised by entry validation
     */
    public static GeoGrid fromColumns(List<String> regions, List<Integer> rows, List<Integer> cols,
                                      List<String> names, List<Map<String, Object>> metadata) {
        int n = regions.size();
        if (rows.size() != n || cols.size() != n
                || (names != null && names.size() != n)
                || (metadata != null && metadata.size() != n)) {
            throw GridValidationException.shapeMismatch(String.format(
                    "regions=%d, rows=%d, cols=%d, names=%s, metadata=%s",
                    n, rows.size(), cols.size(),
                    names == null ? "-" : String.valueOf(names.size()),
                    metadata == null ? "-" : String.valueOf(metadata.size())));
        }
        List<GridEntry> entries = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            entries.add(new GridEntry(
                    regions.get(i),
                    rows.get(i),
                    cols.get(i),
                    names == null ? null : names.get(i),
                    metadata == null ? null : metadata.get(i)));
        }
        return fromEntries("", entries);
    }

    /**
     * Builds a grid from already constructed entries, e.g. the output of a loader.
     *
     * @throws GridValidationException if two entries share a position or a region code
     */
    public static GeoGrid fromEntries(String name, List<GridEntry> entries) {
        return new GeoGrid(name, entries);
    }

    private static Map<String, GridEntry> indexRegions(List<GridEntry> entries) {
        Map<String, GridEntry> index = new LinkedHashMap<>();
        for (GridEntry entry : entries) {
            GridEntry existing = index.putIfAbsent(entry.region(), entry);
            if (existing != null) {
                throw GridValidationException.duplicateRegion(entry.region(), existing.position(), entry.position());
            }
        }
        return Collections.unmodifiableMap(index);
    }

    private static Map<GridPosition, GridEntry> indexPositions(List<GridEntry> entries) {
        Map<GridPosition, GridEntry> index = new HashMap<>();
        for (GridEntry entry : entries) {
            GridEntry existing = index.putIfAbsent(entry.position(), entry);
            if (existing != null) {
                throw GridValidationException.positionConflict(existing.region(), entry.region(), entry.position());
            }
        }
        return Collections.unmodifiableMap(index);
    }

    // ---------- Queries ----------

    public String name() {
        return name;
    }

    public List<GridEntry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public GridDimensions dimensions() {
        return dimensions;
    }

    public List<String> regions() {
        return entries.stream().map(GridEntry::region).toList();
    }

    public boolean hasRegion(String region) {
        return region != null && byRegion.containsKey(region);
    }

    public Optional<GridEntry> entry(String region) {
        return region == null ? Optional.empty() : Optional.ofNullable(byRegion.get(region));
    }

    public Optional<GridPosition> positionOf(String region) {
        return entry(region).map(GridEntry::position);
    }

    public Optional<String> regionAt(int row, int col) {
        return Optional.ofNullable(byPosition.get(new GridPosition(row, col))).map(GridEntry::region);
    }

    /**
     * Returns true when the grid fills every cell of its bounding rectangle.
     * The empty grid is trivially complete.
     */
    public boolean isCompleteRectangle() {
        return entries.isEmpty() || entries.size() == dimensions.cellCount();
    }

    /**
     * Re-runs the structural checks on this grid.
     *
     * @return always {@code true}
     * @throws GridValidationException if an invariant is violated
     */
    public boolean validate() {
        for (GridEntry entry : entries) {
            if (entry.region().isBlank()) {
                throw GridValidationException.invalidEntity(entry.region());
            }
            if (entry.row() <= 0 || entry.col() <= 0) {
                throw GridValidationException.invalidPosition(entry.region(), entry.row(), entry.col());
            }
        }
        indexRegions(entries);
        indexPositions(entries);
        return true;
    }

    public boolean hasNeighborAbove(String region) {
        return positionOf(region)
                .map(p -> anyMatch(e -> e.col() == p.col() && e.row() < p.row()))
                .orElse(false);
    }

    public boolean hasNeighborBelow(String region) {
        return positionOf(region)
                .map(p -> anyMatch(e -> e.col() == p.col() && e.row() > p.row()))
                .orElse(false);
    }

    public boolean hasNeighborLeft(String region) {
        return positionOf(region)
                .map(p -> anyMatch(e -> e.row() == p.row() && e.col() < p.col()))
                .orElse(false);
    }

    public boolean hasNeighborRight(String region) {
        return positionOf(region)
                .map(p -> anyMatch(e -> e.row() == p.row() && e.col() > p.col()))
                .orElse(false);
    }

    private boolean anyMatch(Predicate<GridEntry> predicate) {
        for (GridEntry entry : entries) {
            if (predicate.test(entry)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns a new grid holding the entries accepted by {@code predicate}, in grid order.
     * This grid is left untouched.
     */
    public GeoGrid filter(Predicate<GridEntry> predicate) {
        List<GridEntry> kept = new ArrayList<>();
        for (GridEntry entry : entries) {
            if (predicate.test(entry)) {
                kept.add(entry);
            }
        }
        return new GeoGrid(name, kept);
    }

    @Override
    public Iterator<GridEntry> iterator() {
        return entries.iterator();
    }

    @Override
    public String toString() {
        return "GeoGrid{name='" + name + "', entries=" + entries.size()
                + ", dimensions=" + dimensions.maxRow() + "x" + dimensions.maxCol() + "}";
    }
}
