package org.geofacet.grid;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One region placed on a geographic grid.
 * <p>
 * Entries are immutable. The display name falls back to the region code when it is
 * not supplied or blank; metadata holds any auxiliary attributes (for example extra
 * columns of a grid CSV file) and is empty by default.
 */
public final class GridEntry {

    private final String region;
    private final int row;
    private final int col;
    private final String name;
    private final Map<String, Object> metadata;

    public GridEntry(String region, int row, int col) {
        this(region, row, col, null, null);
    }

    public GridEntry(String region, int row, int col, String name) {
        this(region, row, col, name, null);
    }

    /**
     * Creates a fully specified entry.
     *
     * @param region   region code, must not be blank
     * @param row      1-based row
     * @param col      1-based column
     * @param name     display name, {@code null} or blank to reuse the region code
     * @param metadata extra attributes, may be {@code null}
     * @throws GridValidationException if the region is blank or a coordinate is below 1
     */
    public GridEntry(String region, int row, int col, String name, Map<String, Object> metadata) {
        if (region == null || region.isBlank()) {
            throw GridValidationException.invalidEntity(region);
        }
        if (row <= 0 || col <= 0) {
            throw GridValidationException.invalidPosition(region, row, col);
        }
        this.region = region;
        this.row = row;
        this.col = col;
        this.name = (name == null || name.isBlank()) ? region : name;
        this.metadata = (metadata == null || metadata.isEmpty())
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public String region() {
        return region;
    }

    public int row() {
        return row;
    }

    public int col() {
        return col;
    }

    public String name() {
        return name;
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    public GridPosition position() {
        return new GridPosition(row, col);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GridEntry other)) return false;
        return row == other.row
                && col == other.col
                && region.equals(other.region)
                && name.equals(other.name)
                && metadata.equals(other.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(region, row, col, name, metadata);
    }

    @Override
    public String toString() {
        return "GridEntry{" + region + " at (" + row + ", " + col + ")"
                + (name.equals(region) ? "" : ", name='" + name + "'") + "}";
    }
}
