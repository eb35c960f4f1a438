package org.geofacet.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A small immutable row-oriented table: ordered column names and rows keyed by column.
 * <p>
 * This is the tabular input of a facet plot. It only offers what faceting needs:
 * column access, numeric extraction for plotting and a grouping operation that
 * partitions rows by the value of one column without copying them.
 */
public final class DataTable {

    private final List<String> columns;
    private final List<Map<String, Object>> rows;

    private DataTable(List<String> columns, List<Map<String, Object>> rows) {
        this.columns = columns;
        this.rows = rows;
    }

    public static Builder builder(String... columns) {
        return new Builder(List.of(columns));
    }

    /**
     * Creates a table from column vectors. All columns must have the same length.
     *
     * @param columns column name to values, in column order
     * @return the table
     * @throws IllegalArgumentException if the columns differ in length
     */
    public static DataTable fromColumns(Map<String, ? extends List<?>> columns) {
        Builder builder = new Builder(new ArrayList<>(columns.keySet()));
        int length = -1;
        for (Map.Entry<String, ? extends List<?>> e : columns.entrySet()) {
            if (length >= 0 && e.getValue().size() != length) {
                throw new IllegalArgumentException("Column '" + e.getKey() + "' has " + e.getValue().size()
                        + " values, expected " + length);
            }
            length = e.getValue().size();
        }
        for (int i = 0; i < Math.max(length, 0); i++) {
            Object[] values = new Object[columns.size()];
            int c = 0;
            for (List<?> column : columns.values()) {
                values[c++] = column.get(i);
            }
            builder.addRow(values);
        }
        return builder.build();
    }

    public static DataTable empty() {
        return new DataTable(List.of(), List.of());
    }

    public List<String> columns() {
        return columns;
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public int rowCount() {
        return rows.size();
    }

    /**
     * A table is empty when it has no rows or no columns.
     */
    public boolean isEmpty() {
        return rows.isEmpty() || columns.isEmpty();
    }

    public List<Map<String, Object>> rows() {
        return rows;
    }

    public Object value(int row, String column) {
        requireColumn(column);
        return rows.get(row).get(column);
    }

    public List<Object> column(String column) {
        requireColumn(column);
        List<Object> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            values.add(row.get(column));
        }
        return Collections.unmodifiableList(values);
    }

    /**
     * Extracts a column as doubles. {@code null} cells become {@code NaN}.
     *
     * @throws IllegalArgumentException if the column is missing or holds a non-numeric value
     */
    public double[] doubles(String column) {
        requireColumn(column);
        double[] values = new double[rows.size()];
        for (int i = 0; i < values.length; i++) {
            Object value = rows.get(i).get(column);
            if (value == null) {
                values[i] = Double.NaN;
            } else if (value instanceof Number n) {
                values[i] = n.doubleValue();
            } else {
                throw new IllegalArgumentException("Column '" + column + "' row " + i
                        + " is not numeric: " + value);
            }
        }
        return values;
    }

    public List<String> strings(String column) {
        return column(column).stream().map(v -> v == null ? null : v.toString()).toList();
    }

    /**
     * Partitions the rows by the string form of {@code column}. Groups appear in the
     * order their key is first seen; a {@code null} cell is grouped under {@code ""}.
     * The groups share row objects with this table.
     *
     * @throws IllegalArgumentException if the column is missing
     */
    public GroupedTable groupBy(String column) {
        requireColumn(column);
        Map<String, List<Map<String, Object>>> groups = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            Object value = row.get(column);
            String key = value == null ? "" : value.toString();
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
        }
        Map<String, DataTable> tables = new LinkedHashMap<>();
        groups.forEach((key, groupRows) ->
                tables.put(key, new DataTable(columns, Collections.unmodifiableList(groupRows))));
        return new GroupedTable(column, tables);
    }

    private void requireColumn(String column) {
        if (!columns.contains(column)) {
            throw new IllegalArgumentException("Column " + column + " not found in data");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DataTable other)) return false;
        return columns.equals(other.columns) && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, rows);
    }

    @Override
    public String toString() {
        return "DataTable{columns=" + columns + ", rows=" + rows.size() + "}";
    }

    /**
     * Accumulates rows positionally against a fixed column list.
     */
    public static final class Builder {
        private final List<String> columns;
        private final List<Map<String, Object>> rows = new ArrayList<>();

        private Builder(List<String> columns) {
            if (columns.size() != columns.stream().distinct().count()) {
                throw new IllegalArgumentException("Duplicate column names: " + columns);
            }
            this.columns = List.copyOf(columns);
        }

        public Builder addRow(Object... values) {
            if (values.length != columns.size()) {
                throw new IllegalArgumentException("Expected " + columns.size() + " values but got " + values.length);
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < values.length; i++) {
                row.put(columns.get(i), values[i]);
            }
            rows.add(Collections.unmodifiableMap(row));
            return this;
        }

        public DataTable build() {
            return new DataTable(columns, List.copyOf(rows));
        }
    }
}
