package org.geofacet.data;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The result of {@link DataTable#groupBy(String)}: one sub-table per distinct key,
 * in first-seen order.
 */
public final class GroupedTable {

    private final String column;
    private final Map<String, DataTable> groups;

    GroupedTable(String column, Map<String, DataTable> groups) {
        this.column = column;
        this.groups = Collections.unmodifiableMap(groups);
    }

    /** The column the rows were grouped by. */
    public String column() {
        return column;
    }

    public Set<String> keys() {
        return groups.keySet();
    }

    public Optional<DataTable> group(String key) {
        return Optional.ofNullable(groups.get(key));
    }

    public Map<String, DataTable> groups() {
        return groups;
    }

    public int size() {
        return groups.size();
    }
}
