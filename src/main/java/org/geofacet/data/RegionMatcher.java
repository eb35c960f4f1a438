package org.geofacet.data;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Matches grid region codes against the groups of a partitioned table.
 * <p>
 * Region codes in user data come in any case while grid codes are canonical, so all
 * matching is case-insensitive. Nothing here copies or mutates the caller's table.
 */
public final class RegionMatcher {

    private RegionMatcher() {
        // Private constructor to prevent instantiation
    }

    /**
     * Returns the upper-cased keys of all groups. Compute once per facet call and reuse
     * it for {@link #hasData(Set, String)}.
     */
    public static Set<String> availableRegions(GroupedTable grouped) {
        Set<String> available = new LinkedHashSet<>();
        for (String key : grouped.keys()) {
            available.add(normalize(key));
        }
        return available;
    }

    public static boolean hasData(Set<String> availableRegions, String region) {
        return region != null && availableRegions.contains(normalize(region));
    }

    /**
     * Returns the rows of {@code region}, matching the group key case-insensitively.
     */
    public static Optional<DataTable> dataFor(GroupedTable grouped, String region) {
        if (region == null) {
            return Optional.empty();
        }
        String wanted = normalize(region);
        for (Map.Entry<String, DataTable> group : grouped.groups().entrySet()) {
            if (normalize(group.getKey()).equals(wanted)) {
                return Optional.of(group.getValue());
            }
        }
        return Optional.empty();
    }

    public static String normalize(String region) {
        return region.toUpperCase(Locale.ROOT);
    }
}
