package org.geofacet.axis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An immutable, ordered set of axis options (option name to value).
 * <p>
 * Options are layered with {@link #merge(AxisOptions)}, which returns a new instance
 * in which the argument's values win on key collisions. No instance is ever modified
 * after creation, so one configuration can be handed to several consumers safely.
 */
public final class AxisOptions {

    public static final String TITLE = "title";
    public static final String X_LABEL = "xlabel";
    public static final String Y_LABEL = "ylabel";
    public static final String X_TICKS_VISIBLE = "xticksvisible";
    public static final String X_TICK_LABELS_VISIBLE = "xticklabelsvisible";
    public static final String X_LABEL_VISIBLE = "xlabelvisible";
    public static final String Y_TICKS_VISIBLE = "yticksvisible";
    public static final String Y_TICK_LABELS_VISIBLE = "yticklabelsvisible";
    public static final String Y_LABEL_VISIBLE = "ylabelvisible";
    public static final String Y_AXIS_POSITION = "yaxisposition";

    private static final AxisOptions EMPTY = new AxisOptions(Map.of());

    private final Map<String, Object> values;

    private AxisOptions(Map<String, Object> values) {
        this.values = values;
    }

    public static AxisOptions empty() {
        return EMPTY;
    }

    /**
     * Creates options from alternating keys and values, e.g.
     * {@code AxisOptions.of("xlabel", "Year", "ylabel", "GDP")}.
     */
    public static AxisOptions of(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected key/value pairs, got " + keysAndValues.length + " arguments");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            map.put(requireKey(keysAndValues[i]), keysAndValues[i + 1]);
        }
        return fromMap(map);
    }

    public static AxisOptions fromMap(Map<String, ?> map) {
        if (map == null || map.isEmpty()) {
            return EMPTY;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((k, v) -> copy.put(requireKey(k), v));
        return new AxisOptions(Collections.unmodifiableMap(copy));
    }

    private static String requireKey(Object key) {
        if (!(key instanceof String s) || s.isBlank()) {
            throw new IllegalArgumentException("Axis option names must be non-blank strings, got " + key);
        }
        return s;
    }

    /**
     * Returns a new instance holding this instance's options overlaid with {@code other}'s.
     */
    public AxisOptions merge(AxisOptions other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        Map<String, Object> merged = new LinkedHashMap<>(values);
        merged.putAll(other.values);
        return new AxisOptions(Collections.unmodifiableMap(merged));
    }

    public AxisOptions with(String key, Object value) {
        Map<String, Object> map = new LinkedHashMap<>(values);
        map.put(requireKey(key), value);
        return new AxisOptions(Collections.unmodifiableMap(map));
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public Object get(String key) {
        return values.get(key);
    }

    public String getString(String key, String defaultValue) {
        Object value = values.get(key);
        return value == null ? defaultValue : value.toString();
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object value = values.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            return Boolean.parseBoolean(s);
        }
        return defaultValue;
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AxisOptions other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "AxisOptions" + values;
    }
}
