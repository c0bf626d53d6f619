package com.dynop.fairway.table;

import org.locationtech.jts.geom.Geometry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One row of a source export: an ordered set of named columns plus an optional geometry.
 *
 * <p>Column values keep the types they were read with (String, Long, Double, Boolean) and may
 * be {@code null}. Records are immutable; use {@link #withProperty(String, Object)} to derive
 * a modified copy.
 *
 * @see FeatureTable
 */
public final class FeatureRecord {

    private final Map<String, Object> properties;
    private final Geometry geometry;

    /**
     * Creates a record.
     *
     * @param properties Column values in column order (copied, null values allowed)
     * @param geometry   Geometry of the row, may be null
     */
    public FeatureRecord(Map<String, Object> properties, Geometry geometry) {
        Objects.requireNonNull(properties, "properties");
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        this.geometry = geometry;
    }

    /**
     * @return Unmodifiable column map in column order
     */
    public Map<String, Object> getProperties() {
        return properties;
    }

    /**
     * @return Geometry of the row, or null
     */
    public Geometry getGeometry() {
        return geometry;
    }

    public boolean has(String column) {
        return properties.containsKey(column);
    }

    public Object get(String column) {
        return properties.get(column);
    }

    /**
     * @param column Column name
     * @return Value as a trimmed string, or null when absent or blank
     */
    public String getString(String column) {
        Object value = properties.get(column);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    /**
     * @param column Column name
     * @return Value as a double, or null when absent, blank or not numeric
     */
    public Double getDouble(String column) {
        Object value = properties.get(column);
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            return Double.isNaN(d) ? null : d;
        }
        String text = getString(column);
        if (text == null) {
            return null;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * @param column Column name
     * @return Value normalised as an identifier, see {@link Identifiers#normalize(Object)}
     */
    public String getId(String column) {
        return Identifiers.normalize(properties.get(column));
    }

    /**
     * Returns a copy with one column set (appended when new).
     */
    public FeatureRecord withProperty(String column, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(properties);
        copy.put(column, value);
        return new FeatureRecord(copy, geometry);
    }

    @Override
    public String toString() {
        return String.format("FeatureRecord{properties=%s, geometry=%s}",
                properties, geometry != null ? geometry.getGeometryType() : "none");
    }
}
