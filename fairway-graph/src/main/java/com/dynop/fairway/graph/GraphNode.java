package com.dynop.fairway.graph;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Junction of a fairway graph: a stable id plus an open-ended, ordered attribute map.
 *
 * <p>Typed accessors exist only for the attributes the pipeline branches on; all other
 * source columns are reached through {@link #getAttributes()}.
 */
public final class GraphNode {

    private static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory();

    private final String id;
    private final Map<String, Object> attributes = new LinkedHashMap<>();

    GraphNode(String id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    public String getId() {
        return id;
    }

    /**
     * @return Mutable attribute map owned by this node
     */
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public Object get(String key) {
        return attributes.get(key);
    }

    public GraphNode set(String key, Object value) {
        attributes.put(key, value);
        return this;
    }

    /**
     * @return Country code attribute, or null
     */
    public String getCountryCode() {
        Object value = attributes.get(Attributes.COUNTRY_CODE);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    public String getDataSource() {
        Object value = attributes.get(Attributes.DATA_SOURCE);
        return value != null ? value.toString() : null;
    }

    /**
     * Location of the node.
     *
     * <p>Looks at {@code geometry}, then the legacy {@code Geometry} column, then numeric
     * {@code x}/{@code y} attributes.
     *
     * @return Point in the graph's CRS, or null when the node has no usable location
     */
    public Point getPoint() {
        Object geometry = attributes.get(Attributes.GEOMETRY);
        if (geometry instanceof Point && !((Point) geometry).isEmpty()) {
            return (Point) geometry;
        }
        Object legacy = attributes.get(Attributes.LEGACY_GEOMETRY);
        if (legacy instanceof Point && !((Point) legacy).isEmpty()) {
            return (Point) legacy;
        }
        Object x = attributes.get(Attributes.X);
        Object y = attributes.get(Attributes.Y);
        if (x instanceof Number && y instanceof Number) {
            return GEOMETRY_FACTORY.createPoint(new Coordinate(((Number) x).doubleValue(), ((Number) y).doubleValue()));
        }
        return null;
    }

    /**
     * @return Connected-component index, or -1 when not yet assigned
     */
    public int getComponent() {
        Object value = attributes.get(Attributes.SUBGRAPH);
        return value instanceof Number ? ((Number) value).intValue() : -1;
    }

    @Override
    public String toString() {
        return String.format("GraphNode{id='%s', attributes=%d}", id, attributes.size());
    }
}
