package com.dynop.fairway.graph;

import org.locationtech.jts.geom.Geometry;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Undirected section between two junctions.
 *
 * <p>{@link #getSource()} and {@link #getTarget()} keep the orientation the edge was first
 * inserted with; it carries no meaning for traversal.
 */
public final class GraphEdge {

    private final String source;
    private final String target;
    private final Map<String, Object> attributes = new LinkedHashMap<>();

    GraphEdge(String source, String target) {
        this.source = Objects.requireNonNull(source, "source");
        this.target = Objects.requireNonNull(target, "target");
    }

    public String getSource() {
        return source;
    }

    public String getTarget() {
        return target;
    }

    public EdgeKey getKey() {
        return EdgeKey.of(source, target);
    }

    /**
     * @param nodeId One endpoint
     * @return The other endpoint
     */
    public String opposite(String nodeId) {
        return source.equals(nodeId) ? target : source;
    }

    /**
     * @return Mutable attribute map owned by this edge
     */
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public Object get(String key) {
        return attributes.get(key);
    }

    public GraphEdge set(String key, Object value) {
        attributes.put(key, value);
        return this;
    }

    /**
     * @return Polyline of the section, or null
     */
    public Geometry getGeometry() {
        Object value = attributes.get(Attributes.GEOMETRY);
        return value instanceof Geometry ? (Geometry) value : null;
    }

    public String getDataSource() {
        Object value = attributes.get(Attributes.DATA_SOURCE);
        return value != null ? value.toString() : null;
    }

    public boolean isBorder() {
        return Boolean.TRUE.equals(attributes.get(Attributes.IS_BORDER));
    }

    /**
     * @return Geodesic length in metres, or NaN when not computed
     */
    public double getLengthMeters() {
        Object value = attributes.get(Attributes.LENGTH_M);
        return value instanceof Number ? ((Number) value).doubleValue() : Double.NaN;
    }

    public int getComponent() {
        Object value = attributes.get(Attributes.SUBGRAPH);
        return value instanceof Number ? ((Number) value).intValue() : -1;
    }

    @Override
    public String toString() {
        return String.format("GraphEdge{%s <-> %s, attributes=%d}", source, target, attributes.size());
    }
}
