package com.dynop.fairway.graph;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Undirected attributed graph of a waterway network.
 *
 * <p>Nodes are keyed by string id, edges by the unordered pair of their endpoints, so at
 * most one edge exists between two nodes. Adding an edge that already exists merges the new
 * attributes into it (later values win). Adding an edge creates missing endpoint nodes
 * without attributes.
 *
 * <p>Iteration order of nodes and edges is insertion order. A graph is owned by one pipeline
 * stage at a time and is not thread safe.
 */
public final class FairwayGraph {

    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private final Map<EdgeKey, GraphEdge> edges = new LinkedHashMap<>();
    private final Map<String, Set<String>> adjacency = new LinkedHashMap<>();

    /**
     * Returns the node with the given id, creating it when absent.
     */
    public GraphNode addNode(String id) {
        GraphNode node = nodes.get(id);
        if (node == null) {
            node = new GraphNode(id);
            nodes.put(id, node);
            adjacency.put(id, new LinkedHashSet<>());
        }
        return node;
    }

    /**
     * Returns the node with the given id, creating it when absent, and merges attributes.
     */
    public GraphNode addNode(String id, Map<String, Object> attributes) {
        GraphNode node = addNode(id);
        node.getAttributes().putAll(attributes);
        return node;
    }

    /**
     * Returns the edge between {@code u} and {@code v}, creating it (and its endpoints) when
     * absent.
     */
    public GraphEdge addEdge(String u, String v) {
        Objects.requireNonNull(u, "u");
        Objects.requireNonNull(v, "v");
        EdgeKey key = EdgeKey.of(u, v);
        GraphEdge edge = edges.get(key);
        if (edge == null) {
            addNode(u);
            addNode(v);
            edge = new GraphEdge(u, v);
            edges.put(key, edge);
            adjacency.get(u).add(v);
            adjacency.get(v).add(u);
        }
        return edge;
    }

    /**
     * Returns the edge between {@code u} and {@code v}, creating it when absent, and merges
     * attributes.
     */
    public GraphEdge addEdge(String u, String v, Map<String, Object> attributes) {
        GraphEdge edge = addEdge(u, v);
        edge.getAttributes().putAll(attributes);
        return edge;
    }

    public GraphNode getNode(String id) {
        return nodes.get(id);
    }

    public boolean hasNode(String id) {
        return nodes.containsKey(id);
    }

    /**
     * @return Edge between the two nodes in either orientation, or null
     */
    public GraphEdge getEdge(String u, String v) {
        return edges.get(EdgeKey.of(u, v));
    }

    public boolean hasEdge(String u, String v) {
        return edges.containsKey(EdgeKey.of(u, v));
    }

    /**
     * @return Unmodifiable view of all nodes in insertion order
     */
    public Collection<GraphNode> getNodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    /**
     * @return Unmodifiable view of all edges in insertion order
     */
    public Collection<GraphEdge> getEdges() {
        return Collections.unmodifiableCollection(edges.values());
    }

    /**
     * @return Unmodifiable set of neighbour ids, empty for an unknown node
     */
    public Set<String> neighbors(String id) {
        Set<String> adjacent = adjacency.get(id);
        return adjacent != null ? Collections.unmodifiableSet(adjacent) : Collections.emptySet();
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    @Override
    public String toString() {
        return String.format("FairwayGraph{nodes=%d, edges=%d}", nodes.size(), edges.size());
    }
}
