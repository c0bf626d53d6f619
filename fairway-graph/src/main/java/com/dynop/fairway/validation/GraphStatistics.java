package com.dynop.fairway.validation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Size and composition of the merged graph.
 */
public final class GraphStatistics {

    private final int totalNodes;
    private final int totalEdges;
    private final Map<String, Integer> nodesBySource;
    private final Map<String, Integer> edgesBySource;
    private final int connectedComponents;
    private final int largestComponentSize;
    private final List<ComponentSummary> subgraphs;
    private final int uniqueFairwaySections;

    @JsonCreator
    public GraphStatistics(
            @JsonProperty("total_nodes") int totalNodes,
            @JsonProperty("total_edges") int totalEdges,
            @JsonProperty("nodes_by_source") Map<String, Integer> nodesBySource,
            @JsonProperty("edges_by_source") Map<String, Integer> edgesBySource,
            @JsonProperty("connected_components") int connectedComponents,
            @JsonProperty("largest_component_size") int largestComponentSize,
            @JsonProperty("subgraphs") List<ComponentSummary> subgraphs,
            @JsonProperty("unique_fairway_sections") int uniqueFairwaySections) {
        this.totalNodes = totalNodes;
        this.totalEdges = totalEdges;
        this.nodesBySource = Collections.unmodifiableMap(new LinkedHashMap<>(nodesBySource));
        this.edgesBySource = Collections.unmodifiableMap(new LinkedHashMap<>(edgesBySource));
        this.connectedComponents = connectedComponents;
        this.largestComponentSize = largestComponentSize;
        this.subgraphs = List.copyOf(subgraphs);
        this.uniqueFairwaySections = uniqueFairwaySections;
    }

    @JsonProperty("total_nodes")
    public int getTotalNodes() {
        return totalNodes;
    }

    @JsonProperty("total_edges")
    public int getTotalEdges() {
        return totalEdges;
    }

    /**
     * @return Node count per {@code data_source}; nodes without one count as "unknown"
     */
    @JsonProperty("nodes_by_source")
    public Map<String, Integer> getNodesBySource() {
        return nodesBySource;
    }

    /**
     * @return Edge count per {@code data_source}; edges without one count as "unknown"
     */
    @JsonProperty("edges_by_source")
    public Map<String, Integer> getEdgesBySource() {
        return edgesBySource;
    }

    @JsonProperty("connected_components")
    public int getConnectedComponents() {
        return connectedComponents;
    }

    @JsonProperty("largest_component_size")
    public int getLargestComponentSize() {
        return largestComponentSize;
    }

    /**
     * @return The ten largest components plus every other component with more than one node
     */
    @JsonProperty("subgraphs")
    public List<ComponentSummary> getSubgraphs() {
        return subgraphs;
    }

    /**
     * @return Number of distinct non-empty {@code fairway_id} values on edges
     */
    @JsonProperty("unique_fairway_sections")
    public int getUniqueFairwaySections() {
        return uniqueFairwaySections;
    }
}
