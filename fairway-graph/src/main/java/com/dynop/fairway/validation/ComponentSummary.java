package com.dynop.fairway.validation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Size of one connected component; ids rank components by size, largest first.
 */
public final class ComponentSummary {

    private final int subgraphId;
    private final int nodes;
    private final int edges;

    @JsonCreator
    public ComponentSummary(
            @JsonProperty("subgraph_id") int subgraphId,
            @JsonProperty("nodes") int nodes,
            @JsonProperty("edges") int edges) {
        this.subgraphId = subgraphId;
        this.nodes = nodes;
        this.edges = edges;
    }

    @JsonProperty("subgraph_id")
    public int getSubgraphId() {
        return subgraphId;
    }

    @JsonProperty("nodes")
    public int getNodes() {
        return nodes;
    }

    @JsonProperty("edges")
    public int getEdges() {
        return edges;
    }
}
