package com.dynop.fairway.validation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public final class SchemaCompliance {

    private final ElementCompliance nodes;
    private final ElementCompliance edges;

    @JsonCreator
    public SchemaCompliance(
            @JsonProperty("nodes") ElementCompliance nodes,
            @JsonProperty("edges") ElementCompliance edges) {
        this.nodes = nodes;
        this.edges = edges;
    }

    @JsonProperty("nodes")
    public ElementCompliance getNodes() {
        return nodes;
    }

    @JsonProperty("edges")
    public ElementCompliance getEdges() {
        return edges;
    }
}
