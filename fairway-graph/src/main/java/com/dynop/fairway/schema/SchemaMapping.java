package com.dynop.fairway.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Legacy-to-canonical attribute names for nodes and edges of the merged graph.
 *
 * <p>Both sources export PascalCase or abbreviated column names; the mapping renames them to
 * the canonical lowercase names downstream consumers expect.
 */
public final class SchemaMapping {

    private final Map<String, String> nodes;
    private final Map<String, String> edges;

    @JsonCreator
    public SchemaMapping(
            @JsonProperty("nodes") Map<String, String> nodes,
            @JsonProperty("edges") Map<String, String> edges) {
        this.nodes = nodes != null ? Collections.unmodifiableMap(new LinkedHashMap<>(nodes)) : Collections.emptyMap();
        this.edges = edges != null ? Collections.unmodifiableMap(new LinkedHashMap<>(edges)) : Collections.emptyMap();
    }

    public static SchemaMapping empty() {
        return new SchemaMapping(null, null);
    }

    /**
     * @return Old node attribute name to new name
     */
    @JsonProperty("nodes")
    public Map<String, String> getNodes() {
        return nodes;
    }

    /**
     * @return Old edge attribute name to new name
     */
    @JsonProperty("edges")
    public Map<String, String> getEdges() {
        return edges;
    }

    /**
     * @return Legacy names mapped onto the given canonical name, in mapping order
     */
    static List<String> sourcesOf(Map<String, String> mapping, String canonical) {
        List<String> sources = new ArrayList<>();
        for (Map.Entry<String, String> entry : mapping.entrySet()) {
            if (entry.getValue().equals(canonical)) {
                sources.add(entry.getKey());
            }
        }
        return sources;
    }

    /**
     * @return Legacy node attribute names mapped onto the canonical name
     */
    public List<String> nodeSourcesOf(String canonical) {
        return sourcesOf(nodes, canonical);
    }

    /**
     * @return Legacy edge attribute names mapped onto the canonical name
     */
    public List<String> edgeSourcesOf(String canonical) {
        return sourcesOf(edges, canonical);
    }
}
