package com.dynop.fairway.validation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A known border crossing that must be present in the merged graph.
 */
public final class CriticalConnection {

    private final String name;
    private final String nodeId;

    /**
     * @param name   Display name (e.g., "Lobith Connection")
     * @param nodeId Primary node id, with or without source tag, expected on a border edge
     */
    @JsonCreator
    public CriticalConnection(
            @JsonProperty("name") String name,
            @JsonProperty("nodeId") String nodeId) {
        this.name = Objects.requireNonNull(name, "name");
        this.nodeId = Objects.requireNonNull(nodeId, "nodeId");
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("nodeId")
    public String getNodeId() {
        return nodeId;
    }

    /**
     * @param endpoint Merged-graph node id, e.g. {@code FIS_22638200}
     * @return true if the endpoint is this connection's node
     */
    public boolean matches(String endpoint) {
        return endpoint.equals(nodeId) || endpoint.endsWith("_" + nodeId);
    }

    @Override
    public String toString() {
        return name + " (" + nodeId + ")";
    }
}
