package com.dynop.fairway.schema;

import com.dynop.fairway.graph.FairwayGraph;
import com.dynop.fairway.graph.GraphEdge;
import com.dynop.fairway.graph.GraphNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Renames legacy attribute keys on a graph in place.
 *
 * <p>A renamed value replaces any value already stored under the canonical name.
 */
public final class SchemaMapper {

    private static final Logger LOGGER = Logger.getLogger(SchemaMapper.class.getName());

    private final SchemaMapping mapping;

    public SchemaMapper(SchemaMapping mapping) {
        this.mapping = Objects.requireNonNull(mapping, "mapping");
    }

    /**
     * @param graph Graph to harmonise
     * @return Number of renamed attribute values
     */
    public int apply(FairwayGraph graph) {
        LOGGER.info("Harmonizing node attributes");
        int renamed = 0;
        for (GraphNode node : graph.getNodes()) {
            renamed += rename(node.getAttributes(), mapping.getNodes());
        }
        LOGGER.info("Harmonizing edge attributes");
        for (GraphEdge edge : graph.getEdges()) {
            renamed += rename(edge.getAttributes(), mapping.getEdges());
        }
        int total = renamed;
        LOGGER.fine(() -> String.format("Renamed %d attribute values", total));
        return renamed;
    }

    private static int rename(Map<String, Object> attributes, Map<String, String> names) {
        if (names.isEmpty()) {
            return 0;
        }
        int renamed = 0;
        List<String> keys = new ArrayList<>(attributes.keySet());
        for (String key : keys) {
            String newKey = names.get(key);
            if (newKey != null && attributes.containsKey(key)) {
                Object value = attributes.remove(key);
                attributes.put(newKey, value);
                renamed++;
            }
        }
        return renamed;
    }
}
