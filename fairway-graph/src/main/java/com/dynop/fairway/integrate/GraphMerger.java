package com.dynop.fairway.integrate;

import com.dynop.fairway.graph.Attributes;
import com.dynop.fairway.graph.ConnectedComponents;
import com.dynop.fairway.graph.FairwayGraph;
import com.dynop.fairway.graph.GraphEdge;
import com.dynop.fairway.graph.GraphNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Combines the primary and the secondary network into one graph.
 *
 * <p>Node ids are namespaced with the source tag ({@code FIS_1001}, {@code EURIS_DE_J42}).
 * The secondary network's home-country part is dropped; the primary network covers it.
 * Border connections are added as edges between the matched primary node and the foreign
 * secondary node, which bypasses the secondary bridgehead.
 *
 * <p>Every node and edge of the result carries {@code data_source}: the primary tag, the
 * secondary tag or {@code BORDER}.
 */
public final class GraphMerger {

    private static final Logger LOGGER = Logger.getLogger(GraphMerger.class.getName());

    public static final String BORDER = "BORDER";

    private final String primaryTag;
    private final String secondaryTag;
    private final String homeCountry;
    private final MergeExclusions exclusions;

    /**
     * @param primaryTag   Source tag of the primary network (e.g., "FIS")
     * @param secondaryTag Source tag of the secondary network (e.g., "EURIS")
     * @param homeCountry  Country covered by the primary network (e.g., "NL")
     * @param exclusions   Primary nodes and edges to leave out
     */
    public GraphMerger(String primaryTag, String secondaryTag, String homeCountry, MergeExclusions exclusions) {
        this.primaryTag = Objects.requireNonNull(primaryTag, "primaryTag");
        this.secondaryTag = Objects.requireNonNull(secondaryTag, "secondaryTag");
        this.homeCountry = Objects.requireNonNull(homeCountry, "homeCountry");
        this.exclusions = Objects.requireNonNull(exclusions, "exclusions");
    }

    /**
     * Merge two networks.
     *
     * @param primary     Primary network, un-namespaced ids
     * @param secondary   Secondary network, un-namespaced ids
     * @param connections Border connections between them
     * @return New merged graph; the inputs are not modified
     */
    public FairwayGraph merge(FairwayGraph primary, FairwayGraph secondary, List<BorderConnection> connections) {
        FairwayGraph combined = new FairwayGraph();

        LOGGER.info(() -> String.format("Adding %s nodes to combined graph", primaryTag));
        for (GraphNode node : primary.getNodes()) {
            if (exclusions.isNodeExcluded(node.getId())) {
                LOGGER.info(() -> String.format("Pruning %s node %s (manual exclusion)", primaryTag, node.getId()));
                continue;
            }
            copyNode(combined, node, primaryTag);
        }
        for (GraphEdge edge : primary.getEdges()) {
            Object id = edge.get(Attributes.ID);
            if (exclusions.isEdgeExcluded(id)) {
                LOGGER.info(() -> String.format("Pruning %s edge %s (Id: %s, manual exclusion)", primaryTag, edge.getKey(), id));
                continue;
            }
            if (exclusions.isNodeExcluded(edge.getSource()) || exclusions.isNodeExcluded(edge.getTarget())) {
                continue;
            }
            copyEdge(combined, edge, primaryTag);
        }

        LOGGER.info(() -> String.format("Adding %s nodes to combined graph (excluding %s)", secondaryTag, homeCountry));
        for (GraphNode node : secondary.getNodes()) {
            if (!homeCountry.equals(node.getCountryCode())) {
                copyNode(combined, node, secondaryTag);
            }
        }
        for (GraphEdge edge : secondary.getEdges()) {
            if (homeCountry.equals(secondary.getNode(edge.getSource()).getCountryCode())
                    || homeCountry.equals(secondary.getNode(edge.getTarget()).getCountryCode())) {
                continue;
            }
            copyEdge(combined, edge, secondaryTag);
        }

        LOGGER.info(() -> String.format("Adding %d border connections", connections.size()));
        int skipped = 0;
        for (BorderConnection connection : connections) {
            String u = namespaced(primaryTag, connection.getMatchedNode());
            String v = namespaced(secondaryTag, connection.getForeignNode());
            if (!combined.hasNode(u) || !combined.hasNode(v)) {
                skipped++;
                LOGGER.warning(String.format("Skipping border connection %s <-> %s: endpoint not in merged graph", u, v));
                continue;
            }
            Map<String, Object> attributes = new LinkedHashMap<>(connection.getEdgeAttributes());
            attributes.put(Attributes.DATA_SOURCE, BORDER);
            attributes.put(Attributes.BRIDGEHEAD, connection.getBridgeheadNode());
            attributes.put(Attributes.DISTANCE_GAP, connection.getDistance());
            attributes.put(Attributes.CONNECTION_TYPE, connection.getConnectionType());
            combined.addEdge(u, v, attributes);
        }

        int componentCount = ConnectedComponents.stamp(combined);
        int skippedConnections = skipped;
        LOGGER.info(() -> String.format("Combined graph: %d nodes, %d edges, %d components (%d connections skipped)",
                combined.nodeCount(), combined.edgeCount(), componentCount, skippedConnections));
        return combined;
    }

    private static void copyNode(FairwayGraph target, GraphNode node, String tag) {
        target.addNode(namespaced(tag, node.getId()), node.getAttributes())
                .set(Attributes.DATA_SOURCE, tag);
    }

    private static void copyEdge(FairwayGraph target, GraphEdge edge, String tag) {
        target.addEdge(namespaced(tag, edge.getSource()), namespaced(tag, edge.getTarget()), edge.getAttributes())
                .set(Attributes.DATA_SOURCE, tag);
    }

    /**
     * @return Node id prefixed with the source tag, e.g. {@code FIS_1001}
     */
    public static String namespaced(String tag, String nodeId) {
        return tag + "_" + nodeId;
    }

    public String getPrimaryTag() {
        return primaryTag;
    }

    public String getSecondaryTag() {
        return secondaryTag;
    }

    public MergeExclusions getExclusions() {
        return exclusions;
    }
}
