package com.dynop.fairway.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.logging.Logger;

/**
 * Connected-component partitioning of a {@link FairwayGraph}.
 *
 * <p>Seeds are visited in ascending node-id order, so component {@code 0} is the one holding
 * the smallest node id and indices are reproducible across runs on the same input.
 */
public final class ConnectedComponents {

    private static final Logger LOGGER = Logger.getLogger(ConnectedComponents.class.getName());

    private ConnectedComponents() {
    }

    /**
     * @return Node ids per component, indexed by component number
     */
    public static List<List<String>> find(FairwayGraph graph) {
        List<String> seeds = new ArrayList<>();
        for (GraphNode node : graph.getNodes()) {
            seeds.add(node.getId());
        }
        Collections.sort(seeds);

        Map<String, Integer> component = new HashMap<>();
        List<List<String>> components = new ArrayList<>();
        for (String seed : seeds) {
            if (!component.containsKey(seed)) {
                components.add(bfs(graph, seed, component, components.size()));
            }
        }
        return components;
    }

    /**
     * Writes the component index onto every node and edge as {@code subgraph}.
     *
     * @return Number of components
     */
    public static int stamp(FairwayGraph graph) {
        List<List<String>> components = find(graph);
        for (int i = 0; i < components.size(); i++) {
            for (String nodeId : components.get(i)) {
                graph.getNode(nodeId).set(Attributes.SUBGRAPH, i);
            }
        }
        for (GraphEdge edge : graph.getEdges()) {
            edge.set(Attributes.SUBGRAPH, graph.getNode(edge.getSource()).getComponent());
        }
        int largest = components.stream().mapToInt(List::size).max().orElse(0);
        LOGGER.fine(() -> String.format("Stamped %d components (largest %d nodes)", components.size(), largest));
        return components.size();
    }

    /**
     * @return Component sizes, largest first
     */
    public static List<Integer> sizes(FairwayGraph graph) {
        List<Integer> sizes = new ArrayList<>();
        for (List<String> members : find(graph)) {
            sizes.add(members.size());
        }
        sizes.sort(Comparator.reverseOrder());
        return sizes;
    }

    private static List<String> bfs(FairwayGraph graph, String start, Map<String, Integer> component, int componentId) {
        Queue<String> queue = new ArrayDeque<>();
        List<String> members = new ArrayList<>();
        queue.offer(start);
        component.put(start, componentId);

        while (!queue.isEmpty()) {
            String node = queue.poll();
            members.add(node);
            for (String neighbor : graph.neighbors(node)) {
                if (!component.containsKey(neighbor)) {
                    component.put(neighbor, componentId);
                    queue.offer(neighbor);
                }
            }
        }
        return members;
    }
}
