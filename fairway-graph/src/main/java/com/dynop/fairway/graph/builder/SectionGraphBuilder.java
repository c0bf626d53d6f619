package com.dynop.fairway.graph.builder;

import com.dynop.fairway.geo.GeodesicLength;
import com.dynop.fairway.graph.Attributes;
import com.dynop.fairway.graph.ConnectedComponents;
import com.dynop.fairway.graph.FairwayGraph;
import com.dynop.fairway.graph.GraphEdge;
import com.dynop.fairway.graph.GraphNode;
import com.dynop.fairway.table.FeatureRecord;
import com.dynop.fairway.table.FeatureTable;
import org.locationtech.jts.geom.Point;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds the graph of a single-table network from its section and junction exports.
 *
 * <p>Steps:
 * <ol>
 *   <li>Drop sections without a start or end junction id</li>
 *   <li>Keep only junctions referenced by a retained section</li>
 *   <li>Add one edge per retained section carrying all section columns and its geometry</li>
 *   <li>Attach junction columns plus {@code geometry}, {@code x} and {@code y} to the nodes</li>
 *   <li>Compute {@code length_m} per edge and stamp {@code subgraph}</li>
 * </ol>
 *
 * <p>Repeated endpoint pairs and repeated junction ids are resolved last-write-wins. Running
 * the builder on its own filtered output yields the same graph.
 */
public final class SectionGraphBuilder {

    private static final Logger LOGGER = Logger.getLogger(SectionGraphBuilder.class.getName());

    public static final String START_JUNCTION_ID = "StartJunctionId";
    public static final String END_JUNCTION_ID = "EndJunctionId";
    public static final String JUNCTION_ID = "Id";

    /**
     * Build the graph.
     *
     * @param sections  Section records with {@code StartJunctionId}, {@code EndJunctionId} and a line geometry
     * @param junctions Junction records with {@code Id} and a point geometry
     * @return BuildResult with the graph and the filtered input tables
     * @throws com.dynop.fairway.FairwayDataException if a required column is missing
     */
    public BuildResult build(FeatureTable sections, FeatureTable junctions) {
        sections.requireColumns(START_JUNCTION_ID, END_JUNCTION_ID);
        junctions.requireColumns(JUNCTION_ID);

        FeatureTable filteredSections = filterSections(sections);
        FeatureTable filteredJunctions = filterJunctions(junctions, filteredSections);
        int removedSections = sections.size() - filteredSections.size();

        FairwayGraph graph = new FairwayGraph();
        LOGGER.info(() -> String.format("Building graph from %d edges", filteredSections.size()));
        for (FeatureRecord section : filteredSections.getRecords()) {
            Map<String, Object> attributes = new LinkedHashMap<>(section.getProperties());
            attributes.put(Attributes.GEOMETRY, section.getGeometry());
            graph.addEdge(section.getId(START_JUNCTION_ID), section.getId(END_JUNCTION_ID), attributes);
        }

        LOGGER.info(() -> String.format("Adding node attributes from %d junctions", filteredJunctions.size()));
        for (FeatureRecord junction : filteredJunctions.getRecords()) {
            GraphNode node = graph.getNode(junction.getId(JUNCTION_ID));
            if (node == null) {
                continue;
            }
            node.getAttributes().putAll(junction.getProperties());
            if (junction.getGeometry() instanceof Point && !junction.getGeometry().isEmpty()) {
                Point point = (Point) junction.getGeometry();
                node.set(Attributes.GEOMETRY, point);
                node.set(Attributes.X, point.getX());
                node.set(Attributes.Y, point.getY());
            }
        }

        int measured = computeLengths(graph);
        int componentCount = ConnectedComponents.stamp(graph);

        LOGGER.info(() -> String.format("Graph built: %d nodes, %d edges, %d connected components",
                graph.nodeCount(), graph.edgeCount(), componentCount));
        if (measured < graph.edgeCount()) {
            LOGGER.warning(String.format("%d edges have no computable length", graph.edgeCount() - measured));
        }

        return new BuildResult(graph, filteredSections, filteredJunctions, removedSections, componentCount);
    }

    private FeatureTable filterSections(FeatureTable sections) {
        List<FeatureRecord> valid = new ArrayList<>();
        for (FeatureRecord section : sections.getRecords()) {
            if (section.getId(START_JUNCTION_ID) != null && section.getId(END_JUNCTION_ID) != null) {
                valid.add(section);
            }
        }
        LOGGER.info(() -> String.format("Filtered sections: %d -> %d (removed %d without junction IDs)",
                sections.size(), valid.size(), sections.size() - valid.size()));
        return new FeatureTable(sections.getName(), valid);
    }

    private FeatureTable filterJunctions(FeatureTable junctions, FeatureTable sections) {
        Set<String> referenced = new HashSet<>();
        for (FeatureRecord section : sections.getRecords()) {
            referenced.add(section.getId(START_JUNCTION_ID));
            referenced.add(section.getId(END_JUNCTION_ID));
        }
        List<FeatureRecord> valid = new ArrayList<>();
        for (FeatureRecord junction : junctions.getRecords()) {
            if (referenced.contains(junction.getId(JUNCTION_ID))) {
                valid.add(junction);
            }
        }
        LOGGER.info(() -> String.format("Filtered junctions: %d -> %d (keeping only referenced)",
                junctions.size(), valid.size()));
        return new FeatureTable(junctions.getName(), valid);
    }

    /**
     * Sets {@code length_m} on every edge with a usable line geometry.
     *
     * @return number of edges measured
     */
    static int computeLengths(FairwayGraph graph) {
        int measured = 0;
        for (GraphEdge edge : graph.getEdges()) {
            if (edge.getGeometry() == null) {
                continue;
            }
            try {
                edge.set(Attributes.LENGTH_M, GeodesicLength.meters(edge.getGeometry()));
                measured++;
            } catch (IllegalArgumentException e) {
                LOGGER.log(Level.WARNING, () -> String.format("Skipping length of edge %s: %s",
                        edge.getKey(), e.getMessage()));
            }
        }
        return measured;
    }

    /**
     * Result of the build process.
     */
    public static class BuildResult {
        public final FairwayGraph graph;
        public final FeatureTable filteredSections;
        public final FeatureTable filteredJunctions;
        public final int removedSections;
        public final int componentCount;

        public BuildResult(FairwayGraph graph, FeatureTable filteredSections, FeatureTable filteredJunctions,
                           int removedSections, int componentCount) {
            this.graph = graph;
            this.filteredSections = filteredSections;
            this.filteredJunctions = filteredJunctions;
            this.removedSections = removedSections;
            this.componentCount = componentCount;
        }
    }
}
