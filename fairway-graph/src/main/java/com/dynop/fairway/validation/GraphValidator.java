package com.dynop.fairway.validation;

import com.dynop.fairway.graph.Attributes;
import com.dynop.fairway.graph.ConnectedComponents;
import com.dynop.fairway.graph.FairwayGraph;
import com.dynop.fairway.graph.GraphEdge;
import com.dynop.fairway.graph.GraphNode;
import com.dynop.fairway.integrate.GraphMerger;
import com.dynop.fairway.schema.SchemaMapping;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Read-only checks over the merged graph.
 *
 * <p>Every check reports PASS or WARNING; none of them throws on a finding.
 */
public final class GraphValidator {

    private static final Logger LOGGER = Logger.getLogger(GraphValidator.class.getName());

    private static final String UNKNOWN_SOURCE = "unknown";
    private static final int LISTED_COMPONENTS = 10;

    static final Set<String> BASE_NODE_ATTRIBUTES = Set.of(
            Attributes.DATA_SOURCE, Attributes.GEOMETRY, Attributes.NODE_ID, Attributes.COUNTRY_CODE);
    static final Set<String> BASE_EDGE_ATTRIBUTES = Set.of(
            Attributes.DATA_SOURCE, Attributes.GEOMETRY, "id",
            Attributes.BRIDGEHEAD, Attributes.DISTANCE_GAP, Attributes.CONNECTION_TYPE);

    private final SchemaMapping schema;
    private final ValidationSettings settings;

    public GraphValidator(SchemaMapping schema, ValidationSettings settings) {
        this.schema = Objects.requireNonNull(schema, "schema");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * Run all checks.
     */
    public ValidationReport validate(FairwayGraph graph) {
        ValidationReport report = new ValidationReport(
                checkStatistics(graph),
                checkBorderIntegrity(graph),
                checkSchemaCompliance(graph),
                checkCriticalConnections(graph));
        LOGGER.info(() -> String.format("Validation finished: border integrity %s, %s",
                report.getBorderIntegrity().getStatus(), report.isPassing() ? "all checks passed" : "see warnings"));
        return report;
    }

    public GraphStatistics checkStatistics(FairwayGraph graph) {
        LOGGER.info("Running statistical checks...");

        Map<String, Integer> nodesBySource = new LinkedHashMap<>();
        for (GraphNode node : graph.getNodes()) {
            nodesBySource.merge(sourceOf(node.getDataSource()), 1, Integer::sum);
        }
        Map<String, Integer> edgesBySource = new LinkedHashMap<>();
        Set<Object> fairwayIds = new HashSet<>();
        for (GraphEdge edge : graph.getEdges()) {
            edgesBySource.merge(sourceOf(edge.getDataSource()), 1, Integer::sum);
            Object fairwayId = edge.get(Attributes.FAIRWAY_ID);
            if (!isMissing(fairwayId)) {
                fairwayIds.add(fairwayId);
            }
        }

        List<List<String>> components = ConnectedComponents.find(graph);
        components.sort((a, b) -> Integer.compare(b.size(), a.size()));
        Map<String, Integer> rank = new HashMap<>();
        for (int i = 0; i < components.size(); i++) {
            for (String nodeId : components.get(i)) {
                rank.put(nodeId, i);
            }
        }
        int[] edgesPerComponent = new int[components.size()];
        for (GraphEdge edge : graph.getEdges()) {
            edgesPerComponent[rank.get(edge.getSource())]++;
        }
        List<ComponentSummary> subgraphs = new ArrayList<>();
        for (int i = 0; i < components.size(); i++) {
            int size = components.get(i).size();
            if (i < LISTED_COMPONENTS || size > 1) {
                subgraphs.add(new ComponentSummary(i, size, edgesPerComponent[i]));
            }
        }

        return new GraphStatistics(
                graph.nodeCount(),
                graph.edgeCount(),
                nodesBySource,
                edgesBySource,
                components.size(),
                components.isEmpty() ? 0 : components.get(0).size(),
                subgraphs,
                fairwayIds.size());
    }

    public BorderIntegrity checkBorderIntegrity(FairwayGraph graph) {
        LOGGER.info("Checking border integrity...");

        List<BorderIntegrity.Connection> connections = new ArrayList<>();
        double min = Double.POSITIVE_INFINITY;
        double max = 0.0;
        double sum = 0.0;
        for (GraphEdge edge : graph.getEdges()) {
            if (!GraphMerger.BORDER.equals(edge.getDataSource())) {
                continue;
            }
            Object value = edge.get(Attributes.DISTANCE_GAP);
            double gap = value instanceof Number ? ((Number) value).doubleValue() : 0.0;
            connections.add(new BorderIntegrity.Connection(edge.getSource(), edge.getTarget(), gap));
            min = Math.min(min, gap);
            max = Math.max(max, gap);
            sum += gap;
        }

        int expected = settings.getExpectedBorderConnections();
        ValidationStatus status = connections.size() >= expected ? ValidationStatus.PASS : ValidationStatus.WARNING;
        if (status == ValidationStatus.WARNING) {
            LOGGER.warning(String.format("Found %d border connections, expected at least %d", connections.size(), expected));
        }
        return new BorderIntegrity(
                connections.size(),
                expected,
                status,
                connections.isEmpty() ? 0.0 : min,
                max,
                connections.isEmpty() ? 0.0 : sum / connections.size(),
                connections);
    }

    public SchemaCompliance checkSchemaCompliance(FairwayGraph graph) {
        LOGGER.info("Checking schema compliance...");
        ElementCompliance nodes = checkElements(graph.getNodes(), GraphNode::getAttributes,
                schema.getNodes(), BASE_NODE_ATTRIBUTES, schema::nodeSourcesOf);
        ElementCompliance edges = checkElements(graph.getEdges(), GraphEdge::getAttributes,
                schema.getEdges(), BASE_EDGE_ATTRIBUTES, schema::edgeSourcesOf);
        return new SchemaCompliance(nodes, edges);
    }

    public List<ConnectionCheck> checkCriticalConnections(FairwayGraph graph) {
        LOGGER.info("Checking critical connections...");

        List<ConnectionCheck> checks = new ArrayList<>();
        for (CriticalConnection critical : settings.getCriticalConnections()) {
            ConnectionCheck check = null;
            for (GraphEdge edge : graph.getEdges()) {
                if (GraphMerger.BORDER.equals(edge.getDataSource())
                        && (critical.matches(edge.getSource()) || critical.matches(edge.getTarget()))) {
                    check = new ConnectionCheck(critical.getName(), ValidationStatus.PASS,
                            edge.getSource() + " <-> " + edge.getTarget());
                    break;
                }
            }
            if (check == null) {
                LOGGER.warning(String.format("%s not found in border connections", critical));
                check = new ConnectionCheck(critical.getName(), ValidationStatus.WARNING,
                        critical.getNodeId() + " not found in border connections");
            }
            checks.add(check);
        }
        return checks;
    }

    private static <T> ElementCompliance checkElements(Collection<T> elements,
                                                       Function<T, Map<String, Object>> attributesOf,
                                                       Map<String, String> mapping,
                                                       Set<String> base,
                                                       Function<String, List<String>> sourcesOf) {
        Set<String> canonical = new TreeSet<>(base);
        canonical.addAll(mapping.values());

        Map<String, Integer> nonStandard = new LinkedHashMap<>();
        Map<String, Integer> missing = new LinkedHashMap<>();
        for (String key : canonical) {
            missing.put(key, 0);
        }

        for (T element : elements) {
            Map<String, Object> attributes = attributesOf.apply(element);
            for (String key : attributes.keySet()) {
                if (!canonical.contains(key) && !mapping.containsKey(key) && hasUppercase(key)) {
                    nonStandard.merge(key, 1, Integer::sum);
                }
            }
            for (String key : canonical) {
                if (isMissing(attributes.get(key))) {
                    missing.merge(key, 1, Integer::sum);
                }
            }
        }

        Map<String, String> docs = new LinkedHashMap<>();
        for (String key : canonical) {
            List<String> sources = sourcesOf.apply(key);
            docs.put(key, sources.isEmpty() ? "Standard/Base Attribute" : "Mapped from " + sources);
        }
        return new ElementCompliance(new ArrayList<>(nonStandard.keySet()), nonStandard, missing,
                new ArrayList<>(canonical), docs);
    }

    private static boolean hasUppercase(String key) {
        for (int i = 0; i < key.length(); i++) {
            if (Character.isUpperCase(key.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    private static boolean isMissing(Object value) {
        return value == null || "".equals(value);
    }

    private static String sourceOf(String dataSource) {
        return dataSource != null ? dataSource : UNKNOWN_SOURCE;
    }

    public SchemaMapping getSchema() {
        return schema;
    }

    public ValidationSettings getSettings() {
        return settings;
    }
}
