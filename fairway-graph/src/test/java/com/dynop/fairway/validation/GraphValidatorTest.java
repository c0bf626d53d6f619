package com.dynop.fairway.validation;

import com.dynop.fairway.graph.Attributes;
import com.dynop.fairway.graph.FairwayGraph;
import com.dynop.fairway.integrate.GraphMerger;
import com.dynop.fairway.schema.SchemaMapping;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.dynop.fairway.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link GraphValidator}.
 */
class GraphValidatorTest {

    private FairwayGraph graph;
    private SchemaMapping schema;

    @BeforeEach
    void setUp() {
        graph = new FairwayGraph();
        graph.addNode("FIS_1", Map.of(Attributes.DATA_SOURCE, "FIS", "Name", "Lobith"));
        graph.addNode("FIS_2", Map.of(Attributes.DATA_SOURCE, "FIS"));
        graph.addNode("EURIS_DE_J2", Map.of(Attributes.DATA_SOURCE, "EURIS", "ObjectCode", "J2"));
        graph.addNode("EURIS_DE_J3", Map.of(Attributes.DATA_SOURCE, "EURIS"));
        graph.addNode("FIS_5");

        graph.addEdge("FIS_1", "FIS_2", Map.of(Attributes.DATA_SOURCE, "FIS", "Id", 500L,
                Attributes.FAIRWAY_ID, 77L, "RouteKmBegin", 860.0));
        graph.addEdge("EURIS_DE_J2", "EURIS_DE_J3", Map.of(Attributes.DATA_SOURCE, "EURIS",
                Attributes.FAIRWAY_ID, "F9", Attributes.LENGTH_M, 1200.0));
        graph.addEdge("FIS_2", "EURIS_DE_J2", Map.of(Attributes.DATA_SOURCE, GraphMerger.BORDER,
                Attributes.DISTANCE_GAP, 12.0, Attributes.FAIRWAY_ID, ""));

        schema = new SchemaMapping(Map.of("Name", "name"), Map.of("Id", "id"));
    }

    @Test
    void countsElementsBySource() {
        GraphStatistics statistics = createValidator(1).checkStatistics(graph);

        assertEquals(5, statistics.getTotalNodes());
        assertEquals(3, statistics.getTotalEdges());
        assertEquals(Map.of("FIS", 2, "EURIS", 2, "unknown", 1), statistics.getNodesBySource());
        assertEquals(Map.of("FIS", 1, "EURIS", 1, "BORDER", 1), statistics.getEdgesBySource());
        // Blank fairway ids are not counted
        assertEquals(2, statistics.getUniqueFairwaySections());
    }

    @Test
    void ranksComponentsBySize() {
        GraphStatistics statistics = createValidator(1).checkStatistics(graph);

        assertEquals(2, statistics.getConnectedComponents());
        assertEquals(4, statistics.getLargestComponentSize());
        List<ComponentSummary> subgraphs = statistics.getSubgraphs();
        assertEquals(2, subgraphs.size());
        assertEquals(0, subgraphs.get(0).getSubgraphId());
        assertEquals(4, subgraphs.get(0).getNodes());
        assertEquals(3, subgraphs.get(0).getEdges());
        assertEquals(1, subgraphs.get(1).getNodes());
        assertEquals(0, subgraphs.get(1).getEdges());
    }

    @Test
    void listsOnlyLargerComponentsAfterTheFirstTen() {
        FairwayGraph scattered = new FairwayGraph();
        scattered.addEdge("a", "b");
        for (int i = 0; i < 12; i++) {
            scattered.addNode("single_" + i);
        }
        scattered.addEdge("y", "z");

        GraphStatistics statistics = createValidator(1).checkStatistics(scattered);

        assertEquals(14, statistics.getConnectedComponents());
        // Ten listed by rank, the remaining singletons are left out
        assertEquals(10, statistics.getSubgraphs().size());
    }

    @Test
    void borderIntegrityPassesAtExpectedCount() {
        BorderIntegrity integrity = createValidator(1).checkBorderIntegrity(graph);

        assertEquals(ValidationStatus.PASS, integrity.getStatus());
        assertEquals(1, integrity.getTotalConnections());
        assertEquals(12.0, integrity.getMinGapMeters());
        assertEquals(12.0, integrity.getMaxGapMeters());
        assertEquals(12.0, integrity.getAvgGapMeters());
        assertEquals("FIS_2", integrity.getConnections().get(0).getU());
        assertEquals("EURIS_DE_J2", integrity.getConnections().get(0).getV());
    }

    @Test
    void borderIntegrityWarnsBelowExpectedCount() {
        BorderIntegrity integrity = createValidator(14).checkBorderIntegrity(graph);

        assertEquals(ValidationStatus.WARNING, integrity.getStatus());
        assertEquals(14, integrity.getExpectedConnections());
    }

    @Test
    void noBorderEdgesGiveZeroGaps() {
        FairwayGraph domestic = new FairwayGraph();
        domestic.addEdge("FIS_1", "FIS_2", Map.of(Attributes.DATA_SOURCE, "FIS"));

        BorderIntegrity integrity = createValidator(1).checkBorderIntegrity(domestic);

        assertEquals(0, integrity.getTotalConnections());
        assertEquals(0.0, integrity.getMinGapMeters());
        assertEquals(0.0, integrity.getAvgGapMeters());
        assertEquals(ValidationStatus.WARNING, integrity.getStatus());
    }

    @Test
    void flagsLegacyAttributeNames() {
        SchemaCompliance compliance = createValidator(1).checkSchemaCompliance(graph);

        // Mapped source keys are not flagged, unmapped keys with capitals are
        assertEquals(List.of("ObjectCode"), compliance.getNodes().getNonStandardAttributes());
        assertEquals(1, compliance.getNodes().getAttributeCounts().get("ObjectCode"));
        assertEquals(List.of("RouteKmBegin"), compliance.getEdges().getNonStandardAttributes());
    }

    @Test
    void countsMissingCanonicalAttributes() {
        SchemaCompliance compliance = createValidator(1).checkSchemaCompliance(graph);

        ElementCompliance nodes = compliance.getNodes();
        assertTrue(nodes.getExpectedAttributes().contains("name"));
        assertTrue(nodes.getExpectedAttributes().contains(Attributes.COUNTRY_CODE));
        assertEquals(5, nodes.getMissingCounts().get("name"));
        assertEquals(1, nodes.getMissingCounts().get(Attributes.DATA_SOURCE));
        assertEquals("Mapped from [Name]", nodes.getAttributeDocs().get("name"));
        assertEquals("Standard/Base Attribute", nodes.getAttributeDocs().get(Attributes.GEOMETRY));

        assertEquals(3, compliance.getEdges().getMissingCounts().get("id"));
    }

    @Test
    void criticalConnectionMatchesNamespacedEndpoint() {
        GraphValidator validator = new GraphValidator(schema, new ValidationSettings(1, List.of(
                new CriticalConnection("Lobith Connection", "2"),
                new CriticalConnection("Missing Connection", "99"))));

        List<ConnectionCheck> checks = validator.checkCriticalConnections(graph);

        assertEquals(ValidationStatus.PASS, checks.get(0).getStatus());
        assertEquals("FIS_2 <-> EURIS_DE_J2", checks.get(0).getDetails());
        assertEquals(ValidationStatus.WARNING, checks.get(1).getStatus());
        assertEquals("99 not found in border connections", checks.get(1).getDetails());
    }

    @Test
    void criticalConnectionIgnoresNonBorderEdges() {
        GraphValidator validator = new GraphValidator(schema, new ValidationSettings(1, List.of(
                new CriticalConnection("Domestic", "1"))));

        assertEquals(ValidationStatus.WARNING, validator.checkCriticalConnections(graph).get(0).getStatus());
    }

    @Test
    void validateDoesNotModifyGraph() {
        Map<String, Object> before = Map.copyOf(graph.getNode("FIS_1").getAttributes());

        ValidationReport report = createValidator(1).validate(graph);

        assertTrue(report.isPassing());
        assertEquals(before, graph.getNode("FIS_1").getAttributes());
        assertEquals(3, graph.edgeCount());
    }

    @Test
    void reportSerialisesWithSnakeCaseKeys() throws Exception {
        GraphValidator validator = new GraphValidator(schema, new ValidationSettings(14, List.of(
                new CriticalConnection("Lobith Connection", "2"))));
        ObjectMapper mapper = new ObjectMapper();

        String json = mapper.writeValueAsString(validator.validate(graph));
        JsonNode root = mapper.readTree(json);

        assertEquals(5, root.path("statistics").path("total_nodes").asInt());
        assertEquals("WARNING", root.path("border_integrity").path("status").asText());
        assertEquals(12.0, root.path("border_integrity").path("connections").get(0).path("gap").asDouble());
        assertTrue(root.path("schema_compliance").path("nodes").has("non_standard_attributes_detected"));
        assertEquals("PASS", root.path("critical_connections").path("checks").get(0).path("status").asText());

        ValidationReport parsed = mapper.readValue(json, ValidationReport.class);
        assertEquals(3, parsed.getStatistics().getTotalEdges());
        assertEquals(1, parsed.getCriticalConnections().size());
        assertFalse(parsed.isPassing());
    }

    private GraphValidator createValidator(int expectedBorderConnections) {
        return new GraphValidator(schema, new ValidationSettings(expectedBorderConnections, null));
    }
}
