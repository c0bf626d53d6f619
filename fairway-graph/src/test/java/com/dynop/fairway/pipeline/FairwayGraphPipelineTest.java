package com.dynop.fairway.pipeline;

import com.codahale.metrics.MetricRegistry;
import com.dynop.fairway.FairwayDataException;
import com.dynop.fairway.config.FairwayGraphConfiguration;
import com.dynop.fairway.graph.Attributes;
import com.dynop.fairway.graph.FairwayGraph;
import com.dynop.fairway.graph.GraphEdge;
import com.dynop.fairway.graph.builder.MultiFileGraphBuilder;
import com.dynop.fairway.integrate.GraphMerger;
import com.dynop.fairway.schema.SchemaMapping;
import com.dynop.fairway.table.FeatureRecord;
import com.dynop.fairway.table.FeatureTable;
import com.dynop.fairway.validation.CriticalConnection;
import com.dynop.fairway.validation.ValidationSettings;
import com.dynop.fairway.validation.ValidationStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.dynop.fairway.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link FairwayGraphPipeline} over a small two-country network around Lobith.
 */
class FairwayGraphPipelineTest {

    private FairwayGraphPipeline pipeline;
    private Map<String, FeatureTable> primaryDatasets;
    private FeatureTable secondaryNodes;
    private FeatureTable secondarySections;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        FairwayGraphConfiguration configuration = new FairwayGraphConfiguration();
        configuration.setValidation(new ValidationSettings(1, List.of(
                new CriticalConnection("Lobith Connection", "2"))));
        configuration.setSchema(new SchemaMapping(Map.of("Name", "name"), Map.of("Id", "id")));
        pipeline = new FairwayGraphPipeline(configuration);

        primaryDatasets = new HashMap<>();
        primaryDatasets.put("section", table("section",
                record(line(6.00, 51.85, 6.10, 51.85), "Id", 500L, "StartJunctionId", 1L, "EndJunctionId", 2L,
                        "Name", "Bovenrijn", "RouteId", 7L, "RouteKmBegin", 858.0, "RouteKmEnd", 865.0)));
        primaryDatasets.put("sectionjunction", table("sectionjunction",
                record(point(6.00, 51.85), "Id", 1L, "Name", "Pannerdensche Kop"),
                record(point(6.10, 51.85), "Id", 2L, "Name", "Lobith")));
        primaryDatasets.put("maximumdimensions", table("maximumdimensions",
                record(line(6.00, 51.85, 6.10, 51.85), "GeneralDepth", 3.5)));
        primaryDatasets.put("navigability", table("navigability",
                record(line(6.00, 51.85, 6.10, 51.85), "Code", "Vb")));

        MultiFileGraphBuilder builder = new MultiFileGraphBuilder();
        secondaryNodes = builder.concatNodes(List.of(
                table("Node_DE_0.geojson",
                        createNode("DEEMM00001", "E1", "S1", 6.20, 51.83),
                        createNode("DEEMM00002", "E2", "S2", 6.30, 51.80),
                        createNode("DEEMM00003", "E3", "S2", 6.40, 51.78)),
                table("Node_NL_0.geojson",
                        createNode("NLLOB00001", "L1", "S1", 6.1001, 51.8501))));
        secondarySections = builder.concatSections(List.of(
                table("FairwaySection_DE_0.geojson",
                        record(line(6.1001, 51.8501, 6.20, 51.83), "code", "S1", "name", "Rhein"),
                        record(line(6.30, 51.80, 6.40, 51.78), "code", "S2", "name", "Rhein"))));
    }

    @Test
    void mergesBothNetworksAcrossTheBorder() {
        FeatureTable speeds = table("sailingspeed", record(null, "sectionref", "S2", "maxspeed", 15.0));

        FairwayGraphPipeline.Result result = pipeline.run(primaryDatasets, secondaryNodes, secondarySections, speeds);

        assertEquals(1, result.connections.size());
        assertEquals("2", result.connections.get(0).getMatchedNode());

        FairwayGraph merged = result.merged;
        assertEquals(5, merged.nodeCount());
        assertEquals(3, merged.edgeCount());
        assertFalse(merged.hasNode("EURIS_NL_L1"));
        GraphEdge border = merged.getEdge("FIS_2", "EURIS_DE_E1");
        assertNotNull(border);
        assertEquals(GraphMerger.BORDER, border.getDataSource());
    }

    @Test
    void carriesEnrichmentAndRenamedAttributes() {
        FeatureTable speeds = table("sailingspeed", record(null, "sectionref", "S2", "maxspeed", 15.0));

        FairwayGraph merged = pipeline.run(primaryDatasets, secondaryNodes, secondarySections, speeds).merged;

        GraphEdge primaryEdge = merged.getEdge("FIS_1", "FIS_2");
        assertEquals(3.5, primaryEdge.get("dim_GeneralDepth"));
        assertEquals("Vb", primaryEdge.get("cemt_class"));
        assertEquals(500L, primaryEdge.get("id"));
        assertNull(primaryEdge.get("Id"));
        assertTrue(primaryEdge.getLengthMeters() > 6000);
        assertEquals("Lobith", merged.getNode("FIS_2").get("name"));
        assertEquals(15.0, merged.getEdge("EURIS_DE_E2", "EURIS_DE_E3").get("speed_maxspeed"));
    }

    @Test
    void reportsPassingChecks() {
        FairwayGraphPipeline.Result result = pipeline.run(primaryDatasets, secondaryNodes, secondarySections,
                FeatureTable.empty("sailingspeed"));

        assertEquals(ValidationStatus.PASS, result.report.getBorderIntegrity().getStatus());
        assertEquals(ValidationStatus.PASS, result.report.getCriticalConnections().get(0).getStatus());
        assertEquals(2, result.report.getStatistics().getConnectedComponents());
        assertEquals(Map.of("FIS", 2, "EURIS", 3), result.report.getStatistics().getNodesBySource());
        assertTrue(result.report.isPassing());
    }

    @Test
    void recordsRunMetrics() {
        MetricRegistry metrics = new MetricRegistry();
        FairwayGraphPipeline timed = new FairwayGraphPipeline(new FairwayGraphConfiguration(), metrics);

        timed.run(primaryDatasets, secondaryNodes, secondarySections, FeatureTable.empty("sailingspeed"));

        assertEquals(1, metrics.timer("fairway.pipeline.latency").getCount());
        assertEquals(1, metrics.meter("fairway.pipeline.border_connections").getCount());
    }

    @Test
    void missingJunctionDatasetFails() {
        primaryDatasets.remove("sectionjunction");

        FairwayDataException ex = assertThrows(FairwayDataException.class,
                () -> pipeline.run(primaryDatasets, secondaryNodes, secondarySections, FeatureTable.empty("sailingspeed")));

        assertEquals(FairwayDataException.MISSING_DATASET, ex.getErrorCode());
        assertEquals(FairwayGraphPipeline.JUNCTION_DATASET, ex.getSource());
    }

    @Test
    void readsSecondaryNetworkFromDirectory() throws IOException {
        Files.writeString(tempDir.resolve("Node_DE_0.geojson"), """
            {"type": "FeatureCollection", "features": [
              {"type": "Feature", "properties": {"locode": "DEEMM00001", "objectcode": "E1", "sectionref": "S1"},
               "geometry": {"type": "Point", "coordinates": [6.20, 51.83]}}
            ]}
            """);
        Files.writeString(tempDir.resolve("Node_NL_0.geojson"), """
            {"type": "FeatureCollection", "features": [
              {"type": "Feature", "properties": {"locode": "NLLOB00001", "objectcode": "L1", "sectionref": "S1"},
               "geometry": {"type": "Point", "coordinates": [6.1001, 51.8501]}}
            ]}
            """);
        Files.writeString(tempDir.resolve("FairwaySection_DE_0.geojson"), """
            {"type": "FeatureCollection", "features": [
              {"type": "Feature", "properties": {"code": "S1", "name": "Rhein"},
               "geometry": {"type": "LineString", "coordinates": [[6.1001, 51.8501], [6.20, 51.83]]}}
            ]}
            """);

        FairwayGraphPipeline.Result result = pipeline.run(primaryDatasets, tempDir);

        assertEquals(2, result.secondary.graph.nodeCount());
        assertEquals(1, result.connections.size());
        assertTrue(result.merged.hasEdge("FIS_2", "EURIS_DE_E1"));
        assertEquals("Rhein", result.merged.getEdge("FIS_2", "EURIS_DE_E1").get("name"));
    }

    private static FeatureRecord createNode(String locode, String objectCode, String sectionRef,
                                            double lon, double lat) {
        return record(point(lon, lat),
                "locode", locode,
                "objectcode", objectCode,
                Attributes.SECTION_REF, sectionRef);
    }
}
