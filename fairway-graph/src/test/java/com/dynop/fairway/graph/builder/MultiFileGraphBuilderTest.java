package com.dynop.fairway.graph.builder;

import com.dynop.fairway.FairwayDataException;
import com.dynop.fairway.graph.Attributes;
import com.dynop.fairway.graph.FairwayGraph;
import com.dynop.fairway.graph.GraphEdge;
import com.dynop.fairway.graph.GraphNode;
import com.dynop.fairway.table.FeatureRecord;
import com.dynop.fairway.table.FeatureTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static com.dynop.fairway.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link MultiFileGraphBuilder}.
 */
class MultiFileGraphBuilderTest {

    private MultiFileGraphBuilder builder;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        builder = new MultiFileGraphBuilder();
    }

    @Test
    void derivesCompositeNodeIds() {
        FeatureTable nodes = builder.concatNodes(List.of(
                table("Node_DE_0.geojson", createNode("DEKLE00001", "J1", "S1", null, 6.10, 51.85))));

        FeatureRecord node = nodes.getRecords().get(0);
        assertEquals("DE_J1", node.get(Attributes.NODE_ID));
        assertEquals("DE", node.get(Attributes.COUNTRY_CODE));
        assertEquals("DE", node.get(MultiFileGraphBuilder.COUNTRY_CODE_LOCODE));
        assertEquals("DE", node.get(MultiFileGraphBuilder.COUNTRY_CODE_PATH));
        assertEquals("Node_DE_0.geojson", node.get(MultiFileGraphBuilder.PATH));
    }

    @Test
    void countryFromLocodeWinsOverFileName() {
        // A Dutch node exported in the German file
        FeatureTable nodes = builder.concatNodes(List.of(
                table("Node_DE_3.geojson", createNode("NLLOB00001", "J1", "S1", null, 6.10, 51.86))));

        FeatureRecord node = nodes.getRecords().get(0);
        assertEquals("NL_J1", node.get(Attributes.NODE_ID));
        assertEquals("DE", node.get(MultiFileGraphBuilder.COUNTRY_CODE_PATH));
    }

    @Test
    void removesDuplicatesAcrossFiles() {
        FeatureRecord shared = createNode("DEKLE00001", "J1", "S1", null, 6.10, 51.85);
        FeatureTable nodes = builder.concatNodes(List.of(
                table("Node_DE_0.geojson", shared),
                table("Node_NL_0.geojson", shared, createNode("NLLOB00001", "J2", "S2", null, 6.11, 51.86))));

        assertEquals(2, nodes.size());
        // First occurrence is kept with its own path
        assertEquals("Node_DE_0.geojson", nodes.getRecords().get(0).get(MultiFileGraphBuilder.PATH));
    }

    @Test
    void sameAttributesDifferentGeometryAreNotDuplicates() {
        FeatureTable nodes = builder.concatNodes(List.of(
                table("Node_DE_0.geojson",
                        createNode("DEKLE00001", "J1", "S1", null, 6.10, 51.85),
                        createNode("DEKLE00001", "J1", "S1", null, 6.20, 51.85))));

        assertEquals(2, nodes.size());
    }

    @Test
    void skipsNodesWithoutLocode() {
        FeatureTable nodes = builder.concatNodes(List.of(
                table("Node_DE_0.geojson",
                        createNode("DEKLE00001", "J1", "S1", null, 6.10, 51.85),
                        createNode(null, "J2", "S1", null, 6.20, 51.85))));

        assertEquals(1, nodes.size());
    }

    @Test
    void missingObjectCodeColumnFailsFast() {
        FeatureTable file = table("Node_DE_0.geojson", record(point(6.1, 51.85), "locode", "DEKLE00001"));

        FairwayDataException ex = assertThrows(FairwayDataException.class,
                () -> builder.concatNodes(List.of(file)));

        assertEquals(FairwayDataException.MISSING_COLUMN, ex.getErrorCode());
    }

    @Test
    void noFilesIsAnError() {
        FairwayDataException ex = assertThrows(FairwayDataException.class,
                () -> builder.concatSections(List.of()));

        assertEquals(FairwayDataException.NO_INPUT_FILES, ex.getErrorCode());
    }

    @Test
    void emptyDirectoryIsAnError() {
        FairwayDataException ex = assertThrows(FairwayDataException.class,
                () -> builder.loadNodeFiles(tempDir));

        assertEquals(FairwayDataException.NO_INPUT_FILES, ex.getErrorCode());
    }

    @Test
    void sectionConnectsFirstAndLastReferencingNode() {
        MultiFileGraphBuilder.BuildResult result = builder.build(createNodes(), createSections());

        FairwayGraph graph = result.graph;
        GraphEdge s1 = graph.getEdge("DE_J1", "DE_J2");
        assertNotNull(s1);
        assertEquals("S1", s1.get(Attributes.SECTION_REF));
        assertEquals("Rhein", s1.get("name"));
        assertFalse(s1.isBorder());
        assertTrue(s1.getLengthMeters() > 0);

        GraphNode j1 = graph.getNode("DE_J1");
        assertEquals("DE", j1.getCountryCode());
        assertEquals(6.10, j1.getPoint().getX());
    }

    @Test
    void borderPointCreatesBorderLink() {
        MultiFileGraphBuilder.BuildResult result = builder.build(createNodes(), createSections());

        GraphEdge link = result.graph.getEdge("DE_J2", "NL_N9");
        assertNotNull(link);
        assertTrue(link.isBorder());
        assertEquals("NLLOB00009", link.get(MultiFileGraphBuilder.BORDER_POINT));
        assertEquals(2, link.getGeometry().getNumPoints());
        assertEquals(1, result.borderLinks);
        // Border link joins both countries into one component
        assertEquals(1, result.componentCount);
    }

    @Test
    void countsIrregularAndUnreferencedSections() {
        FeatureTable nodes = builder.concatNodes(List.of(table("Node_DE_0.geojson",
                createNode("DEKLE00001", "A", "S3", null, 6.0, 51.8),
                createNode("DEKLE00002", "B", "S4", null, 6.1, 51.8),
                createNode("DEKLE00003", "C", "S4", null, 6.2, 51.8),
                createNode("DEKLE00004", "D", "S4", null, 6.3, 51.8))));
        FeatureTable sections = builder.concatSections(List.of(table("FairwaySection_DE_0.geojson",
                record(line(6.0, 51.8, 6.05, 51.8), "code", "S3"),
                record(line(6.1, 51.8, 6.3, 51.8), "code", "S4"),
                record(line(7.0, 51.8, 7.1, 51.8), "code", "S5"))));

        MultiFileGraphBuilder.BuildResult result = builder.build(nodes, sections);

        // S3 has one node, S4 has three
        assertEquals(2, result.irregularSections);
        assertEquals(1, result.unreferencedSections);
        assertEquals(1, result.sectionEdges);
        assertTrue(result.graph.hasEdge("DE_B", "DE_D"));
        assertFalse(result.graph.hasNode("DE_A"));
    }

    @Test
    void missingSectionReferenceYieldsNoEdges() {
        FeatureTable nodes = builder.concatNodes(List.of(table("Node_DE_0.geojson",
                record(point(6.0, 51.8), "locode", "DEKLE00001", "objectcode", "A"))));

        MultiFileGraphBuilder.BuildResult result = builder.build(nodes, createSections());

        assertEquals(0, result.graph.edgeCount());
        assertEquals(0, result.sectionEdges);
    }

    private FeatureTable createNodes() {
        return builder.concatNodes(List.of(
                table("Node_DE_0.geojson",
                        createNode("DEKLE00001", "J1", "S1", null, 6.10, 51.80),
                        createNode("DEKLE00002", "J2", "S1", "NLLOB00009", 6.15, 51.84)),
                table("Node_NL_0.geojson",
                        createNode("NLLOB00009", "N9", "S2", null, 6.1502, 51.8402),
                        createNode("NLLOB00008", "N8", "S2", null, 6.00, 51.88))));
    }

    private FeatureTable createSections() {
        return builder.concatSections(List.of(
                table("FairwaySection_DE_0.geojson",
                        record(line(6.10, 51.80, 6.15, 51.84), "code", "S1", "name", "Rhein")),
                table("FairwaySection_NL_0.geojson",
                        record(line(6.1502, 51.8402, 6.00, 51.88), "code", "S2", "name", "Bovenrijn"))));
    }

    private static FeatureRecord createNode(String locode, String objectCode, String sectionRef,
                                            String borderPoint, double lon, double lat) {
        return record(point(lon, lat),
                "locode", locode,
                "objectcode", objectCode,
                "sectionref", sectionRef,
                "borderpoint", borderPoint);
    }
}
