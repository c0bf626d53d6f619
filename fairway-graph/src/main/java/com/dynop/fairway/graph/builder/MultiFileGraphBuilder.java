package com.dynop.fairway.graph.builder;

import com.dynop.fairway.FairwayDataException;
import com.dynop.fairway.geo.GeometryKeys;
import com.dynop.fairway.graph.Attributes;
import com.dynop.fairway.graph.ConnectedComponents;
import com.dynop.fairway.graph.EdgeKey;
import com.dynop.fairway.graph.FairwayGraph;
import com.dynop.fairway.graph.GraphEdge;
import com.dynop.fairway.graph.GraphNode;
import com.dynop.fairway.io.GeoJsonFeatureReader;
import com.dynop.fairway.table.FeatureRecord;
import com.dynop.fairway.table.FeatureTable;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Point;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the graph of the multi-region network from its per-country node and section files.
 *
 * <p>The export has no explicit section endpoints. Nodes reference the section they lie on
 * through {@code sectionref}; the first and last node referencing a section code (in node
 * table order) become the endpoints of its edge. Nodes on a national border name the node
 * across the border through {@code borderpoint}, which is resolved against {@code locode}
 * into an extra straight-line edge flagged {@code is_border}.
 *
 * <h2>Node ids</h2>
 * <p>Object codes are only unique per country, so nodes get the composite id
 * {@code <cc>_<objectcode>}, where {@code cc} is the first two characters of the
 * {@code locode}. The country from the file name is kept as {@code countrycode_path}; file
 * names and locodes do not always agree.
 *
 * <h2>Irregular sections</h2>
 * <p>A section referenced by exactly one node yields no edge. A section referenced by more
 * than two nodes is connected between its first and last node. Both cases are counted in
 * the {@link BuildResult}.
 */
public final class MultiFileGraphBuilder {

    private static final Logger LOGGER = Logger.getLogger(MultiFileGraphBuilder.class.getName());

    public static final String NODE_GLOB = "Node_*.geojson";
    public static final String SECTION_GLOB = "FairwaySection_*.geojson";

    public static final String PATH = "path";
    public static final String LOCODE = "locode";
    public static final String OBJECT_CODE = "objectcode";
    public static final String SECTION_CODE = "code";
    public static final String BORDER_POINT = "borderpoint";
    public static final String COUNTRY_CODE_LOCODE = "countrycode_locode";
    public static final String COUNTRY_CODE_PATH = "countrycode_path";

    private static final Pattern NODE_FILE = Pattern.compile("Node_(?<countrycode>[A-Z]+)_\\d+\\.geojson");
    private static final String GEOMETRY_KEY = "\u0000geometry";

    private final GeoJsonFeatureReader reader;
    private final GeometryFactory geometryFactory = new GeometryFactory();

    public MultiFileGraphBuilder() {
        this(new GeoJsonFeatureReader());
    }

    public MultiFileGraphBuilder(GeoJsonFeatureReader reader) {
        this.reader = Objects.requireNonNull(reader, "reader");
    }

    /**
     * Reads and concatenates every {@code Node_*.geojson} file in a directory.
     *
     * @throws FairwayDataException with code {@code NO_INPUT_FILES} when there are none
     * @throws IOException          if a file cannot be read
     */
    public FeatureTable loadNodeFiles(Path directory) throws IOException {
        return concatNodes(reader.readAll(directory, NODE_GLOB));
    }

    /**
     * Reads and concatenates every {@code FairwaySection_*.geojson} file in a directory.
     *
     * @throws FairwayDataException with code {@code NO_INPUT_FILES} when there are none
     * @throws IOException          if a file cannot be read
     */
    public FeatureTable loadSectionFiles(Path directory) throws IOException {
        return concatSections(reader.readAll(directory, SECTION_GLOB));
    }

    /**
     * Concatenates per-region node tables, removes duplicates and derives node ids.
     *
     * @param files One table per node file, named after the file
     * @return Node table with {@code path}, {@code countrycode}, {@code countrycode_path} and
     *         {@code node_id} columns
     * @throws FairwayDataException if no files are given or {@code locode}/{@code objectcode} is missing
     */
    public FeatureTable concatNodes(List<FeatureTable> files) {
        FeatureTable nodes = concatDistinct("nodes", files);
        nodes.requireColumns(LOCODE, OBJECT_CODE);

        List<FeatureRecord> withIds = new ArrayList<>(nodes.size());
        int withoutLocode = 0;
        for (FeatureRecord record : nodes.getRecords()) {
            String locode = record.getString(LOCODE);
            String objectCode = record.getId(OBJECT_CODE);
            if (locode == null || objectCode == null) {
                withoutLocode++;
                continue;
            }
            String countryCode = locode.length() > 2 ? locode.substring(0, 2) : locode;
            Matcher m = NODE_FILE.matcher(String.valueOf(record.get(PATH)));
            withIds.add(record
                    .withProperty(COUNTRY_CODE_LOCODE, countryCode)
                    .withProperty(COUNTRY_CODE_PATH, m.matches() ? m.group("countrycode") : null)
                    .withProperty(Attributes.COUNTRY_CODE, countryCode)
                    .withProperty(Attributes.NODE_ID, countryCode + "_" + objectCode));
        }
        if (withoutLocode > 0) {
            LOGGER.warning(String.format("Skipped %d nodes without locode or objectcode", withoutLocode));
        }
        return new FeatureTable(nodes.getName(), withIds);
    }

    /**
     * Concatenates per-region section tables and removes duplicates.
     *
     * @param files One table per section file, named after the file
     * @return Section table with a {@code path} column
     * @throws FairwayDataException if no files are given
     */
    public FeatureTable concatSections(List<FeatureTable> files) {
        return concatDistinct("sections", files);
    }

    /**
     * Build the graph from concatenated node and section tables.
     *
     * @param nodes    Output of {@link #concatNodes(List)}
     * @param sections Output of {@link #concatSections(List)}
     * @return BuildResult containing the graph and build statistics
     */
    public BuildResult build(FeatureTable nodes, FeatureTable sections) {
        FairwayGraph graph = new FairwayGraph();

        // Step 1: section edges from node references
        int sectionEdges = 0;
        int irregularSections = 0;
        int unreferencedSections = 0;
        if (!nodes.hasColumn(Attributes.SECTION_REF) || !sections.hasColumn(SECTION_CODE)) {
            LOGGER.warning(String.format("Cannot join sections to nodes: '%s' on nodes or '%s' on sections missing",
                    Attributes.SECTION_REF, SECTION_CODE));
        } else {
            Map<String, List<String>> nodesBySection = new LinkedHashMap<>();
            for (FeatureRecord node : nodes.getRecords()) {
                String sectionRef = node.getId(Attributes.SECTION_REF);
                if (sectionRef != null) {
                    nodesBySection.computeIfAbsent(sectionRef, k -> new ArrayList<>())
                            .add(node.getString(Attributes.NODE_ID));
                }
            }
            LOGGER.info(() -> String.format("Building graph from %d sections...", sections.size()));
            for (FeatureRecord section : sections.getRecords()) {
                String code = section.getId(SECTION_CODE);
                List<String> referencing = code != null ? nodesBySection.get(code) : null;
                if (referencing == null) {
                    unreferencedSections++;
                    continue;
                }
                String source = referencing.get(0);
                String target = referencing.get(referencing.size() - 1);
                if (referencing.size() != 2) {
                    irregularSections++;
                    LOGGER.fine(() -> String.format("Section %s is referenced by %d nodes", code, referencing.size()));
                }
                if (source.equals(target)) {
                    continue;
                }
                Map<String, Object> attributes = new LinkedHashMap<>(section.getProperties());
                attributes.put(Attributes.GEOMETRY, section.getGeometry());
                attributes.put(Attributes.SECTION_REF, code);
                graph.addEdge(source, target, attributes);
                sectionEdges++;
            }
        }

        // Step 2: node attributes for nodes on an edge
        LOGGER.info(() -> String.format("Updating node information for %d nodes...", nodes.size()));
        Map<String, List<String>> nodeIdsByLocode = new LinkedHashMap<>();
        for (FeatureRecord record : nodes.getRecords()) {
            String nodeId = record.getString(Attributes.NODE_ID);
            String locode = record.getString(LOCODE);
            if (locode != null) {
                nodeIdsByLocode.computeIfAbsent(locode, k -> new ArrayList<>()).add(nodeId);
            }
            GraphNode node = graph.getNode(nodeId);
            if (node == null) {
                continue;
            }
            node.getAttributes().putAll(record.getProperties());
            node.set(Attributes.GEOMETRY, record.getGeometry());
        }

        // Step 3: border links
        LOGGER.info("Connecting border nodes...");
        Set<EdgeKey> borderKeys = new HashSet<>();
        int skippedBorderLinks = 0;
        if (nodes.hasColumn(BORDER_POINT)) {
            for (FeatureRecord record : nodes.getRecords()) {
                String borderPoint = record.getString(BORDER_POINT);
                if (borderPoint == null) {
                    continue;
                }
                String source = record.getString(Attributes.NODE_ID);
                for (String target : nodeIdsByLocode.getOrDefault(borderPoint, List.of())) {
                    if (source.equals(target)) {
                        continue;
                    }
                    if (!graph.hasNode(source) || !graph.hasNode(target)) {
                        skippedBorderLinks++;
                        continue;
                    }
                    Map<String, Object> attributes = new LinkedHashMap<>();
                    attributes.put(BORDER_POINT, borderPoint);
                    attributes.put(LOCODE, borderPoint);
                    attributes.put(Attributes.GEOMETRY, straightLine(graph.getNode(source), graph.getNode(target)));
                    graph.addEdge(source, target, attributes);
                    borderKeys.add(EdgeKey.of(source, target));
                }
            }
        }
        for (GraphEdge edge : graph.getEdges()) {
            edge.set(Attributes.IS_BORDER, borderKeys.contains(edge.getKey()));
        }
        int borderLinks = borderKeys.size();
        LOGGER.info(() -> String.format("Found %d border connections", borderLinks));
        if (skippedBorderLinks > 0) {
            LOGGER.warning(String.format("Skipped %d border links to nodes outside the graph", skippedBorderLinks));
        }
        if (irregularSections > 0) {
            LOGGER.warning(String.format("%d sections are not referenced by exactly two nodes", irregularSections));
        }

        // Step 4: components
        LOGGER.info("Computing subgraphs...");
        int componentCount = ConnectedComponents.stamp(graph);

        // Step 5: lengths
        LOGGER.info("Computing edge lengths...");
        SectionGraphBuilder.computeLengths(graph);

        LOGGER.info(() -> String.format("Built multi-region graph: %d nodes, %d edges, %d components",
                graph.nodeCount(), graph.edgeCount(), componentCount));

        return new BuildResult(graph, sectionEdges, borderLinks, irregularSections, unreferencedSections,
                componentCount);
    }

    private FeatureTable concatDistinct(String name, List<FeatureTable> files) {
        if (files.isEmpty()) {
            throw new FairwayDataException(FairwayDataException.NO_INPUT_FILES, name, "No input files");
        }
        LOGGER.info(() -> String.format("Found %d %s files", files.size(), name));

        Set<Map<String, Object>> seen = new HashSet<>();
        List<FeatureRecord> kept = new ArrayList<>();
        int total = 0;
        for (FeatureTable file : files) {
            for (FeatureRecord record : file.getRecords()) {
                total++;
                Map<String, Object> identity = new LinkedHashMap<>(record.getProperties());
                identity.remove(PATH);
                identity.put(GEOMETRY_KEY, GeometryKeys.canonicalKey(record.getGeometry()));
                if (seen.add(identity)) {
                    kept.add(record.withProperty(PATH, file.getName()));
                }
            }
        }
        int duplicates = total - kept.size();
        LOGGER.info(() -> String.format("Removed %d duplicated %s, kept %d", duplicates, name, kept.size()));
        return new FeatureTable(name, kept);
    }

    private LineString straightLine(GraphNode from, GraphNode to) {
        Point a = from.getPoint();
        Point b = to.getPoint();
        if (a == null || b == null) {
            return null;
        }
        return geometryFactory.createLineString(new Coordinate[]{a.getCoordinate(), b.getCoordinate()});
    }

    /**
     * Result of the build process.
     */
    public static class BuildResult {
        public final FairwayGraph graph;
        public final int sectionEdges;
        public final int borderLinks;
        public final int irregularSections;
        public final int unreferencedSections;
        public final int componentCount;

        public BuildResult(FairwayGraph graph, int sectionEdges, int borderLinks, int irregularSections,
                           int unreferencedSections, int componentCount) {
            this.graph = graph;
            this.sectionEdges = sectionEdges;
            this.borderLinks = borderLinks;
            this.irregularSections = irregularSections;
            this.unreferencedSections = unreferencedSections;
            this.componentCount = componentCount;
        }
    }
}
