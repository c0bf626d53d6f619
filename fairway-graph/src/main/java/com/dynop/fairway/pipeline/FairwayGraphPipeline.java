package com.dynop.fairway.pipeline;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.dynop.fairway.FairwayDataException;
import com.dynop.fairway.config.FairwayGraphConfiguration;
import com.dynop.fairway.enrich.AttributeEnricher;
import com.dynop.fairway.enrich.SectionAttributeTable;
import com.dynop.fairway.geo.GeometryProjector;
import com.dynop.fairway.graph.FairwayGraph;
import com.dynop.fairway.graph.builder.MultiFileGraphBuilder;
import com.dynop.fairway.graph.builder.SectionGraphBuilder;
import com.dynop.fairway.integrate.BorderConnection;
import com.dynop.fairway.integrate.BorderStitcher;
import com.dynop.fairway.integrate.GraphMerger;
import com.dynop.fairway.io.GeoJsonFeatureReader;
import com.dynop.fairway.schema.SchemaMapper;
import com.dynop.fairway.table.FeatureTable;
import com.dynop.fairway.validation.GraphValidator;
import com.dynop.fairway.validation.ValidationReport;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Runs the whole integration in order:
 * <ol>
 *   <li>Build the primary graph from its section and junction tables</li>
 *   <li>Enrich primary edges with the auxiliary datasets</li>
 *   <li>Build the secondary graph from its per-region node and section tables</li>
 *   <li>Enrich secondary edges with sailing speeds</li>
 *   <li>Find border connections</li>
 *   <li>Merge both graphs</li>
 *   <li>Rename legacy attributes</li>
 *   <li>Validate the merged graph</li>
 * </ol>
 *
 * <p>Every stage owns the graph it produces until it hands it to the next one; the run is
 * single-threaded.
 */
public final class FairwayGraphPipeline {

    private static final Logger LOGGER = Logger.getLogger(FairwayGraphPipeline.class.getName());

    public static final String JUNCTION_DATASET = "sectionjunction";

    private final SectionGraphBuilder sectionGraphBuilder;
    private final MultiFileGraphBuilder multiFileGraphBuilder;
    private final AttributeEnricher enricher;
    private final BorderStitcher stitcher;
    private final GraphMerger merger;
    private final SchemaMapper schemaMapper;
    private final GraphValidator validator;
    private final GeoJsonFeatureReader reader;
    private final Timer runLatency;
    private final Meter borderConnections;

    public FairwayGraphPipeline(FairwayGraphConfiguration configuration) {
        this(configuration, new MetricRegistry());
    }

    /**
     * Creates a pipeline wired from configuration.
     *
     * @param metrics Registry receiving {@code fairway.pipeline.latency} and
     *                {@code fairway.pipeline.border_connections}
     * @throws FairwayDataException with code {@code INVALID_CRS} if the projected CRS is unknown
     */
    public FairwayGraphPipeline(FairwayGraphConfiguration configuration, MetricRegistry metrics) {
        Objects.requireNonNull(metrics, "metrics");
        this.runLatency = metrics.timer("fairway.pipeline.latency");
        this.borderConnections = metrics.meter("fairway.pipeline.border_connections");
        FairwayGraphConfiguration.Integration integration = configuration.getIntegration();
        this.reader = new GeoJsonFeatureReader();
        this.sectionGraphBuilder = new SectionGraphBuilder();
        this.multiFileGraphBuilder = new MultiFileGraphBuilder(reader);
        this.enricher = new AttributeEnricher(configuration.getEnrichment());
        this.stitcher = new BorderStitcher(
                GeometryProjector.fromWgs84(integration.getProjectedCrs()),
                integration.getHomeCountry(),
                integration.getDistanceThreshold());
        this.merger = new GraphMerger(
                integration.getPrimarySource(),
                integration.getSecondarySource(),
                integration.getHomeCountry(),
                configuration.getExclusions());
        this.schemaMapper = new SchemaMapper(configuration.getSchema());
        this.validator = new GraphValidator(configuration.getSchema(), configuration.getValidation());
    }

    /**
     * Run with the secondary network read from its per-region GeoJSON export.
     *
     * @param primaryDatasets    Primary tables by dataset name ({@code section}, {@code sectionjunction}, auxiliary datasets)
     * @param secondaryDirectory Directory with {@code Node_*}, {@code FairwaySection_*} and optional {@code SailingSpeed_*} files
     * @throws IOException if a file cannot be read
     */
    public Result run(Map<String, FeatureTable> primaryDatasets, Path secondaryDirectory) throws IOException {
        FeatureTable nodes = multiFileGraphBuilder.loadNodeFiles(secondaryDirectory);
        FeatureTable sections = multiFileGraphBuilder.loadSectionFiles(secondaryDirectory);
        FeatureTable sailingSpeed = enricher.loadSailingSpeed(reader, secondaryDirectory);
        return run(primaryDatasets, nodes, sections, sailingSpeed);
    }

    /**
     * Run over tables that are already loaded.
     *
     * @param primaryDatasets   Primary tables by dataset name ({@code section}, {@code sectionjunction}, auxiliary datasets)
     * @param secondaryNodes    Concatenated secondary node table, see {@link MultiFileGraphBuilder#concatNodes}
     * @param secondarySections Concatenated secondary section table
     * @param sailingSpeed      Secondary sailing speed rows, may be empty
     * @return All intermediate and final artefacts
     * @throws FairwayDataException if a required dataset or column is missing
     */
    public Result run(Map<String, FeatureTable> primaryDatasets, FeatureTable secondaryNodes,
                      FeatureTable secondarySections, FeatureTable sailingSpeed) {
        Timer.Context timerContext = runLatency.time();
        try {
            return execute(primaryDatasets, secondaryNodes, secondarySections, sailingSpeed);
        } finally {
            timerContext.stop();
        }
    }

    private Result execute(Map<String, FeatureTable> primaryDatasets, FeatureTable secondaryNodes,
                           FeatureTable secondarySections, FeatureTable sailingSpeed) {
        long startTime = System.currentTimeMillis();

        // Step 1: primary graph
        FeatureTable primarySections = require(primaryDatasets, AttributeEnricher.SECTION_DATASET);
        FeatureTable primaryJunctions = require(primaryDatasets, JUNCTION_DATASET);
        SectionGraphBuilder.BuildResult primaryBuild = sectionGraphBuilder.build(primarySections, primaryJunctions);

        // Step 2: primary enrichment
        SectionAttributeTable enrichment = enricher.buildSectionEnrichment(primaryDatasets);
        enricher.enrichGraph(primaryBuild.graph, primaryBuild.filteredSections, enrichment);

        // Step 3: secondary graph
        MultiFileGraphBuilder.BuildResult secondaryBuild = multiFileGraphBuilder.build(secondaryNodes, secondarySections);

        // Step 4: secondary enrichment
        enricher.enrichWithSailingSpeed(secondaryBuild.graph, Objects.requireNonNull(sailingSpeed, "sailingSpeed"));

        // Step 5: stitching
        List<BorderConnection> connections = stitcher.findConnections(primaryBuild.graph, secondaryBuild.graph);
        borderConnections.mark(connections.size());

        // Step 6: merge
        FairwayGraph merged = merger.merge(primaryBuild.graph, secondaryBuild.graph, connections);

        // Step 7: schema
        schemaMapper.apply(merged);

        // Step 8: validation
        ValidationReport report = validator.validate(merged);

        long duration = System.currentTimeMillis() - startTime;
        LOGGER.info(() -> String.format("Fairway graph pipeline completed in %d ms: %d nodes, %d edges, %d border connections",
                duration, merged.nodeCount(), merged.edgeCount(), connections.size()));

        return new Result(primaryBuild, secondaryBuild, connections, merged, report);
    }

    private static FeatureTable require(Map<String, FeatureTable> datasets, String name) {
        FeatureTable table = datasets.get(name);
        if (table == null) {
            throw new FairwayDataException(FairwayDataException.MISSING_DATASET, name, "Required dataset not supplied");
        }
        return table;
    }

    /**
     * Artefacts of one run.
     */
    public static class Result {
        public final SectionGraphBuilder.BuildResult primary;
        public final MultiFileGraphBuilder.BuildResult secondary;
        public final List<BorderConnection> connections;
        public final FairwayGraph merged;
        public final ValidationReport report;

        public Result(SectionGraphBuilder.BuildResult primary, MultiFileGraphBuilder.BuildResult secondary,
                      List<BorderConnection> connections, FairwayGraph merged, ValidationReport report) {
            this.primary = primary;
            this.secondary = secondary;
            this.connections = List.copyOf(connections);
            this.merged = merged;
            this.report = report;
        }
    }
}
