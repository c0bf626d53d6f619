package com.dynop.fairway.config;

import com.dynop.fairway.enrich.EnrichmentSource;
import com.dynop.fairway.geo.GeometryProjector;
import com.dynop.fairway.integrate.BorderStitcher;
import com.dynop.fairway.integrate.MergeExclusions;
import com.dynop.fairway.schema.SchemaMapping;
import com.dynop.fairway.validation.ValidationSettings;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

/**
 * Settings of a fairway graph build, read from YAML.
 *
 * <pre>{@code
 * integration:
 *   homeCountry: NL
 *   projectedCrs: EPSG:32631
 *   distanceThreshold: 100.0
 *   primarySource: FIS
 *   secondarySource: EURIS
 * exclusions:
 *   prunedNodeIds: [22637860, 22638030]
 *   prunedEdgeIds: [22638449]
 * validation:
 *   expectedBorderConnections: 14
 *   criticalConnections:
 *     - name: Lobith Connection
 *       nodeId: "22638200"
 * schema:
 *   nodes: { Name: name }
 *   edges: { Id: id }
 * }</pre>
 *
 * <p>Sections left out of the file fall back to their defaults. {@code enrichment} may list
 * custom auxiliary datasets; when absent the national export's datasets are used.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class FairwayGraphConfiguration {

    private static final Logger LOGGER = Logger.getLogger(FairwayGraphConfiguration.class.getName());

    public static final String DEFAULT_RESOURCE = "/fairway-graph.yml";

    @JsonProperty("integration")
    private Integration integration = new Integration();

    @JsonProperty("exclusions")
    private MergeExclusions exclusions = MergeExclusions.none();

    @JsonProperty("validation")
    private ValidationSettings validation = ValidationSettings.defaults();

    @JsonProperty("schema")
    private SchemaMapping schema = SchemaMapping.empty();

    @JsonProperty("enrichment")
    private List<EnrichmentSource> enrichment;

    /**
     * Reads a configuration file.
     *
     * @throws IOException if the file cannot be read or parsed
     */
    public static FairwayGraphConfiguration load(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            FairwayGraphConfiguration configuration = read(in);
            LOGGER.info(() -> "Loaded configuration from " + file);
            return configuration;
        }
    }

    /**
     * Reads the configuration bundled on the classpath.
     *
     * @throws IOException if the resource is missing or cannot be parsed
     */
    public static FairwayGraphConfiguration loadDefault() throws IOException {
        try (InputStream in = FairwayGraphConfiguration.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IOException("Configuration resource not found: " + DEFAULT_RESOURCE);
            }
            return read(in);
        }
    }

    private static FairwayGraphConfiguration read(InputStream in) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        FairwayGraphConfiguration configuration = mapper.readValue(in, FairwayGraphConfiguration.class);
        return configuration != null ? configuration : new FairwayGraphConfiguration();
    }

    public Integration getIntegration() {
        return integration;
    }

    public void setIntegration(Integration integration) {
        this.integration = integration != null ? integration : new Integration();
    }

    public MergeExclusions getExclusions() {
        return exclusions;
    }

    public void setExclusions(MergeExclusions exclusions) {
        this.exclusions = exclusions != null ? exclusions : MergeExclusions.none();
    }

    public ValidationSettings getValidation() {
        return validation;
    }

    public void setValidation(ValidationSettings validation) {
        this.validation = validation != null ? validation : ValidationSettings.defaults();
    }

    public SchemaMapping getSchema() {
        return schema;
    }

    public void setSchema(SchemaMapping schema) {
        this.schema = schema != null ? schema : SchemaMapping.empty();
    }

    /**
     * @return Configured auxiliary datasets, or the national export's defaults
     */
    public List<EnrichmentSource> getEnrichment() {
        return enrichment != null && !enrichment.isEmpty() ? enrichment : EnrichmentSource.defaultFisSources();
    }

    public void setEnrichment(List<EnrichmentSource> enrichment) {
        this.enrichment = enrichment;
    }

    /**
     * How the two networks are stitched and tagged.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Integration {

        @JsonProperty("homeCountry")
        private String homeCountry = "NL";

        @JsonProperty("projectedCrs")
        private String projectedCrs = GeometryProjector.DEFAULT_METRIC_CRS;

        @JsonProperty("distanceThreshold")
        private double distanceThreshold = BorderStitcher.DEFAULT_DISTANCE_THRESHOLD;

        @JsonProperty("primarySource")
        private String primarySource = "FIS";

        @JsonProperty("secondarySource")
        private String secondarySource = "EURIS";

        public String getHomeCountry() {
            return homeCountry;
        }

        public void setHomeCountry(String homeCountry) {
            this.homeCountry = homeCountry;
        }

        /**
         * @return Metric CRS used for stitching distances (e.g., "EPSG:32631")
         */
        public String getProjectedCrs() {
            return projectedCrs;
        }

        public void setProjectedCrs(String projectedCrs) {
            this.projectedCrs = projectedCrs;
        }

        /**
         * @return Maximum bridgehead match distance in metres (exclusive)
         */
        public double getDistanceThreshold() {
            return distanceThreshold;
        }

        public void setDistanceThreshold(double distanceThreshold) {
            this.distanceThreshold = distanceThreshold;
        }

        public String getPrimarySource() {
            return primarySource;
        }

        public void setPrimarySource(String primarySource) {
            this.primarySource = primarySource;
        }

        public String getSecondarySource() {
            return secondarySource;
        }

        public void setSecondarySource(String secondarySource) {
            this.secondarySource = secondarySource;
        }
    }
}
