package com.dynop.fairway.enrich;

import com.dynop.fairway.FairwayDataException;
import com.dynop.fairway.graph.Attributes;
import com.dynop.fairway.graph.EdgeKey;
import com.dynop.fairway.graph.FairwayGraph;
import com.dynop.fairway.graph.GraphEdge;
import com.dynop.fairway.graph.builder.SectionGraphBuilder;
import com.dynop.fairway.io.GeoJsonFeatureReader;
import com.dynop.fairway.table.FeatureRecord;
import com.dynop.fairway.table.FeatureTable;
import com.dynop.fairway.table.Identifiers;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Adds auxiliary dataset attributes to graph edges.
 *
 * <p>Enrichment happens in two steps: {@link #buildSectionEnrichment(Map)} joins every
 * configured dataset onto the section table and produces one attribute row per section id;
 * {@link #enrichGraph(FairwayGraph, FeatureTable, SectionAttributeTable)} then resolves each
 * edge's endpoint pair back to its section id and merges that row into the edge.
 *
 * <p>The multi-region network has no route/km data; its sailing speeds are joined through
 * the section reference carried on each edge, see
 * {@link #enrichWithSailingSpeed(FairwayGraph, FeatureTable)}.
 */
public final class AttributeEnricher {

    private static final Logger LOGGER = Logger.getLogger(AttributeEnricher.class.getName());

    public static final String SECTION_DATASET = "section";
    public static final String SAILING_SPEED_GLOB = "SailingSpeed_*.geojson";
    public static final String SAILING_SPEED_PREFIX = "speed_";
    public static final List<String> SAILING_SPEED_COLUMNS = List.of("maxspeed", "calspeed", "direction", "shipcategory");

    private final List<EnrichmentSource> sources;

    public AttributeEnricher() {
        this(EnrichmentSource.defaultFisSources());
    }

    public AttributeEnricher(List<EnrichmentSource> sources) {
        this.sources = List.copyOf(Objects.requireNonNull(sources, "sources"));
    }

    /**
     * Joins all configured datasets onto the section table.
     *
     * @param datasets Dataset name to table; must contain {@code section} and every required source
     * @return Attributes per section id
     * @throws FairwayDataException with code {@code MISSING_DATASET} if a required dataset is absent
     */
    public SectionAttributeTable buildSectionEnrichment(Map<String, FeatureTable> datasets) {
        FeatureTable sections = datasets.get(SECTION_DATASET);
        if (sections == null) {
            throw new FairwayDataException(FairwayDataException.MISSING_DATASET, SECTION_DATASET,
                    "Required dataset not supplied");
        }
        sections.requireColumns(Attributes.ID);

        for (EnrichmentSource source : sources) {
            if (!datasets.containsKey(source.getDataset())) {
                if (source.isRequired()) {
                    throw new FairwayDataException(FairwayDataException.MISSING_DATASET, source.getDataset(),
                            "Required dataset not supplied");
                }
                LOGGER.warning("Optional dataset not supplied: " + source.getDataset());
            }
        }

        SectionAttributeTable enrichment = new SectionAttributeTable();
        for (EnrichmentSource source : sources) {
            FeatureTable data = datasets.get(source.getDataset());
            if (data == null) {
                continue;
            }
            SectionAttributeTable matched = source.getStrategy().matcher()
                    .match(sections, data, source.getColumns(), source.getPrefix());

            if (source.getFlagColumn() != null) {
                if (!data.isEmpty()) {
                    enrichment.putAll(toFlag(sections, matched, source.getFlagColumn()));
                }
                continue;
            }
            for (Map.Entry<String, String> alias : source.getAliases().entrySet()) {
                for (String sectionId : matched.getSectionIds()) {
                    matched.put(sectionId, alias.getValue(), matched.get(sectionId).get(alias.getKey()));
                }
            }
            enrichment.putAll(matched);
        }

        for (EnrichmentSource source : sources) {
            String marker = source.getFlagColumn() != null ? source.getFlagColumn() : source.getPrefix();
            int count = enrichment.countWithPrefix(marker);
            if (count > 0) {
                LOGGER.info(() -> String.format("Total sections with %s: %d", source.getDataset(), count));
            }
        }
        return enrichment;
    }

    /**
     * Merges section attributes into the edges built from those sections.
     *
     * <p>Edges are resolved to sections through their unordered endpoint pair. Only non-null
     * values are merged; edges without a matching section are left untouched.
     *
     * @param graph      Graph built by {@link SectionGraphBuilder}
     * @param sections   Section table with {@code Id}, {@code StartJunctionId}, {@code EndJunctionId}
     * @param enrichment Output of {@link #buildSectionEnrichment(Map)}
     * @return Number of edges that received attributes
     */
    public int enrichGraph(FairwayGraph graph, FeatureTable sections, SectionAttributeTable enrichment) {
        Map<EdgeKey, String> edgeToSection = new HashMap<>();
        for (FeatureRecord section : sections.getRecords()) {
            String start = section.getId(SectionGraphBuilder.START_JUNCTION_ID);
            String end = section.getId(SectionGraphBuilder.END_JUNCTION_ID);
            String id = section.getId(Attributes.ID);
            if (start != null && end != null && id != null) {
                edgeToSection.put(EdgeKey.of(start, end), id);
            }
        }
        LOGGER.info(() -> String.format("Built edge-to-section mapping with %d entries", edgeToSection.size()));

        int enriched = 0;
        for (GraphEdge edge : graph.getEdges()) {
            String sectionId = edgeToSection.get(edge.getKey());
            if (sectionId == null) {
                continue;
            }
            Map<String, Object> attributes = enrichment.get(sectionId);
            if (!attributes.isEmpty()) {
                edge.getAttributes().putAll(attributes);
                enriched++;
            }
        }
        int total = enriched;
        LOGGER.info(() -> String.format("Enriched %d / %d edges", total, graph.edgeCount()));
        return enriched;
    }

    /**
     * Reads and concatenates every {@code SailingSpeed_*.geojson} file in a directory,
     * tagging each row with the country from its file name.
     *
     * @return Combined table, empty (with a warning) when there are no files
     * @throws IOException if a file cannot be read
     */
    public FeatureTable loadSailingSpeed(GeoJsonFeatureReader reader, Path directory) throws IOException {
        List<FeatureTable> files;
        try {
            files = reader.readAll(directory, SAILING_SPEED_GLOB);
        } catch (FairwayDataException e) {
            if (!FairwayDataException.NO_INPUT_FILES.equals(e.getErrorCode())) {
                throw e;
            }
            LOGGER.warning("No sailing speed files found in " + directory);
            return FeatureTable.empty("sailingspeed");
        }
        List<FeatureRecord> rows = new ArrayList<>();
        for (FeatureTable file : files) {
            String[] parts = file.getName().split("_");
            String country = parts.length > 1 ? parts[1].replace(".geojson", "") : null;
            for (FeatureRecord row : file.getRecords()) {
                rows.add(row.withProperty("country", country));
            }
        }
        LOGGER.info(() -> String.format("Combined %d sailing speed records", rows.size()));
        return new FeatureTable("sailingspeed", rows);
    }

    /**
     * Adds sailing speed attributes to edges through their {@code sectionref}.
     *
     * @param graph        Multi-region graph
     * @param sailingSpeed Rows with {@code sectionref} and speed columns
     * @return Number of edges enriched
     */
    public int enrichWithSailingSpeed(FairwayGraph graph, FeatureTable sailingSpeed) {
        if (sailingSpeed.isEmpty() || !sailingSpeed.hasColumn(Attributes.SECTION_REF)) {
            LOGGER.warning("No sailing speed data or missing sectionref column");
            return 0;
        }
        List<String> available = new ArrayList<>();
        for (String column : SAILING_SPEED_COLUMNS) {
            if (sailingSpeed.hasColumn(column)) {
                available.add(column);
            }
        }

        Map<String, Map<String, Object>> lookup = new LinkedHashMap<>();
        for (FeatureRecord row : sailingSpeed.getRecords()) {
            String ref = row.getId(Attributes.SECTION_REF);
            if (ref == null || lookup.containsKey(ref)) {
                continue;
            }
            Map<String, Object> values = new LinkedHashMap<>();
            for (String column : available) {
                Object value = row.get(column);
                if (value != null) {
                    values.put(SAILING_SPEED_PREFIX + column, value);
                }
            }
            lookup.put(ref, values);
        }
        LOGGER.info(() -> String.format("Built speed lookup with %d sectionref entries", lookup.size()));

        int enriched = 0;
        for (GraphEdge edge : graph.getEdges()) {
            Map<String, Object> values = lookup.get(Identifiers.normalize(edge.get(Attributes.SECTION_REF)));
            if (values != null) {
                edge.getAttributes().putAll(values);
                enriched++;
            }
        }
        int total = enriched;
        LOGGER.info(() -> String.format("Enriched %d edges with sailing speed", total));
        return enriched;
    }

    private static SectionAttributeTable toFlag(FeatureTable sections, SectionAttributeTable matched, String flagColumn) {
        SectionAttributeTable flags = new SectionAttributeTable();
        for (FeatureRecord section : sections.getRecords()) {
            if (RouteKmMatcher.hasRouteReference(section)) {
                String sectionId = section.getId(Attributes.ID);
                flags.put(sectionId, flagColumn, matched.getSectionIds().contains(sectionId));
            }
        }
        return flags;
    }
}
