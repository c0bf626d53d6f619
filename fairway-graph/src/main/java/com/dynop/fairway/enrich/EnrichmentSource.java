package com.dynop.fairway.enrich;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One auxiliary dataset joined onto sections.
 *
 * <p>Besides the plain prefixed columns a source can declare aliases (copy a prefixed
 * column under a second name) and a flag column: when set, the matched columns are dropped
 * and every section with a route reference gets a boolean telling whether it matched.
 * A flag source whose dataset is present but matches nothing (no route columns, no
 * overlaps) still sets the flag to {@code false} on every such section; only an absent or
 * empty dataset leaves the column out.
 */
public final class EnrichmentSource {

    private final String dataset;
    private final MatchStrategy strategy;
    private final List<String> columns;
    private final String prefix;
    private final boolean required;
    private final Map<String, String> aliases;
    private final String flagColumn;

    /**
     * @param dataset    Dataset name, e.g. {@code maximumdimensions}
     * @param strategy   Join strategy
     * @param columns    Columns to copy
     * @param prefix     Prefix for copied columns
     * @param required   Whether the run fails when the dataset is absent
     * @param aliases    Prefixed column name to alias name, may be null
     * @param flagColumn Boolean column replacing the copied columns, may be null. Set to
     *                   {@code false} on unmatched sections whenever the dataset has rows
     */
    @JsonCreator
    public EnrichmentSource(
            @JsonProperty("dataset") String dataset,
            @JsonProperty("strategy") MatchStrategy strategy,
            @JsonProperty("columns") List<String> columns,
            @JsonProperty("prefix") String prefix,
            @JsonProperty("required") boolean required,
            @JsonProperty("aliases") Map<String, String> aliases,
            @JsonProperty("flagColumn") String flagColumn) {
        this.dataset = Objects.requireNonNull(dataset, "dataset");
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.columns = columns != null ? List.copyOf(columns) : List.of();
        this.prefix = prefix != null ? prefix : "";
        this.required = required;
        this.aliases = aliases != null ? Map.copyOf(aliases) : Map.of();
        this.flagColumn = flagColumn;
    }

    /**
     * Auxiliary datasets of the national fairway information system export.
     */
    public static List<EnrichmentSource> defaultFisSources() {
        return List.of(
                new EnrichmentSource("maximumdimensions", MatchStrategy.GEOMETRY, List.of(
                        "GeneralDepth", "GeneralLength", "GeneralWidth", "GeneralHeight",
                        "SeaFairingDepth", "SeaFairingLength", "SeaFairingWidth", "SeaFairingHeight",
                        "PushedDepth", "PushedLength", "PushedWidth",
                        "CoupledDepth", "CoupledLength", "CoupledWidth"),
                        "dim_", true, null, null),
                new EnrichmentSource("navigability", MatchStrategy.GEOMETRY,
                        List.of("Classification", "Code", "Description"),
                        "nav_", true, Map.of("nav_Code", "cemt_class"), null),
                new EnrichmentSource("navigationspeed", MatchStrategy.ROUTE_KM,
                        List.of("Speed", "MaxSpeedUp", "MaxSpeedDown", "CalibratedSpeedUp", "CalibratedSpeedDown"),
                        "speed_", false, null, null),
                new EnrichmentSource("fairwaydepth", MatchStrategy.ROUTE_KM,
                        List.of("MinimalDepthLowerLimit", "MinimalDepthUpperLimit", "ReferenceLevel"),
                        "depth_", false, null, null),
                new EnrichmentSource("fairwaytype", MatchStrategy.ROUTE_KM,
                        List.of("CharacterTypeCode"),
                        "type_", false, null, null),
                new EnrichmentSource("tidalarea", MatchStrategy.ROUTE_KM,
                        List.of("Name"),
                        "tidal_", false, null, "is_tidal"));
    }

    public String getDataset() {
        return dataset;
    }

    public MatchStrategy getStrategy() {
        return strategy;
    }

    public List<String> getColumns() {
        return columns;
    }

    public String getPrefix() {
        return prefix;
    }

    public boolean isRequired() {
        return required;
    }

    public Map<String, String> getAliases() {
        return aliases;
    }

    /**
     * @return Boolean column name, or null for a plain source. The column is written for
     * every section with a route reference once the dataset has rows, matched or not
     */
    public String getFlagColumn() {
        return flagColumn;
    }

    @Override
    public String toString() {
        return String.format("EnrichmentSource{dataset='%s', strategy=%s, prefix='%s', required=%s}",
                dataset, strategy, prefix, required);
    }
}
