package com.dynop.fairway.validation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Result of {@link GraphValidator#validate}.
 *
 * <p>Serialises to:
 * <pre>{@code
 * {
 *   "statistics": { ... },
 *   "border_integrity": { ... },
 *   "schema_compliance": { "nodes": { ... }, "edges": { ... } },
 *   "critical_connections": { "checks": [ ... ] }
 * }
 * }</pre>
 */
public final class ValidationReport {

    private final GraphStatistics statistics;
    private final BorderIntegrity borderIntegrity;
    private final SchemaCompliance schemaCompliance;
    private final List<ConnectionCheck> criticalConnections;

    public ValidationReport(GraphStatistics statistics, BorderIntegrity borderIntegrity,
                            SchemaCompliance schemaCompliance, List<ConnectionCheck> criticalConnections) {
        this.statistics = statistics;
        this.borderIntegrity = borderIntegrity;
        this.schemaCompliance = schemaCompliance;
        this.criticalConnections = List.copyOf(criticalConnections);
    }

    @JsonCreator
    static ValidationReport fromJson(
            @JsonProperty("statistics") GraphStatistics statistics,
            @JsonProperty("border_integrity") BorderIntegrity borderIntegrity,
            @JsonProperty("schema_compliance") SchemaCompliance schemaCompliance,
            @JsonProperty("critical_connections") Map<String, List<ConnectionCheck>> criticalConnections) {
        List<ConnectionCheck> checks = criticalConnections != null ? criticalConnections.get("checks") : null;
        return new ValidationReport(statistics, borderIntegrity, schemaCompliance, checks != null ? checks : List.of());
    }

    @JsonProperty("statistics")
    public GraphStatistics getStatistics() {
        return statistics;
    }

    @JsonProperty("border_integrity")
    public BorderIntegrity getBorderIntegrity() {
        return borderIntegrity;
    }

    @JsonProperty("schema_compliance")
    public SchemaCompliance getSchemaCompliance() {
        return schemaCompliance;
    }

    @JsonIgnore
    public List<ConnectionCheck> getCriticalConnections() {
        return criticalConnections;
    }

    @JsonProperty("critical_connections")
    Map<String, List<ConnectionCheck>> getCriticalConnectionsJson() {
        return Map.of("checks", criticalConnections);
    }

    /**
     * @return true when border integrity and every critical connection passed
     */
    @JsonIgnore
    public boolean isPassing() {
        if (borderIntegrity.getStatus() != ValidationStatus.PASS) {
            return false;
        }
        for (ConnectionCheck check : criticalConnections) {
            if (check.getStatus() != ValidationStatus.PASS) {
                return false;
            }
        }
        return true;
    }
}
