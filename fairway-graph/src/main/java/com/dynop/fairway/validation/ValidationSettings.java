package com.dynop.fairway.validation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Baselines the merged graph is checked against.
 */
public final class ValidationSettings {

    /**
     * Border connections found in the reference build.
     */
    public static final int DEFAULT_EXPECTED_BORDER_CONNECTIONS = 14;

    private final int expectedBorderConnections;
    private final List<CriticalConnection> criticalConnections;

    @JsonCreator
    public ValidationSettings(
            @JsonProperty("expectedBorderConnections") Integer expectedBorderConnections,
            @JsonProperty("criticalConnections") List<CriticalConnection> criticalConnections) {
        this.expectedBorderConnections = expectedBorderConnections != null
                ? expectedBorderConnections : DEFAULT_EXPECTED_BORDER_CONNECTIONS;
        this.criticalConnections = criticalConnections != null ? List.copyOf(criticalConnections) : List.of();
    }

    public static ValidationSettings defaults() {
        return new ValidationSettings(null, null);
    }

    @JsonProperty("expectedBorderConnections")
    public int getExpectedBorderConnections() {
        return expectedBorderConnections;
    }

    @JsonProperty("criticalConnections")
    public List<CriticalConnection> getCriticalConnections() {
        return criticalConnections;
    }
}
