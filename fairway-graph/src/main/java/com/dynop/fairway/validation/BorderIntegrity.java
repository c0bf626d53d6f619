package com.dynop.fairway.validation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Border edges found in the merged graph compared with the expected baseline.
 */
public final class BorderIntegrity {

    private final int totalConnections;
    private final int expectedConnections;
    private final ValidationStatus status;
    private final double minGapMeters;
    private final double maxGapMeters;
    private final double avgGapMeters;
    private final List<Connection> connections;

    @JsonCreator
    public BorderIntegrity(
            @JsonProperty("total_connections") int totalConnections,
            @JsonProperty("expected_connections") int expectedConnections,
            @JsonProperty("status") ValidationStatus status,
            @JsonProperty("min_gap_meters") double minGapMeters,
            @JsonProperty("max_gap_meters") double maxGapMeters,
            @JsonProperty("avg_gap_meters") double avgGapMeters,
            @JsonProperty("connections") List<Connection> connections) {
        this.totalConnections = totalConnections;
        this.expectedConnections = expectedConnections;
        this.status = status;
        this.minGapMeters = minGapMeters;
        this.maxGapMeters = maxGapMeters;
        this.avgGapMeters = avgGapMeters;
        this.connections = List.copyOf(connections);
    }

    @JsonProperty("total_connections")
    public int getTotalConnections() {
        return totalConnections;
    }

    @JsonProperty("expected_connections")
    public int getExpectedConnections() {
        return expectedConnections;
    }

    /**
     * @return PASS when at least the expected number of border edges exist
     */
    @JsonProperty("status")
    public ValidationStatus getStatus() {
        return status;
    }

    @JsonProperty("min_gap_meters")
    public double getMinGapMeters() {
        return minGapMeters;
    }

    @JsonProperty("max_gap_meters")
    public double getMaxGapMeters() {
        return maxGapMeters;
    }

    @JsonProperty("avg_gap_meters")
    public double getAvgGapMeters() {
        return avgGapMeters;
    }

    @JsonProperty("connections")
    public List<Connection> getConnections() {
        return connections;
    }

    /**
     * One border edge and the bridgehead distance it was accepted with.
     */
    public static final class Connection {
        private final String u;
        private final String v;
        private final double gap;

        @JsonCreator
        public Connection(
                @JsonProperty("u") String u,
                @JsonProperty("v") String v,
                @JsonProperty("gap") double gap) {
            this.u = u;
            this.v = v;
            this.gap = gap;
        }

        @JsonProperty("u")
        public String getU() {
            return u;
        }

        @JsonProperty("v")
        public String getV() {
            return v;
        }

        @JsonProperty("gap")
        public double getGap() {
            return gap;
        }
    }
}
