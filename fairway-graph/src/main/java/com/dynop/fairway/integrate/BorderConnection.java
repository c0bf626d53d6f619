package com.dynop.fairway.integrate;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Candidate link between a foreign node of the secondary network and a node of the primary
 * network, found by geometric proximity of the secondary network's bridgehead.
 *
 * @see BorderStitcher
 */
public final class BorderConnection {

    public static final String GEOMETRIC = "geometric";

    private final String foreignNode;
    private final String foreignCountry;
    private final String bridgeheadNode;
    private final String matchedNode;
    private final double distance;
    private final String connectionType;
    private final Map<String, Object> edgeAttributes;

    /**
     * Constructs a BorderConnection without carried-over edge attributes.
     *
     * @param foreignNode    Secondary node id on the foreign side
     * @param foreignCountry Country code of the foreign node
     * @param bridgeheadNode Secondary node id on the home-country side
     * @param matchedNode    Primary node id the bridgehead was matched to
     * @param distance       Distance between bridgehead and matched node in CRS units (metres)
     * @param connectionType How the match was found (e.g., "geometric")
     */
    @JsonCreator
    public BorderConnection(
            @JsonProperty("foreignNode") String foreignNode,
            @JsonProperty("foreignCountry") String foreignCountry,
            @JsonProperty("bridgeheadNode") String bridgeheadNode,
            @JsonProperty("matchedNode") String matchedNode,
            @JsonProperty("distance") double distance,
            @JsonProperty("connectionType") String connectionType) {
        this(foreignNode, foreignCountry, bridgeheadNode, matchedNode, distance, connectionType, Map.of());
    }

    /**
     * Constructs a BorderConnection carrying the attributes of the secondary border edge.
     */
    public BorderConnection(String foreignNode, String foreignCountry, String bridgeheadNode, String matchedNode,
                            double distance, String connectionType, Map<String, Object> edgeAttributes) {
        this.foreignNode = foreignNode;
        this.foreignCountry = foreignCountry;
        this.bridgeheadNode = bridgeheadNode;
        this.matchedNode = matchedNode;
        this.distance = distance;
        this.connectionType = connectionType;
        this.edgeAttributes = Collections.unmodifiableMap(new LinkedHashMap<>(edgeAttributes));
    }

    /**
     * @return Secondary node id on the foreign side (e.g., "DE_J42")
     */
    public String getForeignNode() {
        return foreignNode;
    }

    /**
     * @return Country code of the foreign node
     */
    public String getForeignCountry() {
        return foreignCountry;
    }

    /**
     * @return Secondary node id on the home-country side
     */
    public String getBridgeheadNode() {
        return bridgeheadNode;
    }

    /**
     * @return Primary node id the bridgehead was matched to
     */
    public String getMatchedNode() {
        return matchedNode;
    }

    /**
     * @return Distance between bridgehead and matched node in metres
     */
    public double getDistance() {
        return distance;
    }

    /**
     * @return How the match was found (e.g., "geometric")
     */
    public String getConnectionType() {
        return connectionType;
    }

    /**
     * @return Copy of the secondary border edge attributes
     */
    @JsonIgnore
    public Map<String, Object> getEdgeAttributes() {
        return edgeAttributes;
    }

    @Override
    public String toString() {
        return String.format("BorderConnection{foreign='%s' (%s), bridgehead='%s', matched='%s', distance=%.1f, type=%s}",
                foreignNode, foreignCountry, bridgeheadNode, matchedNode, distance, connectionType);
    }
}
