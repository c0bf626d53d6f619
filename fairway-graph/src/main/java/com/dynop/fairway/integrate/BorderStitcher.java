package com.dynop.fairway.integrate;

import com.dynop.fairway.geo.GeometryProjector;
import com.dynop.fairway.graph.FairwayGraph;
import com.dynop.fairway.graph.GraphEdge;
import com.dynop.fairway.graph.GraphNode;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.index.strtree.ItemDistance;
import org.locationtech.jts.index.strtree.STRtree;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Finds links between the primary and the secondary network at the home-country border.
 *
 * <p>The secondary network also covers the home country, but with its own node ids. Each
 * secondary edge running from a foreign node into the home country has a home-country
 * endpoint, the <em>bridgehead</em>. The bridgehead is matched to the nearest primary node
 * in a metric CRS; when that node is closer than the threshold, the foreign node can be
 * linked to it directly and the secondary home-country network dropped.
 *
 * <p>Primary nodes without a location are ignored.
 *
 * @see BorderConnection
 * @see GraphMerger
 */
public final class BorderStitcher {

    private static final Logger LOGGER = Logger.getLogger(BorderStitcher.class.getName());

    /**
     * Maximum distance in metres between a bridgehead and its primary node.
     */
    public static final double DEFAULT_DISTANCE_THRESHOLD = 100.0;

    private static final ItemDistance COORDINATE_DISTANCE =
            (a, b) -> ((IndexedNode) a.getItem()).coordinate.distance(((IndexedNode) b.getItem()).coordinate);

    private final GeometryProjector projector;
    private final String homeCountry;
    private final double distanceThreshold;

    /**
     * Creates a stitcher with the default threshold.
     *
     * @param projector   Projection from the graphs' CRS into a metric CRS
     * @param homeCountry Country covered by the primary network (e.g., "NL")
     */
    public BorderStitcher(GeometryProjector projector, String homeCountry) {
        this(projector, homeCountry, DEFAULT_DISTANCE_THRESHOLD);
    }

    /**
     * @param projector         Projection from the graphs' CRS into a metric CRS
     * @param homeCountry       Country covered by the primary network (e.g., "NL")
     * @param distanceThreshold Exclusive upper bound on the match distance in CRS units
     */
    public BorderStitcher(GeometryProjector projector, String homeCountry, double distanceThreshold) {
        this.projector = Objects.requireNonNull(projector, "projector");
        this.homeCountry = Objects.requireNonNull(homeCountry, "homeCountry");
        this.distanceThreshold = distanceThreshold;
    }

    /**
     * Find border connections.
     *
     * @param primary   Authoritative network of the home country
     * @param secondary Network whose foreign part is to be attached
     * @return One connection per cross-border secondary edge whose bridgehead was matched
     */
    public List<BorderConnection> findConnections(FairwayGraph primary, FairwayGraph secondary) {
        // Step 1: index primary nodes
        STRtree index = new STRtree();
        int indexed = 0;
        for (GraphNode node : primary.getNodes()) {
            Coordinate projected = projectNode(node);
            if (projected != null) {
                index.insert(new Envelope(projected), new IndexedNode(node.getId(), projected));
                indexed++;
            }
        }
        if (indexed == 0) {
            LOGGER.warning("No valid geometry found in primary graph nodes");
            return List.of();
        }

        // Step 2: cross-border edges and their bridgeheads
        List<String[]> borderEdges = new ArrayList<>();
        Set<String> bridgeheads = new LinkedHashSet<>();
        for (GraphEdge edge : secondary.getEdges()) {
            String u = edge.getSource();
            String v = edge.getTarget();
            String uCountry = secondary.getNode(u).getCountryCode();
            String vCountry = secondary.getNode(v).getCountryCode();
            if (homeCountry.equals(uCountry) && vCountry != null && !homeCountry.equals(vCountry)) {
                borderEdges.add(new String[]{v, u, vCountry});
                bridgeheads.add(u);
            } else if (homeCountry.equals(vCountry) && uCountry != null && !homeCountry.equals(uCountry)) {
                borderEdges.add(new String[]{u, v, uCountry});
                bridgeheads.add(v);
            }
        }
        LOGGER.info(() -> String.format("Found %d cross-border edges with %d unique %s bridgeheads",
                borderEdges.size(), bridgeheads.size(), homeCountry));

        // Step 3: nearest primary node per bridgehead
        Map<String, IndexedNode> matches = new LinkedHashMap<>();
        Map<String, Double> distances = new LinkedHashMap<>();
        for (String bridgehead : bridgeheads) {
            Coordinate projected = projectNode(secondary.getNode(bridgehead));
            if (projected == null) {
                continue;
            }
            IndexedNode query = new IndexedNode(bridgehead, projected);
            IndexedNode nearest = (IndexedNode) index.nearestNeighbour(new Envelope(projected), query, COORDINATE_DISTANCE);
            double distance = nearest.coordinate.distance(projected);
            if (distance < distanceThreshold) {
                matches.put(bridgehead, nearest);
                distances.put(bridgehead, distance);
                LOGGER.fine(() -> String.format("Matched %s -> %s (%.1fm)", bridgehead, nearest.id, distance));
            } else {
                LOGGER.fine(() -> String.format("No match for %s: nearest %s at %.1fm", bridgehead, nearest.id, distance));
            }
        }

        // Step 4: connections
        List<BorderConnection> connections = new ArrayList<>();
        for (String[] borderEdge : borderEdges) {
            String foreign = borderEdge[0];
            String bridgehead = borderEdge[1];
            IndexedNode match = matches.get(bridgehead);
            if (match == null) {
                continue;
            }
            GraphEdge edge = secondary.getEdge(foreign, bridgehead);
            connections.add(new BorderConnection(foreign, borderEdge[2], bridgehead, match.id,
                    distances.get(bridgehead), BorderConnection.GEOMETRIC, edge.getAttributes()));
        }
        LOGGER.info(() -> String.format("Established %d geometric border connections", connections.size()));
        return connections;
    }

    private Coordinate projectNode(GraphNode node) {
        Point point = node.getPoint();
        if (point == null) {
            return null;
        }
        try {
            return projector.project(point.getCoordinate());
        } catch (IllegalArgumentException e) {
            LOGGER.log(Level.WARNING, () -> String.format("Cannot project node %s: %s", node.getId(), e.getMessage()));
            return null;
        }
    }

    /**
     * @return Match distance threshold in CRS units
     */
    public double getDistanceThreshold() {
        return distanceThreshold;
    }

    /**
     * @return Country code of the primary network
     */
    public String getHomeCountry() {
        return homeCountry;
    }

    private static final class IndexedNode {
        final String id;
        final Coordinate coordinate;

        IndexedNode(String id, Coordinate coordinate) {
            this.id = id;
            this.coordinate = coordinate;
        }
    }
}
