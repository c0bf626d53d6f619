package com.dynop.fairway.geo;

import net.sf.geographiclib.Geodesic;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;

/**
 * Ellipsoidal (WGS84) length of line geometries given in geographic coordinates.
 *
 * <p>Coordinates are expected as {@code x = longitude}, {@code y = latitude}. Multi-part
 * geometries are summed part by part; points and empty geometries have length zero.
 */
public final class GeodesicLength {

    private GeodesicLength() {
        // Utility class
    }

    /**
     * @param geometry Line or multi-line geometry in EPSG:4326
     * @return Length in metres
     * @throws IllegalArgumentException if the geometry is null or has non-finite coordinates
     */
    public static double meters(Geometry geometry) {
        if (geometry == null) {
            throw new IllegalArgumentException("geometry is null");
        }
        double total = 0.0;
        for (int i = 0; i < geometry.getNumGeometries(); i++) {
            Geometry part = geometry.getGeometryN(i);
            if (part instanceof LineString) {
                total += lineMeters(((LineString) part).getCoordinates());
            }
        }
        return total;
    }

    /**
     * @return Geodesic distance between two lon/lat coordinates in metres
     */
    public static double between(Coordinate from, Coordinate to) {
        if (!isFinite(from) || !isFinite(to)) {
            throw new IllegalArgumentException("Non-finite coordinate: " + from + " -> " + to);
        }
        return Geodesic.WGS84.Inverse(from.y, from.x, to.y, to.x).s12;
    }

    private static double lineMeters(Coordinate[] coords) {
        double sum = 0.0;
        for (int i = 1; i < coords.length; i++) {
            sum += between(coords[i - 1], coords[i]);
        }
        return sum;
    }

    private static boolean isFinite(Coordinate c) {
        return Double.isFinite(c.x) && Double.isFinite(c.y);
    }
}
