package com.dynop.fairway.geo;

import com.dynop.fairway.FairwayDataException;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.CoordinateSequenceFilter;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.Proj4jException;
import org.locationtech.proj4j.ProjCoordinate;

import java.util.Objects;

/**
 * Reprojects coordinates and geometries between two coordinate reference systems.
 *
 * <p>Used to move geographic (EPSG:4326, lon/lat) node positions into a metric CRS so that
 * nearest-neighbour distances are true distances in metres. The default target is
 * EPSG:32631 (UTM zone 31N), which covers the Netherlands; {@link #utmCrsCode(double, double)}
 * gives the zone for any other area.
 *
 * <p>Instances hold a Proj4J transform and are not thread safe.
 */
public class GeometryProjector {

    public static final String WGS84 = "EPSG:4326";
    public static final String DEFAULT_METRIC_CRS = "EPSG:32631";

    private static final CRSFactory CRS_FACTORY = new CRSFactory();
    private static final CoordinateTransformFactory TRANSFORM_FACTORY = new CoordinateTransformFactory();

    private final String sourceCrs;
    private final String targetCrs;
    private final CoordinateTransform transform;

    /**
     * Creates a projector.
     *
     * @param sourceCrs Source CRS code (e.g., "EPSG:4326")
     * @param targetCrs Target CRS code (e.g., "EPSG:32631")
     * @throws FairwayDataException with code {@code INVALID_CRS} when a code is unknown
     */
    public GeometryProjector(String sourceCrs, String targetCrs) {
        this.sourceCrs = Objects.requireNonNull(sourceCrs, "sourceCrs");
        this.targetCrs = Objects.requireNonNull(targetCrs, "targetCrs");
        this.transform = TRANSFORM_FACTORY.createTransform(decode(sourceCrs), decode(targetCrs));
    }

    /**
     * @param metricCrs Target metric CRS code
     * @return projector from WGS84 lon/lat into the metric CRS
     */
    public static GeometryProjector fromWgs84(String metricCrs) {
        return new GeometryProjector(WGS84, metricCrs);
    }

    /**
     * UTM zone CRS code for a position.
     *
     * @param lon Longitude in decimal degrees
     * @param lat Latitude in decimal degrees
     * @return "EPSG:326zz" north of the equator, "EPSG:327zz" south of it
     */
    public static String utmCrsCode(double lon, double lat) {
        int zone = (int) Math.floor((lon + 180.0) / 6.0) + 1;
        zone = Math.max(1, Math.min(60, zone));
        return String.format("EPSG:%d%02d", lat >= 0 ? 326 : 327, zone);
    }

    /**
     * Projects one coordinate.
     *
     * @param coordinate Coordinate in the source CRS (x = easting/longitude)
     * @return New coordinate in the target CRS
     * @throws IllegalArgumentException if the coordinate cannot be projected
     */
    public Coordinate project(Coordinate coordinate) {
        ProjCoordinate out = new ProjCoordinate();
        try {
            transform.transform(new ProjCoordinate(coordinate.x, coordinate.y), out);
        } catch (Proj4jException e) {
            throw new IllegalArgumentException("Cannot project " + coordinate + ": " + e.getMessage(), e);
        }
        if (!Double.isFinite(out.x) || !Double.isFinite(out.y)) {
            throw new IllegalArgumentException("Projection of " + coordinate + " is not finite");
        }
        return new Coordinate(out.x, out.y);
    }

    /**
     * Projects a geometry, leaving the input untouched.
     *
     * @param geometry Geometry in the source CRS
     * @return Projected copy
     * @throws IllegalArgumentException if any vertex cannot be projected
     */
    public Geometry project(Geometry geometry) {
        Geometry copy = geometry.copy();
        copy.apply(new CoordinateSequenceFilter() {
            @Override
            public void filter(CoordinateSequence seq, int i) {
                Coordinate projected = project(seq.getCoordinate(i));
                seq.setOrdinate(i, CoordinateSequence.X, projected.x);
                seq.setOrdinate(i, CoordinateSequence.Y, projected.y);
            }

            @Override
            public boolean isDone() {
                return false;
            }

            @Override
            public boolean isGeometryChanged() {
                return true;
            }
        });
        return copy;
    }

    /**
     * @return projector for the opposite direction
     */
    public GeometryProjector inverse() {
        return new GeometryProjector(targetCrs, sourceCrs);
    }

    public String getSourceCrs() {
        return sourceCrs;
    }

    public String getTargetCrs() {
        return targetCrs;
    }

    private static CoordinateReferenceSystem decode(String code) {
        try {
            return CRS_FACTORY.createFromName(code);
        } catch (Proj4jException e) {
            throw new FairwayDataException(FairwayDataException.INVALID_CRS, code,
                    "Unknown coordinate reference system", e);
        }
    }

    @Override
    public String toString() {
        return String.format("GeometryProjector{%s -> %s}", sourceCrs, targetCrs);
    }
}
