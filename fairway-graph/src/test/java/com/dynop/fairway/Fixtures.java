package com.dynop.fairway;

import com.dynop.fairway.table.FeatureRecord;
import com.dynop.fairway.table.FeatureTable;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Point;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Record, table and geometry factories shared by the unit tests.
 */
public final class Fixtures {

    public static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory();

    private Fixtures() {
    }

    public static Point point(double x, double y) {
        return GEOMETRY_FACTORY.createPoint(new Coordinate(x, y));
    }

    /**
     * @param xy Alternating x and y ordinates
     */
    public static LineString line(double... xy) {
        Coordinate[] coordinates = new Coordinate[xy.length / 2];
        for (int i = 0; i < coordinates.length; i++) {
            coordinates[i] = new Coordinate(xy[2 * i], xy[2 * i + 1]);
        }
        return GEOMETRY_FACTORY.createLineString(coordinates);
    }

    /**
     * @param keyValues Alternating column names and values
     */
    public static FeatureRecord record(Geometry geometry, Object... keyValues) {
        return new FeatureRecord(properties(keyValues), geometry);
    }

    public static Map<String, Object> properties(Object... keyValues) {
        Map<String, Object> properties = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            properties.put((String) keyValues[i], keyValues[i + 1]);
        }
        return properties;
    }

    public static FeatureTable table(String name, FeatureRecord... records) {
        return new FeatureTable(name, List.of(records));
    }
}
