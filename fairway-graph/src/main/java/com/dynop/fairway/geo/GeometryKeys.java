package com.dynop.fairway.geo;

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.WKTWriter;

/**
 * Canonical textual keys for exact geometry joins.
 *
 * <p>The source systems reuse literally identical geometries across related tables, so
 * the full-precision WKT is a sufficient join key. No snapping or tolerance is applied:
 * geometries that differ in any ordinate produce different keys.
 */
public final class GeometryKeys {

    private GeometryKeys() {
        // Utility class
    }

    /**
     * @param geometry Geometry, may be null
     * @return WKT of the geometry, or null for a null geometry
     */
    public static String canonicalKey(Geometry geometry) {
        if (geometry == null) {
            return null;
        }
        // WKTWriter is not thread safe; dimension 3 keeps Z where the coordinates have it
        return new WKTWriter(3).write(geometry);
    }
}
