package com.dynop.fairway.enrich;

import com.dynop.fairway.table.FeatureRecord;
import com.dynop.fairway.table.FeatureTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.LineString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.dynop.fairway.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link GeometryKeyMatcher}.
 */
class GeometryKeyMatcherTest {

    private GeometryKeyMatcher matcher;
    private FeatureTable sections;

    @BeforeEach
    void setUp() {
        matcher = new GeometryKeyMatcher();
        sections = table("section",
                record(line(5.0, 52.0, 5.1, 52.0), "Id", 1),
                record(line(5.1, 52.0, 5.2, 52.0), "Id", 2),
                record(line(5.2, 52.0, 5.3, 52.0), "Id", 3));
    }

    @Test
    void copiesPrefixedColumnsOnIdenticalGeometry() {
        FeatureTable data = table("navigability",
                record(line(5.0, 52.0, 5.1, 52.0), "Code", "Va", "Classification", "CEMT"),
                record(line(5.2, 52.0, 5.3, 52.0), "Code", "IV"));

        SectionAttributeTable result = matcher.match(sections, data, List.of("Code", "Classification"), "nav_");

        assertEquals(Map.of("nav_Code", "Va", "nav_Classification", "CEMT"), result.get("1"));
        assertTrue(result.get("2").isEmpty());
        assertEquals(Map.of("nav_Code", "IV"), result.get("3"));
    }

    @Test
    void differentVertexDoesNotMatch() {
        // Reversed and slightly moved lines are different keys
        FeatureTable data = table("navigability",
                record(line(5.1, 52.0, 5.0, 52.0), "Code", "Va"),
                record(line(5.1, 52.0, 5.2000001, 52.0), "Code", "IV"));

        SectionAttributeTable result = matcher.match(sections, data, List.of("Code"), "nav_");

        assertTrue(result.isEmpty());
    }

    @Test
    void firstDataRowWinsForDuplicateGeometry() {
        FeatureTable data = table("maximumdimensions",
                record(line(5.0, 52.0, 5.1, 52.0), "GeneralWidth", 12.0),
                record(line(5.0, 52.0, 5.1, 52.0), "GeneralWidth", 9.5));

        SectionAttributeTable result = matcher.match(sections, data, List.of("GeneralWidth"), "dim_");

        assertEquals(12.0, result.get("1").get("dim_GeneralWidth"));
    }

    @Test
    void resultDoesNotDependOnSectionOrder() {
        FeatureTable data = table("navigability",
                record(line(5.0, 52.0, 5.1, 52.0), "Code", "Va"),
                record(line(5.2, 52.0, 5.3, 52.0), "Code", "IV"));
        List<FeatureRecord> reversed = new ArrayList<>(sections.getRecords());
        Collections.reverse(reversed);

        SectionAttributeTable forward = matcher.match(sections, data, List.of("Code"), "nav_");
        SectionAttributeTable backward = matcher.match(new FeatureTable("section", reversed), data, List.of("Code"), "nav_");

        for (String id : List.of("1", "2", "3")) {
            assertEquals(forward.get(id), backward.get(id));
        }
    }

    @Test
    void resultDoesNotDependOnDataRowOrder() {
        FeatureTable data = table("navigability",
                record(line(5.0, 52.0, 5.1, 52.0), "Code", "Va"),
                record(line(5.1, 52.0, 5.2, 52.0), "Code", "III"),
                record(line(5.2, 52.0, 5.3, 52.0), "Code", "IV"));
        List<FeatureRecord> reversed = new ArrayList<>(data.getRecords());
        Collections.reverse(reversed);

        SectionAttributeTable forward = matcher.match(sections, data, List.of("Code"), "nav_");
        SectionAttributeTable backward = matcher.match(sections, new FeatureTable("navigability", reversed),
                List.of("Code"), "nav_");

        for (String id : List.of("1", "2", "3")) {
            assertEquals(forward.get(id), backward.get(id));
        }
        assertEquals("III", backward.get("2").get("nav_Code"));
    }

    @Test
    void differentElevationDoesNotMatch() {
        FeatureTable sections3d = table("section",
                record(lineZ(1.0, 5.0, 52.0, 5.1, 52.0), "Id", 1),
                record(lineZ(2.0, 5.1, 52.0, 5.2, 52.0), "Id", 2));
        FeatureTable data = table("navigability",
                record(lineZ(9.0, 5.0, 52.0, 5.1, 52.0), "Code", "Va"),
                record(lineZ(2.0, 5.1, 52.0, 5.2, 52.0), "Code", "IV"));

        SectionAttributeTable result = matcher.match(sections3d, data, List.of("Code"), "nav_");

        // Same XY, other Z
        assertTrue(result.get("1").isEmpty());
        assertEquals(Map.of("nav_Code", "IV"), result.get("2"));
    }

    @Test
    void unknownColumnsAndEmptyDataGiveNothing() {
        FeatureTable data = table("navigability", record(line(5.0, 52.0, 5.1, 52.0), "Code", "Va"));

        assertTrue(matcher.match(sections, data, List.of("Missing"), "nav_").isEmpty());
        assertTrue(matcher.match(sections, FeatureTable.empty("navigability"), List.of("Code"), "nav_").isEmpty());
    }

    private static LineString lineZ(double z, double... xy) {
        Coordinate[] coordinates = new Coordinate[xy.length / 2];
        for (int i = 0; i < coordinates.length; i++) {
            coordinates[i] = new Coordinate(xy[2 * i], xy[2 * i + 1], z);
        }
        return GEOMETRY_FACTORY.createLineString(coordinates);
    }
}
