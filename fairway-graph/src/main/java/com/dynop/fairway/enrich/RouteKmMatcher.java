package com.dynop.fairway.enrich;

import com.dynop.fairway.graph.Attributes;
import com.dynop.fairway.table.FeatureRecord;
import com.dynop.fairway.table.FeatureTable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Matches auxiliary rows to sections on the same route with an overlapping kilometre range.
 *
 * <p>Ranges are normalised to {@code [min, max]} on both sides, so reversed begin/end values
 * match the same way. Ranges that only touch at one kilometre overlap. The first overlapping
 * auxiliary row (in table order) is used per section.
 */
public final class RouteKmMatcher implements SectionMatcher {

    private static final Logger LOGGER = Logger.getLogger(RouteKmMatcher.class.getName());

    public static final String ROUTE_ID = "RouteId";
    public static final String ROUTE_KM_BEGIN = "RouteKmBegin";
    public static final String ROUTE_KM_END = "RouteKmEnd";

    private static final List<String> ROUTE_COLUMNS = List.of(ROUTE_ID, ROUTE_KM_BEGIN, ROUTE_KM_END);

    @Override
    public SectionAttributeTable match(FeatureTable sections, FeatureTable data, List<String> columns, String prefix) {
        SectionAttributeTable result = new SectionAttributeTable();
        if (data == null || data.isEmpty()) {
            return result;
        }
        for (String column : ROUTE_COLUMNS) {
            if (!sections.hasColumn(column) || !data.hasColumn(column)) {
                LOGGER.warning(String.format("Missing %s column for route/km matching (%s)", column, prefix));
                return result;
            }
        }
        List<String> available = new ArrayList<>();
        for (String column : columns) {
            if (data.hasColumn(column)) {
                available.add(column);
            }
        }
        if (available.isEmpty()) {
            return result;
        }

        Map<String, List<FeatureRecord>> byRoute = new HashMap<>();
        for (FeatureRecord row : data.getRecords()) {
            if (hasRouteReference(row)) {
                byRoute.computeIfAbsent(row.getId(ROUTE_ID), k -> new ArrayList<>()).add(row);
            }
        }

        int matched = 0;
        for (FeatureRecord section : sections.getRecords()) {
            FeatureRecord row = firstOverlap(section, byRoute);
            if (row == null) {
                continue;
            }
            String sectionId = section.getId(Attributes.ID);
            for (String column : available) {
                result.put(sectionId, prefix + column, row.get(column));
            }
            matched++;
        }
        int total = matched;
        LOGGER.info(() -> String.format("Matched %d sections by route/km for %s", total, prefix));
        return result;
    }

    /**
     * @return First auxiliary row on the section's route whose range overlaps, or null
     */
    static FeatureRecord firstOverlap(FeatureRecord section, Map<String, List<FeatureRecord>> byRoute) {
        if (!hasRouteReference(section)) {
            return null;
        }
        List<FeatureRecord> candidates = byRoute.get(section.getId(ROUTE_ID));
        if (candidates == null) {
            return null;
        }
        double begin = section.getDouble(ROUTE_KM_BEGIN);
        double end = section.getDouble(ROUTE_KM_END);
        for (FeatureRecord row : candidates) {
            if (overlaps(begin, end, row.getDouble(ROUTE_KM_BEGIN), row.getDouble(ROUTE_KM_END))) {
                return row;
            }
        }
        return null;
    }

    /**
     * @return true when the record has a route id and both kilometre values
     */
    public static boolean hasRouteReference(FeatureRecord record) {
        return record.getId(ROUTE_ID) != null
                && record.getDouble(ROUTE_KM_BEGIN) != null
                && record.getDouble(ROUTE_KM_END) != null;
    }

    /**
     * Closed-interval overlap of two kilometre ranges given in any orientation.
     */
    public static boolean overlaps(double aBegin, double aEnd, double bBegin, double bEnd) {
        double aLow = Math.min(aBegin, aEnd);
        double aHigh = Math.max(aBegin, aEnd);
        double bLow = Math.min(bBegin, bEnd);
        double bHigh = Math.max(bBegin, bEnd);
        return !(aHigh < bLow || bHigh < aLow);
    }
}
