package com.dynop.fairway.enrich;

import com.dynop.fairway.geo.GeometryKeys;
import com.dynop.fairway.graph.Attributes;
import com.dynop.fairway.table.FeatureRecord;
import com.dynop.fairway.table.FeatureTable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Matches auxiliary rows to sections whose geometry is textually identical.
 *
 * <p>Auxiliary rows are de-duplicated on their geometry key before the join; the first row
 * with a given key is used.
 */
public final class GeometryKeyMatcher implements SectionMatcher {

    private static final Logger LOGGER = Logger.getLogger(GeometryKeyMatcher.class.getName());

    @Override
    public SectionAttributeTable match(FeatureTable sections, FeatureTable data, List<String> columns, String prefix) {
        SectionAttributeTable result = new SectionAttributeTable();
        if (data == null || data.isEmpty()) {
            return result;
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

        Map<String, FeatureRecord> byKey = new HashMap<>();
        for (FeatureRecord row : data.getRecords()) {
            String key = GeometryKeys.canonicalKey(row.getGeometry());
            if (key != null) {
                byKey.putIfAbsent(key, row);
            }
        }

        int matched = 0;
        for (FeatureRecord section : sections.getRecords()) {
            String key = GeometryKeys.canonicalKey(section.getGeometry());
            FeatureRecord row = key != null ? byKey.get(key) : null;
            if (row == null) {
                continue;
            }
            String sectionId = section.getId(Attributes.ID);
            boolean any = false;
            for (String column : available) {
                Object value = row.get(column);
                if (value != null) {
                    result.put(sectionId, prefix + column, value);
                    any = true;
                }
            }
            if (any) {
                matched++;
            }
        }
        int total = matched;
        LOGGER.info(() -> String.format("Matched %d sections by geometry for %s", total, prefix));
        return result;
    }
}
