package com.dynop.fairway.enrich;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Enrichment attributes per section id.
 *
 * <p>Only non-null values are stored, so merging a row into an edge never overwrites an
 * existing edge attribute with a missing value.
 */
public final class SectionAttributeTable {

    private final Map<String, Map<String, Object>> rows = new LinkedHashMap<>();
    private final Set<String> columns = new LinkedHashSet<>();

    /**
     * Sets one value; null values are ignored.
     */
    public void put(String sectionId, String column, Object value) {
        if (sectionId == null || value == null) {
            return;
        }
        rows.computeIfAbsent(sectionId, k -> new LinkedHashMap<>()).put(column, value);
        columns.add(column);
    }

    /**
     * Adds all values of another table; on conflict the other table wins.
     */
    public void putAll(SectionAttributeTable other) {
        for (Map.Entry<String, Map<String, Object>> row : other.rows.entrySet()) {
            for (Map.Entry<String, Object> value : row.getValue().entrySet()) {
                put(row.getKey(), value.getKey(), value.getValue());
            }
        }
    }

    /**
     * @return Unmodifiable attributes of the section, empty when it has none
     */
    public Map<String, Object> get(String sectionId) {
        Map<String, Object> row = rows.get(sectionId);
        return row != null ? Collections.unmodifiableMap(row) : Collections.emptyMap();
    }

    /**
     * @return Ids of sections with at least one attribute
     */
    public Set<String> getSectionIds() {
        return Collections.unmodifiableSet(rows.keySet());
    }

    public Set<String> getColumns() {
        return Collections.unmodifiableSet(columns);
    }

    /**
     * @param prefix Column prefix (or full column name)
     * @return Number of sections with at least one column starting with the prefix
     */
    public int countWithPrefix(String prefix) {
        int count = 0;
        for (Map<String, Object> row : rows.values()) {
            for (String column : row.keySet()) {
                if (column.startsWith(prefix)) {
                    count++;
                    break;
                }
            }
        }
        return count;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
