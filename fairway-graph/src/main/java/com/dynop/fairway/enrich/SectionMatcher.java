package com.dynop.fairway.enrich;

import com.dynop.fairway.table.FeatureTable;

import java.util.List;

/**
 * Joins rows of an auxiliary dataset onto sections.
 */
public interface SectionMatcher {

    /**
     * @param sections Section table with an {@code Id} column
     * @param data     Auxiliary dataset, may be null or empty
     * @param columns  Columns to take from the matched auxiliary row (missing ones are ignored)
     * @param prefix   Prefix for the output column names
     * @return Prefixed attributes per section id
     */
    SectionAttributeTable match(FeatureTable sections, FeatureTable data, List<String> columns, String prefix);
}
