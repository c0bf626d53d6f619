package com.dynop.fairway.table;

import com.dynop.fairway.FairwayDataException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Named, immutable list of {@link FeatureRecord}s loaded from one export table or file.
 *
 * <p>The column set is the union of all record columns in first-seen order, so tables
 * concatenated from several region files keep every column any file provided.
 */
public final class FeatureTable {

    private final String name;
    private final List<FeatureRecord> records;
    private final Set<String> columns;

    /**
     * Creates a table.
     *
     * @param name    Table or file name, used in log messages and errors
     * @param records Rows (copied)
     */
    public FeatureTable(String name, List<FeatureRecord> records) {
        this.name = Objects.requireNonNull(name, "name");
        this.records = List.copyOf(Objects.requireNonNull(records, "records"));
        Set<String> cols = new LinkedHashSet<>();
        for (FeatureRecord record : this.records) {
            cols.addAll(record.getProperties().keySet());
        }
        this.columns = Collections.unmodifiableSet(cols);
    }

    /**
     * @return an empty table with the given name
     */
    public static FeatureTable empty(String name) {
        return new FeatureTable(name, List.of());
    }

    /**
     * Concatenates tables in order.
     *
     * @param name   Name of the combined table
     * @param tables Tables to concatenate
     * @return combined table
     */
    public static FeatureTable concat(String name, List<FeatureTable> tables) {
        List<FeatureRecord> all = new ArrayList<>();
        for (FeatureTable table : tables) {
            all.addAll(table.getRecords());
        }
        return new FeatureTable(name, all);
    }

    public String getName() {
        return name;
    }

    public List<FeatureRecord> getRecords() {
        return records;
    }

    public Set<String> getColumns() {
        return columns;
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /**
     * Fails fast when any of the given columns is absent. An empty table carries no schema
     * and always passes.
     *
     * @param required Column names
     * @throws FairwayDataException with code {@code MISSING_COLUMN}
     */
    public void requireColumns(String... required) {
        if (records.isEmpty()) {
            return;
        }
        for (String column : required) {
            if (!columns.contains(column)) {
                throw FairwayDataException.missingColumn(name, column);
            }
        }
    }

    @Override
    public String toString() {
        return String.format("FeatureTable{name='%s', rows=%d, columns=%s}", name, records.size(), columns);
    }
}
