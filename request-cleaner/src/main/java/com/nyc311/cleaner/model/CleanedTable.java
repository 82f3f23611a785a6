package com.nyc311.cleaner.model;

import java.util.List;

/**
 * The materialised output of one pipeline run, ordered by unique key.
 */
public record CleanedTable(List<CleanedRecord> records) {

    public CleanedTable {
        records = List.copyOf(records);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
