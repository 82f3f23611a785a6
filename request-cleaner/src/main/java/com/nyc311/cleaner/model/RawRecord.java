package com.nyc311.cleaner.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One untransformed row of the raw extract: column header → raw string value.
 *
 * Values may be null or empty; both mean "absent" to the cleaning rules.
 * Extra columns are carried along untouched. Instances are immutable.
 */
public final class RawRecord {

    private final Map<String, String> values;

    private RawRecord(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(new HashMap<>(values));
    }

    public static RawRecord of(Map<String, String> values) {
        return new RawRecord(Objects.requireNonNull(values, "values"));
    }

    public String get(SourceColumn column) {
        return values.get(column.header());
    }

    public boolean isAbsent(SourceColumn column) {
        String value = get(column);
        return value == null || value.isEmpty();
    }

    public boolean hasColumn(SourceColumn column) {
        return values.containsKey(column.header());
    }

    /** Columns of the fixed schema that this row does not carry at all. */
    public List<String> missingColumns() {
        return java.util.Arrays.stream(SourceColumn.values())
                .filter(c -> !hasColumn(c))
                .map(SourceColumn::header)
                .toList();
    }

    public Map<String, String> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RawRecord other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "RawRecord{" + SourceColumn.UNIQUE_KEY.header() + "=" + get(SourceColumn.UNIQUE_KEY) + "}";
    }
}
