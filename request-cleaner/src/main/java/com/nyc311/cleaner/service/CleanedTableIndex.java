package com.nyc311.cleaner.service;

import com.nyc311.cleaner.model.CleanedRecord;
import com.nyc311.cleaner.model.CleanedTable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Lookup structures over a cleaned table for the four query dimensions:
 * unique key (exact), complaint type, borough, and created date (sorted, for ranges).
 *
 * Derived from the table and rebuildable at any time; never a source of truth.
 * Immutable once built, so it can be shared between request threads.
 */
public final class CleanedTableIndex {

    private final Map<String, CleanedRecord> byKey;
    private final Map<String, List<CleanedRecord>> byComplaintType;
    private final Map<String, List<CleanedRecord>> byBorough;
    private final NavigableMap<String, List<CleanedRecord>> byCreatedDate;
    private final List<CleanedRecord> withoutCreatedDate;

    private CleanedTableIndex(Map<String, CleanedRecord> byKey,
                              Map<String, List<CleanedRecord>> byComplaintType,
                              Map<String, List<CleanedRecord>> byBorough,
                              NavigableMap<String, List<CleanedRecord>> byCreatedDate,
                              List<CleanedRecord> withoutCreatedDate) {
        this.byKey = byKey;
        this.byComplaintType = byComplaintType;
        this.byBorough = byBorough;
        this.byCreatedDate = byCreatedDate;
        this.withoutCreatedDate = withoutCreatedDate;
    }

    public static CleanedTableIndex build(CleanedTable table) {
        Map<String, CleanedRecord> byKey = new HashMap<>();
        Map<String, List<CleanedRecord>> byType = new HashMap<>();
        Map<String, List<CleanedRecord>> byBorough = new HashMap<>();
        TreeMap<String, List<CleanedRecord>> byDate = new TreeMap<>();
        List<CleanedRecord> undated = new ArrayList<>();

        for (CleanedRecord r : table.records()) {
            CleanedRecord previous = byKey.put(r.getUniqueKey(), r);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate unique key in cleaned table: " + r.getUniqueKey());
            }
            if (r.getComplaintType() != null) {
                byType.computeIfAbsent(r.getComplaintType(), k -> new ArrayList<>()).add(r);
            }
            if (r.getBorough() != null) {
                byBorough.computeIfAbsent(r.getBorough(), k -> new ArrayList<>()).add(r);
            }
            if (r.getCreatedDate() != null) {
                byDate.computeIfAbsent(r.getCreatedDate(), k -> new ArrayList<>()).add(r);
            } else {
                undated.add(r);
            }
        }

        return new CleanedTableIndex(
                Map.copyOf(byKey),
                freeze(byType),
                freeze(byBorough),
                freezeSorted(byDate),
                List.copyOf(undated));
    }

    public Optional<CleanedRecord> findByKey(String uniqueKey) {
        if (uniqueKey == null) return Optional.empty();
        return Optional.ofNullable(byKey.get(uniqueKey));
    }

    public List<CleanedRecord> findByComplaintType(String complaintType) {
        if (complaintType == null) return List.of();
        return byComplaintType.getOrDefault(complaintType, List.of());
    }

    public List<CleanedRecord> findByBorough(String borough) {
        if (borough == null) return List.of();
        return byBorough.getOrDefault(borough, List.of());
    }

    /**
     * Records whose created date (YYYY-MM-DD) lies in [from, to]. Either bound may be
     * null for an open range. Results come back in date order.
     */
    public List<CleanedRecord> findCreatedBetween(String from, String to) {
        NavigableMap<String, List<CleanedRecord>> range = byCreatedDate;
        if (from != null && to != null && from.compareTo(to) > 0) return List.of();
        if (from != null) range = range.tailMap(from, true);
        if (to != null) range = range.headMap(to, true);
        return flatten(range.values());
    }

    public List<CleanedRecord> findWithoutCreatedDate() {
        return withoutCreatedDate;
    }

    public int size() {
        return byKey.size();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static Map<String, List<CleanedRecord>> freeze(Map<String, List<CleanedRecord>> map) {
        Map<String, List<CleanedRecord>> copy = new HashMap<>();
        map.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        return Map.copyOf(copy);
    }

    private static NavigableMap<String, List<CleanedRecord>> freezeSorted(TreeMap<String, List<CleanedRecord>> map) {
        TreeMap<String, List<CleanedRecord>> copy = new TreeMap<>();
        map.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        return java.util.Collections.unmodifiableNavigableMap(copy);
    }

    private static List<CleanedRecord> flatten(Collection<List<CleanedRecord>> groups) {
        List<CleanedRecord> out = new ArrayList<>();
        groups.forEach(out::addAll);
        return out;
    }
}
