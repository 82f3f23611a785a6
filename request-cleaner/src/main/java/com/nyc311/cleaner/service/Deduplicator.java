package com.nyc311.cleaner.service;

import com.nyc311.cleaner.model.RawRecord;
import com.nyc311.cleaner.model.SourceColumn;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * Reduces the raw rows to exactly one row per unique key.
 *
 * Among rows sharing a key, a row matching the preferred predicate (the created-date
 * admission check in the pipeline) wins over one that does not, so a key survives
 * admission whenever any of its rows would. The remaining tie is broken on row
 * content, column by column; the result depends only on which rows are present,
 * not on their order. Rows without a key are dropped.
 */
@Component
@Slf4j
public class Deduplicator {

    private static final Comparator<String> NULLS_FIRST = Comparator.nullsFirst(Comparator.naturalOrder());

    static final Comparator<RawRecord> CONTENT_ORDER = contentOrder();

    public record Result(List<RawRecord> survivors, int duplicatesRemoved, int missingKeys) {}

    public Result deduplicate(List<RawRecord> rows) {
        return deduplicate(rows, r -> true);
    }

    public Result deduplicate(List<RawRecord> rows, Predicate<RawRecord> preferred) {
        Comparator<RawRecord> survivorOrder = Comparator
                .comparing((RawRecord r) -> !preferred.test(r))
                .thenComparing(CONTENT_ORDER);
        Map<String, RawRecord> byKey = new TreeMap<>(UniqueKeyOrder.INSTANCE);
        int missingKeys = 0;
        int duplicates = 0;

        for (RawRecord row : rows) {
            if (row.isAbsent(SourceColumn.UNIQUE_KEY)) {
                missingKeys++;
                continue;
            }
            String key = row.get(SourceColumn.UNIQUE_KEY);
            RawRecord current = byKey.get(key);
            if (current == null) {
                byKey.put(key, row);
            } else {
                duplicates++;
                if (survivorOrder.compare(row, current) < 0) {
                    byKey.put(key, row);
                }
            }
        }

        if (duplicates > 0) {
            log.info("Deduplication removed {} duplicate row(s)", duplicates);
        }
        if (missingKeys > 0) {
            log.warn("{} row(s) have no unique key and were dropped", missingKeys);
        }
        return new Result(new ArrayList<>(byKey.values()), duplicates, missingKeys);
    }

    private static Comparator<RawRecord> contentOrder() {
        Comparator<RawRecord> order = (a, b) -> 0;
        for (SourceColumn column : SourceColumn.values()) {
            order = order.thenComparing(r -> r.get(column), NULLS_FIRST);
        }
        return order;
    }
}
