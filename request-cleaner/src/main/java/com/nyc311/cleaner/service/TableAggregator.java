package com.nyc311.cleaner.service;

import com.nyc311.cleaner.model.CategoryCount;
import com.nyc311.cleaner.model.CleanedRecord;
import com.nyc311.cleaner.model.CleanedTable;
import com.nyc311.cleaner.model.ResponseTimeStats;
import com.nyc311.cleaner.model.TableSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.YearMonth;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Summary statistics over a cleaned table. Read-only; never alters the records.
 */
@Component
@Slf4j
public class TableAggregator {

    private static final Comparator<CategoryCount> BY_COUNT_DESC = Comparator
            .comparingLong(CategoryCount::count).reversed()
            .thenComparing(CategoryCount::value);

    public TableSummary summarise(CleanedTable table, int topComplaintTypes) {
        List<CleanedRecord> records = table.records();
        long total = records.size();

        List<CategoryCount> byBorough = countBy(records, CleanedRecord::getBorough, total);
        List<CategoryCount> complaintTypes = countBy(records, CleanedRecord::getComplaintType, total);

        TableSummary summary = TableSummary.builder()
                .totalRecords(total)
                .withValidBorough(records.stream().filter(r -> r.getFlags().hasValidBorough()).count())
                .withValidCoordinates(records.stream().filter(r -> r.getFlags().hasValidCoordinates()).count())
                .withClosedDate(records.stream().filter(r -> r.getFlags().hasClosedDate()).count())
                .distinctBoroughs(byBorough.size())
                .distinctComplaintTypes(complaintTypes.size())
                .byBorough(byBorough)
                .topComplaintTypes(complaintTypes.stream().limit(Math.max(0, topComplaintTypes)).toList())
                .monthlyVolume(monthlyVolume(records, total))
                .responseTime(responseTime(records))
                .responseTimeByBorough(responseTimeByBorough(records))
                .build();

        log.debug("Summarised {} records: {} boroughs, {} complaint types",
                total, summary.getDistinctBoroughs(), summary.getDistinctComplaintTypes());
        return summary;
    }

    /** Grouped counts with percentages; null values are left out of the groups but not the total. */
    public List<CategoryCount> countBy(List<CleanedRecord> records, Function<CleanedRecord, String> field, long total) {
        Map<String, Long> counts = records.stream()
                .map(field)
                .filter(Objects::nonNull)
                .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));

        return counts.entrySet().stream()
                .map(e -> new CategoryCount(e.getKey(), e.getValue(), percentage(e.getValue(), total)))
                .sorted(BY_COUNT_DESC)
                .toList();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private List<CategoryCount> monthlyVolume(List<CleanedRecord> records, long total) {
        Map<YearMonth, Long> byMonth = records.stream()
                .filter(r -> r.getCreatedAt() != null)
                .collect(Collectors.groupingBy(r -> YearMonth.from(r.getCreatedAt()), TreeMap::new, Collectors.counting()));

        return byMonth.entrySet().stream()
                .map(e -> new CategoryCount(e.getKey().toString(), e.getValue(), percentage(e.getValue(), total)))
                .toList();
    }

    private ResponseTimeStats responseTime(List<CleanedRecord> records) {
        return stats(records.stream()
                .map(CleanedRecord::getResponseTimeHours)
                .filter(Objects::nonNull)
                .sorted()
                .toList());
    }

    private Map<String, ResponseTimeStats> responseTimeByBorough(List<CleanedRecord> records) {
        Map<String, List<Double>> hoursByBorough = records.stream()
                .filter(r -> r.getBorough() != null && r.getResponseTimeHours() != null)
                .collect(Collectors.groupingBy(CleanedRecord::getBorough, TreeMap::new,
                        Collectors.mapping(CleanedRecord::getResponseTimeHours, Collectors.toList())));

        Map<String, ResponseTimeStats> result = new TreeMap<>();
        hoursByBorough.forEach((borough, hours) -> result.put(borough, stats(hours.stream().sorted().toList())));
        return result;
    }

    private ResponseTimeStats stats(List<Double> sortedHours) {
        int n = sortedHours.size();
        if (n == 0) return new ResponseTimeStats(0, null, null);

        double mean = sortedHours.stream().mapToDouble(Double::doubleValue).sum() / n;
        double median = n % 2 == 1
                ? sortedHours.get(n / 2)
                : (sortedHours.get(n / 2 - 1) + sortedHours.get(n / 2)) / 2.0;
        return new ResponseTimeStats(n, mean, median);
    }

    static double percentage(long count, long total) {
        if (total == 0) return 0.0;
        return BigDecimal.valueOf(100.0 * count / total)
                .setScale(2, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
