package com.nyc311.cleaner.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Aggregate view of a cleaned table, as consumed by reporting and dashboards.
 */
@Value
@Builder
public class TableSummary {

    long totalRecords;

    long withValidBorough;
    long withValidCoordinates;
    long withClosedDate;

    long distinctBoroughs;
    long distinctComplaintTypes;

    /** Excludes records without a borough; descending by count */
    List<CategoryCount> byBorough;

    /** Top N; descending by count, ties in name order */
    List<CategoryCount> topComplaintTypes;

    /** YYYY-MM of created_at, ascending */
    List<CategoryCount> monthlyVolume;

    ResponseTimeStats responseTime;
    Map<String, ResponseTimeStats> responseTimeByBorough;
}
