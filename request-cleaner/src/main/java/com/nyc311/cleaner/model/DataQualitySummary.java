package com.nyc311.cleaner.model;

import lombok.Builder;
import lombok.Value;

/**
 * Discard and flag counts for one pipeline run.
 * rawRecords = missingKeyRecords + duplicatesRemoved + dateFilteredRecords + cleanedRecords.
 */
@Value
@Builder
public class DataQualitySummary {

    int rawRecords;
    int missingKeyRecords;
    int duplicatesRemoved;
    int dateFilteredRecords;
    int cleanedRecords;

    // Rows kept but with fields that could not be used
    int unparseableCreatedDates;
    int rejectedCoordinates;
    int unrecognisedBoroughs;

    // Flag totals over the cleaned table
    int withValidBorough;
    int withValidCoordinates;
    int withValidCreatedDate;
    int withClosedDate;

    public int discardedRecords() {
        return rawRecords - cleanedRecords;
    }
}
