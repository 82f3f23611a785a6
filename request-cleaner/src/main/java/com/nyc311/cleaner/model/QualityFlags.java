package com.nyc311.cleaner.model;

/** Per-row validity flags; they never change field values. */
public record QualityFlags(
        boolean hasValidBorough,
        boolean hasValidCoordinates,
        boolean hasValidCreatedDate,
        boolean hasClosedDate) {}
