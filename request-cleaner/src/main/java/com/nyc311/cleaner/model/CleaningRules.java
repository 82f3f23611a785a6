package com.nyc311.cleaner.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable rule tables used by the field normalizer.
 *
 * Defaults are the standard 311 cleaning rules. The Spring
 * context builds its instance from {@code cleaner.rules.*}; tests build their own.
 */
@Value
@Builder
public class CleaningRules {

    public static final String OTHER_CATEGORY = "Other";

    public static final Map<String, Borough> DEFAULT_BOROUGH_ALIASES = Map.of(
            "BRONX", Borough.BRONX,
            "THE BRONX", Borough.BRONX,
            "BROOKLYN", Borough.BROOKLYN,
            "KINGS", Borough.BROOKLYN,
            "MANHATTAN", Borough.MANHATTAN,
            "NEW YORK", Borough.MANHATTAN,
            "QUEENS", Borough.QUEENS,
            "STATEN ISLAND", Borough.STATEN_ISLAND,
            "RICHMOND", Borough.STATEN_ISLAND
    );

    /** High-frequency complaint types kept as their own category; everything else is "Other". */
    public static final List<String> DEFAULT_CATEGORIES = List.of(
            "HEAT/HOT WATER", "Noise - Residential", "Noise - Street/Sidewalk",
            "Blocked Driveway", "Illegal Parking", "Street Condition",
            "Street Light Condition", "UNSANITARY CONDITION",
            "Water System", "PLUMBING", "PAINT/PLASTER",
            "Noise - Commercial", "Noise", "Rodent",
            "Sewer", "Dirty Conditions"
    );

    /** Upper-cased alias → canonical borough. */
    @Builder.Default
    Map<String, Borough> boroughAliases = DEFAULT_BOROUGH_ALIASES;

    /** Upper-cased values that mean "no borough given". */
    @Builder.Default
    Set<String> unspecifiedBoroughs = Set.of("UNSPECIFIED");

    /**
     * When true, a non-empty borough outside the alias table is dropped to absent.
     * When false it is passed through upper-cased.
     */
    @Builder.Default
    boolean rejectUnknownBoroughs = true;

    @Builder.Default
    Set<String> categoryAllowList = Set.copyOf(DEFAULT_CATEGORIES);

    @Builder.Default
    double minLatitude = 40.4;

    @Builder.Default
    double maxLatitude = 40.95;

    @Builder.Default
    double minLongitude = -74.3;

    @Builder.Default
    double maxLongitude = -73.6;

    @Builder.Default
    int minCreatedYear = 2010;

    @Builder.Default
    int maxCreatedYear = 2026;

    public static CleaningRules defaults() {
        return CleaningRules.builder().build();
    }
}
