package com.nyc311.cleaner.model;

/** Creation-to-closure time over the records where it is known. Mean and median are null when count is 0. */
public record ResponseTimeStats(long count, Double meanHours, Double medianHours) {}
