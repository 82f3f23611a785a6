package com.nyc311.cleaner.model;

/** One row of a grouped count: value, how many records, and share of the whole table (2 dp). */
public record CategoryCount(String value, long count, double percentage) {}
