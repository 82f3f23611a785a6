package com.nyc311.cleaner.model;

/** What a successful cleaning pass produces: the table plus its quality summary. */
public record PipelineResult(CleanedTable table, DataQualitySummary quality) {}
