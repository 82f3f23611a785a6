package com.nyc311.cleaner.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Tracks each cleaning run for observability.
 * Stored in the pipeline_runs table.
 */
@Data
@Builder
public class PipelineRun {

    private String runId;           // UUID
    private String source;          // input path or "in-memory"
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private String status;          // RUNNING | SUCCESS | FAILED
    private int rawRecords;
    private int cleanedRecords;
    private String errorMessage;    // null on success
}
