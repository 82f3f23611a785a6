package com.nyc311.cleaner.output;

import com.nyc311.cleaner.config.CleanerProperties;
import com.nyc311.cleaner.model.CleanedRecord;
import com.nyc311.cleaner.model.PipelineRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Routes the cleaned table to the configured sink(s).
 * Supports SQLITE, CSV, BOTH or NONE modes.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OutputRouter {

    private final SqliteWriter sqliteWriter;
    private final CsvWriter csvWriter;
    private final CleanerProperties properties;

    public void write(List<CleanedRecord> records) {
        CleanerProperties.Output.OutputMode mode = properties.getOutput().getMode();

        switch (mode) {
            case SQLITE -> sqliteWriter.replaceCleanedTable(records);
            case CSV -> csvWriter.write(records);
            case BOTH -> {
                sqliteWriter.replaceCleanedTable(records);
                csvWriter.write(records);
            }
            case NONE -> log.debug("Output mode NONE: {} records kept in memory only", records.size());
        }
    }

    public void writeRun(PipelineRun run) {
        CleanerProperties.Output.OutputMode mode = properties.getOutput().getMode();
        if (mode != CleanerProperties.Output.OutputMode.SQLITE && mode != CleanerProperties.Output.OutputMode.BOTH) {
            return;
        }
        try {
            sqliteWriter.writeRun(run);
        } catch (Exception e) {
            log.warn("Failed to write pipeline run metadata: {}", e.getMessage());
        }
    }
}
