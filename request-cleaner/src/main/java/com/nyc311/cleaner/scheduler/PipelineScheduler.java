package com.nyc311.cleaner.scheduler;

import com.nyc311.cleaner.config.CleanerProperties;
import com.nyc311.cleaner.output.SqliteWriter;
import com.nyc311.cleaner.service.CleaningRunService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Manages on-startup and scheduled cleaning runs.
 *
 * Each run recomputes the whole table from the raw extract. The scheduled re-run is
 * off by default; set CLEANER_CRON (cleaner.scheduling.cron) to enable it, e.g.
 * "0 0 3 * * ?" after a nightly extract refresh.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PipelineScheduler {

    private final CleaningRunService runService;
    private final SqliteWriter sqliteWriter;
    private final CleanerProperties properties;

    /**
     * On application startup:
     *  1. Ensure the run-metadata table exists (when SQLite output is in use)
     *  2. Optionally clean the configured extract if RUN_ON_STARTUP=true
     */
    @PostConstruct
    public void onStartup() {
        CleanerProperties.Output.OutputMode mode = properties.getOutput().getMode();
        if (mode == CleanerProperties.Output.OutputMode.SQLITE || mode == CleanerProperties.Output.OutputMode.BOTH) {
            try {
                sqliteWriter.ensureSchema();
            } catch (Exception e) {
                log.warn("Could not initialise SQLite schema: {}", e.getMessage());
            }
        }

        if (properties.getScheduling().isRunOnStartup()) {
            log.info("RUN_ON_STARTUP=true, cleaning {}", properties.getInput().getCsvPath());
            runService.runConfiguredSource();
        } else {
            log.info("Cleaner ready. Scheduled re-run: {}", properties.getScheduling().getCron());
        }
    }

    @Scheduled(cron = "${cleaner.scheduling.cron:-}")
    public void scheduledRun() {
        log.info("Scheduled cleaning run triggered");
        runService.runConfiguredSource();
    }
}
