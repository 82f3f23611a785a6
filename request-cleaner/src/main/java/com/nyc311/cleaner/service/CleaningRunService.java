package com.nyc311.cleaner.service;

import com.nyc311.cleaner.config.CleanerProperties;
import com.nyc311.cleaner.model.CleanedTable;
import com.nyc311.cleaner.model.PipelineResult;
import com.nyc311.cleaner.model.PipelineRun;
import com.nyc311.cleaner.model.RawRecord;
import com.nyc311.cleaner.model.TableSummary;
import com.nyc311.cleaner.output.OutputRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Runs the full cycle: load the raw extract, clean it, write the configured outputs,
 * then publish the table for querying.
 *
 * Runs are serialised. A run that fails at any step publishes nothing and leaves the
 * previously published table in place.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CleaningRunService {

    private final RawCsvLoader loader;
    private final CleaningPipeline pipeline;
    private final TableAggregator aggregator;
    private final OutputRouter outputRouter;
    private final CleanedTableRepository repository;
    private final CleanerProperties properties;

    private final ReentrantLock runLock = new ReentrantLock();
    private final AtomicBoolean backgroundRunActive = new AtomicBoolean();

    /** Clean the CSV extract at {@code cleaner.input.csv-path}. */
    public PipelineRun runConfiguredSource() {
        Path path = Paths.get(properties.getInput().getCsvPath());
        return execute(path.toString(), () -> loader.load(path));
    }

    /** Clean rows that were loaded elsewhere. */
    public PipelineRun run(List<RawRecord> rawRecords, String source) {
        return execute(source, () -> rawRecords);
    }

    /**
     * Starts a run of the configured source on a new thread.
     *
     * @return false if a run is already in progress or already started
     */
    public boolean startConfiguredRun() {
        if (runLock.isLocked() || !backgroundRunActive.compareAndSet(false, true)) {
            return false;
        }
        Thread worker = new Thread(() -> {
            try {
                runConfiguredSource();
            } finally {
                backgroundRunActive.set(false);
            }
        }, "manual-clean-run");
        worker.start();
        return true;
    }

    public boolean isRunning() {
        return backgroundRunActive.get() || runLock.isLocked();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private PipelineRun execute(String source, Supplier<List<RawRecord>> rawSource) {
        runLock.lock();
        try {
            PipelineRun run = PipelineRun.builder()
                    .runId(UUID.randomUUID().toString())
                    .source(source)
                    .startedAt(LocalDateTime.now())
                    .status("RUNNING")
                    .build();
            log.info("Starting cleaning run {} from {}", run.getRunId(), source);

            try {
                List<RawRecord> raw = rawSource.get();
                run.setRawRecords(raw.size());

                PipelineResult result = pipeline.clean(raw);
                CleanedTable table = result.table();

                outputRouter.write(table.records());

                TableSummary summary = aggregator.summarise(table, properties.getPipeline().getTopComplaintTypes());
                CleanedTableIndex index = CleanedTableIndex.build(table);

                run.setCleanedRecords(table.size());
                run.setStatus("SUCCESS");
                run.setCompletedAt(LocalDateTime.now());

                repository.publish(new CleanedTableRepository.PublishedTable(
                        table, index, summary, result.quality(), run));

            } catch (Exception e) {
                log.error("Cleaning run {} failed: {}", run.getRunId(), e.getMessage(), e);
                run.setStatus("FAILED");
                run.setErrorMessage(e.getMessage());
                run.setCompletedAt(LocalDateTime.now());
                repository.recordRun(run);
            } finally {
                outputRouter.writeRun(run);
            }

            return run;
        } finally {
            runLock.unlock();
        }
    }
}
