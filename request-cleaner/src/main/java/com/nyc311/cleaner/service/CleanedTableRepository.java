package com.nyc311.cleaner.service;

import com.nyc311.cleaner.model.CleanedTable;
import com.nyc311.cleaner.model.DataQualitySummary;
import com.nyc311.cleaner.model.PipelineRun;
import com.nyc311.cleaner.model.TableSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the most recently published cleaned table with its index and summaries.
 *
 * A run publishes in one reference swap after all of its output has been written,
 * so readers see either the previous table or the new one, never a mix.
 */
@Component
@Slf4j
public class CleanedTableRepository {

    public record PublishedTable(
            CleanedTable table,
            CleanedTableIndex index,
            TableSummary summary,
            DataQualitySummary quality,
            PipelineRun run) {}

    private final AtomicReference<PublishedTable> current = new AtomicReference<>();
    private final AtomicReference<PipelineRun> lastRun = new AtomicReference<>();

    public void publish(PublishedTable published) {
        current.set(published);
        lastRun.set(published.run());
        log.info("Published cleaned table from run {} ({} records)",
                published.run().getRunId(), published.table().size());
    }

    /** Records a run that did not publish (e.g. a failure); the current table stays. */
    public void recordRun(PipelineRun run) {
        lastRun.set(run);
    }

    public Optional<PublishedTable> current() {
        return Optional.ofNullable(current.get());
    }

    /** @throws IllegalStateException if no run has published a table yet */
    public PublishedTable require() {
        PublishedTable published = current.get();
        if (published == null) {
            throw new IllegalStateException("No cleaned table has been published yet");
        }
        return published;
    }

    public Optional<PipelineRun> lastRun() {
        return Optional.ofNullable(lastRun.get());
    }
}
