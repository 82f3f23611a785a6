package com.nyc311.cleaner.service;

import com.nyc311.cleaner.config.CleanerProperties;
import com.nyc311.cleaner.exception.SchemaViolationException;
import com.nyc311.cleaner.model.CleanedRecord;
import com.nyc311.cleaner.model.CleanedTable;
import com.nyc311.cleaner.model.DataQualitySummary;
import com.nyc311.cleaner.model.PipelineResult;
import com.nyc311.cleaner.model.RawRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.nyc311.cleaner.model.SourceColumn.*;

/**
 * Turns a loaded raw extract into the cleaned table.
 *
 * Order of operations:
 *  1. schema check (fatal if any row lacks a source column)
 *  2. deduplicate on unique key, preferring a row that passes the admission check
 *  3. admission filter on the created-date year
 *  4. normalise + validate each admitted row
 *
 * Nothing here does I/O; see {@link CleaningRunService} for loading and writing.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CleaningPipeline {

    private final Deduplicator deduplicator;
    private final CleanedRecordMapper mapper;
    private final FieldNormalizer normalizer;
    private final CleanerProperties properties;

    public PipelineResult clean(List<RawRecord> rawRecords) {
        checkSchema(rawRecords);

        Deduplicator.Result deduped = deduplicator.deduplicate(
                rawRecords, row -> normalizer.isAdmissibleCreatedDate(row.get(CREATED_DATE)));

        List<RawRecord> admitted = new ArrayList<>(deduped.survivors().size());
        int dateFiltered = 0;
        for (RawRecord row : deduped.survivors()) {
            if (normalizer.isAdmissibleCreatedDate(row.get(CREATED_DATE))) {
                admitted.add(row);
            } else {
                dateFiltered++;
                log.debug("Excluded {}: created date '{}' outside admitted years", row.get(UNIQUE_KEY), row.get(CREATED_DATE));
            }
        }

        // survivors are already in key order; an ordered collect keeps it that way
        Stream<RawRecord> stream = properties.getPipeline().isParallel()
                ? admitted.parallelStream()
                : admitted.stream();
        List<CleanedRecord> cleaned = stream.map(mapper::map).collect(Collectors.toList());

        DataQualitySummary quality = summarise(rawRecords.size(), deduped, dateFiltered, admitted, cleaned);
        logSummary(quality);

        return new PipelineResult(new CleanedTable(cleaned), quality);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void checkSchema(List<RawRecord> rawRecords) {
        for (int i = 0; i < rawRecords.size(); i++) {
            List<String> missing = rawRecords.get(i).missingColumns();
            if (!missing.isEmpty()) {
                throw new SchemaViolationException(missing, "row " + i);
            }
        }
    }

    private DataQualitySummary summarise(int rawCount, Deduplicator.Result deduped, int dateFiltered,
                                         List<RawRecord> admitted, List<CleanedRecord> cleaned) {
        int unparseableDates = 0;
        int rejectedCoords = 0;
        int unknownBoroughs = 0;
        int validBorough = 0, validCoords = 0, validCreated = 0, closed = 0;

        for (int i = 0; i < cleaned.size(); i++) {
            RawRecord raw = admitted.get(i);
            CleanedRecord rec = cleaned.get(i);

            if (!raw.isAbsent(CREATED_DATE) && rec.getCreatedAt() == null) unparseableDates++;
            if ((!raw.isAbsent(LATITUDE) || !raw.isAbsent(LONGITUDE)) && !rec.getFlags().hasValidCoordinates()) {
                rejectedCoords++;
            }
            if (normalizer.isBoroughSpecified(raw.get(BOROUGH)) && rec.getBorough() == null) unknownBoroughs++;

            if (rec.getFlags().hasValidBorough()) validBorough++;
            if (rec.getFlags().hasValidCoordinates()) validCoords++;
            if (rec.getFlags().hasValidCreatedDate()) validCreated++;
            if (rec.getFlags().hasClosedDate()) closed++;
        }

        return DataQualitySummary.builder()
                .rawRecords(rawCount)
                .missingKeyRecords(deduped.missingKeys())
                .duplicatesRemoved(deduped.duplicatesRemoved())
                .dateFilteredRecords(dateFiltered)
                .cleanedRecords(cleaned.size())
                .unparseableCreatedDates(unparseableDates)
                .rejectedCoordinates(rejectedCoords)
                .unrecognisedBoroughs(unknownBoroughs)
                .withValidBorough(validBorough)
                .withValidCoordinates(validCoords)
                .withValidCreatedDate(validCreated)
                .withClosedDate(closed)
                .build();
    }

    private void logSummary(DataQualitySummary q) {
        log.info("Cleaned {} of {} raw rows ({} duplicates, {} without key, {} outside date range)",
                q.getCleanedRecords(), q.getRawRecords(), q.getDuplicatesRemoved(),
                q.getMissingKeyRecords(), q.getDateFilteredRecords());
        if (q.getUnparseableCreatedDates() > 0 || q.getRejectedCoordinates() > 0 || q.getUnrecognisedBoroughs() > 0) {
            log.warn("Data quality: {} unparseable created dates, {} rejected coordinate pairs, {} unrecognised boroughs",
                    q.getUnparseableCreatedDates(), q.getRejectedCoordinates(), q.getUnrecognisedBoroughs());
        }
    }
}
