package com.nyc311.cleaner.output;

import com.nyc311.cleaner.model.CleanedRecord;
import com.nyc311.cleaner.model.PipelineRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Materialises the cleaned table in SQLite as "311_cleaned".
 *
 * The table is dropped, recreated, filled and indexed inside one transaction:
 * readers see the old table or the complete new one.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SqliteWriter {

    static final String CLEANED_TABLE = "\"311_cleaned\"";
    private static final int BATCH_SIZE = 1000;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public void ensureSchema() {
        log.info("Ensuring SQLite schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS pipeline_runs
            (
                run_id              TEXT PRIMARY KEY,
                source              TEXT,
                started_at          TEXT NOT NULL,
                completed_at        TEXT,
                status              TEXT NOT NULL,
                raw_records         INTEGER,
                cleaned_records     INTEGER,
                error_message       TEXT
            )
        """);

        log.info("SQLite schema ready.");
    }

    public void replaceCleanedTable(List<CleanedRecord> records) {
        int total = records.size();
        log.info("Replacing {} with {} records in batches of {}", CLEANED_TABLE, total, BATCH_SIZE);

        transactionTemplate.executeWithoutResult(status -> {
            jdbcTemplate.execute("DROP TABLE IF EXISTS " + CLEANED_TABLE);
            jdbcTemplate.execute(createTableSql());

            String insert = insertSql();
            for (int i = 0; i < total; i += BATCH_SIZE) {
                List<CleanedRecord> batch = records.subList(i, Math.min(i + BATCH_SIZE, total));
                List<Object[]> args = new ArrayList<>(batch.size());
                for (CleanedRecord r : batch) {
                    args.add(CleanedColumns.values(r));
                }
                jdbcTemplate.batchUpdate(insert, args);
                log.debug("Wrote batch {}/{}", Math.min(i + BATCH_SIZE, total), total);
            }

            jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_cleaned_borough ON " + CLEANED_TABLE + "(borough)");
            jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_cleaned_complaint_type ON " + CLEANED_TABLE + "(complaint_type)");
            jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_cleaned_created_date ON " + CLEANED_TABLE + "(created_date_parsed)");
            jdbcTemplate.execute("CREATE UNIQUE INDEX IF NOT EXISTS idx_cleaned_unique_key ON " + CLEANED_TABLE + "(unique_key)");
        });

        log.info("Successfully wrote {} records", total);
    }

    public void writeRun(PipelineRun run) {
        jdbcTemplate.update("""
                INSERT OR REPLACE INTO pipeline_runs
                (run_id, source, started_at, completed_at, status, raw_records, cleaned_records, error_message)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """,
                run.getRunId(),
                run.getSource(),
                Timestamp.valueOf(run.getStartedAt()).toString(),
                run.getCompletedAt() != null ? Timestamp.valueOf(run.getCompletedAt()).toString() : null,
                run.getStatus(),
                run.getRawRecords(),
                run.getCleanedRecords(),
                run.getErrorMessage());
    }

    // ── SQL ──────────────────────────────────────────────────────────────────

    private String createTableSql() {
        StringBuilder sql = new StringBuilder("CREATE TABLE " + CLEANED_TABLE + " (\n");
        for (int i = 0; i < CleanedColumns.NAMES.length; i++) {
            String name = CleanedColumns.NAMES[i];
            sql.append("    ").append(name).append(' ').append(sqlType(name));
            sql.append(i < CleanedColumns.NAMES.length - 1 ? ",\n" : "\n");
        }
        return sql.append(")").toString();
    }

    private String insertSql() {
        String columns = String.join(", ", CleanedColumns.NAMES);
        String placeholders = String.join(", ", Collections.nCopies(CleanedColumns.NAMES.length, "?"));
        return "INSERT INTO " + CLEANED_TABLE + " (" + columns + ") VALUES (" + placeholders + ")";
    }

    private String sqlType(String column) {
        return switch (column) {
            case "unique_key" -> "TEXT NOT NULL";
            case "latitude", "longitude", "response_time_hours" -> "REAL";
            case "has_valid_borough", "has_valid_coordinates", "has_valid_created_date", "has_closed_date" -> "INTEGER NOT NULL";
            default -> "TEXT";
        };
    }
}
