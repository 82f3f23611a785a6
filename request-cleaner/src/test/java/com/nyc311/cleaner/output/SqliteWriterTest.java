package com.nyc311.cleaner.output;

import com.nyc311.cleaner.TestRows;
import com.nyc311.cleaner.model.CleanedRecord;
import com.nyc311.cleaner.model.PipelineRun;
import com.nyc311.cleaner.model.SourceColumn;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class SqliteWriterTest {

    @TempDir
    Path dir;

    private JdbcTemplate jdbcTemplate;
    private SqliteWriter writer;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource("jdbc:sqlite:" + dir.resolve("test.db"));
        dataSource.setDriverClassName("org.sqlite.JDBC");
        jdbcTemplate = new JdbcTemplate(dataSource);
        writer = new SqliteWriter(jdbcTemplate, new TransactionTemplate(new DataSourceTransactionManager(dataSource)));
        writer.ensureSchema();
    }

    @Test
    void materialisesCleanedTableWithIndexes() {
        List<CleanedRecord> records = TestRows.pipeline().clean(List.of(
                TestRows.row("1").with(SourceColumn.BOROUGH, "the bronx").build(),
                TestRows.row("2").with(SourceColumn.BOROUGH, "").with(SourceColumn.LATITUDE, "99").build()
        )).table().records();

        writer.replaceCleanedTable(records);

        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM \"311_cleaned\"", Integer.class)).isEqualTo(2);

        Map<String, Object> bronx = jdbcTemplate.queryForMap("SELECT * FROM \"311_cleaned\" WHERE unique_key = '1'");
        assertThat(bronx.get("borough")).isEqualTo("BRONX");
        assertThat(((Number) bronx.get("has_valid_borough")).intValue()).isEqualTo(1);
        assertThat(((Number) bronx.get("latitude")).doubleValue()).isEqualTo(40.6782);
        assertThat(bronx.get("created_date_parsed")).isEqualTo("2019-03-15");

        Map<String, Object> other = jdbcTemplate.queryForMap("SELECT * FROM \"311_cleaned\" WHERE unique_key = '2'");
        assertThat(other.get("borough")).isNull();
        assertThat(other.get("latitude")).isNull();
        assertThat(((Number) other.get("has_valid_coordinates")).intValue()).isZero();

        List<String> indexes = jdbcTemplate.queryForList(
                "SELECT name FROM sqlite_master WHERE type = 'index' AND tbl_name = '311_cleaned'", String.class);
        assertThat(indexes).contains(
                "idx_cleaned_borough", "idx_cleaned_complaint_type", "idx_cleaned_created_date", "idx_cleaned_unique_key");
    }

    @Test
    void rerunReplacesTheWholeTable() {
        writer.replaceCleanedTable(TestRows.pipeline().clean(List.of(
                TestRows.row("1").build(), TestRows.row("2").build())).table().records());
        writer.replaceCleanedTable(TestRows.pipeline().clean(List.of(
                TestRows.row("3").build())).table().records());

        assertThat(jdbcTemplate.queryForList("SELECT unique_key FROM \"311_cleaned\"", String.class))
                .containsExactly("3");
    }

    @Test
    void writesMoreThanOneBatch() {
        List<com.nyc311.cleaner.model.RawRecord> rows = new ArrayList<>();
        for (int i = 0; i < 2500; i++) {
            rows.add(TestRows.row(String.valueOf(i)).build());
        }

        writer.replaceCleanedTable(TestRows.pipeline().clean(rows).table().records());

        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM \"311_cleaned\"", Integer.class)).isEqualTo(2500);
    }

    @Test
    void failedReplaceKeepsPreviousTable() {
        writer.replaceCleanedTable(TestRows.pipeline().clean(List.of(TestRows.row("1").build())).table().records());

        CleanedRecord first = TestRows.pipeline().clean(List.of(TestRows.row("5").build())).table().records().get(0);
        // the unique index rejects the second copy after the table has already been dropped and refilled
        List<CleanedRecord> duplicated = List.of(first, first);

        assertThatThrownBy(() -> writer.replaceCleanedTable(duplicated)).isInstanceOf(RuntimeException.class);
        assertThat(jdbcTemplate.queryForList("SELECT unique_key FROM \"311_cleaned\"", String.class))
                .containsExactly("1");
    }

    @Test
    void recordsPipelineRuns() {
        writer.writeRun(PipelineRun.builder()
                .runId("run-1")
                .source("in-memory")
                .startedAt(LocalDateTime.of(2024, 1, 1, 2, 0))
                .completedAt(LocalDateTime.of(2024, 1, 1, 2, 5))
                .status("SUCCESS")
                .rawRecords(10)
                .cleanedRecords(8)
                .build());

        Map<String, Object> run = jdbcTemplate.queryForMap("SELECT * FROM pipeline_runs WHERE run_id = 'run-1'");
        assertThat(run.get("status")).isEqualTo("SUCCESS");
        assertThat(((Number) run.get("cleaned_records")).intValue()).isEqualTo(8);
        assertThat(run.get("error_message")).isNull();
    }
}
