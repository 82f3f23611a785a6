package com.nyc311.cleaner.output;

import com.nyc311.cleaner.TestRows;
import com.nyc311.cleaner.config.CleanerProperties;
import com.nyc311.cleaner.model.CleanedRecord;
import com.nyc311.cleaner.model.SourceColumn;
import com.opencsv.CSVReader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CsvWriterTest {

    @Test
    void writesHeaderAndOneLinePerRecord(@TempDir Path dir) throws Exception {
        CleanerProperties properties = new CleanerProperties();
        properties.getOutput().getCsv().setOutputDir(dir.toString());
        CsvWriter writer = new CsvWriter(properties);

        List<CleanedRecord> records = TestRows.pipeline().clean(List.of(
                TestRows.row("1").build(),
                TestRows.row("2").with(SourceColumn.LATITUDE, "").with(SourceColumn.INCIDENT_ADDRESS, "1 BROADWAY, NY").build()
        )).table().records();

        Path out = writer.write(records);

        assertThat(out).isEqualTo(dir.resolve("311_cleaned.csv"));
        assertThat(dir.resolve("311_cleaned.csv.tmp")).doesNotExist();

        List<String[]> rows;
        try (Reader reader = Files.newBufferedReader(out); CSVReader csv = new CSVReader(reader)) {
            rows = csv.readAll();
        }
        assertThat(rows).hasSize(3);
        assertThat(rows.get(0)).isEqualTo(CleanedColumns.NAMES);

        int address = List.of(CleanedColumns.NAMES).indexOf("incident_address");
        int coords = List.of(CleanedColumns.NAMES).indexOf("has_valid_coordinates");
        int latitude = List.of(CleanedColumns.NAMES).indexOf("latitude");
        assertThat(rows.get(1)[coords]).isEqualTo("1");
        assertThat(rows.get(2)[coords]).isEqualTo("0");
        assertThat(rows.get(2)[latitude]).isEmpty();
        assertThat(rows.get(2)[address]).isEqualTo("1 BROADWAY, NY");
    }

    @Test
    void headerCanBeSwitchedOff(@TempDir Path dir) throws Exception {
        CleanerProperties properties = new CleanerProperties();
        properties.getOutput().getCsv().setOutputDir(dir.resolve("nested").toString());
        properties.getOutput().getCsv().setIncludeHeader(false);

        Path out = new CsvWriter(properties).write(
                TestRows.pipeline().clean(List.of(TestRows.row("1").build())).table().records());

        assertThat(Files.readAllLines(out)).hasSize(1);
    }
}
