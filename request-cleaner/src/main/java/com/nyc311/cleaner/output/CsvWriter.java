package com.nyc311.cleaner.output;

import com.nyc311.cleaner.config.CleanerProperties;
import com.nyc311.cleaner.model.CleanedRecord;
import com.opencsv.CSVWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Writes the cleaned table to CSV.
 *
 * Output path: {outputDir}/311_cleaned.csv, replaced as a whole on each run.
 * The file is written next to the target first and moved into place, so a failed
 * run never leaves a half-written table behind.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvWriter {

    static final String FILE_NAME = "311_cleaned.csv";

    private final CleanerProperties properties;

    public Path write(List<CleanedRecord> records) {
        Path outputDir = Paths.get(properties.getOutput().getCsv().getOutputDir());
        ensureDirectory(outputDir);

        Path outputPath = outputDir.resolve(FILE_NAME);
        Path tmpPath = outputDir.resolve(FILE_NAME + ".tmp");

        try (CSVWriter writer = new CSVWriter(
                Files.newBufferedWriter(tmpPath, StandardCharsets.UTF_8),
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            if (properties.getOutput().getCsv().isIncludeHeader()) {
                writer.writeNext(CleanedColumns.NAMES);
            }

            for (CleanedRecord r : records) {
                writer.writeNext(toRow(r));
            }

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", tmpPath, e.getMessage(), e);
            throw new RuntimeException("CSV write failed", e);
        }

        try {
            Files.move(tmpPath, outputPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new RuntimeException("Cannot move " + tmpPath + " to " + outputPath, e);
        }

        log.info("Written {} records to CSV: {}", records.size(), outputPath);
        return outputPath;
    }

    private String[] toRow(CleanedRecord r) {
        Object[] values = CleanedColumns.values(r);
        String[] row = new String[values.length];
        for (int i = 0; i < values.length; i++) {
            row[i] = str(values[i]);
        }
        return row;
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new RuntimeException("Cannot create output directory: " + dir, e);
        }
    }
}
