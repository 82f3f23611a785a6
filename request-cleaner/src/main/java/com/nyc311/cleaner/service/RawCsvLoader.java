package com.nyc311.cleaner.service;

import com.nyc311.cleaner.exception.SchemaViolationException;
import com.nyc311.cleaner.model.RawRecord;
import com.nyc311.cleaner.model.SourceColumn;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the raw 311 CSV export into RawRecords.
 *
 * The header row names the columns; every value stays a string. Empty cells are kept
 * as "" and cells missing from a short row as null, both of which the cleaning rules
 * treat as absent. A header without the fixed source columns is rejected up front.
 *
 * Expected columns (the export carries more; extras are kept but unused):
 *   Unique Key, Created Date, Closed Date, Agency, Agency Name, Complaint Type,
 *   Descriptor, Location Type, Incident Zip, Incident Address, City, Borough,
 *   Latitude, Longitude, Status, Resolution Description,
 *   Resolution Action Updated Date, Community Board
 */
@Component
@Slf4j
public class RawCsvLoader {

    private static final char BOM = '\uFEFF';

    public List<RawRecord> load(Path path) {
        log.info("Reading raw extract: {}", path);
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return load(reader, path.toString());
        } catch (IOException e) {
            throw new RuntimeException("Cannot read raw extract " + path + ": " + e.getMessage(), e);
        }
    }

    public List<RawRecord> load(Reader source, String sourceName) {
        try (CSVReader csv = new CSVReader(source)) {
            String[] header = csv.readNext();
            if (header == null) {
                throw new SchemaViolationException(SourceColumn.headers(), sourceName + " is empty");
            }
            header = cleanHeader(header);
            checkHeader(header, sourceName);

            List<RawRecord> records = new ArrayList<>();
            int shortRows = 0;
            String[] cols;
            while ((cols = csv.readNext()) != null) {
                if (cols.length == 1 && cols[0].isEmpty()) continue;   // blank line
                if (cols.length < header.length) shortRows++;

                Map<String, String> values = new HashMap<>();
                for (int i = 0; i < header.length; i++) {
                    values.put(header[i], i < cols.length ? cols[i] : null);
                }
                records.add(RawRecord.of(values));
            }

            if (shortRows > 0) {
                log.warn("{}: {} row(s) had fewer cells than the header; missing cells read as absent",
                        sourceName, shortRows);
            }
            log.info("Loaded {} raw rows and {} columns from {}", records.size(), header.length, sourceName);
            return records;

        } catch (IOException | CsvValidationException e) {
            throw new RuntimeException("CSV read failed for " + sourceName + ": " + e.getMessage(), e);
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private String[] cleanHeader(String[] header) {
        String[] cleaned = new String[header.length];
        for (int i = 0; i < header.length; i++) {
            String name = header[i] == null ? "" : header[i].trim();
            if (i == 0 && !name.isEmpty() && name.charAt(0) == BOM) {
                name = name.substring(1);
            }
            cleaned[i] = name;
        }
        return cleaned;
    }

    private void checkHeader(String[] header, String sourceName) {
        List<String> present = List.of(header);
        List<String> missing = SourceColumn.headers().stream()
                .filter(h -> !present.contains(h))
                .toList();
        if (!missing.isEmpty()) {
            throw new SchemaViolationException(missing, sourceName + " header");
        }
    }
}
