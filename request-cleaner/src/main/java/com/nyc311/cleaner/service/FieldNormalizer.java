package com.nyc311.cleaner.service;

import com.nyc311.cleaner.model.Borough;
import com.nyc311.cleaner.model.CleaningRules;
import com.nyc311.cleaner.model.Coordinates;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Locale;

/**
 * Field-level cleaning rules: one raw value in, one cleaned value out.
 *
 * Every method is total. Absent, malformed and out-of-range input all come
 * back as null rather than an exception, so a bad row can only ever be flagged.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FieldNormalizer {

    /** Source layout: MM/DD/YYYY HH:MM:SS AM */
    private static final DateTimeFormatter SOURCE_TIMESTAMP = DateTimeFormatter
            .ofPattern("MM/dd/uuuu hh:mm:ss a", Locale.US)
            .withResolverStyle(ResolverStyle.STRICT);

    private static final int DATE_PREFIX_LENGTH = 10;

    private final CleaningRules rules;

    // ── Dates ────────────────────────────────────────────────────────────────

    /**
     * Reorder the MM/DD/YYYY prefix into a sortable YYYY-MM-DD string.
     *
     * This is positional extraction, not calendar validation: "13/45/2019 ..." comes
     * back as "2019-13-45". Input shorter than the ten-character prefix yields null.
     */
    public String parseDate(String raw) {
        if (isAbsent(raw) || raw.length() < DATE_PREFIX_LENGTH) return null;
        return raw.substring(6, 10) + "-" + raw.substring(0, 2) + "-" + raw.substring(3, 5);
    }

    /**
     * Strict parse of the full source timestamp. Null when absent or when the text
     * is not a real calendar instant in the source layout.
     */
    public LocalDateTime parseTimestamp(String raw) {
        if (isAbsent(raw)) return null;
        try {
            return LocalDateTime.parse(raw.trim(), SOURCE_TIMESTAMP);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable timestamp: {}", raw);
            return null;
        }
    }

    /**
     * Year read from character positions 7-10, the way an integer cast of that
     * substring reads it: leading digits only, 0 when there are none.
     */
    public int extractYear(String raw) {
        if (isAbsent(raw) || raw.length() <= 6) return 0;
        String slice = raw.substring(6, Math.min(raw.length(), DATE_PREFIX_LENGTH)).stripLeading();

        int i = 0;
        boolean negative = false;
        if (i < slice.length() && (slice.charAt(i) == '-' || slice.charAt(i) == '+')) {
            negative = slice.charAt(i) == '-';
            i++;
        }
        int year = 0;
        for (; i < slice.length() && Character.isDigit(slice.charAt(i)); i++) {
            year = year * 10 + Character.digit(slice.charAt(i), 10);
        }
        return negative ? -year : year;
    }

    /** Rows with no created date are admitted; otherwise the extracted year must be in range. */
    public boolean isAdmissibleCreatedDate(String raw) {
        if (isAbsent(raw)) return true;
        int year = extractYear(raw);
        return year >= rules.getMinCreatedYear() && year <= rules.getMaxCreatedYear();
    }

    // ── Borough ──────────────────────────────────────────────────────────────

    /**
     * Map a raw borough spelling to its canonical label.
     *
     * Matching is case-insensitive on the trimmed value. Empty and "Unspecified" give
     * null; values outside the alias table give null unless the rules allow pass-through.
     */
    public String normalizeBorough(String raw) {
        if (isAbsent(raw)) return null;
        String key = raw.trim().toUpperCase(Locale.ROOT);
        if (key.isEmpty() || rules.getUnspecifiedBoroughs().contains(key)) return null;

        Borough borough = rules.getBoroughAliases().get(key);
        if (borough != null) return borough.label();

        if (rules.isRejectUnknownBoroughs()) {
            log.debug("Unrecognised borough dropped: {}", raw);
            return null;
        }
        return key;
    }

    /** True when the raw value names a borough at all (i.e. is not empty or "Unspecified"). */
    public boolean isBoroughSpecified(String raw) {
        if (isAbsent(raw)) return false;
        String key = raw.trim().toUpperCase(Locale.ROOT);
        return !key.isEmpty() && !rules.getUnspecifiedBoroughs().contains(key);
    }

    // ── Coordinates ──────────────────────────────────────────────────────────

    /**
     * Both values must be present, numeric and inside the NYC bounding box
     * (bounds inclusive). If either fails, the pair is dropped.
     */
    public Coordinates validateCoordinates(String rawLatitude, String rawLongitude) {
        Double lat = parseDouble(rawLatitude);
        Double lng = parseDouble(rawLongitude);
        if (lat == null || lng == null) return null;

        boolean latOk = lat >= rules.getMinLatitude() && lat <= rules.getMaxLatitude();
        boolean lngOk = lng >= rules.getMinLongitude() && lng <= rules.getMaxLongitude();
        if (!latOk || !lngOk) {
            log.debug("Coordinates outside NYC bounds: {}, {}", lat, lng);
            return null;
        }
        return new Coordinates(lat, lng);
    }

    // ── Complaint category ───────────────────────────────────────────────────

    public String bucketCategory(String complaintType) {
        if (complaintType != null && rules.getCategoryAllowList().contains(complaintType)) {
            return complaintType;
        }
        return CleaningRules.OTHER_CATEGORY;
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private Double parseDouble(String val) {
        if (val == null || val.isBlank()) return null;
        try {
            return Double.parseDouble(val.trim());
        } catch (NumberFormatException e) {
            log.debug("Non-numeric coordinate: {}", val);
            return null;
        }
    }

    static boolean isAbsent(String val) {
        return val == null || val.isEmpty();
    }
}
