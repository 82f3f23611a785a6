package com.nyc311.cleaner.service;

import com.nyc311.cleaner.model.CleanedRecord;
import com.nyc311.cleaner.model.Coordinates;
import com.nyc311.cleaner.model.QualityFlags;
import com.nyc311.cleaner.model.RawRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;

import static com.nyc311.cleaner.model.SourceColumn.*;

/**
 * Maps one admitted raw row to its CleanedRecord by composing the field normalizer
 * and the record validator.
 */
@Component
@RequiredArgsConstructor
public class CleanedRecordMapper {

    private final FieldNormalizer normalizer;
    private final RecordValidator validator;

    public CleanedRecord map(RawRecord raw) {
        String borough = normalizer.normalizeBorough(raw.get(BOROUGH));
        Coordinates coords = normalizer.validateCoordinates(raw.get(LATITUDE), raw.get(LONGITUDE));
        QualityFlags flags = validator.validate(raw, borough, coords);

        LocalDateTime createdAt = normalizer.parseTimestamp(raw.get(CREATED_DATE));
        LocalDateTime closedAt = normalizer.parseTimestamp(raw.get(CLOSED_DATE));
        String complaintType = emptyToNull(raw.get(COMPLAINT_TYPE));

        return CleanedRecord.builder()
                .uniqueKey(raw.get(UNIQUE_KEY))
                .createdDateRaw(emptyToNull(raw.get(CREATED_DATE)))
                .closedDateRaw(emptyToNull(raw.get(CLOSED_DATE)))
                .createdDate(normalizer.parseDate(raw.get(CREATED_DATE)))
                .closedDate(normalizer.parseDate(raw.get(CLOSED_DATE)))
                .createdAt(createdAt)
                .closedAt(closedAt)
                .responseTimeHours(responseHours(createdAt, closedAt))
                .agency(emptyToNull(raw.get(AGENCY)))
                .agencyName(emptyToNull(raw.get(AGENCY_NAME)))
                .complaintType(complaintType)
                .complaintCategory(normalizer.bucketCategory(complaintType))
                .descriptor(emptyToNull(raw.get(DESCRIPTOR)))
                .locationType(emptyToNull(raw.get(LOCATION_TYPE)))
                .incidentZip(emptyToNull(raw.get(INCIDENT_ZIP)))
                .incidentAddress(emptyToNull(raw.get(INCIDENT_ADDRESS)))
                .city(emptyToNull(raw.get(CITY)))
                .borough(borough)
                .latitude(coords != null ? coords.latitude() : null)
                .longitude(coords != null ? coords.longitude() : null)
                .communityBoard(emptyToNull(raw.get(COMMUNITY_BOARD)))
                .status(emptyToNull(raw.get(STATUS)))
                .resolutionDescription(emptyToNull(raw.get(RESOLUTION_DESCRIPTION)))
                .resolutionActionDate(emptyToNull(raw.get(RESOLUTION_ACTION_UPDATED_DATE)))
                .flags(flags)
                .build();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    /** Negative durations are data-entry errors and are treated as unknown. */
    private Double responseHours(LocalDateTime createdAt, LocalDateTime closedAt) {
        if (createdAt == null || closedAt == null) return null;
        long seconds = Duration.between(createdAt, closedAt).getSeconds();
        if (seconds < 0) return null;
        return seconds / 3600.0;
    }

    private String emptyToNull(String val) {
        return (val == null || val.isEmpty()) ? null : val;
    }
}
