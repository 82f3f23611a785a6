package com.nyc311.cleaner.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Normalised service request ready for analysis and persistence.
 *
 * Schema design notes:
 *  - unique_key is unique across a cleaned table
 *  - borough is one of the canonical labels, or null
 *  - latitude and longitude are both set or both null
 *  - created_date / closed_date are sortable YYYY-MM-DD strings cut from the raw text;
 *    created_at / closed_at are the strict timestamp parse and may be null on their own
 */
@Value
@Builder
public class CleanedRecord {

    // ── Identity ────────────────────────────────────────────────────────────
    String uniqueKey;

    // ── Time ────────────────────────────────────────────────────────────────
    /** Source text, e.g. "03/15/2019 10:04:12 AM" */
    String createdDateRaw;
    String closedDateRaw;

    /** YYYY-MM-DD, the created-date index key */
    String createdDate;
    String closedDate;

    LocalDateTime createdAt;
    LocalDateTime closedAt;

    /** Hours from creation to closure; null when unknown or negative */
    Double responseTimeHours;

    // ── Agency ──────────────────────────────────────────────────────────────
    String agency;
    String agencyName;

    // ── Classification ──────────────────────────────────────────────────────
    String complaintType;

    /** complaintType when it is on the allow-list, otherwise "Other" */
    String complaintCategory;

    String descriptor;
    String locationType;

    // ── Location ────────────────────────────────────────────────────────────
    String incidentZip;
    String incidentAddress;
    String city;
    String borough;
    Double latitude;
    Double longitude;
    String communityBoard;

    // ── Resolution ──────────────────────────────────────────────────────────
    String status;
    String resolutionDescription;
    String resolutionActionDate;

    // ── Quality ─────────────────────────────────────────────────────────────
    QualityFlags flags;
}
