package com.nyc311.cleaner.model;

import java.util.Arrays;
import java.util.List;

/**
 * Fixed column set of the raw 311 extract, by exact header name.
 * A run without every one of these columns cannot proceed.
 */
public enum SourceColumn {

    UNIQUE_KEY("Unique Key"),
    CREATED_DATE("Created Date"),
    CLOSED_DATE("Closed Date"),
    AGENCY("Agency"),
    AGENCY_NAME("Agency Name"),
    COMPLAINT_TYPE("Complaint Type"),
    DESCRIPTOR("Descriptor"),
    LOCATION_TYPE("Location Type"),
    INCIDENT_ZIP("Incident Zip"),
    INCIDENT_ADDRESS("Incident Address"),
    CITY("City"),
    BOROUGH("Borough"),
    LATITUDE("Latitude"),
    LONGITUDE("Longitude"),
    STATUS("Status"),
    RESOLUTION_DESCRIPTION("Resolution Description"),
    RESOLUTION_ACTION_UPDATED_DATE("Resolution Action Updated Date"),
    COMMUNITY_BOARD("Community Board");

    private final String header;

    SourceColumn(String header) {
        this.header = header;
    }

    public String header() {
        return header;
    }

    public static List<String> headers() {
        return Arrays.stream(values()).map(SourceColumn::header).toList();
    }
}
