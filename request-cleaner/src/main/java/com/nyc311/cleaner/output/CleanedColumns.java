package com.nyc311.cleaner.output;

import com.nyc311.cleaner.model.CleanedRecord;

/**
 * Column layout of the cleaned table, shared by the SQLite and CSV sinks.
 * Flags are written as 0/1.
 */
final class CleanedColumns {

    static final String[] NAMES = {
            "unique_key",
            "created_date_raw", "closed_date_raw",
            "created_date_parsed", "closed_date_parsed",
            "created_at", "closed_at", "response_time_hours",
            "agency", "agency_name",
            "complaint_type", "complaint_category",
            "descriptor", "location_type",
            "incident_zip", "incident_address", "city", "borough",
            "latitude", "longitude", "community_board",
            "status", "resolution_description", "resolution_action_date",
            "has_valid_borough", "has_valid_coordinates", "has_valid_created_date", "has_closed_date"
    };

    private CleanedColumns() {}

    static Object[] values(CleanedRecord r) {
        return new Object[]{
                r.getUniqueKey(),
                r.getCreatedDateRaw(), r.getClosedDateRaw(),
                r.getCreatedDate(), r.getClosedDate(),
                r.getCreatedAt() != null ? r.getCreatedAt().toString() : null,
                r.getClosedAt() != null ? r.getClosedAt().toString() : null,
                r.getResponseTimeHours(),
                r.getAgency(), r.getAgencyName(),
                r.getComplaintType(), r.getComplaintCategory(),
                r.getDescriptor(), r.getLocationType(),
                r.getIncidentZip(), r.getIncidentAddress(), r.getCity(), r.getBorough(),
                r.getLatitude(), r.getLongitude(), r.getCommunityBoard(),
                r.getStatus(), r.getResolutionDescription(), r.getResolutionActionDate(),
                flag(r.getFlags().hasValidBorough()),
                flag(r.getFlags().hasValidCoordinates()),
                flag(r.getFlags().hasValidCreatedDate()),
                flag(r.getFlags().hasClosedDate())
        };
    }

    private static int flag(boolean value) {
        return value ? 1 : 0;
    }
}
