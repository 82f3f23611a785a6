package com.nyc311.cleaner.service;

import com.nyc311.cleaner.model.Coordinates;
import com.nyc311.cleaner.model.QualityFlags;
import com.nyc311.cleaner.model.RawRecord;
import com.nyc311.cleaner.model.SourceColumn;
import org.springframework.stereotype.Component;

/**
 * Computes the quality flags of one row from its normalised fields and raw presence checks.
 */
@Component
public class RecordValidator {

    /**
     * @param raw         the source row
     * @param borough     output of {@link FieldNormalizer#normalizeBorough}
     * @param coordinates output of {@link FieldNormalizer#validateCoordinates}
     */
    public QualityFlags validate(RawRecord raw, String borough, Coordinates coordinates) {
        return new QualityFlags(
                borough != null,
                coordinates != null,
                // presence, not parseability: a non-empty but unparseable date still counts
                !raw.isAbsent(SourceColumn.CREATED_DATE),
                !raw.isAbsent(SourceColumn.CLOSED_DATE)
        );
    }
}
