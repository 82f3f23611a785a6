package com.nyc311.cleaner.service;

import com.nyc311.cleaner.model.CleanedRecord;
import com.nyc311.cleaner.model.TableSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Queries the published cleaned table through its index.
 *
 * Access patterns: exact lookup by unique key, filter by complaint type and/or borough,
 * and created-date ranges. Borough filters accept any alias the cleaner understands,
 * so "the bronx" finds BRONX.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ServiceRequestQueryService {

    private static final Pattern ISO_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");

    private final CleanedTableRepository repository;
    private final FieldNormalizer normalizer;

    public Optional<CleanedRecord> findByKey(String uniqueKey) {
        return repository.require().index().findByKey(uniqueKey);
    }

    public TableSummary summary() {
        return repository.require().summary();
    }

    /**
     * Records matching every given filter; null filters are ignored.
     *
     * @param complaintType exact complaint type, e.g. "Noise - Residential"
     * @param borough       borough name or alias
     * @param from          inclusive lower bound on created date, YYYY-MM-DD
     * @param to            inclusive upper bound on created date, YYYY-MM-DD
     * @param limit         maximum number of records returned
     */
    public List<CleanedRecord> search(String complaintType, String borough, String from, String to, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1");
        }
        validateDate("from", from);
        validateDate("to", to);

        CleanedTableRepository.PublishedTable published = repository.require();
        CleanedTableIndex index = published.index();

        String canonicalBorough = null;
        if (borough != null) {
            canonicalBorough = normalizer.normalizeBorough(borough);
            if (canonicalBorough == null) {
                throw new IllegalArgumentException("Unknown borough: " + borough);
            }
        }

        // start from the narrowest index the filters allow, then filter the rest in memory
        List<CleanedRecord> candidates;
        Predicate<CleanedRecord> filter = r -> true;
        if (complaintType != null) {
            candidates = index.findByComplaintType(complaintType);
            if (canonicalBorough != null) {
                String b = canonicalBorough;
                filter = filter.and(r -> b.equals(r.getBorough()));
            }
            if (from != null || to != null) {
                filter = filter.and(createdWithin(from, to));
            }
        } else if (canonicalBorough != null) {
            candidates = index.findByBorough(canonicalBorough);
            if (from != null || to != null) {
                filter = filter.and(createdWithin(from, to));
            }
        } else if (from != null || to != null) {
            candidates = index.findCreatedBetween(from, to);
        } else {
            candidates = published.table().records();
        }

        List<CleanedRecord> result = candidates.stream().filter(filter).limit(limit).toList();
        log.debug("Search type={} borough={} from={} to={} → {} records",
                complaintType, canonicalBorough, from, to, result.size());
        return result;
    }

    public List<CleanedRecord> findWithoutCreatedDate(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1");
        }
        return repository.require().index().findWithoutCreatedDate().stream().limit(limit).toList();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private Predicate<CleanedRecord> createdWithin(String from, String to) {
        return r -> r.getCreatedDate() != null
                && (from == null || r.getCreatedDate().compareTo(from) >= 0)
                && (to == null || r.getCreatedDate().compareTo(to) <= 0);
    }

    private void validateDate(String name, String value) {
        if (value != null && !ISO_DATE.matcher(value).matches()) {
            throw new IllegalArgumentException(name + " must be YYYY-MM-DD");
        }
    }
}
