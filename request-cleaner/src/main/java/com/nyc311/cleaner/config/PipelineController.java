package com.nyc311.cleaner.config;

import com.nyc311.cleaner.service.CleanedTableRepository;
import com.nyc311.cleaner.service.CleaningRunService;
import com.nyc311.cleaner.service.ServiceRequestQueryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class PipelineController {

    private final CleaningRunService runService;
    private final ServiceRequestQueryService queryService;
    private final CleanedTableRepository repository;

    // ── Pipeline ──────────────────────────────────────────────────────────────

    @PostMapping("/pipeline/run")
    public ResponseEntity<Map<String, String>> triggerRun() {
        if (!runService.startConfiguredRun()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "a cleaning run is already in progress"));
        }
        return ResponseEntity.accepted().body(Map.of("status", "accepted"));
    }

    @GetMapping("/pipeline/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "nyc311-request-cleaner");
        body.put("running", runService.isRunning());
        repository.lastRun().ifPresent(run -> body.put("lastRun", run));
        repository.current().ifPresent(published -> {
            body.put("publishedRunId", published.run().getRunId());
            body.put("quality", published.quality());
        });
        return ResponseEntity.ok(body);
    }

    // ── Cleaned table queries ─────────────────────────────────────────────────

    /**
     * Aggregate view of the published table.
     *
     * GET /requests/summary
     */
    @GetMapping("/requests/summary")
    public ResponseEntity<?> summary() {
        try {
            return ResponseEntity.ok(queryService.summary());
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * Records kept without a created date, which no date-range query returns.
     *
     * GET /requests/undated?limit=100
     */
    @GetMapping("/requests/undated")
    public ResponseEntity<?> undated(@RequestParam(defaultValue = "100") int limit) {
        try {
            return ResponseEntity.ok(queryService.findWithoutCreatedDate(limit));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * Exact lookup.
     *
     * GET /requests/12345678
     */
    @GetMapping("/requests/{uniqueKey}")
    public ResponseEntity<?> byKey(@PathVariable String uniqueKey) {
        try {
            return queryService.findByKey(uniqueKey)
                    .<ResponseEntity<?>>map(ResponseEntity::ok)
                    .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                            .body(Map.of("error", "No request with unique key " + uniqueKey)));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * Filtered search.
     *
     * GET /requests?complaintType=Rodent&borough=brooklyn&from=2023-01-01&to=2023-12-31&limit=100
     */
    @GetMapping("/requests")
    public ResponseEntity<?> search(
            @RequestParam(required = false) String complaintType,
            @RequestParam(required = false) String borough,
            @RequestParam(required = false) String from,
            @RequestParam(required = false) String to,
            @RequestParam(defaultValue = "100") int limit) {
        try {
            return ResponseEntity.ok(queryService.search(complaintType, borough, from, to, limit));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Search failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }
}
