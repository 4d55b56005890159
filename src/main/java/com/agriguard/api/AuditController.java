package com.agriguard.api;

import com.agriguard.audit.AuditEvent;
import com.agriguard.audit.AuditService;
import com.agriguard.audit.EventSource;
import com.agriguard.audit.StatsAggregator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the audit trail and the running counters.
 */
@RestController
@RequestMapping("/v1")
public class AuditController {

    private final AuditService auditService;
    private final StatsAggregator statsAggregator;

    public AuditController(AuditService auditService, StatsAggregator statsAggregator) {
        this.auditService = auditService;
        this.statsAggregator = statsAggregator;
    }

    @GetMapping("/events/{eventId}")
    public ResponseEntity<AuditEvent> event(@PathVariable long eventId) {
        return auditService.getEvent(eventId)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/events/recent")
    public List<AuditEvent> recent(@RequestParam(defaultValue = "20") int limit) {
        return auditService.getRecentEvents(limit);
    }

    @GetMapping("/events")
    public List<AuditEvent> query(@RequestParam(required = false) String source,
                                  @RequestParam(required = false) String action,
                                  @RequestParam(name = "subject_id", required = false) Long subjectId,
                                  @RequestParam(defaultValue = "100") int limit) {
        return auditService.query(
            Optional.ofNullable(source).map(EventSource::fromValue),
            Optional.ofNullable(action),
            Optional.ofNullable(subjectId),
            Math.min(limit, 1000)
        );
    }

    @GetMapping("/statistics")
    public StatsAggregator.Snapshot statistics() {
        return statsAggregator.snapshot();
    }
}
