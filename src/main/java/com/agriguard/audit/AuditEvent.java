package com.agriguard.audit;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * One entry of the append-only audit trail.
 *
 * {@code subjectId} is the policy id for insurance events and the dispute id for
 * dispute and bridge events (0 for registry-level events such as juror registration).
 * {@code amount} is the coverage or payout for insurance events and the vote value
 * for dispute events.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AuditEvent(
    @JsonProperty("event_id") long eventId,
    @JsonProperty("source") EventSource source,
    @JsonProperty("action") String action,
    @JsonProperty("subject_id") long subjectId,
    @JsonProperty("actor") String actor,
    @JsonProperty("round") long round,
    @JsonProperty("amount") long amount
) {

    /** An event not yet appended; the log assigns the id. */
    public static AuditEvent draft(EventSource source, String action, long subjectId,
                                   String actor, long round, long amount) {
        return new AuditEvent(0L, source, action, subjectId, actor, round, amount);
    }

    public AuditEvent withEventId(long id) {
        return new AuditEvent(id, source, action, subjectId, actor, round, amount);
    }
}
