package com.agriguard.audit;

import java.util.List;
import java.util.Optional;

public interface EventLog {
    AuditEvent append(AuditEvent event);

    Optional<AuditEvent> findById(long eventId);

    List<AuditEvent> query(Optional<EventSource> source,
                           Optional<String> action,
                           Optional<Long> subjectId,
                           int limit);

    long getLatestEventId();

    List<AuditEvent> queryByIdRange(long fromInclusive, long toInclusive, int limit);
}
