package com.agriguard.audit;

import com.agriguard.ledger.LogicalClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Appends audit events stamped with the current round and fans them out to
 * subscribers (monitoring hooks). A failing subscriber never aborts the operation
 * that produced the event.
 */
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    static final int MAX_RECENT = 1000;

    private final EventLog eventLog;
    private final LogicalClock clock;
    private final ConcurrentHashMap<String, Consumer<AuditEvent>> subscribers = new ConcurrentHashMap<>();

    public AuditService(EventLog eventLog, LogicalClock clock) {
        this.eventLog = eventLog;
        this.clock = clock;
    }

    public AuditEvent record(EventSource source, String action, long subjectId, String actor, long amount) {
        AuditEvent appended = eventLog.append(
            AuditEvent.draft(source, action, subjectId, actor, clock.currentRound(), amount));
        log.debug("Audit event {} {}:{} subject={} actor={}",
            appended.eventId(), source.getValue(), action, subjectId, actor);
        notifySubscribers(appended);
        return appended;
    }

    public Optional<AuditEvent> getEvent(long eventId) {
        return eventLog.findById(eventId);
    }

    /**
     * The {@code limit} most recent events, oldest first. The limit is clamped to
     * [0, 1000].
     */
    public List<AuditEvent> getRecentEvents(int limit) {
        int bounded = Math.max(0, Math.min(limit, MAX_RECENT));
        long latest = eventLog.getLatestEventId();
        long from = Math.max(1, latest - bounded + 1);
        return eventLog.queryByIdRange(from, latest, bounded);
    }

    public List<AuditEvent> query(Optional<EventSource> source,
                                  Optional<String> action,
                                  Optional<Long> subjectId,
                                  int limit) {
        return eventLog.query(source, action, subjectId, limit);
    }

    public long latestEventId() {
        return eventLog.getLatestEventId();
    }

    public String subscribe(Consumer<AuditEvent> consumer) {
        String id = UUID.randomUUID().toString();
        subscribers.put(id, consumer);
        return id;
    }

    public void unsubscribe(String id) {
        subscribers.remove(id);
    }

    private void notifySubscribers(AuditEvent event) {
        subscribers.values().forEach(consumer -> {
            try {
                consumer.accept(event);
            } catch (Exception ex) {
                log.warn("Subscriber notification failed for event={}: {}",
                    event.eventId(), ex.getMessage());
            }
        });
    }
}
