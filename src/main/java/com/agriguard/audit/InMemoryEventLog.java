package com.agriguard.audit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

public class InMemoryEventLog implements EventLog {

    private final CopyOnWriteArrayList<AuditEvent> events = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong(0);

    @Override
    public AuditEvent append(AuditEvent event) {
        AuditEvent stored = event.withEventId(sequence.incrementAndGet());
        events.add(stored);
        return stored;
    }

    @Override
    public Optional<AuditEvent> findById(long eventId) {
        // ids are dense and start at 1
        if (eventId < 1 || eventId > events.size()) {
            return Optional.empty();
        }
        return Optional.of(events.get((int) (eventId - 1)));
    }

    @Override
    public List<AuditEvent> query(Optional<EventSource> source,
                                  Optional<String> action,
                                  Optional<Long> subjectId,
                                  int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }

        return events.stream()
            .filter(e -> source.map(s -> s == e.source()).orElse(true))
            .filter(e -> action.map(a -> a.equals(e.action())).orElse(true))
            .filter(e -> subjectId.map(id -> id == e.subjectId()).orElse(true))
            .limit(limit)
            .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public long getLatestEventId() {
        return sequence.get();
    }

    @Override
    public List<AuditEvent> queryByIdRange(long fromInclusive, long toInclusive, int limit) {
        if (limit <= 0 || toInclusive < fromInclusive) {
            return Collections.emptyList();
        }
        return events.stream()
            .filter(e -> e.eventId() >= fromInclusive && e.eventId() <= toInclusive)
            .limit(limit)
            .collect(Collectors.toCollection(ArrayList::new));
    }
}
