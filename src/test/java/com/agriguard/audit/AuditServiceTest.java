package com.agriguard.audit;

import com.agriguard.ledger.ManualLogicalClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class AuditServiceTest {

    private ManualLogicalClock clock;
    private AuditService audit;

    @BeforeEach
    void setUp() {
        clock = new ManualLogicalClock(10);
        audit = new AuditService(new InMemoryEventLog(), clock);
    }

    private void recordPolicies(int count) {
        for (int i = 1; i <= count; i++) {
            audit.record(EventSource.INSURANCE, "policy_created", i, "farmer-1", 1_000L * i);
        }
    }

    @Nested
    @DisplayName("Recording")
    class Recording {

        @Test
        void eventIdsAreDenseAndIncreasing() {
            AuditEvent first = audit.record(EventSource.INSURANCE, "policy_created", 1L, "farmer-1", 500L);
            clock.advance(3);
            AuditEvent second = audit.record(EventSource.DISPUTE, "dispute_created", 1L, "juror-1", 0L);

            assertEquals(1L, first.eventId());
            assertEquals(2L, second.eventId());
            assertEquals(13L, second.round());
            assertEquals(2L, audit.latestEventId());
            assertEquals(Optional.of(first), audit.getEvent(1L));
            assertTrue(audit.getEvent(3L).isEmpty());
            assertTrue(audit.getEvent(0L).isEmpty());
        }

        @Test
        void failingSubscriberDoesNotBlockOthers() {
            List<AuditEvent> received = new ArrayList<>();
            audit.subscribe(event -> {
                throw new IllegalStateException("monitor down");
            });
            audit.subscribe(received::add);

            AuditEvent event = audit.record(EventSource.BRIDGE, "settlement_forwarded", 4L, "dispute-engine", 10L);

            assertEquals(List.of(event), received);
            assertEquals(1L, audit.latestEventId());
        }

        @Test
        void unsubscribedConsumerStopsReceiving() {
            List<AuditEvent> received = new ArrayList<>();
            String id = audit.subscribe(received::add);
            audit.record(EventSource.INSURANCE, "policy_created", 1L, "farmer-1", 1L);
            audit.unsubscribe(id);
            audit.record(EventSource.INSURANCE, "policy_created", 2L, "farmer-1", 1L);

            assertEquals(1, received.size());
        }
    }

    @Nested
    @DisplayName("Reading")
    class Reading {

        @Test
        void recentEvents_areTheNewestOldestFirst() {
            recordPolicies(5);

            List<AuditEvent> recent = audit.getRecentEvents(3);

            assertEquals(List.of(3L, 4L, 5L), recent.stream().map(AuditEvent::eventId).toList());
        }

        @Test
        void recentEvents_clampTheLimit() {
            recordPolicies(2);

            assertTrue(audit.getRecentEvents(0).isEmpty());
            assertTrue(audit.getRecentEvents(-4).isEmpty());
            assertEquals(2, audit.getRecentEvents(5_000).size());
        }

        @Test
        void query_filtersBySourceActionAndSubject() {
            recordPolicies(3);
            audit.record(EventSource.DISPUTE, "dispute_created", 2L, "juror-1", 0L);
            audit.record(EventSource.DISPUTE, "vote_cast", 2L, "juror-2", 1L);

            assertEquals(2, audit.query(Optional.of(EventSource.DISPUTE), Optional.empty(),
                Optional.empty(), 100).size());
            assertEquals(1, audit.query(Optional.empty(), Optional.of("vote_cast"),
                Optional.empty(), 100).size());
            assertEquals(3, audit.query(Optional.empty(), Optional.empty(),
                Optional.of(2L), 100).size());
            assertEquals(2, audit.query(Optional.empty(), Optional.empty(),
                Optional.empty(), 2).size());
        }
    }
}
