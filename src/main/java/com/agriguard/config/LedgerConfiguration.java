package com.agriguard.config;

import com.agriguard.audit.AuditService;
import com.agriguard.audit.EventLog;
import com.agriguard.audit.InMemoryEventLog;
import com.agriguard.audit.StatsAggregator;
import com.agriguard.ledger.InMemoryTreasury;
import com.agriguard.ledger.LedgerExecutor;
import com.agriguard.ledger.ManualLogicalClock;
import com.agriguard.ledger.Treasury;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Execution substrate shared by both engines: clock, global lock, treasury and the
 * audit trail.
 */
@Configuration
public class LedgerConfiguration {

    @Bean
    public ManualLogicalClock logicalClock(AgriGuardProperties properties) {
        return new ManualLogicalClock(properties.clock().initialRound());
    }

    @Bean
    public LedgerExecutor ledgerExecutor() {
        return new LedgerExecutor();
    }

    @Bean
    public Treasury treasury(AgriGuardProperties properties) {
        return new InMemoryTreasury(properties.treasury().initialBalance());
    }

    @Bean
    public EventLog eventLog() {
        return new InMemoryEventLog();
    }

    @Bean
    public AuditService auditService(EventLog eventLog, ManualLogicalClock clock) {
        return new AuditService(eventLog, clock);
    }

    @Bean
    public StatsAggregator statsAggregator() {
        return new StatsAggregator();
    }
}
