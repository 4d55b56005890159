package com.agriguard.config;

import com.agriguard.audit.AuditService;
import com.agriguard.audit.StatsAggregator;
import com.agriguard.dispute.DisputeEngine;
import com.agriguard.dispute.DisputeStore;
import com.agriguard.dispute.InMemoryDisputeStore;
import com.agriguard.dispute.QuorumMajorityRule;
import com.agriguard.dispute.SeededJurorSelector;
import com.agriguard.ledger.LedgerExecutor;
import com.agriguard.ledger.ManualLogicalClock;
import com.agriguard.ledger.Treasury;
import com.agriguard.policy.InMemoryPolicyStore;
import com.agriguard.policy.PolicyEngine;
import com.agriguard.policy.PolicyStore;
import com.agriguard.settlement.InProcessSettlementBridge;
import com.agriguard.settlement.SettlementBridge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the two engines and the bridge between them.
 *
 * With {@code agriguard.auto-link=true} the admin links the engines to each other
 * (and binds {@code agriguard.oracle} when set) at startup, which is what a single
 * process deployment wants. Otherwise the links stay empty until the admin
 * operations are called.
 */
@Configuration
public class EngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EngineConfiguration.class);

    @Bean
    public PolicyStore policyStore() {
        return new InMemoryPolicyStore();
    }

    @Bean
    public DisputeStore disputeStore() {
        return new InMemoryDisputeStore();
    }

    @Bean
    public PolicyEngine policyEngine(PolicyStore policyStore,
                                     Treasury treasury,
                                     AuditService auditService,
                                     StatsAggregator statsAggregator,
                                     LedgerExecutor ledgerExecutor,
                                     ManualLogicalClock clock,
                                     AgriGuardProperties properties) {
        PolicyEngine engine = new PolicyEngine(policyStore, treasury, auditService, statsAggregator,
            ledgerExecutor, clock, properties.insurance(), properties.admin());
        if (properties.oracle() != null && !properties.oracle().isBlank()) {
            engine.setOracle(properties.oracle(), properties.admin());
        }
        return engine;
    }

    @Bean
    public SettlementBridge settlementBridge(PolicyEngine policyEngine,
                                            AuditService auditService,
                                            LedgerExecutor ledgerExecutor,
                                            ManualLogicalClock clock,
                                            AgriGuardProperties properties) {
        return new InProcessSettlementBridge(policyEngine, auditService, ledgerExecutor, clock,
            properties.dispute().address());
    }

    @Bean
    public DisputeEngine disputeEngine(DisputeStore disputeStore,
                                       SettlementBridge settlementBridge,
                                       PolicyEngine policyEngine,
                                       AuditService auditService,
                                       StatsAggregator statsAggregator,
                                       LedgerExecutor ledgerExecutor,
                                       ManualLogicalClock clock,
                                       AgriGuardProperties properties) {
        AgriGuardProperties.Dispute settings = properties.dispute();
        DisputeEngine engine = new DisputeEngine(disputeStore, new SeededJurorSelector(),
            new QuorumMajorityRule(settings.quorum(), settings.majority()), settlementBridge,
            auditService, statsAggregator, ledgerExecutor, clock, settings, properties.admin());
        policyEngine.attachDisputeGateway(engine);

        if (properties.autoLink()) {
            policyEngine.setDisputeLink(engine.getAddress(), properties.admin());
            engine.setInsuranceLink(policyEngine.getAddress(), properties.admin());
            log.info("Linked {} <-> {}", policyEngine.getAddress(), engine.getAddress());
        }
        return engine;
    }
}
