package com.agriguard.settlement;

import com.agriguard.audit.AuditService;
import com.agriguard.audit.EventSource;
import com.agriguard.error.AgriGuardException;
import com.agriguard.error.ErrorCode;
import com.agriguard.error.StateException;
import com.agriguard.ledger.LedgerExecutor;
import com.agriguard.ledger.LogicalClock;
import com.agriguard.policy.PolicyEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Bridge for engines sharing one process: the forward is a direct call into
 * {@link PolicyEngine#settle}, made as the dispute engine's address while the
 * outer dispute operation still holds the ledger lock.
 */
public class InProcessSettlementBridge implements SettlementBridge {

    private static final Logger log = LoggerFactory.getLogger(InProcessSettlementBridge.class);

    private final PolicyEngine policyEngine;
    private final AuditService audit;
    private final LedgerExecutor ledger;
    private final LogicalClock clock;
    private final String disputeAddress;
    private final ConcurrentHashMap<Long, SettlementOutcome> outcomes = new ConcurrentHashMap<>();

    public InProcessSettlementBridge(PolicyEngine policyEngine,
                                     AuditService audit,
                                     LedgerExecutor ledger,
                                     LogicalClock clock,
                                     String disputeAddress) {
        this.policyEngine = policyEngine;
        this.audit = audit;
        this.ledger = ledger;
        this.clock = clock;
        this.disputeAddress = disputeAddress;
    }

    @Override
    public SettlementOutcome triggerSettlement(long disputeId, long policyId, boolean approved) {
        return ledger.execute("trigger_settlement", () -> {
            SettlementOutcome previous = outcomes.get(disputeId);
            if (previous != null && previous.isDelivered()) {
                log.debug("Settlement for dispute {} already delivered; not forwarding again", disputeId);
                return previous;
            }
            int attempts = previous == null ? 1 : previous.attempts() + 1;
            return attempt(disputeId, policyId, approved, attempts);
        });
    }

    @Override
    public SettlementOutcome retry(long disputeId) {
        return ledger.execute("retry_settlement", () -> {
            SettlementOutcome previous = outcomes.get(disputeId);
            if (previous == null) {
                throw new StateException(ErrorCode.SETTLEMENT_NOT_FOUND,
                    "no settlement was forwarded for dispute " + disputeId);
            }
            if (previous.isDelivered()) {
                return previous;
            }
            log.info("Retrying settlement for dispute {} (attempt {})", disputeId, previous.attempts() + 1);
            return attempt(disputeId, previous.policyId(), previous.approved(), previous.attempts() + 1);
        });
    }

    @Override
    public Optional<SettlementOutcome> findOutcome(long disputeId) {
        return Optional.ofNullable(outcomes.get(disputeId));
    }

    @Override
    public List<SettlementOutcome> failedOutcomes() {
        return outcomes.values().stream()
            .filter(o -> !o.isDelivered())
            .sorted(Comparator.comparingLong(SettlementOutcome::disputeId))
            .collect(Collectors.toCollection(ArrayList::new));
    }

    private SettlementOutcome attempt(long disputeId, long policyId, boolean approved, int attempts) {
        long round = clock.currentRound();
        SettlementOutcome outcome;
        try {
            long payout = policyEngine.settle(policyId, approved, disputeAddress);
            outcome = SettlementOutcome.delivered(disputeId, policyId, approved, payout, attempts, round);
            audit.record(EventSource.BRIDGE, "settlement_forwarded", disputeId, disputeAddress, payout);
            log.info("Dispute {} settled policy {} approved={} payout={}", disputeId, policyId, approved, payout);
        } catch (AgriGuardException ex) {
            // the dispute keeps its resolution; the failure stays visible and retryable
            outcome = SettlementOutcome.failed(disputeId, policyId, approved,
                ex.getCode(), ex.getMessage(), attempts, round);
            audit.record(EventSource.BRIDGE, "settlement_bridge_failed", disputeId, disputeAddress, 0L);
            log.warn("Settlement forward for dispute {} on policy {} failed with {}: {}",
                disputeId, policyId, ex.getCode(), ex.getMessage());
        }
        outcomes.put(disputeId, outcome);
        return outcome;
    }
}
