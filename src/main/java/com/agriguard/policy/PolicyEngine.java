package com.agriguard.policy;

import com.agriguard.audit.AuditService;
import com.agriguard.audit.EventSource;
import com.agriguard.audit.StatsAction;
import com.agriguard.audit.StatsAggregator;
import com.agriguard.config.AgriGuardProperties;
import com.agriguard.error.AuthorizationException;
import com.agriguard.error.ErrorCode;
import com.agriguard.error.StateException;
import com.agriguard.error.ValidationException;
import com.agriguard.ledger.LedgerExecutor;
import com.agriguard.ledger.LogicalClock;
import com.agriguard.ledger.Treasury;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Policy lifecycle: creation, oracle settlement with payout, dispute filing.
 *
 * Every public operation runs through the {@link LedgerExecutor}, validates all of
 * its preconditions first and only then writes. Settlement flips a policy to
 * {@link SettlementStatus#SETTLED} together with the payout, so a retried settle
 * always fails with {@link StateException} and can never pay twice.
 */
public class PolicyEngine {

    private static final Logger log = LoggerFactory.getLogger(PolicyEngine.class);

    private final PolicyStore store;
    private final Treasury treasury;
    private final AuditService audit;
    private final StatsAggregator stats;
    private final LedgerExecutor ledger;
    private final LogicalClock clock;
    private final AgriGuardProperties.Insurance settings;
    private final String admin;
    private final PolicyValidator validator;
    private final FeeCalculator feeCalculator = new FeeCalculator();

    private volatile String oracle;
    private volatile String disputeLink;
    private volatile DisputeGateway disputeGateway;

    public PolicyEngine(PolicyStore store,
                        Treasury treasury,
                        AuditService audit,
                        StatsAggregator stats,
                        LedgerExecutor ledger,
                        LogicalClock clock,
                        AgriGuardProperties.Insurance settings,
                        String admin) {
        this.store = store;
        this.treasury = treasury;
        this.audit = audit;
        this.stats = stats;
        this.ledger = ledger;
        this.clock = clock;
        this.settings = settings;
        this.admin = admin;
        this.validator = new PolicyValidator(settings);
    }

    // ---- administration ----

    public void setOracle(String address, String caller) {
        ledger.run("set_oracle", () -> {
            requireAdmin(caller, "set oracle");
            requireAddress(address, "oracle address is required");
            this.oracle = address;
            log.info("Oracle set to {}", address);
        });
    }

    public Optional<String> getOracle() {
        return Optional.ofNullable(oracle);
    }

    /**
     * Binds the address the dispute engine settles with. Settlements coming from
     * this address are accepted alongside the oracle's.
     */
    public void setDisputeLink(String address, String caller) {
        ledger.run("set_dispute_link", () -> {
            requireAdmin(caller, "set dispute link");
            requireAddress(address, "dispute link address is required");
            this.disputeLink = address;
            log.info("Dispute link set to {}", address);
        });
    }

    public Optional<String> getDisputeLink() {
        return Optional.ofNullable(disputeLink);
    }

    /** In-process transport to the dispute engine; wired once at startup. */
    public void attachDisputeGateway(DisputeGateway gateway) {
        this.disputeGateway = gateway;
    }

    public String getAddress() {
        return settings.address();
    }

    // ---- operations ----

    public long createPolicy(PolicyParams params, String caller) {
        return ledger.execute("create_policy", () -> {
            long round = clock.currentRound();
            validator.validate(params, caller, round);
            treasury.ensureCanAccept(params.fee());
            stats.ensureCanRecordPolicy(params.cap(), params.fee());

            long policyId = store.nextPolicyId();
            treasury.deposit(caller, params.fee());
            store.save(Policy.open(policyId, caller, params, round));

            stats.update(StatsAction.POLICY_CREATED, params.cap(), params.fee());
            audit.record(EventSource.INSURANCE, "policy_created", policyId, caller, params.cap());

            log.info("Policy {} created for owner={} cap={} window=[{}, {}]",
                policyId, caller, params.cap(), params.t0(), params.t1());
            return policyId;
        });
    }

    /**
     * Settles a policy once. Approved settlements pay {@code cap} to the owner.
     *
     * @return the amount paid out, {@code cap} or 0
     */
    public long settle(long policyId, boolean approved, String caller) {
        return ledger.execute("settle", () -> {
            requireSettler(caller);
            Policy policy = requirePolicy(policyId);
            if (policy.isSettled()) {
                throw new StateException(ErrorCode.ALREADY_SETTLED,
                    "policy " + policyId + " is already settled");
            }
            long round = clock.currentRound();
            if (round < policy.t0()) {
                throw new StateException(ErrorCode.NOT_STARTED,
                    "policy " + policyId + " coverage starts at round " + policy.t0());
            }
            if (round > policy.t1()) {
                throw new StateException(ErrorCode.COVERAGE_EXPIRED,
                    "policy " + policyId + " coverage ended at round " + policy.t1());
            }
            long payout = approved ? policy.cap() : 0L;
            if (payout > 0) {
                treasury.ensureCanPay(payout);
            }

            treasury.pay(policy.owner(), payout);
            store.save(policy.settle(round, payout));

            stats.update(StatsAction.POLICY_SETTLED, payout, 0L);
            audit.record(EventSource.INSURANCE, approved ? "settled_approved" : "settled_rejected",
                policyId, caller, payout);

            log.info("Policy {} settled by {} approved={} payout={}", policyId, caller, approved, payout);
            return payout;
        });
    }

    /**
     * Accepts the oracle collaborator's decision payload. Only {@code decision} is
     * consumed.
     */
    public long settleDecision(SettlementDecision decision, String caller) {
        if (decision == null) {
            throw new ValidationException("settlement decision is required");
        }
        if (decision.decision() != 0 && decision.decision() != 1) {
            throw new ValidationException("decision must be 0 or 1");
        }
        log.debug("Oracle decision for policy {}: decision={} confidence={}",
            decision.policyId(), decision.decision(), decision.confidence());
        return settle(decision.policyId(), decision.decision() == 1, caller);
    }

    public DisputeRef fileDispute(long policyId, String reason, String caller) {
        return ledger.execute("file_dispute", () -> {
            if (reason == null || reason.isBlank()) {
                throw new ValidationException("reason is required");
            }
            Policy policy = requirePolicy(policyId);
            if (!policy.isOwnedBy(caller)) {
                throw new AuthorizationException(ErrorCode.NOT_OWNER,
                    "only the owner can dispute policy " + policyId);
            }
            if (!policy.isSettled()) {
                throw new StateException(ErrorCode.NOT_SETTLED,
                    "policy " + policyId + " has not been settled");
            }
            long round = clock.currentRound();
            if (round - policy.settledRound() > settings.disputeWindowRounds()) {
                throw new StateException(ErrorCode.DISPUTE_WINDOW_CLOSED,
                    "dispute window for policy " + policyId + " closed at round "
                        + (policy.settledRound() + settings.disputeWindowRounds()));
            }
            DisputeGateway gateway = disputeGateway;
            if (disputeLink == null || gateway == null) {
                throw new StateException(ErrorCode.DISPUTE_LINK_MISSING, "no dispute engine is linked");
            }

            DisputeRef ref = gateway.openDispute(policyId, caller, reason, settings.address());

            audit.record(EventSource.INSURANCE, "disputed", policyId, caller, 0L);
            log.info("Policy {} disputed by owner {} as dispute {}", policyId, caller, ref.disputeId());
            return ref;
        });
    }

    /**
     * Removes an unsettled policy at its owner's request. The fee is not refunded.
     */
    public void deletePolicy(long policyId, String caller) {
        ledger.run("delete_policy", () -> {
            Policy policy = requirePolicy(policyId);
            if (!policy.isOwnedBy(caller)) {
                throw new AuthorizationException(ErrorCode.NOT_OWNER,
                    "only the owner can delete policy " + policyId);
            }
            if (policy.isSettled()) {
                throw new StateException(ErrorCode.ALREADY_SETTLED,
                    "policy " + policyId + " is settled and cannot be deleted");
            }

            store.delete(policyId);
            stats.update(StatsAction.POLICY_DELETED);
            audit.record(EventSource.INSURANCE, "policy_deleted", policyId, caller, 0L);
            log.info("Policy {} deleted by owner {}", policyId, caller);
        });
    }

    // ---- queries ----

    public long calculateFee(long cap, long riskScore, long uncertainty, long durationDays) {
        return feeCalculator.calculateFee(cap, riskScore, uncertainty, durationDays);
    }

    public Optional<Policy> getPolicy(long policyId) {
        return ledger.execute("get_policy", () -> store.findById(policyId));
    }

    public List<Policy> getPoliciesByOwner(String owner) {
        return ledger.execute("get_policies_by_owner", () -> store.findByOwner(owner));
    }

    public long getPolicyCount() {
        return ledger.execute("get_policy_count", store::issuedCount);
    }

    public PolicyTiming validatePolicyTiming(long policyId) {
        return ledger.execute("validate_policy_timing", () -> {
            Optional<Policy> found = store.findById(policyId);
            if (found.isEmpty()) {
                return PolicyTiming.NOT_FOUND;
            }
            Policy policy = found.get();
            if (policy.isSettled()) {
                return PolicyTiming.SETTLED;
            }
            long round = clock.currentRound();
            if (round < policy.t0()) {
                return PolicyTiming.NOT_STARTED;
            }
            if (round > policy.t1()) {
                return PolicyTiming.EXPIRED;
            }
            return PolicyTiming.ACTIVE;
        });
    }

    // ---- helpers ----

    private Policy requirePolicy(long policyId) {
        return store.findById(policyId)
            .orElseThrow(() -> new StateException(ErrorCode.POLICY_NOT_FOUND,
                "policy " + policyId + " does not exist"));
    }

    private void requireSettler(String caller) {
        boolean isOracle = oracle != null && oracle.equals(caller);
        boolean isDisputeEngine = disputeLink != null && disputeLink.equals(caller);
        if (!isOracle && !isDisputeEngine) {
            throw new AuthorizationException(ErrorCode.NOT_ORACLE, "only the oracle can settle policies");
        }
    }

    private void requireAdmin(String caller, String action) {
        if (!admin.equals(caller)) {
            throw new AuthorizationException(ErrorCode.NOT_ADMIN, "only admin can " + action);
        }
    }

    private static void requireAddress(String address, String message) {
        if (address == null || address.isBlank()) {
            throw new ValidationException(message);
        }
    }
}
