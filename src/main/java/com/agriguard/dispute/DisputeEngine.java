package com.agriguard.dispute;

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
import com.agriguard.policy.DisputeGateway;
import com.agriguard.policy.DisputeRef;
import com.agriguard.settlement.SettlementBridge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Juror registry and dispute voting.
 *
 * A dispute accepts votes from its assigned panel until the tally reaches quorum,
 * at which point the {@link ResolutionRule} fixes the outcome for good. An approved
 * outcome is forwarded to the policy side through the {@link SettlementBridge};
 * whether that forward succeeds has no effect on the dispute's own status.
 */
public class DisputeEngine implements DisputeGateway {

    private static final Logger log = LoggerFactory.getLogger(DisputeEngine.class);

    static final String DEFAULT_REASON = "Policy settlement dispute";

    private final DisputeStore store;
    private final JurorSelector selector;
    private final ResolutionRule resolutionRule;
    private final SettlementBridge bridge;
    private final AuditService audit;
    private final StatsAggregator stats;
    private final LedgerExecutor ledger;
    private final LogicalClock clock;
    private final AgriGuardProperties.Dispute settings;
    private final String admin;
    private final long startRound;

    private volatile String insuranceLink;

    public DisputeEngine(DisputeStore store,
                         JurorSelector selector,
                         ResolutionRule resolutionRule,
                         SettlementBridge bridge,
                         AuditService audit,
                         StatsAggregator stats,
                         LedgerExecutor ledger,
                         LogicalClock clock,
                         AgriGuardProperties.Dispute settings,
                         String admin) {
        this.store = store;
        this.selector = selector;
        this.resolutionRule = resolutionRule;
        this.bridge = bridge;
        this.audit = audit;
        this.stats = stats;
        this.ledger = ledger;
        this.clock = clock;
        this.settings = settings;
        this.admin = admin;
        this.startRound = clock.currentRound();
    }

    // ---- administration ----

    public void setInsuranceLink(String address, String caller) {
        ledger.run("set_insurance_link", () -> {
            requireAdmin(caller, "set insurance link");
            if (address == null || address.isBlank()) {
                throw new ValidationException("insurance link address is required");
            }
            this.insuranceLink = address;
            log.info("Insurance link set to {}", address);
        });
    }

    public Optional<String> getInsuranceLink() {
        return Optional.ofNullable(insuranceLink);
    }

    public String getAddress() {
        return settings.address();
    }

    public long getStartRound() {
        return startRound;
    }

    /** Moves a resolved dispute to PROCESSED. */
    public Dispute archiveDispute(long disputeId, String caller) {
        return ledger.execute("archive_dispute", () -> {
            requireAdmin(caller, "archive disputes");
            Dispute dispute = requireDispute(disputeId);
            if (!dispute.status().isResolved()) {
                throw new StateException(ErrorCode.NOT_RESOLVED,
                    "dispute " + disputeId + " is " + dispute.status().getValue() + ", not resolved");
            }
            Dispute archived = store.saveDispute(dispute.transition(DisputeStatus.PROCESSED, clock.currentRound()));
            audit.record(EventSource.DISPUTE, "dispute_processed", disputeId, caller, 0L);
            log.info("Dispute {} archived", disputeId);
            return archived;
        });
    }

    // ---- jurors ----

    public Juror registerJuror(String caller) {
        return ledger.execute("register_juror", () -> {
            requireCaller(caller);
            if (store.jurorExists(caller)) {
                throw new StateException(ErrorCode.ALREADY_REGISTERED, caller + " is already a juror");
            }
            long round = clock.currentRound();
            requireWarmedUp(round, settings.jurorWarmupRounds(), "juror registration");

            Juror juror = store.saveJuror(
                Juror.register(caller, settings.initialReputation(), round, settings.minStakeAmount()));

            stats.update(StatsAction.JUROR_REGISTERED);
            audit.record(EventSource.DISPUTE, "juror_registered", 0L, caller, 0L);
            log.info("Juror {} registered at round {}", caller, round);
            return juror;
        });
    }

    // ---- disputes ----

    /** Opens a dispute on a policy; the caller must be a registered juror and becomes the claimant. */
    public long createDispute(long policyId, String caller) {
        return ledger.execute("create_dispute", () -> {
            requireCaller(caller);
            if (!store.jurorExists(caller)) {
                throw new AuthorizationException(ErrorCode.NOT_A_JUROR, caller + " is not a registered juror");
            }
            return open(policyId, caller, DEFAULT_REASON).disputeId();
        });
    }

    @Override
    public DisputeRef openDispute(long policyId, String claimant, String reason, String caller) {
        return ledger.execute("open_dispute", () -> {
            if (insuranceLink == null || !insuranceLink.equals(caller)) {
                throw new AuthorizationException(ErrorCode.INSURANCE_NOT_LINKED,
                    caller + " is not the linked insurance engine");
            }
            requireCaller(claimant);
            String effectiveReason = reason == null || reason.isBlank() ? DEFAULT_REASON : reason;
            Dispute dispute = open(policyId, claimant, effectiveReason);
            return new DisputeRef(dispute.disputeId(), dispute.policyId(), dispute.claimant(),
                dispute.votingDeadline());
        });
    }

    private Dispute open(long policyId, String claimant, String reason) {
        if (policyId <= 0) {
            throw new ValidationException("policy_id must be positive");
        }
        long round = clock.currentRound();
        requireWarmedUp(round, settings.disputeWarmupRounds(), "dispute creation");

        long disputeId = store.nextDisputeId();
        Dispute dispute = store.saveDispute(
            Dispute.open(disputeId, policyId, claimant, reason, round, settings.votingDurationRounds()));
        List<String> panel = selector.select(store.jurorAddresses(), disputeId + round, settings.panelSize());
        store.saveAssignment(disputeId, panel);

        stats.update(StatsAction.DISPUTE_CREATED);
        audit.record(EventSource.DISPUTE, "dispute_created", disputeId, claimant, 0L);
        log.info("Dispute {} opened on policy {} by {} with {} jurors, deadline round {}",
            disputeId, policyId, claimant, panel.size(), dispute.votingDeadline());
        return dispute;
    }

    /**
     * Casts a juror's vote. When this vote brings the tally to quorum the dispute is
     * resolved in the same operation, and an approval is forwarded for settlement.
     *
     * @return the dispute after the vote
     */
    public Dispute vote(long disputeId, boolean vote, String caller) {
        return ledger.execute("vote", () -> {
            requireCaller(caller);
            long round = clock.currentRound();
            Dispute dispute = requireDispute(disputeId);
            if (dispute.isPastDeadline(round)) {
                throw new StateException(ErrorCode.VOTING_EXPIRED,
                    "voting on dispute " + disputeId + " closed at round " + dispute.votingDeadline());
            }
            if (!dispute.isActive()) {
                throw new StateException(ErrorCode.ALREADY_RESOLVED,
                    "dispute " + disputeId + " is already " + dispute.status().getValue());
            }
            if (!store.findAssignment(disputeId).contains(caller)) {
                throw new AuthorizationException(ErrorCode.NOT_ASSIGNED,
                    caller + " is not on the panel of dispute " + disputeId);
            }
            Vote.VoteKey key = new Vote.VoteKey(disputeId, caller);
            if (store.voteExists(key)) {
                throw new StateException(ErrorCode.ALREADY_VOTED,
                    caller + " already voted on dispute " + disputeId);
            }
            // panels hold registered jurors only, and jurors are never removed
            Juror juror = store.findJuror(caller).orElseThrow();
            if (juror.hasVoted() && round - juror.lastVoteRound() < settings.voteCooldownRounds()) {
                throw new StateException(ErrorCode.TOO_SOON,
                    caller + " voted at round " + juror.lastVoteRound() + "; next vote allowed at round "
                        + (juror.lastVoteRound() + settings.voteCooldownRounds()));
            }

            store.saveVote(new Vote(caller, disputeId, vote, round));
            store.saveJuror(juror.recordVote(round));
            Dispute tallied = store.saveDispute(dispute.withVote(vote));

            stats.update(StatsAction.VOTE_CAST);
            audit.record(EventSource.DISPUTE, "vote_cast", disputeId, caller, vote ? 1L : 0L);

            ResolutionRule.Outcome outcome = resolutionRule.evaluate(tallied);
            if (outcome instanceof ResolutionRule.Outcome.Pending) {
                return tallied;
            }
            return resolve(tallied, outcome instanceof ResolutionRule.Outcome.Approved, round, caller);
        });
    }

    private Dispute resolve(Dispute dispute, boolean approved, long round, String lastVoter) {
        DisputeStatus next = approved ? DisputeStatus.APPROVED : DisputeStatus.REJECTED;
        Dispute resolved = store.saveDispute(dispute.transition(next, round));
        scoreJurors(dispute.disputeId(), approved);

        stats.update(approved ? StatsAction.DISPUTE_RESOLVED : StatsAction.DISPUTE_REJECTED);
        audit.record(EventSource.DISPUTE, approved ? "dispute_resolved" : "dispute_rejected",
            dispute.disputeId(), lastVoter, approved ? 1L : 0L);
        log.info("Dispute {} resolved {} by {} with {} yes / {} no", dispute.disputeId(),
            next.getValue(), resolutionRule.ruleId(), resolved.yesVotes(), resolved.noVotes());

        if (approved) {
            bridge.triggerSettlement(dispute.disputeId(), dispute.policyId(), true);
        }
        return resolved;
    }

    private void scoreJurors(long disputeId, boolean approved) {
        for (Vote cast : store.findVotes(disputeId)) {
            store.findJuror(cast.juror()).ifPresent(juror ->
                store.saveJuror(juror.score(cast.vote() == approved, settings.reputationStep())));
        }
    }

    /**
     * Current status of a dispute. An ACTIVE dispute whose deadline has passed is
     * moved to EXPIRED here, on first observation.
     */
    public DisputeStatus getDisputeStatus(long disputeId) {
        return ledger.execute("get_dispute_status", () -> {
            Dispute dispute = requireDispute(disputeId);
            long round = clock.currentRound();
            if (dispute.isActive() && dispute.isPastDeadline(round)) {
                Dispute expired = store.saveDispute(dispute.transition(DisputeStatus.EXPIRED, round));
                audit.record(EventSource.DISPUTE, "dispute_expired", disputeId, settings.address(), 0L);
                log.info("Dispute {} expired with {} of {} votes",
                    disputeId, expired.totalVotes(), settings.quorum());
                return expired.status();
            }
            return dispute.status();
        });
    }

    // ---- queries ----

    public Optional<Dispute> getDispute(long disputeId) {
        return ledger.execute("get_dispute", () -> store.findDispute(disputeId));
    }

    public List<String> getDisputeJurors(long disputeId) {
        return ledger.execute("get_dispute_jurors", () -> {
            requireDispute(disputeId);
            return store.findAssignment(disputeId);
        });
    }

    public Optional<Vote> getVote(long disputeId, String juror) {
        return ledger.execute("get_vote", () -> store.findVote(new Vote.VoteKey(disputeId, juror)));
    }

    public Optional<Juror> getJurorInfo(String address) {
        return ledger.execute("get_juror_info", () -> store.findJuror(address));
    }

    public long getTotalJurors() {
        return ledger.execute("get_total_jurors", store::jurorCount);
    }

    public ActiveDisputes getActiveDisputes() {
        return ledger.execute("get_active_disputes", () -> {
            long round = clock.currentRound();
            long active = store.findAllDisputes().stream()
                .filter(d -> d.isActive() && !d.isPastDeadline(round))
                .count();
            return new ActiveDisputes(active, store.issuedDisputeCount());
        });
    }

    public JurorEligibility validateJurorEligibility(String address) {
        return ledger.execute("validate_juror_eligibility", () -> {
            Optional<Juror> found = store.findJuror(address);
            if (found.isEmpty()) {
                return JurorEligibility.NOT_REGISTERED;
            }
            Juror juror = found.get();
            if (clock.currentRound() - juror.registrationRound() < settings.eligibilityWaitRounds()) {
                return JurorEligibility.WAITING_PERIOD;
            }
            if (juror.reputation() < settings.minReputation()) {
                return JurorEligibility.LOW_REPUTATION;
            }
            return JurorEligibility.ELIGIBLE;
        });
    }

    // ---- helpers ----

    private Dispute requireDispute(long disputeId) {
        return store.findDispute(disputeId)
            .orElseThrow(() -> new StateException(ErrorCode.DISPUTE_NOT_FOUND,
                "dispute " + disputeId + " does not exist"));
    }

    private void requireWarmedUp(long round, long warmupRounds, String action) {
        if (round - startRound < warmupRounds) {
            throw new StateException(ErrorCode.NOT_READY,
                action + " opens at round " + (startRound + warmupRounds));
        }
    }

    private void requireAdmin(String caller, String action) {
        if (!admin.equals(caller)) {
            throw new AuthorizationException(ErrorCode.NOT_ADMIN, "only admin can " + action);
        }
    }

    private static void requireCaller(String caller) {
        if (caller == null || caller.isBlank()) {
            throw new ValidationException("caller is required");
        }
    }
}
