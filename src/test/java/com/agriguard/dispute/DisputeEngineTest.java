package com.agriguard.dispute;

import com.agriguard.EngineHarness;
import com.agriguard.error.AuthorizationException;
import com.agriguard.error.ErrorCode;
import com.agriguard.error.StateException;
import com.agriguard.policy.SettlementStatus;
import com.agriguard.settlement.RecordingSettlementBridge;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.agriguard.EngineHarness.ADMIN;
import static com.agriguard.EngineHarness.OWNER;
import static org.junit.jupiter.api.Assertions.*;

class DisputeEngineTest {

    private EngineHarness harness;
    private DisputeEngine engine;

    @BeforeEach
    void setUp() {
        harness = new EngineHarness(0L, 10_000_000L);
        engine = harness.disputeEngine;
    }

    @Nested
    @DisplayName("Juror registration")
    class Registration {

        @Test
        void registration_opensAfterWarmup() {
            harness.clock.advanceTo(5);
            StateException early = assertThrows(StateException.class, () -> engine.registerJuror("juror-1"));
            assertEquals(ErrorCode.NOT_READY, early.getCode());

            harness.clock.advanceTo(10);
            Juror juror = engine.registerJuror("juror-1");

            assertEquals(100, juror.reputation());
            assertEquals(0, juror.totalVotes());
            assertEquals(10L, juror.registrationRound());
            assertEquals(1_000_000L, juror.stakedAmount());
            assertEquals(1L, engine.getTotalJurors());
        }

        @Test
        void registeringTwiceFails() {
            harness.registerJurors(1);

            StateException ex = assertThrows(StateException.class, () -> engine.registerJuror("juror-1"));
            assertEquals(ErrorCode.ALREADY_REGISTERED, ex.getCode());
            assertEquals(1L, engine.getTotalJurors());
            assertEquals(1, harness.stats.disputes().activeJurors());
        }

        @Test
        void eligibility_followsWaitingPeriod() {
            harness.registerJurors(1);

            assertEquals(JurorEligibility.NOT_REGISTERED, engine.validateJurorEligibility("stranger"));
            assertEquals(JurorEligibility.WAITING_PERIOD, engine.validateJurorEligibility("juror-1"));
            harness.clock.advance(50);
            assertEquals(JurorEligibility.ELIGIBLE, engine.validateJurorEligibility("juror-1"));
        }
    }

    @Nested
    @DisplayName("Dispute creation")
    class Creation {

        @Test
        void onlyJurorsCanOpenDisputes() {
            harness.registerJurors(3);
            long policyId = harness.createPolicy(1_000_000);

            AuthorizationException ex = assertThrows(AuthorizationException.class,
                () -> engine.createDispute(policyId, "stranger"));
            assertEquals(ErrorCode.NOT_A_JUROR, ex.getCode());
            assertEquals(0L, engine.getActiveDisputes().total());
        }

        @Test
        void disputesOpenOnlyAfterWarmup() {
            harness.clock.advanceTo(10);
            engine.registerJuror("juror-1");

            StateException ex = assertThrows(StateException.class, () -> engine.createDispute(1L, "juror-1"));
            assertEquals(ErrorCode.NOT_READY, ex.getCode());
        }

        @Test
        void newDispute_isActiveWithEmptyTallyAndPanel() {
            harness.registerJurors(12);
            long policyId = harness.createPolicy(1_000_000);
            long round = harness.clock.currentRound();

            long disputeId = engine.createDispute(policyId, "juror-1");

            Dispute dispute = engine.getDispute(disputeId).orElseThrow();
            assertEquals(DisputeStatus.ACTIVE, dispute.status());
            assertEquals(0, dispute.totalVotes());
            assertEquals("juror-1", dispute.claimant());
            assertEquals(DisputeEngine.DEFAULT_REASON, dispute.reason());
            assertEquals(round + 1000, dispute.votingDeadline());
            assertEquals(10, engine.getDisputeJurors(disputeId).size());
            assertEquals(new ActiveDisputes(1, 1), engine.getActiveDisputes());
        }

        @Test
        void openDispute_rejectsCallerOtherThanLinkedInsurance() {
            harness.registerJurors(3);

            AuthorizationException ex = assertThrows(AuthorizationException.class,
                () -> engine.openDispute(1L, OWNER, "reason", "someone-else"));
            assertEquals(ErrorCode.INSURANCE_NOT_LINKED, ex.getCode());
        }

        @Test
        void unknownDisputeQueriesFail() {
            StateException ex = assertThrows(StateException.class, () -> engine.getDisputeStatus(7L));
            assertEquals(ErrorCode.DISPUTE_NOT_FOUND, ex.getCode());
            assertTrue(engine.getDispute(7L).isEmpty());
        }
    }

    @Nested
    @DisplayName("Voting and resolution")
    class Voting {

        private long policyId;
        private long disputeId;

        @BeforeEach
        void openDispute() {
            harness.registerJurors(10);
            policyId = harness.createPolicy(1_000_000);
            disputeId = engine.createDispute(policyId, "juror-1");
            // coverage opens one round after creation
            harness.clock.advance(1);
        }

        @Test
        @DisplayName("Four yes and three no approve and settle the policy once")
        void quorumWithMajority_approvesAndTriggersSettlement() {
            harness.castVotes(disputeId, 4, 3);

            Dispute dispute = engine.getDispute(disputeId).orElseThrow();
            assertEquals(DisputeStatus.APPROVED, dispute.status());
            assertEquals(4, dispute.yesVotes());
            assertEquals(3, dispute.noVotes());
            assertEquals(7, dispute.totalVotes());
            assertEquals(harness.clock.currentRound(), dispute.resolutionRound());

            assertEquals(List.of(new RecordingSettlementBridge.Trigger(disputeId, policyId, true)),
                harness.bridge.triggers());
            assertEquals(SettlementStatus.SETTLED,
                harness.policyEngine.getPolicy(policyId).orElseThrow().settled());
            assertEquals(1_000_000, harness.treasury.paidTo(OWNER));
        }

        @Test
        void quorumWithoutMajority_rejectsWithoutSettlement() {
            harness.castVotes(disputeId, 3, 4);

            assertEquals(DisputeStatus.REJECTED, engine.getDisputeStatus(disputeId));
            assertTrue(harness.bridge.triggers().isEmpty());
            assertFalse(harness.policyEngine.getPolicy(policyId).orElseThrow().isSettled());
            assertEquals(1, harness.stats.disputes().rejectedDisputes());
        }

        @Test
        void tallyStaysPendingBelowQuorum() {
            harness.castVotes(disputeId, 6, 0);

            Dispute dispute = engine.getDispute(disputeId).orElseThrow();
            assertEquals(DisputeStatus.ACTIVE, dispute.status());
            assertEquals(dispute.yesVotes() + dispute.noVotes(), dispute.totalVotes());
            assertTrue(harness.bridge.triggers().isEmpty());
        }

        @Test
        void voteAfterResolutionFails() {
            List<String> panel = harness.castVotes(disputeId, 4, 3);
            String late = panel.get(7);

            StateException ex = assertThrows(StateException.class, () -> engine.vote(disputeId, true, late));
            assertEquals(ErrorCode.ALREADY_RESOLVED, ex.getCode());
            assertEquals(7, engine.getDispute(disputeId).orElseThrow().totalVotes());
            assertTrue(engine.getVote(disputeId, late).isEmpty());
        }

        @Test
        void sameJurorCannotVoteTwice() {
            String juror = engine.getDisputeJurors(disputeId).get(0);
            engine.vote(disputeId, true, juror);

            StateException ex = assertThrows(StateException.class, () -> engine.vote(disputeId, false, juror));
            assertEquals(ErrorCode.ALREADY_VOTED, ex.getCode());
            assertTrue(engine.getVote(disputeId, juror).orElseThrow().vote());
            assertEquals(1, engine.getDispute(disputeId).orElseThrow().totalVotes());
        }

        @Test
        @DisplayName("A juror must wait out the cooldown before voting on another dispute")
        void voteCooldownAcrossDisputes() {
            long second = engine.createDispute(policyId, "juror-2");
            String juror = engine.getDisputeJurors(disputeId).get(0);
            engine.vote(disputeId, true, juror);

            harness.clock.advance(5);
            StateException ex = assertThrows(StateException.class, () -> engine.vote(second, true, juror));
            assertEquals(ErrorCode.TOO_SOON, ex.getCode());

            harness.clock.advance(5);
            Dispute tallied = engine.vote(second, true, juror);
            assertEquals(1, tallied.yesVotes());
        }

        @Test
        @DisplayName("A dispute without quorum expires after its deadline")
        void expiryAfterDeadline() {
            harness.castVotes(disputeId, 2, 1);
            long deadline = engine.getDispute(disputeId).orElseThrow().votingDeadline();
            harness.clock.advanceTo(deadline + 1);

            assertEquals(DisputeStatus.EXPIRED, engine.getDisputeStatus(disputeId));
            assertEquals(DisputeStatus.EXPIRED, engine.getDispute(disputeId).orElseThrow().status());
            assertEquals(new ActiveDisputes(0, 1), engine.getActiveDisputes());

            String juror = engine.getDisputeJurors(disputeId).get(5);
            StateException ex = assertThrows(StateException.class, () -> engine.vote(disputeId, true, juror));
            assertEquals(ErrorCode.VOTING_EXPIRED, ex.getCode());
        }

        @Test
        void voteOnDeadlineRoundIsAccepted() {
            long deadline = engine.getDispute(disputeId).orElseThrow().votingDeadline();
            harness.clock.advanceTo(deadline);

            Dispute tallied = engine.vote(disputeId, false, engine.getDisputeJurors(disputeId).get(0));
            assertEquals(1, tallied.noVotes());
        }

        @Test
        void resolution_scoresJurorsAgainstOutcome() {
            List<String> panel = harness.castVotes(disputeId, 4, 3);

            Juror right = engine.getJurorInfo(panel.get(0)).orElseThrow();
            Juror wrong = engine.getJurorInfo(panel.get(6)).orElseThrow();
            Juror absent = engine.getJurorInfo(panel.get(9)).orElseThrow();

            assertEquals(105, right.reputation());
            assertEquals(1, right.correctVotes());
            assertEquals(95, wrong.reputation());
            assertEquals(0, wrong.correctVotes());
            assertEquals(100, absent.reputation());
        }

        @Test
        void resolution_updatesStatisticsAndAuditTrail() {
            harness.castVotes(disputeId, 4, 3);

            assertEquals(1, harness.stats.disputes().totalDisputes());
            assertEquals(1, harness.stats.disputes().resolvedDisputes());
            assertEquals(7, harness.stats.disputes().totalVotesCast());

            List<String> actions = harness.audit.getRecentEvents(4).stream()
                .map(e -> e.action())
                .toList();
            assertEquals(List.of("vote_cast", "dispute_resolved", "settled_approved", "settlement_forwarded"),
                actions);
        }

        @Test
        void archive_requiresAdminAndResolvedDispute() {
            StateException active = assertThrows(StateException.class,
                () -> engine.archiveDispute(disputeId, ADMIN));
            assertEquals(ErrorCode.NOT_RESOLVED, active.getCode());

            harness.castVotes(disputeId, 3, 4);
            assertThrows(AuthorizationException.class, () -> engine.archiveDispute(disputeId, "juror-1"));

            Dispute archived = engine.archiveDispute(disputeId, ADMIN);
            assertEquals(DisputeStatus.PROCESSED, archived.status());
        }
    }

    @Nested
    @DisplayName("Panel assignment")
    class Panels {

        @Test
        void unassignedJurorCannotVote() {
            List<String> jurors = harness.registerJurors(12);
            long policyId = harness.createPolicy(1_000_000);
            long disputeId = engine.createDispute(policyId, "juror-1");

            List<String> panel = engine.getDisputeJurors(disputeId);
            String outsider = jurors.stream().filter(j -> !panel.contains(j)).findFirst().orElseThrow();

            AuthorizationException ex = assertThrows(AuthorizationException.class,
                () -> engine.vote(disputeId, true, outsider));
            assertEquals(ErrorCode.NOT_ASSIGNED, ex.getCode());
        }

        @Test
        void unregisteredCallerIsNotAssigned() {
            harness.registerJurors(10);
            long policyId = harness.createPolicy(1_000_000);
            long disputeId = engine.createDispute(policyId, "juror-1");

            AuthorizationException ex = assertThrows(AuthorizationException.class,
                () -> engine.vote(disputeId, true, "stranger"));
            assertEquals(ErrorCode.NOT_ASSIGNED, ex.getCode());
            assertEquals(0, engine.getDispute(disputeId).orElseThrow().totalVotes());
        }

        @Test
        void panelMatchesSeededSelectionOverRegistry() {
            List<String> jurors = harness.registerJurors(15);
            long policyId = harness.createPolicy(1_000_000);
            long round = harness.clock.currentRound();
            long disputeId = engine.createDispute(policyId, "juror-3");

            List<String> expected = new SeededJurorSelector().select(jurors, disputeId + round, 10);
            assertEquals(expected, engine.getDisputeJurors(disputeId));
        }

        @Test
        void smallRegistryYieldsSmallerPanel() {
            harness.registerJurors(4);
            long policyId = harness.createPolicy(1_000_000);

            long disputeId = engine.createDispute(policyId, "juror-1");

            assertEquals(4, engine.getDisputeJurors(disputeId).size());
        }
    }
}
