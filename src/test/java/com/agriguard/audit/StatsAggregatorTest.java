package com.agriguard.audit;

import com.agriguard.error.ValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StatsAggregatorTest {

    private final StatsAggregator stats = new StatsAggregator();

    @Test
    void policyLifecycleMovesInsuranceCounters() {
        stats.update(StatsAction.POLICY_CREATED, 1_000_000, 100_000);
        stats.update(StatsAction.POLICY_CREATED, 500_000, 50_000);
        stats.update(StatsAction.POLICY_SETTLED, 1_000_000, 0);
        stats.update(StatsAction.POLICY_DELETED);

        assertEquals(new InsuranceStatistics(2, 1_500_000, 1_000_000, 0, 150_000), stats.insurance());
    }

    @Test
    void disputeLifecycleMovesDisputeCounters() {
        stats.update(StatsAction.JUROR_REGISTERED);
        stats.update(StatsAction.JUROR_REGISTERED);
        stats.update(StatsAction.DISPUTE_CREATED);
        stats.update(StatsAction.DISPUTE_CREATED);
        stats.update(StatsAction.VOTE_CAST);
        stats.update(StatsAction.DISPUTE_RESOLVED);
        stats.update(StatsAction.DISPUTE_REJECTED);

        assertEquals(new DisputeStatistics(2, 1, 1, 1, 2), stats.disputes());
    }

    @Test
    void overflowingTotalsAreRejectedBeforeRecording() {
        stats.update(StatsAction.POLICY_CREATED, Long.MAX_VALUE - 5, 10);

        assertThrows(ValidationException.class, () -> stats.ensureCanRecordPolicy(6, 1));
        assertThrows(ValidationException.class, () -> stats.ensureCanRecordPolicy(1, Long.MAX_VALUE - 9));
        stats.ensureCanRecordPolicy(5, 1);
        assertEquals(Long.MAX_VALUE - 5, stats.insurance().totalCoverage());
    }

    @Test
    void activePoliciesNeverGoNegative() {
        stats.update(StatsAction.POLICY_DELETED);

        assertEquals(0, stats.insurance().activePolicies());
    }

    @Test
    void snapshotCombinesBothSides() {
        stats.update(StatsAction.POLICY_CREATED, 10, 1);
        stats.update(StatsAction.VOTE_CAST);

        StatsAggregator.Snapshot snapshot = stats.snapshot();

        assertEquals(1, snapshot.insurance().totalPolicies());
        assertEquals(1, snapshot.disputes().totalVotesCast());
    }
}
