package com.agriguard.dispute;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class QuorumMajorityRuleTest {

    private final QuorumMajorityRule rule = new QuorumMajorityRule(7, 4);

    private static Dispute tally(int yes, int no) {
        return new Dispute(1L, 1L, "juror-1", "reason", 0L, DisputeStatus.ACTIVE,
            yes, no, yes + no, 1000L, 0L);
    }

    @Test
    void belowQuorum_isPending() {
        assertInstanceOf(ResolutionRule.Outcome.Pending.class, rule.evaluate(tally(6, 0)));
    }

    @Test
    void majorityIsAbsoluteCount() {
        assertInstanceOf(ResolutionRule.Outcome.Approved.class, rule.evaluate(tally(4, 3)));
        assertInstanceOf(ResolutionRule.Outcome.Rejected.class, rule.evaluate(tally(3, 4)));
        assertInstanceOf(ResolutionRule.Outcome.Rejected.class, rule.evaluate(tally(0, 7)));
    }

    @Test
    void invalidConfigurationIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new QuorumMajorityRule(3, 4));
        assertThrows(IllegalArgumentException.class, () -> new QuorumMajorityRule(0, 0));
    }

    @Test
    void inconsistentTallyCannotBeBuilt() {
        assertThrows(IllegalArgumentException.class, () -> new Dispute(1L, 1L, "juror-1", "reason", 0L,
            DisputeStatus.ACTIVE, 2, 2, 5, 1000L, 0L));
    }
}
