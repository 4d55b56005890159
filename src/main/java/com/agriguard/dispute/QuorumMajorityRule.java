package com.agriguard.dispute;

/**
 * Resolves once {@code quorum} votes are counted: approved with at least
 * {@code majority} yes votes, rejected otherwise. The majority is an absolute count,
 * not a fraction of the total.
 */
public class QuorumMajorityRule implements ResolutionRule {

    private final int quorum;
    private final int majority;

    public QuorumMajorityRule(int quorum, int majority) {
        if (quorum < 1 || majority < 1 || majority > quorum) {
            throw new IllegalArgumentException("require 1 <= majority <= quorum");
        }
        this.quorum = quorum;
        this.majority = majority;
    }

    @Override
    public String ruleId() {
        return "quorum-majority";
    }

    @Override
    public Outcome evaluate(Dispute dispute) {
        if (dispute.totalVotes() < quorum) {
            return new Outcome.Pending();
        }
        if (dispute.yesVotes() >= majority) {
            return new Outcome.Approved();
        }
        return new Outcome.Rejected();
    }
}
