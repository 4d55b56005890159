package com.agriguard.dispute;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A disputed settlement under juror vote. Immutable: every transition returns a new
 * record, and the constructor rejects any tally where yes + no != total.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Dispute(
    @JsonProperty("dispute_id") long disputeId,
    @JsonProperty("policy_id") long policyId,
    @JsonProperty("claimant") String claimant,
    @JsonProperty("reason") String reason,
    @JsonProperty("created_at") long createdAt,
    @JsonProperty("status") DisputeStatus status,
    @JsonProperty("yes_votes") int yesVotes,
    @JsonProperty("no_votes") int noVotes,
    @JsonProperty("total_votes") int totalVotes,
    @JsonProperty("voting_deadline") long votingDeadline,
    @JsonProperty("resolution_round") long resolutionRound
) {

    public Dispute {
        if (totalVotes != yesVotes + noVotes) {
            throw new IllegalArgumentException("total_votes must equal yes_votes + no_votes");
        }
    }

    static Dispute open(long disputeId, long policyId, String claimant, String reason,
                        long round, long votingDuration) {
        return new Dispute(disputeId, policyId, claimant, reason, round, DisputeStatus.ACTIVE,
            0, 0, 0, round + votingDuration, 0L);
    }

    public boolean isActive() {
        return status == DisputeStatus.ACTIVE;
    }

    public boolean isPastDeadline(long round) {
        return round > votingDeadline;
    }

    Dispute withVote(boolean yes) {
        return new Dispute(disputeId, policyId, claimant, reason, createdAt, status,
            yes ? yesVotes + 1 : yesVotes, yes ? noVotes : noVotes + 1, totalVotes + 1,
            votingDeadline, resolutionRound);
    }

    Dispute transition(DisputeStatus next, long round) {
        long resolvedAt = next.isResolved() ? round : resolutionRound;
        return new Dispute(disputeId, policyId, claimant, reason, createdAt, next,
            yesVotes, noVotes, totalVotes, votingDeadline, resolvedAt);
    }
}
