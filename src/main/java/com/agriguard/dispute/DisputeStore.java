package com.agriguard.dispute;

import java.util.List;
import java.util.Optional;

/**
 * Keyed storage for disputes, jurors, votes and panel assignments. No joins: every
 * lookup goes through an explicit key.
 */
public interface DisputeStore {
    long nextDisputeId();

    long issuedDisputeCount();

    Dispute saveDispute(Dispute dispute);

    Optional<Dispute> findDispute(long disputeId);

    List<Dispute> findAllDisputes();

    Juror saveJuror(Juror juror);

    Optional<Juror> findJuror(String address);

    boolean jurorExists(String address);

    /** All juror addresses in registration order. */
    List<String> jurorAddresses();

    long jurorCount();

    /** Write-once; fails if a vote already exists for the same key. */
    Vote saveVote(Vote vote);

    Optional<Vote> findVote(Vote.VoteKey key);

    boolean voteExists(Vote.VoteKey key);

    List<Vote> findVotes(long disputeId);

    void saveAssignment(long disputeId, List<String> jurors);

    List<String> findAssignment(long disputeId);
}
