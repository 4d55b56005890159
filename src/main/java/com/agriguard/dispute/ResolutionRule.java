package com.agriguard.dispute;

/**
 * Decides whether a dispute's tally resolves it. Rules are deterministic: no
 * randomness, no clock, only the counted votes.
 */
public interface ResolutionRule {

    /** Unique rule identifier, e.g. "quorum-majority". */
    String ruleId();

    Outcome evaluate(Dispute dispute);

    sealed interface Outcome {
        record Pending() implements Outcome {}
        record Approved() implements Outcome {}
        record Rejected() implements Outcome {}
    }
}
