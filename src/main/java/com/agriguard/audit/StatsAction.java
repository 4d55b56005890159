package com.agriguard.audit;

public enum StatsAction {
    POLICY_CREATED,
    POLICY_SETTLED,
    POLICY_DELETED,
    DISPUTE_CREATED,
    DISPUTE_RESOLVED,
    DISPUTE_REJECTED,
    VOTE_CAST,
    JUROR_REGISTERED
}
