package com.agriguard.policy;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A parametric insurance policy. Immutable; settlement produces a new record.
 *
 * {@code settledRound} and {@code payout} are 0 while the policy is unsettled.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Policy(
    @JsonProperty("policy_id") long policyId,
    @JsonProperty("owner") String owner,
    @JsonProperty("zip_code") String zipCode,
    @JsonProperty("t0") long t0,
    @JsonProperty("t1") long t1,
    @JsonProperty("cap") long cap,
    @JsonProperty("direction") PolicyDirection direction,
    @JsonProperty("threshold") long threshold,
    @JsonProperty("slope") long slope,
    @JsonProperty("fee_paid") long feePaid,
    @JsonProperty("settled") SettlementStatus settled,
    @JsonProperty("created_round") long createdRound,
    @JsonProperty("settled_round") long settledRound,
    @JsonProperty("payout") long payout
) {

    static Policy open(long policyId, String owner, PolicyParams params, long createdRound) {
        return new Policy(policyId, owner, params.zipCode(), params.t0(), params.t1(), params.cap(),
            params.direction(), params.threshold(), params.slope(), params.fee(),
            SettlementStatus.UNSETTLED, createdRound, 0L, 0L);
    }

    public boolean isSettled() {
        return settled == SettlementStatus.SETTLED;
    }

    public boolean isOwnedBy(String address) {
        return owner.equals(address);
    }

    Policy settle(long round, long payoutAmount) {
        if (isSettled()) {
            throw new IllegalStateException("policy " + policyId + " is already settled");
        }
        return new Policy(policyId, owner, zipCode, t0, t1, cap, direction, threshold, slope, feePaid,
            SettlementStatus.SETTLED, createdRound, round, payoutAmount);
    }
}
