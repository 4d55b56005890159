package com.agriguard.settlement;

import com.agriguard.error.ErrorCode;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Result of the latest forward attempt for one dispute.
 *
 * {@code errorCode} and {@code message} are set only when {@code status} is FAILED.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SettlementOutcome(
    @JsonProperty("dispute_id") long disputeId,
    @JsonProperty("policy_id") long policyId,
    @JsonProperty("approved") boolean approved,
    @JsonProperty("status") Status status,
    @JsonProperty("payout") long payout,
    @JsonProperty("error_code") ErrorCode errorCode,
    @JsonProperty("message") String message,
    @JsonProperty("attempts") int attempts,
    @JsonProperty("round") long round
) {

    public enum Status {
        DELIVERED,
        FAILED
    }

    static SettlementOutcome delivered(long disputeId, long policyId, boolean approved,
                                       long payout, int attempts, long round) {
        return new SettlementOutcome(disputeId, policyId, approved, Status.DELIVERED,
            payout, null, null, attempts, round);
    }

    static SettlementOutcome failed(long disputeId, long policyId, boolean approved,
                                    ErrorCode errorCode, String message, int attempts, long round) {
        return new SettlementOutcome(disputeId, policyId, approved, Status.FAILED,
            0L, errorCode, message, attempts, round);
    }

    public boolean isDelivered() {
        return status == Status.DELIVERED;
    }
}
