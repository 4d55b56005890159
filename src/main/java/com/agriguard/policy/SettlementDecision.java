package com.agriguard.policy;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Payload posted by the weather/risk oracle. Only {@code decision} drives settlement;
 * the remaining fields are informational.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SettlementDecision(
    @JsonProperty("policy_id") long policyId,
    @JsonProperty("decision") int decision,
    @JsonProperty("settlement_amount") long settlementAmount,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("reasoning") String reasoning
) {}
