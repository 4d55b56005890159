package com.agriguard.policy;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DisputeRef(
    @JsonProperty("dispute_id") long disputeId,
    @JsonProperty("policy_id") long policyId,
    @JsonProperty("claimant") String claimant,
    @JsonProperty("voting_deadline") long votingDeadline
) {}
