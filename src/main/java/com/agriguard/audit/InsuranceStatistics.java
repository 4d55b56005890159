package com.agriguard.audit;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record InsuranceStatistics(
    @JsonProperty("total_policies") long totalPolicies,
    @JsonProperty("total_coverage") long totalCoverage,
    @JsonProperty("total_payouts") long totalPayouts,
    @JsonProperty("active_policies") long activePolicies,
    @JsonProperty("total_fees_collected") long totalFeesCollected
) {

    public static InsuranceStatistics empty() {
        return new InsuranceStatistics(0, 0, 0, 0, 0);
    }
}
