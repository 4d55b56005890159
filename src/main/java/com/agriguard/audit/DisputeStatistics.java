package com.agriguard.audit;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DisputeStatistics(
    @JsonProperty("total_disputes") long totalDisputes,
    @JsonProperty("resolved_disputes") long resolvedDisputes,
    @JsonProperty("rejected_disputes") long rejectedDisputes,
    @JsonProperty("total_votes_cast") long totalVotesCast,
    @JsonProperty("active_jurors") long activeJurors
) {

    public static DisputeStatistics empty() {
        return new DisputeStatistics(0, 0, 0, 0, 0);
    }
}
