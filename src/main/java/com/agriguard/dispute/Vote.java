package com.agriguard.dispute;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Vote(
    @JsonProperty("juror") String juror,
    @JsonProperty("dispute_id") long disputeId,
    @JsonProperty("vote") boolean vote,
    @JsonProperty("timestamp") long timestamp
) {

    public VoteKey key() {
        return new VoteKey(disputeId, juror);
    }

    /** Composite key of the vote table: one vote per (dispute, juror). */
    public record VoteKey(long disputeId, String juror) {}
}
