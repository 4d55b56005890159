package com.agriguard.dispute;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Juror(
    @JsonProperty("address") String address,
    @JsonProperty("reputation") int reputation,
    @JsonProperty("total_votes") int totalVotes,
    @JsonProperty("correct_votes") int correctVotes,
    @JsonProperty("registration_round") long registrationRound,
    @JsonProperty("last_vote_round") long lastVoteRound,
    @JsonProperty("staked_amount") long stakedAmount
) {

    static Juror register(String address, int reputation, long round, long stake) {
        return new Juror(address, reputation, 0, 0, round, 0L, stake);
    }

    public boolean hasVoted() {
        return totalVotes > 0;
    }

    Juror recordVote(long round) {
        return new Juror(address, reputation, totalVotes + 1, correctVotes, registrationRound, round, stakedAmount);
    }

    Juror score(boolean correct, int step) {
        int nextReputation = correct ? reputation + step : Math.max(0, reputation - step);
        return new Juror(address, nextReputation, totalVotes, correct ? correctVotes + 1 : correctVotes,
            registrationRound, lastVoteRound, stakedAmount);
    }
}
