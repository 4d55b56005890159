package com.agriguard.policy;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Terms requested by a buyer. {@code t0}/{@code t1} are rounds of the logical clock.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PolicyParams(
    @JsonProperty("zip_code") String zipCode,
    @JsonProperty("t0") long t0,
    @JsonProperty("t1") long t1,
    @JsonProperty("cap") long cap,
    @JsonProperty("direction") PolicyDirection direction,
    @JsonProperty("threshold") long threshold,
    @JsonProperty("slope") long slope,
    @JsonProperty("fee") long fee
) {}
