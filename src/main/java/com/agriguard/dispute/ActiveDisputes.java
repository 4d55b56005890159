package com.agriguard.dispute;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ActiveDisputes(
    @JsonProperty("active") long active,
    @JsonProperty("total") long total
) {}
