package com.tickercontext.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RefNumber(
    @JsonProperty("n") int number,
    @JsonProperty("url") String url
) {}
