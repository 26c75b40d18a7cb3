package com.tickercontext.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record OneLinerRequest(
    @JsonProperty("class_") String classification,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("title") String title,
    @JsonProperty("publisher") String publisher,
    @JsonProperty("url") String url,
    @JsonProperty("refs") List<HeadlineRef> refs   // up to 3 slots, null = empty slot
) {}
