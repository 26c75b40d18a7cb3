package com.tickercontext.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Rendered explanation line plus the citation number → url mapping used for link rendering.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OneLiner(
    @JsonProperty("text") String text,
    @JsonProperty("refs_numbers") List<RefNumber> refsNumbers
) {}
