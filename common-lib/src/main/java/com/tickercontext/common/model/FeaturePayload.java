package com.tickercontext.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Feature service response for one ticker.
 *
 * <p>{@code refs} always has three slots; empty slots are {@code null} so citation numbers
 * stay positionally stable. {@code refsSources} lists the publishers of the present refs
 * in the same order. A non-null {@code error} marks a degraded but still usable payload.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FeaturePayload(
    @JsonProperty("ticker") String ticker,
    @JsonProperty("features") FeatureVector features,
    @JsonProperty("top_headline") HeadlineRef topHeadline,
    @JsonProperty("refs") List<HeadlineRef> refs,
    @JsonProperty("refs_sources") List<String> refsSources,
    @JsonProperty("error") String error,
    @JsonProperty("quote") QuoteSnapshot quote,
    @JsonProperty("ts") String timestamp
) {
    public static final int REF_SLOTS = 3;
}
