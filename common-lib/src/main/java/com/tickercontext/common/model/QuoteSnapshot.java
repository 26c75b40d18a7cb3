package com.tickercontext.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Display quote attached to a feature payload. {@code bid} and {@code ask} are null
 * only in the fully synthetic payload; otherwise {@code bid < ask}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QuoteSnapshot(
    @JsonProperty("last") double last,
    @JsonProperty("bid") Double bid,
    @JsonProperty("ask") Double ask,
    @JsonProperty("quality") QuoteQuality quality
) {
    public static QuoteSnapshot unknown() {
        return new QuoteSnapshot(0.0, null, null, QuoteQuality.UNKNOWN);
    }
}
