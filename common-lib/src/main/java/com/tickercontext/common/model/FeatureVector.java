package com.tickercontext.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Normalized short-term market state of one ticker, the input of the recommendation scorer.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FeatureVector(
    @JsonProperty("sent_mean") double sentMean,
    @JsonProperty("sent_std") double sentStd,
    @JsonProperty("r_1m") double return1m,
    @JsonProperty("r_5m") double return5m,
    @JsonProperty("above_sma20") boolean aboveSma20,
    @JsonProperty("mins_since_news") int minsSinceNews,
    @JsonProperty("rv20") double rv20,           // clamped to [0.02, 0.80]
    @JsonProperty("earnings_soon") boolean earningsSoon,
    @JsonProperty("liquidity_flag") boolean liquidityFlag
) {}
