package com.tickercontext.gateway.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.tickercontext.common.model.FeatureVector;
import com.tickercontext.common.model.HeadlineRef;
import com.tickercontext.common.model.OneLiner;
import com.tickercontext.common.model.QuoteSnapshot;

import java.util.List;

/**
 * Composite gateway answer for one ticker. {@code featuresNote} carries the feature
 * service's degradation message and is omitted when the features were clean.
 */
public record RunResponse(
    @JsonProperty("ticker") String ticker,
    @JsonProperty("features") FeatureVector features,
    @JsonProperty("recommendation") JsonNode recommendation,
    @JsonProperty("one_liner") OneLiner oneLiner,
    @JsonProperty("quote") QuoteSnapshot quote,
    @JsonProperty("top_headline") HeadlineRef topHeadline,
    @JsonProperty("refs") List<HeadlineRef> refs,
    @JsonProperty("refs_sources") List<String> refsSources,
    @JsonProperty("ts_ctx") String contextTimestamp,
    @JsonProperty("ts_gateway") String gatewayTimestamp,
    @JsonProperty("cache_age_seconds") Long cacheAgeSeconds,
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("features_note") String featuresNote
) {}
