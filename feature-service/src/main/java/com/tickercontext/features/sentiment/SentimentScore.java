package com.tickercontext.features.sentiment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SentimentScore(
    double mean,
    double std
) {
    static final double DEFAULT_MEAN = 0.0;
    static final double DEFAULT_STD = 0.05;

    /** Used whenever the scorer cannot be consulted. */
    public static final SentimentScore NEUTRAL = new SentimentScore(DEFAULT_MEAN, DEFAULT_STD);

    /** Wire form; a missing or null field takes its neutral default. */
    @JsonCreator
    public static SentimentScore fromWire(@JsonProperty("mean") Double mean,
                                          @JsonProperty("std") Double std) {
        return new SentimentScore(
            mean != null ? mean : DEFAULT_MEAN,
            std != null ? std : DEFAULT_STD);
    }
}
