package com.tickercontext.features.sentiment;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Scores headline texts. Implementations never emit an error: any failure resolves to
 * {@link SentimentScore#NEUTRAL}.
 */
public interface SentimentScorer {
    Mono<SentimentScore> score(List<String> texts);
}
