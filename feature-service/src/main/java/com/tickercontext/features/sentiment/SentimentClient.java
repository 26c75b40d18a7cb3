package com.tickercontext.features.sentiment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * HTTP client for the external sentiment service ({@code POST /api/sentiment}).
 *
 * <p>All errors (timeout, non-2xx, malformed body) are absorbed with the
 * {@link SentimentScore#NEUTRAL} fallback so that a sentiment outage never fails
 * a feature aggregation.
 */
public class SentimentClient implements SentimentScorer {

    private static final Logger log = LoggerFactory.getLogger(SentimentClient.class);

    public static final int MAX_TEXTS = 8;

    private final WebClient sentimentWebClient;
    private final Duration timeout;

    public SentimentClient(WebClient sentimentWebClient, Duration timeout) {
        this.sentimentWebClient = sentimentWebClient;
        this.timeout            = timeout;
    }

    @Override
    public Mono<SentimentScore> score(List<String> texts) {
        List<String> cleaned = texts == null ? List.of() : texts.stream()
            .filter(t -> t != null && !t.isBlank())
            .map(String::trim)
            .limit(MAX_TEXTS)
            .toList();
        if (cleaned.isEmpty()) {
            return Mono.just(SentimentScore.NEUTRAL);
        }
        return sentimentWebClient.post()
            .uri("/api/sentiment")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("texts", cleaned))
            .retrieve()
            .bodyToMono(SentimentScore.class)
            .timeout(timeout)
            .doOnNext(s -> log.debug("Sentiment scored. texts={} mean={} std={}", cleaned.size(), s.mean(), s.std()))
            .onErrorResume(e -> {
                log.warn("Sentiment scoring failed, using neutral fallback. texts={} reason={}",
                         cleaned.size(), e.getMessage());
                return Mono.just(SentimentScore.NEUTRAL);
            })
            .defaultIfEmpty(SentimentScore.NEUTRAL);
    }
}
