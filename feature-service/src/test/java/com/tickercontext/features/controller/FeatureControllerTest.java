package com.tickercontext.features.controller;

import com.tickercontext.features.cache.FeatureCache;
import com.tickercontext.features.provider.ProviderSet;
import com.tickercontext.features.ring.QuoteRingBuffer;
import com.tickercontext.features.sentiment.SentimentScore;
import com.tickercontext.features.service.FeatureAggregator;
import com.tickercontext.features.service.FeatureSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

class FeatureControllerTest {

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T14:00:00Z"), ZoneOffset.UTC);
        ProviderSet none = new ProviderSet(null, null, null, null, null, null);
        FeatureAggregator aggregator = new FeatureAggregator(none, texts -> Mono.just(SentimentScore.NEUTRAL),
            new QuoteRingBuffer(clock), new FeatureCache(clock),
            new FeatureSettings(false, Duration.ofSeconds(1), 5), clock);
        client = WebTestClient.bindToController(new FeatureController(aggregator)).build();
    }

    @Test
    @DisplayName("stub endpoint returns the synthetic payload")
    void stub() {
        client.get().uri("/api/features?ticker=aapl").exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.ticker").isEqualTo("AAPL")
            .jsonPath("$.quote.quality").isEqualTo("unknown")
            .jsonPath("$.refs.length()").isEqualTo(3)
            .jsonPath("$.features.mins_since_news").isEqualTo(12)
            .jsonPath("$.ts").isEqualTo("2024-05-01T14:00:00Z");
    }

    @Test
    @DisplayName("blank ticker → 400")
    void blankTicker() {
        client.get().uri("/api/features/v2?ticker= ").exchange().expectStatus().isBadRequest();
        client.get().uri("/api/features?ticker=").exchange().expectStatus().isBadRequest();
    }

    @Test
    @DisplayName("v2 echoes the trace header through the pipeline")
    void v2() {
        client.get().uri("/api/features/v2?ticker=msft")
            .header("X-Trace-Id", "trace-1")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.ticker").isEqualTo("MSFT")
            .jsonPath("$.refs_sources.length()").isEqualTo(0);
    }

    @Test
    @DisplayName("one-liner composes from the posted refs")
    void oneLiner() {
        String body = """
            {"class_": "IRON_CONDOR", "confidence": 0.7, "title": "t", "publisher": "Reuters", "url": "https://a",
             "refs": [{"title": "a", "publisher": "Reuters", "url": "https://a"},
                      {"title": "b", "publisher": "AP", "url": "https://b"}, null]}
            """;
        client.post().uri("/api/one_liner")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.text").isEqualTo("Range-bound, IV watch. Source: Reuters —([1][2])")
            .jsonPath("$.refs_numbers[1].n").isEqualTo(2)
            .jsonPath("$.refs_numbers[1].url").isEqualTo("https://b");
    }

    @Test
    void healthz() {
        client.get().uri("/healthz").exchange()
            .expectStatus().isOk()
            .expectBody().jsonPath("$.status").isEqualTo("ok");
    }
}
