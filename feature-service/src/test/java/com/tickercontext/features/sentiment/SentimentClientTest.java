package com.tickercontext.features.sentiment;

import com.tickercontext.features.support.StubExchange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SentimentClientTest {

    @Test
    @DisplayName("scores are read from {mean, std}")
    void scores() {
        StubExchange exchange = StubExchange.ok("{\"mean\": 0.35, \"std\": 0.12}");
        SentimentClient client = new SentimentClient(exchange.webClient("http://sent.test"), Duration.ofSeconds(1));

        SentimentScore score = client.score(List.of("Apple beats", "Apple guides")).block();

        assertEquals(new SentimentScore(0.35, 0.12), score);
        assertEquals(HttpMethod.POST, exchange.lastRequest().method());
        assertEquals("/api/sentiment", exchange.lastRequest().url().getPath());
    }

    @Nested
    @DisplayName("incomplete 2xx bodies")
    class IncompleteBodyTests {

        private SentimentScore scoreWith(String body) {
            StubExchange exchange = StubExchange.ok(body);
            SentimentClient client = new SentimentClient(exchange.webClient("http://sent.test"), Duration.ofSeconds(1));
            return client.score(List.of("headline")).block();
        }

        @Test
        @DisplayName("empty object → neutral")
        void emptyObject() {
            assertEquals(SentimentScore.NEUTRAL, scoreWith("{}"));
        }

        @Test
        @DisplayName("missing std → default std, mean kept")
        void missingStd() {
            assertEquals(new SentimentScore(0.3, 0.05), scoreWith("{\"mean\": 0.3}"));
        }

        @Test
        @DisplayName("null fields → neutral")
        void nullFields() {
            assertEquals(SentimentScore.NEUTRAL, scoreWith("{\"mean\": null, \"std\": null}"));
        }
    }

    @Test
    @DisplayName("no usable text → neutral without an HTTP call")
    void emptyInput() {
        StubExchange exchange = StubExchange.ok("{\"mean\": 0.9, \"std\": 0.0}");
        SentimentClient client = new SentimentClient(exchange.webClient("http://sent.test"), Duration.ofSeconds(1));

        assertEquals(SentimentScore.NEUTRAL, client.score(Arrays.asList(" ", null)).block());
        assertEquals(SentimentScore.NEUTRAL, client.score(null).block());
        assertTrue(exchange.requests().isEmpty());
    }

    @Test
    @DisplayName("upstream error → neutral")
    void upstreamError() {
        StubExchange exchange = new StubExchange(HttpStatus.INTERNAL_SERVER_ERROR, "{}");
        SentimentClient client = new SentimentClient(exchange.webClient("http://sent.test"), Duration.ofSeconds(1));

        assertEquals(SentimentScore.NEUTRAL, client.score(List.of("headline")).block());
    }
}
