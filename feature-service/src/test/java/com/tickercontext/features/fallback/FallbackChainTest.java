package com.tickercontext.features.fallback;

import com.tickercontext.common.exception.ProviderException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class FallbackChainTest {

    @Nested
    @DisplayName("resolve()")
    class ResolveTests {

        @Test
        @DisplayName("first attempt accepted → SUCCESS, later attempts never subscribed")
        void firstWins() {
            AtomicInteger lateCalls = new AtomicInteger();
            ProviderOutcome<Double> result = FallbackChain.<Double>of("price")
                .thenValue("primary", 10.0)
                .then("secondary", () -> {
                    lateCalls.incrementAndGet();
                    return Mono.just(ProviderOutcome.success(20.0, "secondary"));
                })
                .resolve(p -> p > 0)
                .block();

            assertEquals(ProviderOutcome.Status.SUCCESS, result.status());
            assertEquals(10.0, result.value());
            assertEquals("primary", result.source());
            assertNull(result.diagnostic());
            assertEquals(0, lateCalls.get());
        }

        @Test
        @DisplayName("rejected and failed attempts → DEGRADED with joined diagnostics")
        void degraded() {
            ProviderOutcome<Double> result = FallbackChain.<Double>of("price")
                .thenOutcome("primary", ProviderOutcome.failed("primary: timeout"))
                .thenOutcome("candles", ProviderOutcome.success(0.0, "candles"))
                .then("secondary", () -> Mono.error(new ProviderException("finnhub", "HTTP 500")))
                .thenValue("sentinel", 1.0)
                .resolve(p -> p > 0)
                .block();

            assertEquals(ProviderOutcome.Status.DEGRADED, result.status());
            assertEquals(1.0, result.value());
            assertEquals("sentinel", result.source());
            assertEquals("primary: timeout; secondary: HTTP 500", result.diagnostic());
        }

        @Test
        @DisplayName("every attempt exhausted → FAILED")
        void exhausted() {
            ProviderOutcome<String> result = FallbackChain.<String>of("headline")
                .thenOutcome("a", ProviderOutcome.failed("a: down"))
                .then("b", Mono::empty)
                .resolve(s -> !s.isBlank())
                .block();

            assertTrue(result.isFailed());
            assertEquals("a: down; b: no response", result.diagnostic());
        }

        @Test
        @DisplayName("empty chain → FAILED with kind in diagnostic")
        void emptyChain() {
            ProviderOutcome<String> result = FallbackChain.<String>of("headline").resolve(s -> true).block();
            assertTrue(result.isFailed());
            assertEquals("headline: no usable value", result.diagnostic());
        }
    }

    @Nested
    @DisplayName("ProviderOutcome.capture()")
    class CaptureTests {

        @Test
        @DisplayName("value → SUCCESS tagged with label")
        void value() {
            ProviderOutcome<Integer> outcome = ProviderOutcome.capture("tiingo", () -> Mono.just(5),
                Duration.ofSeconds(1)).block();
            assertEquals(ProviderOutcome.Status.SUCCESS, outcome.status());
            assertEquals(5, outcome.value());
            assertEquals("tiingo", outcome.source());
        }

        @Test
        @DisplayName("empty → SUCCESS without value")
        void empty() {
            ProviderOutcome<Integer> outcome = ProviderOutcome.<Integer>capture("finnhub earnings", Mono::empty,
                Duration.ofSeconds(1)).block();
            assertFalse(outcome.isFailed());
            assertFalse(outcome.hasValue());
        }

        @Test
        @DisplayName("timeout and thrown exceptions → FAILED, never an error signal")
        void failures() {
            ProviderOutcome<Integer> timedOut = ProviderOutcome.capture("yahoo", () -> Mono.<Integer>never(),
                Duration.ofMillis(50)).block();
            assertTrue(timedOut.isFailed());
            assertTrue(timedOut.diagnostic().startsWith("yahoo: "));

            ProviderOutcome<Integer> thrown = ProviderOutcome.<Integer>capture("finnhub", () -> {
                throw new IllegalStateException("no key");
            }, Duration.ofSeconds(1)).block();
            assertEquals("finnhub: no key", thrown.diagnostic());
        }

        @Test
        @DisplayName("provider errors name the provider once")
        void providerNamedOnce() {
            ProviderOutcome<Integer> outcome = ProviderOutcome.<Integer>capture("finnhub",
                () -> Mono.error(new ProviderException("finnhub", "missing API key")),
                Duration.ofSeconds(1)).block();
            assertEquals("finnhub: missing API key", outcome.diagnostic());
        }

        @Test
        @DisplayName("map() keeps the tag")
        void mapKeepsStatus() {
            ProviderOutcome<Integer> degraded = ProviderOutcome.degraded(2, "x: down", "b");
            ProviderOutcome<String> mapped = degraded.map(String::valueOf);
            assertEquals(ProviderOutcome.Status.DEGRADED, mapped.status());
            assertEquals("2", mapped.value());
            assertEquals("x: down", mapped.diagnostic());
            assertEquals(7, ProviderOutcome.<Integer>failed("z").valueOr(7));
        }
    }
}
