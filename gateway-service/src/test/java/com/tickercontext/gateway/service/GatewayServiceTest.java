package com.tickercontext.gateway.service;

import com.tickercontext.common.exception.UpstreamServiceException;
import com.tickercontext.common.model.QuoteQuality;
import com.tickercontext.gateway.model.RunResponse;
import com.tickercontext.gateway.support.ScriptedExchange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.tickercontext.gateway.support.GatewayFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class GatewayServiceTest {

    @Nested
    @DisplayName("run()")
    class RunTests {

        @Test
        @DisplayName("assembles the composite response from all three calls")
        void happyPath() {
            ScriptedExchange features = new ScriptedExchange()
                .ok("/api/features/v2", features(null, "2024-05-01T13:59:30Z"))
                .ok("/api/one_liner", ONE_LINER_JSON);
            ScriptedExchange recommendation = new ScriptedExchange().ok("/api/recommend", RECOMMENDATION_JSON);

            RunResponse response = service(features, recommendation).run("AAPL", "trace-1").block();

            assertEquals("AAPL", response.ticker());
            assertEquals(0.05, response.features().rv20());
            assertEquals("IRON_CONDOR", response.recommendation().path("class").asText());
            assertEquals("v3", response.recommendation().path("model").asText());
            assertEquals("Range-bound, IV watch. Source: Reuters —([1][2])", response.oneLiner().text());
            assertEquals(2, response.oneLiner().refsNumbers().size());
            assertEquals(QuoteQuality.REAL, response.quote().quality());
            assertEquals(3, response.refs().size());
            assertEquals("2024-05-01T13:59:30Z", response.contextTimestamp());
            assertEquals("2024-05-01T14:00:00Z", response.gatewayTimestamp());
            assertEquals(30L, response.cacheAgeSeconds());
            assertNull(response.featuresNote());
        }

        @Test
        @DisplayName("feature call recovers after two failures")
        void featureRetry() {
            ScriptedExchange features = new ScriptedExchange()
                .fail("/api/features/v2")
                .fail("/api/features/v2")
                .ok("/api/features/v2", features(null, "2024-05-01T13:59:30Z"))
                .ok("/api/one_liner", ONE_LINER_JSON);
            ScriptedExchange recommendation = new ScriptedExchange().ok("/api/recommend", RECOMMENDATION_JSON);

            assertNotNull(service(features, recommendation).run("AAPL", "trace-1").block());
            assertEquals(3, features.calls("/api/features/v2"));
        }

        @Test
        @DisplayName("feature service down → UpstreamServiceException, recommendation never called")
        void featuresDown() {
            ScriptedExchange features = new ScriptedExchange().fail("/api/features/v2");
            ScriptedExchange recommendation = new ScriptedExchange().ok("/api/recommend", RECOMMENDATION_JSON);

            UpstreamServiceException e = assertThrows(UpstreamServiceException.class,
                () -> service(features, recommendation).run("AAPL", "trace-1").block());

            assertEquals("features", e.getServiceName());
            assertEquals(RETRY.retries() + 1, features.calls("/api/features/v2"));
            assertEquals(0, recommendation.calls("/api/recommend"));
        }

        @Test
        @DisplayName("recommendation service down → UpstreamServiceException")
        void recommendationDown() {
            ScriptedExchange features = new ScriptedExchange()
                .ok("/api/features/v2", features(null, "2024-05-01T13:59:30Z"));
            ScriptedExchange recommendation = new ScriptedExchange().fail("/api/recommend");

            UpstreamServiceException e = assertThrows(UpstreamServiceException.class,
                () -> service(features, recommendation).run("AAPL", "trace-1").block());

            assertEquals("recommendation", e.getServiceName());
            assertEquals(3, recommendation.calls("/api/recommend"));
        }
    }

    @Nested
    @DisplayName("degradation")
    class DegradationTests {

        @Test
        @DisplayName("one-liner failure → local CLASS · NN% confidence line")
        void oneLinerFallback() {
            ScriptedExchange features = new ScriptedExchange()
                .ok("/api/features/v2", features(null, "2024-05-01T13:59:30Z"))
                .fail("/api/one_liner");
            ScriptedExchange recommendation = new ScriptedExchange().ok("/api/recommend", RECOMMENDATION_JSON);

            RunResponse response = service(features, recommendation).run("AAPL", "trace-1").block();

            assertEquals("IRON_CONDOR · 72% confidence", response.oneLiner().text());
            assertTrue(response.oneLiner().refsNumbers().isEmpty());
            assertEquals(3, features.calls("/api/one_liner"));
        }

        @Test
        @DisplayName("recommendation without class/confidence → NO_ACTION at 0%")
        void recommendationDefaults() {
            ScriptedExchange features = new ScriptedExchange()
                .ok("/api/features/v2", features(null, "2024-05-01T13:59:30Z"))
                .fail("/api/one_liner");
            ScriptedExchange recommendation = new ScriptedExchange().ok("/api/recommend", "{}");

            RunResponse response = service(features, recommendation).run("AAPL", "trace-1").block();

            assertEquals("NO_ACTION · 0% confidence", response.oneLiner().text());
        }

        @Test
        @DisplayName("degraded features are surfaced as features_note; missing ts → null cache age")
        void featuresNote() {
            ScriptedExchange features = new ScriptedExchange()
                .ok("/api/features/v2", features("tiingo: HTTP 503", null))
                .ok("/api/one_liner", ONE_LINER_JSON);
            ScriptedExchange recommendation = new ScriptedExchange().ok("/api/recommend", RECOMMENDATION_JSON);

            RunResponse response = service(features, recommendation).run("AAPL", "trace-1").block();

            assertEquals("tiingo: HTTP 503", response.featuresNote());
            assertNull(response.cacheAgeSeconds());
        }
    }

    @Test
    @DisplayName("cache age: whole seconds, null when unparseable")
    void cacheAge() {
        assertEquals(90L, GatewayService.cacheAgeSeconds("2024-05-01T13:58:30Z", NOW));
        assertEquals(90L, GatewayService.cacheAgeSeconds("2024-05-01T13:58:30", NOW));
        assertNull(GatewayService.cacheAgeSeconds("not a time", NOW));
        assertEquals(0L, GatewayService.cacheAgeSeconds("2024-05-01T14:00:00Z", NOW.minusMillis(500)));
        assertEquals(-1L, GatewayService.cacheAgeSeconds("2024-05-01T14:00:01.900Z", NOW.plusMillis(500)));
        assertNull(GatewayService.cacheAgeSeconds(null, NOW));
    }
}
