package com.tickercontext.gateway.support;

import com.tickercontext.gateway.client.ResilientServiceClient;
import com.tickercontext.gateway.client.RetrySettings;
import com.tickercontext.gateway.logger.RequestFlowLogger;
import com.tickercontext.gateway.service.GatewayService;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

/** Canned downstream bodies and a gateway wired against {@link ScriptedExchange}s. */
public final class GatewayFixtures {

    public static final Instant NOW = Instant.parse("2024-05-01T14:00:00Z");
    public static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
    public static final RetrySettings RETRY = new RetrySettings(Duration.ofSeconds(2), 2, Duration.ofMillis(10));

    private static final String FEATURES_JSON = """
        {
          "ticker": "AAPL",
          "features": {"sent_mean": 0.2, "sent_std": 0.1, "r_1m": 0.001, "r_5m": 0.004, "above_sma20": true,
                       "mins_since_news": 30, "rv20": 0.05, "earnings_soon": false, "liquidity_flag": true},
          "top_headline": {"title": "Apple beats", "publisher": "Reuters", "url": "https://a"},
          "refs": [{"title": "Apple beats", "publisher": "Reuters", "url": "https://a"},
                   {"title": "Apple guides", "publisher": "AP", "url": "https://b"}, null],
          "refs_sources": ["Reuters", "AP"],
          "error": %s,
          "quote": {"last": 187.3, "bid": 187.25, "ask": 187.35, "quality": "real"},
          "ts": %s
        }
        """;

    public static final String RECOMMENDATION_JSON =
        "{\"class\": \"IRON_CONDOR\", \"confidence\": 0.72, \"model\": \"v3\"}";

    public static final String ONE_LINER_JSON = """
        {"text": "Range-bound, IV watch. Source: Reuters —([1][2])",
         "refs_numbers": [{"n": 1, "url": "https://a"}, {"n": 2, "url": "https://b"}]}
        """;

    private GatewayFixtures() {}

    /** Feature payload body; {@code null} arguments render as JSON null. */
    public static String features(String error, String ts) {
        return FEATURES_JSON.formatted(
            error == null ? "null" : "\"" + error + "\"",
            ts == null ? "null" : "\"" + ts + "\"");
    }

    public static GatewayService service(ScriptedExchange features, ScriptedExchange recommendation) {
        return new GatewayService(
            new ResilientServiceClient("features", features.webClient(), RETRY),
            new ResilientServiceClient("recommendation", recommendation.webClient(), RETRY),
            new RequestFlowLogger(),
            CLOCK);
    }
}
