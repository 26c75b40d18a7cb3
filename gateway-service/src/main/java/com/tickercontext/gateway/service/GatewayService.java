package com.tickercontext.gateway.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.tickercontext.common.model.FeaturePayload;
import com.tickercontext.common.model.HeadlineRef;
import com.tickercontext.common.model.OneLiner;
import com.tickercontext.common.model.OneLinerRequest;
import com.tickercontext.common.model.QuoteSnapshot;
import com.tickercontext.common.time.IsoTimestamps;
import com.tickercontext.common.trace.TraceContextUtil;
import com.tickercontext.gateway.client.ResilientServiceClient;
import com.tickercontext.gateway.logger.RequestFlowLogger;
import com.tickercontext.gateway.model.RunResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Runs features → recommendation → one-liner for a ticker and assembles the composite response.
 *
 * <p>Feature and recommendation failures (after retries) abort the run with
 * {@link com.tickercontext.common.exception.UpstreamServiceException}. A one-liner failure
 * never does: a plain "CLASS · NN% confidence" line is substituted.
 */
@Service
public class GatewayService {

    private static final Logger log = LoggerFactory.getLogger(GatewayService.class);

    static final String DEFAULT_CLASS = "NO_ACTION";

    private final ResilientServiceClient featureClient;
    private final ResilientServiceClient recommendationClient;
    private final RequestFlowLogger flowLogger;
    private final Clock clock;

    public GatewayService(
            @Qualifier("featureServiceClient") ResilientServiceClient featureClient,
            @Qualifier("recommendationServiceClient") ResilientServiceClient recommendationClient,
            RequestFlowLogger flowLogger,
            Clock clock) {
        this.featureClient        = featureClient;
        this.recommendationClient = recommendationClient;
        this.flowLogger           = flowLogger;
        this.clock                = clock;
    }

    public Mono<RunResponse> run(String ticker, String traceId) {
        flowLogger.logWithTraceId(RequestFlowLogger.REQUEST_RECEIVED, ticker, traceId);

        Mono<RunResponse> pipeline = featureClient
            .get("/api/features/v2", Map.of("ticker", ticker), FeaturePayload.class, traceId)
            .doOnEach(flowLogger.stage(RequestFlowLogger.FEATURES_FETCHED))
            .flatMap(payload -> recommendationClient
                .post("/api/recommend", recommendationBody(payload), JsonNode.class, traceId)
                .doOnEach(flowLogger.stage(RequestFlowLogger.RECOMMENDATION_RECEIVED))
                .flatMap(recommendation -> composeOneLiner(payload, recommendation, traceId)
                    .map(oneLiner -> assemble(ticker, payload, recommendation, oneLiner))))
            .doOnEach(flowLogger.stage(RequestFlowLogger.RESPONSE_ASSEMBLED))
            .doOnError(e -> TraceContextUtil.withMdc(traceId, () ->
                log.error("RUN_FAILED ticker={} traceId={} reason={}", ticker, traceId, e.getMessage())));

        return TraceContextUtil.withTraceId(pipeline, traceId);
    }

    private Object recommendationBody(FeaturePayload payload) {
        return payload.features() != null ? payload.features() : Map.of();
    }

    private Mono<OneLiner> composeOneLiner(FeaturePayload payload, JsonNode recommendation, String traceId) {
        String classification = recommendation.path("class").asText(DEFAULT_CLASS);
        double confidence = recommendation.path("confidence").asDouble(0.0);

        HeadlineRef headline = payload.topHeadline();
        OneLinerRequest request = new OneLinerRequest(
            classification,
            confidence,
            headline != null && headline.title() != null ? headline.title() : "",
            headline != null && headline.publisher() != null ? headline.publisher() : "",
            headline != null && headline.url() != null ? headline.url() : "",
            payload.refs() != null ? payload.refs() : List.of());

        return featureClient.post("/api/one_liner", request, OneLiner.class, traceId)
            .doOnEach(flowLogger.stage(RequestFlowLogger.ONE_LINER_COMPOSED))
            .onErrorResume(e -> {
                log.warn("ONE_LINER_FALLBACK class={} traceId={} reason={}",
                         classification, traceId, e.getMessage());
                return Mono.just(fallbackOneLiner(classification, confidence));
            });
    }

    static OneLiner fallbackOneLiner(String classification, double confidence) {
        return new OneLiner(classification + " · " + (int) Math.floor(confidence * 100) + "% confidence", List.of());
    }

    private RunResponse assemble(String ticker, FeaturePayload payload, JsonNode recommendation, OneLiner oneLiner) {
        Instant now = clock.instant();
        return new RunResponse(
            ticker,
            payload.features(),
            recommendation,
            oneLiner,
            payload.quote() != null ? payload.quote() : QuoteSnapshot.unknown(),
            payload.topHeadline(),
            payload.refs() != null ? payload.refs() : List.of(),
            payload.refsSources() != null ? payload.refsSources() : List.of(),
            payload.timestamp(),
            IsoTimestamps.format(now),
            cacheAgeSeconds(payload.timestamp(), now),
            payload.error());
    }

    /**
     * Whole seconds between the payload timestamp and {@code now}, truncated toward zero;
     * null when absent or unparseable.
     */
    static Long cacheAgeSeconds(String payloadTimestamp, Instant now) {
        return IsoTimestamps.parse(payloadTimestamp)
            .map(ts -> Duration.between(ts, now).toMillis() / 1000)
            .orElse(null);
    }
}
