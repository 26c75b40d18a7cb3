package com.tickercontext.gateway.client;

import com.tickercontext.common.exception.UpstreamServiceException;
import com.tickercontext.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.Map;

/**
 * JSON client for one downstream platform service.
 *
 * <p>Every call is bounded by {@link RetrySettings#timeout()} per attempt and re-issued
 * identically up to {@link RetrySettings#retries()} times with a fixed delay. When the
 * budget is spent the call fails with {@link UpstreamServiceException}; an empty body
 * counts as a failed attempt.
 */
public class ResilientServiceClient {

    private static final Logger log = LoggerFactory.getLogger(ResilientServiceClient.class);

    private final String serviceName;
    private final WebClient webClient;
    private final RetrySettings settings;

    public ResilientServiceClient(String serviceName, WebClient webClient, RetrySettings settings) {
        this.serviceName = serviceName;
        this.webClient   = webClient;
        this.settings    = settings;
    }

    public String serviceName() {
        return serviceName;
    }

    public <T> Mono<T> get(String path, Map<String, ?> queryParams, Class<T> type, String traceId) {
        Mono<T> call = webClient.get()
            .uri(uriBuilder -> {
                uriBuilder.path(path);
                queryParams.forEach((name, value) -> uriBuilder.queryParam(name, value));
                return uriBuilder.build();
            })
            .header(TraceContextUtil.TRACE_ID_HEADER, traceId)
            .retrieve()
            .bodyToMono(type);
        return withRetry("GET " + path, call);
    }

    public <T> Mono<T> post(String path, Object body, Class<T> type, String traceId) {
        Mono<T> call = webClient.post()
            .uri(path)
            .contentType(MediaType.APPLICATION_JSON)
            .header(TraceContextUtil.TRACE_ID_HEADER, traceId)
            .bodyValue(body)
            .retrieve()
            .bodyToMono(type);
        return withRetry("POST " + path, call);
    }

    private <T> Mono<T> withRetry(String operation, Mono<T> call) {
        return call
            .switchIfEmpty(Mono.error(() -> new IllegalStateException("empty response body")))
            .timeout(settings.timeout())
            .retryWhen(Retry.fixedDelay(settings.retries(), settings.delay())
                .doBeforeRetry(signal -> log.warn(
                    "UPSTREAM_RETRY service={} op={} failedAttempt={} reason={}",
                    serviceName, operation, signal.totalRetries() + 1, signal.failure().getMessage()))
                .onRetryExhaustedThrow((retrySpec, signal) -> new UpstreamServiceException(
                    serviceName,
                    operation + " failed after " + (signal.totalRetries() + 1) + " attempts: "
                        + signal.failure().getMessage(),
                    signal.failure())));
    }
}
