package com.tickercontext.gateway.logger;

import com.tickercontext.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs each stage of a gateway run as it passes through the reactive pipeline.
 *
 * <p>Stages (in order):
 * <ol>
 *   <li>{@link #REQUEST_RECEIVED}</li>
 *   <li>{@link #FEATURES_FETCHED}</li>
 *   <li>{@link #RECOMMENDATION_RECEIVED}</li>
 *   <li>{@link #ONE_LINER_COMPOSED}</li>
 *   <li>{@link #RESPONSE_ASSEMBLED}</li>
 * </ol>
 *
 * <pre>
 *     .doOnEach(requestFlowLogger.stage(RequestFlowLogger.FEATURES_FETCHED))
 * </pre>
 */
@Component
public class RequestFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(RequestFlowLogger.class);

    public static final String REQUEST_RECEIVED        = "REQUEST_RECEIVED";
    public static final String FEATURES_FETCHED        = "FEATURES_FETCHED";
    public static final String RECOMMENDATION_RECEIVED = "RECOMMENDATION_RECEIVED";
    public static final String ONE_LINER_COMPOSED      = "ONE_LINER_COMPOSED";
    public static final String RESPONSE_ASSEMBLED      = "RESPONSE_ASSEMBLED";

    /**
     * Returns a {@code doOnEach} consumer that logs {@code stageName} on {@code onNext} only.
     * The traceId is read from the Reactor Context carried by the signal.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[RequestFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    public void logWithTraceId(String stageName, String ticker, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[RequestFlow] stage={} ticker={} traceId={}", stageName, ticker, traceId)
        );
    }
}
