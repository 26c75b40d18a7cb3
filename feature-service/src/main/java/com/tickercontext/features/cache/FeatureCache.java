package com.tickercontext.features.cache;

import com.tickercontext.common.model.FeaturePayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory store of the last computed {@link FeaturePayload}, one per ticker.
 *
 * <p>Entries never expire: a cached payload is served until the next aggregation
 * for the same ticker overwrites it. Concurrent writers for one ticker race with
 * last-writer-wins semantics.
 *
 * <p>Thread-safe via {@link ConcurrentHashMap}. No blocking calls.
 */
@Component
public class FeatureCache {

    private static final Logger log = LoggerFactory.getLogger(FeatureCache.class);

    private final ConcurrentHashMap<String, CachedFeatures> store = new ConcurrentHashMap<>();
    private final Clock clock;

    public FeatureCache(Clock clock) {
        this.clock = clock;
    }

    /**
     * @return the cached entry for the ticker, or {@code null} if absent
     */
    public CachedFeatures get(String ticker) {
        return store.get(ticker);
    }

    public void put(String ticker, FeaturePayload payload) {
        store.put(ticker, new CachedFeatures(payload, clock.instant()));
        log.info("CACHE_REFRESH symbol={} degraded={}", ticker, payload.error() != null);
    }

    public int size() {
        return store.size();
    }
}
