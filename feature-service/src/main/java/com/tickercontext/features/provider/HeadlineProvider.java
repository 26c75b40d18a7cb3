package com.tickercontext.features.provider;

import com.tickercontext.features.model.Headline;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Source of recent news for a ticker. Fails with a provider-specific error.
 */
public interface HeadlineProvider {
    String name();

    Mono<List<Headline>> fetchHeadlines(String ticker, int limit);
}
