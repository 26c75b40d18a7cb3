package com.tickercontext.features.provider;

import com.tickercontext.features.model.ProviderQuote;
import reactor.core.publisher.Mono;

public interface QuoteProvider {
    String name();

    Mono<ProviderQuote> fetchQuote(String ticker);
}
