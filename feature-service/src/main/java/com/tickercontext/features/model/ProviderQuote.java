package com.tickercontext.features.model;

/**
 * Raw quote from a provider; any field may be null or zero when the provider omits it.
 */
public record ProviderQuote(
    Double last,
    Double bid,
    Double ask
) {}
