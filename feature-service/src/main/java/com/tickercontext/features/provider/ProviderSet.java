package com.tickercontext.features.provider;

/**
 * The upstream sources the aggregator consults, in fallback order per data kind.
 */
public record ProviderSet(
    HeadlineProvider primaryHeadlines,
    HeadlineProvider secondaryHeadlines,
    QuoteProvider primaryQuotes,
    QuoteProvider secondaryQuotes,
    CandleProvider candles,
    EarningsDateProvider earnings
) {}
