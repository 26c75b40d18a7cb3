package com.tickercontext.features.service;

import java.time.Duration;

/**
 * @param liveProviders   false serves the deterministic synthetic feature set without network calls
 * @param providerTimeout per-call timeout applied to every upstream provider request
 * @param headlineLimit   items requested from each headline source
 */
public record FeatureSettings(
    boolean liveProviders,
    Duration providerTimeout,
    int headlineLimit
) {}
