package com.tickercontext.features.cache;

import com.tickercontext.common.model.FeaturePayload;

import java.time.Instant;

/**
 * Immutable cache entry wrapping a {@link FeaturePayload} with the instant it was stored.
 */
public record CachedFeatures(
    FeaturePayload payload,
    Instant storedAt
) {}
