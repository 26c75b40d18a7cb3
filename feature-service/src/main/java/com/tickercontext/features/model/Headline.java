package com.tickercontext.features.model;

import java.time.Instant;

/**
 * One news item as returned by a headline provider. {@code publishedAt} may be null.
 */
public record Headline(
    String title,
    String url,
    String publisher,
    Instant publishedAt
) {}
