package com.tickercontext.gateway.client;

import java.time.Duration;

/**
 * @param timeout per-attempt timeout
 * @param retries additional attempts after the first; total attempts = retries + 1
 * @param delay   fixed pause between attempts (no growth, no jitter)
 */
public record RetrySettings(
    Duration timeout,
    int retries,
    Duration delay
) {
    public RetrySettings {
        if (retries < 0) throw new IllegalArgumentException("retries must be >= 0");
    }
}
