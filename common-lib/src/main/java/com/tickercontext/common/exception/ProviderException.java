package com.tickercontext.common.exception;

/**
 * Raised by an upstream data provider client when a single call fails: non-2xx status,
 * malformed body or missing credentials. Always non-fatal to a feature aggregation.
 */
public class ProviderException extends RuntimeException {
    private final String providerName;
    private final String reason;

    public ProviderException(String providerName, String message) {
        super("[" + providerName + "] " + message);
        this.providerName = providerName;
        this.reason = message;
    }

    public ProviderException(String providerName, String message, Throwable cause) {
        super("[" + providerName + "] " + message, cause);
        this.providerName = providerName;
        this.reason = message;
    }

    public String getProviderName() {
        return providerName;
    }

    /** The message without the provider prefix. */
    public String getReason() {
        return reason;
    }
}
