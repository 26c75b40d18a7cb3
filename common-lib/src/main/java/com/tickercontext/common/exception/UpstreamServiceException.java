package com.tickercontext.common.exception;

/**
 * A downstream platform service (feature or recommendation) could not be reached
 * within the configured retry budget. Fatal to the gateway request that issued the call.
 */
public class UpstreamServiceException extends RuntimeException {
    private final String serviceName;

    public UpstreamServiceException(String serviceName, String message, Throwable cause) {
        super(message, cause);
        this.serviceName = serviceName;
    }

    public String getServiceName() {
        return serviceName;
    }
}
