package com.poolradar.source;

/**
 * Upstream request did not answer within the configured request timeout.
 */
public class UpstreamTimeoutException extends UpstreamException {

    public UpstreamTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
