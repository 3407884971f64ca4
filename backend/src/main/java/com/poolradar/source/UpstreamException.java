package com.poolradar.source;

/**
 * Thrown when an upstream pool source fails (transport, HTTP status, error payload or unexpected response shape).
 */
public class UpstreamException extends RuntimeException {

    public UpstreamException(String message) {
        super(message);
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
