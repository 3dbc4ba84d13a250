package com.propertyintel.hydrant.exception;

/**
 * A transient upstream failure (5xx, 429, timeout or connection error).
 * Only this subtype is retried by the "hydrantApi" retry instance.
 */
public class UpstreamUnavailableException extends UpstreamFetchException {

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
