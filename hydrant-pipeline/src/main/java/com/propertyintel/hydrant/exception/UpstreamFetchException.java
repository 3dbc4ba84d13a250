package com.propertyintel.hydrant.exception;

/**
 * The open-data API could not be reached, timed out or returned an error.
 */
public class UpstreamFetchException extends HydrantPipelineException {

    public UpstreamFetchException(String message) {
        super(FailureKind.UPSTREAM_FETCH, message);
    }

    public UpstreamFetchException(String message, Throwable cause) {
        super(FailureKind.UPSTREAM_FETCH, message, cause);
    }
}
