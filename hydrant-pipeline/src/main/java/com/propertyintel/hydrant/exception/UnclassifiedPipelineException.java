package com.propertyintel.hydrant.exception;

/**
 * Wraps any unexpected error raised during a run; the original is kept as the cause.
 */
public class UnclassifiedPipelineException extends HydrantPipelineException {

    public UnclassifiedPipelineException(String message, Throwable cause) {
        super(FailureKind.UNCLASSIFIED, message, cause);
    }
}
