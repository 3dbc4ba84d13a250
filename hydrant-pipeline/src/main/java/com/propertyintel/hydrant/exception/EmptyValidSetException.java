package com.propertyintel.hydrant.exception;

/**
 * Quality gate: validation left no records to process.
 */
public class EmptyValidSetException extends HydrantPipelineException {

    public EmptyValidSetException(String message) {
        super(FailureKind.EMPTY_VALID_SET, message);
    }
}
