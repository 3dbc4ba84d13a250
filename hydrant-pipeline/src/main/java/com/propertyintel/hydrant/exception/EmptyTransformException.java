package com.propertyintel.hydrant.exception;

/**
 * Quality gate: the transformer returned no rows for a non-empty input.
 */
public class EmptyTransformException extends HydrantPipelineException {

    public EmptyTransformException(String message) {
        super(FailureKind.EMPTY_TRANSFORM, message);
    }
}
