package com.propertyintel.hydrant.exception;

/**
 * The raw payload is not a JSON array of objects.
 */
public class PayloadParseException extends HydrantPipelineException {

    public PayloadParseException(String message) {
        super(FailureKind.PAYLOAD_PARSE, message);
    }

    public PayloadParseException(String message, Throwable cause) {
        super(FailureKind.PAYLOAD_PARSE, message, cause);
    }
}
