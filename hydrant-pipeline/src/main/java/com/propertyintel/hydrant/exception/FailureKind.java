package com.propertyintel.hydrant.exception;

/**
 * Failure taxonomy of a pipeline run. Every kind is fatal to the run.
 */
public enum FailureKind {
    UPSTREAM_FETCH,
    PAYLOAD_PARSE,
    EMPTY_VALID_SET,
    EMPTY_TRANSFORM,
    STORAGE_WRITE,
    UNCLASSIFIED
}
