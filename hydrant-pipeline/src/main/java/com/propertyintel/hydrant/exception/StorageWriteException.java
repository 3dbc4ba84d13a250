package com.propertyintel.hydrant.exception;

/**
 * The partition directory or dataset file could not be written.
 */
public class StorageWriteException extends HydrantPipelineException {

    public StorageWriteException(String message, Throwable cause) {
        super(FailureKind.STORAGE_WRITE, message, cause);
    }
}
