package com.propertyintel.hydrant.exception;

import com.propertyintel.hydrant.model.PipelineStage;

/**
 * Base type for every fatal pipeline condition.
 *
 * The stage is the last stage the run reached before failing; the orchestrator
 * fills it in when the exception passes through its top-level handler.
 */
public abstract class HydrantPipelineException extends RuntimeException {

    private final FailureKind kind;
    private PipelineStage stage;

    protected HydrantPipelineException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected HydrantPipelineException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }

    public PipelineStage getStage() {
        return stage;
    }

    public HydrantPipelineException atStage(PipelineStage stage) {
        if (this.stage == null) {
            this.stage = stage;
        }
        return this;
    }
}
