package com.propertyintel.hydrant.model;

/**
 * Stages of a single pipeline run. FAILED is terminal and reachable from any
 * stage before DONE.
 */
public enum PipelineStage {
    INIT,
    INGESTED,
    VALIDATED,
    GATE_CHECKED,
    TRANSFORMED,
    PERSISTED,
    DONE,
    FAILED
}
