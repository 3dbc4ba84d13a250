package com.propertyintel.hydrant.model;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.time.LocalDateTime;

/**
 * Tracks one pipeline execution for observability.
 * Logged as a summary line when the run finishes, successfully or not.
 */
@Data
@Builder
public class PipelineRun {

    private String runId;           // first 8 chars of a UUID
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private PipelineStage stage;
    private PipelineStage failedAt; // null unless stage == FAILED
    private Path rawPayload;
    private int recordsValid;
    private int recordsInvalid;
    private int recordsWritten;
    private Path partitionFile;
    private String errorMessage;    // null on success
}
