package com.propertyintel.hydrant.service;

import com.propertyintel.hydrant.config.HydrantPipelineProperties;
import com.propertyintel.hydrant.exception.EmptyTransformException;
import com.propertyintel.hydrant.exception.EmptyValidSetException;
import com.propertyintel.hydrant.exception.HydrantPipelineException;
import com.propertyintel.hydrant.exception.UnclassifiedPipelineException;
import com.propertyintel.hydrant.model.HydrantFeature;
import com.propertyintel.hydrant.model.PipelineRun;
import com.propertyintel.hydrant.model.PipelineStage;
import com.propertyintel.hydrant.model.ValidationOutcome;
import com.propertyintel.hydrant.output.PartitionedWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Runs one daily batch: fetch → validate → quality gate → transform → gate → persist.
 *
 * Any failure moves the run to FAILED, is logged, raises an alert and is rethrown
 * to the caller. Pipeline exceptions keep their type; anything else is wrapped in
 * an UnclassifiedPipelineException.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PipelineOrchestrator {

    public static final String RUN_ID_KEY = "runId";

    static final String NO_VALID_DATA = "No valid data to process after validation.";
    static final String EMPTY_TRANSFORM = "Transformation returned an empty dataset; aborting pipeline.";

    private final OpenDataFetcher fetcher;
    private final SchemaValidator validator;
    private final FeatureTransformer transformer;
    private final PartitionedWriter writer;
    private final AlertNotifier notifier;
    private final HydrantPipelineProperties properties;
    private final Clock clock;

    public synchronized PipelineRun run() {
        String runId = UUID.randomUUID().toString().substring(0, 8);
        MDC.put(RUN_ID_KEY, runId);

        PipelineRun run = PipelineRun.builder()
                .runId(runId)
                .startedAt(LocalDateTime.now(clock))
                .stage(PipelineStage.INIT)
                .build();

        log.info("Starting hydrant pipeline with run ID: {}", runId);
        try {
            Path rawPayload = fetcher.fetch();
            run.setRawPayload(rawPayload);
            advance(run, PipelineStage.INGESTED);

            ValidationOutcome outcome = validator.validateFile(rawPayload);
            run.setRecordsValid(outcome.validRecords().size());
            run.setRecordsInvalid(outcome.invalidCount());
            advance(run, PipelineStage.VALIDATED);
            log.info("Validation complete: {} valid records, {} invalid records.",
                    outcome.validRecords().size(), outcome.invalidCount());

            if (outcome.validRecords().isEmpty()) {
                log.warn(NO_VALID_DATA);
                throw new EmptyValidSetException(NO_VALID_DATA);
            }
            advance(run, PipelineStage.GATE_CHECKED);

            List<HydrantFeature> features = transformer.transform(outcome.validRecords());
            if (features.isEmpty()) {
                log.error(EMPTY_TRANSFORM);
                throw new EmptyTransformException(EMPTY_TRANSFORM);
            }
            advance(run, PipelineStage.TRANSFORMED);

            Path processedDir = Paths.get(properties.getStorage().getProcessedDir());
            writer.ensureBaseDirectory(processedDir);
            Path partitionFile = writer.write(features, processedDir);
            run.setPartitionFile(partitionFile);
            run.setRecordsWritten(features.size());
            advance(run, PipelineStage.PERSISTED);

            advance(run, PipelineStage.DONE);
            log.info("Data pipeline completed successfully.");
            return run;

        } catch (HydrantPipelineException e) {
            e.atStage(run.getStage());
            fail(run, e);
            throw e;

        } catch (RuntimeException e) {
            UnclassifiedPipelineException wrapped = new UnclassifiedPipelineException(
                    "Unexpected " + e.getClass().getSimpleName() + ": " + e.getMessage(), e);
            wrapped.atStage(run.getStage());
            fail(run, wrapped);
            throw wrapped;

        } finally {
            run.setCompletedAt(LocalDateTime.now(clock));
            log.info("Run summary: {}", run);
            MDC.remove(RUN_ID_KEY);
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void advance(PipelineRun run, PipelineStage next) {
        log.debug("Stage {} → {}", run.getStage(), next);
        run.setStage(next);
    }

    private void fail(PipelineRun run, HydrantPipelineException e) {
        run.setFailedAt(run.getStage());
        run.setStage(PipelineStage.FAILED);
        run.setErrorMessage(e.getMessage());

        log.error("Hydrant pipeline failed at stage {} ({}): {}", run.getFailedAt(), e.getKind(), e.getMessage(), e);
        sendAlert("Hydrant pipeline failed: " + e.getMessage());
    }

    /** Alert delivery is best-effort; a notifier failure must not replace the original error. */
    private void sendAlert(String message) {
        try {
            notifier.notify(message);
        } catch (Exception e) {
            log.warn("Failed to send alert: {}", e.getMessage());
        }
    }
}
