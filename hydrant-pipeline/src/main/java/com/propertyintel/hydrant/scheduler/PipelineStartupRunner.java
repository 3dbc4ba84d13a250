package com.propertyintel.hydrant.scheduler;

import com.propertyintel.hydrant.config.HydrantPipelineProperties;
import com.propertyintel.hydrant.exception.HydrantPipelineException;
import com.propertyintel.hydrant.service.PipelineOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs the pipeline once when the application starts.
 *
 * In one-shot mode (scheduling disabled) a failed run is not caught: the
 * exception aborts SpringApplication.run and the process exits non-zero.
 * With scheduling enabled the failure is logged and the daily schedule keeps running.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "hydrant-pipeline.scheduling", name = "run-on-startup",
        havingValue = "true", matchIfMissing = true)
public class PipelineStartupRunner implements CommandLineRunner {

    private final PipelineOrchestrator orchestrator;
    private final HydrantPipelineProperties properties;

    @Override
    public void run(String... args) {
        log.info("Run on startup enabled, running hydrant pipeline once");
        if (!properties.getScheduling().isEnabled()) {
            orchestrator.run();
            return;
        }
        try {
            orchestrator.run();
        } catch (HydrantPipelineException e) {
            log.error("Startup run failed ({}), waiting for next scheduled run: {}", e.getKind(), e.getMessage());
        }
    }
}
