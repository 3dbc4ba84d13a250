package com.propertyintel.hydrant.service;

import com.propertyintel.hydrant.config.HydrantPipelineProperties;
import com.propertyintel.hydrant.exception.UpstreamFetchException;
import com.propertyintel.hydrant.exception.UpstreamUnavailableException;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Downloads the daily hydrant snapshot from the Cincinnati Open Data API and
 * lands it unchanged in the raw zone.
 *
 * Output path pattern: {rawDir}/firehydrants_{yyyyMMdd'T'HHmmss'Z'}.json
 *
 * A 5xx, 429, timeout or connection error raises UpstreamUnavailableException,
 * which the Resilience4j "hydrantApi" retry repeats. Other 4xx responses, an empty
 * body or a failure saving the payload fail straight away. Either way the
 * UpstreamFetchException reaches the orchestrator and fails the run.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OpenDataFetcher {

    private static final DateTimeFormatter FILE_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);

    private static final int TOO_MANY_REQUESTS = 429;

    private final RestTemplate restTemplate;
    private final HydrantPipelineProperties properties;
    private final Clock clock;

    /**
     * Fetch the full hydrant dataset and save it to the raw directory.
     *
     * @return path of the saved JSON payload
     */
    @Retry(name = "hydrantApi")
    public Path fetch() {
        String url = properties.getApi().getUrl();
        log.info("Starting data ingestion from: {}", url);

        String body = callApi(url);

        Path rawDir = Paths.get(properties.getStorage().getRawDir());
        Path target = rawDir.resolve("firehydrants_" + FILE_TIMESTAMP.format(clock.instant()) + ".json");
        try {
            Files.createDirectories(rawDir);
            Files.writeString(target, body, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to write raw payload to {}: {}", target, e.getMessage());
            throw new UpstreamFetchException("Could not save raw payload to " + target, e);
        }

        log.info("Data saved to {}", target);
        return target;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private String callApi(String url) {
        ResponseEntity<String> response;
        try {
            response = restTemplate.getForEntity(url, String.class);

        } catch (HttpStatusCodeException e) {
            log.error("API returned HTTP error: {}", e.getStatusCode());
            String message = "Open data API returned HTTP " + e.getStatusCode().value();
            if (e.getStatusCode().is5xxServerError() || e.getStatusCode().value() == TOO_MANY_REQUESTS) {
                throw new UpstreamUnavailableException(message, e); // let Resilience4j retry
            }
            throw new UpstreamFetchException(message, e);

        } catch (ResourceAccessException e) {
            // connect/read timeouts and socket errors
            log.error("API request failed or timed out after {}: {}",
                    properties.getApi().getTimeout(), e.getMessage());
            throw new UpstreamUnavailableException("Open data API unreachable: " + e.getMessage(), e);

        } catch (RestClientException e) {
            log.error("Unexpected error calling open data API: {}", e.getMessage());
            throw new UpstreamFetchException("Open data API call failed: " + e.getMessage(), e);
        }

        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new UpstreamFetchException("Open data API returned HTTP " + response.getStatusCode().value());
        }
        String body = response.getBody();
        if (body == null || body.isBlank()) {
            throw new UpstreamFetchException("Open data API returned an empty body");
        }
        return body;
    }
}
