package com.propertyintel.hydrant.output;

import com.propertyintel.hydrant.config.HydrantPipelineProperties;
import com.propertyintel.hydrant.config.HydrantPipelineProperties.Output.OutputFormat;
import com.propertyintel.hydrant.exception.StorageWriteException;
import com.propertyintel.hydrant.model.HydrantFeature;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.util.List;

/**
 * Persists a transformed batch as one dataset file in a Hive-style date partition.
 *
 * Output path pattern: {baseDir}/load_date={YYYY-MM-DD}/firehydrants.{parquet|csv}
 * e.g. data/processed/load_date=2024-06-20/firehydrants.parquet
 *
 * Re-running a day overwrites that day's file. The file is written to a hidden
 * sibling first and moved over the final name, so readers never see a partial
 * file (no guarantee across crashes).
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PartitionedWriter {

    static final String DATASET_NAME = "firehydrants";
    static final String PARTITION_KEY = "load_date";

    private final ParquetFileWriter parquetFileWriter;
    private final CsvFileWriter csvFileWriter;
    private final HydrantPipelineProperties properties;

    /** Create the processed root if absent; no-op when it exists. */
    public void ensureBaseDirectory(Path baseDir) {
        ensureDirectory(baseDir);
    }

    /**
     * @param dataset non-empty rows sharing one load_date
     * @param baseDir processed root directory
     * @return path of the written dataset file
     */
    public Path write(List<HydrantFeature> dataset, Path baseDir) {
        if (dataset.isEmpty()) {
            throw new IllegalArgumentException("Refusing to write an empty dataset");
        }
        LocalDate loadDate = dataset.get(0).getLoadDate();
        if (loadDate == null || dataset.stream().anyMatch(r -> !loadDate.equals(r.getLoadDate()))) {
            throw new IllegalArgumentException("All rows of a batch must share one non-null load_date");
        }

        OutputFormat format = properties.getOutput().getFormat();
        Path partitionDir = partitionDirectory(baseDir, loadDate);
        ensureDirectory(partitionDir);

        Path target = partitionDir.resolve(fileName(format));
        Path staging = partitionDir.resolve("." + fileName(format) + ".inprogress");

        try {
            switch (format) {
                case PARQUET -> parquetFileWriter.write(dataset, staging);
                case CSV -> csvFileWriter.write(dataset, staging);
            }
            moveIntoPlace(staging, target);
            removeOtherFormats(partitionDir, format);
        } catch (IOException | DataAccessException e) {
            log.error("Failed to write partition file {}: {}", target, e.getMessage(), e);
            deleteStaging(staging);
            throw new StorageWriteException("Partition write failed for " + target + ": " + e.getMessage(), e);
        }

        log.info("Written {} records to partition: {}", dataset.size(), target);
        return target;
    }

    public static Path partitionDirectory(Path baseDir, LocalDate loadDate) {
        return baseDir.resolve(PARTITION_KEY + "=" + loadDate);
    }

    public static String fileName(OutputFormat format) {
        return DATASET_NAME + "." + format.name().toLowerCase();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void moveIntoPlace(Path staging, Path target) throws IOException {
        try {
            Files.move(staging, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(staging, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /** A partition holds one dataset file, even when the configured format changed since the last run. */
    private void removeOtherFormats(Path partitionDir, OutputFormat written) throws IOException {
        for (OutputFormat other : OutputFormat.values()) {
            if (other != written && Files.deleteIfExists(partitionDir.resolve(fileName(other)))) {
                log.info("Removed stale {} dataset from {}", other, partitionDir);
            }
        }
    }

    private void deleteStaging(Path staging) {
        try {
            Files.deleteIfExists(staging);
        } catch (IOException e) {
            log.warn("Could not remove staging file {}: {}", staging, e.getMessage());
        }
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StorageWriteException("Cannot create output directory: " + dir, e);
        }
    }
}
