package com.propertyintel.hydrant.output;

import com.opencsv.CSVWriter;
import com.propertyintel.hydrant.config.HydrantPipelineProperties;
import com.propertyintel.hydrant.model.HydrantFeature;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes hydrant features to a single CSV file, columns in HydrantFeature.COLUMNS order.
 *
 * Nulls are written as empty fields. Loadable into most warehouses via e.g.
 *   read_csv_auto('.../load_date=2024-06-20/firehydrants.csv', header=true)
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvFileWriter {

    private static final String[] HEADERS = HydrantFeature.COLUMNS.toArray(new String[0]);

    private final HydrantPipelineProperties properties;

    public void write(List<HydrantFeature> records, Path file) throws IOException {
        try (CSVWriter writer = new CSVWriter(
                new FileWriter(file.toFile(), StandardCharsets.UTF_8),
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            if (properties.getOutput().getCsv().isIncludeHeader()) {
                writer.writeNext(HEADERS);
            }

            for (HydrantFeature r : records) {
                writer.writeNext(toRow(r));
            }
        }
        log.debug("Written {} records to CSV file {}", records.size(), file);
    }

    private String[] toRow(HydrantFeature r) {
        return r.values().stream()
                .map(this::str)
                .toArray(String[]::new);
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }
}
