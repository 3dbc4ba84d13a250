package com.propertyintel.hydrant.output;

import com.propertyintel.hydrant.model.HydrantFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes hydrant features to a single Parquet file using an in-memory DuckDB.
 *
 * Rows are loaded into a typed staging table, then exported with
 * COPY ... TO (FORMAT PARQUET). A fresh in-memory database is used per file
 * and discarded afterwards.
 */
@Component
@Slf4j
public class ParquetFileWriter {

    private static final int BATCH_SIZE = 1000;
    private static final String TABLE = "firehydrants";

    private static final DateTimeFormatter TIMESTAMP_LITERAL =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS");

    public void write(List<HydrantFeature> records, Path file) {
        SingleConnectionDataSource dataSource = new SingleConnectionDataSource("jdbc:duckdb:", true);
        dataSource.setDriverClassName("org.duckdb.DuckDBDriver");
        try {
            JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
            createTable(jdbcTemplate);

            int total = records.size();
            for (int i = 0; i < total; i += BATCH_SIZE) {
                List<HydrantFeature> batch = records.subList(i, Math.min(i + BATCH_SIZE, total));
                writeBatchAsValues(jdbcTemplate, batch);
                log.debug("Staged batch {}/{}", Math.min(i + BATCH_SIZE, total), total);
            }

            jdbcTemplate.execute(String.format(
                    "COPY %s TO %s (FORMAT PARQUET, COMPRESSION SNAPPY)", TABLE, sqlStr(file.toString())));
            log.debug("Exported {} rows to Parquet file {}", total, file);
        } finally {
            dataSource.destroy();
        }
    }

    private void createTable(JdbcTemplate jdbcTemplate) {
        jdbcTemplate.execute("""
            CREATE TABLE firehydrants
            (
                objectid             BIGINT,
                assetid              DOUBLE,
                record_hash          VARCHAR,
                latitude             DOUBLE,
                longitude            DOUBLE,
                geo_cluster          VARCHAR,
                neighborhood         VARCHAR,
                servicearea          VARCHAR,
                lifecyclestatus      VARCHAR,
                is_active            INTEGER,
                staticpressure       DOUBLE,
                pressure_category    VARCHAR,
                pressure_risk_score  DOUBLE,
                service_quality      VARCHAR,
                load_date            DATE,
                load_timestamp       TIMESTAMP
            )
        """);
    }

    /**
     * Single INSERT ... VALUES per batch, column order matching HydrantFeature.COLUMNS.
     */
    private void writeBatchAsValues(JdbcTemplate jdbcTemplate, List<HydrantFeature> batch) {
        String rows = batch.stream()
                .map(this::toValueRow)
                .collect(Collectors.joining(",\n"));

        jdbcTemplate.execute("INSERT INTO " + TABLE + " VALUES\n" + rows);
    }

    private String toValueRow(HydrantFeature r) {
        return r.values().stream()
                .map(this::sqlLiteral)
                .collect(Collectors.joining(",", "(", ")"));
    }

    private String sqlLiteral(Object val) {
        if (val == null) return "NULL";
        if (val instanceof Number) return val.toString();
        if (val instanceof LocalDate date) return "DATE " + sqlStr(date.toString());
        if (val instanceof LocalDateTime ts) return "TIMESTAMP " + sqlStr(TIMESTAMP_LITERAL.format(ts));
        return sqlStr(val.toString());
    }

    private String sqlStr(String val) {
        return "'" + val.replace("'", "''") + "'";
    }
}
