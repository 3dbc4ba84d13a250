package com.propertyintel.hydrant.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

/**
 * Analytics-ready hydrant row for insurance underwriting.
 *
 * Schema design notes:
 *  - record_hash is a fingerprint of (objectid, latitude, longitude) for downstream upserts
 *  - geo_cluster is a ~111m grid cell key (coordinates rounded to 3 decimals)
 *  - staticpressure is median-imputed; pressure_category, risk score and quality are
 *    derived from the value as delivered, before imputation
 *  - load_date is shared by every row of a run and is the partition key
 */
@Data
@Builder
public class HydrantFeature {

    /** Output column order: identifiers, geography, status/measurements, derived, lineage. */
    public static final List<String> COLUMNS = List.of(
            "objectid", "assetid", "record_hash",
            "latitude", "longitude", "geo_cluster", "neighborhood", "servicearea",
            "lifecyclestatus", "is_active", "staticpressure",
            "pressure_category", "pressure_risk_score", "service_quality",
            "load_date", "load_timestamp"
    );

    public static final int INACTIVE = 0;
    public static final int ACTIVE = 1;
    public static final int ABANDONED = 2;

    // ── Identifiers ─────────────────────────────────────────────────────────
    private Long objectid;
    private Double assetid;
    private String recordHash;

    // ── Geography ───────────────────────────────────────────────────────────
    private Double latitude;
    private Double longitude;
    private String geoCluster;
    private String neighborhood;
    private String servicearea;

    // ── Status / measurements ───────────────────────────────────────────────
    private String lifecyclestatus;

    /** 0 = inactive, 1 = active, 2 = abandoned */
    private int isActive;

    /** psi; null only when the whole batch had no pressure readings */
    private Double staticpressure;

    // ── Derived features ────────────────────────────────────────────────────
    /** Null when the delivered pressure was missing */
    private PressureCategory pressureCategory;

    /** 0 (best) to 100 (worst), relative to the batch maximum pressure */
    private double pressureRiskScore;

    private ServiceQuality serviceQuality;

    // ── Lineage ─────────────────────────────────────────────────────────────
    private LocalDate loadDate;

    /** UTC */
    private LocalDateTime loadTimestamp;

    /** Values in {@link #COLUMNS} order, nulls preserved. */
    public List<Object> values() {
        return Arrays.asList(
                objectid, assetid, recordHash,
                latitude, longitude, geoCluster, neighborhood, servicearea,
                lifecyclestatus, isActive, staticpressure,
                pressureCategory != null ? pressureCategory.name() : null,
                pressureRiskScore,
                serviceQuality != null ? serviceQuality.name() : null,
                loadDate, loadTimestamp
        );
    }
}
