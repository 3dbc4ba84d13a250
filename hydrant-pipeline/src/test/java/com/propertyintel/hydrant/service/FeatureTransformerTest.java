package com.propertyintel.hydrant.service;

import com.propertyintel.hydrant.model.HydrantFeature;
import com.propertyintel.hydrant.model.PressureCategory;
import com.propertyintel.hydrant.model.RawRecord;
import com.propertyintel.hydrant.model.ServiceQuality;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FeatureTransformerTest {

    private static final Instant NOW = Instant.parse("2024-06-20T23:30:15Z");

    private final FeatureTransformer transformer = new FeatureTransformer(Clock.fixed(NOW, ZoneOffset.UTC));

    private static RawRecord hydrant(String objectId, String status, String pressure, String lat, String lon) {
        Map<String, String> fields = new HashMap<>();
        fields.put("objectid", objectId);
        fields.put("assetid", "5000" + objectId);
        fields.put("lifecyclestatus", status);
        fields.put("servicearea", "  west SIDE ");
        fields.put("staticpressure", pressure);
        fields.put("latitude", lat);
        fields.put("longitude", lon);
        fields.put("neighborhood", "east PRICE hill");
        return new RawRecord(fields);
    }

    private static RawRecord withPressure(String objectId, String pressure) {
        return hydrant(objectId, "AC", pressure, "39.1", "-84.5");
    }

    private HydrantFeature single(RawRecord record) {
        return transformer.transform(List.of(record)).get(0);
    }

    @Test
    void emptyInputReturnsEmptyDatasetWithoutError() {
        assertTrue(transformer.transform(List.of()).isEmpty());
    }

    @Test
    void coercesNumericFieldsOrNulls() {
        HydrantFeature f = single(hydrant("12", "AC", "55.5", "39.1234", "-84.5678"));
        assertEquals(12L, f.getObjectid());
        assertEquals(500012.0, f.getAssetid());
        assertEquals(55.5, f.getStaticpressure());
        assertEquals(39.1234, f.getLatitude());
        assertEquals(-84.5678, f.getLongitude());

        HydrantFeature bad = single(hydrant("abc", "AC", "55", "north", ""));
        assertNull(bad.getObjectid());
        assertNull(bad.getLatitude());
        assertNull(bad.getLongitude());
    }

    @Test
    void objectIdAcceptsIntegralDecimalsOnly() {
        assertEquals(12L, FeatureTransformer.parseLong("12.0"));
        assertEquals(7L, FeatureTransformer.parseLong(" 7 "));
        assertNull(FeatureTransformer.parseLong("12.5"));
        assertNull(FeatureTransformer.parseLong(null));
        assertNull(FeatureTransformer.parseDouble("NaN"));
        assertNull(FeatureTransformer.parseDouble("Infinity"));
        assertNull(FeatureTransformer.parseDouble("12f"));
        assertEquals(1500.0, FeatureTransformer.parseDouble("1.5e3"));
    }

    @Test
    void normalisesTextFields() {
        HydrantFeature f = single(hydrant("1", "  active ", "50", "39.1", "-84.5"));
        assertEquals("ACTIVE", f.getLifecyclestatus());
        assertEquals("West Side", f.getServicearea());
        assertEquals("East Price Hill", f.getNeighborhood());
        assertEquals("O'Bryonville", FeatureTransformer.titleCase("o'bryonville"));
        assertEquals("Mt. Airy", FeatureTransformer.titleCase(" MT. AIRY"));
        assertNull(FeatureTransformer.titleCase(null));
    }

    @Test
    void stampsUtcLineageOncePerBatch() {
        List<HydrantFeature> rows = transformer.transform(List.of(withPressure("1", "30"), withPressure("2", "50")));
        for (HydrantFeature row : rows) {
            assertEquals(LocalDate.of(2024, 6, 20), row.getLoadDate());
            assertEquals(LocalDateTime.of(2024, 6, 20, 23, 30, 15), row.getLoadTimestamp());
        }
    }

    @Test
    void pressureCategoryBoundariesAreRightClosed() {
        assertEquals(PressureCategory.INSUFFICIENT, PressureCategory.of(20.0));
        assertEquals(PressureCategory.MARGINAL, PressureCategory.of(20.01));
        assertEquals(PressureCategory.MARGINAL, PressureCategory.of(40.0));
        assertEquals(PressureCategory.ADEQUATE, PressureCategory.of(40.01));
        assertEquals(PressureCategory.ADEQUATE, PressureCategory.of(60.0));
        assertEquals(PressureCategory.EXCELLENT, PressureCategory.of(60.01));
        assertEquals(PressureCategory.INSUFFICIENT, PressureCategory.of(-5.0));
        assertNull(PressureCategory.of(null));
    }

    @Test
    void activityFlagFromNormalisedStatus() {
        assertEquals(2, single(hydrant("1", "ab", "50", "39.1", "-84.5")).getIsActive());
        assertEquals(2, single(hydrant("1", "Abandoned", "50", "39.1", "-84.5")).getIsActive());
        assertEquals(1, single(hydrant("1", "Active", "50", "39.1", "-84.5")).getIsActive());
        assertEquals(1, single(hydrant("1", "AC", "50", "39.1", "-84.5")).getIsActive());
        assertEquals(0, single(hydrant("1", "Retired", "50", "39.1", "-84.5")).getIsActive());
        assertEquals(0, single(hydrant("1", null, "50", "39.1", "-84.5")).getIsActive());
    }

    @Test
    void riskScoreIsRelativeToBatchMaximum() {
        List<HydrantFeature> rows = transformer.transform(List.of(
                withPressure("1", "60"),
                withPressure("2", "30"),
                withPressure("3", "20")));

        assertEquals(0.0, rows.get(0).getPressureRiskScore());
        assertEquals(50.0, rows.get(1).getPressureRiskScore());
        assertEquals(66.67, rows.get(2).getPressureRiskScore());
    }

    @Test
    void missingPressureScoresMaximumRisk() {
        assertEquals(100.0, FeatureTransformer.riskScore(null, 60.0));
        assertEquals(100.0, FeatureTransformer.riskScore(0.0, 0.0));
        assertEquals(100.0, FeatureTransformer.riskScore(10.0, null));
    }

    @Test
    void serviceQualityTiers() {
        assertEquals(ServiceQuality.HIGH, FeatureTransformer.serviceQuality(1, 45.0));
        assertEquals(ServiceQuality.MEDIUM, FeatureTransformer.serviceQuality(1, 25.0));
        assertEquals(ServiceQuality.MEDIUM, FeatureTransformer.serviceQuality(1, 20.0));
        assertEquals(ServiceQuality.MEDIUM, FeatureTransformer.serviceQuality(1, 40.0));
        assertEquals(ServiceQuality.LOW, FeatureTransformer.serviceQuality(1, 10.0));
        assertEquals(ServiceQuality.UNKNOWN, FeatureTransformer.serviceQuality(1, null));
        assertEquals(ServiceQuality.INACTIVE, FeatureTransformer.serviceQuality(0, 45.0));
        assertEquals(ServiceQuality.UNKNOWN, FeatureTransformer.serviceQuality(2, 45.0));
    }

    @Test
    void geoClusterRoundsToThreeDecimals() {
        assertEquals("39.123_-84.568", FeatureTransformer.geoCluster(39.1234, -84.5678));
        assertEquals("39.1_-84.5", FeatureTransformer.geoCluster(39.1, -84.5));
        assertEquals("nan_nan", FeatureTransformer.geoCluster(null, null));
        assertEquals("39.123_nan", FeatureTransformer.geoCluster(39.1234, null));
    }

    @Test
    void recordHashIsDeterministicAndSensitiveToEachKeyField() {
        String base = FeatureTransformer.recordHash(1L, 39.1, -84.5);

        assertEquals(base, FeatureTransformer.recordHash(1L, 39.1, -84.5));
        assertEquals(16, base.length());
        assertNotEquals(base, FeatureTransformer.recordHash(2L, 39.1, -84.5));
        assertNotEquals(base, FeatureTransformer.recordHash(1L, 39.2, -84.5));
        assertNotEquals(base, FeatureTransformer.recordHash(1L, 39.1, -84.6));
        assertNotEquals(base, FeatureTransformer.recordHash(null, 39.1, -84.5));
    }

    @Test
    void hashIgnoresNonKeyFields() {
        List<HydrantFeature> rows = transformer.transform(List.of(
                hydrant("7", "AC", "30", "39.1", "-84.5"),
                hydrant("7", "Retired", "90", "39.1", "-84.5")));
        assertEquals(rows.get(0).getRecordHash(), rows.get(1).getRecordHash());
    }

    @Test
    void nullPressureIsImputedWithMedianAfterDerivedFeatures() {
        List<HydrantFeature> rows = transformer.transform(List.of(
                withPressure("1", "10"),
                withPressure("2", "30"),
                withPressure("3", null),
                withPressure("4", "70"),
                withPressure("5", "abc"),
                withPressure("6", "50")));

        HydrantFeature imputed = rows.get(2);
        assertEquals(40.0, imputed.getStaticpressure());
        assertNull(imputed.getPressureCategory());
        assertEquals(100.0, imputed.getPressureRiskScore());
        assertEquals(ServiceQuality.UNKNOWN, imputed.getServiceQuality());
        assertEquals(40.0, rows.get(4).getStaticpressure());

        assertEquals(10.0, rows.get(0).getStaticpressure());
        assertEquals(PressureCategory.EXCELLENT, rows.get(3).getPressureCategory());
    }

    @Test
    void pressureStaysNullWhenNoRowHasOne() {
        List<HydrantFeature> rows = transformer.transform(List.of(withPressure("1", null), withPressure("2", "")));
        assertNull(rows.get(0).getStaticpressure());
        assertEquals(100.0, rows.get(1).getPressureRiskScore());
    }

    @Test
    void categoryDistributionLeavesOutMissingCategories() {
        List<HydrantFeature> rows = transformer.transform(List.of(
                withPressure("1", "10"),
                withPressure("2", null),
                withPressure("3", "70"),
                withPressure("4", "80")));

        Map<PressureCategory, Long> distribution = FeatureTransformer.categoryDistribution(rows);

        assertEquals(Map.of(PressureCategory.INSUFFICIENT, 1L, PressureCategory.EXCELLENT, 2L), distribution);
        assertFalse(distribution.containsKey(null));
    }

    @Test
    void everyRowCarriesAllColumnsInOrder() {
        HydrantFeature f = single(hydrant("3", "AC", "45", "39.1234", "-84.5678"));
        List<Object> values = f.values();

        assertEquals(HydrantFeature.COLUMNS.size(), values.size());
        assertEquals(16, values.size());
        assertEquals(3L, values.get(HydrantFeature.COLUMNS.indexOf("objectid")));
        assertEquals("39.123_-84.568", values.get(HydrantFeature.COLUMNS.indexOf("geo_cluster")));
        assertEquals("ADEQUATE", values.get(HydrantFeature.COLUMNS.indexOf("pressure_category")));
        assertEquals("HIGH", values.get(HydrantFeature.COLUMNS.indexOf("service_quality")));
        assertEquals(LocalDate.of(2024, 6, 20), values.get(HydrantFeature.COLUMNS.indexOf("load_date")));
    }

    @Test
    void preservesInputOrder() {
        List<RawRecord> input = new ArrayList<>();
        for (int i = 1; i <= 20; i++) {
            input.add(withPressure(String.valueOf(i), String.valueOf(i * 3)));
        }
        List<HydrantFeature> rows = transformer.transform(input);
        for (int i = 0; i < rows.size(); i++) {
            assertEquals(i + 1L, rows.get(i).getObjectid());
        }
    }
}
