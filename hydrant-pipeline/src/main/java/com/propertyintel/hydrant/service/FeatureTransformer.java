package com.propertyintel.hydrant.service;

import com.propertyintel.hydrant.model.HydrantFeature;
import com.propertyintel.hydrant.model.PressureCategory;
import com.propertyintel.hydrant.model.RawRecord;
import com.propertyintel.hydrant.model.ServiceQuality;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns validated raw hydrant records into analytics-ready HydrantFeature rows.
 *
 * The whole batch is processed as a unit in two passes: the first coerces
 * pressures and computes the batch maximum and median, the second emits one
 * row per record. Derived features use the pressure as delivered; null
 * pressures are median-imputed only after they have been computed.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FeatureTransformer {

    private static final Set<String> ABANDONED_STATUSES = Set.of("AB", "ABANDONED");
    private static final Set<String> ACTIVE_STATUSES = Set.of("ACTIVE", "AC");

    private static final Pattern NUMERIC = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private static final int HASH_HEX_LENGTH = 16;

    private final Clock clock;

    public List<HydrantFeature> transform(List<RawRecord> validRecords) {
        if (validRecords.isEmpty()) {
            log.error("No valid records provided, returning an empty dataset");
            return List.of();
        }
        log.info("Starting transformation of {} records", validRecords.size());

        // ── Pass 1: batch aggregates ────────────────────────────────────────
        List<Double> pressures = new ArrayList<>(validRecords.size());
        for (RawRecord record : validRecords) {
            pressures.add(parseDouble(record.get("staticpressure")));
        }
        Double maxPressure = max(pressures);
        Double medianPressure = median(pressures);

        LocalDateTime loadTimestamp = LocalDateTime.now(clock);
        LocalDate loadDate = loadTimestamp.toLocalDate();

        // ── Pass 2: per-row features ────────────────────────────────────────
        List<HydrantFeature> features = new ArrayList<>(validRecords.size());
        for (int i = 0; i < validRecords.size(); i++) {
            RawRecord record = validRecords.get(i);
            Double pressure = pressures.get(i);

            Long objectId = parseLong(record.get("objectid"));
            Double latitude = parseDouble(record.get("latitude"));
            Double longitude = parseDouble(record.get("longitude"));
            String status = normaliseStatus(record.get("lifecyclestatus"));
            int isActive = activityFlag(status);

            features.add(HydrantFeature.builder()
                    .objectid(objectId)
                    .assetid(parseDouble(record.get("assetid")))
                    .recordHash(recordHash(objectId, latitude, longitude))
                    .latitude(latitude)
                    .longitude(longitude)
                    .geoCluster(geoCluster(latitude, longitude))
                    .neighborhood(titleCase(record.get("neighborhood")))
                    .servicearea(titleCase(record.get("servicearea")))
                    .lifecyclestatus(status)
                    .isActive(isActive)
                    .staticpressure(pressure != null ? pressure : medianPressure)
                    .pressureCategory(PressureCategory.of(pressure))
                    .pressureRiskScore(riskScore(pressure, maxPressure))
                    .serviceQuality(serviceQuality(isActive, pressure))
                    .loadDate(loadDate)
                    .loadTimestamp(loadTimestamp)
                    .build());
        }

        logSummary(features);
        return features;
    }

    // ── Derived features ─────────────────────────────────────────────────────

    static int activityFlag(String normalisedStatus) {
        if (normalisedStatus == null) return HydrantFeature.INACTIVE;
        if (ABANDONED_STATUSES.contains(normalisedStatus)) return HydrantFeature.ABANDONED;
        if (ACTIVE_STATUSES.contains(normalisedStatus)) return HydrantFeature.ACTIVE;
        return HydrantFeature.INACTIVE;
    }

    /**
     * 100 - (pressure / batch max * 100), rounded to 2 places.
     * Missing pressure, or a batch with no usable maximum, scores the maximum risk of 100.
     */
    static double riskScore(Double pressure, Double maxPressure) {
        if (pressure == null || maxPressure == null || maxPressure == 0.0) {
            return 100.0;
        }
        return round(100 - (pressure / maxPressure * 100), 2);
    }

    /**
     * Only active hydrants are graded on pressure. The [20, 40] band is checked
     * after the >= 40 band, so exactly 40 psi grades MEDIUM.
     */
    static ServiceQuality serviceQuality(int isActive, Double pressure) {
        if (isActive == HydrantFeature.INACTIVE) return ServiceQuality.INACTIVE;
        if (isActive != HydrantFeature.ACTIVE || pressure == null) return ServiceQuality.UNKNOWN;

        ServiceQuality quality = ServiceQuality.UNKNOWN;
        if (pressure >= 40) quality = ServiceQuality.HIGH;
        if (pressure >= 20 && pressure <= 40) quality = ServiceQuality.MEDIUM;
        if (pressure < 20) quality = ServiceQuality.LOW;
        return quality;
    }

    /**
     * ~111m grid cell: "{lat}_{lon}" with both rounded to 3 decimals, "nan" for a missing coordinate.
     */
    static String geoCluster(Double latitude, Double longitude) {
        return clusterPart(latitude) + "_" + clusterPart(longitude);
    }

    private static String clusterPart(Double coordinate) {
        return coordinate == null ? "nan" : Double.toString(round(coordinate, 3));
    }

    /**
     * First 16 hex chars of SHA-256 over "objectid|latitude|longitude".
     * Stable for identical triples; nulls hash as the literal "null".
     */
    static String recordHash(Long objectId, Double latitude, Double longitude) {
        String key = objectId + "|" + latitude + "|" + longitude;
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(key.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, HASH_HEX_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    // ── Normalisation ────────────────────────────────────────────────────────

    static String normaliseStatus(String status) {
        return status == null ? null : status.trim().toUpperCase();
    }

    /**
     * Trim, then capitalise every letter that follows a non-letter and lowercase the rest.
     * e.g. "  EAST price HILL " → "East Price Hill", "o'bryonville" → "O'Bryonville"
     */
    static String titleCase(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        StringBuilder sb = new StringBuilder(trimmed.length());
        boolean previousIsLetter = false;
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (Character.isLetter(c)) {
                sb.append(previousIsLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
                previousIsLetter = true;
            } else {
                sb.append(c);
                previousIsLetter = false;
            }
        }
        return sb.toString();
    }

    // ── Coercion (unparsable → null, never throws) ──────────────────────────

    static Double parseDouble(String val) {
        if (val == null || val.isBlank()) return null;
        String trimmed = val.trim();
        if (!NUMERIC.matcher(trimmed).matches()) return null;
        try {
            double parsed = Double.parseDouble(trimmed);
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Accepts integral decimals such as "12.0"; any fractional value is null. */
    static Long parseLong(String val) {
        Double parsed = parseDouble(val);
        if (parsed == null) return null;
        try {
            return Long.parseLong(val.trim());
        } catch (NumberFormatException e) {
            if (parsed != Math.rint(parsed) || Math.abs(parsed) >= 0x1p63) return null;
            return parsed.longValue();
        }
    }

    // ── Batch statistics ─────────────────────────────────────────────────────

    private static Double max(List<Double> values) {
        return values.stream()
                .filter(v -> v != null)
                .max(Double::compare)
                .orElse(null);
    }

    private static Double median(List<Double> values) {
        double[] sorted = values.stream()
                .filter(v -> v != null)
                .mapToDouble(Double::doubleValue)
                .sorted()
                .toArray();
        if (sorted.length == 0) return null;
        int mid = sorted.length / 2;
        return sorted.length % 2 == 1
                ? sorted[mid]
                : (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    /** Half-even rounding on the scaled value, matching numpy's around(). */
    static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.rint(value * scale) / scale;
    }

    /** Counts per pressure category; rows without a category are left out. */
    static Map<PressureCategory, Long> categoryDistribution(List<HydrantFeature> features) {
        return features.stream()
                .map(HydrantFeature::getPressureCategory)
                .filter(Objects::nonNull)
                .collect(Collectors.groupingBy(c -> c,
                        () -> new EnumMap<PressureCategory, Long>(PressureCategory.class),
                        Collectors.counting()));
    }

    private void logSummary(List<HydrantFeature> features) {
        long active = features.stream().filter(f -> f.getIsActive() == HydrantFeature.ACTIVE).count();
        Map<String, Long> quality = features.stream()
                .collect(Collectors.groupingBy(f -> String.valueOf(f.getServiceQuality()), TreeMap::new,
                        Collectors.counting()));
        Map<PressureCategory, Long> categories = categoryDistribution(features);

        log.info("Transformation complete: {} rows x {} columns", features.size(), HydrantFeature.COLUMNS.size());
        log.info("Active hydrants: {} ({})", active, String.format("%.1f%%", active * 100.0 / features.size()));
        log.info("Service quality distribution: {}", quality);
        log.info("Pressure categories: {}", categories);
    }
}
