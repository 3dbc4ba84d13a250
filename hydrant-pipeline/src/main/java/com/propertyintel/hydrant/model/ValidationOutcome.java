package com.propertyintel.hydrant.model;

import java.util.List;

/**
 * Result of schema validation: the complete records in input order plus a count
 * of the records dropped for missing fields.
 */
public record ValidationOutcome(List<RawRecord> validRecords, int invalidCount) {

    public ValidationOutcome {
        validRecords = List.copyOf(validRecords);
    }

    public int totalCount() {
        return validRecords.size() + invalidCount;
    }

    /** Share of valid records, 0.0 for an empty batch. */
    public double validationRate() {
        int total = totalCount();
        return total == 0 ? 0.0 : (double) validRecords.size() / total;
    }
}
