package com.propertyintel.hydrant.service;

import com.propertyintel.hydrant.model.RawRecord;
import com.propertyintel.hydrant.model.ValidationOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks raw hydrant records for schema completeness.
 *
 * Presence only: a record passes when every required field is a key, whatever
 * its value (empty, null or malformed values are the transformer's concern).
 * Incomplete records are counted and dropped.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SchemaValidator {

    public static final List<String> REQUIRED_FIELDS = List.of(
            "objectid",
            "assetid",
            "lifecyclestatus",
            "servicearea",
            "staticpressure",
            "latitude",
            "longitude",
            "neighborhood"
    );

    private final RawPayloadParser payloadParser;

    public boolean isComplete(RawRecord record) {
        for (String field : REQUIRED_FIELDS) {
            if (!record.has(field)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Stable filter: valid records keep their input order.
     */
    public ValidationOutcome validateBatch(List<RawRecord> records) {
        List<RawRecord> valid = new ArrayList<>(records.size());
        int invalid = 0;

        for (RawRecord record : records) {
            if (isComplete(record)) {
                valid.add(record);
            } else {
                invalid++;
            }
        }

        ValidationOutcome outcome = new ValidationOutcome(valid, invalid);
        log.info("Validated {} records: {} valid, {} missing required fields (validation rate {})",
                outcome.totalCount(), valid.size(), invalid,
                String.format("%.1f%%", outcome.validationRate() * 100));
        return outcome;
    }

    /**
     * Parse a raw payload file and validate every record in it.
     *
     * @throws com.propertyintel.hydrant.exception.PayloadParseException if the file is not a JSON array of objects
     */
    public ValidationOutcome validateFile(Path payload) {
        return validateBatch(payloadParser.parse(payload));
    }
}
