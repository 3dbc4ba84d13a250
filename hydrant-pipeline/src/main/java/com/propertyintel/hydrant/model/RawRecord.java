package com.propertyintel.hydrant.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One hydrant object exactly as delivered by the open-data API.
 *
 * Deliberately untyped: keys may be missing and every value is the source text
 * (a JSON null is kept as a present key with a null value).
 */
public record RawRecord(Map<String, String> fields) {

    public RawRecord {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    public String get(String field) {
        return fields.get(field);
    }
}
