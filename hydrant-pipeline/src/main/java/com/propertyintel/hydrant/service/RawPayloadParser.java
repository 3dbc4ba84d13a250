package com.propertyintel.hydrant.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.propertyintel.hydrant.exception.PayloadParseException;
import com.propertyintel.hydrant.model.RawRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a raw payload file (a JSON array of objects) into untyped RawRecords.
 *
 * Values are kept as text: strings as-is, other scalars via their JSON text,
 * nested structures as serialized JSON, JSON null as a null value.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RawPayloadParser {

    private final ObjectMapper objectMapper;

    public List<RawRecord> parse(Path payload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload.toFile());
        } catch (IOException e) {
            throw new PayloadParseException("Could not parse raw payload " + payload + ": " + e.getMessage(), e);
        }

        if (root == null || !root.isArray()) {
            throw new PayloadParseException("Raw payload " + payload + " is not a JSON array");
        }

        List<RawRecord> records = new ArrayList<>(root.size());
        for (int i = 0; i < root.size(); i++) {
            JsonNode element = root.get(i);
            if (!element.isObject()) {
                throw new PayloadParseException(
                        "Raw payload element " + i + " is " + element.getNodeType() + ", expected an object");
            }
            records.add(toRawRecord(element));
        }

        log.debug("Parsed {} raw records from {}", records.size(), payload);
        return records;
    }

    private RawRecord toRawRecord(JsonNode object) {
        Map<String, String> fields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = object.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> field = it.next();
            fields.put(field.getKey(), asText(field.getValue()));
        }
        return new RawRecord(fields);
    }

    private String asText(JsonNode value) {
        if (value == null || value.isNull()) return null;
        return value.isValueNode() ? value.asText() : value.toString();
    }
}
