package com.entity.reconciliation.source;

import com.entity.reconciliation.core.model.EntityType;
import com.entity.reconciliation.core.model.SourceRecord;
import com.entity.reconciliation.core.model.SourceSide;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a source extract in JSON Lines format, one record per line.
 *
 * <pre>
 * {"sourceRecordId": "OMS-1", "naturalKey": "123", "ingestionTime": "2024-01-05T10:00:00Z",
 *  "attributes": {"vet_first": "john", "disability_pct": 50}}
 * </pre>
 *
 * <p>{@code batchId} and {@code ingestionTime} fall back to the values passed to
 * {@link #read}. When {@code naturalKey} is absent the configured key attribute is used.
 * Malformed lines are reported in the {@link ReadResult} and skipped.</p>
 */
public class JsonLinesSourceReader {
    private static final Logger log = LoggerFactory.getLogger(JsonLinesSourceReader.class);

    private final ObjectMapper objectMapper;
    private final String keyAttribute;

    public JsonLinesSourceReader() {
        this(new ObjectMapper(), null);
    }

    /**
     * @param keyAttribute attribute holding the natural key when a line has no {@code naturalKey}
     */
    public JsonLinesSourceReader(ObjectMapper objectMapper, String keyAttribute) {
        this.objectMapper = objectMapper;
        this.keyAttribute = keyAttribute;
    }

    public ReadResult read(InputStream input, EntityType entityType, SourceSide side,
                           String batchId, Instant defaultIngestionTime) {
        return read(new InputStreamReader(input, StandardCharsets.UTF_8), entityType, side, batchId,
                defaultIngestionTime);
    }

    public ReadResult read(Reader reader, EntityType entityType, SourceSide side,
                           String batchId, Instant defaultIngestionTime) {
        List<SourceRecord> records = new ArrayList<>();
        List<ReadResult.ReadError> errors = new ArrayList<>();

        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            String line;
            long lineNumber = 0;
            while ((line = br.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    records.add(parseLine(line, entityType, side, batchId, defaultIngestionTime));
                } catch (JsonProcessingException | IllegalArgumentException | DateTimeParseException e) {
                    errors.add(new ReadResult.ReadError(lineNumber, e.getMessage()));
                    log.warn("source.read.error side={} line={} error={}", side, lineNumber, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.error("source.read.failed side={} error={}", side, e.getMessage());
            errors.add(new ReadResult.ReadError(0, "IO error: " + e.getMessage()));
        }

        ReadResult result = new ReadResult(records, errors);
        log.info("source.read.completed entityType={} side={} batchId={} result={}",
                entityType, side, batchId, result);
        return result;
    }

    private SourceRecord parseLine(String line, EntityType entityType, SourceSide side,
                                   String batchId, Instant defaultIngestionTime) throws JsonProcessingException {
        JsonNode node = objectMapper.readTree(line);
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Line is not a JSON object");
        }

        Map<String, Object> attributes = new LinkedHashMap<>();
        JsonNode attrs = node.path("attributes");
        if (attrs.isObject()) {
            attrs.fields().forEachRemaining(e -> attributes.put(e.getKey(), toValue(e.getValue())));
        }

        String naturalKey = text(node, "naturalKey");
        if (naturalKey == null && keyAttribute != null) {
            Object keyValue = attributes.get(keyAttribute);
            naturalKey = keyValue != null ? keyValue.toString() : null;
        }
        String ingestion = text(node, "ingestionTime");
        String lineBatch = text(node, "batchId");
        if (ingestion == null && defaultIngestionTime == null) {
            throw new IllegalArgumentException("ingestionTime is required");
        }
        if (lineBatch == null && batchId == null) {
            throw new IllegalArgumentException("batchId is required");
        }

        return SourceRecord.builder()
                .entityType(entityType)
                .side(side)
                .sourceRecordId(text(node, "sourceRecordId"))
                .naturalKey(naturalKey)
                .attributes(attributes)
                .batchId(lineBatch != null ? lineBatch : batchId)
                .ingestionTime(ingestion != null ? Instant.parse(ingestion) : defaultIngestionTime)
                .build();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static Object toValue(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual()) {
            return value.asText();
        }
        if (value.isIntegralNumber() && value.canConvertToLong()) {
            return value.asLong();
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        return value.toString();
    }
}
