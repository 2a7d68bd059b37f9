package com.entity.reconciliation.source;

import com.entity.reconciliation.core.model.EntityType;
import com.entity.reconciliation.core.model.SourceRecord;
import com.entity.reconciliation.core.model.SourceSide;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.StringReader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class JsonLinesSourceReaderTest {

    private static final Instant DEFAULT_TIME = Instant.parse("2024-01-05T00:00:00Z");

    private final JsonLinesSourceReader reader = new JsonLinesSourceReader();

    @Test
    @DisplayName("Should read JSON Lines records with typed attributes")
    void testReadRecords() {
        String jsonl = """
                {"sourceRecordId": "OMS-1", "naturalKey": "123", "ingestionTime": "2024-01-05T10:00:00Z", "attributes": {"vet_first": "john", "disability_pct": 50, "score": 1.25, "sc_flag": true, "vet_middle": null}}
                {"sourceRecordId": "OMS-2", "naturalKey": "456", "attributes": {"vet_first": "jane"}}
                """;

        ReadResult result = reader.read(new StringReader(jsonl), EntityType.VETERAN, SourceSide.A,
                "BATCH_001", DEFAULT_TIME);

        assertFalse(result.hasErrors());
        assertEquals(2, result.records().size());

        SourceRecord first = result.records().get(0);
        assertEquals("OMS-1", first.sourceRecordId());
        assertEquals("123", first.naturalKey());
        assertEquals(Instant.parse("2024-01-05T10:00:00Z"), first.ingestionTime());
        assertEquals("BATCH_001", first.batchId());
        assertEquals(50L, first.attribute("disability_pct"));
        assertEquals(new BigDecimal("1.25"), first.attribute("score"));
        assertEquals(Boolean.TRUE, first.attribute("sc_flag"));
        assertTrue(first.attributes().containsKey("vet_middle"));
        assertNull(first.attribute("vet_middle"));

        assertEquals(DEFAULT_TIME, result.records().get(1).ingestionTime());
    }

    @Test
    @DisplayName("Should take the natural key from the configured attribute")
    void testKeyAttribute() {
        JsonLinesSourceReader keyed = new JsonLinesSourceReader(new ObjectMapper(), "npi_number");
        String jsonl = "{\"sourceRecordId\": \"VEMS-7\", \"attributes\": {\"npi_number\": 1234567890}}\n";

        ReadResult result = keyed.read(new StringReader(jsonl), EntityType.EVALUATOR, SourceSide.B,
                "BATCH_001", DEFAULT_TIME);

        assertEquals("1234567890", result.records().get(0).naturalKey());
    }

    @Test
    @DisplayName("Should report malformed lines and keep reading")
    void testMalformedLines() {
        String jsonl = """
                {"naturalKey": "1", "attributes": {}}
                this is not json
                ["an", "array"]
                {"naturalKey": "2", "ingestionTime": "yesterday"}

                {"naturalKey": "3"}
                """;

        ReadResult result = reader.read(new StringReader(jsonl), EntityType.FACILITY, SourceSide.A,
                "BATCH_001", DEFAULT_TIME);

        assertEquals(2, result.records().size());
        assertEquals(3, result.errors().size());
        assertEquals(2, result.errors().get(0).lineNumber());
        assertEquals(3, result.errors().get(1).lineNumber());
        assertEquals(4, result.errors().get(2).lineNumber());
    }

    @Test
    @DisplayName("Lines without an ingestion time fail when no default is given")
    void testMissingIngestionTime() {
        ReadResult result = reader.read(new StringReader("{\"naturalKey\": \"1\"}"), EntityType.FACILITY,
                SourceSide.A, "BATCH_001", null);

        assertTrue(result.records().isEmpty());
        assertEquals(1, result.errors().size());
    }

    @Test
    @DisplayName("Should read from an input stream")
    void testInputStream() {
        byte[] bytes = "{\"naturalKey\": \"é-1\"}".getBytes(StandardCharsets.UTF_8);

        ReadResult result = reader.read(new ByteArrayInputStream(bytes), EntityType.FACILITY, SourceSide.B,
                "BATCH_001", DEFAULT_TIME);

        assertEquals("é-1", result.records().get(0).naturalKey());
    }
}
