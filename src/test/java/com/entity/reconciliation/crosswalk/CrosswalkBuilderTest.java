package com.entity.reconciliation.crosswalk;

import com.entity.reconciliation.config.PipelineConfig;
import com.entity.reconciliation.core.model.CrosswalkEntry;
import com.entity.reconciliation.core.model.EntityType;
import com.entity.reconciliation.core.model.MatchMethod;
import com.entity.reconciliation.core.model.SourceRecord;
import com.entity.reconciliation.core.model.SourceSide;
import com.entity.reconciliation.error.InvalidInputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CrosswalkBuilder Tests")
class CrosswalkBuilderTest {

    private static final String BATCH = "BATCH_20240105_001";
    private static final Instant NOW = Instant.parse("2024-01-05T12:00:00Z");

    private final CrosswalkBuilder builder = new CrosswalkBuilder(PipelineConfig.defaults());

    private static SourceRecord record(SourceSide side, String id, String key, Instant ingested) {
        return record(side, id, key, ingested, Map.of());
    }

    private static SourceRecord record(SourceSide side, String id, String key, Instant ingested,
                                       Map<String, Object> attributes) {
        return SourceRecord.builder()
                .entityType(EntityType.VETERAN)
                .side(side)
                .sourceRecordId(id)
                .naturalKey(key)
                .attributes(attributes)
                .batchId(BATCH)
                .ingestionTime(ingested)
                .build();
    }

    private CrosswalkResult build(List<SourceRecord> a, List<SourceRecord> b) {
        return builder.build(EntityType.VETERAN, BATCH, SourceSide.A, a, b, NOW);
    }

    @Nested
    @DisplayName("Matching")
    class MatchingTests {

        @Test
        @DisplayName("Key in both sources is an exact match with confidence 100")
        void bothSources() {
            CrosswalkResult result = build(
                    List.of(record(SourceSide.A, "OMS-1", "123", NOW)),
                    List.of(record(SourceSide.B, "VEMS-9", "123", NOW)));

            assertEquals(1, result.entries().size());
            CrosswalkEntry entry = result.entries().get(0);
            assertEquals("123", entry.masterId());
            assertEquals("OMS-1", entry.sourceARef());
            assertEquals("VEMS-9", entry.sourceBRef());
            assertEquals(MatchMethod.BOTH_EXACT, entry.matchMethod());
            assertEquals(100, entry.confidence());
            assertEquals(SourceSide.A, entry.primarySource());
        }

        @Test
        @DisplayName("Key in one source gets confidence 90")
        void singleSource() {
            CrosswalkResult result = build(
                    List.of(record(SourceSide.A, "OMS-1", "123", NOW)),
                    List.of(record(SourceSide.B, "VEMS-5", "456", NOW)));

            assertEquals(2, result.entries().size());
            assertEquals(MatchMethod.SOURCE_A_ONLY, result.entries().get(0).matchMethod());
            assertNull(result.entries().get(0).sourceBRef());
            assertEquals(MatchMethod.SOURCE_B_ONLY, result.entries().get(1).matchMethod());
            assertEquals(90, result.entries().get(1).confidence());
            assertEquals(Map.of(MatchMethod.SOURCE_A_ONLY, 1L, MatchMethod.SOURCE_B_ONLY, 1L),
                    result.countsByMethod());
        }

        @Test
        @DisplayName("Keys are trimmed before matching")
        void trimmedKeys() {
            CrosswalkResult result = build(
                    List.of(record(SourceSide.A, "OMS-1", " 123 ", NOW)),
                    List.of(record(SourceSide.B, "VEMS-9", "123", NOW)));

            assertEquals(1, result.entries().size());
            assertEquals("123", result.entries().get(0).masterId());
        }

        @Test
        @DisplayName("Entries are sorted by master id")
        void sortedOutput() {
            CrosswalkResult result = build(
                    List.of(record(SourceSide.A, "a3", "300", NOW), record(SourceSide.A, "a1", "100", NOW)),
                    List.of(record(SourceSide.B, "b2", "200", NOW)));

            assertEquals(List.of("100", "200", "300"),
                    result.entries().stream().map(CrosswalkEntry::masterId).toList());
        }

        @Test
        @DisplayName("Empty sources produce an empty crosswalk")
        void emptySources() {
            CrosswalkResult result = build(List.of(), List.of());
            assertTrue(result.entries().isEmpty());
            assertEquals(0, result.recordsRead());
        }
    }

    @Nested
    @DisplayName("Filtering")
    class FilteringTests {

        @Test
        @DisplayName("Records without a natural key become orphans")
        void orphans() {
            CrosswalkResult result = build(
                    List.of(record(SourceSide.A, "OMS-1", "123", NOW), record(SourceSide.A, "OMS-2", "  ", NOW)),
                    List.of(record(SourceSide.B, "VEMS-3", null, NOW)));

            assertEquals(1, result.entries().size());
            assertEquals(2, result.orphans().size());
            assertEquals(OrphanRecord.MISSING_NATURAL_KEY, result.orphans().get(0).reason());
            assertEquals(SourceSide.A, result.orphans().get(0).record().side());
            assertEquals(3, result.recordsRead());
        }

        @Test
        @DisplayName("Records older than the rolling window are ignored")
        void rollingWindow() {
            CrosswalkBuilder weekly = new CrosswalkBuilder(PipelineConfig.builder()
                    .rollingWindow(Duration.ofDays(7))
                    .build());

            CrosswalkResult result = weekly.build(EntityType.VETERAN, BATCH, SourceSide.A,
                    List.of(record(SourceSide.A, "OMS-1", "123", NOW.minus(Duration.ofDays(8))),
                            record(SourceSide.A, "OMS-2", "456", NOW.minus(Duration.ofDays(7)))),
                    List.of(),
                    NOW);

            assertEquals(1, result.outsideWindow());
            assertEquals(List.of("456"), result.entries().stream().map(CrosswalkEntry::masterId).toList());
        }

        @Test
        @DisplayName("Records of another type or side are rejected")
        void mismatchedRecord() {
            assertThrows(IllegalArgumentException.class, () -> build(
                    List.of(record(SourceSide.B, "VEMS-1", "123", NOW)),
                    List.of()));
        }

        @Test
        @DisplayName("An empty batch id is rejected")
        void emptyBatchId() {
            List<SourceRecord> a = List.of(record(SourceSide.A, "OMS-1", "K1", NOW));

            InvalidInputException ex = assertThrows(InvalidInputException.class, () ->
                    builder.build(EntityType.VETERAN, "", SourceSide.A, a, List.of(), NOW));
            assertEquals(EntityType.VETERAN, ex.getEntityType());
            assertThrows(InvalidInputException.class, () ->
                    builder.build(EntityType.VETERAN, "  ", SourceSide.A, a, List.of(), NOW));
            assertThrows(InvalidInputException.class, () ->
                    builder.build(EntityType.VETERAN, null, SourceSide.A, a, List.of(), NOW));
        }
    }

    @Nested
    @DisplayName("Duplicate keys")
    class DuplicateTests {

        @Test
        @DisplayName("The most recently ingested duplicate survives")
        void latestWins() {
            CrosswalkResult result = build(
                    List.of(record(SourceSide.A, "OMS-1", "123", NOW.minusSeconds(60)),
                            record(SourceSide.A, "OMS-2", "123", NOW)),
                    List.of());

            assertEquals("OMS-2", result.entries().get(0).sourceARef());
        }

        @Test
        @DisplayName("Ties are broken the same way whatever the input order")
        void deterministicTieBreak() {
            List<SourceRecord> duplicates = new ArrayList<>(List.of(
                    record(SourceSide.A, "OMS-1", "123", NOW, Map.of("vet_first", "JOHN")),
                    record(SourceSide.A, "OMS-2", "123", NOW, Map.of("vet_first", "JON")),
                    record(SourceSide.A, "OMS-2", "123", NOW, Map.of("vet_first", "JOHNNY"))));

            SourceRecord expected = SourceRecordOrdering.latest(duplicates).orElseThrow();
            for (int i = 0; i < 3; i++) {
                Collections.rotate(duplicates, 1);
                CrosswalkResult result = build(duplicates, List.of());
                assertEquals("OMS-2", result.entries().get(0).sourceARef());
                assertSame(expected, SourceRecordOrdering.latest(duplicates).orElseThrow());
            }
        }
    }
}
