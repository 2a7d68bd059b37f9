package com.entity.reconciliation.scd;

import com.entity.reconciliation.core.model.EntityType;
import com.entity.reconciliation.core.model.MergedRecord;
import com.entity.reconciliation.error.IntegrityViolationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ScdHistorizer Tests")
class ScdHistorizerTest {

    private static final Instant T1 = Instant.parse("2024-01-05T12:00:00Z");
    private static final Instant T2 = Instant.parse("2024-01-06T12:00:00Z");
    private static final Instant T3 = Instant.parse("2024-01-07T12:00:00Z");

    private InMemoryDimensionRepository repository;
    private ScdHistorizer historizer;

    @BeforeEach
    void setUp() {
        repository = new InMemoryDimensionRepository();
        historizer = new ScdHistorizer(repository, 4);
    }

    @AfterEach
    void tearDown() {
        historizer.close();
    }

    private static MergedRecord merged(String masterId, String fingerprint, String city) {
        return new MergedRecord(EntityType.FACILITY, "B1", masterId, "OMS_MERGED",
                Map.of("city", city), fingerprint, 100, List.of(), List.of(), List.of());
    }

    @Nested
    @DisplayName("Transitions")
    class TransitionTests {

        @Test
        @DisplayName("New master id opens version 1")
        void opensFirstVersion() {
            HistorizationResult result = historizer.historize(EntityType.FACILITY, "B1",
                    List.of(merged("F1", "fp1", "AUSTIN")), T1);

            assertEquals(1, result.opened());
            assertEquals(1, result.inserted());
            DimensionVersion current = repository.findCurrent(EntityType.FACILITY, "F1").orElseThrow();
            assertEquals(1, current.versionNumber());
            assertEquals(T1, current.effectiveStart());
            assertEquals(DimensionVersion.OPEN_END, current.effectiveEnd());
            assertTrue(current.current());
            assertEquals("AUSTIN", current.attributes().get("city"));
            assertEquals("B1", current.batchId());
        }

        @Test
        @DisplayName("Unchanged fingerprint leaves history untouched")
        void unchanged() {
            historizer.historize(EntityType.FACILITY, "B1", List.of(merged("F1", "fp1", "AUSTIN")), T1);
            HistorizationResult result = historizer.historize(EntityType.FACILITY, "B2",
                    List.of(merged("F1", "fp1", "AUSTIN")), T2);

            assertEquals(1, result.unchanged());
            assertEquals(0, result.inserted());
            assertEquals(1, repository.findHistory(EntityType.FACILITY, "F1").size());
        }

        @Test
        @DisplayName("Changed fingerprint closes the current version and opens the next")
        void versioned() {
            historizer.historize(EntityType.FACILITY, "B1", List.of(merged("F1", "fp1", "AUSTIN")), T1);
            HistorizationResult result = historizer.historize(EntityType.FACILITY, "B2",
                    List.of(merged("F1", "fp2", "DALLAS")), T2);

            assertEquals(1, result.versioned());
            assertEquals(1, result.closed());
            List<DimensionVersion> history = repository.findHistory(EntityType.FACILITY, "F1");
            assertEquals(2, history.size());

            DimensionVersion closed = history.get(0);
            DimensionVersion open = history.get(1);
            assertFalse(closed.current());
            assertEquals(T2, closed.effectiveEnd());
            assertEquals(closed.effectiveEnd(), open.effectiveStart());
            assertEquals(2, open.versionNumber());
            assertTrue(open.current());
            assertEquals("DALLAS", open.attributes().get("city"));
        }

        @Test
        @DisplayName("As-of lookups find the version in effect")
        void asOf() {
            historizer.historize(EntityType.FACILITY, "B1", List.of(merged("F1", "fp1", "AUSTIN")), T1);
            historizer.historize(EntityType.FACILITY, "B2", List.of(merged("F1", "fp2", "DALLAS")), T2);

            assertEquals(1, repository.findAsOf(EntityType.FACILITY, "F1", T1).orElseThrow().versionNumber());
            assertEquals(2, repository.findAsOf(EntityType.FACILITY, "F1", T2).orElseThrow().versionNumber());
            assertTrue(repository.findAsOf(EntityType.FACILITY, "F1", T1.minusSeconds(1)).isEmpty());
        }

        @Test
        @DisplayName("Processing time before the current start is clamped to keep history contiguous")
        void clampsOutOfOrderTime() {
            historizer.historize(EntityType.FACILITY, "B2", List.of(merged("F1", "fp1", "AUSTIN")), T2);
            historizer.historize(EntityType.FACILITY, "B1", List.of(merged("F1", "fp2", "DALLAS")), T1);

            List<DimensionVersion> history = repository.findHistory(EntityType.FACILITY, "F1");
            assertEquals(T2, history.get(0).effectiveEnd());
            assertEquals(T2, history.get(1).effectiveStart());
            assertEquals(1, history.stream().filter(DimensionVersion::current).count());
        }

        @Test
        @DisplayName("Reopening a closed history starts after its last end")
        void reopensAfterLastEnd() {
            DimensionVersion retired = DimensionVersion.open(EntityType.FACILITY, "F1", 1, Map.of(), "fp0", "B0", T1)
                    .closeAt(T3);
            repository.load(EntityType.FACILITY, "F1", List.of(retired));

            HistorizationResult result = historizer.historize(EntityType.FACILITY, "B2",
                    List.of(merged("F1", "fp1", "AUSTIN")), T2);

            assertEquals(1, result.opened());
            DimensionVersion current = repository.findCurrent(EntityType.FACILITY, "F1").orElseThrow();
            assertEquals(2, current.versionNumber());
            assertEquals(T3, current.effectiveStart());
        }
    }

    @Nested
    @DisplayName("Integrity and concurrency")
    class IntegrityTests {

        @Test
        @DisplayName("Two current versions for one master id is an integrity violation")
        void multipleCurrentVersions() {
            repository.load(EntityType.FACILITY, "F1", List.of(
                    DimensionVersion.open(EntityType.FACILITY, "F1", 1, Map.of(), "fp1", "B0", T1),
                    DimensionVersion.open(EntityType.FACILITY, "F1", 2, Map.of(), "fp2", "B0", T2)));

            IntegrityViolationException ex = assertThrows(IntegrityViolationException.class, () ->
                    historizer.historize(EntityType.FACILITY, "B1", List.of(merged("F1", "fp3", "AUSTIN")), T3));
            assertEquals("F1", ex.getNaturalKey());
            assertEquals(2, repository.findHistory(EntityType.FACILITY, "F1").size());
        }

        @Test
        @DisplayName("A batch with a corrupt master id writes no version for any master id")
        void integrityCheckedBeforeAnyWrite() {
            repository.load(EntityType.FACILITY, "F5", List.of(
                    DimensionVersion.open(EntityType.FACILITY, "F5", 1, Map.of(), "fp1", "B0", T1),
                    DimensionVersion.open(EntityType.FACILITY, "F5", 2, Map.of(), "fp2", "B0", T2)));
            List<MergedRecord> records = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                records.add(merged("F" + i, "fp-" + i, "CITY" + i));
            }

            assertThrows(IntegrityViolationException.class, () ->
                    historizer.historize(EntityType.FACILITY, "B1", records, T3));

            assertEquals(2, repository.countVersions(EntityType.FACILITY));
            assertTrue(repository.findHistory(EntityType.FACILITY, "F0").isEmpty());
            assertTrue(repository.findHistory(EntityType.FACILITY, "F9").isEmpty());
        }

        @Test
        @DisplayName("A record of another entity type is rejected before anything is written")
        void mixedTypesRejectedUpFront() {
            MergedRecord veteran = new MergedRecord(EntityType.VETERAN, "B1", "V1", "OMS_MERGED",
                    Map.of(), "fp", 100, List.of(), List.of(), List.of());

            assertThrows(IllegalArgumentException.class, () -> historizer.historize(EntityType.FACILITY, "B1",
                    List.of(merged("F1", "fp1", "AUSTIN"), veteran), T1));
            assertEquals(0, repository.countVersions(EntityType.FACILITY));
        }

        @Test
        @DisplayName("Many master ids are historized in parallel with one current version each")
        void parallelMasterIds() {
            List<MergedRecord> records = new ArrayList<>();
            for (int i = 0; i < 500; i++) {
                records.add(merged("F" + i, "fp-" + i, "CITY" + i));
            }

            HistorizationResult first = historizer.historize(EntityType.FACILITY, "B1", records, T1);
            HistorizationResult second = historizer.historize(EntityType.FACILITY, "B1", records, T1);

            assertEquals(500, first.opened());
            assertEquals(500, second.unchanged());
            assertEquals(500, repository.countVersions(EntityType.FACILITY));
            assertEquals(500, repository.findAllCurrent(EntityType.FACILITY).size());
        }

        @Test
        @DisplayName("Records of another entity type are rejected")
        void wrongEntityType() {
            assertThrows(IllegalArgumentException.class, () ->
                    historizer.historize(EntityType.VETERAN, "B1", List.of(merged("F1", "fp1", "AUSTIN")), T1));
        }
    }

    @Test
    @DisplayName("Only the open version may be current")
    void versionInvariant() {
        assertThrows(IllegalArgumentException.class, () -> new DimensionVersion(EntityType.FACILITY, "F1", 1,
                Map.of(), "fp", "B1", T1, T2, true));
        assertThrows(IllegalArgumentException.class, () -> new DimensionVersion(EntityType.FACILITY, "F1", 1,
                Map.of(), "fp", "B1", T2, T1, false));
    }
}
