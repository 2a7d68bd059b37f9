package com.entity.reconciliation.source;

import com.entity.reconciliation.core.model.EntityType;
import com.entity.reconciliation.core.model.SourceRecord;
import com.entity.reconciliation.core.model.SourceSide;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemorySourceRecordStore Tests")
class InMemorySourceRecordStoreTest {

    private static SourceRecord record(SourceSide side, String batchId, String key) {
        return SourceRecord.builder()
                .entityType(EntityType.VETERAN)
                .side(side)
                .naturalKey(key)
                .batchId(batchId)
                .ingestionTime(Instant.parse("2024-01-05T10:00:00Z"))
                .build();
    }

    @Test
    @DisplayName("Records are partitioned by type, side and batch")
    void partitioned() {
        InMemorySourceRecordStore store = new InMemorySourceRecordStore();
        store.addAll(List.of(
                record(SourceSide.A, "B1", "1"),
                record(SourceSide.A, "B1", "2"),
                record(SourceSide.B, "B1", "1"),
                record(SourceSide.A, "B2", "3")));

        assertEquals(2, store.fetch(EntityType.VETERAN, SourceSide.A, "B1").size());
        assertEquals(1, store.fetch(EntityType.VETERAN, SourceSide.B, "B1").size());
        assertTrue(store.fetch(EntityType.FACILITY, SourceSide.A, "B1").isEmpty());
        assertEquals(4, store.size());
    }

    @Test
    @DisplayName("Clear removes one side of one batch")
    void clear() {
        InMemorySourceRecordStore store = new InMemorySourceRecordStore();
        store.add(record(SourceSide.A, "B1", "1"));
        store.add(record(SourceSide.B, "B1", "1"));

        store.clear(EntityType.VETERAN, SourceSide.A, "B1");

        assertTrue(store.fetch(EntityType.VETERAN, SourceSide.A, "B1").isEmpty());
        assertEquals(1, store.fetch(EntityType.VETERAN, SourceSide.B, "B1").size());
    }
}
