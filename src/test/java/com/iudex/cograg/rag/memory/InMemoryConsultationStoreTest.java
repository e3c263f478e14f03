package com.iudex.cograg.rag.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

class InMemoryConsultationStoreTest {

    private InMemoryConsultationStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryConsultationStore();
        ReflectionTestUtils.setField(store, "maxRecordsPerTenant", 3);
    }

    @Test
    void shouldReturnNewestFirstPerTenant() {
        store.save(record("c1", "tenant-a"));
        store.save(record("c2", "tenant-b"));
        store.save(record("c3", "tenant-a"));

        assertEquals(List.of("c3", "c1"), store.recent("tenant-a", 10).stream().map(ConsultationRecord::id).toList());
        assertEquals(List.of("c3"), store.recent("tenant-a", 1).stream().map(ConsultationRecord::id).toList());
        assertTrue(store.recent("tenant-c", 10).isEmpty());
    }

    @Test
    void shouldEvictOldestBeyondTenantCap() {
        for (int i = 1; i <= 4; i++) {
            store.save(record("c" + i, "tenant-a"));
        }

        assertEquals(3, store.size());
        assertFalse(store.findById("c1").isPresent());
        assertTrue(store.findById("c4").isPresent());
    }

    @Test
    void shouldAppendCorrectionsToExistingRecordOnly() {
        store.save(record("c1", "tenant-a"));
        Correction correction = new Correction(List.of("Lei 8.666"), "revogada", "rev-1", Instant.now());

        assertTrue(store.appendCorrection("c1", correction));
        assertFalse(store.appendCorrection("missing", correction));
        assertEquals(1, store.findById("c1").orElseThrow().corrections().size());
    }

    private static ConsultationRecord record(String id, String tenant) {
        return new ConsultationRecord(id, tenant, "consulta " + id, Set.of("consulta"), null, Map.of(), "resposta",
                List.of(), Instant.now(), List.of());
    }
}
