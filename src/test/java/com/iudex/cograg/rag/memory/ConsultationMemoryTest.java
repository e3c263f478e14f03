package com.iudex.cograg.rag.memory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ConsultationMemoryTest {

    private static final String QUERY = "Responsabilidade subsidiária da administração pública na terceirização";

    private InMemoryConsultationStore store;
    private ConsultationMemory memory;

    @BeforeEach
    void setUp() {
        store = new InMemoryConsultationStore();
        memory = new ConsultationMemory(store);
    }

    @Test
    @DisplayName("Same question in the same tenant is recalled")
    void shouldRecallSimilarConsultation() {
        String id = memory.store(QUERY, "tenant-a", null, Map.of("n1", "resposta"), "Resposta final", List.of("Súmula 331"));

        Optional<SimilarConsultation> recalled = memory.findSimilar("responsabilidade SUBSIDIÁRIA administração pública terceirização?", "tenant-a");

        assertTrue(recalled.isPresent());
        assertEquals(id, recalled.get().consultationId());
        assertEquals(1.0, recalled.get().similarity(), 1e-9);
        assertEquals("Resposta final", recalled.get().record().finalAnswer());
    }

    @Test
    @DisplayName("Records of another tenant are never recalled")
    void shouldIsolateTenants() {
        memory.store(QUERY, "tenant-a", null, Map.of(), "Resposta final", List.of());

        assertTrue(memory.findSimilar(QUERY, "tenant-b").isEmpty());
    }

    @Test
    @DisplayName("Similarity below the threshold is not recalled")
    void shouldRespectThreshold() {
        memory.store(QUERY, "tenant-a", null, Map.of(), "Resposta final", List.of());
        String widened = QUERY + " trabalhista";

        assertTrue(memory.findSimilar(widened, "tenant-a").isEmpty());
        assertTrue(memory.findSimilar(widened, "tenant-a", 0.8).isPresent());
    }

    @Test
    @DisplayName("On equal similarity the newer record wins")
    void shouldPreferNewestRecord() {
        memory.store(QUERY, "tenant-a", null, Map.of(), "Antiga", List.of());
        String newer = memory.store(QUERY, "tenant-a", null, Map.of(), "Nova", List.of());

        assertEquals(newer, memory.findSimilar(QUERY, "tenant-a").orElseThrow().consultationId());
    }

    @Test
    @DisplayName("Corrections surface as penalized references on recall")
    void shouldPropagateCorrections() {
        String id = memory.store(QUERY, "tenant-a", null, Map.of(), "Resposta", List.of("Lei 8.666"));

        assertTrue(memory.applyCorrection(id, List.of("Lei 8.666"), "revogada pela Lei 14.133", "rev-1"));

        assertThat(memory.findSimilar(QUERY, "tenant-a").orElseThrow().penalizedReferences())
                .contains("Lei 8.666", "lei 8.666");
    }

    @Test
    @DisplayName("Corrections for unknown ids or without references are rejected")
    void shouldRejectInvalidCorrections() {
        assertFalse(memory.applyCorrection("missing", List.of("art. 1"), "nota"));
        assertFalse(memory.applyCorrection(null, List.of("art. 1"), "nota"));
        assertFalse(memory.applyCorrection("missing", List.of(), "nota"));
    }

    @Test
    @DisplayName("Store failures degrade to no memory")
    void shouldDegradeOnStoreFailure() {
        ConsultationStore failing = mock(ConsultationStore.class);
        doThrow(new IllegalStateException("disk full")).when(failing).save(any());
        when(failing.recent(anyString(), anyInt())).thenThrow(new IllegalStateException("unreachable"));
        ConsultationMemory degraded = new ConsultationMemory(failing);

        assertNull(degraded.store(QUERY, "tenant-a", null, Map.of(), "Resposta", List.of()));
        assertTrue(degraded.findSimilar(QUERY, "tenant-a").isEmpty());
    }

    @Test
    @DisplayName("Queries without keywords are never matched")
    void shouldIgnoreQueriesWithoutKeywords() {
        assertNotNull(memory.store("o que é?", "tenant-a", null, Map.of(), "Resposta", List.of()));

        assertTrue(memory.findSimilar("o que é?", "tenant-a").isEmpty());
    }
}
