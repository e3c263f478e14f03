package com.iudex.cograg.rag.fusion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.iudex.cograg.Fixtures;
import com.iudex.cograg.config.FusionProperties;
import com.iudex.cograg.context.RequestContext;
import com.iudex.cograg.exception.BackendUnavailableException;
import com.iudex.cograg.exception.EmbeddingException;
import com.iudex.cograg.model.BackendType;
import com.iudex.cograg.model.FusedResult;
import com.iudex.cograg.model.Query;
import com.iudex.cograg.model.RetrievalCandidate;
import com.iudex.cograg.service.ProviderCallGuard;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HybridFusionServiceTest {

    private ExecutorService executor;
    private FusionProperties properties;
    private HybridFusionService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        properties = new FusionProperties();
        service = new HybridFusionService(properties, new ProviderCallGuard(), executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldMergeSameContentAcrossBackends() {
        StubAdapter lexical = new StubAdapter(BackendType.LEXICAL, request -> List.of(
                Fixtures.candidate(BackendType.LEXICAL, "lei-8666-art-24", "Art. 24 dispensa de licitação"),
                Fixtures.candidate(BackendType.LEXICAL, "lei-14133-art-75", "Art. 75 da Lei 14.133 dispensa")));
        StubAdapter vector = new StubAdapter(BackendType.VECTOR, request -> List.of(
                Fixtures.candidate(BackendType.VECTOR, "chunk-77", "art. 24   dispensa de LICITAÇÃO")));

        FusionOutcome outcome = service.fuse("dispensa de licitação", FusionWeights.of(0.5, 0.5, 0.3),
                List.of(lexical, vector), 10, Map.of(), context());

        assertEquals(2, outcome.results().size());
        FusedResult top = outcome.results().get(0);
        assertThat(top.backends()).containsExactly(BackendType.LEXICAL, BackendType.VECTOR);
        assertEquals(0.5 / 61 + 0.5 / 61, top.rrfScore(), 1e-12);
        assertEquals(1.0, top.score(), 1e-9);
        assertTrue(outcome.failedBackends().isEmpty());
    }

    @Test
    void shouldExcludeFailedBackendAndKeepTheRest() {
        StubAdapter lexical = new StubAdapter(BackendType.LEXICAL, request -> List.of(
                Fixtures.candidate(BackendType.LEXICAL, "d1", "Súmula 331 do TST terceirização")));
        StubAdapter vector = new StubAdapter(BackendType.VECTOR, request -> {
            throw new EmbeddingException("embedding model offline");
        });
        StubAdapter graph = new StubAdapter(BackendType.GRAPH, request -> {
            throw new BackendUnavailableException("graph", "connection refused");
        });

        RequestContext context = context();
        FusionOutcome outcome = service.fuse("terceirização", FusionWeights.of(0.5, 0.5, 0.3),
                List.of(lexical, vector, graph), 10, Map.of(), context);

        assertEquals(1, outcome.results().size());
        assertThat(outcome.failedBackends()).containsExactly("vector", "graph");
        assertThat(outcome.warnings()).contains("embedding failed; vector search skipped");
        assertThat(context.warnings()).contains("embedding failed; vector search skipped");
    }

    @Test
    void shouldTreatSlowBackendAsFailed() {
        properties.setProviderTimeoutsMs(Map.of("graph", 50L));
        StubAdapter lexical = new StubAdapter(BackendType.LEXICAL, request -> List.of(
                Fixtures.candidate(BackendType.LEXICAL, "d1", "prazo prescricional quinquenal")));
        StubAdapter graph = new StubAdapter(BackendType.GRAPH, request -> {
            try {
                Thread.sleep(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return List.of(Fixtures.candidate(BackendType.GRAPH, "g1", "late answer"));
        });

        FusionOutcome outcome = service.fuse("prazo prescricional", FusionWeights.of(0.5, 0.5, 0.3),
                List.of(lexical, graph), 10, Map.of(), context());

        assertEquals(List.of("d1"), outcome.results().stream().map(FusedResult::id).toList());
        assertThat(outcome.failedBackends()).containsExactly("graph");
        assertThat(outcome.warnings()).anyMatch(warning -> warning.contains("timed out"));
    }

    @Test
    void shouldReturnEmptyWhenEveryBackendFails() {
        StubAdapter lexical = new StubAdapter(BackendType.LEXICAL, request -> {
            throw new BackendUnavailableException("lexical", "index closed");
        });

        FusionOutcome outcome = service.fuse("qualquer coisa", FusionWeights.of(0.5, 0.5, 0.3),
                List.of(lexical), 10, Map.of(), context());

        assertTrue(outcome.isEmpty());
        assertThat(outcome.failedBackends()).containsExactly("lexical");
    }

    @Test
    void shouldIgnoreEmptyBackendWhenNormalizing() {
        StubAdapter lexical = new StubAdapter(BackendType.LEXICAL, request -> List.of(
                Fixtures.candidate(BackendType.LEXICAL, "d1", "responsabilidade subsidiária do tomador")));
        StubAdapter vector = new StubAdapter(BackendType.VECTOR, request -> List.of(
                Fixtures.candidate(BackendType.VECTOR, "c1", "culpa in vigilando da administração")));
        StubAdapter emptyGraph = new StubAdapter(BackendType.GRAPH, request -> List.of());
        FusionWeights weights = FusionWeights.of(0.5, 0.5, 0.3);

        List<FusedResult> withoutGraph = service.fuse("responsabilidade do tomador", weights, List.of(lexical, vector), 10);
        FusionOutcome withEmptyGraph = service.fuse("responsabilidade do tomador", weights, List.of(lexical, vector, emptyGraph),
                10, Map.of(), context());

        assertEquals(0.5, withoutGraph.get(0).score(), 1e-9);
        assertEquals(0.5, withEmptyGraph.results().get(0).score(), 1e-9);
        assertTrue(withEmptyGraph.failedBackends().isEmpty());
    }

    @Test
    void shouldIgnoreSecondAdapterForSameBackend() {
        StubAdapter first = new StubAdapter(BackendType.LEXICAL, request -> List.of(
                Fixtures.candidate(BackendType.LEXICAL, "d1", "primeiro índice")));
        StubAdapter second = new StubAdapter(BackendType.LEXICAL, request -> List.of(
                Fixtures.candidate(BackendType.LEXICAL, "d2", "segundo índice")));

        FusionOutcome outcome = service.fuse("índice", FusionWeights.of(1.0, 0.0, 0.0), List.of(first, second), 10, Map.of(), context());

        assertEquals(List.of("d1"), outcome.results().stream().map(FusedResult::id).toList());
        assertThat(outcome.warnings()).contains("backend lexical listed twice; extra adapter ignored");
    }

    @Test
    void shouldBreakScoreTiesById() {
        StubAdapter lexical = new StubAdapter(BackendType.LEXICAL, request -> List.of(
                Fixtures.candidate(BackendType.LEXICAL, "b-doc", "texto lexical")));
        StubAdapter vector = new StubAdapter(BackendType.VECTOR, request -> List.of(
                Fixtures.candidate(BackendType.VECTOR, "a-doc", "texto vetorial")));

        for (int i = 0; i < 5; i++) {
            List<FusedResult> results = service.fuse("consulta " + i, FusionWeights.of(0.5, 0.5, 0.0),
                    List.of(lexical, vector), 10);
            assertEquals(List.of("a-doc", "b-doc"), results.stream().map(FusedResult::id).toList());
        }
    }

    @Test
    void shouldKeepBestRankForDuplicatesInsideOneList() {
        Map<BackendType, List<RetrievalCandidate>> ranked = Map.of(BackendType.LEXICAL, List.of(
                Fixtures.candidate(BackendType.LEXICAL, "d1", "mesmo texto"),
                Fixtures.candidate(BackendType.LEXICAL, "d1-copy", "Mesmo  texto"),
                Fixtures.candidate(BackendType.LEXICAL, "d2", "outro texto")));

        List<FusedResult> results = service.reciprocalRankFusion(ranked, FusionWeights.of(1.0, 0.0, 0.0), 10);

        assertEquals(2, results.size());
        assertEquals("d1", results.get(0).id());
        assertEquals(1.0 / 62, results.get(1).rrfScore(), 1e-12);
    }

    @Test
    void shouldTruncateToTopK() {
        Map<BackendType, List<RetrievalCandidate>> ranked = Map.of(BackendType.LEXICAL, List.of(
                Fixtures.candidate(BackendType.LEXICAL, "d1", "um"),
                Fixtures.candidate(BackendType.LEXICAL, "d2", "dois"),
                Fixtures.candidate(BackendType.LEXICAL, "d3", "três")));

        assertEquals(2, service.reciprocalRankFusion(ranked, FusionWeights.of(1.0, 0.0, 0.0), 2).size());
    }

    @Test
    void rrfContributionShouldFallWithRankAndRiseWithWeight() {
        for (int rank = 1; rank < 50; rank++) {
            assertTrue(HybridFusionService.rrfContribution(0.7, 60, rank) > HybridFusionService.rrfContribution(0.7, 60, rank + 1));
            assertTrue(HybridFusionService.rrfContribution(0.8, 60, rank) > HybridFusionService.rrfContribution(0.7, 60, rank));
        }
    }

    private static RequestContext context() {
        return RequestContext.detached(Query.of("fusion test", "tenant-a"));
    }

    private static final class StubAdapter implements RetrievalAdapter {
        private final BackendType backend;
        private final Function<RetrievalRequest, List<RetrievalCandidate>> results;

        private StubAdapter(BackendType backend, Function<RetrievalRequest, List<RetrievalCandidate>> results) {
            this.backend = backend;
            this.results = results;
        }

        @Override
        public BackendType backend() {
            return backend;
        }

        @Override
        public List<RetrievalCandidate> retrieve(RetrievalRequest request) {
            return results.apply(request);
        }
    }
}
