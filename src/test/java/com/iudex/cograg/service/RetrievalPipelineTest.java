package com.iudex.cograg.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.iudex.cograg.Fixtures;
import com.iudex.cograg.capability.LanguageModelService;
import com.iudex.cograg.config.FusionProperties;
import com.iudex.cograg.exception.BackendUnavailableException;
import com.iudex.cograg.exception.LanguageModelException;
import com.iudex.cograg.model.BackendType;
import com.iudex.cograg.model.FusedResult;
import com.iudex.cograg.model.RetrievalCandidate;
import com.iudex.cograg.rag.classifier.ClassificationCache;
import com.iudex.cograg.rag.classifier.QueryCategory;
import com.iudex.cograg.rag.classifier.QueryClassifier;
import com.iudex.cograg.rag.crag.CragGate;
import com.iudex.cograg.rag.crag.EvidenceLevel;
import com.iudex.cograg.rag.crag.QueryRewriteService;
import com.iudex.cograg.rag.fusion.HybridFusionService;
import com.iudex.cograg.rag.fusion.RetrievalAdapter;
import com.iudex.cograg.rag.fusion.RetrievalAdapters;
import com.iudex.cograg.rag.fusion.RetrievalRequest;
import com.iudex.cograg.rag.rerank.RerankProvider;
import com.iudex.cograg.rag.rerank.RerankService;
import com.iudex.cograg.reasoning.ReasoningTracer;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

class RetrievalPipelineTest {

    private static final List<RetrievalCandidate> LEXICAL_HITS = List.of(
            Fixtures.candidate(BackendType.LEXICAL, "tst-331", "Súmula 331 do TST: o tomador de serviços responde subsidiariamente."),
            Fixtures.candidate(BackendType.LEXICAL, "lei-8666-art-71", "Art. 71 da Lei 8.666: o contratado responde pelos encargos trabalhistas."));

    private ExecutorService executor;
    private LanguageModelService languageModel;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        languageModel = mock(LanguageModelService.class);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Citation query takes the pattern fast path and ranks without any model call")
    void shouldRankCitationQueryWithoutModel() {
        AtomicInteger graphCalls = new AtomicInteger();
        RetrievalPipeline pipeline = pipeline(new RetrievalAdapters(List.of(
                new StubAdapter(BackendType.LEXICAL, request -> LEXICAL_HITS),
                new StubAdapter(BackendType.VECTOR, request -> List.of(
                        Fixtures.candidate(BackendType.VECTOR, "chunk-1", LEXICAL_HITS.get(0).text()),
                        Fixtures.candidate(BackendType.VECTOR, "chunk-2", LEXICAL_HITS.get(1).text()))),
                new StubAdapter(BackendType.GRAPH, request -> {
                    graphCalls.incrementAndGet();
                    return List.of();
                })), true));

        RankedResults results = pipeline.search("Súmula 331 do TST", "tenant-a", null, Map.of(), 10, false);

        assertEquals(QueryCategory.CITATION, results.classification().category());
        assertEquals(List.of("tst-331", "lei-8666-art-71"), results.results().stream().map(FusedResult::id).toList());
        assertEquals(1.0, results.results().get(0).score(), 1e-9);
        assertTrue(results.gatePassed());
        assertEquals(EvidenceLevel.STRONG, results.gate().level());
        assertEquals(RerankProvider.PASSTHROUGH, results.rerankProvider());
        assertEquals(0, results.retryRounds());
        assertFalse(results.timedOut());
        assertEquals(0, graphCalls.get());
        verifyNoInteractions(languageModel);
    }

    @Test
    @DisplayName("All backends down gives an empty, failed result after one corrective retry")
    void shouldReturnEmptyResultWhenAllBackendsFail() {
        when(languageModel.complete(anyString(), anyInt(), anyDouble())).thenThrow(new LanguageModelException("offline"));
        Function<RetrievalRequest, List<RetrievalCandidate>> down = request -> {
            throw new BackendUnavailableException("index", "connection refused");
        };
        RetrievalPipeline pipeline = pipeline(new RetrievalAdapters(List.of(
                new StubAdapter(BackendType.LEXICAL, down), new StubAdapter(BackendType.VECTOR, down)), false));

        RankedResults results = pipeline.search("responsabilidade do tomador de serviços", "tenant-a", null, Map.of(), 10, false);

        assertTrue(results.isEmpty());
        assertFalse(results.gatePassed());
        assertEquals(EvidenceLevel.INSUFFICIENT, results.gate().level());
        assertEquals(1, results.retryRounds());
        assertFalse(results.timedOut());
        assertEquals(QueryCategory.GENERAL, results.classification().category());
        assertThat(results.warnings()).anyMatch(warning -> warning.startsWith("backend lexical unavailable"));
        assertThat(results.gate().reason()).startsWith("0 results retrieved");
    }

    @Test
    @DisplayName("Deadline hit during the search returns a timed-out result instead of throwing")
    void shouldReturnPartialResultOnDeadline() {
        when(languageModel.complete(anyString(), anyInt(), anyDouble())).thenAnswer(invocation -> {
            Thread.sleep(150L);
            throw new LanguageModelException("slow model");
        });
        RetrievalPipeline pipeline = pipeline(new RetrievalAdapters(List.of(
                new StubAdapter(BackendType.LEXICAL, request -> LEXICAL_HITS)), false));
        ReflectionTestUtils.setField(pipeline, "searchTimeoutMs", 50L);

        RankedResults results = pipeline.search("responsabilidade do tomador de serviços", "tenant-a", null, Map.of(), 10, false);

        assertTrue(results.timedOut());
        assertTrue(results.isEmpty());
        assertThat(results.warnings()).anyMatch(warning -> warning.startsWith("deadline exceeded during fusion"));
    }

    private RetrievalPipeline pipeline(RetrievalAdapters adapters) {
        FusionProperties properties = new FusionProperties();
        ProviderCallGuard guard = new ProviderCallGuard();
        guard.init();
        RerankService rerankService = new RerankService(List.of());
        rerankService.init();
        return new RetrievalPipeline(
                new QueryClassifier(new GuardedLanguageModel(languageModel, guard), new ClassificationCache()),
                new HybridFusionService(properties, guard, executor),
                rerankService,
                new CragGate(),
                new QueryRewriteService(new GuardedLanguageModel(languageModel, guard)),
                adapters,
                properties,
                new ReasoningTracer());
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
