package com.iudex.cograg.rag.rerank;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.iudex.cograg.Fixtures;
import com.iudex.cograg.capability.LanguageModelService;
import com.iudex.cograg.context.RequestContext;
import com.iudex.cograg.exception.LanguageModelException;
import com.iudex.cograg.model.FusedResult;
import com.iudex.cograg.model.Query;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

class LlmRelevanceRerankerTest {

    private final LanguageModelService languageModel = mock(LanguageModelService.class);
    private final LlmRelevanceReranker reranker = new LlmRelevanceReranker(Fixtures.guarded(languageModel));
    private final List<FusedResult> candidates = List.of(
            Fixtures.fused("d1", "Prazo de prescrição trabalhista", 0.5),
            Fixtures.fused("d2", "Regras de licitação", 0.6));

    @Test
    void shouldApplyModelScoresPerPassage() {
        when(languageModel.complete(anyString(), anyInt(), anyDouble())).thenReturn("1: 0.92\n2: 0.10");

        List<FusedResult> results = reranker.rerank("prescrição", candidates, context());

        assertEquals(0.92, results.get(0).score(), 1e-9);
        assertEquals(0.10, results.get(1).score(), 1e-9);
    }

    @Test
    void shouldFailWhenModelOmitsAPassage() {
        when(languageModel.complete(anyString(), anyInt(), anyDouble())).thenReturn("1: 0.92");

        assertThrows(RerankException.class, () -> reranker.rerank("prescrição", candidates, context()));
    }

    @Test
    void shouldWrapModelFailure() {
        when(languageModel.complete(anyString(), anyInt(), anyDouble())).thenThrow(new LanguageModelException("timeout"));

        assertThrows(RerankException.class, () -> reranker.rerank("prescrição", candidates, context()));
    }

    @Test
    void shouldKeepFusedScoreBeyondScoringWindow() {
        ReflectionTestUtils.setField(reranker, "maxCandidates", 1);
        when(languageModel.complete(anyString(), anyInt(), anyDouble())).thenReturn("1: 0.92");

        List<FusedResult> results = reranker.rerank("prescrição", candidates, context());

        assertEquals(0.92, results.get(0).score(), 1e-9);
        assertEquals(0.6, results.get(1).score(), 1e-9);
        assertEquals("d2", results.get(1).id());
    }

    @Test
    void shouldParseBracketedAndEqualsForms() {
        Map<Integer, Double> scores = LlmRelevanceReranker.parseScores("[1] = 1.0\n[2]: 0.35\nnoise line\n2: 0.99");

        assertEquals(1.0, scores.get(1), 1e-9);
        assertEquals(0.35, scores.get(2), 1e-9);
    }

    private static RequestContext context() {
        return RequestContext.detached(Query.of("prescrição", "tenant-a"));
    }
}
