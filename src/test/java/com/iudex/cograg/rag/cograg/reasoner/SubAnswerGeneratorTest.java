package com.iudex.cograg.rag.cograg.reasoner;

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
import com.iudex.cograg.context.RequestBudget;
import com.iudex.cograg.context.RequestContext;
import com.iudex.cograg.exception.LanguageModelException;
import com.iudex.cograg.model.FusedResult;
import com.iudex.cograg.model.Query;
import com.iudex.cograg.rag.cograg.planner.CognitiveTree;
import com.iudex.cograg.rag.cograg.planner.MindMapNode;
import com.iudex.cograg.rag.cograg.planner.NodeState;
import com.iudex.cograg.rag.cograg.refiner.EvidenceSet;
import com.iudex.cograg.rag.cograg.refiner.RefinementResult;
import com.iudex.cograg.reasoning.ReasoningTrace;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SubAnswerGeneratorTest {

    private ExecutorService executor;
    private LanguageModelService languageModel;
    private SubAnswerGenerator generator;
    private MindMapNode leafA;
    private MindMapNode leafB;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        languageModel = mock(LanguageModelService.class);
        generator = new SubAnswerGenerator(Fixtures.guarded(languageModel), executor);
        CognitiveTree tree = new CognitiveTree("Responsabilidade da administração na terceirização");
        leafA = tree.addChild(tree.getRootId(), "O que diz a Súmula 331 do TST?", NodeState.END);
        leafB = tree.addChild(tree.getRootId(), "O que diz o art. 71 da Lei 8.666?", NodeState.END);
        tree.freeze();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Nested
    @DisplayName("confidence()")
    class ConfidenceTest {

        @Test
        @DisplayName("Plenty of good evidence and a full answer give high confidence")
        void strongEvidence() {
            assertEquals(0.9, SubAnswerGenerator.confidence(5, 0.5, false, 250, true), 1e-9);
        }

        @Test
        @DisplayName("Conflicts cost 0.15")
        void conflictsLowerConfidence() {
            assertEquals(0.75, SubAnswerGenerator.confidence(5, 0.5, true, 250, true), 1e-9);
        }

        @Test
        @DisplayName("Failed gate halves the score")
        void failedGateHalves() {
            assertEquals(0.45, SubAnswerGenerator.confidence(5, 0.5, false, 250, false), 1e-9);
        }

        @Test
        @DisplayName("Single chunk and a terse answer stay low")
        void thinEvidence() {
            assertEquals(0.4, SubAnswerGenerator.confidence(1, 0.0, false, 10, true), 1e-9);
        }
    }

    @Test
    @DisplayName("Model answer keeps its citations and evidence refs")
    void shouldAnswerFromEvidence() {
        when(languageModel.complete(anyString(), anyInt(), anyDouble()))
                .thenReturn("Pela Súmula 331 do TST, o tomador responde subsidiariamente [ref:tst-331].");

        Optional<SubAnswer> answer = generator.generate(leafA, evidence(leafA, "tst-331"), true, Set.of(), context());

        assertTrue(answer.isPresent());
        assertEquals(leafA.getId(), answer.get().nodeId());
        assertEquals(List.of("Súmula 331"), answer.get().citations());
        assertEquals(List.of("tst-331"), answer.get().evidenceRefs());
        assertFalse(answer.get().extractive());
    }

    @Test
    @DisplayName("Model failure falls back to an extractive answer")
    void shouldFallBackToExtractiveAnswer() {
        when(languageModel.complete(anyString(), anyInt(), anyDouble())).thenThrow(new LanguageModelException("offline"));
        RequestContext context = context();

        SubAnswer answer = generator.generate(leafA, evidence(leafA, "tst-331"), true, Set.of(), context).orElseThrow();

        assertTrue(answer.extractive());
        assertThat(answer.answer()).startsWith("Based on the retrieved sources:").contains("[ref:tst-331]");
        assertThat(context.warnings()).contains("reasoning: extractive answer used for node " + leafA.getId());
    }

    @Test
    @DisplayName("Exhausted call budget answers extractively without calling the model")
    void shouldNotCallModelWithoutBudget() {
        RequestContext context = new RequestContext(Query.of("q", "tenant-a"), RequestBudget.of(Duration.ofSeconds(10), 0, 1000),
                new ReasoningTrace("tenant-a", "q"));

        SubAnswer answer = generator.generate(leafA, evidence(leafA, "tst-331"), true, Set.of(), context).orElseThrow();

        assertTrue(answer.extractive());
        verifyNoInteractions(languageModel);
    }

    @Test
    @DisplayName("Penalized references are dropped from citations and evidence refs")
    void shouldDropPenalizedReferences() {
        when(languageModel.complete(anyString(), anyInt(), anyDouble()))
                .thenReturn("Aplica-se o art. 71 da Lei 8.666 e a Súmula 331 [ref:tst-331] [ref:lei-8666].");
        EvidenceSet evidence = new EvidenceSet(leafB.getId(), List.of(
                Fixtures.fused("tst-331", "Súmula 331 do TST", 0.8),
                Fixtures.fused("lei-8666", "Art. 71 da Lei 8.666", 0.7)), 0.5, false, Map.of());

        SubAnswer answer = generator.generate(leafB, evidence, true, Set.of("lei 8.666", "lei-8666"), context()).orElseThrow();

        assertEquals(List.of("art. 71", "Súmula 331"), answer.citations());
        assertEquals(List.of("tst-331"), answer.evidenceRefs());
    }

    @Test
    @DisplayName("Leaf without evidence gets no answer")
    void shouldSkipLeafWithoutEvidence() {
        assertTrue(generator.generate(leafA, EvidenceSet.empty(leafA.getId()), true, Set.of(), context()).isEmpty());
        verifyNoInteractions(languageModel);
    }

    @Test
    @DisplayName("All leaves are answered concurrently and returned in leaf order")
    void shouldAnswerAllLeavesInOrder() {
        when(languageModel.complete(anyString(), anyInt(), anyDouble())).thenAnswer(invocation -> {
            String prompt = invocation.getArgument(0);
            return prompt.contains("Súmula 331 do TST?") ? "Resposta A [ref:tst-331]" : "Resposta B [ref:lei-8666]";
        });
        RefinementResult refinement = new RefinementResult(Map.of(
                leafA.getId(), evidence(leafA, "tst-331"),
                leafB.getId(), evidence(leafB, "lei-8666")), List.of());
        RequestContext context = context();

        List<SubAnswer> answers = generator.generateAll(List.of(leafA, leafB), refinement,
                Map.of(leafA.getId(), true, leafB.getId(), false), Set.of(), context);

        assertEquals(List.of(leafA.getId(), leafB.getId()), answers.stream().map(SubAnswer::nodeId).toList());
        assertTrue(answers.get(0).gatePassed());
        assertFalse(answers.get(1).gatePassed());
        assertTrue(answers.get(1).confidence() < answers.get(0).confidence());
    }

    private static EvidenceSet evidence(MindMapNode leaf, String id) {
        List<FusedResult> results = List.of(Fixtures.fused(id, "Texto da fonte " + id + " sobre responsabilidade subsidiária.", 0.8));
        return new EvidenceSet(leaf.getId(), results, 0.6, false, Map.of(id, 0.6));
    }

    private static RequestContext context() {
        return RequestContext.detached(Query.of("terceirização", "tenant-a"));
    }
}
