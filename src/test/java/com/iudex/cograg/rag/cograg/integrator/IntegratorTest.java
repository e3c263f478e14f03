package com.iudex.cograg.rag.cograg.integrator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.iudex.cograg.Fixtures;
import com.iudex.cograg.capability.LanguageModelService;
import com.iudex.cograg.context.RequestContext;
import com.iudex.cograg.exception.LanguageModelException;
import com.iudex.cograg.model.Query;
import com.iudex.cograg.rag.cograg.reasoner.SubAnswer;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;

class IntegratorTest {

    private static final String QUERY = "A administração responde pelos encargos trabalhistas do terceirizado?";

    private LanguageModelService languageModel;
    private Integrator integrator;

    @BeforeEach
    void setUp() {
        languageModel = mock(LanguageModelService.class);
        integrator = new Integrator(Fixtures.guarded(languageModel));
    }

    @Nested
    @DisplayName("Proceed path")
    class ProceedTest {

        @Test
        @DisplayName("No sub-answers gives the fixed message without citations")
        void noAnswers() {
            IntegratedAnswer result = integrator.integrate(QUERY, List.of(), GateStatus.PROCEED, List.of(), true);

            assertEquals(Integrator.NOTHING_FOUND, result.answer());
            assertTrue(result.citations().isEmpty());
            assertEquals(IntegrationMode.NO_RESULTS, result.mode());
            verifyNoInteractions(languageModel);
        }

        @Test
        @DisplayName("Single sub-answer is returned unchanged")
        void singleAnswer() {
            SubAnswer only = answer("n1", "Resposta única com a Súmula 331.", "Súmula 331");

            IntegratedAnswer result = integrator.integrate(QUERY, List.of(only), GateStatus.PROCEED, List.of(), true);

            assertEquals(only.answer(), result.answer());
            assertEquals(List.of("Súmula 331"), result.citations());
            assertEquals(IntegrationMode.SINGLE_ANSWER, result.mode());
            verifyNoInteractions(languageModel);
        }

        @Test
        @DisplayName("Several sub-answers are synthesized by the model")
        void synthesized() {
            when(languageModel.complete(anyString(), anyInt(), anyDouble())).thenReturn("  Síntese final.  ");

            IntegratedAnswer result = integrator.integrate(QUERY, twoAnswers(), GateStatus.PROCEED, List.of(), true);

            assertEquals("Síntese final.", result.answer());
            assertEquals(IntegrationMode.SYNTHESIZED, result.mode());
            assertEquals(List.of("Súmula 331", "art. 71"), result.citations());
        }

        @Test
        @DisplayName("Synthesis failure falls back to the rule-based text")
        void ruleBasedFallback() {
            when(languageModel.complete(anyString(), anyInt(), anyDouble())).thenThrow(new LanguageModelException("offline"));
            RequestContext context = context();

            IntegratedAnswer result = integrator.integrate(QUERY, twoAnswers(), GateStatus.PROCEED, List.of(), true, context);

            assertEquals(IntegrationMode.RULE_BASED, result.mode());
            assertEquals("Regarding 'Q1': A1\n\nFinally, regarding 'Q2': A2", result.answer());
            assertThat(context.warnings()).contains("integration: synthesis failed, rule-based answer used");
        }
    }

    @Nested
    @DisplayName("Abstain path")
    class AbstainTest {

        @Test
        @DisplayName("Explained abstention uses the model text and keeps abstain metadata")
        void explained() {
            when(languageModel.complete(anyString(), anyInt(), anyDouble())).thenReturn("As fontes divergem.");

            IntegratedAnswer result = integrator.integrate(QUERY, twoAnswers(), GateStatus.ABSTAIN,
                    List.of("conflicting sources"), true);

            assertEquals("As fontes divergem.", result.answer());
            assertEquals(IntegrationMode.ABSTAIN_EXPLAINED, result.mode());
            assertTrue(result.isAbstain());
            assertEquals(Integrator.ABSTAIN_REASON, result.abstain().reason());
            assertEquals(2, result.abstain().partialAnswerCount());
        }

        @Test
        @DisplayName("Explanation failure falls back to the template")
        void templateFallback() {
            when(languageModel.complete(anyString(), anyInt(), anyDouble())).thenThrow(new LanguageModelException("offline"));

            IntegratedAnswer result = integrator.integrate(QUERY, twoAnswers(), GateStatus.ABSTAIN,
                    List.of("low confidence"), true);

            assertEquals(IntegrationMode.ABSTAIN_TEMPLATE, result.mode());
            assertThat(result.answer())
                    .contains("cannot be given")
                    .contains("- low confidence")
                    .contains("Partial findings (2)");
        }

        @Test
        @DisplayName("Silent abstention has no text, no citations and no model call")
        void silent() {
            IntegratedAnswer result = integrator.integrate(QUERY, twoAnswers(), GateStatus.ABSTAIN, List.of("no evidence"), false);

            assertNull(result.answer());
            assertTrue(result.citations().isEmpty());
            assertEquals(IntegrationMode.ABSTAIN_SILENT, result.mode());
            assertEquals(List.of("no evidence"), result.abstain().issues());
            verifyNoInteractions(languageModel);
        }
    }

    @Test
    @DisplayName("Citations are merged ignoring case, first spelling wins")
    void shouldMergeCitationsIgnoringCase() {
        List<SubAnswer> answers = List.of(
                answer("n1", "A1", "Súmula 331", "Art. 71"),
                answer("n2", "A2", "súmula 331", "art. 71", "Lei 8.666"));

        assertEquals(List.of("Súmula 331", "Art. 71", "Lei 8.666"), Integrator.mergeCitations(answers));
    }

    @Test
    @DisplayName("Streaming synthesis falls back to the rule-based text on error")
    void shouldFallBackWhenStreamFails() {
        when(languageModel.stream(anyString(), anyInt(), anyDouble())).thenReturn(Flux.error(new LanguageModelException("stream broke")));
        RequestContext context = context();

        List<String> chunks = integrator.streamSynthesis(QUERY, twoAnswers(), context).collectList().block();

        assertEquals(List.of(Integrator.ruleBasedAnswer(twoAnswers())), chunks);
        assertThat(context.warnings()).contains("integration: streaming synthesis failed, rule-based answer used");
    }

    @Test
    @DisplayName("Streaming passes model chunks through")
    void shouldStreamModelChunks() {
        when(languageModel.stream(anyString(), anyInt(), anyDouble())).thenReturn(Flux.just("Sín", "tese"));

        assertEquals(List.of("Sín", "tese"), integrator.streamSynthesis(QUERY, twoAnswers(), context()).collectList().block());
    }

    private static List<SubAnswer> twoAnswers() {
        return List.of(answer("n1", "A1", "Súmula 331"), answer("n2", "A2", "art. 71"));
    }

    private static SubAnswer answer(String nodeId, String text, String... citations) {
        String question = "Q" + nodeId.substring(1);
        return new SubAnswer(nodeId, question, text, 0.7, List.of(citations), List.of("ref-" + nodeId), false, true, false);
    }

    private static RequestContext context() {
        return RequestContext.detached(Query.of(QUERY, "tenant-a"));
    }
}
