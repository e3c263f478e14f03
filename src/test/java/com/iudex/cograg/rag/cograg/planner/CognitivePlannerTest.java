package com.iudex.cograg.rag.cograg.planner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
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
import com.iudex.cograg.model.Query;
import com.iudex.cograg.reasoning.ReasoningStep;
import com.iudex.cograg.reasoning.ReasoningTrace;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CognitivePlannerTest {

    private static final String COMPLEX_QUERY =
            "Quais as diferenças entre responsabilidade civil contratual e extracontratual e como se aplica a prescrição?";
    private static final Pattern QUESTION_LINE = Pattern.compile("Question: (.*)\n");

    private ExecutorService executor;
    private LanguageModelService languageModel;
    private CognitivePlanner planner;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        languageModel = mock(LanguageModelService.class);
        planner = new CognitivePlanner(Fixtures.guarded(languageModel), new ComplexityHeuristic(25, 12), executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Short query yields a single END node without model calls")
    void shortQueryIsSingleNode() {
        CognitiveTree tree = planner.plan("Art. 5 CF");

        assertEquals(1, tree.size());
        assertEquals(NodeState.END, tree.root().getState());
        assertTrue(tree.isFrozen());
        verifyNoInteractions(languageModel);
    }

    @Test
    @DisplayName("Complex query expands breadth-first down to the depth limit")
    void complexQueryIsDecomposed() {
        when(languageModel.complete(anyString(), anyInt(), anyDouble())).thenAnswer(invocation -> answer(invocation.getArgument(0)));
        RequestContext context = context(RequestBudget.unbounded());

        CognitiveTree tree = planner.plan(COMPLEX_QUERY, 3, 4, context);

        assertEquals(7, tree.size());
        assertEquals(3, tree.depth());
        assertEquals(4, tree.leaves().size());
        assertThat(tree.nodes()).noneMatch(node -> node.getState() == NodeState.CONTINUE && node.getChildIds().isEmpty());
        assertThat(tree.leaves()).allMatch(leaf -> leaf.getLevel() == 2);
        ReasoningStep step = lastStep(context);
        assertEquals(ReasoningStep.StepType.PLANNING, step.type());
        assertEquals("decomposed", step.data().get("path"));
    }

    @Test
    @DisplayName("Depth limit of two stops after the first level")
    void depthTwoStopsAtChildren() {
        when(languageModel.complete(anyString(), anyInt(), anyDouble())).thenAnswer(invocation -> answer(invocation.getArgument(0)));

        CognitiveTree tree = planner.plan(COMPLEX_QUERY, 2, 4);

        assertEquals(3, tree.size());
        assertThat(tree.leaves()).hasSize(2).allMatch(leaf -> leaf.getLevel() == 1);
    }

    @Test
    @DisplayName("Model failure degrades to a single-node tree")
    void modelFailureFallsBackToRoot() {
        when(languageModel.complete(anyString(), anyInt(), anyDouble())).thenThrow(new LanguageModelException("offline"));
        RequestContext context = context(RequestBudget.unbounded());

        CognitiveTree tree = planner.plan(COMPLEX_QUERY, 3, 4, context);

        assertEquals(1, tree.size());
        assertEquals(NodeState.END, tree.root().getState());
        assertThat(context.warnings()).contains(
                "planner: conditions extraction failed, decomposing without context",
                "planner: decomposition failed for node n0, treated as leaf");
    }

    @Test
    @DisplayName("Sub-questions repeating existing ones end the parent")
    void duplicateSubQuestionsEndParent() {
        when(languageModel.complete(anyString(), anyInt(), anyDouble()))
                .thenReturn("{\"sub_questions\": [\"" + COMPLEX_QUERY.replace("?", "") + "\"]}");

        CognitiveTree tree = planner.plan(COMPLEX_QUERY, 3, 4);

        assertEquals(1, tree.size());
        assertEquals(NodeState.END, tree.root().getState());
    }

    @Test
    @DisplayName("Exhausted call budget returns the partial tree frozen")
    void budgetExhaustionReturnsPartialTree() {
        when(languageModel.complete(anyString(), anyInt(), anyDouble())).thenAnswer(invocation -> answer(invocation.getArgument(0)));
        RequestContext context = context(RequestBudget.of(Duration.ofSeconds(30), 2, 100_000));

        CognitiveTree tree = planner.plan(COMPLEX_QUERY, 3, 4, context);

        assertTrue(tree.isFrozen());
        assertEquals(3, tree.size());
        assertThat(tree.leaves()).hasSize(2);
        assertThat(context.warnings()).anyMatch(warning -> warning.startsWith("planner: expansion stopped early"));
        assertEquals("partial", lastStep(context).data().get("path"));
    }

    @Test
    void shouldParseSeveralSubQuestionShapes() {
        String response = "```json\n{\"sub_questions\": [\"Qual o prazo?\", {\"question\": \"Quem é parte legítima?\"},"
                + " {\"pergunta\": \"Cabe recurso?\"}, {\"type\": \"norm\"}, \"Excedente\"]}\n```";

        List<String> questions = CognitivePlanner.parseSubQuestions(response, 3);

        assertEquals(List.of("Qual o prazo?", "Quem é parte legítima?", "Cabe recurso?"), questions);
    }

    private static String answer(String prompt) {
        if (prompt.contains("extract its context")) {
            return "{\"conditions\": [\"relação contratual prévia\"], \"themes\": [\"responsabilidade civil\"],"
                    + " \"key_entities\": [\"Código Civil\"]}";
        }
        Matcher matcher = QUESTION_LINE.matcher(prompt);
        String question = matcher.find() ? matcher.group(1) : "unknown";
        return "{\"sub_questions\": [{\"question\": \"" + question + " - aspecto normativo\", \"type\": \"norm\"},"
                + " {\"question\": \"" + question + " - aspecto jurisprudencial\", \"type\": \"case_law\"}]}";
    }

    private static RequestContext context(RequestBudget budget) {
        return new RequestContext(Query.of(COMPLEX_QUERY, "tenant-a"), budget, new ReasoningTrace("tenant-a", "planner"));
    }

    private static ReasoningStep lastStep(RequestContext context) {
        List<ReasoningStep> steps = context.trace().getSteps();
        return steps.get(steps.size() - 1);
    }
}
