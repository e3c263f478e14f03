package com.iudex.cograg.rag.cograg.planner;

import com.fasterxml.jackson.databind.JsonNode;
import com.iudex.cograg.context.RequestContext;
import com.iudex.cograg.exception.BudgetExceededException;
import com.iudex.cograg.model.Query;
import com.iudex.cograg.reasoning.ReasoningStep;
import com.iudex.cograg.service.GuardedLanguageModel;
import com.iudex.cograg.util.BoundedFanOut;
import com.iudex.cograg.util.LogSanitizer;
import com.iudex.cograg.util.ModelJson;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Top-down decomposition of a query into a mind-map of sub-questions.
 *
 * <p>Simple queries produce a single {@code END} node. Complex queries get one conditions
 * extraction call, then breadth-first expansion: levels run in sequence, siblings within a level
 * are expanded concurrently. New nodes are attached on the calling thread after each level's
 * fan-in, so node ids are stable for identical model answers.</p>
 */
@Service
public class CognitivePlanner {
    private static final Logger log = LoggerFactory.getLogger(CognitivePlanner.class);
    private final GuardedLanguageModel languageModel;
    private final ComplexityHeuristic complexityHeuristic;
    private final ExecutorService branchExecutor;
    @Value(value="${iudex.planner.max-depth:3}")
    private int defaultMaxDepth = 3;
    @Value(value="${iudex.planner.max-children:4}")
    private int defaultMaxChildren = 4;
    @Value(value="${iudex.planner.max-parallelism:4}")
    private int maxParallelism = 4;
    @Value(value="${iudex.planner.max-tokens:400}")
    private int maxTokens = 400;

    public CognitivePlanner(GuardedLanguageModel languageModel, ComplexityHeuristic complexityHeuristic,
                            @Qualifier("branchExecutor") ExecutorService branchExecutor) {
        this.languageModel = languageModel;
        this.complexityHeuristic = complexityHeuristic;
        this.branchExecutor = branchExecutor;
    }

    @PostConstruct
    public void init() {
        log.info("Cognitive planner initialized (maxDepth={}, maxChildren={}, maxParallelism={}, minQueryLength={}, wordThreshold={})",
                this.defaultMaxDepth, this.defaultMaxChildren, this.maxParallelism,
                this.complexityHeuristic.getMinQueryLength(), this.complexityHeuristic.getWordThreshold());
    }

    public CognitiveTree plan(String query) {
        return this.plan(query, this.defaultMaxDepth, this.defaultMaxChildren, RequestContext.detached(Query.of(query, "default")));
    }

    public CognitiveTree plan(String query, int maxDepth, int maxChildren) {
        return this.plan(query, maxDepth, maxChildren, RequestContext.detached(Query.of(query, "default")));
    }

    /**
     * Builds and freezes the tree. A failed expansion ends the affected node; an exhausted budget
     * stops expansion and returns the partial tree, frozen, with a warning.
     */
    public CognitiveTree plan(String query, int maxDepth, int maxChildren, RequestContext context) {
        long startTime = System.currentTimeMillis();
        CognitiveTree tree = new CognitiveTree(query);
        if (maxDepth <= 1 || !this.complexityHeuristic.isComplex(query)) {
            tree.markEnd(tree.getRootId());
            tree.freeze();
            this.record(context, tree, "simple", 0, startTime);
            return tree;
        }

        int limit = Math.max(1, maxChildren);
        PlanningConditions conditions = this.extractConditions(query, context);
        List<MindMapNode> frontier = List.of(tree.root());
        String stoppedBy = null;
        while (!frontier.isEmpty() && stoppedBy == null) {
            Set<String> existing = tree.questions();
            List<BoundedFanOut.Outcome<List<String>>> outcomes = BoundedFanOut.run(frontier,
                    node -> this.decompose(node, existing, conditions, limit, context),
                    this.maxParallelism, this.branchExecutor, context.budget());
            List<MindMapNode> next = new ArrayList<>();
            for (int i = 0; i < frontier.size(); i++) {
                MindMapNode parent = frontier.get(i);
                BoundedFanOut.Outcome<List<String>> outcome = outcomes.get(i);
                if (!outcome.isSuccess()) {
                    tree.markEnd(parent.getId());
                    if (outcome.error() instanceof BudgetExceededException budgetError) {
                        stoppedBy = budgetError.getMessage();
                    } else if (outcome.timedOut()) {
                        stoppedBy = "request deadline reached while expanding " + parent.getId();
                    } else {
                        context.addWarning("planner: decomposition failed for node " + parent.getId() + ", treated as leaf");
                        if (log.isWarnEnabled()) {
                            log.warn("Planner: decomposition failed for node {}: {}", parent.getId(),
                                    LogSanitizer.sanitize(outcome.error().getMessage()));
                        }
                    }
                    continue;
                }
                int added = 0;
                NodeState childState = parent.getLevel() + 1 >= maxDepth - 1 ? NodeState.END : NodeState.CONTINUE;
                for (String question : outcome.value()) {
                    if (added >= limit) {
                        break;
                    }
                    MindMapNode child = tree.addChild(parent.getId(), question, childState);
                    if (child == null) {
                        continue;
                    }
                    added++;
                    if (childState == NodeState.CONTINUE) {
                        next.add(child);
                    }
                }
                if (added == 0) {
                    tree.markEnd(parent.getId());
                }
            }
            frontier = next;
        }
        int forced = tree.freeze();
        if (stoppedBy != null) {
            context.addWarning("planner: expansion stopped early (" + stoppedBy + ")");
            log.warn("Planner: expansion stopped early for {}: {}", LogSanitizer.querySummary(query), stoppedBy);
        }
        this.record(context, tree, stoppedBy != null ? "partial" : "decomposed", forced, startTime);
        return tree;
    }

    PlanningConditions extractConditions(String query, RequestContext context) {
        String prompt = "Analyse the legal question below and extract its context.\n\n"
                + "Question: " + query + "\n\n"
                + "Return only JSON in the form {\"conditions\": [...], \"themes\": [...], \"key_entities\": [...]} where "
                + "conditions are factual or procedural premises, themes are the legal subjects involved and "
                + "key_entities are statutes, courts or parties named or implied.";
        try {
            context.budget().acquireLlmCall("planning");
            String response = this.languageModel.complete(context, "planning", prompt, this.maxTokens, 0.1);
            context.budget().recordUsage(prompt, response);
            JsonNode json = ModelJson.parseObject(response);
            return new PlanningConditions(textList(json.path("conditions")), textList(json.path("themes")),
                    textList(json.path("key_entities")));
        } catch (RuntimeException e) {
            log.warn("Planner: conditions extraction failed for {}: {}", LogSanitizer.querySummary(query), e.getMessage());
            context.addWarning("planner: conditions extraction failed, decomposing without context");
            return PlanningConditions.EMPTY;
        }
    }

    List<String> decompose(MindMapNode node, Set<String> existing, PlanningConditions conditions, int maxChildren, RequestContext context) {
        context.budget().checkDeadline("planning");
        String prompt = this.buildDecompositionPrompt(node, existing, conditions, maxChildren);
        context.budget().acquireLlmCall("planning");
        String response = this.languageModel.complete(context, "planning", prompt, this.maxTokens, 0.2);
        context.budget().recordUsage(prompt, response);
        return parseSubQuestions(response, maxChildren);
    }

    private String buildDecompositionPrompt(MindMapNode node, Set<String> existing, PlanningConditions conditions, int maxChildren) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Break the legal question below into between 2 and ").append(maxChildren)
                .append(" narrower sub-questions that can each be answered from legal sources on their own.\n\n");
        prompt.append("Question: ").append(node.getQuestion()).append("\n");
        if (!conditions.isEmpty()) {
            prompt.append("Conditions: ").append(String.join("; ", conditions.conditions())).append("\n");
            prompt.append("Themes: ").append(String.join("; ", conditions.themes())).append("\n");
            prompt.append("Key entities: ").append(String.join("; ", conditions.keyEntities())).append("\n");
        }
        prompt.append("\nDo not repeat any of these existing questions:\n");
        for (String question : existing) {
            prompt.append("- ").append(question).append("\n");
        }
        prompt.append("\nReturn only JSON in the form {\"sub_questions\": [{\"question\": \"...\", \"type\": \"norm|case_law|concept|procedure\"}]}. ");
        prompt.append("Return an empty list when the question cannot be split further.");
        return prompt.toString();
    }

    /**
     * Accepts {@code {"sub_questions": [...]}} where each entry is an object with {@code question}
     * (or {@code pergunta}) or a plain string.
     */
    static List<String> parseSubQuestions(String response, int maxChildren) {
        JsonNode json = ModelJson.parseObject(response);
        JsonNode items = json.path("sub_questions");
        if (!items.isArray()) {
            items = json.path("subquestions");
        }
        List<String> questions = new ArrayList<>();
        for (JsonNode item : items) {
            String text;
            if (item.isTextual()) {
                text = item.asText();
            } else if (item.hasNonNull("question")) {
                text = item.get("question").asText();
            } else {
                text = item.path("pergunta").asText("");
            }
            if (!text.isBlank() && questions.size() < maxChildren) {
                questions.add(text.trim());
            }
        }
        return questions;
    }

    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode item : node) {
                if (item.isValueNode() && !item.asText().isBlank()) {
                    values.add(item.asText().trim());
                }
            }
        } else if (node.isTextual() && !node.asText().isBlank()) {
            values.add(node.asText().trim());
        }
        return values;
    }

    private void record(RequestContext context, CognitiveTree tree, String path, int forced, long startTime) {
        long elapsed = System.currentTimeMillis() - startTime;
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("path", path);
        data.put("nodes", tree.size());
        data.put("leaves", tree.leaves().size());
        data.put("depth", tree.depth());
        data.put("forcedEnd", forced);
        context.trace().addStep(ReasoningStep.StepType.PLANNING, "Cognitive decomposition",
                String.format("%s: %d nodes, %d leaves, depth %d", path, tree.size(), tree.leaves().size(), tree.depth()),
                elapsed, data);
        log.info("Planner: {} tree with {} nodes ({} leaves) in {}ms", path, tree.size(), tree.leaves().size(), elapsed);
    }
}
