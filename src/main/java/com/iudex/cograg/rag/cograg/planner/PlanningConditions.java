package com.iudex.cograg.rag.cograg.planner;

import java.util.List;

/**
 * Context extracted once from the root query and shared by every decomposition prompt.
 */
public record PlanningConditions(List<String> conditions, List<String> themes, List<String> keyEntities) {
    public static final PlanningConditions EMPTY = new PlanningConditions(List.of(), List.of(), List.of());

    public PlanningConditions {
        conditions = List.copyOf(conditions);
        themes = List.copyOf(themes);
        keyEntities = List.copyOf(keyEntities);
    }

    public boolean isEmpty() {
        return this.conditions.isEmpty() && this.themes.isEmpty() && this.keyEntities.isEmpty();
    }
}
