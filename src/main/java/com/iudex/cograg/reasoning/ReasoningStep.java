package com.iudex.cograg.reasoning;

import java.util.Map;

public record ReasoningStep(StepType type, String label, String detail, long durationMs, Map<String, Object> data) {

    public static ReasoningStep of(StepType type, String label, String detail, long durationMs) {
        return new ReasoningStep(type, label, detail, durationMs, Map.of());
    }

    public static ReasoningStep of(StepType type, String label, String detail, long durationMs, Map<String, Object> data) {
        return new ReasoningStep(type, label, detail, durationMs, data == null ? Map.of() : Map.copyOf(data));
    }

    public enum StepType {
        MEMORY_RECALL,
        CLASSIFICATION,
        FUSION,
        RERANK,
        CRAG_GATE,
        CRAG_RETRY,
        PLANNING,
        REFINEMENT,
        REASONING,
        VERIFICATION,
        INTEGRATION,
        MEMORY_STORE,
        TIMEOUT,
        ERROR
    }
}
