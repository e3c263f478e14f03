package com.iudex.cograg.reasoning;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Ordered record of the stages one request went through.
 *
 * <p>Leaf branches append concurrently, so steps from different branches interleave in
 * completion order.</p>
 */
public class ReasoningTrace {

    private final String traceId;
    private final Instant timestamp;
    private final String tenantId;
    private final String querySummary;
    private final List<ReasoningStep> steps = new CopyOnWriteArrayList<>();
    private final Map<String, Object> metrics = new ConcurrentHashMap<>();
    private final AtomicLong totalDurationMs = new AtomicLong();
    private volatile boolean completed;

    public ReasoningTrace(String tenantId, String querySummary) {
        this.traceId = UUID.randomUUID().toString().substring(0, 8);
        this.timestamp = Instant.now();
        this.tenantId = tenantId;
        this.querySummary = querySummary;
    }

    public void addStep(ReasoningStep step) {
        this.steps.add(step);
        this.totalDurationMs.addAndGet(step.durationMs());
    }

    public void addStep(ReasoningStep.StepType type, String label, String detail, long durationMs) {
        this.addStep(ReasoningStep.of(type, label, detail, durationMs));
    }

    public void addStep(ReasoningStep.StepType type, String label, String detail, long durationMs, Map<String, Object> data) {
        this.addStep(ReasoningStep.of(type, label, detail, durationMs, data));
    }

    public void addMetric(String key, Object value) {
        if (key != null && value != null) {
            this.metrics.put(key, value);
        }
    }

    public void complete() {
        this.completed = true;
    }

    public String getTraceId() {
        return this.traceId;
    }

    public Instant getTimestamp() {
        return this.timestamp;
    }

    public String getTenantId() {
        return this.tenantId;
    }

    public List<ReasoningStep> getSteps() {
        return Collections.unmodifiableList(this.steps);
    }

    public Map<String, Object> getMetrics() {
        return Collections.unmodifiableMap(this.metrics);
    }

    /**
     * Sum of step durations. Concurrent branches overlap, so this can exceed wall-clock time.
     */
    public long getTotalDurationMs() {
        return this.totalDurationMs.get();
    }

    public boolean isCompleted() {
        return this.completed;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("traceId", this.traceId);
        map.put("timestamp", this.timestamp.toString());
        map.put("tenantId", this.tenantId);
        map.put("query", this.querySummary);
        map.put("totalDurationMs", this.totalDurationMs.get());
        map.put("completed", this.completed);
        List<Map<String, Object>> stepMaps = new ArrayList<>();
        for (ReasoningStep step : this.steps) {
            Map<String, Object> stepMap = new LinkedHashMap<>();
            stepMap.put("type", step.type().name().toLowerCase());
            stepMap.put("label", step.label());
            stepMap.put("detail", step.detail());
            stepMap.put("durationMs", step.durationMs());
            if (!step.data().isEmpty()) {
                stepMap.put("data", step.data());
            }
            stepMaps.add(stepMap);
        }
        map.put("steps", stepMaps);
        if (!this.metrics.isEmpty()) {
            map.put("metrics", new LinkedHashMap<>(this.metrics));
        }
        return map;
    }

    public String getSummary() {
        return String.format("Trace[%s]: %d steps, %dms total, %s",
                this.traceId, this.steps.size(), this.totalDurationMs.get(), this.completed ? "COMPLETED" : "IN_PROGRESS");
    }
}
