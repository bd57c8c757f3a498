package com.jreinhal.tieredrag.reasoning;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Steps and metrics recorded for one ingestion, search or chat request.
 */
public class ReasoningTrace implements TraceSink {

    private final String traceId;
    private final Instant timestamp;
    private final String operation;
    private final String subject;
    private final List<ReasoningStep> steps = new ArrayList<>();
    private final Map<String, Object> metrics = new LinkedHashMap<>();
    private long totalDurationMs;
    private volatile boolean completed;

    public ReasoningTrace(String operation, String subject) {
        this.traceId = UUID.randomUUID().toString().substring(0, 8);
        this.timestamp = Instant.now();
        this.operation = operation;
        this.subject = subject;
    }

    @Override
    public synchronized void step(ReasoningStep step) {
        steps.add(step);
        totalDurationMs += step.durationMs();
    }

    @Override
    public synchronized void metric(String key, Object value) {
        metrics.put(key, value);
    }

    void complete() {
        this.completed = true;
    }

    public String getTraceId() {
        return traceId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getOperation() {
        return operation;
    }

    public synchronized List<ReasoningStep> getSteps() {
        return List.copyOf(steps);
    }

    public synchronized Map<String, Object> getMetrics() {
        return new LinkedHashMap<>(metrics);
    }

    public synchronized long getTotalDurationMs() {
        return totalDurationMs;
    }

    public boolean isCompleted() {
        return completed;
    }

    public synchronized Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("traceId", traceId);
        map.put("timestamp", timestamp.toString());
        map.put("operation", operation);
        map.put("subject", subject);
        map.put("totalDurationMs", totalDurationMs);
        map.put("completed", completed);
        List<Map<String, Object>> stepMaps = new ArrayList<>();
        for (ReasoningStep step : steps) {
            Map<String, Object> stepMap = new LinkedHashMap<>();
            stepMap.put("type", step.type().name());
            stepMap.put("label", step.label());
            stepMap.put("detail", step.detail());
            stepMap.put("durationMs", step.durationMs());
            if (!step.data().isEmpty()) {
                stepMap.put("data", step.data());
            }
            stepMaps.add(stepMap);
        }
        map.put("steps", stepMaps);
        map.put("metrics", new LinkedHashMap<>(metrics));
        return map;
    }
}
