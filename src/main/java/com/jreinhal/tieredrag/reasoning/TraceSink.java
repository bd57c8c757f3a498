package com.jreinhal.tieredrag.reasoning;

import java.util.Map;

/**
 * Receives the decision steps of one operation. Passed explicitly to the operation that
 * records into it; there is no ambient "current" sink.
 */
public interface TraceSink {

    TraceSink NOOP = new TraceSink() {
        @Override
        public void step(ReasoningStep step) {
        }

        @Override
        public void metric(String key, Object value) {
        }
    };

    void step(ReasoningStep step);

    void metric(String key, Object value);

    default void step(ReasoningStep.StepType type, String label, String detail, long durationMs) {
        step(ReasoningStep.of(type, label, detail, durationMs));
    }

    default void step(ReasoningStep.StepType type, String label, String detail, long durationMs,
                      Map<String, Object> data) {
        step(new ReasoningStep(type, label, detail, durationMs, data));
    }

    static TraceSink orNoop(TraceSink sink) {
        return sink == null ? NOOP : sink;
    }
}
