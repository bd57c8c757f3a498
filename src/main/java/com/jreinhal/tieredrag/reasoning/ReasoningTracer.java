package com.jreinhal.tieredrag.reasoning;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Creates traces and keeps recently completed ones for lookup by id.
 *
 * <p>A trace is handed to the traced operation as a {@link TraceSink} argument; this
 * component holds no per-thread state.</p>
 */
@Component
public class ReasoningTracer {
    private static final Logger log = LoggerFactory.getLogger(ReasoningTracer.class);

    @Value("${tieredrag.trace.enabled:true}")
    private boolean enabled;
    @Value("${tieredrag.trace.cache-size:500}")
    private int cacheSize;
    @Value("${tieredrag.trace.ttl-minutes:30}")
    private long ttlMinutes;
    private Cache<String, ReasoningTrace> completedTraces;

    @PostConstruct
    public void init() {
        this.completedTraces = Caffeine.newBuilder()
                .maximumSize(Math.max(1, this.cacheSize))
                .expireAfterWrite(Duration.ofMinutes(Math.max(1L, this.ttlMinutes)))
                .build();
        log.info("Reasoning tracer initialized (enabled={}, cacheSize={})", this.enabled, this.cacheSize);
    }

    /**
     * Starts a trace, or returns {@code null} when tracing is disabled. Pass the result
     * through {@link TraceSink#orNoop(TraceSink)} when handing it to an operation.
     */
    public ReasoningTrace start(String operation, String subject) {
        if (!this.enabled) {
            return null;
        }
        ReasoningTrace trace = new ReasoningTrace(operation, subject);
        log.debug("Started {} trace {}", operation, trace.getTraceId());
        return trace;
    }

    public void complete(ReasoningTrace trace) {
        if (trace == null) {
            return;
        }
        trace.complete();
        this.completedTraces.put(trace.getTraceId(), trace);
        log.debug("Completed trace {} ({} steps, {}ms)", trace.getTraceId(), trace.getSteps().size(),
                trace.getTotalDurationMs());
    }

    public Optional<ReasoningTrace> find(String traceId) {
        if (traceId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(this.completedTraces.getIfPresent(traceId));
    }

    public boolean isEnabled() {
        return this.enabled;
    }
}
