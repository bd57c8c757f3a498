package com.jreinhal.tieredrag.ingest;

import com.jreinhal.tieredrag.extraction.CancellationSignal;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Cancellation handles for uploads still being processed, keyed by a caller-chosen
 * operation id. Entries exist only while the upload runs.
 */
@Component
public class InFlightIngestions {
    private static final Logger log = LoggerFactory.getLogger(InFlightIngestions.class);
    private static final Pattern SAFE_OPERATION_ID = Pattern.compile("^[a-zA-Z0-9\\-_.]{1,64}$");

    private final Map<String, CancellationSignal> signals = new ConcurrentHashMap<>();

    /**
     * @throws IllegalArgumentException if the id is malformed or already in use
     */
    public CancellationSignal register(String operationId) {
        if (operationId == null || !SAFE_OPERATION_ID.matcher(operationId).matches()) {
            throw new IllegalArgumentException("Operation id must be 1-64 letters, digits, '.', '_' or '-'");
        }
        CancellationSignal signal = new CancellationSignal();
        if (this.signals.putIfAbsent(operationId, signal) != null) {
            throw new IllegalArgumentException("Operation id already in use: " + operationId);
        }
        return signal;
    }

    public boolean cancel(String operationId) {
        CancellationSignal signal = operationId == null ? null : this.signals.get(operationId);
        if (signal == null) {
            return false;
        }
        signal.cancel();
        log.info("Cancellation requested for ingestion {}", operationId);
        return true;
    }

    public void release(String operationId, CancellationSignal signal) {
        if (operationId != null) {
            this.signals.remove(operationId, signal);
        }
    }
}
