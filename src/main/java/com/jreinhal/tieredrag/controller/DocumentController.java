package com.jreinhal.tieredrag.controller;

import com.jreinhal.tieredrag.extraction.CancellationSignal;
import com.jreinhal.tieredrag.extraction.ExtractionAttempt;
import com.jreinhal.tieredrag.extraction.ExtractionResult;
import com.jreinhal.tieredrag.extraction.ExtractionTier;
import com.jreinhal.tieredrag.ingest.DocumentIngestionService;
import com.jreinhal.tieredrag.ingest.InFlightIngestions;
import com.jreinhal.tieredrag.ingest.IngestionReport;
import com.jreinhal.tieredrag.reasoning.ReasoningTrace;
import com.jreinhal.tieredrag.reasoning.ReasoningTracer;
import com.jreinhal.tieredrag.reasoning.TraceSink;
import com.jreinhal.tieredrag.vector.SourceSummary;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.io.IOException;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@Tag(name = "Documents")
public class DocumentController {
    private final DocumentIngestionService ingestionService;
    private final InFlightIngestions inFlight;
    private final ReasoningTracer tracer;

    public DocumentController(DocumentIngestionService ingestionService, InFlightIngestions inFlight,
                              ReasoningTracer tracer) {
        this.ingestionService = ingestionService;
        this.inFlight = inFlight;
        this.tracer = tracer;
    }

    /**
     * Uploads a document. Supplying {@code operationId} lets the caller cancel the upload
     * through {@code DELETE /api/ingestions/{operationId}} while it runs.
     */
    @PostMapping("/api/kb/{name}/documents")
    public ResponseEntity<IngestionResponse> upload(@PathVariable String name,
                                                    @RequestParam("file") MultipartFile file,
                                                    @RequestParam(value = "targetQuality", required = false) Double targetQuality,
                                                    @RequestParam(value = "tiers", required = false) List<String> tiers,
                                                    @RequestParam(value = "operationId", required = false) String operationId)
            throws IOException {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("File is required");
        }
        Set<ExtractionTier> tierSet = parseTiers(tiers);
        CancellationSignal cancellation = operationId != null ? this.inFlight.register(operationId) : CancellationSignal.none();
        ReasoningTrace trace = this.tracer.start("ingest", name);
        try {
            IngestionReport report = this.ingestionService.ingest(name, file.getOriginalFilename(), file.getBytes(),
                    targetQuality, tierSet, cancellation, TraceSink.orNoop(trace));
            return ResponseEntity.status(HttpStatus.CREATED)
                    .body(IngestionResponse.from(report, trace != null ? trace.getTraceId() : null));
        } finally {
            this.tracer.complete(trace);
            if (operationId != null) {
                this.inFlight.release(operationId, cancellation);
            }
        }
    }

    @DeleteMapping("/api/ingestions/{operationId}")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String operationId) {
        if (!this.inFlight.cancel(operationId)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("operationId", operationId, "cancelled", false));
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("operationId", operationId, "cancelled", true));
    }

    @GetMapping("/api/kb/{name}/documents")
    public ResponseEntity<List<SourceSummary>> list(@PathVariable String name) {
        return ResponseEntity.ok(this.ingestionService.listDocuments(name));
    }

    @DeleteMapping("/api/kb/{name}/documents/{filename}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable String name, @PathVariable String filename) {
        long deleted = this.ingestionService.deleteDocument(name, filename);
        return ResponseEntity.ok(Map.of("filename", filename, "chunksDeleted", deleted));
    }

    static Set<ExtractionTier> parseTiers(List<String> tiers) {
        if (tiers == null || tiers.isEmpty()) {
            return null;
        }
        Set<ExtractionTier> parsed = EnumSet.noneOf(ExtractionTier.class);
        for (String value : tiers) {
            for (String part : value.split(",")) {
                if (!part.isBlank()) {
                    parsed.add(ExtractionTier.fromString(part));
                }
            }
        }
        return parsed.isEmpty() ? null : parsed;
    }

    public record AttemptView(String tier, double qualityScore, String recommendation, int pages, double cost,
                              long durationMs, List<String> issues) {

        static AttemptView from(ExtractionAttempt attempt) {
            return new AttemptView(attempt.tier().configKey(), attempt.score(),
                    attempt.quality().recommendation().label(), attempt.pages().size(), attempt.cost(),
                    attempt.duration().toMillis(), attempt.quality().issues());
        }
    }

    public record IngestionResponse(String knowledgeBase, String filename, int chunkCount, AttemptView selected,
                                    List<AttemptView> attempts, List<String> tiersTried, Map<String, String> failures,
                                    String escalationReason, boolean cancelled, double totalCost, String traceId) {

        static IngestionResponse from(IngestionReport report, String traceId) {
            ExtractionResult extraction = report.extraction();
            Map<String, String> failures = new LinkedHashMap<>();
            extraction.failures().forEach((tier, reason) -> failures.put(tier.configKey(), reason));
            return new IngestionResponse(report.knowledgeBase(), report.filename(), report.chunkCount(),
                    AttemptView.from(extraction.selected()),
                    extraction.attempts().stream().map(AttemptView::from).toList(),
                    extraction.tiersTried().stream().map(ExtractionTier::configKey).toList(),
                    failures, extraction.escalationReason(), extraction.cancelled(), extraction.totalCost(), traceId);
        }
    }
}
