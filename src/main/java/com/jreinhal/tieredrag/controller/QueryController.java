package com.jreinhal.tieredrag.controller;

import com.jreinhal.tieredrag.answer.AnswerResult;
import com.jreinhal.tieredrag.answer.ConversationTurn;
import com.jreinhal.tieredrag.answer.RagAnswerService;
import com.jreinhal.tieredrag.exception.ResourceNotFoundException;
import com.jreinhal.tieredrag.reasoning.ReasoningTrace;
import com.jreinhal.tieredrag.reasoning.ReasoningTracer;
import com.jreinhal.tieredrag.reasoning.TraceSink;
import com.jreinhal.tieredrag.retrieval.FusedResultSet;
import com.jreinhal.tieredrag.retrieval.SearchHit;
import com.jreinhal.tieredrag.retrieval.SearchStats;
import com.jreinhal.tieredrag.routing.RouteMatch;
import com.jreinhal.tieredrag.routing.SemanticRouter;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Query")
@RequestMapping(value={"/api"})
public class QueryController {
    private final RagAnswerService answerService;
    private final SemanticRouter router;
    private final ReasoningTracer tracer;
    @Value("${tieredrag.retrieval.max-top-k:50}")
    private int maxTopK = 50;

    public QueryController(RagAnswerService answerService, SemanticRouter router, ReasoningTracer tracer) {
        this.answerService = answerService;
        this.router = router;
        this.tracer = tracer;
    }

    @PostMapping("/search")
    public ResponseEntity<SearchResponse> search(@RequestBody SearchRequest request) {
        requireQuery(request == null ? null : request.query());
        requireTopK(request.topK());
        ReasoningTrace trace = this.tracer.start("search", request.knowledgeBase());
        try {
            FusedResultSet result = this.answerService.search(request.knowledgeBase(), request.query(), request.topK(),
                    request.useRerank() == null || request.useRerank(),
                    request.deduplicate() == null || request.deduplicate(), TraceSink.orNoop(trace));
            return ResponseEntity.ok(SearchResponse.from(result, traceId(trace)));
        } finally {
            this.tracer.complete(trace);
        }
    }

    @PostMapping("/route")
    public ResponseEntity<RouteResponse> route(@RequestBody RouteRequest request) {
        requireQuery(request == null ? null : request.query());
        ReasoningTrace trace = this.tracer.start("route", null);
        try {
            int topK = request.topK() != null && request.topK() > 0 ? request.topK() : 1;
            List<RouteMatch> matches = this.router.route(request.query(), topK, TraceSink.orNoop(trace));
            String best = matches.isEmpty() ? null : matches.get(0).knowledgeBase();
            return ResponseEntity.ok(new RouteResponse(best, matches, traceId(trace)));
        } finally {
            this.tracer.complete(trace);
        }
    }

    @PostMapping("/chat")
    public ResponseEntity<ChatResponse> chat(@RequestBody ChatRequest request) {
        requireQuery(request == null ? null : request.query());
        requireTopK(request.topK());
        ReasoningTrace trace = this.tracer.start("chat", request.knowledgeBase());
        try {
            AnswerResult result = this.answerService.answer(request.knowledgeBase(), request.query(), request.topK(),
                    request.history(), TraceSink.orNoop(trace));
            FusedResultSet retrieval = result.retrieval();
            return ResponseEntity.ok(new ChatResponse(result.answer(), result.knowledgeBase(),
                    retrieval.sourceSummary(), retrieval.notes(), result.degraded(), traceId(trace)));
        } finally {
            this.tracer.complete(trace);
        }
    }

    @GetMapping("/traces/{traceId}")
    public ResponseEntity<Map<String, Object>> trace(@PathVariable String traceId) {
        return this.tracer.find(traceId)
                .map(trace -> ResponseEntity.ok(trace.toMap()))
                .orElseThrow(() -> new ResourceNotFoundException("Trace not found: " + traceId));
    }

    private static void requireQuery(String query) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query is required");
        }
    }

    private void requireTopK(Integer topK) {
        if (topK != null && topK > this.maxTopK) {
            throw new IllegalArgumentException("topK must not exceed " + this.maxTopK);
        }
    }

    private static String traceId(ReasoningTrace trace) {
        return trace != null ? trace.getTraceId() : null;
    }

    public record SearchRequest(String knowledgeBase, String query, Integer topK, Boolean useRerank,
                                Boolean deduplicate) {
    }

    public record SearchResponse(String knowledgeBase, String query, List<SearchHit> hits, String formattedContext,
                                 Map<String, Integer> sourceSummary, List<String> notes, boolean rerankApplied,
                                 SearchStats stats, String traceId) {

        static SearchResponse from(FusedResultSet result, String traceId) {
            return new SearchResponse(result.knowledgeBase(), result.query(), result.hits(), result.formattedContext(),
                    result.sourceSummary(), result.notes(), result.rerankApplied(), result.stats(), traceId);
        }
    }

    public record RouteRequest(String query, Integer topK) {
    }

    public record RouteResponse(String knowledgeBase, List<RouteMatch> matches, String traceId) {
    }

    public record ChatRequest(String knowledgeBase, String query, Integer topK, List<ConversationTurn> history) {
    }

    public record ChatResponse(String answer, String knowledgeBase, Map<String, Integer> sources, List<String> notes,
                               boolean degraded, String traceId) {
    }
}
