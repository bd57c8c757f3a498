package com.jreinhal.tieredrag.answer;

import com.jreinhal.tieredrag.reasoning.ReasoningStep;
import com.jreinhal.tieredrag.reasoning.TraceSink;
import com.jreinhal.tieredrag.retrieval.FusedResultSet;
import com.jreinhal.tieredrag.retrieval.HybridRetriever;
import com.jreinhal.tieredrag.retrieval.HybridSearchRequest;
import com.jreinhal.tieredrag.retrieval.SearchStats;
import com.jreinhal.tieredrag.routing.RouteMatch;
import com.jreinhal.tieredrag.routing.SemanticRouter;
import com.jreinhal.tieredrag.util.LogSanitizer;
import com.jreinhal.tieredrag.util.SimpleCircuitBreaker;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Query-time entry point: resolves the knowledge base (routing when the caller names none),
 * runs hybrid retrieval and, for chat, generates an answer grounded in the retrieved context.
 */
@Service
public class RagAnswerService {
    private static final Logger log = LoggerFactory.getLogger(RagAnswerService.class);
    static final String NO_MATCHING_KB = "no knowledge base matched the query";
    static final String NO_RELEVANT_INFORMATION = "No relevant information was found in the knowledge base.";
    private static final int MAX_HISTORY_TURNS = 10;
    private static final String SYSTEM_PROMPT = """
            You answer questions using only the numbered context passages provided.
            Cite passages by their number in square brackets, e.g. [1].
            If the context does not contain the answer, say that the documents do not cover it.
            """;

    private final HybridRetriever retriever;
    private final SemanticRouter router;
    private final ChatClient chatClient;
    private final ExecutorService executor;

    @Value("${tieredrag.answer.timeout-seconds:60}")
    private long timeoutSeconds = 60L;
    @Value("${tieredrag.answer.circuit-breaker.failure-threshold:3}")
    private int failureThreshold = 3;
    @Value("${tieredrag.answer.circuit-breaker.open-seconds:30}")
    private long openSeconds = 30L;
    private SimpleCircuitBreaker circuitBreaker;

    public RagAnswerService(HybridRetriever retriever, SemanticRouter router, ChatClient.Builder chatClientBuilder,
                            @Qualifier("generationExecutor") ExecutorService executor) {
        this.retriever = retriever;
        this.router = router;
        this.chatClient = chatClientBuilder.build();
        this.executor = executor;
    }

    @PostConstruct
    public void init() {
        this.circuitBreaker = new SimpleCircuitBreaker("llm-answer", this.failureThreshold,
                Duration.ofSeconds(this.openSeconds), 1);
    }

    /**
     * Hybrid search. With no knowledge base given, the best routed one is searched; if none
     * matches, the result is empty with a note.
     */
    public FusedResultSet search(String knowledgeBase, String query, Integer topK, boolean useRerank,
                                 boolean deduplicate, TraceSink trace) {
        TraceSink sink = TraceSink.orNoop(trace);
        int k = topK != null && topK > 0 ? topK : this.retriever.defaultTopK();
        String kb = knowledgeBase;
        if (kb == null || kb.isBlank()) {
            if (query == null || query.isBlank()) {
                return FusedResultSet.empty(null, query, List.of("empty query"), SearchStats.NONE);
            }
            List<RouteMatch> matches = this.router.route(query, 1, sink);
            if (matches.isEmpty()) {
                return FusedResultSet.empty(null, query, List.of(NO_MATCHING_KB), SearchStats.NONE);
            }
            kb = matches.get(0).knowledgeBase();
        }
        return this.retriever.search(HybridSearchRequest.of(kb, query, k, useRerank, deduplicate), sink);
    }

    public AnswerResult answer(String knowledgeBase, String query, Integer topK, List<ConversationTurn> history,
                               TraceSink trace) {
        TraceSink sink = TraceSink.orNoop(trace);
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query is required");
        }
        FusedResultSet retrieval = search(knowledgeBase, query, topK, true, true, sink);
        if (retrieval.isEmpty()) {
            sink.step(ReasoningStep.StepType.GENERATION, "Answer generation", "skipped: no relevant context", 0L);
            return new AnswerResult(NO_RELEVANT_INFORMATION, retrieval.knowledgeBase(), retrieval, false);
        }
        if (!this.circuitBreaker.allowRequest()) {
            sink.step(ReasoningStep.StepType.GENERATION, "Answer generation", "skipped: circuit open", 0L);
            return new AnswerResult(degradedAnswer(retrieval), retrieval.knowledgeBase(), retrieval, true);
        }
        long start = System.currentTimeMillis();
        String userMessage = buildUserMessage(query, retrieval.formattedContext(), history);
        Future<String> future = null;
        try {
            future = this.executor.submit(() -> this.chatClient.prompt()
                    .system(SYSTEM_PROMPT)
                    .user(userMessage)
                    .call()
                    .content());
            String content = future.get(this.timeoutSeconds, TimeUnit.SECONDS);
            if (content == null || content.isBlank()) {
                throw new IllegalStateException("empty model response");
            }
            this.circuitBreaker.recordSuccess();
            sink.step(ReasoningStep.StepType.GENERATION, "Answer generation", content.length() + " chars",
                    System.currentTimeMillis() - start);
            log.info("Answered {} from {} using {} passage(s)", LogSanitizer.querySummary(query),
                    retrieval.knowledgeBase(), retrieval.hits().size());
            return new AnswerResult(content.trim(), retrieval.knowledgeBase(), retrieval, false);
        }
        catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return generationFailed(retrieval, sink, start, "interrupted");
        }
        catch (TimeoutException e) {
            future.cancel(true);
            return generationFailed(retrieval, sink, start, "timeout after " + this.timeoutSeconds + "s");
        }
        catch (RejectedExecutionException e) {
            return generationFailed(retrieval, sink, start, "generation pool saturated");
        }
        catch (ExecutionException | RuntimeException e) {
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            return generationFailed(retrieval, sink, start, cause.getMessage());
        }
    }

    private AnswerResult generationFailed(FusedResultSet retrieval, TraceSink sink, long start, String reason) {
        this.circuitBreaker.recordFailure();
        log.warn("Answer generation failed ({}); returning source listing", LogSanitizer.sanitize(reason));
        sink.step(ReasoningStep.StepType.ERROR, "Answer generation failed", LogSanitizer.sanitize(reason),
                System.currentTimeMillis() - start);
        return new AnswerResult(degradedAnswer(retrieval), retrieval.knowledgeBase(), retrieval, true);
    }

    static String degradedAnswer(FusedResultSet retrieval) {
        String sources = retrieval.sourceSummary().entrySet().stream()
                .map(e -> e.getKey() + " (" + e.getValue() + ")")
                .collect(Collectors.joining(", "));
        return "The answer service is currently unavailable. Relevant passages were found in: " + sources + ".";
    }

    static String buildUserMessage(String query, String context, List<ConversationTurn> history) {
        StringBuilder message = new StringBuilder();
        if (history != null && !history.isEmpty()) {
            message.append("Conversation so far:\n");
            List<ConversationTurn> recent = history.size() > MAX_HISTORY_TURNS
                    ? history.subList(history.size() - MAX_HISTORY_TURNS, history.size())
                    : history;
            for (ConversationTurn turn : recent) {
                if (turn == null || turn.content() == null || turn.content().isBlank()) {
                    continue;
                }
                message.append(turn.fromUser() ? "User: " : "Assistant: ").append(turn.content().trim()).append('\n');
            }
            message.append('\n');
        }
        message.append("Context:\n").append(context).append("\n\n");
        message.append("Question: ").append(query.trim());
        return message.toString();
    }

    SimpleCircuitBreaker.State circuitState() {
        return this.circuitBreaker.getState();
    }
}
