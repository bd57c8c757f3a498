package com.jreinhal.tieredrag.retrieval;

import com.jreinhal.tieredrag.embedding.EmbeddingProvider;
import com.jreinhal.tieredrag.reasoning.ReasoningStep;
import com.jreinhal.tieredrag.reasoning.TraceSink;
import com.jreinhal.tieredrag.retrieval.rerank.RerankScorer;
import com.jreinhal.tieredrag.retrieval.sparse.SparseEmbeddingService;
import com.jreinhal.tieredrag.util.LogSanitizer;
import com.jreinhal.tieredrag.vector.ScoredChunkId;
import com.jreinhal.tieredrag.vector.StoredChunk;
import com.jreinhal.tieredrag.vector.VectorStore;
import com.jreinhal.tieredrag.vector.VectorStoreException;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Dense plus sparse retrieval over one knowledge base, fused with Reciprocal Rank Fusion,
 * optionally reranked and deduplicated, and rendered as a numbered, attributed context.
 *
 * <p>The two channels run concurrently on the retrieval pool and are joined under one
 * deadline. A failing or slow channel fails the search with
 * {@link SearchBackendUnavailableException}; a failing reranker only costs the rerank step,
 * recorded as a note on the result. All intermediate state is local to the call.</p>
 *
 * <p>Never routes: the caller supplies the knowledge base.</p>
 */
@Service
public class HybridRetriever {
    private static final Logger log = LoggerFactory.getLogger(HybridRetriever.class);
    private static final Comparator<SearchHit> RERANK_ORDER = Comparator
            .comparingDouble(SearchHit::finalScore).reversed()
            .thenComparing(Comparator.comparingDouble(SearchHit::rrfScore).reversed())
            .thenComparingInt(SearchHit::rrfRank);

    private final VectorStore vectorStore;
    private final EmbeddingProvider embeddingProvider;
    private final SparseEmbeddingService sparseEmbeddingService;
    private final RerankScorer rerankScorer;
    private final ExecutorService executor;

    @Value("${tieredrag.retrieval.rrf-k:60}")
    private int rrfK = ReciprocalRankFusion.DEFAULT_K;
    @Value("${tieredrag.retrieval.limit-multiplier:2}")
    private int limitMultiplier = 2;
    @Value("${tieredrag.retrieval.default-top-k:5}")
    private int defaultTopK = 5;
    @Value("${tieredrag.retrieval.max-top-k:50}")
    private int maxTopK = 50;
    @Value("${tieredrag.retrieval.search-timeout-seconds:8}")
    private int searchTimeoutSeconds = 8;
    @Value("${tieredrag.retrieval.rerank-threshold:0.0}")
    private double rerankThreshold = 0.0;
    @Value("${tieredrag.retrieval.dedup.similarity-threshold:0.85}")
    private double dedupThreshold = 0.85;
    @Value("${tieredrag.retrieval.dedup.shingle-size:3}")
    private int shingleSize = 3;
    private NearDuplicateFilter duplicateFilter;

    public HybridRetriever(VectorStore vectorStore, EmbeddingProvider embeddingProvider,
                           SparseEmbeddingService sparseEmbeddingService, RerankScorer rerankScorer,
                           @Qualifier("retrievalExecutor") ExecutorService executor) {
        this.vectorStore = vectorStore;
        this.embeddingProvider = embeddingProvider;
        this.sparseEmbeddingService = sparseEmbeddingService;
        this.rerankScorer = rerankScorer;
        this.executor = executor;
    }

    @PostConstruct
    public void init() {
        this.duplicateFilter = new NearDuplicateFilter(this.dedupThreshold, this.shingleSize);
        log.info("Hybrid retriever initialized (rrfK={}, limitMultiplier={}, timeout={}s, dedupThreshold={})",
                this.rrfK, this.limitMultiplier, this.searchTimeoutSeconds, this.dedupThreshold);
    }

    public int defaultTopK() {
        return this.defaultTopK;
    }

    public FusedResultSet search(HybridSearchRequest request, TraceSink trace) {
        TraceSink sink = TraceSink.orNoop(trace);
        String kb = request.knowledgeBase();
        if (kb == null || kb.isBlank()) {
            throw new IllegalArgumentException("A knowledge base is required for search");
        }
        String query = request.query() == null ? "" : request.query().strip();
        if (query.isEmpty()) {
            return FusedResultSet.empty(kb, query, List.of("empty query"), SearchStats.NONE);
        }
        long start = System.currentTimeMillis();
        int topK = Math.min(request.topK() > 0 ? request.topK() : this.defaultTopK, Math.max(1, this.maxTopK));
        int candidateLimit = (int) Math.min(Integer.MAX_VALUE, (long) topK * Math.max(1, this.limitMultiplier));
        List<String> notes = new ArrayList<>();

        Future<ChannelResult> denseFuture = null;
        Future<ChannelResult> sparseFuture = null;
        ChannelResult dense;
        ChannelResult sparse;
        try {
            denseFuture = this.executor.submit(timed(() -> {
                float[] vector = request.queryEmbedding() != null ? request.queryEmbedding() : this.embeddingProvider.embed(query);
                return this.vectorStore.denseSearch(kb, vector, candidateLimit);
            }));
            sparseFuture = this.executor.submit(timed(() -> {
                Map<String, Float> terms = request.sparseTerms() != null ? request.sparseTerms()
                        : this.sparseEmbeddingService.embedQuery(query);
                return terms.isEmpty() ? List.of() : this.vectorStore.sparseSearch(kb, terms, candidateLimit);
            }));
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(this.searchTimeoutSeconds);
            dense = denseFuture.get(remaining(deadline), TimeUnit.NANOSECONDS);
            sparse = sparseFuture.get(remaining(deadline), TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            cancel(denseFuture, sparseFuture);
            sink.step(ReasoningStep.StepType.ERROR, "Retrieval rejected", "retrieval pool saturated", 0L);
            throw new SearchBackendUnavailableException("Retrieval pool saturated", e);
        } catch (TimeoutException e) {
            cancel(denseFuture, sparseFuture);
            log.warn("Search in kb {} timed out after {}s for query {}", kb, this.searchTimeoutSeconds,
                    LogSanitizer.querySummary(query));
            sink.step(ReasoningStep.StepType.ERROR, "Retrieval timed out", this.searchTimeoutSeconds + "s", 0L);
            throw new SearchBackendUnavailableException("Search timed out after " + this.searchTimeoutSeconds + "s", e);
        } catch (ExecutionException e) {
            cancel(denseFuture, sparseFuture);
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Search backend failed in kb {}: {}", kb, cause.getMessage());
            sink.step(ReasoningStep.StepType.ERROR, "Retrieval failed", cause.getMessage(), 0L);
            throw new SearchBackendUnavailableException("Search backend unavailable: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel(denseFuture, sparseFuture);
            throw new SearchBackendUnavailableException("Search interrupted", e);
        }
        sink.step(ReasoningStep.StepType.DENSE_RETRIEVAL, "Dense search", dense.hits().size() + " candidates",
                dense.durationMs());
        sink.step(ReasoningStep.StepType.SPARSE_RETRIEVAL, "Sparse search", sparse.hits().size() + " candidates",
                sparse.durationMs());

        long fusionStart = System.currentTimeMillis();
        List<ReciprocalRankFusion.Candidate> fused = ReciprocalRankFusion.fuse(dense.hits(), sparse.hits(), this.rrfK);
        int fusedCount = fused.size();
        if (fused.size() > candidateLimit) {
            fused = fused.subList(0, candidateLimit);
        }
        sink.step(ReasoningStep.StepType.RRF_FUSION, "RRF fusion",
                fusedCount + " unique chunks, kept " + fused.size(), System.currentTimeMillis() - fusionStart,
                Map.of("k", this.rrfK));
        if (dense.hits().isEmpty() != sparse.hits().isEmpty()) {
            notes.add((dense.hits().isEmpty() ? "dense" : "sparse") + " search returned no candidates");
        }

        List<SearchHit> hits = resolveHits(fused, notes);
        if (hits.isEmpty()) {
            return FusedResultSet.empty(kb, query, notes,
                    new SearchStats(dense.hits().size(), sparse.hits().size(), fusedCount, 0,
                            System.currentTimeMillis() - start));
        }

        boolean rerankApplied = false;
        if (request.useRerank()) {
            List<SearchHit> reranked = rerank(query, hits, notes, sink);
            rerankApplied = reranked != null;
            if (rerankApplied) {
                hits = reranked;
            }
        }

        int duplicatesRemoved = 0;
        if (request.deduplicate()) {
            long dedupStart = System.currentTimeMillis();
            List<SearchHit> unique = this.duplicateFilter.filter(hits);
            duplicatesRemoved = hits.size() - unique.size();
            hits = unique;
            sink.step(ReasoningStep.StepType.DEDUPLICATION, "Deduplication", duplicatesRemoved + " removed",
                    System.currentTimeMillis() - dedupStart);
        }
        if (hits.size() > topK) {
            hits = hits.subList(0, topK);
        }

        long elapsed = System.currentTimeMillis() - start;
        SearchStats stats = new SearchStats(dense.hits().size(), sparse.hits().size(), fusedCount, duplicatesRemoved, elapsed);
        sink.metric("hits", hits.size());
        sink.metric("search_ms", elapsed);
        log.info("Hybrid search in kb {} for query {}: dense={}, sparse={}, fused={}, returned={} in {}ms",
                kb, LogSanitizer.querySummary(query), dense.hits().size(), sparse.hits().size(), fusedCount,
                hits.size(), elapsed);
        return new FusedResultSet(kb, query, hits, ContextFormatter.format(hits), ContextFormatter.sourceSummary(hits),
                notes, rerankApplied, stats);
    }

    private List<SearchHit> resolveHits(List<ReciprocalRankFusion.Candidate> fused, List<String> notes) {
        if (fused.isEmpty()) {
            return List.of();
        }
        Map<String, StoredChunk> chunks;
        try {
            chunks = this.vectorStore.fetchChunks(fused.stream().map(ReciprocalRankFusion.Candidate::chunkId).toList());
        } catch (VectorStoreException e) {
            throw new SearchBackendUnavailableException("Search backend unavailable: " + e.getMessage(), e);
        }
        List<SearchHit> hits = new ArrayList<>(fused.size());
        int rank = 0;
        for (ReciprocalRankFusion.Candidate candidate : fused) {
            rank++;
            StoredChunk chunk = chunks.get(candidate.chunkId());
            if (chunk == null) {
                continue;
            }
            hits.add(new SearchHit(candidate.chunkId(), chunk.text(),
                    new ChunkSource(chunk.source(), chunk.page(), chunk.section()),
                    candidate.denseScore(), candidate.sparseScore(), candidate.rrfScore(), rank, null));
        }
        if (hits.size() < fused.size()) {
            notes.add((fused.size() - hits.size()) + " candidate(s) no longer in the store");
        }
        return hits;
    }

    /**
     * Returns the reranked list, or null when reranking was skipped.
     */
    private List<SearchHit> rerank(String query, List<SearchHit> hits, List<String> notes, TraceSink sink) {
        long start = System.currentTimeMillis();
        List<Double> scores;
        try {
            scores = this.rerankScorer.score(query, hits.stream().map(SearchHit::text).toList());
            if (scores == null || scores.size() != hits.size()) {
                throw new IllegalStateException("reranker returned " + (scores == null ? 0 : scores.size())
                        + " scores for " + hits.size() + " passages");
            }
        } catch (RuntimeException e) {
            log.warn("Reranking skipped for query {}: {}", LogSanitizer.querySummary(query), e.getMessage());
            notes.add("reranking skipped: " + e.getMessage());
            sink.step(ReasoningStep.StepType.RERANK, "Reranking skipped", e.getMessage(),
                    System.currentTimeMillis() - start);
            return null;
        }
        List<SearchHit> reranked = new ArrayList<>(hits.size());
        int dropped = 0;
        for (int i = 0; i < hits.size(); i++) {
            Double score = scores.get(i);
            double value = score == null || score.isNaN() ? 0.0 : score;
            if (this.rerankThreshold > 0.0 && value < this.rerankThreshold) {
                dropped++;
                continue;
            }
            reranked.add(hits.get(i).withRerankScore(value));
        }
        reranked.sort(RERANK_ORDER);
        if (dropped > 0) {
            notes.add(dropped + " hit(s) below rerank threshold " + this.rerankThreshold);
        }
        sink.step(ReasoningStep.StepType.RERANK, "Reranking", hits.size() + " passages scored",
                System.currentTimeMillis() - start);
        return reranked;
    }

    private static Callable<ChannelResult> timed(Callable<List<ScoredChunkId>> search) {
        return () -> {
            long start = System.currentTimeMillis();
            List<ScoredChunkId> hits = search.call();
            return new ChannelResult(hits == null ? List.of() : hits, System.currentTimeMillis() - start);
        };
    }

    private static long remaining(long deadlineNanos) {
        return Math.max(0L, deadlineNanos - System.nanoTime());
    }

    private static void cancel(Future<?>... futures) {
        for (Future<?> future : futures) {
            if (future != null) {
                future.cancel(true);
            }
        }
    }

    private record ChannelResult(List<ScoredChunkId> hits, long durationMs) {
    }
}
