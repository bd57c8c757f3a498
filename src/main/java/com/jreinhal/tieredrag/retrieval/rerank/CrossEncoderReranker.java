package com.jreinhal.tieredrag.retrieval.rerank;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.jreinhal.tieredrag.constant.StopWords;
import com.jreinhal.tieredrag.embedding.EmbeddingProvider;
import com.jreinhal.tieredrag.embedding.EmbeddingUnavailableException;
import com.jreinhal.tieredrag.util.VectorMath;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Relevance scorer with three modes:
 * <ul>
 *   <li>{@code dedicated}: cosine between the query embedding and a joint query/passage embedding</li>
 *   <li>{@code llm}: asks the chat model for a 0.0-1.0 relevance rating, in parallel batches</li>
 *   <li>{@code keyword}: share of query terms present in the passage</li>
 * </ul>
 * A failing pair degrades to its keyword score. A backend that is down as a whole, or a batch
 * that misses its deadline, raises {@link RerankUnavailableException}.
 */
@Component
public class CrossEncoderReranker implements RerankScorer {
    private static final Logger log = LoggerFactory.getLogger(CrossEncoderReranker.class);
    private static final Pattern SCORE_PATTERN = Pattern.compile("(0\\.\\d+|1\\.0|0|1)");
    private static final Pattern TERM_SPLIT = Pattern.compile("\\W+");
    private static final Set<String> STOP_WORDS = StopWords.RERANKER;
    private static final int MAX_PASSAGE_CHARS = 1000;

    private final ChatClient chatClient;
    private final ExecutorService executor;
    private final EmbeddingProvider embeddingProvider;
    @Value("${tieredrag.reranker.batch-size:5}")
    private int batchSize;
    @Value("${tieredrag.reranker.timeout-seconds:30}")
    private int timeoutSeconds;
    @Value("${tieredrag.reranker.mode:dedicated}")
    private String rerankerMode;
    @Value("${tieredrag.reranker.cache-size:2000}")
    private int cacheSize;
    @Value("${tieredrag.reranker.cache-ttl-seconds:900}")
    private long cacheTtlSeconds;
    private Cache<String, Double> scoreCache;
    private RerankerMode mode = RerankerMode.DEDICATED;

    public CrossEncoderReranker(ChatClient.Builder builder, @Qualifier("rerankerExecutor") ExecutorService executor,
                                EmbeddingProvider embeddingProvider) {
        this.chatClient = builder.build();
        this.executor = executor;
        this.embeddingProvider = embeddingProvider;
    }

    @PostConstruct
    public void init() {
        if (this.cacheSize > 0 && this.cacheTtlSeconds > 0) {
            this.scoreCache = Caffeine.newBuilder()
                    .maximumSize(this.cacheSize)
                    .expireAfterWrite(Duration.ofSeconds(this.cacheTtlSeconds))
                    .build();
        }
        this.mode = resolveRerankerMode();
        log.info("Cross-encoder reranker initialized (mode={}, batchSize={}, timeout={}s)",
                this.mode, this.batchSize, this.timeoutSeconds);
    }

    @Override
    public List<Double> score(String query, List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        long start = System.currentTimeMillis();
        List<Double> scores = switch (this.mode) {
            case DEDICATED -> scoreWithDedicatedModel(query, texts);
            case LLM -> scoreWithLlm(query, texts);
            case KEYWORD -> texts.stream().map(text -> scoreWithKeywords(query, text)).toList();
        };
        log.debug("Reranked {} passages in {}ms ({})", texts.size(), System.currentTimeMillis() - start, this.mode);
        return scores;
    }

    private RerankerMode resolveRerankerMode() {
        String configured = this.rerankerMode != null ? this.rerankerMode.trim().toUpperCase(Locale.ROOT) : "";
        try {
            return configured.isEmpty() ? RerankerMode.DEDICATED : RerankerMode.valueOf(configured);
        } catch (IllegalArgumentException e) {
            log.warn("Unknown reranker mode '{}'; using dedicated", this.rerankerMode);
            return RerankerMode.DEDICATED;
        }
    }

    private List<Double> scoreWithDedicatedModel(String query, List<String> texts) {
        float[] queryEmbedding;
        try {
            queryEmbedding = this.embeddingProvider.embed("query: " + query);
        } catch (EmbeddingUnavailableException e) {
            throw new RerankUnavailableException("embedding backend unavailable", e);
        }
        List<Double> scores = new ArrayList<>(texts.size());
        for (String text : texts) {
            String cacheKey = buildCacheKey(query, text);
            Double cached = cached(cacheKey);
            if (cached != null) {
                scores.add(cached);
                continue;
            }
            try {
                float[] pairEmbedding = this.embeddingProvider.embed("query: " + query + "\ndocument: " + truncate(text));
                if (pairEmbedding.length != queryEmbedding.length) {
                    scores.add(scoreWithKeywords(query, text));
                    continue;
                }
                double cosine = VectorMath.cosine(queryEmbedding, pairEmbedding);
                double score = Math.max(0.0, Math.min(1.0, (cosine + 1.0) / 2.0));
                cache(cacheKey, score);
                scores.add(score);
            } catch (EmbeddingUnavailableException e) {
                log.debug("Dedicated scoring failed for a passage, using keyword score: {}", e.getMessage());
                scores.add(scoreWithKeywords(query, text));
            }
        }
        return scores;
    }

    private List<Double> scoreWithLlm(String query, List<String> texts) {
        List<Double> scores = new ArrayList<>(texts.size());
        int step = Math.max(1, this.batchSize);
        for (int i = 0; i < texts.size(); i += step) {
            List<String> batch = texts.subList(i, Math.min(i + step, texts.size()));
            List<Future<Double>> futures = new ArrayList<>(batch.size());
            try {
                for (String text : batch) {
                    futures.add(this.executor.submit(() -> llmScore(query, text)));
                }
                long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(this.timeoutSeconds);
                for (Future<Double> future : futures) {
                    scores.add(future.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS));
                }
            } catch (RejectedExecutionException e) {
                cancelAll(futures);
                throw new RerankUnavailableException("reranker pool saturated", e);
            } catch (TimeoutException e) {
                cancelAll(futures);
                throw new RerankUnavailableException("backend timeout after " + this.timeoutSeconds + "s", e);
            } catch (ExecutionException e) {
                cancelAll(futures);
                throw new RerankUnavailableException("scoring failed: " + e.getCause(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelAll(futures);
                throw new RerankUnavailableException("interrupted", e);
            }
        }
        return scores;
    }

    private Double llmScore(String query, String text) {
        String cacheKey = buildCacheKey(query, text);
        Double cached = cached(cacheKey);
        if (cached != null) {
            return cached;
        }
        try {
            String promptText = String.format("Rate the relevance of this document to the query on a scale of 0.0 to 1.0.%n%nQUERY: %s%n%nDOCUMENT:%n%s%n%nRespond with ONLY a number between 0.0 and 1.0, nothing else.%n0.0 = completely irrelevant%n0.5 = somewhat relevant%n1.0 = highly relevant%n%nScore:", query, truncate(text));
            String response = this.chatClient.prompt().user(promptText).call().content();
            double score = parseScore(response);
            cache(cacheKey, score);
            return score;
        } catch (RuntimeException e) {
            log.debug("LLM scoring failed for a passage, using keyword score: {}", e.getMessage());
            return scoreWithKeywords(query, text);
        }
    }

    double parseScore(String response) {
        if (response == null || response.isEmpty()) {
            return 0.5;
        }
        Matcher matcher = SCORE_PATTERN.matcher(response.trim());
        if (matcher.find()) {
            try {
                return Math.max(0.0, Math.min(1.0, Double.parseDouble(matcher.group(1))));
            } catch (NumberFormatException e) {
                log.debug("Cross-encoder score parse failed: {}", response);
            }
        }
        return 0.5;
    }

    double scoreWithKeywords(String query, String text) {
        String lowerContent = text != null ? text.toLowerCase(Locale.ROOT) : "";
        int totalTerms = 0;
        int matchedTerms = 0;
        for (String term : TERM_SPLIT.split(query.toLowerCase(Locale.ROOT))) {
            if (term.length() <= 2 || STOP_WORDS.contains(term)) {
                continue;
            }
            totalTerms++;
            if (lowerContent.contains(term)) {
                matchedTerms++;
            }
        }
        return totalTerms > 0 ? (double) matchedTerms / totalTerms : 0.0;
    }

    private Double cached(String cacheKey) {
        return this.scoreCache != null ? this.scoreCache.getIfPresent(cacheKey) : null;
    }

    private void cache(String cacheKey, double score) {
        if (this.scoreCache != null) {
            this.scoreCache.put(cacheKey, score);
        }
    }

    private String buildCacheKey(String query, String text) {
        String content = text != null ? text : "";
        return this.mode + "|" + query + "|" + content.length() + "|" + content.hashCode();
    }

    private static String truncate(String text) {
        String content = text != null ? text : "";
        return content.length() > MAX_PASSAGE_CHARS ? content.substring(0, MAX_PASSAGE_CHARS) + "..." : content;
    }

    private static void cancelAll(List<Future<Double>> futures) {
        for (Future<Double> future : futures) {
            future.cancel(true);
        }
    }

    private enum RerankerMode {
        DEDICATED,
        LLM,
        KEYWORD
    }
}
