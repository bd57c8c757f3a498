package com.jreinhal.tieredrag.routing;

import com.jreinhal.tieredrag.embedding.EmbeddingProvider;
import com.jreinhal.tieredrag.kb.KnowledgeBase;
import com.jreinhal.tieredrag.kb.KnowledgeBaseRepository;
import com.jreinhal.tieredrag.reasoning.ReasoningStep;
import com.jreinhal.tieredrag.reasoning.TraceSink;
import com.jreinhal.tieredrag.util.LogSanitizer;
import com.jreinhal.tieredrag.util.VectorMath;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Picks the knowledge base whose description embedding is closest to a query.
 *
 * <p>The descriptor index is an immutable list published through an {@link AtomicReference}.
 * Readers take a snapshot and never lock; {@link #rebuild()} builds a fresh list and swaps it
 * in, so a route never sees a half-built index. The index is loaded from MongoDB on first
 * use and rebuilt whenever a knowledge base is created, updated or deleted.</p>
 */
@Service
public class SemanticRouter {
    private static final Logger log = LoggerFactory.getLogger(SemanticRouter.class);

    private final KnowledgeBaseRepository repository;
    private final EmbeddingProvider embeddingProvider;
    private final AtomicReference<List<KnowledgeBaseDescriptor>> index = new AtomicReference<>();

    @Value("${tieredrag.routing.similarity-floor:0.5}")
    private double similarityFloor = 0.5;

    public SemanticRouter(KnowledgeBaseRepository repository, EmbeddingProvider embeddingProvider) {
        this.repository = repository;
        this.embeddingProvider = embeddingProvider;
    }

    /**
     * Best descriptor at or above {@code floor}. Ties go to the earlier descriptor in the list.
     */
    public static RouteDecision route(float[] queryEmbedding, List<KnowledgeBaseDescriptor> descriptors, double floor) {
        if (queryEmbedding == null || descriptors == null || descriptors.isEmpty()) {
            return RouteDecision.none(0.0);
        }
        String bestName = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (KnowledgeBaseDescriptor descriptor : descriptors) {
            double score = VectorMath.cosine(queryEmbedding, descriptor.embedding());
            if (score > bestScore) {
                bestScore = score;
                bestName = descriptor.name();
            }
        }
        if (bestScore >= floor) {
            return new RouteDecision(bestName, bestScore);
        }
        return RouteDecision.none(bestScore);
    }

    /**
     * All descriptors at or above {@code floor}, best first, at most {@code topK}. Equal
     * scores keep list order.
     */
    public static List<RouteMatch> rank(float[] queryEmbedding, List<KnowledgeBaseDescriptor> descriptors,
                                        double floor, int topK) {
        if (queryEmbedding == null || descriptors == null || descriptors.isEmpty() || topK <= 0) {
            return List.of();
        }
        List<RouteMatch> matches = new ArrayList<>();
        for (KnowledgeBaseDescriptor descriptor : descriptors) {
            double score = VectorMath.cosine(queryEmbedding, descriptor.embedding());
            if (score >= floor) {
                matches.add(new RouteMatch(descriptor.name(), score));
            }
        }
        // List.sort is stable, so registration order survives among ties.
        matches.sort(Comparator.comparingDouble(RouteMatch::similarity).reversed());
        return matches.size() > topK ? List.copyOf(matches.subList(0, topK)) : List.copyOf(matches);
    }

    public RouteDecision route(float[] queryEmbedding) {
        return route(queryEmbedding, descriptors(), this.similarityFloor);
    }

    /**
     * Embeds {@code queryText} and returns up to {@code topK} knowledge bases above the floor.
     * An empty list means no knowledge base matched.
     */
    public List<RouteMatch> route(String queryText, int topK, TraceSink trace) {
        TraceSink sink = TraceSink.orNoop(trace);
        if (queryText == null || queryText.isBlank()) {
            throw new IllegalArgumentException("Query is required");
        }
        long start = System.currentTimeMillis();
        List<KnowledgeBaseDescriptor> snapshot = descriptors();
        if (snapshot.isEmpty()) {
            sink.step(ReasoningStep.StepType.ROUTING, "Routing", "no knowledge bases registered",
                    System.currentTimeMillis() - start);
            return List.of();
        }
        float[] embedding = this.embeddingProvider.embed(queryText);
        List<RouteMatch> matches = rank(embedding, snapshot, this.similarityFloor, Math.max(1, topK));
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("candidates", snapshot.size());
        data.put("floor", this.similarityFloor);
        data.put("matches", matches.stream().map(RouteMatch::knowledgeBase).toList());
        String detail = matches.isEmpty()
                ? "no knowledge base above similarity floor " + this.similarityFloor
                : String.format("routed to %s (%.3f)", matches.get(0).knowledgeBase(), matches.get(0).similarity());
        sink.step(ReasoningStep.StepType.ROUTING, "Semantic routing", detail, System.currentTimeMillis() - start, data);
        if (log.isDebugEnabled()) {
            log.debug("Routed {} -> {}", LogSanitizer.querySummary(queryText), matches);
        }
        return matches;
    }

    /**
     * Current index snapshot, loading it on first use.
     */
    public List<KnowledgeBaseDescriptor> descriptors() {
        List<KnowledgeBaseDescriptor> current = this.index.get();
        if (current != null) {
            return current;
        }
        return rebuild();
    }

    /**
     * Reloads the index from the repository. Rebuilds are serialized; readers keep using the
     * previous snapshot until the new one is published.
     */
    public synchronized List<KnowledgeBaseDescriptor> rebuild() {
        List<KnowledgeBaseDescriptor> loaded = new ArrayList<>();
        for (KnowledgeBase kb : this.repository.findAllByOrderByCreatedAtAsc()) {
            if (kb.descriptionEmbedding() == null || kb.descriptionEmbedding().isEmpty()) {
                log.warn("Knowledge base {} has no description embedding; excluded from routing", kb.name());
                continue;
            }
            loaded.add(new KnowledgeBaseDescriptor(kb.name(), kb.description(), kb.category(),
                    VectorMath.toArray(kb.descriptionEmbedding())));
        }
        List<KnowledgeBaseDescriptor> snapshot = List.copyOf(loaded);
        this.index.set(snapshot);
        log.info("Routing index rebuilt with {} knowledge base(s)", snapshot.size());
        return snapshot;
    }

    public double getSimilarityFloor() {
        return this.similarityFloor;
    }
}
