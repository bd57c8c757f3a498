package com.jreinhal.tieredrag.kb;

import com.jreinhal.tieredrag.embedding.EmbeddingProvider;
import com.jreinhal.tieredrag.exception.ResourceConflictException;
import com.jreinhal.tieredrag.exception.ResourceNotFoundException;
import com.jreinhal.tieredrag.routing.SemanticRouter;
import com.jreinhal.tieredrag.util.VectorMath;
import com.jreinhal.tieredrag.vector.VectorStore;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class KnowledgeBaseService {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeBaseService.class);
    private static final Pattern VALID_NAME = Pattern.compile("^[A-Za-z0-9_-]{1,64}$");
    private static final int MAX_DESCRIPTION_LENGTH = 2000;
    private static final String DEFAULT_CATEGORY = "general";

    private final KnowledgeBaseRepository repository;
    private final EmbeddingProvider embeddingProvider;
    private final VectorStore vectorStore;
    private final SemanticRouter router;

    public KnowledgeBaseService(KnowledgeBaseRepository repository, EmbeddingProvider embeddingProvider,
                                VectorStore vectorStore, SemanticRouter router) {
        this.repository = repository;
        this.embeddingProvider = embeddingProvider;
        this.vectorStore = vectorStore;
        this.router = router;
    }

    public KnowledgeBaseSummary create(KnowledgeBaseCreateRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Knowledge base request is required");
        }
        String name = validateName(request.name());
        String description = validateDescription(request.description());
        if (this.repository.existsById(name)) {
            throw new ResourceConflictException("Knowledge base already exists: " + name);
        }
        float[] embedding = this.embeddingProvider.embed(description);
        Instant now = Instant.now();
        KnowledgeBase saved = this.repository.save(new KnowledgeBase(name, description, category(request.category()),
                VectorMath.toList(embedding), now, now));
        this.router.rebuild();
        log.info("Knowledge base created: {}", name);
        return toSummary(saved, 0L);
    }

    public KnowledgeBaseSummary get(String name) {
        KnowledgeBase kb = require(name);
        return toSummary(kb, this.vectorStore.countChunks(kb.name()));
    }

    public List<KnowledgeBaseSummary> list() {
        return this.repository.findAllByOrderByCreatedAtAsc().stream()
                .map(kb -> toSummary(kb, this.vectorStore.countChunks(kb.name())))
                .toList();
    }

    /**
     * Updates description and/or category. The description embedding is recomputed only
     * when the description text actually changes.
     */
    public KnowledgeBaseSummary update(String name, KnowledgeBaseUpdateRequest request) {
        KnowledgeBase existing = require(name);
        if (request == null) {
            throw new IllegalArgumentException("Knowledge base request is required");
        }
        String description = existing.description();
        List<Double> embedding = existing.descriptionEmbedding();
        if (request.description() != null) {
            String candidate = validateDescription(request.description());
            if (!Objects.equals(candidate, existing.description())) {
                description = candidate;
                embedding = VectorMath.toList(this.embeddingProvider.embed(candidate));
            }
        }
        String category = request.category() != null ? category(request.category()) : existing.category();
        KnowledgeBase saved = this.repository.save(new KnowledgeBase(existing.name(), description, category,
                embedding, existing.createdAt(), Instant.now()));
        this.router.rebuild();
        log.info("Knowledge base updated: {} (re-embedded={})", saved.name(), embedding != existing.descriptionEmbedding());
        return toSummary(saved, this.vectorStore.countChunks(saved.name()));
    }

    /**
     * Removes the knowledge base and all of its chunks.
     *
     * @return number of chunks deleted
     */
    public long delete(String name) {
        KnowledgeBase kb = require(name);
        long chunks = this.vectorStore.deleteKnowledgeBase(kb.name());
        this.repository.deleteById(kb.name());
        this.router.rebuild();
        log.info("Knowledge base deleted: {} ({} chunks)", kb.name(), chunks);
        return chunks;
    }

    public KnowledgeBase require(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Knowledge base name is required");
        }
        return this.repository.findById(name)
                .orElseThrow(() -> new ResourceNotFoundException("Knowledge base not found: " + name));
    }

    private static String validateName(String name) {
        if (name == null || !VALID_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Knowledge base name must be 1-64 letters, digits, '_' or '-'");
        }
        return name;
    }

    private static String validateDescription(String description) {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Knowledge base description is required");
        }
        String trimmed = description.trim();
        if (trimmed.length() > MAX_DESCRIPTION_LENGTH) {
            throw new IllegalArgumentException("Knowledge base description is too long");
        }
        return trimmed;
    }

    private static String category(String category) {
        return category == null || category.isBlank() ? DEFAULT_CATEGORY : category.trim();
    }

    private static KnowledgeBaseSummary toSummary(KnowledgeBase kb, long chunkCount) {
        return new KnowledgeBaseSummary(kb.name(), kb.description(), kb.category(), chunkCount,
                kb.createdAt(), kb.updatedAt());
    }

    public record KnowledgeBaseCreateRequest(String name, String description, String category) {
    }

    public record KnowledgeBaseUpdateRequest(String description, String category) {
    }

    public record KnowledgeBaseSummary(String name, String description, String category, long chunkCount,
                                       Instant createdAt, Instant updatedAt) {
    }
}
