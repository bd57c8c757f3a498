package com.jreinhal.tieredrag.vector;

import com.jreinhal.tieredrag.constant.ChunkMetadata;
import com.jreinhal.tieredrag.util.VectorMath;
import com.mongodb.client.result.DeleteResult;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

/**
 * MongoDB-backed chunk store. Similarity is computed in the service over the candidate
 * chunks of one knowledge base: cosine for dense search, weight dot-product for sparse
 * search after a {@code sparseTerms $in} prefilter.
 */
@Component
public class MongoVectorStore implements VectorStore {
    private static final Logger log = LoggerFactory.getLogger(MongoVectorStore.class);
    static final String COLLECTION_NAME = "kb_chunks";
    private static final Comparator<ScoredChunkId> BY_SCORE = Comparator.comparingDouble(ScoredChunkId::score)
            .reversed()
            .thenComparing(ScoredChunkId::chunkId);

    private final MongoTemplate mongoTemplate;

    public MongoVectorStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public List<ScoredChunkId> denseSearch(String knowledgeBase, float[] vector, int limit) {
        if (vector == null || vector.length == 0 || limit <= 0) {
            return List.of();
        }
        Query query = Query.query(Criteria.where("kb").is(knowledgeBase));
        query.fields().include("_id", "embedding");
        List<ChunkRecord> candidates = find(query, "dense search");
        List<ScoredChunkId> scored = new ArrayList<>(candidates.size());
        for (ChunkRecord candidate : candidates) {
            float[] embedding = VectorMath.toArray(candidate.getEmbedding());
            if (embedding.length != vector.length) {
                continue;
            }
            scored.add(new ScoredChunkId(candidate.getId(), VectorMath.cosine(vector, embedding)));
        }
        scored.sort(BY_SCORE);
        log.debug("Dense search over {} chunks in kb {}", candidates.size(), knowledgeBase);
        return scored.size() > limit ? List.copyOf(scored.subList(0, limit)) : scored;
    }

    @Override
    public List<ScoredChunkId> sparseSearch(String knowledgeBase, Map<String, Float> terms, int limit) {
        if (terms == null || terms.isEmpty() || limit <= 0) {
            return List.of();
        }
        Map<String, Float> queryWeights = new HashMap<>();
        terms.forEach((term, weight) -> queryWeights.merge(termKey(term), weight, Float::sum));
        Query query = Query.query(Criteria.where("kb").is(knowledgeBase).and("sparseTerms").in(queryWeights.keySet()));
        query.fields().include("_id", "sparseWeights");
        List<ChunkRecord> candidates = find(query, "sparse search");
        List<ScoredChunkId> scored = new ArrayList<>(candidates.size());
        for (ChunkRecord candidate : candidates) {
            Map<String, Double> weights = candidate.getSparseWeights();
            if (weights == null) {
                continue;
            }
            double score = 0.0;
            for (Map.Entry<String, Float> term : queryWeights.entrySet()) {
                Double weight = weights.get(term.getKey());
                if (weight != null) {
                    score += weight * term.getValue();
                }
            }
            if (score > 0.0) {
                scored.add(new ScoredChunkId(candidate.getId(), score));
            }
        }
        scored.sort(BY_SCORE);
        return scored.size() > limit ? List.copyOf(scored.subList(0, limit)) : scored;
    }

    @Override
    public Map<String, StoredChunk> fetchChunks(Collection<String> chunkIds) {
        if (chunkIds == null || chunkIds.isEmpty()) {
            return Map.of();
        }
        Query query = Query.query(Criteria.where("_id").in(chunkIds));
        query.fields().include("_id", "kb", "text", "metadata");
        Map<String, StoredChunk> chunks = new LinkedHashMap<>();
        for (ChunkRecord record : find(query, "fetch")) {
            chunks.put(record.getId(), new StoredChunk(record.getId(), record.getKb(), record.getText(),
                    record.getMetadata()));
        }
        return chunks;
    }

    @Override
    public void upsert(String knowledgeBase, List<IndexedChunk> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            return;
        }
        try {
            Instant now = Instant.now();
            for (IndexedChunk chunk : chunks) {
                List<Double> embedding = VectorMath.toList(chunk.embedding());
                Map<String, Double> sparseWeights = new HashMap<>();
                chunk.sparseWeights().forEach((term, weight) -> sparseWeights.merge(termKey(term), weight.doubleValue(), Double::sum));
                ChunkRecord record = new ChunkRecord();
                record.setId(chunk.id());
                record.setKb(knowledgeBase);
                record.setText(chunk.text());
                record.setMetadata(new HashMap<>(chunk.metadata()));
                record.setSource(String.valueOf(chunk.metadata().getOrDefault(ChunkMetadata.SOURCE, "unknown")));
                record.setEmbedding(embedding);
                record.setEmbeddingNorm(VectorMath.norm(embedding));
                record.setSparseWeights(sparseWeights);
                record.setSparseTerms(new ArrayList<>(sparseWeights.keySet()));
                record.setCreatedAt(now);
                this.mongoTemplate.save(record, COLLECTION_NAME);
            }
            log.info("Persisted {} chunks to knowledge base {}", chunks.size(), knowledgeBase);
        } catch (DataAccessException e) {
            log.error("Failed to persist chunks to knowledge base {}", knowledgeBase, e);
            throw new VectorStoreException("Failed to save chunks: " + e.getMessage(), e);
        }
    }

    @Override
    public long deleteKnowledgeBase(String knowledgeBase) {
        return remove(Query.query(Criteria.where("kb").is(knowledgeBase)), "knowledge base " + knowledgeBase);
    }

    @Override
    public long deleteSource(String knowledgeBase, String source) {
        return remove(Query.query(Criteria.where("kb").is(knowledgeBase).and("source").is(source)), "source");
    }

    @Override
    public long deleteSourceExcept(String knowledgeBase, String source, Collection<String> keepIds) {
        return remove(Query.query(Criteria.where("kb").is(knowledgeBase).and("source").is(source)
                .and("_id").nin(keepIds)), "stale chunks");
    }

    @Override
    public List<SourceSummary> listSources(String knowledgeBase) {
        Query query = Query.query(Criteria.where("kb").is(knowledgeBase));
        query.fields().include("_id", "source", "metadata", "createdAt");
        Map<String, List<ChunkRecord>> bySource = new LinkedHashMap<>();
        for (ChunkRecord record : find(query, "list sources")) {
            bySource.computeIfAbsent(record.getSource(), key -> new ArrayList<>()).add(record);
        }
        List<SourceSummary> summaries = new ArrayList<>();
        bySource.forEach((source, records) -> {
            Map<String, Object> meta = records.get(0).getMetadata() != null ? records.get(0).getMetadata() : Map.of();
            Instant uploadedAt = records.stream().map(ChunkRecord::getCreatedAt)
                    .filter(Objects::nonNull).min(Comparator.naturalOrder()).orElse(null);
            summaries.add(new SourceSummary(source, records.size(),
                    meta.get(ChunkMetadata.TIER_USED) != null ? meta.get(ChunkMetadata.TIER_USED).toString() : null,
                    asDouble(meta.get(ChunkMetadata.QUALITY_SCORE)),
                    asDouble(meta.get(ChunkMetadata.EXTRACTION_COST)),
                    uploadedAt));
        });
        summaries.sort(Comparator.comparing(SourceSummary::source));
        return summaries;
    }

    @Override
    public long countChunks(String knowledgeBase) {
        try {
            return this.mongoTemplate.count(Query.query(Criteria.where("kb").is(knowledgeBase)), COLLECTION_NAME);
        } catch (DataAccessException e) {
            throw new VectorStoreException("Failed to count chunks: " + e.getMessage(), e);
        }
    }

    /**
     * Field names in MongoDB may not contain '.' or start with '$'.
     */
    static String termKey(String term) {
        String key = term.replace('.', '\uFF0E');
        return key.startsWith("$") ? "\uFF04" + key.substring(1) : key;
    }

    private List<ChunkRecord> find(Query query, String operation) {
        try {
            return this.mongoTemplate.find(query, ChunkRecord.class, COLLECTION_NAME);
        } catch (DataAccessException e) {
            log.error("Vector store {} failed: {}", operation, e.getMessage());
            throw new VectorStoreException("Vector store " + operation + " failed: " + e.getMessage(), e);
        }
    }

    private long remove(Query query, String what) {
        try {
            DeleteResult result = this.mongoTemplate.remove(query, COLLECTION_NAME);
            log.info("Deleted {} chunks for {}", result.getDeletedCount(), what);
            return result.getDeletedCount();
        } catch (DataAccessException e) {
            throw new VectorStoreException("Failed to delete chunks: " + e.getMessage(), e);
        }
    }

    private static Double asDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return null;
    }

    public static class ChunkRecord {
        @Id
        private String id;
        private String kb;
        private String text;
        private Map<String, Object> metadata;
        private String source;
        private List<Double> embedding;
        private double embeddingNorm;
        private Map<String, Double> sparseWeights;
        private List<String> sparseTerms;
        private Instant createdAt;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getKb() {
            return kb;
        }

        public void setKb(String kb) {
            this.kb = kb;
        }

        public String getText() {
            return text;
        }

        public void setText(String text) {
            this.text = text;
        }

        public Map<String, Object> getMetadata() {
            return metadata;
        }

        public void setMetadata(Map<String, Object> metadata) {
            this.metadata = metadata;
        }

        public String getSource() {
            return source;
        }

        public void setSource(String source) {
            this.source = source;
        }

        public List<Double> getEmbedding() {
            return embedding;
        }

        public void setEmbedding(List<Double> embedding) {
            this.embedding = embedding;
        }

        public double getEmbeddingNorm() {
            return embeddingNorm;
        }

        public void setEmbeddingNorm(double embeddingNorm) {
            this.embeddingNorm = embeddingNorm;
        }

        public Map<String, Double> getSparseWeights() {
            return sparseWeights;
        }

        public void setSparseWeights(Map<String, Double> sparseWeights) {
            this.sparseWeights = sparseWeights;
        }

        public List<String> getSparseTerms() {
            return sparseTerms;
        }

        public void setSparseTerms(List<String> sparseTerms) {
            this.sparseTerms = sparseTerms;
        }

        public Instant getCreatedAt() {
            return createdAt;
        }

        public void setCreatedAt(Instant createdAt) {
            this.createdAt = createdAt;
        }
    }
}
