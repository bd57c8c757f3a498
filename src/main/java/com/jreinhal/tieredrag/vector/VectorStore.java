package com.jreinhal.tieredrag.vector;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Chunk storage with dense and sparse similarity search, scoped by knowledge base.
 * Implementations report backend failures as {@link VectorStoreException}.
 */
public interface VectorStore {

    /**
     * Chunks of {@code knowledgeBase} ordered by descending vector similarity.
     */
    List<ScoredChunkId> denseSearch(String knowledgeBase, float[] vector, int limit);

    /**
     * Chunks of {@code knowledgeBase} ordered by descending term-overlap score; chunks sharing
     * no term with {@code terms} are not returned.
     */
    List<ScoredChunkId> sparseSearch(String knowledgeBase, Map<String, Float> terms, int limit);

    /**
     * Batch lookup; ids with no stored chunk are absent from the result.
     */
    Map<String, StoredChunk> fetchChunks(Collection<String> chunkIds);

    default Optional<StoredChunk> fetchText(String chunkId) {
        return Optional.ofNullable(fetchChunks(List.of(chunkId)).get(chunkId));
    }

    void upsert(String knowledgeBase, List<IndexedChunk> chunks);

    long deleteKnowledgeBase(String knowledgeBase);

    long deleteSource(String knowledgeBase, String source);

    /**
     * Removes chunks of {@code source} whose ids are not in {@code keepIds}; used after a
     * re-ingest has upserted the new chunk set.
     */
    long deleteSourceExcept(String knowledgeBase, String source, Collection<String> keepIds);

    List<SourceSummary> listSources(String knowledgeBase);

    long countChunks(String knowledgeBase);
}
