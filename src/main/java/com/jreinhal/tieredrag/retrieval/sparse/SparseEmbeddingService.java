package com.jreinhal.tieredrag.retrieval.sparse;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Sparse term weights for chunks at ingestion time and for queries at search time.
 *
 * <p>Uses the learned sparse sidecar when it is enabled and answering, otherwise local
 * lexical weights, so sparse search always has a representation to work with.</p>
 */
@Service
public class SparseEmbeddingService {
    private static final Logger log = LoggerFactory.getLogger(SparseEmbeddingService.class);

    private final SparseEmbeddingClient client;

    public SparseEmbeddingService(SparseEmbeddingClient client) {
        this.client = client;
    }

    public Map<String, Float> embedQuery(String query) {
        if (query == null || query.isBlank()) {
            return Map.of();
        }
        if (client.isEnabled()) {
            List<SparseBatch> batches = client.embedSparse(List.of(query));
            if (!batches.isEmpty() && batches.get(0).isLearned() && !batches.get(0).weights().get(0).isEmpty()) {
                return batches.get(0).weights().get(0);
            }
            log.debug("No learned query weights ({}); using lexical weights",
                    batches.isEmpty() ? "no batch" : batches.get(0).fallbackReason());
        }
        return LexicalTermWeights.of(query);
    }

    /**
     * One weight map per text, same order. Batches the sidecar could not embed get lexical weights.
     */
    public List<Map<String, Float>> embedDocuments(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        List<Map<String, Float>> weights = new ArrayList<>(texts.size());
        for (SparseBatch batch : client.embedSparse(texts)) {
            if (batch.isLearned()) {
                weights.addAll(batch.weights());
                continue;
            }
            if (batch.fallbackReason() != SparseBatch.FallbackReason.DISABLED) {
                log.warn("Sparse batch at index {} fell back to lexical weights: {}", batch.offset(),
                        batch.fallbackReason());
            }
            for (String text : batch.texts()) {
                weights.add(LexicalTermWeights.of(text));
            }
        }
        return weights;
    }
}
