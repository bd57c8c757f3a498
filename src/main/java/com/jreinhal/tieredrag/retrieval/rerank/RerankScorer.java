package com.jreinhal.tieredrag.retrieval.rerank;

import java.util.List;

/**
 * Cross-encoder style relevance scoring of (query, passage) pairs.
 */
public interface RerankScorer {

    /**
     * One relevance score in [0,1] per text, same order as {@code texts}.
     *
     * @throws RerankUnavailableException if the scoring backend fails or times out
     */
    List<Double> score(String query, List<String> texts);
}
