package com.jreinhal.tieredrag.retrieval;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final, ordered search result.
 *
 * @param hits ordered by final score (rerank score if present, else RRF score), ties by RRF rank
 * @param formattedContext numbered, source-attributed passages ready for a prompt
 * @param sourceSummary source file to number of contributing hits, in order of first appearance
 * @param notes degradations applied while searching, e.g. skipped reranking
 */
public record FusedResultSet(String knowledgeBase, String query, List<SearchHit> hits, String formattedContext,
                             Map<String, Integer> sourceSummary, List<String> notes, boolean rerankApplied,
                             SearchStats stats) {

    public FusedResultSet {
        hits = List.copyOf(hits);
        sourceSummary = Collections.unmodifiableMap(new LinkedHashMap<>(sourceSummary));
        notes = List.copyOf(notes);
    }

    public static FusedResultSet empty(String knowledgeBase, String query, List<String> notes, SearchStats stats) {
        return new FusedResultSet(knowledgeBase, query, List.of(), "", Map.of(), notes, false, stats);
    }

    public boolean isEmpty() {
        return hits.isEmpty();
    }
}
