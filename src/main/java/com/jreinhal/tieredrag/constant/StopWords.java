package com.jreinhal.tieredrag.constant;

import java.util.Set;

public final class StopWords {
    public static final Set<String> RERANKER = Set.of(
            "the", "a", "an", "is", "are", "was", "were", "what", "where",
            "when", "who", "how", "why", "which", "and", "or", "but", "in",
            "on", "at", "to", "for", "of", "with"
    );

    public static final Set<String> LEXICAL_TERMS = Set.of(
            "a", "an", "the", "is", "are", "was", "were", "be", "been", "being",
            "have", "has", "had", "do", "does", "did", "will", "would", "could",
            "should", "may", "might", "must", "can", "and", "but", "or", "nor",
            "for", "so", "as", "if", "when", "where", "what", "which", "who",
            "whom", "why", "how", "that", "this", "these", "those", "then", "than",
            "in", "on", "at", "by", "with", "about", "into", "through", "to",
            "from", "up", "out", "over", "under", "i", "me", "my", "we", "our",
            "you", "your", "he", "him", "his", "she", "her", "it", "its", "they",
            "them", "their", "all", "each", "some", "such", "no", "not", "only",
            "any", "both", "tell", "find", "show", "give", "describe", "also"
    );

    private StopWords() {
    }
}
