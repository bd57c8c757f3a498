package com.jreinhal.tieredrag.retrieval;

public record SearchStats(int denseCandidates, int sparseCandidates, int fusedCandidates, int duplicatesRemoved,
                          long elapsedMs) {

    public static final SearchStats NONE = new SearchStats(0, 0, 0, 0, 0L);
}
