package com.jreinhal.tieredrag.retrieval;

/**
 * One retrieved chunk with the scores from each stage.
 *
 * @param denseScore raw dense similarity, null if the dense channel did not return the chunk
 * @param sparseScore raw sparse score, null if the sparse channel did not return the chunk
 * @param rrfScore reciprocal rank fusion score
 * @param rrfRank 1-based position after fusion
 * @param rerankScore cross-encoder relevance, null when reranking was not applied
 */
public record SearchHit(String chunkId, String text, ChunkSource source, Double denseScore, Double sparseScore,
                        double rrfScore, int rrfRank, Double rerankScore) {

    public double finalScore() {
        return rerankScore != null ? rerankScore : rrfScore;
    }

    public SearchHit withRerankScore(double score) {
        return new SearchHit(chunkId, text, source, denseScore, sparseScore, rrfScore, rrfRank, score);
    }
}
