package com.jreinhal.tieredrag.retrieval;

import com.jreinhal.tieredrag.vector.ScoredChunkId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges the dense and sparse rankings by rank position only:
 * {@code rrf(c) = sum over lists of 1 / (k + rank)}, with 1-based ranks and no contribution
 * from a list that does not contain the chunk. Raw score magnitudes never enter the fused score.
 */
public final class ReciprocalRankFusion {
    public static final int DEFAULT_K = 60;

    private static final Comparator<Candidate> ORDER = Comparator
            .comparingDouble(Candidate::rrfScore).reversed()
            .thenComparingInt(Candidate::bestRank)
            .thenComparingInt(candidate -> candidate.denseRank() != null ? candidate.denseRank() : Integer.MAX_VALUE)
            .thenComparing(Candidate::chunkId);

    private ReciprocalRankFusion() {
    }

    /**
     * Fused candidates, best first. Ties on score go to the better single-list rank, then the
     * better dense rank, then chunk id. A chunk listed twice in one channel keeps its first rank.
     */
    public static List<Candidate> fuse(List<ScoredChunkId> dense, List<ScoredChunkId> sparse, int k) {
        if (k <= 0) {
            throw new IllegalArgumentException("RRF constant must be positive");
        }
        Map<String, Candidate> byId = new LinkedHashMap<>();
        int rank = 0;
        for (ScoredChunkId hit : dense) {
            rank++;
            if (!byId.containsKey(hit.chunkId())) {
                byId.put(hit.chunkId(), new Candidate(hit.chunkId(), hit.score(), rank, null, null, contribution(k, rank)));
            }
        }
        rank = 0;
        for (ScoredChunkId hit : sparse) {
            rank++;
            Candidate existing = byId.get(hit.chunkId());
            if (existing == null) {
                byId.put(hit.chunkId(), new Candidate(hit.chunkId(), null, null, hit.score(), rank, contribution(k, rank)));
            } else if (existing.sparseRank() == null) {
                byId.put(hit.chunkId(), new Candidate(hit.chunkId(), existing.denseScore(), existing.denseRank(),
                        hit.score(), rank, existing.rrfScore() + contribution(k, rank)));
            }
        }
        List<Candidate> fused = new ArrayList<>(byId.values());
        fused.sort(ORDER);
        return fused;
    }

    public static double contribution(int k, int rank) {
        return 1.0 / (k + rank);
    }

    public record Candidate(String chunkId, Double denseScore, Integer denseRank, Double sparseScore,
                            Integer sparseRank, double rrfScore) {

        int bestRank() {
            int best = Integer.MAX_VALUE;
            if (denseRank != null) {
                best = denseRank;
            }
            if (sparseRank != null) {
                best = Math.min(best, sparseRank);
            }
            return best;
        }
    }
}
