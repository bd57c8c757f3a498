package com.jreinhal.tieredrag.retrieval;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.jreinhal.tieredrag.vector.ScoredChunkId;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class ReciprocalRankFusionTest {

    private static List<ScoredChunkId> ranked(String... ids) {
        ScoredChunkId[] hits = new ScoredChunkId[ids.length];
        for (int i = 0; i < ids.length; i++) {
            hits[i] = new ScoredChunkId(ids[i], 1.0 - i * 0.1);
        }
        return List.of(hits);
    }

    private static Map<String, ReciprocalRankFusion.Candidate> byId(List<ReciprocalRankFusion.Candidate> fused) {
        return fused.stream().collect(Collectors.toMap(ReciprocalRankFusion.Candidate::chunkId, Function.identity()));
    }

    @Test
    void scoresFollowTheRankFormula() {
        List<ReciprocalRankFusion.Candidate> fused = ReciprocalRankFusion.fuse(
                ranked("A", "B", "C"), ranked("B", "C", "A"), 60);
        Map<String, ReciprocalRankFusion.Candidate> candidates = byId(fused);

        assertEquals(1.0 / 61 + 1.0 / 63, candidates.get("A").rrfScore(), 1e-12);
        assertEquals(1.0 / 62 + 1.0 / 61, candidates.get("B").rrfScore(), 1e-12);
        assertEquals(1.0 / 63 + 1.0 / 62, candidates.get("C").rrfScore(), 1e-12);
        // B holds ranks 2 and 1, the best pair, so it leads.
        assertEquals(List.of("B", "A", "C"), fused.stream().map(ReciprocalRankFusion.Candidate::chunkId).toList());
    }

    @Test
    void rawScoreMagnitudesDoNotAffectFusion() {
        List<ScoredChunkId> denseSmall = List.of(new ScoredChunkId("A", 0.02), new ScoredChunkId("B", 0.01));
        List<ScoredChunkId> denseLarge = List.of(new ScoredChunkId("A", 900.0), new ScoredChunkId("B", 3.0));
        List<ScoredChunkId> sparse = List.of(new ScoredChunkId("B", 12.5), new ScoredChunkId("C", 0.3));

        List<ReciprocalRankFusion.Candidate> a = ReciprocalRankFusion.fuse(denseSmall, sparse, 60);
        List<ReciprocalRankFusion.Candidate> b = ReciprocalRankFusion.fuse(denseLarge, sparse, 60);

        assertEquals(a.stream().map(ReciprocalRankFusion.Candidate::chunkId).toList(),
                b.stream().map(ReciprocalRankFusion.Candidate::chunkId).toList());
        for (int i = 0; i < a.size(); i++) {
            assertEquals(a.get(i).rrfScore(), b.get(i).rrfScore(), 0.0);
        }
    }

    @Test
    void chunkMissingFromOneListGetsNothingFromIt() {
        List<ReciprocalRankFusion.Candidate> fused = ReciprocalRankFusion.fuse(ranked("X", "Y", "Z"), ranked("Y", "Z", "W"), 60);
        Map<String, ReciprocalRankFusion.Candidate> candidates = byId(fused);

        assertEquals(1.0 / 61, candidates.get("X").rrfScore(), 1e-12);
        assertNull(candidates.get("X").sparseRank());
        assertEquals(1.0 / 63, candidates.get("W").rrfScore(), 1e-12);
        assertNull(candidates.get("W").denseRank());
        assertEquals(List.of("Y", "Z", "X", "W"), fused.stream().map(ReciprocalRankFusion.Candidate::chunkId).toList());
    }

    @Test
    void emptySparseListDegradesToDenseOrder() {
        List<ReciprocalRankFusion.Candidate> fused = ReciprocalRankFusion.fuse(ranked("A", "B", "C"), List.of(), 60);

        assertEquals(List.of("A", "B", "C"), fused.stream().map(ReciprocalRankFusion.Candidate::chunkId).toList());
        assertTrue(fused.stream().allMatch(c -> c.sparseScore() == null));
    }

    @Test
    void equalScoresPreferBetterDenseRank() {
        // P is dense rank 1, Q is sparse rank 1: identical RRF scores and best ranks.
        List<ReciprocalRankFusion.Candidate> fused = ReciprocalRankFusion.fuse(ranked("P"), ranked("Q"), 60);

        assertEquals(List.of("P", "Q"), fused.stream().map(ReciprocalRankFusion.Candidate::chunkId).toList());
    }

    @Test
    void duplicateIdInOneChannelKeepsFirstRank() {
        List<ReciprocalRankFusion.Candidate> fused = ReciprocalRankFusion.fuse(ranked("A", "A", "B"), List.of(), 60);

        assertEquals(2, fused.size());
        assertEquals(1, byId(fused).get("A").denseRank());
        assertEquals(1.0 / 61, byId(fused).get("A").rrfScore(), 1e-12);
    }

    @Test
    void rejectsNonPositiveConstant() {
        assertThrows(IllegalArgumentException.class, () -> ReciprocalRankFusion.fuse(List.of(), List.of(), 0));
    }
}
