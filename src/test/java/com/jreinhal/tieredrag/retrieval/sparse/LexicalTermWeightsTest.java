package com.jreinhal.tieredrag.retrieval.sparse;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

class LexicalTermWeightsTest {

    @Test
    void weightsAreUnitLength() {
        Map<String, Float> weights = LexicalTermWeights.of("Revenue revenue growth in the third quarter");

        double sumSquares = weights.values().stream().mapToDouble(w -> w * w).sum();
        assertEquals(1.0, sumSquares, 1e-5);
    }

    @Test
    void repeatedTermsWeighMore() {
        Map<String, Float> weights = LexicalTermWeights.of("revenue revenue growth");

        assertTrue(weights.get("revenue") > weights.get("growth"));
    }

    @Test
    void dropsStopWordsAndSingleCharacters() {
        Map<String, Float> weights = LexicalTermWeights.of("The a x is growth");

        assertEquals(Map.of("growth", 1.0f), weights);
    }

    @Test
    void blankTextHasNoWeights() {
        assertTrue(LexicalTermWeights.of("   ").isEmpty());
        assertTrue(LexicalTermWeights.of(null).isEmpty());
        assertTrue(LexicalTermWeights.of("the is a").isEmpty());
    }
}
