package com.jreinhal.tieredrag.routing;

/**
 * Outcome of routing one query embedding. {@code knowledgeBase} is null when nothing reached
 * the similarity floor; {@code similarity} is then the best score seen (0.0 for an empty index).
 */
public record RouteDecision(String knowledgeBase, double similarity) {

    public static RouteDecision none(double bestSimilarity) {
        return new RouteDecision(null, bestSimilarity);
    }

    public boolean matched() {
        return knowledgeBase != null;
    }
}
