package com.jreinhal.tieredrag.retrieval;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Greedy near-duplicate removal over an already ordered hit list. A hit is dropped when its
 * normalised text equals, or its word-shingle Jaccard similarity reaches the threshold with,
 * a hit kept earlier. The first (highest ranked) instance always survives, which makes the
 * filter idempotent.
 */
public class NearDuplicateFilter {
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final double similarityThreshold;
    private final int shingleSize;

    public NearDuplicateFilter(double similarityThreshold, int shingleSize) {
        if (similarityThreshold <= 0.0 || similarityThreshold > 1.0) {
            throw new IllegalArgumentException("Similarity threshold must lie in (0,1]");
        }
        this.similarityThreshold = similarityThreshold;
        this.shingleSize = Math.max(1, shingleSize);
    }

    public List<SearchHit> filter(List<SearchHit> hits) {
        List<SearchHit> kept = new ArrayList<>();
        List<String> keptNormalized = new ArrayList<>();
        List<Set<String>> keptShingles = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        for (SearchHit hit : hits) {
            if (!seenIds.add(hit.chunkId())) {
                continue;
            }
            String normalized = normalize(hit.text());
            Set<String> shingles = shingles(normalized);
            boolean duplicate = false;
            for (int i = 0; i < kept.size() && !duplicate; i++) {
                duplicate = normalized.equals(keptNormalized.get(i))
                        || jaccard(shingles, keptShingles.get(i)) >= similarityThreshold;
            }
            if (!duplicate) {
                kept.add(hit);
                keptNormalized.add(normalized);
                keptShingles.add(shingles);
            }
        }
        return kept;
    }

    static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String lower = NON_WORD.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ");
        return WHITESPACE.matcher(lower).replaceAll(" ").trim();
    }

    private Set<String> shingles(String normalized) {
        Set<String> shingles = new HashSet<>();
        if (normalized.isEmpty()) {
            return shingles;
        }
        String[] words = normalized.split(" ");
        if (words.length < shingleSize) {
            shingles.add(normalized);
            return shingles;
        }
        for (int i = 0; i + shingleSize <= words.length; i++) {
            shingles.add(String.join(" ", List.of(words).subList(i, i + shingleSize)));
        }
        return shingles;
    }

    private static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        int intersection = 0;
        for (String shingle : a) {
            if (b.contains(shingle)) {
                intersection++;
            }
        }
        return (double) intersection / (a.size() + b.size() - intersection);
    }
}
