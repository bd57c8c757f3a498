package com.jreinhal.tieredrag.retrieval.sparse;

import com.jreinhal.tieredrag.constant.StopWords;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Local sparse representation: stop-word filtered terms, log-scaled term frequency,
 * L2-normalised so document and query weights are comparable.
 */
public final class LexicalTermWeights {
    private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}]+");

    private LexicalTermWeights() {
    }

    public static Map<String, Float> of(String text) {
        if (text == null || text.isBlank()) {
            return Map.of();
        }
        Map<String, Integer> counts = new LinkedHashMap<>();
        Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            String term = matcher.group();
            if (term.length() < 2 || StopWords.LEXICAL_TERMS.contains(term)) {
                continue;
            }
            counts.merge(term, 1, Integer::sum);
        }
        if (counts.isEmpty()) {
            return Map.of();
        }
        Map<String, Double> raw = new LinkedHashMap<>();
        double sumSquares = 0.0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            double weight = 1.0 + Math.log(entry.getValue());
            raw.put(entry.getKey(), weight);
            sumSquares += weight * weight;
        }
        double norm = Math.sqrt(sumSquares);
        Map<String, Float> weights = new LinkedHashMap<>();
        raw.forEach((term, weight) -> weights.put(term, (float) (weight / norm)));
        return weights;
    }
}
