package com.jreinhal.tieredrag.extraction.quality;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @param score normalised to [0,1], higher is better
 * @param weight share of the overall score
 * @param signals raw measurements the score was derived from
 * @param issues human-readable problems detected in this dimension
 */
public record DimensionScore(double score, double weight, Map<String, Double> signals, List<String> issues) {

    public DimensionScore {
        signals = Collections.unmodifiableMap(new LinkedHashMap<>(signals));
        issues = List.copyOf(issues);
    }

    public double weighted() {
        return score * weight;
    }
}
