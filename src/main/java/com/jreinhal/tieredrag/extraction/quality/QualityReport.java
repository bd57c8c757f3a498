package com.jreinhal.tieredrag.extraction.quality;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record QualityReport(double overallScore, Map<QualityDimension, DimensionScore> dimensions,
                            Recommendation recommendation) {

    public QualityReport {
        EnumMap<QualityDimension, DimensionScore> copy = new EnumMap<>(QualityDimension.class);
        copy.putAll(dimensions);
        dimensions = Collections.unmodifiableMap(copy);
    }

    public DimensionScore dimension(QualityDimension dimension) {
        return dimensions.get(dimension);
    }

    /**
     * All issues across dimensions, in dimension order.
     */
    public List<String> issues() {
        List<String> issues = new ArrayList<>();
        for (DimensionScore score : dimensions.values()) {
            issues.addAll(score.issues());
        }
        return issues;
    }
}
