package com.jreinhal.tieredrag.extraction;

import com.jreinhal.tieredrag.extraction.quality.QualityReport;
import java.time.Duration;
import java.util.List;

public record ExtractionAttempt(ExtractionTier tier, List<String> pages, Duration duration, double cost,
                                QualityReport quality) {

    public ExtractionAttempt {
        pages = List.copyOf(pages);
    }

    public double score() {
        return quality.overallScore();
    }
}
