package com.jreinhal.tieredrag.config;

import com.jreinhal.tieredrag.extraction.quality.QualityScorer;
import com.jreinhal.tieredrag.extraction.quality.QualityWeights;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExtractionConfig {
    private static final Logger log = LoggerFactory.getLogger(ExtractionConfig.class);

    /**
     * Weights are validated on construction; a set that does not sum to 1.0 fails startup.
     */
    @Bean
    public QualityWeights qualityWeights(
            @Value("${tieredrag.quality.weights.cleanliness:0.25}") double cleanliness,
            @Value("${tieredrag.quality.weights.word-integrity:0.20}") double wordIntegrity,
            @Value("${tieredrag.quality.weights.consistency:0.15}") double consistency,
            @Value("${tieredrag.quality.weights.structure:0.20}") double structure,
            @Value("${tieredrag.quality.weights.density:0.20}") double density) {
        QualityWeights weights = new QualityWeights(cleanliness, wordIntegrity, consistency, structure, density);
        log.info("Quality weights: {}", weights);
        return weights;
    }

    @Bean
    public QualityScorer qualityScorer(QualityWeights qualityWeights) {
        return new QualityScorer(qualityWeights);
    }
}
