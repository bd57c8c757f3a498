package com.jreinhal.tieredrag.extraction.quality;

public record QualityWeights(double cleanliness, double wordIntegrity, double consistency, double structure,
                             double density) {

    private static final double TOLERANCE = 1e-6;

    public static final QualityWeights DEFAULT = new QualityWeights(0.25, 0.20, 0.15, 0.20, 0.20);

    public QualityWeights {
        double[] all = {cleanliness, wordIntegrity, consistency, structure, density};
        double sum = 0.0;
        for (double weight : all) {
            if (weight < 0.0 || weight > 1.0 || Double.isNaN(weight)) {
                throw new IllegalArgumentException("Quality weights must lie in [0,1], got " + weight);
            }
            sum += weight;
        }
        if (Math.abs(sum - 1.0) > TOLERANCE) {
            throw new IllegalArgumentException("Quality weights must sum to 1.0, got " + sum);
        }
    }

    public double weightOf(QualityDimension dimension) {
        return switch (dimension) {
            case TEXT_CLEANLINESS -> cleanliness;
            case WORD_INTEGRITY -> wordIntegrity;
            case CROSS_PAGE_CONSISTENCY -> consistency;
            case STRUCTURAL_RICHNESS -> structure;
            case CONTENT_DENSITY -> density;
        };
    }
}
