package com.jreinhal.tieredrag.extraction.quality;

public enum Recommendation {
    EXCELLENT("excellent", 0.85),
    GOOD("good", 0.70),
    FAIR("fair", 0.50),
    POOR("poor", 0.0);

    private final String label;
    private final double floor;

    Recommendation(String label, double floor) {
        this.label = label;
        this.floor = floor;
    }

    public String label() {
        return label;
    }

    public static Recommendation forScore(double score) {
        for (Recommendation band : values()) {
            if (score >= band.floor) {
                return band;
            }
        }
        return POOR;
    }
}
