package com.jreinhal.tieredrag.extraction.quality;

public enum QualityDimension {
    TEXT_CLEANLINESS("text_cleanliness"),
    WORD_INTEGRITY("word_integrity"),
    CROSS_PAGE_CONSISTENCY("cross_page_consistency"),
    STRUCTURAL_RICHNESS("structural_richness"),
    CONTENT_DENSITY("content_density");

    private final String key;

    QualityDimension(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
