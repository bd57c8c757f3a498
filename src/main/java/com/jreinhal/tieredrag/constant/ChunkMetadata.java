package com.jreinhal.tieredrag.constant;

/**
 * Metadata keys written on every indexed chunk.
 */
public final class ChunkMetadata {
    public static final String SOURCE = "source";
    public static final String PAGE = "page_number";
    public static final String SECTION = "section";
    public static final String CHUNK_INDEX = "chunk_index";
    public static final String KNOWLEDGE_BASE = "kb";
    public static final String TIER_USED = "tier_used";
    public static final String QUALITY_SCORE = "quality_score";
    public static final String EXTRACTION_COST = "extraction_cost";
    public static final String UPLOADED_AT = "uploaded_at";
    public static final String DOC_TYPE = "doc_type";
    public static final String CATEGORY = "category";
    public static final String STATUS = "status";
    public static final String TITLE = "title";

    private ChunkMetadata() {
    }
}
