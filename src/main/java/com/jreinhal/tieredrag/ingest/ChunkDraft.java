package com.jreinhal.tieredrag.ingest;

import java.util.Map;

/**
 * A chunk of extracted text with its page-level metadata, before embedding.
 */
public record ChunkDraft(String text, Map<String, Object> metadata) {

    public ChunkDraft {
        metadata = Map.copyOf(metadata);
    }
}
