package com.jreinhal.tieredrag.vector;

import com.jreinhal.tieredrag.constant.ChunkMetadata;
import java.util.Map;

public record StoredChunk(String id, String knowledgeBase, String text, Map<String, Object> metadata) {

    public StoredChunk {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public String source() {
        Object source = metadata.get(ChunkMetadata.SOURCE);
        return source != null ? source.toString() : "unknown";
    }

    public Integer page() {
        Object page = metadata.get(ChunkMetadata.PAGE);
        if (page instanceof Number number) {
            return number.intValue();
        }
        if (page != null) {
            try {
                return Integer.parseInt(page.toString().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public String section() {
        Object section = metadata.get(ChunkMetadata.SECTION);
        return section == null || section.toString().isBlank() ? null : section.toString();
    }
}
