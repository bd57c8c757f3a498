package com.jreinhal.tieredrag.ingest;

import com.jreinhal.tieredrag.constant.ChunkMetadata;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Document-level descriptors shared by every chunk of a file.
 *
 * @param fromModel false when the values come from keyword heuristics
 */
public record DocumentMetadata(String docType, String category, String status, String title, boolean fromModel) {

    public Map<String, Object> toChunkMetadata() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(ChunkMetadata.DOC_TYPE, this.docType);
        map.put(ChunkMetadata.CATEGORY, this.category);
        map.put(ChunkMetadata.STATUS, this.status);
        map.put(ChunkMetadata.TITLE, this.title);
        return map;
    }
}
