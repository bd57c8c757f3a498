package com.jreinhal.tieredrag.ingest;

import com.jreinhal.tieredrag.extraction.ExtractionResult;

public record IngestionReport(String knowledgeBase, String filename, int chunkCount, ExtractionResult extraction) {
}
