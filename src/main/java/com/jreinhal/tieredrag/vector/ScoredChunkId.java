package com.jreinhal.tieredrag.vector;

public record ScoredChunkId(String chunkId, double score) {
}
