package com.jreinhal.tieredrag.retrieval;

/**
 * Where a chunk came from. {@code page} and {@code section} are null when unknown.
 */
public record ChunkSource(String file, Integer page, String section) {
}
