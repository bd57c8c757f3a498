package com.jreinhal.tieredrag.routing;

import java.util.Objects;

/**
 * Routing entry for one knowledge base. The embedding array is owned by the descriptor and
 * must not be mutated after construction.
 */
public record KnowledgeBaseDescriptor(String name, String description, String category, float[] embedding) {

    public KnowledgeBaseDescriptor {
        Objects.requireNonNull(name, "name");
        embedding = embedding == null ? new float[0] : embedding;
    }
}
