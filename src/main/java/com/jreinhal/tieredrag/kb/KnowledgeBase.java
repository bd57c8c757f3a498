package com.jreinhal.tieredrag.kb;

import java.time.Instant;
import java.util.List;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection="knowledge_bases")
public record KnowledgeBase(
    @Id String name,
    String description,
    String category,
    List<Double> descriptionEmbedding,
    Instant createdAt,
    Instant updatedAt
) {
}
