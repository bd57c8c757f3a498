package com.jreinhal.tieredrag.kb;

import java.util.List;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface KnowledgeBaseRepository extends MongoRepository<KnowledgeBase, String> {

    // Registration order is the routing tie-break order.
    List<KnowledgeBase> findAllByOrderByCreatedAtAsc();
}
