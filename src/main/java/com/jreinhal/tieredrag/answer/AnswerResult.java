package com.jreinhal.tieredrag.answer;

import com.jreinhal.tieredrag.retrieval.FusedResultSet;

/**
 * @param knowledgeBase the knowledge base searched, null when routing found none
 * @param degraded true when the answer was assembled without the language model
 */
public record AnswerResult(String answer, String knowledgeBase, FusedResultSet retrieval, boolean degraded) {
}
