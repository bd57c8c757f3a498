package com.jreinhal.tieredrag.retrieval.rerank;

public class RerankUnavailableException extends RuntimeException {

    public RerankUnavailableException(String message) {
        super(message);
    }

    public RerankUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
