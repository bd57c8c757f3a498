package com.jreinhal.tieredrag.retrieval;

/**
 * The vector store or embedding backend failed, timed out or was saturated. Not retried.
 */
public class SearchBackendUnavailableException extends RuntimeException {

    public SearchBackendUnavailableException(String message) {
        super(message);
    }

    public SearchBackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
