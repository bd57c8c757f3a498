package com.jreinhal.tieredrag.extraction;

/**
 * The caller cancelled the extraction before any tier produced a usable attempt.
 */
public class ExtractionCancelledException extends RuntimeException {

    public ExtractionCancelledException(String message) {
        super(message);
    }
}
