package com.jreinhal.tieredrag.extraction;

public class ExtractionEmptyException extends ExtractionFailedException {

    public ExtractionEmptyException(ExtractionTier tier, String message) {
        super(tier, message);
    }

    public ExtractionEmptyException(ExtractionTier tier, String message, Throwable cause) {
        super(tier, message, cause);
    }

    @Override
    public String category() {
        return "empty";
    }
}
