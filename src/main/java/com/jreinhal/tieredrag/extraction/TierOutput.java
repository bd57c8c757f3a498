package com.jreinhal.tieredrag.extraction;

import java.time.Duration;
import java.util.List;

/**
 * Raw result of one tier call: page texts in document order, monetary cost and elapsed time.
 */
public record TierOutput(List<String> pages, double cost, Duration duration) {

    public TierOutput {
        pages = pages == null ? List.of() : List.copyOf(pages);
        duration = duration == null ? Duration.ZERO : duration;
    }
}
