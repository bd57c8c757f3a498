package com.jreinhal.tieredrag.retrieval;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Prompt context and citation counts for retrieved hits.
 *
 * <p>Each block is {@code [i] (source: file, page N, section S)} followed by the passage; page
 * and section are omitted when unknown.</p>
 */
public final class ContextFormatter {

    private ContextFormatter() {
    }

    public static String format(List<SearchHit> hits) {
        StringBuilder context = new StringBuilder();
        for (int i = 0; i < hits.size(); i++) {
            SearchHit hit = hits.get(i);
            if (i > 0) {
                context.append("\n\n");
            }
            context.append('[').append(i + 1).append("] ").append(attribution(hit.source())).append('\n')
                    .append(hit.text() == null ? "" : hit.text().strip());
        }
        return context.toString();
    }

    public static String attribution(ChunkSource source) {
        StringBuilder attribution = new StringBuilder("(source: ");
        attribution.append(source != null && source.file() != null ? source.file() : "unknown");
        if (source != null && source.page() != null) {
            attribution.append(", page ").append(source.page());
        }
        if (source != null && source.section() != null && !source.section().isBlank()) {
            attribution.append(", section ").append(source.section());
        }
        return attribution.append(')').toString();
    }

    public static Map<String, Integer> sourceSummary(List<SearchHit> hits) {
        Map<String, Integer> summary = new LinkedHashMap<>();
        for (SearchHit hit : hits) {
            String file = hit.source() != null && hit.source().file() != null ? hit.source().file() : "unknown";
            summary.merge(file, 1, Integer::sum);
        }
        return summary;
    }
}
