package com.jreinhal.tieredrag.ingest;

import com.jreinhal.tieredrag.constant.ChunkMetadata;
import com.jreinhal.tieredrag.util.HeadingDetector;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.ai.document.Document;
import org.springframework.ai.transformer.splitter.TokenTextSplitter;

/**
 * Splits extracted pages into token-bounded chunks. Chunks never span a page boundary, so
 * each one carries a single page number. The section is the heading in effect where the
 * chunk starts; a heading carries over to following pages until the next one appears.
 */
public class PageChunker {
    private static final int MIN_CHUNK_LENGTH_TO_EMBED = 5;
    private static final int MAX_CHUNKS_PER_PAGE = 10000;

    private final TokenTextSplitter splitter;

    public PageChunker(int chunkSize, int minChunkSizeChars) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive");
        }
        this.splitter = new TokenTextSplitter(chunkSize, Math.max(1, minChunkSizeChars), MIN_CHUNK_LENGTH_TO_EMBED,
                MAX_CHUNKS_PER_PAGE, true);
    }

    /**
     * @param baseMetadata copied onto every chunk; null values are skipped
     */
    public List<ChunkDraft> chunk(String source, List<String> pages, Map<String, Object> baseMetadata) {
        List<ChunkDraft> chunks = new ArrayList<>();
        if (pages == null) {
            return chunks;
        }
        String section = null;
        int chunkIndex = 0;
        for (int p = 0; p < pages.size(); p++) {
            String page = pages.get(p);
            if (page == null || page.isBlank()) {
                continue;
            }
            for (Document piece : this.splitter.apply(List.of(new Document(page)))) {
                String text = piece.getText();
                if (text == null || text.isBlank()) {
                    continue;
                }
                String leading = leadingHeading(text);
                if (leading != null) {
                    section = leading;
                }
                Map<String, Object> metadata = new LinkedHashMap<>();
                if (baseMetadata != null) {
                    baseMetadata.forEach((key, value) -> {
                        if (value != null) {
                            metadata.put(key, value);
                        }
                    });
                }
                metadata.put(ChunkMetadata.SOURCE, source);
                metadata.put(ChunkMetadata.PAGE, p + 1);
                metadata.put(ChunkMetadata.CHUNK_INDEX, chunkIndex++);
                if (section != null) {
                    metadata.put(ChunkMetadata.SECTION, section);
                }
                chunks.add(new ChunkDraft(text.strip(), metadata));
                String last = HeadingDetector.lastHeading(text);
                if (last != null) {
                    section = last;
                }
            }
        }
        return chunks;
    }

    private static String leadingHeading(String text) {
        for (String line : text.split("\n")) {
            if (!line.isBlank()) {
                return HeadingDetector.title(line);
            }
        }
        return null;
    }
}
