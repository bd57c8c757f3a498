package com.jreinhal.tieredrag.ingest;

import static org.junit.jupiter.api.Assertions.*;

import com.jreinhal.tieredrag.constant.ChunkMetadata;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PageChunkerTest {

    private final PageChunker chunker = new PageChunker(800, 350);

    @Test
    void chunksCarryPageNumberAndRunningIndex() {
        List<ChunkDraft> chunks = chunker.chunk("policy.pdf", List.of(
                "## Scope\nThis policy covers business travel.",
                "",
                "Employees book flights early.\nCOSTS\nHotels are capped per night.",
                "Meals are reimbursed against receipts."), Map.of());

        assertEquals(3, chunks.size());
        assertEquals(1, chunks.get(0).metadata().get(ChunkMetadata.PAGE));
        assertEquals(3, chunks.get(1).metadata().get(ChunkMetadata.PAGE));
        assertEquals(4, chunks.get(2).metadata().get(ChunkMetadata.PAGE));
        assertEquals(List.of(0, 1, 2), chunks.stream().map(c -> c.metadata().get(ChunkMetadata.CHUNK_INDEX)).toList());
        assertTrue(chunks.stream().allMatch(c -> "policy.pdf".equals(c.metadata().get(ChunkMetadata.SOURCE))));
    }

    @Test
    void sectionFollowsMostRecentHeading() {
        List<ChunkDraft> chunks = chunker.chunk("policy.pdf", List.of(
                "## Scope\nThis policy covers business travel.",
                "Employees book flights early.\nCOSTS\nHotels are capped per night.",
                "Meals are reimbursed against receipts."), Map.of());

        assertEquals("Scope", chunks.get(0).metadata().get(ChunkMetadata.SECTION));
        assertEquals("Scope", chunks.get(1).metadata().get(ChunkMetadata.SECTION));
        assertEquals("COSTS", chunks.get(2).metadata().get(ChunkMetadata.SECTION));
    }

    @Test
    void textWithoutHeadingsHasNoSection() {
        List<ChunkDraft> chunks = chunker.chunk("notes.txt", List.of("Plain remarks about the meeting."), Map.of());

        assertFalse(chunks.get(0).metadata().containsKey(ChunkMetadata.SECTION));
    }

    @Test
    void baseMetadataIsCopiedWithoutNulls() {
        Map<String, Object> base = new HashMap<>();
        base.put(ChunkMetadata.KNOWLEDGE_BASE, "hr");
        base.put(ChunkMetadata.TIER_USED, null);

        ChunkDraft chunk = chunker.chunk("notes.txt", List.of("Plain remarks about the meeting."), base).get(0);

        assertEquals("hr", chunk.metadata().get(ChunkMetadata.KNOWLEDGE_BASE));
        assertFalse(chunk.metadata().containsKey(ChunkMetadata.TIER_USED));
    }

    @Test
    void longPageSplitsIntoSeveralChunksOnTheSamePage() {
        String page = "The committee reviewed the budget and approved the plan. ".repeat(60);
        PageChunker small = new PageChunker(50, 20);

        List<ChunkDraft> chunks = small.chunk("minutes.pdf", List.of(page), Map.of());

        assertTrue(chunks.size() > 1);
        assertTrue(chunks.stream().allMatch(c -> Integer.valueOf(1).equals(c.metadata().get(ChunkMetadata.PAGE))));
        assertTrue(chunks.stream().noneMatch(c -> c.text().isBlank()));
    }

    @Test
    void nullOrBlankPagesYieldNothing() {
        assertTrue(chunker.chunk("empty.pdf", null, Map.of()).isEmpty());
        assertTrue(chunker.chunk("empty.pdf", List.of(" ", "\n"), Map.of()).isEmpty());
    }

    @Test
    void rejectsNonPositiveChunkSize() {
        assertThrows(IllegalArgumentException.class, () -> new PageChunker(0, 100));
    }
}
