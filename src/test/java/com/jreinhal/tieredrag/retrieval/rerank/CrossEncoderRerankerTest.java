package com.jreinhal.tieredrag.retrieval.rerank;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.jreinhal.tieredrag.embedding.EmbeddingProvider;
import com.jreinhal.tieredrag.embedding.EmbeddingUnavailableException;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Answers;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.test.util.ReflectionTestUtils;

class CrossEncoderRerankerTest {
    private ExecutorService executor;
    private ChatClient.Builder builder;
    private ChatClient chatClient;
    private EmbeddingProvider embeddingProvider;

    @BeforeEach
    void setUp() {
        this.builder = mock(ChatClient.Builder.class);
        this.chatClient = mock(ChatClient.class, Answers.RETURNS_DEEP_STUBS);
        when(this.builder.build()).thenReturn(this.chatClient);
        this.embeddingProvider = mock(EmbeddingProvider.class);
        this.executor = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        this.executor.shutdownNow();
    }

    @Test
    void dedicatedModeScoresByEmbeddingAgreement() {
        when(this.embeddingProvider.embed(anyString())).thenAnswer(invocation -> {
            String input = invocation.getArgument(0, String.class);
            if ("query: capital of france".equals(input)) {
                return new float[]{1.0f, 0.0f};
            }
            if (input.contains("document: Paris is the capital")) {
                return new float[]{1.0f, 0.0f};
            }
            return new float[]{-1.0f, 0.0f};
        });
        CrossEncoderReranker reranker = newReranker("dedicated");

        List<Double> scores = reranker.score("capital of france",
                List.of("Paris is the capital of France.", "Bananas are yellow."));

        assertEquals(1.0, scores.get(0), 1e-9);
        assertEquals(0.0, scores.get(1), 1e-9);
    }

    @Test
    void dedicatedModeCachesPairScores() {
        when(this.embeddingProvider.embed(anyString())).thenReturn(new float[]{1.0f, 0.0f});
        CrossEncoderReranker reranker = newReranker("dedicated");

        reranker.score("capital of france", List.of("Paris"));
        reranker.score("capital of france", List.of("Paris"));

        verify(this.embeddingProvider, times(1)).embed("query: capital of france\ndocument: Paris");
    }

    @Test
    void dedicatedModeFailsWhenQueryCannotBeEmbedded() {
        when(this.embeddingProvider.embed(anyString()))
                .thenThrow(new EmbeddingUnavailableException("embedding service down"));
        CrossEncoderReranker reranker = newReranker("dedicated");

        assertThrows(RerankUnavailableException.class,
                () -> reranker.score("capital of france", List.of("Paris")));
    }

    @Test
    void dimensionMismatchFallsBackToKeywordScore() {
        when(this.embeddingProvider.embed("query: capital france")).thenReturn(new float[]{1.0f, 0.0f});
        when(this.embeddingProvider.embed("query: capital france\ndocument: the capital of france"))
                .thenReturn(new float[]{1.0f, 0.0f, 0.0f});
        CrossEncoderReranker reranker = newReranker("dedicated");

        List<Double> scores = reranker.score("capital france", List.of("the capital of france"));

        assertEquals(1.0, scores.get(0), 1e-9);
    }

    @Test
    void llmModeParsesModelRatings() {
        when(this.chatClient.prompt().user(anyString()).call().content()).thenReturn("Score: 0.85");
        CrossEncoderReranker reranker = newReranker("llm");

        List<Double> scores = reranker.score("capital of france", List.of("Paris", "Lyon", "Nice"));

        assertEquals(List.of(0.85, 0.85, 0.85), scores);
        verify(this.embeddingProvider, never()).embed(anyString());
    }

    @Test
    void llmModeTimesOutAsUnavailable() {
        when(this.chatClient.prompt().user(anyString()).call().content()).thenAnswer(invocation -> {
            Thread.sleep(3_000);
            return "0.9";
        });
        CrossEncoderReranker reranker = newReranker("llm");
        ReflectionTestUtils.setField(reranker, "timeoutSeconds", 1);

        RerankUnavailableException ex = assertThrows(RerankUnavailableException.class,
                () -> reranker.score("capital of france", List.of("Paris")));
        assertTrue(ex.getMessage().contains("timeout"));
    }

    @Test
    void keywordModeCountsQueryTerms() {
        CrossEncoderReranker reranker = newReranker("keyword");

        List<Double> scores = reranker.score("revenue growth forecast",
                List.of("Revenue growth was strong", "Nothing relevant here"));

        assertEquals(2.0 / 3.0, scores.get(0), 1e-9);
        assertEquals(0.0, scores.get(1), 1e-9);
    }

    @Test
    void unknownModeFallsBackToDedicated() {
        when(this.embeddingProvider.embed(anyString())).thenReturn(new float[]{1.0f, 0.0f});
        CrossEncoderReranker reranker = newReranker("mystery");

        reranker.score("capital of france", List.of("Paris"));

        verify(this.embeddingProvider).embed("query: capital of france");
    }

    @Test
    void parseScoreClampsAndDefaults() {
        CrossEncoderReranker reranker = newReranker("keyword");

        assertEquals(0.7, reranker.parseScore("0.7"), 1e-9);
        assertEquals(1.0, reranker.parseScore("Relevance 1.0 overall"), 1e-9);
        assertEquals(0.5, reranker.parseScore("no idea"), 1e-9);
        assertEquals(0.5, reranker.parseScore(null), 1e-9);
    }

    @Test
    void emptyPassageListScoresNothing() {
        CrossEncoderReranker reranker = newReranker("dedicated");

        assertTrue(reranker.score("anything", List.of()).isEmpty());
        verify(this.embeddingProvider, never()).embed(anyString());
    }

    private CrossEncoderReranker newReranker(String mode) {
        CrossEncoderReranker reranker = new CrossEncoderReranker(this.builder, this.executor, this.embeddingProvider);
        ReflectionTestUtils.setField(reranker, "batchSize", 2);
        ReflectionTestUtils.setField(reranker, "timeoutSeconds", 5);
        ReflectionTestUtils.setField(reranker, "rerankerMode", mode);
        ReflectionTestUtils.setField(reranker, "cacheSize", 100);
        ReflectionTestUtils.setField(reranker, "cacheTtlSeconds", 60L);
        reranker.init();
        return reranker;
    }
}
