package com.jreinhal.tieredrag.routing;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.jreinhal.tieredrag.embedding.EmbeddingProvider;
import com.jreinhal.tieredrag.kb.KnowledgeBase;
import com.jreinhal.tieredrag.kb.KnowledgeBaseRepository;
import com.jreinhal.tieredrag.reasoning.ReasoningStep;
import com.jreinhal.tieredrag.reasoning.ReasoningTrace;
import com.jreinhal.tieredrag.util.VectorMath;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SemanticRouterTest {

    private static final float[] QUERY = {1.0f, 0.0f};

    private KnowledgeBaseRepository repository;
    private EmbeddingProvider embeddingProvider;
    private SemanticRouter router;

    @BeforeEach
    void setUp() {
        repository = mock(KnowledgeBaseRepository.class);
        embeddingProvider = mock(EmbeddingProvider.class);
        router = new SemanticRouter(repository, embeddingProvider);
    }

    @Test
    void routesToClosestDescription() {
        List<KnowledgeBaseDescriptor> descriptors = List.of(
                descriptor("legal", 0.2f, 0.98f),
                descriptor("finance", 0.95f, 0.3f));

        RouteDecision decision = SemanticRouter.route(QUERY, descriptors, 0.5);

        assertTrue(decision.matched());
        assertEquals("finance", decision.knowledgeBase());
    }

    @Test
    void bestScoreBelowFloorMatchesNothing() {
        List<KnowledgeBaseDescriptor> descriptors = List.of(descriptor("hr", 0.45f, 0.893f));

        RouteDecision decision = SemanticRouter.route(QUERY, descriptors, 0.5);

        assertFalse(decision.matched());
        assertNull(decision.knowledgeBase());
        assertEquals(0.45, decision.similarity(), 0.005);
    }

    @Test
    void scoreEqualToFloorMatches() {
        KnowledgeBaseDescriptor hr = descriptor("hr", 0.6f, 0.8f);
        double exact = VectorMath.cosine(QUERY, hr.embedding());

        RouteDecision decision = SemanticRouter.route(QUERY, List.of(hr), exact);

        assertEquals("hr", decision.knowledgeBase());
    }

    @Test
    void tieGoesToFirstRegistered() {
        List<KnowledgeBaseDescriptor> descriptors = List.of(
                descriptor("first", 0.8f, 0.6f),
                descriptor("second", 0.8f, 0.6f));

        assertEquals("first", SemanticRouter.route(QUERY, descriptors, 0.5).knowledgeBase());
        assertEquals(List.of("first", "second"), SemanticRouter.rank(QUERY, descriptors, 0.5, 5).stream()
                .map(RouteMatch::knowledgeBase).toList());
    }

    @Test
    void emptyIndexMatchesNothing() {
        RouteDecision decision = SemanticRouter.route(QUERY, List.of(), 0.5);

        assertFalse(decision.matched());
        assertEquals(0.0, decision.similarity());
    }

    @Test
    void rankKeepsOnlyMatchesAboveFloorUpToTopK() {
        List<KnowledgeBaseDescriptor> descriptors = List.of(
                descriptor("low", 0.1f, 0.99f),
                descriptor("mid", 0.7f, 0.7f),
                descriptor("high", 1.0f, 0.05f),
                descriptor("near", 0.9f, 0.4f));

        List<RouteMatch> matches = SemanticRouter.rank(QUERY, descriptors, 0.5, 2);

        assertEquals(List.of("high", "near"), matches.stream().map(RouteMatch::knowledgeBase).toList());
    }

    @Test
    void routeTextUsesRepositoryIndexAndRecordsStep() {
        when(repository.findAllByOrderByCreatedAtAsc()).thenReturn(List.of(
                kb("finance", List.of(1.0, 0.1)),
                kb("legal", List.of(0.0, 1.0))));
        when(embeddingProvider.embed("quarterly revenue")).thenReturn(QUERY);
        ReasoningTrace trace = new ReasoningTrace("route", "query");

        List<RouteMatch> matches = router.route("quarterly revenue", 3, trace);

        assertEquals(List.of("finance"), matches.stream().map(RouteMatch::knowledgeBase).toList());
        assertEquals(ReasoningStep.StepType.ROUTING, trace.getSteps().get(0).type());
    }

    @Test
    void routeTextWithEmptyIndexSkipsEmbedding() {
        when(repository.findAllByOrderByCreatedAtAsc()).thenReturn(List.of());

        assertTrue(router.route("anything", 1, null).isEmpty());
        verify(embeddingProvider, never()).embed(anyString());
    }

    @Test
    void blankQueryIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> router.route("  ", 1, null));
    }

    @Test
    void indexIsLoadedOnceAndRefreshedOnRebuild() {
        when(repository.findAllByOrderByCreatedAtAsc())
                .thenReturn(List.of(kb("finance", List.of(1.0, 0.0))))
                .thenReturn(List.of(kb("finance", List.of(1.0, 0.0)), kb("legal", List.of(0.0, 1.0))));

        assertEquals(1, router.descriptors().size());
        assertEquals(1, router.descriptors().size());
        router.rebuild();
        assertEquals(2, router.descriptors().size());
        verify(repository, times(2)).findAllByOrderByCreatedAtAsc();
    }

    @Test
    void knowledgeBaseWithoutEmbeddingIsNotRoutable() {
        when(repository.findAllByOrderByCreatedAtAsc()).thenReturn(List.of(
                kb("pending", null),
                kb("finance", List.of(1.0, 0.0))));

        List<KnowledgeBaseDescriptor> descriptors = router.rebuild();

        assertEquals(List.of("finance"), descriptors.stream().map(KnowledgeBaseDescriptor::name).toList());
    }

    private static KnowledgeBaseDescriptor descriptor(String name, float x, float y) {
        return new KnowledgeBaseDescriptor(name, name + " documents", "general", new float[]{x, y});
    }

    private static KnowledgeBase kb(String name, List<Double> embedding) {
        Instant now = Instant.now();
        return new KnowledgeBase(name, name + " documents", "general", embedding, now, now);
    }
}
