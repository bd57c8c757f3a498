package com.jreinhal.tieredrag.controller;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jreinhal.tieredrag.extraction.AllTiersExhaustedException;
import com.jreinhal.tieredrag.extraction.CancellationSignal;
import com.jreinhal.tieredrag.extraction.ExtractionAttempt;
import com.jreinhal.tieredrag.extraction.ExtractionResult;
import com.jreinhal.tieredrag.extraction.ExtractionTier;
import com.jreinhal.tieredrag.extraction.quality.QualityReport;
import com.jreinhal.tieredrag.extraction.quality.Recommendation;
import com.jreinhal.tieredrag.ingest.DocumentIngestionService;
import com.jreinhal.tieredrag.ingest.InFlightIngestions;
import com.jreinhal.tieredrag.ingest.IngestionReport;
import com.jreinhal.tieredrag.reasoning.ReasoningTrace;
import com.jreinhal.tieredrag.reasoning.ReasoningTracer;
import com.jreinhal.tieredrag.reasoning.TraceSink;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(DocumentController.class)
@AutoConfigureMockMvc(addFilters = false)
class DocumentControllerTest {
    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private DocumentIngestionService ingestionService;
    @MockitoBean
    private InFlightIngestions inFlight;
    @MockitoBean
    private ReasoningTracer tracer;

    private static ExtractionAttempt attempt(ExtractionTier tier, double score, double cost) {
        return new ExtractionAttempt(tier, List.of("Leave policy text"), Duration.ofMillis(120), cost,
                new QualityReport(score, Map.of(), Recommendation.forScore(score)));
    }

    @Test
    void uploadReturnsIngestionReport() throws Exception {
        ExtractionAttempt fast = attempt(ExtractionTier.FAST, 0.55, 0.0);
        ExtractionAttempt balanced = attempt(ExtractionTier.BALANCED, 0.91, 0.0004);
        ExtractionResult extraction = new ExtractionResult(balanced, List.of(fast, balanced),
                List.of(ExtractionTier.FAST, ExtractionTier.BALANCED), Map.of(), "met target at tier balanced", false);
        when(tracer.start("ingest", "hr")).thenReturn(new ReasoningTrace("ingest", "hr"));
        when(ingestionService.ingest(eq("hr"), eq("handbook.pdf"), any(byte[].class), eq(0.8), isNull(),
                any(CancellationSignal.class), any(TraceSink.class)))
                .thenReturn(new IngestionReport("hr", "handbook.pdf", 6, extraction));

        MockMultipartFile file = new MockMultipartFile("file", "handbook.pdf", "application/pdf", new byte[] {1, 2, 3});

        mockMvc.perform(multipart("/api/kb/hr/documents").file(file).param("targetQuality", "0.8"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.chunkCount").value(6))
                .andExpect(jsonPath("$.selected.tier").value("balanced"))
                .andExpect(jsonPath("$.selected.recommendation").value("excellent"))
                .andExpect(jsonPath("$.tiersTried[0]").value("fast"))
                .andExpect(jsonPath("$.escalationReason").value("met target at tier balanced"))
                .andExpect(jsonPath("$.traceId").isNotEmpty());
    }

    @Test
    void operationIdRegistersCancellableIngestion() throws Exception {
        CancellationSignal signal = new CancellationSignal();
        when(inFlight.register("op-1")).thenReturn(signal);
        when(ingestionService.ingest(anyString(), anyString(), any(byte[].class), isNull(), isNull(),
                eq(signal), any(TraceSink.class)))
                .thenThrow(new AllTiersExhaustedException(Map.of(ExtractionTier.FAST, "empty: no text layer found")));

        MockMultipartFile file = new MockMultipartFile("file", "scan.pdf", "application/pdf", new byte[] {1});

        mockMvc.perform(multipart("/api/kb/hr/documents").file(file).param("operationId", "op-1"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.failures.fast").value("empty: no text layer found"));

        verify(inFlight).release("op-1", signal);
    }

    @Test
    void cancelUnknownOperationReturnsNotFound() throws Exception {
        when(inFlight.cancel("missing")).thenReturn(false);

        mockMvc.perform(delete("/api/ingestions/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.cancelled").value(false));
    }

    @Test
    void cancelRunningOperationIsAccepted() throws Exception {
        when(inFlight.cancel("op-2")).thenReturn(true);

        mockMvc.perform(delete("/api/ingestions/op-2"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.cancelled").value(true));
    }

    @Test
    void deleteDocumentReportsChunks() throws Exception {
        when(ingestionService.deleteDocument("hr", "handbook.pdf")).thenReturn(3L);

        mockMvc.perform(delete("/api/kb/hr/documents/handbook.pdf"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.chunksDeleted").value(3));
    }

    @Test
    void tierListAcceptsCommaSeparatedValues() {
        assertEquals(EnumSet.of(ExtractionTier.FAST, ExtractionTier.PREMIUM),
                DocumentController.parseTiers(List.of("fast,premium")));
        assertNull(DocumentController.parseTiers(List.of(" ")));
        assertNull(DocumentController.parseTiers(null));
    }
}
