package com.jreinhal.tieredrag.extraction.tier;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.tieredrag.extraction.BackoffPolicy;
import com.jreinhal.tieredrag.extraction.ExtractionEmptyException;
import com.jreinhal.tieredrag.extraction.ExtractionTier;
import com.jreinhal.tieredrag.extraction.RateLimitedException;
import com.jreinhal.tieredrag.extraction.TierOutput;
import com.jreinhal.tieredrag.extraction.TierSettings;
import com.jreinhal.tieredrag.extraction.TierUnavailableException;
import com.jreinhal.tieredrag.util.SimpleCircuitBreaker;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class VisionTierClientTest {

    private static final String URL = "http://vision.local:8092";
    private static final byte[] PDF = "%PDF-1.7 scanned".getBytes(StandardCharsets.UTF_8);

    private MockRestServiceServer server;
    private VisionTierClient client;
    private final List<Duration> sleeps = new ArrayList<>();

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new VisionTierClient(new ObjectMapper(), timeout -> restTemplate, sleeps::add, () -> 0.5);
    }

    @Test
    void supportsOnlyVisionTiers() {
        assertFalse(client.supports(ExtractionTier.FAST));
        assertTrue(client.supports(ExtractionTier.BALANCED));
        assertTrue(client.supports(ExtractionTier.PREMIUM));
    }

    @Test
    void returnsPagesInPageOrderWithReportedCost() {
        server.expect(requestTo(URL + VisionTierClient.EXTRACT_PATH))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess("""
                        {"pages":[{"page_number":2,"text":" second "},{"page_number":1,"text":"first"}],
                         "cost_usd":0.0026,"model":"vl"}""", MediaType.APPLICATION_JSON));

        TierOutput output = client.extract(PDF, "scan.pdf", settings(ExtractionTier.PREMIUM, BackoffPolicy.NONE));

        assertEquals(List.of("first", "second"), output.pages());
        assertEquals(0.0026, output.cost(), 1e-12);
        server.verify();
    }

    @Test
    void estimatesCostWhenServiceOmitsIt() {
        server.expect(requestTo(URL + VisionTierClient.EXTRACT_PATH))
                .andRespond(withSuccess("""
                        {"pages":[{"page_number":1,"text":"a"},{"page_number":2,"text":"b"}]}""",
                        MediaType.APPLICATION_JSON));

        TierOutput output = client.extract(PDF, "scan.pdf", settings(ExtractionTier.BALANCED, BackoffPolicy.NONE));

        assertEquals(2 * ExtractionTier.BALANCED.defaultCostPerPage(), output.cost(), 1e-12);
    }

    @Test
    void rateLimitIsReportedWithoutRetry() {
        server.expect(ExpectedCount.once(), requestTo(URL + VisionTierClient.EXTRACT_PATH))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS).header("Retry-After", "7"));
        BackoffPolicy retrying = new BackoffPolicy(3, Duration.ofMillis(100), 2.0, 0.0);

        RateLimitedException ex = assertThrows(RateLimitedException.class,
                () -> client.extract(PDF, "scan.pdf", settings(ExtractionTier.PREMIUM, retrying)));

        assertEquals(Duration.ofSeconds(7), ex.getRetryAfter().orElseThrow());
        assertTrue(sleeps.isEmpty());
        server.verify();
    }

    @Test
    void retriesServerErrorsWithBackoff() {
        server.expect(ExpectedCount.times(2), requestTo(URL + VisionTierClient.EXTRACT_PATH))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));
        server.expect(requestTo(URL + VisionTierClient.EXTRACT_PATH))
                .andRespond(withSuccess("{\"pages\":[{\"page_number\":1,\"text\":\"ok\"}]}",
                        MediaType.APPLICATION_JSON));
        BackoffPolicy retrying = new BackoffPolicy(3, Duration.ofMillis(200), 2.0, 0.0);

        TierOutput output = client.extract(PDF, "scan.pdf", settings(ExtractionTier.PREMIUM, retrying));

        assertEquals(List.of("ok"), output.pages());
        assertEquals(List.of(Duration.ofMillis(200), Duration.ofMillis(400)), sleeps);
        server.verify();
    }

    @Test
    void opensCircuitAfterRepeatedFailures() {
        ReflectionTestUtils.setField(client, "failureThreshold", 1);
        server.expect(ExpectedCount.once(), requestTo(URL + VisionTierClient.EXTRACT_PATH))
                .andRespond(withStatus(HttpStatus.BAD_GATEWAY));
        TierSettings settings = settings(ExtractionTier.PREMIUM, BackoffPolicy.NONE);

        assertThrows(TierUnavailableException.class, () -> client.extract(PDF, "scan.pdf", settings));
        assertEquals(SimpleCircuitBreaker.State.OPEN, client.circuitState(ExtractionTier.PREMIUM));

        TierUnavailableException ex = assertThrows(TierUnavailableException.class,
                () -> client.extract(PDF, "scan.pdf", settings));
        assertTrue(ex.getMessage().contains("circuit open"));
        assertEquals(SimpleCircuitBreaker.State.CLOSED, client.circuitState(ExtractionTier.BALANCED));
        server.verify();
    }

    @Test
    void rateLimitDuringHalfOpenDoesNotWedgeTier() {
        ReflectionTestUtils.setField(client, "failureThreshold", 1);
        ReflectionTestUtils.setField(client, "openSeconds", 0L);
        server.expect(ExpectedCount.once(), requestTo(URL + VisionTierClient.EXTRACT_PATH))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));
        server.expect(ExpectedCount.once(), requestTo(URL + VisionTierClient.EXTRACT_PATH))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));
        server.expect(ExpectedCount.once(), requestTo(URL + VisionTierClient.EXTRACT_PATH))
                .andRespond(withSuccess("{\"pages\":[{\"page_number\":1,\"text\":\"recovered\"}]}",
                        MediaType.APPLICATION_JSON));
        TierSettings settings = settings(ExtractionTier.PREMIUM, BackoffPolicy.NONE);

        assertThrows(TierUnavailableException.class, () -> client.extract(PDF, "scan.pdf", settings));
        assertThrows(RateLimitedException.class, () -> client.extract(PDF, "scan.pdf", settings));
        assertEquals(SimpleCircuitBreaker.State.OPEN, client.circuitState(ExtractionTier.PREMIUM));

        TierOutput output = client.extract(PDF, "scan.pdf", settings);

        assertEquals(List.of("recovered"), output.pages());
        assertEquals(SimpleCircuitBreaker.State.CLOSED, client.circuitState(ExtractionTier.PREMIUM));
        server.verify();
    }

    @Test
    void malformedResponseCountsAsFailure() {
        ReflectionTestUtils.setField(client, "failureThreshold", 1);
        server.expect(requestTo(URL + VisionTierClient.EXTRACT_PATH))
                .andRespond(withSuccess("not json", MediaType.TEXT_PLAIN));

        assertThrows(TierUnavailableException.class,
                () -> client.extract(PDF, "scan.pdf", settings(ExtractionTier.BALANCED, BackoffPolicy.NONE)));
        assertEquals(SimpleCircuitBreaker.State.OPEN, client.circuitState(ExtractionTier.BALANCED));
    }

    @Test
    void wellFormedAnswersKeepCircuitClosed() {
        ReflectionTestUtils.setField(client, "failureThreshold", 1);
        server.expect(requestTo(URL + VisionTierClient.EXTRACT_PATH))
                .andRespond(withSuccess("{\"pages\":[]}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(URL + VisionTierClient.EXTRACT_PATH))
                .andRespond(withStatus(HttpStatus.PAYLOAD_TOO_LARGE));
        TierSettings settings = settings(ExtractionTier.BALANCED, BackoffPolicy.NONE);

        assertThrows(ExtractionEmptyException.class, () -> client.extract(PDF, "scan.pdf", settings));
        assertThrows(TierUnavailableException.class, () -> client.extract(PDF, "scan.pdf", settings));

        assertEquals(SimpleCircuitBreaker.State.CLOSED, client.circuitState(ExtractionTier.BALANCED));
        server.verify();
    }

    @Test
    void blankTranscriptionIsEmpty() {
        server.expect(requestTo(URL + VisionTierClient.EXTRACT_PATH))
                .andRespond(withSuccess("{\"pages\":[{\"page_number\":1,\"text\":\"   \"}]}",
                        MediaType.APPLICATION_JSON));

        assertThrows(ExtractionEmptyException.class,
                () -> client.extract(PDF, "scan.pdf", settings(ExtractionTier.BALANCED, BackoffPolicy.NONE)));
    }

    @Test
    void malformedResponseIsUnavailable() {
        server.expect(requestTo(URL + VisionTierClient.EXTRACT_PATH))
                .andRespond(withSuccess("not json", MediaType.TEXT_PLAIN));

        assertThrows(TierUnavailableException.class,
                () -> client.extract(PDF, "scan.pdf", settings(ExtractionTier.BALANCED, BackoffPolicy.NONE)));
    }

    @Test
    void missingServiceUrlIsUnavailable() {
        TierSettings settings = new TierSettings(ExtractionTier.PREMIUM, true, 0.0013, 0.97, null, "vl",
                Duration.ofSeconds(5), BackoffPolicy.NONE);

        assertThrows(TierUnavailableException.class, () -> client.extract(PDF, "scan.pdf", settings));
    }

    private static TierSettings settings(ExtractionTier tier, BackoffPolicy backoff) {
        return new TierSettings(tier, true, tier.defaultCostPerPage(), tier.defaultQualityCeiling(), URL, "vl",
                Duration.ofSeconds(5), backoff);
    }
}
