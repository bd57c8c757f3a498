package com.jreinhal.tieredrag.retrieval.sparse;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.tieredrag.retrieval.sparse.SparseBatch.FallbackReason;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.net.HttpURLConnection;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client for the learned sparse embedding sidecar ({@code POST /embed-sparse}).
 *
 * <p>Texts are sent in batches of {@code batch-size}. Each batch either carries one weight
 * map per text or a {@link FallbackReason}; nothing is thrown, the caller decides how to
 * fill a failed batch.</p>
 *
 * Configuration:
 *   tieredrag.sparse-embedding.enabled: true/false
 *   tieredrag.sparse-embedding.service-url: http://localhost:8091
 *   tieredrag.sparse-embedding.timeout-seconds: 30
 *   tieredrag.sparse-embedding.batch-size: 64
 */
@Component
public class SparseEmbeddingClient {
    private static final Logger log = LoggerFactory.getLogger(SparseEmbeddingClient.class);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private RestTemplate restTemplate;

    @Value("${tieredrag.sparse-embedding.enabled:false}")
    private boolean enabled;
    @Value("${tieredrag.sparse-embedding.service-url:http://localhost:8091}")
    private String serviceUrl;
    @Value("${tieredrag.sparse-embedding.timeout-seconds:30}")
    private int timeoutSeconds = 30;
    @Value("${tieredrag.sparse-embedding.batch-size:64}")
    private int batchSize = 64;

    @PostConstruct
    void init() {
        this.restTemplate = noRedirectRestTemplate(this.timeoutSeconds);
        log.info("Sparse embedding client initialised (enabled={}, url={}, timeout={}s, batchSize={})",
                this.enabled, this.serviceUrl, this.timeoutSeconds, batchSize());
    }

    private static RestTemplate noRedirectRestTemplate(int timeoutSecs) {
        int timeoutMs = Math.max(1, timeoutSecs) * 1000;
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory() {
            @Override
            protected void prepareConnection(HttpURLConnection connection, String httpMethod) throws IOException {
                super.prepareConnection(connection, httpMethod);
                connection.setInstanceFollowRedirects(false);
            }
        };
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);
        return new RestTemplate(factory);
    }

    public boolean isEnabled() {
        return this.enabled;
    }

    public int batchSize() {
        return Math.max(1, this.batchSize);
    }

    /**
     * Batches covering {@code texts} in order. A disabled client returns a single
     * {@link FallbackReason#DISABLED} batch without calling the sidecar.
     */
    public List<SparseBatch> embedSparse(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        if (!this.enabled) {
            return List.of(SparseBatch.fallback(0, texts, FallbackReason.DISABLED));
        }
        int step = batchSize();
        List<SparseBatch> batches = new ArrayList<>((texts.size() + step - 1) / step);
        for (int offset = 0; offset < texts.size(); offset += step) {
            batches.add(embedBatch(offset, texts.subList(offset, Math.min(offset + step, texts.size()))));
        }
        return batches;
    }

    private SparseBatch embedBatch(int offset, List<String> texts) {
        ResponseEntity<String> response;
        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            String body = this.objectMapper.writeValueAsString(new EmbedSparseRequest(texts));
            response = this.restTemplate.postForEntity(this.serviceUrl + "/embed-sparse",
                    new HttpEntity<>(body, headers), String.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not encode sparse embedding request", e);
        } catch (HttpStatusCodeException e) {
            log.warn("Sparse embedding sidecar returned status {}", e.getStatusCode());
            return SparseBatch.fallback(offset, texts, FallbackReason.HTTP_STATUS);
        } catch (RestClientException e) {
            log.warn("Sparse embedding request at offset {} failed: {}", offset, e.getMessage());
            return SparseBatch.fallback(offset, texts, FallbackReason.UNREACHABLE);
        }
        if (response.getStatusCode().is3xxRedirection()) {
            log.warn("Sparse embedding sidecar returned redirect; not following");
            return SparseBatch.fallback(offset, texts, FallbackReason.REDIRECT);
        }
        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            log.warn("Sparse embedding sidecar returned status {}", response.getStatusCode());
            return SparseBatch.fallback(offset, texts, FallbackReason.HTTP_STATUS);
        }
        EmbedSparseResponse parsed;
        try {
            parsed = this.objectMapper.readValue(response.getBody(), EmbedSparseResponse.class);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable sparse embedding response: {}", e.getOriginalMessage());
            return SparseBatch.fallback(offset, texts, FallbackReason.MALFORMED_RESPONSE);
        }
        int returned = parsed.results == null ? 0 : parsed.results.size();
        if (returned != texts.size()) {
            log.warn("Sparse embedding sidecar returned {} results for {} texts", returned, texts.size());
            return SparseBatch.fallback(offset, texts, FallbackReason.COUNT_MISMATCH);
        }
        List<Map<String, Float>> weights = new ArrayList<>(returned);
        for (TokenWeights result : parsed.results) {
            weights.add(result != null && result.tokenWeights != null ? result.tokenWeights : Map.of());
        }
        log.debug("Sparse embedding: {} texts in {}ms", texts.size(), parsed.processingTimeMs);
        return SparseBatch.learned(offset, texts, weights);
    }

    private record EmbedSparseRequest(List<String> texts) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static class EmbedSparseResponse {
        @JsonProperty("results")
        public List<TokenWeights> results;

        @JsonProperty("processing_time_ms")
        public double processingTimeMs;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static class TokenWeights {
        @JsonProperty("token_weights")
        public Map<String, Float> tokenWeights;
    }
}
