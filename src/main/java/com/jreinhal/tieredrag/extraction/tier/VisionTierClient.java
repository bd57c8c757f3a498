package com.jreinhal.tieredrag.extraction.tier;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.tieredrag.extraction.ExtractionEmptyException;
import com.jreinhal.tieredrag.extraction.ExtractionTier;
import com.jreinhal.tieredrag.extraction.ExtractionTierClient;
import com.jreinhal.tieredrag.extraction.RateLimitedException;
import com.jreinhal.tieredrag.extraction.TierOutput;
import com.jreinhal.tieredrag.extraction.TierSettings;
import com.jreinhal.tieredrag.extraction.TierUnavailableException;
import com.jreinhal.tieredrag.util.LogSanitizer;
import com.jreinhal.tieredrag.util.SimpleCircuitBreaker;
import java.io.IOException;
import java.net.HttpURLConnection;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

/**
 * Client for the vision extraction sidecar that renders pages and transcribes them with a
 * vision language model. Serves the BALANCED and PREMIUM tiers; the tier's model and
 * service URL travel in its {@link TierSettings}.
 *
 * <p>HTTP 429 becomes {@link RateLimitedException} at once so the controller can move on.
 * 5xx responses and I/O errors are retried under the tier's backoff policy, then reported
 * as {@link TierUnavailableException}. Redirects are never followed.</p>
 *
 * Configuration:
 *   tieredrag.extraction.tiers.premium.service-url: http://localhost:8092
 *   tieredrag.extraction.tiers.premium.model: google/gemini-2.5-flash
 */
@Component
public class VisionTierClient implements ExtractionTierClient {
    private static final Logger log = LoggerFactory.getLogger(VisionTierClient.class);
    static final String EXTRACT_PATH = "/extract/pdf";

    private final ObjectMapper objectMapper;
    private final Function<Duration, RestTemplate> restTemplateFactory;
    private final Sleeper sleeper;
    private final DoubleSupplier random;
    private final Map<ExtractionTier, RestTemplate> restTemplates = new ConcurrentHashMap<>();
    private final Map<ExtractionTier, SimpleCircuitBreaker> breakers = new ConcurrentHashMap<>();

    @Value("${tieredrag.extraction.circuit-breaker.failure-threshold:3}")
    private int failureThreshold = 3;
    @Value("${tieredrag.extraction.circuit-breaker.open-seconds:60}")
    private long openSeconds = 60L;

    @Autowired
    public VisionTierClient(ObjectMapper objectMapper) {
        this(objectMapper, VisionTierClient::createNoRedirectRestTemplate,
                delay -> Thread.sleep(delay.toMillis()), () -> ThreadLocalRandom.current().nextDouble());
    }

    VisionTierClient(ObjectMapper objectMapper, Function<Duration, RestTemplate> restTemplateFactory, Sleeper sleeper,
                     DoubleSupplier random) {
        this.objectMapper = objectMapper;
        this.restTemplateFactory = restTemplateFactory;
        this.sleeper = sleeper;
        this.random = random;
    }

    private static RestTemplate createNoRedirectRestTemplate(Duration timeout) {
        int timeoutMs = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory() {
            @Override
            protected void prepareConnection(HttpURLConnection connection, String httpMethod) throws IOException {
                super.prepareConnection(connection, httpMethod);
                connection.setInstanceFollowRedirects(false);
            }
        };
        factory.setConnectTimeout(Math.min(timeoutMs, 10_000));
        factory.setReadTimeout(timeoutMs);
        return new RestTemplate(factory);
    }

    @Override
    public boolean supports(ExtractionTier tier) {
        return tier == ExtractionTier.BALANCED || tier == ExtractionTier.PREMIUM;
    }

    @Override
    public TierOutput extract(byte[] content, String filename, TierSettings settings) {
        ExtractionTier tier = settings.tier();
        if (settings.serviceUrl() == null || settings.serviceUrl().isBlank()) {
            throw new TierUnavailableException(tier, "no service url configured");
        }
        SimpleCircuitBreaker breaker = breakers.computeIfAbsent(tier, key ->
                new SimpleCircuitBreaker("vision-" + key.configKey(), failureThreshold, Duration.ofSeconds(openSeconds), 1));
        if (!breaker.allowRequest()) {
            throw new TierUnavailableException(tier, "circuit open after repeated failures");
        }
        RestTemplate restTemplate = restTemplates.computeIfAbsent(tier, key -> restTemplateFactory.apply(settings.timeout()));
        String safeName = LogSanitizer.sanitize(filename);
        int maxAttempts = settings.backoff().maxAttempts();
        RuntimeException lastError = null;
        // Every exit settles the breaker, including rate limits and empty transcriptions.
        boolean serviceHealthy = false;
        try {
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                if (attempt > 1) {
                    pause(tier, settings.backoff().delayBefore(attempt, random));
                }
                long start = System.nanoTime();
                try {
                    TierOutput output = post(restTemplate, content, filename, settings, start);
                    serviceHealthy = true;
                    return output;
                } catch (ExtractionEmptyException e) {
                    serviceHealthy = true;
                    throw e;
                } catch (HttpClientErrorException.TooManyRequests e) {
                    log.warn("Vision tier {} rate limited while extracting {}", tier, safeName);
                    throw new RateLimitedException(tier, "HTTP 429 from vision service", retryAfter(e.getResponseHeaders()));
                } catch (HttpClientErrorException e) {
                    serviceHealthy = true;
                    throw new TierUnavailableException(tier, "request rejected with HTTP " + e.getStatusCode().value(), e);
                } catch (HttpServerErrorException | ResourceAccessException e) {
                    lastError = e;
                    log.warn("Vision tier {} attempt {}/{} failed for {}: {}", tier, attempt, maxAttempts, safeName,
                            e.getMessage());
                }
            }
            throw new TierUnavailableException(tier, "failed after " + maxAttempts + " attempt(s): "
                    + (lastError != null ? lastError.getMessage() : "unknown error"), lastError);
        } finally {
            if (serviceHealthy) {
                breaker.recordSuccess();
            } else {
                breaker.recordFailure();
            }
        }
    }

    private TierOutput post(RestTemplate restTemplate, byte[] content, String filename, TierSettings settings,
                            long startNanos) {
        ExtractionTier tier = settings.tier();
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);
        MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
        body.add("file", new ByteArrayResource(content) {
            @Override
            public String getFilename() {
                return filename;
            }
        });
        if (settings.model() != null) {
            body.add("model", settings.model());
        }
        body.add("tier", tier.configKey());
        ResponseEntity<String> response = restTemplate.postForEntity(settings.serviceUrl() + EXTRACT_PATH,
                new HttpEntity<>(body, headers), String.class);
        if (response.getStatusCode().is3xxRedirection()) {
            throw new TierUnavailableException(tier, "vision service answered with a redirect; refusing to follow");
        }
        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            throw new TierUnavailableException(tier, "vision service returned HTTP " + response.getStatusCode().value());
        }
        VisionExtractionResponse parsed;
        try {
            parsed = objectMapper.readValue(response.getBody(), VisionExtractionResponse.class);
        } catch (JsonProcessingException e) {
            throw new TierUnavailableException(tier, "malformed response from vision service", e);
        }
        List<String> pages = new ArrayList<>();
        if (parsed.pages != null) {
            parsed.pages.stream()
                    .sorted(Comparator.comparingInt(page -> page.pageNumber))
                    .forEach(page -> pages.add(page.text == null ? "" : page.text.strip()));
        }
        if (pages.stream().allMatch(String::isBlank)) {
            throw new ExtractionEmptyException(tier, "vision service returned no text");
        }
        double cost = parsed.costUsd != null ? parsed.costUsd : pages.size() * settings.costPerPage();
        Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
        log.info("Vision tier {} extracted {} pages from {} in {}ms", tier, pages.size(),
                LogSanitizer.sanitize(filename), duration.toMillis());
        return new TierOutput(pages, cost, duration);
    }

    private void pause(ExtractionTier tier, Duration delay) {
        if (delay.isZero()) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TierUnavailableException(tier, "interrupted during backoff", e);
        }
    }

    private static Duration retryAfter(HttpHeaders headers) {
        String value = headers != null ? headers.getFirst(HttpHeaders.RETRY_AFTER) : null;
        if (value == null) {
            return null;
        }
        try {
            return Duration.ofSeconds(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric Retry-After header: {}", LogSanitizer.sanitize(value));
            return null;
        }
    }

    SimpleCircuitBreaker.State circuitState(ExtractionTier tier) {
        SimpleCircuitBreaker breaker = breakers.get(tier);
        return breaker == null ? SimpleCircuitBreaker.State.CLOSED : breaker.getState();
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration delay) throws InterruptedException;
    }

    // ---------- DTOs ----------

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class VisionExtractionResponse {
        @JsonProperty("pages")
        public List<PageText> pages;

        @JsonProperty("cost_usd")
        public Double costUsd;

        @JsonProperty("model")
        public String model;

        @JsonProperty("processing_time_ms")
        public Double processingTimeMs;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class PageText {
        @JsonProperty("page_number")
        public int pageNumber;

        @JsonProperty("text")
        public String text;
    }
}
