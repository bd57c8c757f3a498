package com.jreinhal.tieredrag.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.tieredrag.util.LogSanitizer;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Asks the chat model for a document's type, category, status and title, reading only the
 * opening text. Any model failure, timeout or unparseable reply falls back to keyword
 * heuristics, so ingestion never fails here.
 */
@Component
public class DocumentMetadataExtractor {
    private static final Logger log = LoggerFactory.getLogger(DocumentMetadataExtractor.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    static final String OTHER = "other";
    static final String UNKNOWN = "unknown";
    static final String GENERAL = "general";
    static final String UNTITLED = "Untitled";
    private static final int MAX_TITLE_LENGTH = 100;
    private static final int MAX_LABEL_LENGTH = 40;

    private static final String SYSTEM_PROMPT = """
            You classify documents for a search index. Reply with a single JSON object and nothing else:
            {"doc_type": "...", "category": "...", "status": "...", "title": "..."}
            doc_type is one of law, regulation, guideline, policy, report, other.
            category is a short lower-case topic such as firearms, contracts, hr, finance or general.
            status is one of active, draft, archived, unknown.
            title is the document's own title, or "Untitled" if it has none.
            """;

    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json)?", Pattern.CASE_INSENSITIVE);
    private static final List<Map.Entry<String, Pattern>> DOC_TYPE_RULES = List.of(
            Map.entry("law", Pattern.compile("\\b(?:law|act|statute)\\b|พระราชบัญญัติ|พ\\.ร\\.บ\\.", Pattern.CASE_INSENSITIVE)),
            Map.entry("regulation", Pattern.compile("\\bregulations?\\b|ระเบียบ", Pattern.CASE_INSENSITIVE)),
            Map.entry("guideline", Pattern.compile("\\bguidelines?\\b|แนวทาง", Pattern.CASE_INSENSITIVE)),
            Map.entry("policy", Pattern.compile("\\bpolic(?:y|ies)\\b|นโยบาย", Pattern.CASE_INSENSITIVE)),
            Map.entry("report", Pattern.compile("\\breport\\b|รายงาน", Pattern.CASE_INSENSITIVE)));
    private static final List<Map.Entry<String, Pattern>> CATEGORY_RULES = List.of(
            Map.entry("firearms", Pattern.compile("\\b(?:firearms?|guns?)\\b|ปืน|อาวุธ", Pattern.CASE_INSENSITIVE)),
            Map.entry("contracts", Pattern.compile("\\bcontracts?\\b|สัญญา", Pattern.CASE_INSENSITIVE)),
            Map.entry("hr", Pattern.compile("\\b(?:hr|human resources?|employees?)\\b|พนักงาน", Pattern.CASE_INSENSITIVE)),
            Map.entry("finance", Pattern.compile("\\b(?:finance|financial|budget)\\b|การเงิน", Pattern.CASE_INSENSITIVE)));

    private final ChatClient chatClient;
    private final ExecutorService executor;

    @Value("${tieredrag.ingest.metadata.enabled:true}")
    private boolean enabled = true;
    @Value("${tieredrag.ingest.metadata.max-chars:3000}")
    private int maxChars = 3000;
    @Value("${tieredrag.ingest.metadata.timeout-seconds:30}")
    private long timeoutSeconds = 30L;

    public DocumentMetadataExtractor(ChatClient.Builder chatClientBuilder,
                                     @Qualifier("generationExecutor") ExecutorService executor) {
        this.chatClient = chatClientBuilder.build();
        this.executor = executor;
    }

    /**
     * @param defaultCategory category used when neither the model nor the keywords name one
     */
    public DocumentMetadata extract(String text, String filename, String defaultCategory) {
        String excerpt = text == null ? "" : text.strip();
        if (excerpt.length() > this.maxChars) {
            excerpt = excerpt.substring(0, this.maxChars) + "...";
        }
        DocumentMetadata fallback = heuristic(excerpt, filename, defaultCategory);
        if (!this.enabled || excerpt.isEmpty()) {
            return fallback;
        }
        String reply = ask(excerpt, filename);
        if (reply == null) {
            return fallback;
        }
        DocumentMetadata parsed = parse(reply, fallback);
        if (parsed == null) {
            log.warn("Unparseable metadata reply for {}; using heuristics", LogSanitizer.sanitize(filename));
            return fallback;
        }
        log.debug("Model metadata for {}: {}", LogSanitizer.sanitize(filename), parsed);
        return parsed;
    }

    private String ask(String excerpt, String filename) {
        String userMessage = "Document text:\n" + excerpt + "\n\nJSON:";
        Future<String> future = null;
        try {
            future = this.executor.submit(() -> this.chatClient.prompt()
                    .system(SYSTEM_PROMPT)
                    .user(userMessage)
                    .call()
                    .content());
            return future.get(this.timeoutSeconds, TimeUnit.SECONDS);
        }
        catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return null;
        }
        catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Metadata extraction for {} timed out after {}s", LogSanitizer.sanitize(filename),
                    this.timeoutSeconds);
            return null;
        }
        catch (ExecutionException | RejectedExecutionException e) {
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            log.warn("Metadata extraction for {} failed: {}", LogSanitizer.sanitize(filename), cause.getMessage());
            return null;
        }
    }

    /**
     * Reads the first JSON object in {@code reply}; missing or blank fields take the fallback's
     * value. Null when no object can be read.
     */
    static DocumentMetadata parse(String reply, DocumentMetadata fallback) {
        if (reply == null) {
            return null;
        }
        String body = CODE_FENCE.matcher(reply).replaceAll("");
        int open = body.indexOf('{');
        int close = body.lastIndexOf('}');
        if (open < 0 || close <= open) {
            return null;
        }
        JsonNode node;
        try {
            node = OBJECT_MAPPER.readTree(body.substring(open, close + 1));
        } catch (JsonProcessingException e) {
            log.debug("Metadata reply is not JSON: {}", e.getOriginalMessage());
            return null;
        }
        if (node == null || !node.isObject()) {
            return null;
        }
        return new DocumentMetadata(
                label(node, "doc_type", fallback.docType()),
                label(node, "category", fallback.category()),
                label(node, "status", fallback.status()),
                truncate(text(node, "title", fallback.title()), MAX_TITLE_LENGTH),
                true);
    }

    static DocumentMetadata heuristic(String text, String filename, String defaultCategory) {
        String body = text == null ? "" : text;
        String docType = firstMatch(DOC_TYPE_RULES, body, OTHER);
        String category = firstMatch(CATEGORY_RULES, body,
                defaultCategory == null || defaultCategory.isBlank() ? GENERAL : defaultCategory);
        return new DocumentMetadata(docType, category, UNKNOWN, heuristicTitle(body, filename), false);
    }

    private static String firstMatch(List<Map.Entry<String, Pattern>> rules, String text, String otherwise) {
        for (Map.Entry<String, Pattern> rule : rules) {
            if (rule.getValue().matcher(text).find()) {
                return rule.getKey();
            }
        }
        return otherwise;
    }

    private static String heuristicTitle(String text, String filename) {
        for (String line : text.split("\n")) {
            String candidate = line.replaceFirst("^#+", "").strip();
            if (!candidate.isEmpty()) {
                return truncate(candidate, MAX_TITLE_LENGTH);
            }
        }
        return filename == null || filename.isBlank() ? UNTITLED : filename;
    }

    private static String label(JsonNode node, String field, String fallback) {
        String value = text(node, field, null);
        return value == null ? fallback : truncate(value.toLowerCase(Locale.ROOT), MAX_LABEL_LENGTH);
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            return fallback;
        }
        return value.asText().strip();
    }

    private static String truncate(String value, int max) {
        return value.length() > max ? value.substring(0, max).strip() : value;
    }
}
