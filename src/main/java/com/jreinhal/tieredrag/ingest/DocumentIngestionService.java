package com.jreinhal.tieredrag.ingest;

import com.jreinhal.tieredrag.constant.ChunkMetadata;
import com.jreinhal.tieredrag.embedding.EmbeddingProvider;
import com.jreinhal.tieredrag.exception.ResourceNotFoundException;
import com.jreinhal.tieredrag.extraction.CancellationSignal;
import com.jreinhal.tieredrag.extraction.ExtractionAttempt;
import com.jreinhal.tieredrag.extraction.ExtractionRequest;
import com.jreinhal.tieredrag.extraction.ExtractionResult;
import com.jreinhal.tieredrag.extraction.ExtractionTier;
import com.jreinhal.tieredrag.extraction.ProgressiveExtractionService;
import com.jreinhal.tieredrag.kb.KnowledgeBase;
import com.jreinhal.tieredrag.kb.KnowledgeBaseService;
import com.jreinhal.tieredrag.reasoning.ReasoningStep;
import com.jreinhal.tieredrag.reasoning.TraceSink;
import com.jreinhal.tieredrag.retrieval.sparse.SparseEmbeddingService;
import com.jreinhal.tieredrag.util.LogSanitizer;
import com.jreinhal.tieredrag.vector.IndexedChunk;
import com.jreinhal.tieredrag.vector.SourceSummary;
import com.jreinhal.tieredrag.vector.VectorStore;
import com.jreinhal.tieredrag.vector.VectorStoreException;
import jakarta.annotation.PostConstruct;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Document upload pipeline: progressive extraction, page-aware chunking, document metadata
 * tagging, dense and sparse embedding, then storage. Re-ingesting a file name replaces that
 * file's chunks; a failed write leaves the previous version searchable.
 */
@Service
public class DocumentIngestionService {
    private static final Logger log = LoggerFactory.getLogger(DocumentIngestionService.class);
    private static final Pattern UNSAFE_FILENAME_CHARS = Pattern.compile("[\\x00-\\x1F\\x7F]");
    private static final int MAX_FILENAME_LENGTH = 255;

    private final KnowledgeBaseService knowledgeBases;
    private final ProgressiveExtractionService extractionService;
    private final EmbeddingProvider embeddingProvider;
    private final SparseEmbeddingService sparseEmbeddingService;
    private final VectorStore vectorStore;
    private final DocumentMetadataExtractor metadataExtractor;

    @Value("${tieredrag.ingest.max-file-size-bytes:52428800}")
    private long maxFileSizeBytes = 52428800L;
    @Value("${tieredrag.ingest.chunk-size:800}")
    private int chunkSize = 800;
    @Value("${tieredrag.ingest.min-chunk-size-chars:200}")
    private int minChunkSizeChars = 200;
    private PageChunker chunker;

    public DocumentIngestionService(KnowledgeBaseService knowledgeBases, ProgressiveExtractionService extractionService,
                                    EmbeddingProvider embeddingProvider, SparseEmbeddingService sparseEmbeddingService,
                                    VectorStore vectorStore, DocumentMetadataExtractor metadataExtractor) {
        this.knowledgeBases = knowledgeBases;
        this.extractionService = extractionService;
        this.embeddingProvider = embeddingProvider;
        this.sparseEmbeddingService = sparseEmbeddingService;
        this.vectorStore = vectorStore;
        this.metadataExtractor = metadataExtractor;
    }

    @PostConstruct
    public void init() {
        this.chunker = new PageChunker(this.chunkSize, this.minChunkSizeChars);
        log.info("Document ingestion initialized (chunkSize={}, maxFileSizeBytes={})", this.chunkSize,
                this.maxFileSizeBytes);
    }

    /**
     * @param targetQuality null for the configured default
     * @param tiers null for every enabled tier
     */
    public IngestionReport ingest(String knowledgeBase, String filename, byte[] content, Double targetQuality,
                                  Set<ExtractionTier> tiers, CancellationSignal cancellation, TraceSink trace) {
        TraceSink sink = TraceSink.orNoop(trace);
        KnowledgeBase kbEntry = this.knowledgeBases.require(knowledgeBase);
        String kb = kbEntry.name();
        String source = normalizeFilename(filename);
        if (content == null || content.length == 0) {
            throw new IllegalArgumentException("Document is empty");
        }
        if (content.length > this.maxFileSizeBytes) {
            throw new IllegalArgumentException("Document exceeds maximum size of " + this.maxFileSizeBytes + " bytes");
        }
        double target = targetQuality != null ? targetQuality : this.extractionService.defaultTargetQuality();
        ExtractionResult extraction = this.extractionService.extract(
                new ExtractionRequest(source, content, target, tiers), cancellation, sink);
        ExtractionAttempt selected = extraction.selected();

        long chunkStart = System.currentTimeMillis();
        Map<String, Object> base = new LinkedHashMap<>();
        base.put(ChunkMetadata.KNOWLEDGE_BASE, kb);
        base.put(ChunkMetadata.TIER_USED, selected.tier().configKey());
        base.put(ChunkMetadata.QUALITY_SCORE, selected.score());
        base.put(ChunkMetadata.EXTRACTION_COST, extraction.totalCost());
        base.put(ChunkMetadata.UPLOADED_AT, Instant.now().toString());
        List<ChunkDraft> drafts = this.chunker.chunk(source, selected.pages(), base);
        sink.step(ReasoningStep.StepType.CHUNKING, "Chunking",
                drafts.size() + " chunk(s) from " + selected.pages().size() + " page(s)",
                System.currentTimeMillis() - chunkStart);
        if (drafts.isEmpty()) {
            throw new IllegalArgumentException("Document has no indexable text");
        }

        long metadataStart = System.currentTimeMillis();
        DocumentMetadata documentMetadata = this.metadataExtractor.extract(drafts.get(0).text(), source,
                kbEntry.category());
        sink.step(ReasoningStep.StepType.METADATA_EXTRACTION, "Document metadata",
                documentMetadata.docType() + "/" + documentMetadata.category()
                        + (documentMetadata.fromModel() ? " (model)" : " (heuristic)"),
                System.currentTimeMillis() - metadataStart, documentMetadata.toChunkMetadata());

        long indexStart = System.currentTimeMillis();
        List<String> texts = drafts.stream().map(ChunkDraft::text).toList();
        List<float[]> embeddings = this.embeddingProvider.embedAll(texts);
        List<Map<String, Float>> sparse = this.sparseEmbeddingService.embedDocuments(texts);
        if (embeddings.size() != drafts.size()) {
            throw new IngestionException("Embedding count mismatch: expected " + drafts.size() + ", got " + embeddings.size());
        }
        List<IndexedChunk> chunks = new ArrayList<>(drafts.size());
        for (int i = 0; i < drafts.size(); i++) {
            ChunkDraft draft = drafts.get(i);
            Map<String, Float> weights = i < sparse.size() ? sparse.get(i) : Map.of();
            Map<String, Object> metadata = new LinkedHashMap<>(documentMetadata.toChunkMetadata());
            metadata.putAll(draft.metadata());
            chunks.add(new IndexedChunk(chunkId(kb, source, i), draft.text(), metadata, embeddings.get(i), weights));
        }
        // Chunk ids are stable per position, so the upsert overwrites in place; only the tail of a
        // longer previous version is left to remove.
        try {
            this.vectorStore.upsert(kb, chunks);
            long stale = this.vectorStore.deleteSourceExcept(kb, source,
                    chunks.stream().map(IndexedChunk::id).toList());
            if (stale > 0) {
                log.info("Removed {} stale chunk(s) of {} in {}", stale, LogSanitizer.sanitize(source), kb);
            }
        } catch (VectorStoreException e) {
            throw new IngestionException("Failed to index " + source, e);
        }
        sink.step(ReasoningStep.StepType.INDEXING, "Indexing", chunks.size() + " chunk(s) stored in " + kb,
                System.currentTimeMillis() - indexStart);
        sink.metric("chunks", chunks.size());
        sink.metric("tierUsed", selected.tier().name());
        log.info("Ingested {} into {}: {} chunk(s), tier={}, quality={}, cost=${}", LogSanitizer.sanitize(source), kb,
                chunks.size(), selected.tier(), String.format("%.3f", selected.score()),
                String.format("%.4f", extraction.totalCost()));
        return new IngestionReport(kb, source, chunks.size(), extraction);
    }

    public List<SourceSummary> listDocuments(String knowledgeBase) {
        String kb = this.knowledgeBases.require(knowledgeBase).name();
        return this.vectorStore.listSources(kb);
    }

    /**
     * @return number of chunks removed
     */
    public long deleteDocument(String knowledgeBase, String filename) {
        String kb = this.knowledgeBases.require(knowledgeBase).name();
        String source = normalizeFilename(filename);
        long deleted = this.vectorStore.deleteSource(kb, source);
        if (deleted == 0) {
            throw new ResourceNotFoundException("Document not found: " + source);
        }
        log.info("Deleted {} chunk(s) of {} from {}", deleted, LogSanitizer.sanitize(source), kb);
        return deleted;
    }

    static String chunkId(String knowledgeBase, String source, int index) {
        String key = knowledgeBase + "|" + source + "|" + index;
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }

    static String normalizeFilename(String filename) {
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("File name is required");
        }
        String name = filename.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        name = UNSAFE_FILENAME_CHARS.matcher(name).replaceAll("").trim();
        if (name.isEmpty() || name.equals(".") || name.equals("..")) {
            throw new IllegalArgumentException("File name is invalid");
        }
        if (name.length() > MAX_FILENAME_LENGTH) {
            throw new IllegalArgumentException("File name is too long");
        }
        return name;
    }
}
