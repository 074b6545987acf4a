package ch.so.arp.assistant.retrieval;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link RetrievalService} backed by an {@link InMemoryVectorIndex}. Chunk
 * embeddings of an ingest batch are requested concurrently on the ingest
 * executor and merged into the index once all of them have finished.
 */
public class EmbeddingRetrievalService implements RetrievalService {

    private static final Logger LOGGER = LoggerFactory.getLogger(EmbeddingRetrievalService.class);

    private final EmbeddingProvider embeddingProvider;
    private final TextChunker chunker;
    private final Executor ingestExecutor;
    private final InMemoryVectorIndex index;
    private final Map<String, String> documents = Collections.synchronizedMap(new LinkedHashMap<>());

    public EmbeddingRetrievalService(EmbeddingProvider embeddingProvider, TextChunker chunker,
            Executor ingestExecutor) {
        this(embeddingProvider, chunker, ingestExecutor, new InMemoryVectorIndex());
    }

    EmbeddingRetrievalService(EmbeddingProvider embeddingProvider, TextChunker chunker, Executor ingestExecutor,
            InMemoryVectorIndex index) {
        this.embeddingProvider = Objects.requireNonNull(embeddingProvider, "embeddingProvider");
        this.chunker = Objects.requireNonNull(chunker, "chunker");
        this.ingestExecutor = Objects.requireNonNull(ingestExecutor, "ingestExecutor");
        this.index = Objects.requireNonNull(index, "index");
    }

    @Override
    public Map<String, Integer> ingestAll(List<SourceDocument> documentsToIngest) {
        Objects.requireNonNull(documentsToIngest, "documents");
        List<CompletableFuture<DocumentChunk>> pending = new ArrayList<>();
        for (SourceDocument document : documentsToIngest) {
            for (String text : chunker.chunk(document.text())) {
                pending.add(CompletableFuture.supplyAsync(() -> embedChunk(document.sourceId(), text),
                        ingestExecutor));
            }
        }
        CompletableFuture.allOf(pending.toArray(CompletableFuture[]::new)).join();

        List<DocumentChunk> embedded = new ArrayList<>(pending.size());
        Map<String, Integer> counts = new LinkedHashMap<>();
        documentsToIngest.forEach(document -> counts.put(document.sourceId(), 0));
        for (CompletableFuture<DocumentChunk> future : pending) {
            DocumentChunk chunk = future.join();
            if (chunk != null) {
                embedded.add(chunk);
                counts.merge(chunk.sourceId(), 1, Integer::sum);
            }
        }
        index.addAll(embedded);
        documentsToIngest.forEach(document -> documents.put(document.sourceId(), document.text()));
        LOGGER.info("Indexed {} of {} chunks from {} document(s)", embedded.size(), pending.size(),
                documentsToIngest.size());
        return counts;
    }

    @Override
    public List<RetrievedContext> query(String question, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative but was " + limit);
        }
        if (index.size() == 0 || limit == 0) {
            return List.of();
        }
        float[] queryEmbedding;
        try {
            queryEmbedding = embeddingProvider.embed(question);
        } catch (RuntimeException ex) {
            LOGGER.warn("Unable to embed question, continuing without retrieval context: {}", ex.getMessage());
            return List.of();
        }
        if (queryEmbedding == null) {
            LOGGER.warn("Embedding provider returned no vector for the question");
            return List.of();
        }
        List<InMemoryVectorIndex.ScoredChunk> hits;
        try {
            hits = index.search(queryEmbedding, limit);
        } catch (IllegalArgumentException ex) {
            LOGGER.warn("Query embedding does not fit the index: {}", ex.getMessage());
            return List.of();
        }
        LOGGER.debug("Retrieved {} chunk(s) for question '{}'", hits.size(), question);
        return hits.stream()
                .map(hit -> new RetrievedContext(hit.chunk().sourceId(), hit.chunk().text(), hit.score()))
                .toList();
    }

    @Override
    public void remove(String sourceId) {
        int removed = index.removeBySource(sourceId);
        documents.remove(sourceId);
        LOGGER.info("Removed document '{}' with {} chunk(s)", sourceId, removed);
    }

    @Override
    public Optional<String> documentText(String sourceId) {
        return Optional.ofNullable(documents.get(sourceId));
    }

    @Override
    public Set<String> sourceIds() {
        Set<String> ids;
        synchronized (documents) {
            ids = new LinkedHashSet<>(documents.keySet());
        }
        ids.addAll(index.sourceIds());
        return ids;
    }

    int indexedChunkCount() {
        return index.size();
    }

    private DocumentChunk embedChunk(String sourceId, String text) {
        try {
            float[] embedding = embeddingProvider.embed(text);
            if (embedding == null) {
                LOGGER.warn("No embedding returned for a chunk of '{}', chunk skipped", sourceId);
                return null;
            }
            return new DocumentChunk(sourceId, text, embedding);
        } catch (RuntimeException ex) {
            LOGGER.warn("Embedding failed for a chunk of '{}', chunk skipped: {}", sourceId, ex.getMessage());
            return null;
        }
    }
}
