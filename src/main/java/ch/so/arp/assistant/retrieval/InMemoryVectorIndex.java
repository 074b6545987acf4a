package ch.so.arp.assistant.retrieval;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only in-memory store of embedded chunks with an exhaustive nearest
 * neighbour search. Batches are merged under the write lock so a concurrent
 * search sees either the whole batch or none of it.
 */
public class InMemoryVectorIndex {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryVectorIndex.class);

    private static final Comparator<ScoredChunk> BY_SCORE_THEN_POSITION = Comparator
            .comparingDouble(ScoredChunk::score).reversed()
            .thenComparingLong(ScoredChunk::position);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<Entry> entries = new ArrayList<>();
    private long nextPosition;
    private int dimensions;

    /**
     * Append all chunks as one unit.
     *
     * @throws IllegalArgumentException if a chunk has no embedding or its
     *                                  dimensionality differs from the index
     */
    public void addAll(List<DocumentChunk> chunks) {
        Objects.requireNonNull(chunks, "chunks");
        if (chunks.isEmpty()) {
            return;
        }
        lock.writeLock().lock();
        try {
            int expected = dimensions;
            for (DocumentChunk chunk : chunks) {
                if (!chunk.hasEmbedding()) {
                    throw new IllegalArgumentException("Chunk of '" + chunk.sourceId() + "' has no embedding");
                }
                if (expected == 0) {
                    expected = chunk.dimensions();
                } else if (chunk.dimensions() != expected) {
                    throw new IllegalArgumentException("Chunk of '" + chunk.sourceId() + "' has "
                            + chunk.dimensions() + " dimensions, index expects " + expected);
                }
            }
            dimensions = expected;
            for (DocumentChunk chunk : chunks) {
                entries.add(new Entry(nextPosition++, chunk));
            }
            LOGGER.debug("Appended {} chunks, index now holds {}", chunks.size(), entries.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Remove every chunk of the given source.
     *
     * @return the number of removed chunks
     */
    public int removeBySource(String sourceId) {
        lock.writeLock().lock();
        try {
            int before = entries.size();
            entries.removeIf(entry -> entry.chunk().sourceId().equals(sourceId));
            int removed = before - entries.size();
            if (entries.isEmpty()) {
                dimensions = 0;
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Score every chunk against the query vector by dot product and return the
     * best {@code limit} ones. Ties keep insertion order.
     *
     * @throws IllegalArgumentException if {@code limit} is negative or the query
     *                                  vector does not match the index dimensions
     */
    public List<ScoredChunk> search(float[] query, int limit) {
        Objects.requireNonNull(query, "query");
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative but was " + limit);
        }
        lock.readLock().lock();
        try {
            if (entries.isEmpty() || limit == 0) {
                return List.of();
            }
            if (query.length != dimensions) {
                throw new IllegalArgumentException(
                        "Query has " + query.length + " dimensions, index expects " + dimensions);
            }
            List<ScoredChunk> scored = new ArrayList<>(entries.size());
            for (Entry entry : entries) {
                scored.add(new ScoredChunk(entry.chunk(), entry.chunk().dot(query), entry.position()));
            }
            scored.sort(BY_SCORE_THEN_POSITION);
            return List.copyOf(scored.subList(0, Math.min(limit, scored.size())));
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int dimensions() {
        lock.readLock().lock();
        try {
            return dimensions;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<String> sourceIds() {
        lock.readLock().lock();
        try {
            Set<String> ids = new LinkedHashSet<>();
            entries.forEach(entry -> ids.add(entry.chunk().sourceId()));
            return ids;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Chunk with its similarity score and insertion position.
     */
    public record ScoredChunk(DocumentChunk chunk, double score, long position) {
    }

    private record Entry(long position, DocumentChunk chunk) {
    }
}
