package ch.so.arp.assistant.retrieval;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Retrieval engine owning the indexed documents of one assistant session.
 */
public interface RetrievalService {

    int DEFAULT_LIMIT = 3;

    /**
     * Chunk, embed and index one document.
     *
     * @return the number of chunks that were stored
     */
    default int ingest(String sourceId, String text) {
        return ingestAll(List.of(new SourceDocument(sourceId, text))).getOrDefault(sourceId, 0);
    }

    /**
     * Chunk, embed and index a batch of documents. Chunks whose embedding fails
     * are skipped. The surviving chunks become visible to queries at once.
     *
     * @return stored chunk count per source id
     */
    Map<String, Integer> ingestAll(List<SourceDocument> documents);

    /**
     * Find the chunks most similar to the question. Returns an empty list when
     * nothing is indexed or the question cannot be embedded.
     *
     * @throws IllegalArgumentException if {@code limit} is negative
     */
    List<RetrievedContext> query(String question, int limit);

    default List<RetrievedContext> query(String question) {
        return query(question, DEFAULT_LIMIT);
    }

    /**
     * Drop the document and all of its chunks. Unknown ids are ignored.
     */
    void remove(String sourceId);

    Optional<String> documentText(String sourceId);

    Set<String> sourceIds();
}
