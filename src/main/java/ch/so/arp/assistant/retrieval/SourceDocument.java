package ch.so.arp.assistant.retrieval;

import java.util.Objects;

/**
 * Extracted plain text of one uploaded document, keyed by a stable source id.
 */
public record SourceDocument(String sourceId, String text) {

    public SourceDocument {
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(text, "text");
    }
}
