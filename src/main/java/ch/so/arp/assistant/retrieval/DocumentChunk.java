package ch.so.arp.assistant.retrieval;

import java.util.Arrays;
import java.util.Objects;

/**
 * Window of a source document together with its embedding. Instances are
 * immutable; the embedding array is copied on the way in and out.
 */
public record DocumentChunk(String sourceId, String text, float[] embedding) {

    public DocumentChunk {
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(text, "text");
        embedding = embedding == null ? null : embedding.clone();
    }

    @Override
    public float[] embedding() {
        return embedding == null ? null : embedding.clone();
    }

    public boolean hasEmbedding() {
        return embedding != null;
    }

    int dimensions() {
        return embedding == null ? 0 : embedding.length;
    }

    double dot(float[] other) {
        double product = 0.0d;
        for (int i = 0; i < embedding.length; i++) {
            product += embedding[i] * other[i];
        }
        return product;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof DocumentChunk that)) {
            return false;
        }
        return sourceId.equals(that.sourceId) && text.equals(that.text) && Arrays.equals(embedding, that.embedding);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceId, text, Arrays.hashCode(embedding));
    }

    @Override
    public String toString() {
        return "DocumentChunk[sourceId=" + sourceId + ", length=" + text.length() + ", dimensions=" + dimensions()
                + "]";
    }
}
