package ch.so.arp.assistant.retrieval;

/**
 * Strategy abstraction used to compute embeddings for chunks and questions.
 * Implementations can either call a model runtime or provide deterministic
 * placeholders that are suited for tests and local development.
 */
public interface EmbeddingProvider {

    /**
     * Create an embedding vector for the provided text. Vectors are expected to
     * be unit-normalised so that the dot product equals the cosine similarity.
     *
     * @param text the text to embed
     * @return the embedding represented as a float array
     * @throws EmbeddingException if no embedding could be produced
     */
    float[] embed(String text);
}
