package ch.so.arp.assistant.retrieval;

/**
 * Raised by an {@link EmbeddingProvider} that cannot embed a text.
 */
public class EmbeddingException extends RuntimeException {

    public EmbeddingException(String message) {
        super(message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
